/** Reads annotated Java interfaces into declarations through reflection. */
@NullMarked
package facet.x.iface.compiler.reflect;

import org.jspecify.annotations.NullMarked;
