/** Java source generation for dispatch types, rendered with StringTemplate. */
@NullMarked
package facet.x.iface.compiler.generator;

import org.jspecify.annotations.NullMarked;
