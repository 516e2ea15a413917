/** Diagnostics reported by the interface compiler and the sink that accumulates them. */
@NullMarked
package facet.x.iface.compiler.diagnostics;

import org.jspecify.annotations.NullMarked;
