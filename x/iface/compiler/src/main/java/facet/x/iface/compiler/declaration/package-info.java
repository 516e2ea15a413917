/**
 * Input model of the interface compiler: contracts, their methods and parameters, types, and the
 * raw directives attached to each of them.
 */
@NullMarked
package facet.x.iface.compiler.declaration;

import org.jspecify.annotations.NullMarked;
