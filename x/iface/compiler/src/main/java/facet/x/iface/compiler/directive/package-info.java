/**
 * The boundary between raw directives and the compiler: {@link
 * facet.x.iface.compiler.directive.DirectiveExtractor} and the option records it produces.
 */
@NullMarked
package facet.x.iface.compiler.directive;

import org.jspecify.annotations.NullMarked;
