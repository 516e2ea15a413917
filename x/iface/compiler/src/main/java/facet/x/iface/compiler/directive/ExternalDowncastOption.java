package facet.x.iface.compiler.directive;

import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;

/**
 * An external downcast binding declared on the contract.
 *
 * @param implementer the implementer type the function narrows to
 * @param function the function reference, e.g. {@code com.example.Casts::toHuman}
 * @param span where the binding is declared
 */
public record ExternalDowncastOption(TypeRef implementer, String function, SourceSpan span) {}
