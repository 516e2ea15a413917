package facet.x.iface.compiler.directive;

import facet.x.iface.compiler.declaration.TypeRef;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Declaration-level options. Every option is independently optional. */
public record ContractOptions(
    @Nullable Spanned<String> name,
    @Nullable Spanned<String> description,
    @Nullable Spanned<TypeRef> scalar,
    List<Spanned<TypeRef>> implementers,
    List<ExternalDowncastOption> externalDowncasts,
    @Nullable Spanned<TypeRef> context,
    @Nullable Spanned<DispatchOption> dispatch,
    boolean async,
    boolean internal) {

  public ContractOptions {
    implementers = List.copyOf(implementers);
    externalDowncasts = List.copyOf(externalDowncasts);
  }

  public static ContractOptions empty() {
    return new ContractOptions(null, null, null, List.of(), List.of(), null, null, false, false);
  }
}
