package facet.x.iface.compiler;

import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.diagnostics.DiagnosticKind;
import facet.x.iface.compiler.diagnostics.DiagnosticSink;
import facet.x.iface.compiler.directive.ExternalDowncastOption;
import facet.x.iface.compiler.directive.Spanned;
import facet.x.iface.compiler.model.DowncastBinding;
import facet.x.iface.compiler.model.ImplementerDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the implementer registry of a contract and attaches downcast bindings to it.
 *
 * <p>The registry is seeded from the declared implementers. External bindings have to be applied
 * before method bindings: a method binding for an implementer that already has an external one
 * is reported as a conflict at the method, naming both.
 */
public final class ImplementerResolver {

  static final String ONLY_IMPLEMENTERS_MESSAGE =
      "downcasting is possible only to interface implementers";

  private final DiagnosticSink sink;
  private final Map<TypeRef, ImplementerDefinition> registry = new LinkedHashMap<>();

  public ImplementerResolver(DiagnosticSink sink) {
    this.sink = sink;
  }

  /**
   * Registers the declared implementers, without bindings. Repeated types are registered once.
   *
   * @param declared the implementer types, in declaration order
   */
  public void seed(List<Spanned<TypeRef>> declared) {
    for (Spanned<TypeRef> implementer : declared) {
      TypeRef key = keyOf(implementer.value());
      registry.putIfAbsent(key, ImplementerDefinition.unbound(key, implementer.span()));
    }
  }

  /**
   * Attaches the external downcast bindings declared on the contract.
   *
   * @param bindings the bindings, in declaration order
   */
  public void applyExternal(List<ExternalDowncastOption> bindings) {
    for (ExternalDowncastOption binding : bindings) {
      TypeRef key = keyOf(binding.implementer());
      ImplementerDefinition implementer = registry.get(key);
      if (implementer == null) {
        sink.error(
            DiagnosticKind.NON_IMPLEMENTER_DOWNCAST_TARGET,
            binding.span(),
            ONLY_IMPLEMENTERS_MESSAGE);
        continue;
      }
      if (implementer.downcast() != null) {
        sink.error(
            DiagnosticKind.DUPLICATE_DOWNCAST_BINDING,
            binding.span(),
            "external downcast function `"
                + binding.function()
                + "` conflicts with "
                + describe(implementer.downcast())
                + " declared on the interface to downcast into the implementer type `"
                + key.render()
                + "`");
        continue;
      }
      DowncastBinding external = new DowncastBinding.ByExternalFunction(binding.function());
      registry.put(key, implementer.withDowncast(external, null));
    }
  }

  /**
   * Attaches a downcast method found on the contract.
   *
   * @param downcast the classified downcast method
   */
  public void applyMethod(MethodClassifier.Downcast downcast) {
    TypeRef key = keyOf(downcast.implementer());
    ImplementerDefinition implementer = registry.get(key);
    if (implementer == null) {
      sink.error(
          DiagnosticKind.NON_IMPLEMENTER_DOWNCAST_TARGET,
          downcast.method().span(),
          ONLY_IMPLEMENTERS_MESSAGE);
      return;
    }
    if (implementer.downcast() != null) {
      sink.error(
          DiagnosticKind.DUPLICATE_DOWNCAST_BINDING,
          downcast.method().span(),
          "method `"
              + downcast.method().identifier()
              + "` conflicts with "
              + describe(implementer.downcast())
              + " declared on the interface to downcast into the implementer type `"
              + key.render()
              + "`",
          "use the `ignore` directive to exclude this method from implementer downcasting");
      return;
    }
    registry.put(key, implementer.withDowncast(downcast.binding(), downcast.contextType()));
  }

  /** The registered implementers, in declaration order. */
  public List<ImplementerDefinition> implementers() {
    return new ArrayList<>(registry.values());
  }

  private static TypeRef keyOf(TypeRef type) {
    return TypeRef.unreferenced(type).anonymized();
  }

  private static String describe(DowncastBinding binding) {
    if (binding instanceof DowncastBinding.ByExternalFunction external) {
      return "the external downcast function `" + external.function() + "`";
    }
    DowncastBinding.ByMethod method = (DowncastBinding.ByMethod) binding;
    return "the downcast method `" + method.methodIdentifier() + "`";
  }
}
