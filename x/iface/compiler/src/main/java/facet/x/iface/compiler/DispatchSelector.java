package facet.x.iface.compiler;

import facet.x.iface.compiler.declaration.AssociatedConstant;
import facet.x.iface.compiler.declaration.ContractDeclaration;
import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.diagnostics.DiagnosticKind;
import facet.x.iface.compiler.diagnostics.DiagnosticSink;
import facet.x.iface.compiler.directive.DispatchOption;
import facet.x.iface.compiler.model.DispatchArtifact;
import facet.x.iface.compiler.model.ImplementerDefinition;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Chooses between open and closed dispatch and assembles the chosen artifact. Without a {@code
 * dispatch} option the contract gets a closed union named {@code <Identifier>Value}.
 */
public final class DispatchSelector {

  static final String OPEN_PREFIX = "Dyn";
  static final String CLOSED_SUFFIX = "Value";

  /**
   * Selects the dispatch artifact.
   *
   * @param declaration the contract
   * @param option the requested dispatch mode, if any
   * @param implementers the resolved implementers
   * @return the artifact
   */
  public DispatchArtifact select(
      ContractDeclaration declaration,
      @Nullable DispatchOption option,
      List<ImplementerDefinition> implementers) {
    List<MethodDeclaration> methods =
        declaration.methods().stream().map(MethodDeclaration::withoutDirectives).toList();

    if (option != null && option.open()) {
      String alias =
          option.artifactName() != null
              ? option.artifactName()
              : OPEN_PREFIX + declaration.identifier();
      return new DispatchArtifact.OpenDispatch(
          alias, declaration.qualifiedIdentifier(), methods);
    }

    String name =
        option != null && option.artifactName() != null
            ? option.artifactName()
            : declaration.identifier() + CLOSED_SUFFIX;
    return new DispatchArtifact.ClosedDispatch(
        name,
        variants(implementers),
        declaration.associatedTypes(),
        declaration.associatedConstants(),
        methods);
  }

  /**
   * Reports contract members whose names the generated type already uses for its own members.
   * Methods clash by name whatever their parameters; constants clash with the union's fields.
   *
   * @param declaration the contract
   * @param artifact the selected artifact
   * @param sink receives one diagnostic per clashing member
   */
  public void checkMemberNames(
      ContractDeclaration declaration, DispatchArtifact artifact, DiagnosticSink sink) {
    Set<String> reserved = artifact.reservedMethodNames();
    for (MethodDeclaration method : artifact.methods()) {
      if (reserved.contains(method.identifier())) {
        sink.error(
            DiagnosticKind.RESERVED_MEMBER_NAME,
            method.span(),
            "method `"
                + method.identifier()
                + "` clashes with a member generated on `"
                + artifact.name()
                + "`",
            "rename the method; the `name` directive keeps the field name");
      }
    }
    if (artifact instanceof DispatchArtifact.ClosedDispatch closed) {
      for (AssociatedConstant constant : closed.associatedConstants()) {
        if (closed.reservedFieldNames().contains(constant.identifier())) {
          sink.error(
              DiagnosticKind.RESERVED_MEMBER_NAME,
              declaration.span(),
              "constant `"
                  + constant.identifier()
                  + "` clashes with a field generated on `"
                  + artifact.name()
                  + "`");
        }
      }
    }
  }

  private static List<DispatchArtifact.Variant> variants(List<ImplementerDefinition> implementers) {
    Set<String> tags = new HashSet<>();
    List<DispatchArtifact.Variant> variants = new ArrayList<>();
    for (ImplementerDefinition implementer : implementers) {
      String tag = Names.toConstantCase(implementer.simpleName());
      if (!tags.add(tag)) {
        // Same simple name in different packages
        tag = Names.toConstantCase(implementer.type().render().replaceAll("\\W", "_"));
        tags.add(tag);
      }
      variants.add(new DispatchArtifact.Variant(tag, implementer.type()));
    }
    return variants;
  }
}
