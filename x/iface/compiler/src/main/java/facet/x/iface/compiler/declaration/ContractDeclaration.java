package facet.x.iface.compiler.declaration;

import java.util.ArrayList;
import java.util.List;

/**
 * The contract to compile: an interface-shaped declaration together with the raw directives
 * attached to it. Immutable input to {@link facet.x.iface.compiler.ContractCompiler}.
 *
 * @param identifier the contract's identifier as written
 * @param packageName the package the contract lives in, empty for the default package
 * @param visibility the contract's visibility
 * @param genericParameters names of the contract's own type parameters
 * @param methods declared methods, in source order
 * @param associatedTypes declared type members
 * @param associatedConstants declared constants
 * @param directives raw declaration-level directives
 * @param span where the contract is declared
 */
public record ContractDeclaration(
    String identifier,
    String packageName,
    Visibility visibility,
    List<String> genericParameters,
    List<MethodDeclaration> methods,
    List<AssociatedType> associatedTypes,
    List<AssociatedConstant> associatedConstants,
    List<Directive> directives,
    SourceSpan span) {

  public ContractDeclaration {
    genericParameters = List.copyOf(genericParameters);
    methods = List.copyOf(methods);
    associatedTypes = List.copyOf(associatedTypes);
    associatedConstants = List.copyOf(associatedConstants);
    directives = List.copyOf(directives);
  }

  /** The identifier qualified with the package, as Java code refers to it. */
  public String qualifiedIdentifier() {
    return packageName.isEmpty() ? identifier : packageName + "." + identifier;
  }

  public static Builder builder(String identifier) {
    return new Builder(identifier);
  }

  /** Builder for assembling a declaration element by element. */
  public static final class Builder {
    private final String identifier;
    private String packageName = "";
    private Visibility visibility = Visibility.PUBLIC;
    private final List<String> genericParameters = new ArrayList<>();
    private final List<MethodDeclaration> methods = new ArrayList<>();
    private final List<AssociatedType> associatedTypes = new ArrayList<>();
    private final List<AssociatedConstant> associatedConstants = new ArrayList<>();
    private final List<Directive> directives = new ArrayList<>();
    private SourceSpan span = SourceSpan.unknown();

    private Builder(String identifier) {
      this.identifier = identifier;
    }

    public Builder packageName(String packageName) {
      this.packageName = packageName;
      return this;
    }

    public Builder visibility(Visibility visibility) {
      this.visibility = visibility;
      return this;
    }

    public Builder genericParameter(String name) {
      this.genericParameters.add(name);
      return this;
    }

    public Builder method(MethodDeclaration method) {
      this.methods.add(method);
      return this;
    }

    public Builder associatedType(AssociatedType type) {
      this.associatedTypes.add(type);
      return this;
    }

    public Builder associatedConstant(AssociatedConstant constant) {
      this.associatedConstants.add(constant);
      return this;
    }

    public Builder directive(Directive directive) {
      this.directives.add(directive);
      return this;
    }

    public Builder span(SourceSpan span) {
      this.span = span;
      return this;
    }

    public ContractDeclaration build() {
      return new ContractDeclaration(
          identifier,
          packageName,
          visibility,
          genericParameters,
          methods,
          associatedTypes,
          associatedConstants,
          directives,
          span);
    }
  }
}
