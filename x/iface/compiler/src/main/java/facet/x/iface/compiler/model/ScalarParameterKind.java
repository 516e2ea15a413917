package facet.x.iface.compiler.model;

import facet.x.iface.compiler.declaration.TypeRef;

/** How the scalar (payload) type parameter is threaded through generated signatures. */
public sealed interface ScalarParameterKind {

  /** The contract is fixed to one scalar representation. */
  record Concrete(TypeRef type) implements ScalarParameterKind {}

  /** The contract's own type parameter {@code parameter} is the scalar parameter. */
  record ExplicitGeneric(String parameter) implements ScalarParameterKind {}

  /**
   * A type parameter synthesized by the compiler. Callers that do not care get {@code
   * defaultType}.
   */
  record ImplicitGeneric(String parameter, TypeRef defaultType) implements ScalarParameterKind {}
}
