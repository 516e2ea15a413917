package facet.x.iface.compiler.declaration;

import java.util.List;

/** Payload shapes a raw {@link Directive} can carry. */
public sealed interface DirectiveValue {

  /** Presence-only directive, e.g. {@code ignore}. */
  record Flag() implements DirectiveValue {}

  /** A literal, e.g. a name, a description or {@code open(DynCharacter)}. */
  record Text(String text) implements DirectiveValue {}

  /** One or more types, e.g. the implementer list. */
  record Types(List<TypeRef> types) implements DirectiveValue {
    public Types {
      types = List.copyOf(types);
    }
  }

  /** A type bound to a function reference, e.g. an external downcast. */
  record Binding(TypeRef type, String function) implements DirectiveValue {}
}
