package facet.x.iface.compiler.declaration;

import java.util.List;

/** A type member declared by a contract, e.g. a nested type. */
public record AssociatedType(String identifier, List<String> genericParameters) {

  public AssociatedType {
    genericParameters = List.copyOf(genericParameters);
  }
}
