package facet.x.iface.compiler.model;

import facet.x.iface.compiler.declaration.TypeRef;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A queryable field of the interface.
 *
 * @param name the exposed field name
 * @param type the result shape; lifetimes are erased and a suspendable result is unwrapped to
 *     the value it completes with
 * @param description the field description
 * @param deprecation set when the field is deprecated
 * @param arguments the classified parameters, in declaration order
 * @param methodIdentifier the contract method backing the field
 * @param async whether the backing method suspends
 */
public record FieldDefinition(
    String name,
    TypeRef type,
    @Nullable String description,
    @Nullable Deprecation deprecation,
    List<ArgumentDefinition> arguments,
    String methodIdentifier,
    boolean async) {

  public FieldDefinition {
    arguments = List.copyOf(arguments);
  }

  /** The arguments exposed in the schema, i.e. without context and executor. */
  public List<ArgumentDefinition.Regular> regularArguments() {
    return arguments.stream()
        .filter(ArgumentDefinition.Regular.class::isInstance)
        .map(ArgumentDefinition.Regular.class::cast)
        .toList();
  }
}
