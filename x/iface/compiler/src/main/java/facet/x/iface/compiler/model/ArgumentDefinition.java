package facet.x.iface.compiler.model;

import facet.x.iface.compiler.declaration.TypeRef;
import org.jspecify.annotations.Nullable;

/** The role a field method parameter plays. */
public sealed interface ArgumentDefinition {

  /** Receives the execution context; never exposed in the schema. */
  record Context(TypeRef type) implements ArgumentDefinition {}

  /** Receives the executor handle; never exposed in the schema. */
  record Executor() implements ArgumentDefinition {}

  /**
   * A GraphQL argument of the field.
   *
   * @param name the exposed argument name
   * @param type the declared parameter type
   * @param description the argument description
   * @param defaultValue the default value as a GraphQL literal
   */
  record Regular(
      String name, TypeRef type, @Nullable String description, @Nullable String defaultValue)
      implements ArgumentDefinition {}
}
