package facet.x.iface.compiler.schema;

import facet.x.iface.compiler.declaration.TypeRef;
import graphql.Scalars;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeReference;
import java.util.Set;

/**
 * Maps declaration types to graphql-java types. Every type is non-null unless wrapped in {@code
 * Optional}; lists and arrays become GraphQL lists; a suspendable result maps as the value it
 * completes with. Types other than the built-in scalars are referenced by their simple name and
 * resolved when the schema is assembled.
 *
 * <p>{@code long} and {@code void} have no GraphQL counterpart and are rejected: GraphQL's {@code
 * Int} is 32-bit and every field has a type.
 */
public class GraphQLTypeMapper {

  private static final Set<String> LIST_TYPES =
      Set.of(
          "List",
          "java.util.List",
          "Collection",
          "java.util.Collection",
          "Set",
          "java.util.Set",
          "Iterable",
          "java.lang.Iterable");

  private static final String ARRAY_SUFFIX = "[]";

  /**
   * Maps a field result type.
   *
   * @param type the declared type
   * @return the GraphQL output type
   * @throws IllegalArgumentException if the type has no GraphQL counterpart
   */
  public GraphQLOutputType toOutputType(TypeRef type) {
    return (GraphQLOutputType) map(type);
  }

  /**
   * Maps an argument type.
   *
   * @param type the declared type
   * @return the GraphQL input type
   * @throws IllegalArgumentException if the type has no GraphQL counterpart
   */
  public GraphQLInputType toInputType(TypeRef type) {
    return (GraphQLInputType) map(type);
  }

  private GraphQLType map(TypeRef type) {
    TypeRef target = unwrap(type);
    if (target instanceof TypeRef.Named named && named.isOption()) {
      return mapNullable(named.arguments().get(0));
    }
    return GraphQLNonNull.nonNull(mapNullable(target));
  }

  private GraphQLType mapNullable(TypeRef type) {
    TypeRef target = unwrap(type);
    if (target instanceof TypeRef.GenericParameter parameter) {
      return GraphQLTypeReference.typeRef(parameter.name());
    }
    TypeRef.Named named = (TypeRef.Named) target;
    if (named.isOption()) {
      // Optional<Optional<T>> has no GraphQL counterpart; it collapses to a nullable T
      return mapNullable(named.arguments().get(0));
    }
    if (LIST_TYPES.contains(named.name()) && named.arguments().size() == 1) {
      return GraphQLList.list(map(named.arguments().get(0)));
    }
    if (named.name().endsWith(ARRAY_SUFFIX)) {
      String component =
          named.name().substring(0, named.name().length() - ARRAY_SUFFIX.length());
      return GraphQLList.list(map(TypeRef.named(component)));
    }
    return mapScalarOrCustomType(named);
  }

  private static GraphQLType mapScalarOrCustomType(TypeRef.Named named) {
    return switch (named.name()) {
      case "String", "java.lang.String", "char", "Character", "java.lang.Character" ->
          Scalars.GraphQLString;
      case "int",
          "Integer",
          "java.lang.Integer",
          "short",
          "Short",
          "java.lang.Short",
          "byte",
          "Byte",
          "java.lang.Byte" -> Scalars.GraphQLInt;
      case "double", "Double", "java.lang.Double", "float", "Float", "java.lang.Float" ->
          Scalars.GraphQLFloat;
      case "boolean", "Boolean", "java.lang.Boolean" -> Scalars.GraphQLBoolean;
      case "long", "Long", "java.lang.Long", "void", "Void", "java.lang.Void" ->
          throw new IllegalArgumentException(
              "type `"
                  + named.name()
                  + "` has no GraphQL counterpart; use a built-in scalar or a schema type");
      // For custom types (enums, objects, interfaces), reference the type by name
      default -> GraphQLTypeReference.typeRef(named.simpleName());
    };
  }

  private static TypeRef unwrap(TypeRef type) {
    TypeRef target = TypeRef.unreferenced(type);
    while (target instanceof TypeRef.Named named && named.isSuspendable()) {
      target = TypeRef.unreferenced(named.arguments().get(0));
    }
    return target;
  }
}
