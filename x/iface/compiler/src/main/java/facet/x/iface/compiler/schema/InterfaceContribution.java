package facet.x.iface.compiler.schema;

import graphql.schema.GraphQLInterfaceType;
import java.util.List;

/**
 * What a compiled interface contributes to a schema.
 *
 * @param interfaceType the GraphQL interface type
 * @param possibleTypeNames the object types implementing it, in implementer order
 */
public record InterfaceContribution(
    GraphQLInterfaceType interfaceType, List<String> possibleTypeNames) {

  public InterfaceContribution {
    possibleTypeNames = List.copyOf(possibleTypeNames);
  }
}
