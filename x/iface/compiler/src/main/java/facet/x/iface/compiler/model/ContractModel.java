package facet.x.iface.compiler.model;

import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.declaration.Visibility;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The validated description of a compiled interface, handed to the schema builder.
 *
 * @param name the exposed GraphQL name
 * @param identifier the contract's qualified identifier
 * @param artifactName the name of the generated dispatch type
 * @param visibility the contract's visibility
 * @param description the interface description
 * @param context the resolved context type
 * @param scalar how the scalar parameter is threaded
 * @param genericParameters the contract's own type parameters
 * @param fields the fields, in declaration order
 * @param implementers the implementers, in declaration order
 * @param asyncAdaptation the concurrency contract of the dispatch type
 */
public record ContractModel(
    String name,
    String identifier,
    String artifactName,
    Visibility visibility,
    @Nullable String description,
    @Nullable TypeRef context,
    ScalarParameterKind scalar,
    List<String> genericParameters,
    List<FieldDefinition> fields,
    List<ImplementerDefinition> implementers,
    AsyncAdaptation asyncAdaptation) {

  public ContractModel {
    genericParameters = List.copyOf(genericParameters);
    fields = List.copyOf(fields);
    implementers = List.copyOf(implementers);
  }
}
