package facet.x.iface.compiler.schema;

import facet.x.iface.compiler.model.ArgumentDefinition;
import facet.x.iface.compiler.model.ContractModel;
import facet.x.iface.compiler.model.Deprecation;
import facet.x.iface.compiler.model.FieldDefinition;
import facet.x.iface.compiler.model.ImplementerDefinition;
import graphql.language.Value;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLOutputType;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the graphql-java interface type of a compiled contract. Context and executor arguments
 * are injected at resolution time and never appear in the schema.
 */
public class InterfaceTypeBuilder {

  static final String DEFAULT_DEPRECATION_REASON = "No longer supported";

  private final GraphQLTypeMapper typeMapper;

  public InterfaceTypeBuilder() {
    this(new GraphQLTypeMapper());
  }

  public InterfaceTypeBuilder(GraphQLTypeMapper typeMapper) {
    this.typeMapper = typeMapper;
  }

  /**
   * Builds the interface type and lists its possible types.
   *
   * @param model the compiled contract
   * @return the schema contribution
   * @throws IllegalArgumentException if an argument default is not a valid GraphQL literal, or a
   *     field or argument type has no GraphQL counterpart
   */
  public InterfaceContribution build(ContractModel model) {
    GraphQLInterfaceType.Builder builder =
        GraphQLInterfaceType.newInterface().name(model.name()).description(model.description());
    for (FieldDefinition field : model.fields()) {
      builder.field(field(field));
    }

    List<String> possibleTypeNames = new ArrayList<>();
    for (ImplementerDefinition implementer : model.implementers()) {
      possibleTypeNames.add(implementer.simpleName());
    }
    return new InterfaceContribution(builder.build(), possibleTypeNames);
  }

  private GraphQLFieldDefinition field(FieldDefinition field) {
    GraphQLFieldDefinition.Builder builder =
        GraphQLFieldDefinition.newFieldDefinition()
            .name(field.name())
            .description(field.description())
            .type(outputType(field));
    Deprecation deprecation = field.deprecation();
    if (deprecation != null) {
      builder.deprecate(
          deprecation.reason() != null ? deprecation.reason() : DEFAULT_DEPRECATION_REASON);
    }
    for (ArgumentDefinition.Regular argument : field.regularArguments()) {
      builder.argument(argument(field, argument));
    }
    return builder.build();
  }

  private GraphQLArgument argument(FieldDefinition field, ArgumentDefinition.Regular argument) {
    GraphQLArgument.Builder builder =
        GraphQLArgument.newArgument()
            .name(argument.name())
            .description(argument.description())
            .type(inputType(field, argument));
    String defaultValue = argument.defaultValue();
    if (defaultValue != null) {
      builder.defaultValueLiteral(parseLiteral(field, argument, defaultValue));
    }
    return builder.build();
  }

  private GraphQLOutputType outputType(FieldDefinition field) {
    try {
      return typeMapper.toOutputType(field.type());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid type of field `" + field.name() + "`: " + e.getMessage(), e);
    }
  }

  private GraphQLInputType inputType(FieldDefinition field, ArgumentDefinition.Regular argument) {
    try {
      return typeMapper.toInputType(argument.type());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid type of argument `"
              + argument.name()
              + "` of field `"
              + field.name()
              + "`: "
              + e.getMessage(),
          e);
    }
  }

  private static Value<?> parseLiteral(
      FieldDefinition field, ArgumentDefinition.Regular argument, String literal) {
    try {
      return Parser.parseValue(literal);
    } catch (InvalidSyntaxException e) {
      throw new IllegalArgumentException(
          "Invalid default value for argument `"
              + argument.name()
              + "` of field `"
              + field.name()
              + "`: "
              + literal,
          e);
    }
  }
}
