package facet.java.api.types;

/**
 * Implemented by every generated dispatch type. A value of this type stands for "some implementer
 * of the interface", and knows which one.
 *
 * @param <S> the scalar value representation of the schema
 */
public interface GraphQLInterfaceValue<S extends ScalarValue> {

  /**
   * The GraphQL name of the implementer behind this value.
   *
   * @return the concrete object type name
   * @throws IllegalStateException if no declared implementer matches the value
   */
  String concreteTypeName();
}
