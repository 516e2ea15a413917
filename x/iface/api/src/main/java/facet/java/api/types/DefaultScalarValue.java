package facet.java.api.types;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The scalar representation used when a contract does not choose one. Holds one of the built-in
 * GraphQL scalar values: {@code Int}, {@code Float}, {@code String} or {@code Boolean}.
 */
public final class DefaultScalarValue implements ScalarValue {

  private final Object value;

  private DefaultScalarValue(Object value) {
    this.value = value;
  }

  public static DefaultScalarValue ofInt(int value) {
    return new DefaultScalarValue(value);
  }

  public static DefaultScalarValue ofFloat(double value) {
    return new DefaultScalarValue(value);
  }

  public static DefaultScalarValue ofString(String value) {
    return new DefaultScalarValue(Objects.requireNonNull(value, "value"));
  }

  public static DefaultScalarValue ofBoolean(boolean value) {
    return new DefaultScalarValue(value);
  }

  /**
   * Wraps a Java value of one of the supported kinds.
   *
   * @param value an {@link Integer}, {@link Double}, {@link String} or {@link Boolean}
   * @return the scalar value
   * @throws IllegalArgumentException if the value is of any other kind
   */
  public static DefaultScalarValue of(Object value) {
    if (value instanceof Integer
        || value instanceof Double
        || value instanceof String
        || value instanceof Boolean) {
      return new DefaultScalarValue(value);
    }
    throw new IllegalArgumentException(
        "Unsupported scalar value of type " + value.getClass().getName());
  }

  public Object getValue() {
    return value;
  }

  public @Nullable Integer asInt() {
    return value instanceof Integer i ? i : null;
  }

  public @Nullable Double asFloat() {
    return value instanceof Double d ? d : null;
  }

  public @Nullable String asString() {
    return value instanceof String s ? s : null;
  }

  public @Nullable Boolean asBoolean() {
    return value instanceof Boolean b ? b : null;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DefaultScalarValue other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return "DefaultScalarValue(" + value + ")";
  }
}
