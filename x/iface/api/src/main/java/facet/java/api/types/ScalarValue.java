package facet.java.api.types;

/**
 * Tagging interface for the leaf value representation of a schema. Generated dispatch types are
 * generic over a type bounded by this interface, so a schema can pick its own representation of
 * scalar values.
 */
public interface ScalarValue {}
