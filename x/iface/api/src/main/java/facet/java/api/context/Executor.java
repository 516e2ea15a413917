package facet.java.api.context;

import facet.java.api.types.ScalarValue;
import java.util.List;

/**
 * Handle to the running query execution, injected into field methods that declare it.
 *
 * <p>Field methods receive it through a parameter named {@code executor} or annotated with {@link
 * facet.java.api.annotations.InjectExecutor}. The execution engine provides the implementation.
 *
 * @param <S> the scalar value representation of the schema
 */
public interface Executor<S extends ScalarValue> {

  /**
   * The context value of the current execution.
   *
   * @return the context value
   */
  Object getContext();

  /**
   * The response path of the field being resolved, e.g. {@code ["hero", "friends", "0"]}.
   *
   * @return the path segments
   */
  List<String> getPath();

  /**
   * Whether the caller selected the given sub-field of the field being resolved.
   *
   * @param fieldName the sub-field name
   * @return true if it is part of the selection set
   */
  boolean isSelected(String fieldName);
}
