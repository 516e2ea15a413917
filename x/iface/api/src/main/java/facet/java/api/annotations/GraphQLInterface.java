package facet.java.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Java interface as a GraphQL interface contract.
 *
 * <p>The interface's methods become the GraphQL fields of the interface, and the listed {@link
 * #implementers()} become its possible types. The interface compiler reads this annotation and
 * generates a dispatch type that lets calling code resolve fields without knowing which
 * implementer is behind it.
 *
 * <pre>{@code
 * @GraphQLInterface(
 *     name = "Character",
 *     implementers = {Human.class, Droid.class})
 * public interface Character {
 *   String id();
 *
 *   @Downcast
 *   default Optional<Human> asHuman() {
 *     return Optional.empty();
 *   }
 * }
 * }</pre>
 *
 * <h2>Dispatch</h2>
 *
 * <p>By default a closed dispatch type named {@code <Interface>Value} is generated, with one
 * variant per implementer. Set {@link #dispatch()} to {@link DispatchMode#OPEN} to get a wrapper
 * that works for any implementer, including ones added later.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface GraphQLInterface {

  /**
   * The exposed GraphQL name. Defaults to the interface's simple name.
   *
   * @return the GraphQL type name
   */
  String name() default "";

  /**
   * Description of the interface in the schema.
   *
   * @return the description, or empty for none
   */
  String description() default "";

  /**
   * Overrides the scalar (payload) type parameter. If the value names one of the interface's own
   * type variables, the generated dispatch type stays generic over it; otherwise it is taken as the
   * fully qualified name of a concrete scalar type.
   *
   * @return the scalar type or type variable name, or empty to synthesize one
   */
  String scalar() default "";

  /**
   * The concrete types implementing this interface.
   *
   * @return the implementer types
   */
  Class<?>[] implementers() default {};

  /**
   * The context type passed to fields and downcasts. Inferred from field arguments when absent.
   *
   * @return the context type, or {@code void.class} to infer it
   */
  Class<?> context() default void.class;

  /**
   * Which dispatch representation to generate.
   *
   * @return the dispatch mode
   */
  DispatchMode dispatch() default DispatchMode.CLOSED;

  /**
   * Name of the generated dispatch type. Empty means a name derived from the interface.
   *
   * @return the dispatch type name
   */
  String dispatchName() default "";

  /**
   * Forces an asynchronous contract even when no method returns a future.
   *
   * @return whether every field resolves asynchronously
   */
  boolean async() default false;

  /**
   * Marks the interface as part of the introspection system, which allows names starting with
   * {@code __}.
   *
   * @return whether the interface is internal
   */
  boolean internal() default false;
}
