package facet.java.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a static function that narrows a contract value to one of its implementers.
 *
 * <p>The function is referenced as {@code fully.qualified.Owner::method} and must accept the
 * contract value (and, optionally, the context) and return an {@code Optional} of the implementer.
 * The implementer must also be listed in {@link GraphQLInterface#implementers()}, and must not have
 * a {@link Downcast} method on the interface at the same time.
 *
 * <pre>{@code
 * @GraphQLInterface(implementers = {Human.class})
 * @ExternalDowncast(implementer = Human.class, function = "com.example.Casts::toHuman")
 * public interface Character { ... }
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(ExternalDowncasts.class)
public @interface ExternalDowncast {

  /**
   * The implementer type this function narrows to.
   *
   * @return the implementer type
   */
  Class<?> implementer();

  /**
   * The function reference, as {@code Owner::method}.
   *
   * @return the function reference
   */
  String function();
}
