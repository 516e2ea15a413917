package facet.java.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an interface method as a downcast to one implementer instead of a field.
 *
 * <p>The method must return {@code Optional<Implementer>}, take no parameters other than an
 * optional context, and must not be asynchronous:
 *
 * <pre>{@code
 * @Downcast
 * default Optional<Droid> asDroid(Database context) {
 *   return Optional.empty();
 * }
 * }</pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Downcast {}
