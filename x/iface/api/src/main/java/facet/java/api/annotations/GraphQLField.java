package facet.java.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Customizes the GraphQL field produced from an interface method. Methods without this annotation
 * are still fields; their name is derived from the method name.
 *
 * <p>Use {@link Deprecated} on the method to deprecate the field; {@link #deprecationReason()}
 * supplies the reason shown in the schema.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface GraphQLField {

  /**
   * The exposed field name. Defaults to the camel-cased method name.
   *
   * @return the field name
   */
  String name() default "";

  /**
   * Description of the field in the schema.
   *
   * @return the description, or empty for none
   */
  String description() default "";

  /**
   * Deprecation reason. Implies deprecation even without {@link Deprecated}.
   *
   * @return the reason, or empty for none
   */
  String deprecationReason() default "";
}
