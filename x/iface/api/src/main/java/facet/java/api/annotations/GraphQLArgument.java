package facet.java.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Customizes the GraphQL argument produced from a field method parameter.
 *
 * <p>Cannot be combined with {@link InjectContext} or {@link InjectExecutor}: a parameter is either
 * a regular argument or an injected value.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface GraphQLArgument {

  /**
   * The exposed argument name. Defaults to the camel-cased parameter name, which requires the
   * class to be compiled with {@code -parameters}.
   *
   * @return the argument name
   */
  String name() default "";

  /**
   * Description of the argument in the schema.
   *
   * @return the description, or empty for none
   */
  String description() default "";

  /**
   * Default value as a GraphQL literal, e.g. {@code "10"} or {@code "\"en\""}.
   *
   * @return the default value literal, or empty for none
   */
  String defaultValue() default "";
}
