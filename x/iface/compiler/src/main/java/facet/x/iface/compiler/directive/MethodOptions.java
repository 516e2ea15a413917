package facet.x.iface.compiler.directive;

import org.jspecify.annotations.Nullable;

/**
 * Method-level options.
 *
 * @param name the exposed field name override
 * @param description the field description
 * @param deprecation present when the field is deprecated; its value is the reason, possibly
 *     empty
 * @param ignore whether the method is left out of the interface
 * @param downcast whether the method narrows to an implementer instead of being a field
 */
public record MethodOptions(
    @Nullable Spanned<String> name,
    @Nullable Spanned<String> description,
    @Nullable Spanned<String> deprecation,
    boolean ignore,
    boolean downcast) {

  public static MethodOptions empty() {
    return new MethodOptions(null, null, null, false, false);
  }
}
