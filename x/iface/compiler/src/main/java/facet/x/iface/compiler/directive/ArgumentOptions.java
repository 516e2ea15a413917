package facet.x.iface.compiler.directive;

import facet.x.iface.compiler.declaration.SourceSpan;
import org.jspecify.annotations.Nullable;

/**
 * Argument-level options. {@code context} and {@code executor} hold the location of the marker
 * directive, or null when it is absent.
 */
public record ArgumentOptions(
    @Nullable Spanned<String> name,
    @Nullable Spanned<String> description,
    @Nullable Spanned<String> defaultValue,
    @Nullable SourceSpan context,
    @Nullable SourceSpan executor) {

  public static ArgumentOptions empty() {
    return new ArgumentOptions(null, null, null, null, null);
  }
}
