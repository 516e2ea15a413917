package facet.x.iface.compiler.declaration;

import java.util.List;

/**
 * A raw directive attached to a declaration, method or parameter, before it has been interpreted
 * by a {@link facet.x.iface.compiler.directive.DirectiveExtractor}.
 *
 * @param key the directive name, e.g. {@code name} or {@code external-downcast}
 * @param value the directive payload
 * @param span where the directive is written
 */
public record Directive(String key, DirectiveValue value, SourceSpan span) {

  public static Directive flag(String key, SourceSpan span) {
    return new Directive(key, new DirectiveValue.Flag(), span);
  }

  public static Directive text(String key, String text, SourceSpan span) {
    return new Directive(key, new DirectiveValue.Text(text), span);
  }

  public static Directive types(String key, List<TypeRef> types, SourceSpan span) {
    return new Directive(key, new DirectiveValue.Types(types), span);
  }

  public static Directive binding(String key, TypeRef type, String function, SourceSpan span) {
    return new Directive(key, new DirectiveValue.Binding(type, function), span);
  }
}
