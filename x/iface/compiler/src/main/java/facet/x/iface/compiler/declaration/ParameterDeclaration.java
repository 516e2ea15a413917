package facet.x.iface.compiler.declaration;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A non-receiver parameter of a contract method.
 *
 * @param identifier the bare identifier, or null when the parameter is bound by a destructuring
 *     pattern
 * @param patternText the parameter pattern as written, used in diagnostics
 * @param type the declared type
 * @param directives raw directives on the parameter
 * @param span where the parameter is declared
 */
public record ParameterDeclaration(
    @Nullable String identifier,
    String patternText,
    TypeRef type,
    List<Directive> directives,
    SourceSpan span) {

  public ParameterDeclaration {
    directives = List.copyOf(directives);
  }

  public static ParameterDeclaration of(String identifier, TypeRef type, Directive... directives) {
    return new ParameterDeclaration(
        identifier, identifier, type, List.of(directives), SourceSpan.unknown());
  }

  public ParameterDeclaration withoutDirectives() {
    return new ParameterDeclaration(identifier, patternText, type, List.of(), span);
  }
}
