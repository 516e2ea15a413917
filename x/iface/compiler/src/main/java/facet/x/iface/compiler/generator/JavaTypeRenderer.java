package facet.x.iface.compiler.generator;

import facet.x.iface.compiler.declaration.TypeRef;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders declaration types as Java source. References have no Java spelling and render as the
 * type they point to.
 */
public final class JavaTypeRenderer {

  private static final Map<String, String> BOXED =
      Map.of(
          "int", "Integer",
          "long", "Long",
          "short", "Short",
          "byte", "Byte",
          "char", "Character",
          "float", "Float",
          "double", "Double",
          "boolean", "Boolean",
          "void", "Void");

  private JavaTypeRenderer() {
    // Static utility class
  }

  public static String render(TypeRef type) {
    if (type instanceof TypeRef.Reference reference) {
      return render(reference.target());
    }
    if (type instanceof TypeRef.GenericParameter parameter) {
      return parameter.name();
    }
    TypeRef.Named named = (TypeRef.Named) type;
    if (named.arguments().isEmpty()) {
      return named.name();
    }
    return named.name()
        + named.arguments().stream()
            .map(JavaTypeRenderer::boxed)
            .collect(Collectors.joining(", ", "<", ">"));
  }

  /** Renders the type, boxing primitives so it can be used as a type argument. */
  public static String boxed(TypeRef type) {
    String rendered = render(type);
    return BOXED.getOrDefault(rendered, rendered);
  }

  public static boolean isVoid(TypeRef type) {
    return type instanceof TypeRef.Named named && named.name().equals("void");
  }
}
