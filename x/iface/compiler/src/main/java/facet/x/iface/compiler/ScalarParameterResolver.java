package facet.x.iface.compiler;

import facet.java.api.types.DefaultScalarValue;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.directive.Spanned;
import facet.x.iface.compiler.model.ScalarParameterKind;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decides how the scalar (payload) type parameter is threaded through the generated signatures.
 *
 * <ul>
 *   <li>an override naming one of the contract's own type parameters binds to it
 *   <li>any other override fixes the contract to that concrete type
 *   <li>no override synthesizes a fresh parameter defaulting to {@link DefaultScalarValue}
 * </ul>
 */
public final class ScalarParameterResolver {

  static final String SYNTHESIZED_PARAMETER = "S";

  static final TypeRef DEFAULT_SCALAR = TypeRef.named(DefaultScalarValue.class.getName());

  /**
   * Resolves the scalar parameter kind.
   *
   * @param override the scalar override, if any
   * @param genericParameters the contract's own type parameters
   * @return the scalar parameter kind
   */
  public ScalarParameterKind resolve(
      @Nullable Spanned<TypeRef> override, List<String> genericParameters) {
    if (override == null) {
      return new ScalarParameterKind.ImplicitGeneric(
          freshParameter(genericParameters), DEFAULT_SCALAR);
    }
    TypeRef type = override.value();
    String candidate = null;
    if (type instanceof TypeRef.GenericParameter parameter) {
      candidate = parameter.name();
    } else if (type instanceof TypeRef.Named named && named.arguments().isEmpty()) {
      candidate = named.name();
    }
    if (candidate != null && genericParameters.contains(candidate)) {
      return new ScalarParameterKind.ExplicitGeneric(candidate);
    }
    return new ScalarParameterKind.Concrete(type);
  }

  private static String freshParameter(List<String> genericParameters) {
    if (!genericParameters.contains(SYNTHESIZED_PARAMETER)) {
      return SYNTHESIZED_PARAMETER;
    }
    int suffix = 0;
    while (genericParameters.contains(SYNTHESIZED_PARAMETER + suffix)) {
      suffix++;
    }
    return SYNTHESIZED_PARAMETER + suffix;
  }
}
