package facet.x.iface.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import facet.java.api.types.DefaultScalarValue;
import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.directive.Spanned;
import facet.x.iface.compiler.model.ScalarParameterKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScalarParameterResolverTest {

  private final ScalarParameterResolver resolver = new ScalarParameterResolver();

  @Test
  void synthesizesParameterWithDefaultScalarWhenNoOverride() {
    ScalarParameterKind kind = resolver.resolve(null, List.of());

    assertThat(kind)
        .isEqualTo(
            new ScalarParameterKind.ImplicitGeneric(
                "S", TypeRef.named(DefaultScalarValue.class.getName())));
  }

  @Test
  void synthesizedParameterAvoidsExistingOnes() {
    assertThat(resolver.resolve(null, List.of("S")))
        .isInstanceOfSatisfying(
            ScalarParameterKind.ImplicitGeneric.class,
            implicit -> assertThat(implicit.parameter()).isEqualTo("S0"));
    assertThat(resolver.resolve(null, List.of("S", "S0")))
        .isInstanceOfSatisfying(
            ScalarParameterKind.ImplicitGeneric.class,
            implicit -> assertThat(implicit.parameter()).isEqualTo("S1"));
  }

  @Test
  void bindsOverrideNamingOwnTypeParameter() {
    assertThat(resolver.resolve(override(TypeRef.generic("T")), List.of("T")))
        .isEqualTo(new ScalarParameterKind.ExplicitGeneric("T"));
    assertThat(resolver.resolve(override(TypeRef.named("T")), List.of("T")))
        .isEqualTo(new ScalarParameterKind.ExplicitGeneric("T"));
  }

  @Test
  void fixesContractToConcreteOverride() {
    TypeRef custom = TypeRef.named("com.example.MyScalarValue");

    assertThat(resolver.resolve(override(custom), List.of("T")))
        .isEqualTo(new ScalarParameterKind.Concrete(custom));
  }

  private static Spanned<TypeRef> override(TypeRef type) {
    return new Spanned<>(type, SourceSpan.unknown());
  }
}
