package facet.x.iface.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.diagnostics.Diagnostic;
import facet.x.iface.compiler.diagnostics.DiagnosticKind;
import facet.x.iface.compiler.diagnostics.DiagnosticSink;
import facet.x.iface.compiler.directive.ExternalDowncastOption;
import facet.x.iface.compiler.directive.Spanned;
import facet.x.iface.compiler.model.DowncastBinding;
import facet.x.iface.compiler.model.ImplementerDefinition;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImplementerResolverTest {

  private static final SourceSpan SPAN = SourceSpan.of("Character.java");
  private static final TypeRef HUMAN = TypeRef.named("com.example.Human");
  private static final TypeRef DROID = TypeRef.named("com.example.Droid");
  private static final TypeRef DATABASE = TypeRef.named("com.example.Database");

  private DiagnosticSink sink;
  private ImplementerResolver resolver;

  @BeforeEach
  void setUp() {
    sink = new DiagnosticSink();
    resolver = new ImplementerResolver(sink);
  }

  @Test
  void seedsImplementersOnceInDeclarationOrder() {
    resolver.seed(List.of(declared(HUMAN), declared(DROID), declared(TypeRef.ref(HUMAN))));

    assertThat(resolver.implementers())
        .extracting(ImplementerDefinition::type)
        .containsExactly(HUMAN, DROID);
    assertThat(resolver.implementers()).allSatisfy(i -> assertThat(i.downcast()).isNull());
  }

  @Test
  void attachesExternalBinding() {
    resolver.seed(List.of(declared(HUMAN)));
    resolver.applyExternal(List.of(external(HUMAN, "com.example.Casts::toHuman")));

    assertThat(resolver.implementers().get(0).downcast())
        .isEqualTo(new DowncastBinding.ByExternalFunction("com.example.Casts::toHuman"));
    assertThat(sink.hasErrors()).isFalse();
  }

  @Test
  void externalBindingToNonImplementerCreatesNothing() {
    resolver.seed(List.of(declared(HUMAN)));
    resolver.applyExternal(List.of(external(DROID, "com.example.Casts::toDroid")));

    assertThat(resolver.implementers())
        .extracting(ImplementerDefinition::type)
        .containsExactly(HUMAN);
    assertThat(sink.diagnostics()).hasSize(1);
    Diagnostic diagnostic = sink.diagnostics().get(0);
    assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.NON_IMPLEMENTER_DOWNCAST_TARGET);
    assertThat(diagnostic.message()).isEqualTo(ImplementerResolver.ONLY_IMPLEMENTERS_MESSAGE);
  }

  @Test
  void attachesMethodBindingWithContext() {
    resolver.seed(List.of(declared(HUMAN)));
    resolver.applyMethod(downcast("asHuman", HUMAN, DATABASE));

    ImplementerDefinition human = resolver.implementers().get(0);
    assertThat(human.downcast()).isEqualTo(new DowncastBinding.ByMethod("asHuman", true));
    assertThat(human.contextType()).isEqualTo(DATABASE);
  }

  @Test
  void methodBindingToNonImplementerIsReported() {
    resolver.seed(List.of(declared(HUMAN)));
    resolver.applyMethod(downcast("asDroid", DROID, null));

    assertThat(sink.diagnostics())
        .extracting(Diagnostic::kind)
        .containsExactly(DiagnosticKind.NON_IMPLEMENTER_DOWNCAST_TARGET);
    assertThat(resolver.implementers()).hasSize(1);
  }

  @Test
  void methodConflictingWithExternalBindingNamesBoth() {
    resolver.seed(List.of(declared(HUMAN)));
    resolver.applyExternal(List.of(external(HUMAN, "com.example.Casts::toHuman")));
    resolver.applyMethod(downcast("asHuman", HUMAN, null));

    assertThat(sink.diagnostics()).hasSize(1);
    Diagnostic diagnostic = sink.diagnostics().get(0);
    assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.DUPLICATE_DOWNCAST_BINDING);
    assertThat(diagnostic.message())
        .isEqualTo(
            "method `asHuman` conflicts with the external downcast function"
                + " `com.example.Casts::toHuman` declared on the interface to downcast into the"
                + " implementer type `com.example.Human`");
    assertThat(diagnostic.notes())
        .containsExactly(
            "use the `ignore` directive to exclude this method from implementer downcasting");
    // The first binding is kept
    assertThat(resolver.implementers().get(0).downcast())
        .isInstanceOf(DowncastBinding.ByExternalFunction.class);
  }

  @Test
  void secondExternalBindingIsDuplicate() {
    resolver.seed(List.of(declared(HUMAN)));
    resolver.applyExternal(
        List.of(
            external(HUMAN, "com.example.Casts::toHuman"),
            external(HUMAN, "com.example.OtherCasts::toHuman")));

    assertThat(sink.diagnostics())
        .extracting(Diagnostic::kind)
        .containsExactly(DiagnosticKind.DUPLICATE_DOWNCAST_BINDING);
    assertThat(resolver.implementers().get(0).downcast())
        .isEqualTo(new DowncastBinding.ByExternalFunction("com.example.Casts::toHuman"));
  }

  @Test
  void secondMethodBindingIsDuplicate() {
    resolver.seed(List.of(declared(HUMAN)));
    resolver.applyMethod(downcast("asHuman", HUMAN, null));
    resolver.applyMethod(downcast("toHuman", HUMAN, null));

    assertThat(sink.diagnostics()).hasSize(1);
    assertThat(sink.diagnostics().get(0).message())
        .contains("`toHuman`")
        .contains("the downcast method `asHuman`");
    assertThat(resolver.implementers().get(0).downcast())
        .isEqualTo(new DowncastBinding.ByMethod("asHuman", false));
  }

  private static Spanned<TypeRef> declared(TypeRef type) {
    return new Spanned<>(type, SPAN);
  }

  private static ExternalDowncastOption external(TypeRef implementer, String function) {
    return new ExternalDowncastOption(implementer, function, SPAN);
  }

  private static MethodClassifier.Downcast downcast(
      String identifier, TypeRef implementer, TypeRef contextType) {
    MethodDeclaration method =
        MethodDeclaration.builder(identifier)
            .result(TypeRef.named("java.util.Optional", implementer))
            .span(SPAN)
            .build();
    return new MethodClassifier.Downcast(
        implementer,
        new DowncastBinding.ByMethod(identifier, contextType != null),
        contextType,
        method);
  }
}
