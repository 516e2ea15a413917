package facet.x.iface.compiler.reflect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import facet.x.iface.compiler.CompilationResult;
import facet.x.iface.compiler.ContractCompiler;
import facet.x.iface.compiler.declaration.AssociatedConstant;
import facet.x.iface.compiler.declaration.AssociatedType;
import facet.x.iface.compiler.declaration.ContractDeclaration;
import facet.x.iface.compiler.declaration.Directive;
import facet.x.iface.compiler.declaration.DirectiveValue;
import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.ParameterDeclaration;
import facet.x.iface.compiler.declaration.Receiver;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.declaration.Visibility;
import facet.x.iface.compiler.diagnostics.Diagnostic;
import facet.x.iface.compiler.diagnostics.DiagnosticKind;
import facet.x.iface.compiler.directive.KeyValueDirectiveExtractor;
import facet.x.iface.compiler.model.ArgumentDefinition;
import facet.x.iface.compiler.model.ContractModel;
import facet.x.iface.compiler.model.DispatchArtifact;
import facet.x.iface.compiler.model.DowncastBinding;
import facet.x.iface.compiler.model.FieldDefinition;
import facet.x.iface.compiler.model.ScalarParameterKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnnotatedInterfaceReaderTest {

  private static final String FIXTURES = Fixtures.class.getName();
  private static final TypeRef DATABASE = TypeRef.named(FIXTURES + ".Database");
  private static final TypeRef HUMAN = TypeRef.named(FIXTURES + ".Human");
  private static final TypeRef DROID = TypeRef.named(FIXTURES + ".Droid");

  private final AnnotatedInterfaceReader reader = new AnnotatedInterfaceReader();

  @Test
  void readsContractShape() {
    ContractDeclaration declaration = reader.read(Fixtures.Character.class);

    assertThat(declaration.identifier()).isEqualTo("Character");
    assertThat(declaration.qualifiedIdentifier()).isEqualTo(FIXTURES + ".Character");
    assertThat(declaration.visibility()).isEqualTo(Visibility.PUBLIC);
    assertThat(declaration.genericParameters()).isEmpty();
    assertThat(declaration.associatedConstants())
        .containsExactly(new AssociatedConstant("MAX_FRIENDS", TypeRef.named("int")));
    assertThat(declaration.associatedTypes())
        .containsExactly(new AssociatedType("Visitor", List.of()));
  }

  @Test
  void readsMethodsSortedByName() {
    ContractDeclaration declaration = reader.read(Fixtures.Character.class);

    assertThat(declaration.methods())
        .extracting(MethodDeclaration::identifier)
        .containsExactly("asHuman", "describe", "friends", "id", "name", "nickname");
  }

  @Test
  void translatesAnnotationsToDirectives() {
    ContractDeclaration declaration = reader.read(Fixtures.Character.class);

    assertThat(declaration.directives())
        .extracting(Directive::key)
        .containsExactly(
            KeyValueDirectiveExtractor.DESCRIPTION,
            KeyValueDirectiveExtractor.IMPLEMENTS,
            KeyValueDirectiveExtractor.DISPATCH);
    assertThat(declaration.directives().get(1).value())
        .isEqualTo(new DirectiveValue.Types(List.of(HUMAN, DROID)));
    assertThat(declaration.directives().get(2).value())
        .isEqualTo(new DirectiveValue.Text("closed"));

    MethodDeclaration name = method(declaration, "name");
    assertThat(name.directives())
        .extracting(Directive::key)
        .containsExactly(KeyValueDirectiveExtractor.NAME, KeyValueDirectiveExtractor.DESCRIPTION);
    MethodDeclaration nickname = method(declaration, "nickname");
    assertThat(nickname.directives())
        .containsExactly(Directive.flag(KeyValueDirectiveExtractor.DEPRECATED, nickname.span()));
  }

  @Test
  void readsReceiverDefaultBodyAndTypes() {
    ContractDeclaration declaration = reader.read(Fixtures.Character.class);

    MethodDeclaration asHuman = method(declaration, "asHuman");
    assertThat(asHuman.receiver()).isEqualTo(Receiver.SHARED_REFERENCE);
    assertThat(asHuman.defaultBody()).isTrue();
    assertThat(asHuman.result()).isEqualTo(TypeRef.named("java.util.Optional", HUMAN));

    MethodDeclaration describe = method(declaration, "describe");
    assertThat(describe.receiver()).isEqualTo(Receiver.NONE);
    assertThat(describe.directives())
        .extracting(Directive::key)
        .containsExactly(KeyValueDirectiveExtractor.IGNORE);
  }

  @Test
  void readsParameterDirectives() {
    MethodDeclaration friends = method(reader.read(Fixtures.Character.class), "friends");

    assertThat(friends.parameters()).hasSize(2);
    ParameterDeclaration db = friends.parameters().get(0);
    assertThat(db.identifier()).isEqualTo("db");
    assertThat(db.type()).isEqualTo(DATABASE);
    assertThat(db.directives())
        .extracting(Directive::key)
        .containsExactly(KeyValueDirectiveExtractor.CONTEXT);

    ParameterDeclaration limit = friends.parameters().get(1);
    assertThat(limit.type()).isEqualTo(TypeRef.named("int"));
    assertThat(limit.directives())
        .extracting(Directive::value)
        .containsExactly(
            new DirectiveValue.Text("first"),
            new DirectiveValue.Text("Page size"),
            new DirectiveValue.Text("10"));
  }

  @Test
  void marksFutureResultsAsync() {
    ContractDeclaration declaration = reader.read(Fixtures.Node.class);

    assertThat(method(declaration, "summary").async()).isTrue();
    assertThat(method(declaration, "rank").async()).isTrue();
    assertThat(method(declaration, "rank").defaultBody()).isTrue();
    assertThat(method(declaration, "id").async()).isFalse();
  }

  @Test
  void skipsRedeclaredObjectMethods() {
    ContractDeclaration declaration = reader.read(Fixtures.Node.class);

    assertThat(declaration.methods())
        .extracting(MethodDeclaration::identifier)
        .containsExactly("id", "rank", "summary");
  }

  @Test
  void readsTypeVariablesAndScalarBinding() {
    ContractDeclaration declaration = reader.read(Fixtures.Payload.class);

    assertThat(declaration.genericParameters()).containsExactly("T");
    assertThat(declaration.directives())
        .contains(
            Directive.types(
                KeyValueDirectiveExtractor.SCALAR,
                List.of(TypeRef.generic("T")),
                declaration.span()));
  }

  @Test
  void rejectsUnannotatedAndNonInterfaceTypes() {
    assertThatThrownBy(() -> reader.read(Fixtures.Plain.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("is not annotated with @GraphQLInterface");
    assertThatThrownBy(() -> reader.read(Fixtures.Human.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("is not an interface");
  }

  @Test
  void readDeclarationCompiles() {
    CompilationResult result =
        new ContractCompiler().compile(reader.read(Fixtures.Character.class));

    assertThat(result).isInstanceOf(CompilationResult.Success.class);
    ContractModel model = ((CompilationResult.Success) result).model();
    assertThat(model.name()).isEqualTo("Character");
    assertThat(model.description()).isEqualTo("A character in the saga");
    assertThat(model.context()).isEqualTo(DATABASE);
    assertThat(model.fields())
        .extracting(FieldDefinition::name)
        .containsExactly("friends", "id", "displayName", "nickname");
    assertThat(model.fields().get(0).arguments())
        .containsExactly(
            new ArgumentDefinition.Context(DATABASE),
            new ArgumentDefinition.Regular("first", TypeRef.named("int"), "Page size", "10"));
    assertThat(model.implementers().get(0).downcast())
        .isEqualTo(new DowncastBinding.ByMethod("asHuman", false));
    assertThat(model.implementers().get(1).downcast()).isNull();
  }

  @Test
  void readOpenDeclarationCompiles() {
    CompilationResult.Success success =
        (CompilationResult.Success)
            new ContractCompiler().compile(reader.read(Fixtures.Node.class));

    assertThat(success.artifact()).isInstanceOf(DispatchArtifact.OpenDispatch.class);
    assertThat(success.artifact().name()).isEqualTo("AnyNode");
    assertThat(success.model().asyncAdaptation().async()).isTrue();
  }

  @Test
  void forcedAsyncGenericContractCompiles() {
    CompilationResult.Success success =
        (CompilationResult.Success)
            new ContractCompiler().compile(reader.read(Fixtures.Payload.class));

    assertThat(success.model().scalar()).isEqualTo(new ScalarParameterKind.ExplicitGeneric("T"));
    assertThat(success.model().asyncAdaptation().async()).isTrue();
  }

  @Test
  void staticMethodWithoutIgnoreIsMissingReceiver() {
    CompilationResult result = new ContractCompiler().compile(reader.read(Fixtures.Mutator.class));

    assertThat(result).isInstanceOf(CompilationResult.Failure.class);
    assertThat(((CompilationResult.Failure) result).diagnostics())
        .extracting(Diagnostic::kind)
        .containsExactly(DiagnosticKind.MISSING_RECEIVER);
  }

  private static MethodDeclaration method(ContractDeclaration declaration, String identifier) {
    return declaration.methods().stream()
        .filter(method -> method.identifier().equals(identifier))
        .findFirst()
        .orElseThrow();
  }
}
