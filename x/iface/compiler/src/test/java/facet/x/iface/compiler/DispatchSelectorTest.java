package facet.x.iface.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import facet.x.iface.compiler.declaration.AssociatedConstant;
import facet.x.iface.compiler.declaration.AssociatedType;
import facet.x.iface.compiler.declaration.ContractDeclaration;
import facet.x.iface.compiler.declaration.Directive;
import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.diagnostics.Diagnostic;
import facet.x.iface.compiler.diagnostics.DiagnosticKind;
import facet.x.iface.compiler.diagnostics.DiagnosticSink;
import facet.x.iface.compiler.directive.DispatchOption;
import facet.x.iface.compiler.directive.KeyValueDirectiveExtractor;
import facet.x.iface.compiler.model.DispatchArtifact;
import facet.x.iface.compiler.model.ImplementerDefinition;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DispatchSelectorTest {

  private static final TypeRef HUMAN = TypeRef.named("com.example.Human");
  private static final TypeRef DROID = TypeRef.named("com.example.Droid");

  private final DispatchSelector selector = new DispatchSelector();

  @Test
  void defaultsToClosedUnionNamedAfterContract() {
    DispatchArtifact artifact = selector.select(character(), null, implementers(HUMAN, DROID));

    assertThat(artifact).isInstanceOf(DispatchArtifact.ClosedDispatch.class);
    DispatchArtifact.ClosedDispatch closed = (DispatchArtifact.ClosedDispatch) artifact;
    assertThat(closed.name()).isEqualTo("CharacterValue");
    assertThat(closed.variants())
        .containsExactly(
            new DispatchArtifact.Variant("HUMAN", HUMAN),
            new DispatchArtifact.Variant("DROID", DROID));
  }

  @Test
  void closedUnionReexposesContractSurfaceWithoutDirectives() {
    DispatchArtifact.ClosedDispatch closed =
        (DispatchArtifact.ClosedDispatch)
            selector.select(character(), new DispatchOption(false, null), implementers(HUMAN));

    assertThat(closed.associatedTypes()).containsExactly(new AssociatedType("Id", List.of()));
    assertThat(closed.associatedConstants())
        .containsExactly(new AssociatedConstant("MAX_FRIENDS", TypeRef.named("int")));
    assertThat(closed.methods()).extracting(MethodDeclaration::identifier).containsExactly("name");
    assertThat(closed.methods()).allSatisfy(m -> assertThat(m.directives()).isEmpty());
  }

  @Test
  void closedUnionHonoursExplicitName() {
    DispatchArtifact artifact =
        selector.select(character(), new DispatchOption(false, "AnyCharacter"), List.of());

    assertThat(artifact.name()).isEqualTo("AnyCharacter");
  }

  @Test
  void openHandleDefaultsToDynPrefix() {
    DispatchArtifact artifact =
        selector.select(character(), new DispatchOption(true, null), implementers(HUMAN));

    assertThat(artifact).isInstanceOf(DispatchArtifact.OpenDispatch.class);
    DispatchArtifact.OpenDispatch open = (DispatchArtifact.OpenDispatch) artifact;
    assertThat(open.name()).isEqualTo("DynCharacter");
    assertThat(open.contractIdentifier()).isEqualTo("com.example.Character");
    assertThat(open.methods()).extracting(MethodDeclaration::identifier).containsExactly("name");
  }

  @Test
  void openHandleHonoursExplicitName() {
    DispatchArtifact artifact =
        selector.select(character(), new DispatchOption(true, "CharacterRef"), List.of());

    assertThat(artifact.name()).isEqualTo("CharacterRef");
  }

  @Test
  void variantTagsStayUniqueForSameSimpleName() {
    TypeRef otherHuman = TypeRef.named("com.example.legacy.Human");

    DispatchArtifact.ClosedDispatch closed =
        (DispatchArtifact.ClosedDispatch)
            selector.select(character(), null, implementers(HUMAN, otherHuman));

    assertThat(closed.variants())
        .extracting(DispatchArtifact.Variant::tag)
        .containsExactly("HUMAN", "COM_EXAMPLE_LEGACY_HUMAN");
  }

  @Test
  void reportsMethodsNamedLikeUnionMembers() {
    ContractDeclaration declaration =
        ContractDeclaration.builder("Entry")
            .method(method("dispatchKind"))
            .method(method("concreteTypeName"))
            .method(method("ofHuman"))
            .method(method("kind"))
            .build();
    DispatchArtifact artifact = selector.select(declaration, null, implementers(HUMAN));
    DiagnosticSink sink = new DiagnosticSink();

    selector.checkMemberNames(declaration, artifact, sink);

    assertThat(sink.diagnostics())
        .extracting(Diagnostic::kind)
        .containsOnly(DiagnosticKind.RESERVED_MEMBER_NAME);
    assertThat(sink.diagnostics())
        .extracting(Diagnostic::message)
        .containsExactly(
            "method `dispatchKind` clashes with a member generated on `EntryValue`",
            "method `concreteTypeName` clashes with a member generated on `EntryValue`",
            "method `ofHuman` clashes with a member generated on `EntryValue`");
  }

  @Test
  void reportsConstantsNamedLikeUnionFields() {
    ContractDeclaration declaration =
        ContractDeclaration.builder("Entry")
            .associatedConstant(new AssociatedConstant("dispatchValue", TypeRef.named("int")))
            .associatedConstant(new AssociatedConstant("value", TypeRef.named("int")))
            .build();
    DispatchArtifact artifact = selector.select(declaration, null, implementers(HUMAN));
    DiagnosticSink sink = new DiagnosticSink();

    selector.checkMemberNames(declaration, artifact, sink);

    assertThat(sink.diagnostics())
        .extracting(Diagnostic::message)
        .containsExactly("constant `dispatchValue` clashes with a field generated on `EntryValue`");
  }

  @Test
  void openHandleReservesOnlyItsOwnMembers() {
    ContractDeclaration declaration =
        ContractDeclaration.builder("Entry")
            .method(method("dispatchKind"))
            .method(method("dispatchValue"))
            .build();
    DispatchArtifact artifact =
        selector.select(declaration, new DispatchOption(true, null), implementers(HUMAN));
    DiagnosticSink sink = new DiagnosticSink();

    selector.checkMemberNames(declaration, artifact, sink);

    assertThat(sink.diagnostics())
        .singleElement()
        .extracting(Diagnostic::message)
        .isEqualTo("method `dispatchValue` clashes with a member generated on `DynEntry`");
  }

  private static MethodDeclaration method(String identifier) {
    return MethodDeclaration.builder(identifier).result(TypeRef.named("String")).build();
  }

  private static ContractDeclaration character() {
    return ContractDeclaration.builder("Character")
        .packageName("com.example")
        .method(
            MethodDeclaration.builder("name")
                .result(TypeRef.named("String"))
                .directive(
                    Directive.text(
                        KeyValueDirectiveExtractor.DESCRIPTION, "Name", SourceSpan.unknown()))
                .build())
        .associatedType(new AssociatedType("Id", List.of()))
        .associatedConstant(new AssociatedConstant("MAX_FRIENDS", TypeRef.named("int")))
        .build();
  }

  private static List<ImplementerDefinition> implementers(TypeRef... types) {
    return Arrays.stream(types)
        .map(type -> ImplementerDefinition.unbound(type, SourceSpan.unknown()))
        .toList();
  }
}
