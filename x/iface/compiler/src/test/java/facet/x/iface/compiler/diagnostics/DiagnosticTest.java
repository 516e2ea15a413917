package facet.x.iface.compiler.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;

import facet.x.iface.compiler.declaration.SourceSpan;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticTest {

  private static final SourceSpan SPAN = new SourceSpan("Character.java", 12, 5);

  @Test
  void formatsLocationAndMessage() {
    Diagnostic diagnostic =
        new Diagnostic(
            DiagnosticKind.MISSING_RECEIVER, SPAN, "method `create` must be an instance method");

    assertThat(diagnostic.format())
        .isEqualTo("Character.java:12:5: error: method `create` must be an instance method");
  }

  @Test
  void formatsNotesOnTheirOwnLines() {
    Diagnostic diagnostic =
        new Diagnostic(
            DiagnosticKind.DUPLICATE_DOWNCAST_BINDING,
            SPAN,
            "conflict",
            List.of("use the `ignore` directive"));

    assertThat(diagnostic.format())
        .isEqualTo(
            "Character.java:12:5: error: conflict"
                + System.lineSeparator()
                + "  = note: use the `ignore` directive");
  }

  @Test
  void sinkKeepsDiagnosticsInReportOrder() {
    DiagnosticSink sink = new DiagnosticSink();
    assertThat(sink.hasErrors()).isFalse();

    sink.error(DiagnosticKind.RESERVED_NAME_PREFIX, SPAN, "first");
    sink.error(DiagnosticKind.MALFORMED_ARGUMENT_PATTERN, SPAN, "second", "a note");

    assertThat(sink.hasErrors()).isTrue();
    assertThat(sink.diagnostics())
        .extracting(Diagnostic::message)
        .containsExactly("first", "second");
    assertThat(sink.diagnostics().get(1).notes()).containsExactly("a note");
  }
}
