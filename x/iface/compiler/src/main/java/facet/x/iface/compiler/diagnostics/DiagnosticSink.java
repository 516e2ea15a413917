package facet.x.iface.compiler.diagnostics;

import facet.x.iface.compiler.declaration.SourceSpan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of a single compilation. Each compile call owns its own sink, so
 * independent compilations never see each other's problems.
 */
public final class DiagnosticSink {

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public void report(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  public void error(DiagnosticKind kind, SourceSpan span, String message) {
    report(new Diagnostic(kind, span, message));
  }

  public void error(DiagnosticKind kind, SourceSpan span, String message, String note) {
    report(new Diagnostic(kind, span, message, List.of(note)));
  }

  /** Whether any problem was recorded; the compiler aborts the current phase if so. */
  public boolean hasErrors() {
    return !diagnostics.isEmpty();
  }

  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }
}
