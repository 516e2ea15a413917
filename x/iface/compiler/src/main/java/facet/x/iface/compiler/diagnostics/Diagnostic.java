package facet.x.iface.compiler.diagnostics;

import facet.x.iface.compiler.declaration.SourceSpan;
import java.util.List;

/**
 * A compile-time problem found in a contract declaration.
 *
 * @param kind the category of the problem
 * @param span the location of the offending element
 * @param message human-readable explanation
 * @param notes additional hints, e.g. how to resolve a conflict
 */
public record Diagnostic(DiagnosticKind kind, SourceSpan span, String message, List<String> notes) {

  public Diagnostic {
    notes = List.copyOf(notes);
  }

  public Diagnostic(DiagnosticKind kind, SourceSpan span, String message) {
    this(kind, span, message, List.of());
  }

  /** Renders the diagnostic as {@code location: error: message}, followed by its notes. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    sb.append(span).append(": error: ").append(message);
    for (String note : notes) {
      sb.append(System.lineSeparator()).append("  = note: ").append(note);
    }
    return sb.toString();
  }
}
