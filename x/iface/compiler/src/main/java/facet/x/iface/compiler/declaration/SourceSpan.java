package facet.x.iface.compiler.declaration;

/**
 * Location of a declaration element, used to point diagnostics at the offending source.
 *
 * @param source the file or class the element comes from
 * @param line 1-based line, or 0 when unknown
 * @param column 1-based column, or 0 when unknown
 */
public record SourceSpan(String source, int line, int column) {

  private static final SourceSpan UNKNOWN = new SourceSpan("<unknown>", 0, 0);

  /** Span for synthesized elements that have no source location. */
  public static SourceSpan unknown() {
    return UNKNOWN;
  }

  /** Span pointing at a whole source without a line. */
  public static SourceSpan of(String source) {
    return new SourceSpan(source, 0, 0);
  }

  @Override
  public String toString() {
    if (line <= 0) {
      return source;
    }
    return column <= 0 ? source + ":" + line : source + ":" + line + ":" + column;
  }
}
