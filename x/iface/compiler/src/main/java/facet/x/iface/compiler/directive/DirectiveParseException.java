package facet.x.iface.compiler.directive;

import facet.x.iface.compiler.declaration.SourceSpan;

/** Thrown by a {@link DirectiveExtractor} when directives cannot be turned into options. */
public class DirectiveParseException extends Exception {

  private final SourceSpan span;

  public DirectiveParseException(SourceSpan span, String message) {
    super(message);
    this.span = span;
  }

  /** Location of the directive that failed to parse. */
  public SourceSpan getSpan() {
    return span;
  }
}
