package facet.x.iface.compiler.directive;

import facet.x.iface.compiler.declaration.SourceSpan;

/** A directive value together with the location it was written at. */
public record Spanned<T>(T value, SourceSpan span) {}
