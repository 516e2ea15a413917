package facet.x.iface.compiler.model;

import org.jspecify.annotations.Nullable;

/** Marks a field deprecated, optionally with a reason. */
public record Deprecation(@Nullable String reason) {}
