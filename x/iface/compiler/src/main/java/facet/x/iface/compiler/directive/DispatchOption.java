package facet.x.iface.compiler.directive;

import org.jspecify.annotations.Nullable;

/**
 * The requested dispatch representation.
 *
 * @param open true for open dispatch, false for a closed union
 * @param artifactName the requested name of the dispatch type, or null to derive one
 */
public record DispatchOption(boolean open, @Nullable String artifactName) {}
