/**
 * Execution handles injected into contract field methods.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package facet.java.api.context;

import org.jspecify.annotations.NullMarked;
