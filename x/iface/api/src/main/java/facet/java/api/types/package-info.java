/**
 * Runtime types referenced by generated dispatch code.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package facet.java.api.types;

import org.jspecify.annotations.NullMarked;
