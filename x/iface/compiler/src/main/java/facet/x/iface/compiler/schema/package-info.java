/** Schema contribution of compiled interfaces, expressed as graphql-java types. */
@NullMarked
package facet.x.iface.compiler.schema;

import org.jspecify.annotations.NullMarked;
