package facet.x.iface.compiler.model;

import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;
import org.jspecify.annotations.Nullable;

/**
 * A concrete type implementing the interface.
 *
 * @param type the implementer type
 * @param downcast how to narrow to this implementer, if declared
 * @param contextType the context type the downcast method takes, if any
 * @param span where the implementer is declared
 */
public record ImplementerDefinition(
    TypeRef type,
    @Nullable DowncastBinding downcast,
    @Nullable TypeRef contextType,
    SourceSpan span) {

  public static ImplementerDefinition unbound(TypeRef type, SourceSpan span) {
    return new ImplementerDefinition(type, null, null, span);
  }

  public ImplementerDefinition withDowncast(
      DowncastBinding downcast, @Nullable TypeRef contextType) {
    return new ImplementerDefinition(type, downcast, contextType, span);
  }

  /** The implementer's simple name, which is also its GraphQL object type name. */
  public String simpleName() {
    TypeRef target = TypeRef.unreferenced(type);
    if (target instanceof TypeRef.Named named) {
      return named.simpleName();
    }
    return target.render();
  }
}
