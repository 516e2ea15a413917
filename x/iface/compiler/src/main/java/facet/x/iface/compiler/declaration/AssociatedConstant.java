package facet.x.iface.compiler.declaration;

/** A constant declared by a contract. */
public record AssociatedConstant(String identifier, TypeRef type) {}
