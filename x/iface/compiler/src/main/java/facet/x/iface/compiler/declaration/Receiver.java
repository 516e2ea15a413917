package facet.x.iface.compiler.declaration;

/** How a contract method receives the value it is called on. */
public enum Receiver {
  /** An immutable borrowed receiver; the only shape allowed on fields and downcasts. */
  SHARED_REFERENCE,
  MUTABLE_REFERENCE,
  /** The method consumes the value. */
  OWNED,
  /** No receiver at all, e.g. a static method. */
  NONE
}
