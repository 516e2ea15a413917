package facet.x.iface.compiler.model;

/** Extra capability bounds a generated dispatch type has to carry. */
public enum Capability {
  /** Safe to call from several concurrent call sites. */
  SHAREABLE
}
