package facet.x.iface.compiler.declaration;

/** Visibility of a contract, carried over to its generated dispatch type. */
public enum Visibility {
  PUBLIC("public "),
  PACKAGE_PRIVATE("");

  private final String modifier;

  Visibility(String modifier) {
    this.modifier = modifier;
  }

  /** The Java modifier, followed by a space when non-empty. */
  public String modifier() {
    return modifier;
  }
}
