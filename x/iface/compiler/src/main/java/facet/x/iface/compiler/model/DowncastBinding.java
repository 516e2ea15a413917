package facet.x.iface.compiler.model;

/** How a dispatch value is narrowed to one particular implementer. */
public sealed interface DowncastBinding {

  /**
   * A downcast method declared on the contract.
   *
   * @param methodIdentifier the method name
   * @param withContext whether the method takes the context value
   */
  record ByMethod(String methodIdentifier, boolean withContext) implements DowncastBinding {}

  /**
   * A static function declared on the contract with an external downcast directive.
   *
   * @param function the function reference, {@code Owner::method}
   */
  record ByExternalFunction(String function) implements DowncastBinding {}
}
