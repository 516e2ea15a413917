package facet.x.iface.compiler;

import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.model.AsyncAdaptation;
import facet.x.iface.compiler.model.Capability;
import java.util.List;

/**
 * Marks a contract asynchronous when it is forced to be or when any field method suspends. An
 * asynchronous contract whose fields include default-bodied asynchronous methods additionally
 * requires the {@link Capability#SHAREABLE} bound.
 */
public final class AsyncAdaptationMarker {

  /**
   * Computes the concurrency contract.
   *
   * @param forced whether the declaration is explicitly marked asynchronous
   * @param fieldMethods the methods backing the contract's fields
   * @return the adaptation
   */
  public AsyncAdaptation mark(boolean forced, List<MethodDeclaration> fieldMethods) {
    boolean async = forced || fieldMethods.stream().anyMatch(MethodDeclaration::async);
    if (!async) {
      return AsyncAdaptation.synchronous();
    }
    boolean hasDefaultAsync =
        fieldMethods.stream().anyMatch(method -> method.async() && method.defaultBody());
    return new AsyncAdaptation(true, hasDefaultAsync ? List.of(Capability.SHAREABLE) : List.of());
  }
}
