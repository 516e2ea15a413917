package facet.x.iface.compiler.model;

import java.util.List;

/**
 * Concurrency contract of the generated dispatch type.
 *
 * @param async whether every field call returns a suspendable result
 * @param capabilities capability bounds attached to the dispatch type
 */
public record AsyncAdaptation(boolean async, List<Capability> capabilities) {

  public AsyncAdaptation {
    capabilities = List.copyOf(capabilities);
  }

  public static AsyncAdaptation synchronous() {
    return new AsyncAdaptation(false, List.of());
  }

  public boolean requires(Capability capability) {
    return capabilities.contains(capability);
  }
}
