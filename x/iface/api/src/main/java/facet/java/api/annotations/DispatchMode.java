package facet.java.api.annotations;

/** The two dispatch representations a contract can be compiled into. */
public enum DispatchMode {
  /** A wrapper over any implementation of the contract. Membership is not fixed. */
  OPEN,
  /** A tagged value with exactly one variant per declared implementer. */
  CLOSED
}
