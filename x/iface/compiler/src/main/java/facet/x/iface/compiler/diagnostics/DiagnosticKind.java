package facet.x.iface.compiler.diagnostics;

/** Categories of problems reported while compiling a contract. */
public enum DiagnosticKind {
  DIRECTIVE_PARSE_FAILURE,
  INVALID_RECEIVER_SHAPE,
  MISSING_RECEIVER,
  RESERVED_NAME_PREFIX,
  NON_IMPLEMENTER_DOWNCAST_TARGET,
  DUPLICATE_DOWNCAST_BINDING,
  DISALLOWED_DIRECTIVE_COMBINATION,
  MALFORMED_ARGUMENT_PATTERN,
  INVALID_DOWNCAST_SIGNATURE,
  UNSUPPORTED_ASYNC_DOWNCAST,
  DUPLICATE_SPECIAL_ARGUMENT,
  RESERVED_MEMBER_NAME
}
