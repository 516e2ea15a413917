package facet.x.iface.compiler;

import facet.x.iface.compiler.diagnostics.Diagnostic;
import java.util.List;
import java.util.stream.Collectors;

/** Thrown by {@link InterfaceCodegen} when a contract does not compile. */
public class ContractCompilationException extends RuntimeException {

  private final String contract;
  private final List<Diagnostic> diagnostics;

  public ContractCompilationException(String contract, List<Diagnostic> diagnostics) {
    super(message(contract, diagnostics));
    this.contract = contract;
    this.diagnostics = List.copyOf(diagnostics);
  }

  /** The qualified name of the contract that failed. */
  public String getContract() {
    return contract;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  private static String message(String contract, List<Diagnostic> diagnostics) {
    return "Interface contract "
        + contract
        + " failed to compile:\n"
        + diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining("\n"));
  }
}
