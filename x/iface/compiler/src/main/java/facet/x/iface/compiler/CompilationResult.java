package facet.x.iface.compiler;

import facet.x.iface.compiler.diagnostics.Diagnostic;
import facet.x.iface.compiler.model.ContractModel;
import facet.x.iface.compiler.model.DispatchArtifact;
import java.util.List;

/** Outcome of compiling one contract: a model and its dispatch artifact, or the diagnostics. */
public sealed interface CompilationResult {

  boolean isSuccess();

  /** A successful compilation. No diagnostics were recorded. */
  record Success(ContractModel model, DispatchArtifact artifact) implements CompilationResult {
    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  /** A failed compilation. No model is produced. */
  record Failure(List<Diagnostic> diagnostics) implements CompilationResult {
    public Failure {
      diagnostics = List.copyOf(diagnostics);
    }

    @Override
    public boolean isSuccess() {
      return false;
    }
  }
}
