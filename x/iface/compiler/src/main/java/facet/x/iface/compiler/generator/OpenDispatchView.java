package facet.x.iface.compiler.generator;

import facet.x.iface.compiler.model.ContractModel;
import facet.x.iface.compiler.model.DispatchArtifact;
import facet.x.iface.compiler.model.DowncastBinding;
import facet.x.iface.compiler.model.ImplementerDefinition;
import java.util.ArrayList;
import java.util.List;

/** Template model for an open dispatch handle wrapping any implementation of the contract. */
public final class OpenDispatchView extends DispatchView {

  private static final String DELEGATE = "delegate";

  private final DispatchArtifact.OpenDispatch artifact;

  public OpenDispatchView(
      ContractModel model, DispatchArtifact.OpenDispatch artifact, String packageName) {
    super(model, packageName);
    this.artifact = artifact;
  }

  @Override
  protected List<String> forward(Call call) {
    // Qualified with this, since a contract parameter may share the field's name
    return call.statements("this." + DELEGATE);
  }

  @Override
  public String getClassName() {
    return artifact.name();
  }

  @Override
  public List<MethodView> getMethods() {
    return methodViews(artifact.methods());
  }

  public String getDelegateType() {
    return contractType();
  }

  public boolean getHasContext() {
    return model.context() != null;
  }

  public String getContextType() {
    return model.context() == null ? "" : JavaTypeRenderer.render(model.context());
  }

  /** Resolution lines usable without a context value. */
  public List<String> getConcreteTypeNameBody() {
    List<String> lines = new ArrayList<>();
    for (ImplementerDefinition implementer : model.implementers()) {
      lines.add("if (" + test(implementer, false) + ") {");
      lines.add("    return \"" + implementer.simpleName() + "\";");
      lines.add("}");
    }
    lines.add(unresolved());
    return lines;
  }

  /** Resolution lines that may pass the context value to downcast functions. */
  public List<String> getContextualConcreteTypeNameBody() {
    List<String> lines = new ArrayList<>();
    for (ImplementerDefinition implementer : model.implementers()) {
      lines.add("if (" + test(implementer, true) + ") {");
      lines.add("    return \"" + implementer.simpleName() + "\";");
      lines.add("}");
    }
    lines.add(unresolved());
    return lines;
  }

  private String test(ImplementerDefinition implementer, boolean withContext) {
    DowncastBinding downcast = implementer.downcast();
    if (downcast instanceof DowncastBinding.ByMethod byMethod) {
      if (!byMethod.withContext()) {
        return DELEGATE + "." + byMethod.methodIdentifier() + "().isPresent()";
      }
      if (withContext) {
        return DELEGATE + "." + byMethod.methodIdentifier() + "(context).isPresent()";
      }
    } else if (downcast instanceof DowncastBinding.ByExternalFunction external) {
      String function = external.function().replace("::", ".");
      if (getHasContext() && withContext) {
        return function + "(" + DELEGATE + ", context).isPresent()";
      }
      if (!getHasContext()) {
        return function + "(" + DELEGATE + ").isPresent()";
      }
    }
    return DELEGATE + " instanceof " + JavaTypeRenderer.render(implementer.type());
  }

  private String unresolved() {
    return "throw new IllegalStateException(\"no implementer of "
        + model.name()
        + " matches \" + "
        + DELEGATE
        + ".getClass().getName());";
  }
}
