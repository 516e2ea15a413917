package facet.x.iface.compiler.generator;

import facet.x.iface.compiler.declaration.AssociatedConstant;
import facet.x.iface.compiler.declaration.AssociatedType;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.model.ContractModel;
import facet.x.iface.compiler.model.DispatchArtifact;
import java.util.ArrayList;
import java.util.List;

/** Template model for a closed tagged union over the declared implementers. */
public final class ClosedDispatchView extends DispatchView {

  private final DispatchArtifact.ClosedDispatch artifact;

  public ClosedDispatchView(
      ContractModel model, DispatchArtifact.ClosedDispatch artifact, String packageName) {
    super(model, packageName);
    this.artifact = artifact;
  }

  @Override
  public String getClassName() {
    return artifact.name();
  }

  @Override
  public List<MethodView> getMethods() {
    return methodViews(artifact.methods());
  }

  @Override
  protected List<String> forward(Call call) {
    if (artifact.variants().isEmpty()) {
      return List.of(noVariants());
    }
    // Qualified with this, since a contract parameter may share the field's name
    String kind = "this." + DispatchArtifact.ClosedDispatch.KIND_ACCESSOR;
    List<String> lines = new ArrayList<>();
    lines.add(call.producesValue() ? "return switch (" + kind + ") {" : "switch (" + kind + ") {");
    for (VariantView variant : getVariants()) {
      String target =
          "((" + variant.getJavaType() + ") this." + DispatchArtifact.VALUE_ACCESSOR + ")";
      lines.add("    case " + variant.getTag() + " -> " + call.expression().apply(target) + ";");
    }
    lines.add(call.producesValue() ? "};" : "}");
    if (call.trailer() != null) {
      lines.add(call.trailer());
    }
    return lines;
  }

  public List<VariantView> getVariants() {
    List<VariantView> variants = new ArrayList<>();
    for (DispatchArtifact.Variant variant : artifact.variants()) {
      variants.add(new VariantView(variant));
    }
    return variants;
  }

  public boolean getHasVariants() {
    return !artifact.variants().isEmpty();
  }

  public String getTags() {
    List<String> tags = new ArrayList<>();
    for (DispatchArtifact.Variant variant : artifact.variants()) {
      tags.add(variant.tag());
    }
    return String.join(", ", tags);
  }

  public List<String> getConcreteTypeNameBody() {
    if (artifact.variants().isEmpty()) {
      return List.of(noVariants());
    }
    List<String> lines = new ArrayList<>();
    lines.add("return switch (" + DispatchArtifact.ClosedDispatch.KIND_ACCESSOR + ") {");
    for (VariantView variant : getVariants()) {
      lines.add("    case " + variant.getTag() + " -> \"" + variant.getGraphqlName() + "\";");
    }
    lines.add("};");
    return lines;
  }

  public List<String> getConstants() {
    List<String> constants = new ArrayList<>();
    for (AssociatedConstant constant : artifact.associatedConstants()) {
      constants.add(
          "public static final "
              + JavaTypeRenderer.render(constant.type())
              + " "
              + constant.identifier()
              + " = "
              + model.identifier()
              + "."
              + constant.identifier()
              + ";");
    }
    return constants;
  }

  public boolean getHasConstants() {
    return !artifact.associatedConstants().isEmpty();
  }

  /** Names of the contract's nested types, mentioned in the union's documentation. */
  public List<String> getAssociatedTypes() {
    List<String> types = new ArrayList<>();
    for (AssociatedType type : artifact.associatedTypes()) {
      types.add(model.identifier() + "." + type.identifier());
    }
    return types;
  }

  public boolean getHasAssociatedTypes() {
    return !artifact.associatedTypes().isEmpty();
  }

  private String noVariants() {
    return "throw new IllegalStateException(\"" + model.name() + " has no implementers\");";
  }

  /** One variant of the union. */
  public static final class VariantView {

    private final DispatchArtifact.Variant variant;

    VariantView(DispatchArtifact.Variant variant) {
      this.variant = variant;
    }

    public String getTag() {
      return variant.tag();
    }

    public String getJavaType() {
      return JavaTypeRenderer.render(variant.implementer());
    }

    public String getGraphqlName() {
      TypeRef target = TypeRef.unreferenced(variant.implementer());
      return target instanceof TypeRef.Named named ? named.simpleName() : target.render();
    }

    public String getFactoryName() {
      return variant.factoryName();
    }
  }
}
