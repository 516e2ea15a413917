package facet.x.iface.compiler.generator;

import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.ParameterDeclaration;
import facet.x.iface.compiler.declaration.Receiver;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.model.Capability;
import facet.x.iface.compiler.model.ContractModel;
import facet.x.iface.compiler.model.FieldDefinition;
import facet.x.iface.compiler.model.ScalarParameterKind;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Template model shared by both dispatch shapes: naming, type parameters threaded with the scalar
 * parameter, and the delegating methods.
 *
 * <p>Fields of an asynchronous contract are rendered with a {@code CompletableFuture} result
 * whether or not the implementer's method suspends, so callers can treat every field alike.
 */
public abstract class DispatchView {

  private static final String SCALAR_BOUND = " extends ScalarValue";

  protected final ContractModel model;
  private final String packageName;

  protected DispatchView(ContractModel model, String packageName) {
    this.model = model;
    this.packageName = packageName;
  }

  /** Statements of an instance method body that forwards the given call. */
  protected abstract List<String> forward(Call call);

  /** The delegating methods, in contract order. */
  public abstract List<MethodView> getMethods();

  // ST (StringTemplate) requires JavaBean-style getters
  public String getPackageName() {
    return packageName;
  }

  public boolean getHasPackage() {
    return !packageName.isEmpty();
  }

  public String getClassName() {
    return model.artifactName();
  }

  public String getClassModifier() {
    return model.visibility().modifier();
  }

  public String getContractIdentifier() {
    return model.identifier();
  }

  public String getGraphqlName() {
    return model.name();
  }

  public @Nullable String getDescription() {
    return model.description();
  }

  public boolean getHasDescription() {
    return model.description() != null && !model.description().isEmpty();
  }

  public boolean getAsync() {
    return model.asyncAdaptation().async();
  }

  /** The class's type parameter clause, e.g. {@code <S extends ScalarValue>}, or empty. */
  public String getTypeParameters() {
    List<String> parameters = new ArrayList<>();
    ScalarParameterKind scalar = model.scalar();
    for (String parameter : model.genericParameters()) {
      boolean bound =
          scalar instanceof ScalarParameterKind.ExplicitGeneric explicit
              && explicit.parameter().equals(parameter);
      parameters.add(bound ? parameter + SCALAR_BOUND : parameter);
    }
    if (scalar instanceof ScalarParameterKind.ImplicitGeneric implicit) {
      parameters.add(implicit.parameter() + SCALAR_BOUND);
    }
    return parameters.isEmpty() ? "" : "<" + String.join(", ", parameters) + ">";
  }

  /** The class's type arguments, e.g. {@code <S>}, or empty. */
  public String getTypeArguments() {
    List<String> arguments = new ArrayList<>(model.genericParameters());
    if (model.scalar() instanceof ScalarParameterKind.ImplicitGeneric implicit) {
      arguments.add(implicit.parameter());
    }
    return arguments.isEmpty() ? "" : "<" + String.join(", ", arguments) + ">";
  }

  /** The diamond to use when instantiating the class. */
  public String getDiamond() {
    return getTypeArguments().isEmpty() ? "" : "<>";
  }

  /** Type parameters for static generic methods, followed by a space, or empty. */
  public String getGenericPrefix() {
    String parameters = getTypeParameters();
    return parameters.isEmpty() ? "" : parameters + " ";
  }

  /** The type argument passed as the scalar representation. */
  public String getScalarType() {
    ScalarParameterKind scalar = model.scalar();
    if (scalar instanceof ScalarParameterKind.Concrete concrete) {
      return JavaTypeRenderer.render(concrete.type());
    }
    if (scalar instanceof ScalarParameterKind.ExplicitGeneric explicit) {
      return explicit.parameter();
    }
    return ((ScalarParameterKind.ImplicitGeneric) scalar).parameter();
  }

  /** The default scalar type callers get for a synthesized parameter, or empty. */
  public String getDefaultScalarType() {
    if (model.scalar() instanceof ScalarParameterKind.ImplicitGeneric implicit) {
      return JavaTypeRenderer.render(implicit.defaultType());
    }
    return "";
  }

  public boolean getHasDefaultScalarType() {
    return !getDefaultScalarType().isEmpty();
  }

  public String getInterfacesClause() {
    StringBuilder sb =
        new StringBuilder("GraphQLInterfaceValue<").append(getScalarType()).append('>');
    if (model.asyncAdaptation().requires(Capability.SHAREABLE)) {
      sb.append(", Shareable");
    }
    return sb.toString();
  }

  public boolean getShareable() {
    return model.asyncAdaptation().requires(Capability.SHAREABLE);
  }

  /** The contract type with its type arguments, e.g. {@code com.example.Character<T>}. */
  protected String contractType() {
    if (model.genericParameters().isEmpty()) {
      return model.identifier();
    }
    return model.identifier() + "<" + String.join(", ", model.genericParameters()) + ">";
  }

  /** Builds the delegating views of the given methods. */
  protected List<MethodView> methodViews(List<MethodDeclaration> methods) {
    List<MethodView> views = new ArrayList<>();
    for (MethodDeclaration method : methods) {
      views.add(methodView(method));
    }
    return views;
  }

  private MethodView methodView(MethodDeclaration method) {
    FieldDefinition field = fieldFor(method);
    boolean adaptAsync = field != null && getAsync();

    List<String> parameters = new ArrayList<>();
    List<String> arguments = new ArrayList<>();
    for (int i = 0; i < method.parameters().size(); i++) {
      ParameterDeclaration parameter = method.parameters().get(i);
      String name = parameter.identifier() != null ? parameter.identifier() : "arg" + i;
      parameters.add(JavaTypeRenderer.render(parameter.type()) + " " + name);
      arguments.add(name);
    }
    String invocation = method.identifier() + "(" + String.join(", ", arguments) + ")";

    TypeRef declaredResult = method.result() == null ? TypeRef.named("void") : method.result();
    boolean returnsVoid = JavaTypeRenderer.isVoid(declaredResult);
    String returnType;
    Call call;
    if (adaptAsync) {
      returnType = "CompletableFuture<" + JavaTypeRenderer.boxed(field.type()) + ">";
      if (method.async()) {
        call = new Call(target -> target + "." + invocation + ".toCompletableFuture()", true, null);
      } else if (returnsVoid) {
        call =
            new Call(
                target -> target + "." + invocation,
                false,
                "return CompletableFuture.completedFuture(null);");
      } else {
        call =
            new Call(
                target -> "CompletableFuture.completedFuture(" + target + "." + invocation + ")",
                true,
                null);
      }
    } else {
      returnType = JavaTypeRenderer.render(declaredResult);
      call = new Call(target -> target + "." + invocation, !returnsVoid, null);
    }

    String parameterList = String.join(", ", parameters);
    if (method.receiver() == Receiver.NONE) {
      String signature =
          "public static " + returnType + " " + method.identifier() + "(" + parameterList + ")";
      return new MethodView(method.identifier(), signature, call.statements(model.identifier()));
    }
    String signature =
        "public " + returnType + " " + method.identifier() + "(" + parameterList + ")";
    return new MethodView(method.identifier(), signature, forward(call));
  }

  private @Nullable FieldDefinition fieldFor(MethodDeclaration method) {
    if (method.receiver() == Receiver.NONE) {
      return null;
    }
    for (FieldDefinition field : model.fields()) {
      if (field.methodIdentifier().equals(method.identifier())) {
        return field;
      }
    }
    return null;
  }

  /**
   * A forwarded call.
   *
   * @param expression builds the call expression on a given target
   * @param producesValue whether the expression is the method's return value
   * @param trailer a statement to run after the call, if any
   */
  protected record Call(
      Function<String, String> expression, boolean producesValue, @Nullable String trailer) {

    /** The call on the given target as a single statement. */
    String statement(String target) {
      String expr = expression.apply(target);
      return producesValue ? "return " + expr + ";" : expr + ";";
    }

    List<String> statements(String target) {
      List<String> statements = new ArrayList<>();
      statements.add(statement(target));
      if (trailer != null) {
        statements.add(trailer);
      }
      return statements;
    }
  }
}
