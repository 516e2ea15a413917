package facet.x.iface.compiler;

import facet.x.iface.compiler.declaration.ContractDeclaration;
import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.diagnostics.Diagnostic;
import facet.x.iface.compiler.diagnostics.DiagnosticKind;
import facet.x.iface.compiler.diagnostics.DiagnosticSink;
import facet.x.iface.compiler.directive.ContractOptions;
import facet.x.iface.compiler.directive.DirectiveExtractor;
import facet.x.iface.compiler.directive.DirectiveParseException;
import facet.x.iface.compiler.directive.KeyValueDirectiveExtractor;
import facet.x.iface.compiler.model.ArgumentDefinition;
import facet.x.iface.compiler.model.AsyncAdaptation;
import facet.x.iface.compiler.model.ContractModel;
import facet.x.iface.compiler.model.DispatchArtifact;
import facet.x.iface.compiler.model.FieldDefinition;
import facet.x.iface.compiler.model.ImplementerDefinition;
import facet.x.iface.compiler.model.ScalarParameterKind;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a contract declaration into a {@link ContractModel} and a {@link DispatchArtifact}.
 *
 * <p>Stages run in order: declaration options, implementer registry with external downcasts,
 * method classification with method downcasts, then scalar parameter, async adaptation and
 * dispatch selection. Diagnostics are collected in a sink owned by the {@link #compile} call;
 * after the options, the implementer, the method and the dispatch phases the compilation stops if
 * anything was reported, so no partially valid model is ever returned.
 *
 * <p>Instances hold no per-compilation state and can be shared.
 */
public class ContractCompiler {

  private static final Logger log = LoggerFactory.getLogger(ContractCompiler.class);

  private final DirectiveExtractor extractor;
  private final ScalarParameterResolver scalarResolver = new ScalarParameterResolver();
  private final DispatchSelector dispatchSelector = new DispatchSelector();
  private final AsyncAdaptationMarker asyncMarker = new AsyncAdaptationMarker();

  public ContractCompiler() {
    this(new KeyValueDirectiveExtractor());
  }

  public ContractCompiler(DirectiveExtractor extractor) {
    this.extractor = extractor;
  }

  /**
   * Compiles a contract.
   *
   * @param declaration the contract declaration
   * @return the model and artifact, or every diagnostic found
   */
  public CompilationResult compile(ContractDeclaration declaration) {
    log.debug("Compiling interface contract {}", declaration.qualifiedIdentifier());
    DiagnosticSink sink = new DiagnosticSink();

    ContractOptions options;
    try {
      options = extractor.contractOptions(declaration);
    } catch (DirectiveParseException e) {
      sink.error(DiagnosticKind.DIRECTIVE_PARSE_FAILURE, e.getSpan(), e.getMessage());
      return abort(declaration, sink);
    }

    String name = options.name() != null ? options.name().value() : declaration.identifier();
    if (!options.internal() && Names.isReserved(name)) {
      sink.error(
          DiagnosticKind.RESERVED_NAME_PREFIX,
          options.name() != null ? options.name().span() : declaration.span(),
          Names.reservedNameMessage(name));
    }

    ImplementerResolver implementerResolver = new ImplementerResolver(sink);
    implementerResolver.seed(options.implementers());
    implementerResolver.applyExternal(options.externalDowncasts());
    if (sink.hasErrors()) {
      return abort(declaration, sink);
    }

    MethodClassifier classifier = new MethodClassifier(extractor, sink, options.internal());
    List<FieldDefinition> fields = new ArrayList<>();
    List<MethodDeclaration> fieldMethods = new ArrayList<>();
    List<MethodClassifier.ClassifiedMethod> classifiedMethods =
        classifier.classify(declaration.methods());
    for (MethodClassifier.ClassifiedMethod classified : classifiedMethods) {
      if (classified instanceof MethodClassifier.Field field) {
        fields.add(field.definition());
        fieldMethods.add(field.method());
      } else if (classified instanceof MethodClassifier.Downcast downcast) {
        implementerResolver.applyMethod(downcast);
      }
    }
    if (sink.hasErrors()) {
      return abort(declaration, sink);
    }

    List<ImplementerDefinition> implementers = implementerResolver.implementers();
    ScalarParameterKind scalar =
        scalarResolver.resolve(options.scalar(), declaration.genericParameters());
    AsyncAdaptation asyncAdaptation = asyncMarker.mark(options.async(), fieldMethods);
    DispatchArtifact artifact =
        dispatchSelector.select(
            declaration,
            options.dispatch() == null ? null : options.dispatch().value(),
            implementers);
    dispatchSelector.checkMemberNames(declaration, artifact, sink);
    if (sink.hasErrors()) {
      return abort(declaration, sink);
    }

    ContractModel model =
        new ContractModel(
            name,
            declaration.qualifiedIdentifier(),
            artifact.name(),
            declaration.visibility(),
            options.description() == null ? null : options.description().value(),
            resolveContext(options, fields, implementers),
            scalar,
            declaration.genericParameters(),
            fields,
            implementers,
            asyncAdaptation);

    log.debug(
        "Compiled interface {} with {} fields and {} implementers into {}",
        model.name(),
        fields.size(),
        implementers.size(),
        artifact.getClass().getSimpleName());
    return new CompilationResult.Success(model, artifact);
  }

  /**
   * The context type: the explicit option, else the first context argument of any field, else
   * the context taken by the first context-consuming downcast method.
   */
  private static @Nullable TypeRef resolveContext(
      ContractOptions options,
      List<FieldDefinition> fields,
      List<ImplementerDefinition> implementers) {
    if (options.context() != null) {
      return options.context().value();
    }
    for (FieldDefinition field : fields) {
      for (ArgumentDefinition argument : field.arguments()) {
        if (argument instanceof ArgumentDefinition.Context context) {
          return context.type();
        }
      }
    }
    for (ImplementerDefinition implementer : implementers) {
      if (implementer.contextType() != null) {
        return implementer.contextType();
      }
    }
    return null;
  }

  private static CompilationResult abort(ContractDeclaration declaration, DiagnosticSink sink) {
    List<Diagnostic> diagnostics = sink.diagnostics();
    log.warn(
        "Compilation of interface contract {} failed with {} diagnostic(s)",
        declaration.qualifiedIdentifier(),
        diagnostics.size());
    for (Diagnostic diagnostic : diagnostics) {
      log.warn("{}", diagnostic.format());
    }
    return new CompilationResult.Failure(diagnostics);
  }
}
