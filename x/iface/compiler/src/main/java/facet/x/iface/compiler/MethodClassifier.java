package facet.x.iface.compiler;

import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.ParameterDeclaration;
import facet.x.iface.compiler.declaration.Receiver;
import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.diagnostics.DiagnosticKind;
import facet.x.iface.compiler.diagnostics.DiagnosticSink;
import facet.x.iface.compiler.directive.DirectiveExtractor;
import facet.x.iface.compiler.directive.DirectiveParseException;
import facet.x.iface.compiler.directive.MethodOptions;
import facet.x.iface.compiler.model.ArgumentDefinition;
import facet.x.iface.compiler.model.Deprecation;
import facet.x.iface.compiler.model.DowncastBinding;
import facet.x.iface.compiler.model.FieldDefinition;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decides for every contract method whether it is ignored, a field, or a downcast to an
 * implementer, and validates its shape.
 *
 * <p>Invalid methods are reported to the sink and dropped, so a single pass surfaces every
 * independent problem.
 */
public final class MethodClassifier {

  static final String DOWNCAST_RESULT_MESSAGE =
      "expects method return type to be `Optional<ImplementerType>` only";
  static final String DOWNCAST_PARAMETERS_MESSAGE =
      "expects an instance method accepting nothing but, optionally, the context";

  /** A method that survived classification. */
  public sealed interface ClassifiedMethod {
    MethodDeclaration method();
  }

  /** A method compiled into a field. */
  public record Field(FieldDefinition definition, MethodDeclaration method)
      implements ClassifiedMethod {}

  /**
   * A method compiled into a downcast.
   *
   * @param implementer the implementer type the method narrows to
   * @param binding the method binding
   * @param contextType the context type the method takes, if any
   * @param method the method
   */
  public record Downcast(
      TypeRef implementer,
      DowncastBinding.ByMethod binding,
      @Nullable TypeRef contextType,
      MethodDeclaration method)
      implements ClassifiedMethod {}

  private final DirectiveExtractor extractor;
  private final ArgumentRoleResolver argumentResolver;
  private final DiagnosticSink sink;
  private final boolean internal;

  public MethodClassifier(DirectiveExtractor extractor, DiagnosticSink sink, boolean internal) {
    this.extractor = extractor;
    this.argumentResolver = new ArgumentRoleResolver(extractor, sink, internal);
    this.sink = sink;
    this.internal = internal;
  }

  /**
   * Classifies the given methods, in order. Ignored and invalid methods are left out.
   *
   * @param methods the contract's methods
   * @return the fields and downcasts
   */
  public List<ClassifiedMethod> classify(List<MethodDeclaration> methods) {
    List<ClassifiedMethod> classified = new ArrayList<>();
    for (MethodDeclaration method : methods) {
      ClassifiedMethod result = classify(method);
      if (result != null) {
        classified.add(result);
      }
    }
    return classified;
  }

  /**
   * Classifies a single method.
   *
   * @param method the method
   * @return the field or downcast, or null if the method is ignored or invalid
   */
  public @Nullable ClassifiedMethod classify(MethodDeclaration method) {
    MethodOptions options;
    try {
      options = extractor.methodOptions(method);
    } catch (DirectiveParseException e) {
      sink.error(DiagnosticKind.DIRECTIVE_PARSE_FAILURE, e.getSpan(), e.getMessage());
      return null;
    }

    if (options.ignore()) {
      return null;
    }
    if (options.downcast()) {
      return parseDowncast(method);
    }
    return parseField(method, options);
  }

  private @Nullable Downcast parseDowncast(MethodDeclaration method) {
    TypeRef implementer = downcastTarget(method.result());
    if (implementer == null) {
      sink.error(DiagnosticKind.INVALID_DOWNCAST_SIGNATURE, method.span(), DOWNCAST_RESULT_MESSAGE);
      return null;
    }

    if (method.receiver() != Receiver.SHARED_REFERENCE || method.parameters().size() > 1) {
      sink.error(
          DiagnosticKind.INVALID_DOWNCAST_SIGNATURE, method.span(), DOWNCAST_PARAMETERS_MESSAGE);
      return null;
    }
    TypeRef contextType = null;
    if (method.parameters().size() == 1) {
      ParameterDeclaration parameter = method.parameters().get(0);
      if (parameter.type() instanceof TypeRef.Reference reference && reference.mutable()) {
        sink.error(
            DiagnosticKind.INVALID_DOWNCAST_SIGNATURE,
            parameter.span(),
            DOWNCAST_PARAMETERS_MESSAGE);
        return null;
      }
      contextType = TypeRef.unreferenced(parameter.type()).anonymized();
    }

    if (method.async()) {
      sink.error(
          DiagnosticKind.UNSUPPORTED_ASYNC_DOWNCAST,
          method.span(),
          "async downcast to interface implementer is not supported");
      return null;
    }

    return new Downcast(
        implementer,
        new DowncastBinding.ByMethod(method.identifier(), contextType != null),
        contextType,
        method.withoutDirectives());
  }

  /** Extracts {@code T} from {@code Optional<&T>} or {@code Optional<T>}, or null otherwise. */
  private static @Nullable TypeRef downcastTarget(@Nullable TypeRef result) {
    if (!(result instanceof TypeRef.Named option) || !option.isOption()) {
      return null;
    }
    TypeRef inner = option.arguments().get(0);
    if (inner instanceof TypeRef.Reference reference) {
      if (reference.mutable()) {
        return null;
      }
      inner = reference.target();
    }
    if (inner instanceof TypeRef.Named target && !target.isOption() && !target.isSuspendable()) {
      return target.anonymized();
    }
    return null;
  }

  private @Nullable Field parseField(MethodDeclaration method, MethodOptions options) {
    String name;
    SourceSpan nameSpan;
    if (options.name() != null) {
      name = options.name().value();
      nameSpan = options.name().span();
    } else {
      name = Names.toCamelCase(method.identifier());
      nameSpan = method.span();
    }
    if (!internal && Names.isReserved(name)) {
      sink.error(DiagnosticKind.RESERVED_NAME_PREFIX, nameSpan, Names.reservedNameMessage(name));
      return null;
    }

    switch (method.receiver()) {
      case SHARED_REFERENCE -> {}
      case NONE -> {
        sink.error(
            DiagnosticKind.MISSING_RECEIVER,
            method.span(),
            "method `" + method.identifier() + "` must be an instance method to be a field");
        return null;
      }
      case MUTABLE_REFERENCE, OWNED -> {
        sink.error(
            DiagnosticKind.INVALID_RECEIVER_SHAPE,
            method.span(),
            "method `"
                + method.identifier()
                + "` can only read the interface value it is called on");
        return null;
      }
    }

    List<ArgumentDefinition> arguments = argumentResolver.resolve(method);
    if (arguments == null) {
      return null;
    }

    Deprecation deprecation = null;
    if (options.deprecation() != null) {
      String reason = options.deprecation().value();
      deprecation = new Deprecation(reason.isEmpty() ? null : reason);
    }

    FieldDefinition definition =
        new FieldDefinition(
            name,
            resultShape(method),
            options.description() == null ? null : options.description().value(),
            deprecation,
            arguments,
            method.identifier(),
            method.async());
    return new Field(definition, method.withoutDirectives());
  }

  /** The field's type: lifetimes erased, and a suspendable result unwrapped to its value. */
  private static TypeRef resultShape(MethodDeclaration method) {
    TypeRef result = method.result();
    if (result == null) {
      return TypeRef.named("void");
    }
    TypeRef shape = result.anonymized();
    if (method.async() && shape instanceof TypeRef.Named named && named.isSuspendable()) {
      return named.arguments().get(0);
    }
    return shape;
  }
}
