package facet.x.iface.compiler;

import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.ParameterDeclaration;
import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.diagnostics.DiagnosticKind;
import facet.x.iface.compiler.diagnostics.DiagnosticSink;
import facet.x.iface.compiler.directive.ArgumentOptions;
import facet.x.iface.compiler.directive.DirectiveExtractor;
import facet.x.iface.compiler.directive.DirectiveParseException;
import facet.x.iface.compiler.directive.Spanned;
import facet.x.iface.compiler.model.ArgumentDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Classifies every non-receiver parameter of a field method as the context value, the executor
 * handle, or a regular GraphQL argument.
 *
 * <p>An explicit {@code context} or {@code executor} directive wins; otherwise parameters named
 * {@code context}, {@code ctx} or {@code executor} are classified by convention. Either way the
 * parameter cannot also carry {@code name}, {@code description} or {@code default}.
 */
public final class ArgumentRoleResolver {

  private static final Set<String> CONTEXT_NAMES = Set.of("context", "ctx");
  private static final String EXECUTOR_NAME = "executor";

  private final DirectiveExtractor extractor;
  private final DiagnosticSink sink;
  private final boolean internal;

  public ArgumentRoleResolver(DirectiveExtractor extractor, DiagnosticSink sink, boolean internal) {
    this.extractor = extractor;
    this.sink = sink;
    this.internal = internal;
  }

  /**
   * Resolves the roles of all parameters of a field method. Parameters that fail to resolve are
   * reported and left out.
   *
   * @param method the field method
   * @return the arguments in declaration order, or null when the method declares more than one
   *     context or executor parameter and the whole field has to be dropped
   */
  public @Nullable List<ArgumentDefinition> resolve(MethodDeclaration method) {
    List<ArgumentDefinition> arguments = new ArrayList<>();
    boolean hasContext = false;
    boolean hasExecutor = false;
    for (ParameterDeclaration parameter : method.parameters()) {
      ArgumentDefinition argument = resolve(parameter);
      if (argument == null) {
        continue;
      }
      if (argument instanceof ArgumentDefinition.Context) {
        if (hasContext) {
          return duplicateSpecial(method, parameter, "context");
        }
        hasContext = true;
      } else if (argument instanceof ArgumentDefinition.Executor) {
        if (hasExecutor) {
          return duplicateSpecial(method, parameter, "executor");
        }
        hasExecutor = true;
      }
      arguments.add(argument);
    }
    return arguments;
  }

  /**
   * Resolves the role of a single parameter.
   *
   * @param parameter the parameter
   * @return the argument, or null if it was reported as invalid
   */
  public @Nullable ArgumentDefinition resolve(ParameterDeclaration parameter) {
    ArgumentOptions options;
    try {
      options = extractor.argumentOptions(parameter);
    } catch (DirectiveParseException e) {
      sink.error(DiagnosticKind.DIRECTIVE_PARSE_FAILURE, e.getSpan(), e.getMessage());
      return null;
    }

    if (options.context() != null && options.executor() != null) {
      sink.error(
          DiagnosticKind.DISALLOWED_DIRECTIVE_COMBINATION,
          options.executor(),
          "directive `executor` is not allowed on an argument marked as `context`");
      return null;
    }

    ArgumentDefinition special = specialRole(parameter, options);
    if (special != null) {
      return ensureNoRegularArgumentOptions(options) ? special : null;
    }

    String name;
    SourceSpan nameSpan;
    if (options.name() != null) {
      name = options.name().value();
      nameSpan = options.name().span();
    } else if (parameter.identifier() != null) {
      name = Names.toCamelCase(parameter.identifier());
      nameSpan = parameter.span();
    } else {
      sink.error(
          DiagnosticKind.MALFORMED_ARGUMENT_PATTERN,
          parameter.span(),
          "method argument `" + parameter.patternText() + "` should be a single identifier",
          "use the `name` directive to specify the argument's name without requiring it to be"
              + " a single identifier");
      return null;
    }
    if (!internal && Names.isReserved(name)) {
      sink.error(DiagnosticKind.RESERVED_NAME_PREFIX, nameSpan, Names.reservedNameMessage(name));
      return null;
    }

    return new ArgumentDefinition.Regular(
        name, parameter.type(), valueOf(options.description()), valueOf(options.defaultValue()));
  }

  private static @Nullable ArgumentDefinition specialRole(
      ParameterDeclaration parameter, ArgumentOptions options) {
    if (options.context() != null) {
      return new ArgumentDefinition.Context(contextType(parameter));
    }
    if (options.executor() != null) {
      return new ArgumentDefinition.Executor();
    }
    String identifier = parameter.identifier();
    if (identifier == null) {
      return null;
    }
    if (CONTEXT_NAMES.contains(identifier)) {
      return new ArgumentDefinition.Context(contextType(parameter));
    }
    if (EXECUTOR_NAME.equals(identifier)) {
      return new ArgumentDefinition.Executor();
    }
    return null;
  }

  private static TypeRef contextType(ParameterDeclaration parameter) {
    return TypeRef.unreferenced(parameter.type()).anonymized();
  }

  private boolean ensureNoRegularArgumentOptions(ArgumentOptions options) {
    if (options.name() != null) {
      return disallowed(options.name(), "name");
    }
    if (options.description() != null) {
      return disallowed(options.description(), "description");
    }
    if (options.defaultValue() != null) {
      return disallowed(options.defaultValue(), "default");
    }
    return true;
  }

  private boolean disallowed(Spanned<String> option, String key) {
    sink.error(
        DiagnosticKind.DISALLOWED_DIRECTIVE_COMBINATION,
        option.span(),
        "directive `" + key + "` is not allowed on a context or executor argument");
    return false;
  }

  private @Nullable List<ArgumentDefinition> duplicateSpecial(
      MethodDeclaration method, ParameterDeclaration parameter, String role) {
    sink.error(
        DiagnosticKind.DUPLICATE_SPECIAL_ARGUMENT,
        parameter.span(),
        "method `"
            + method.identifier()
            + "` declares more than one "
            + role
            + " argument, `"
            + parameter.patternText()
            + "` is the second one");
    return null;
  }

  private static @Nullable String valueOf(@Nullable Spanned<String> option) {
    return option == null ? null : option.value();
  }
}
