package facet.x.iface.compiler.directive;

import facet.x.iface.compiler.declaration.ContractDeclaration;
import facet.x.iface.compiler.declaration.Directive;
import facet.x.iface.compiler.declaration.DirectiveValue;
import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.ParameterDeclaration;
import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Default {@link DirectiveExtractor}: interprets directives as {@code key = value} pairs.
 *
 * <p>Recognized keys:
 *
 * <ul>
 *   <li>contract: {@code name}, {@code description}, {@code scalar}, {@code implements}, {@code
 *       external-downcast}, {@code context}, {@code dispatch}, {@code async}, {@code internal}
 *   <li>method: {@code name}, {@code description}, {@code deprecated}, {@code ignore}, {@code
 *       downcast}
 *   <li>argument: {@code name}, {@code description}, {@code default}, {@code context}, {@code
 *       executor}
 * </ul>
 *
 * <p>Only {@code implements} and {@code external-downcast} may be repeated. The {@code dispatch}
 * value is {@code open}, {@code closed}, or either with a type name in parentheses, e.g. {@code
 * open(DynCharacter)}.
 */
public class KeyValueDirectiveExtractor implements DirectiveExtractor {

  public static final String NAME = "name";
  public static final String DESCRIPTION = "description";
  public static final String SCALAR = "scalar";
  public static final String IMPLEMENTS = "implements";
  public static final String EXTERNAL_DOWNCAST = "external-downcast";
  public static final String CONTEXT = "context";
  public static final String DISPATCH = "dispatch";
  public static final String ASYNC = "async";
  public static final String INTERNAL = "internal";
  public static final String DEPRECATED = "deprecated";
  public static final String IGNORE = "ignore";
  public static final String DOWNCAST = "downcast";
  public static final String DEFAULT = "default";
  public static final String EXECUTOR = "executor";

  private static final Set<String> REPEATABLE = Set.of(IMPLEMENTS, EXTERNAL_DOWNCAST);

  private static final Pattern DISPATCH_VALUE =
      Pattern.compile("(open|closed)(?:\\(\\s*([A-Za-z_$][A-Za-z0-9_$]*)\\s*\\))?");

  @Override
  public ContractOptions contractOptions(ContractDeclaration declaration)
      throws DirectiveParseException {
    Spanned<String> name = null;
    Spanned<String> description = null;
    Spanned<TypeRef> scalar = null;
    List<Spanned<TypeRef>> implementers = new ArrayList<>();
    List<ExternalDowncastOption> externalDowncasts = new ArrayList<>();
    Spanned<TypeRef> context = null;
    Spanned<DispatchOption> dispatch = null;
    boolean async = false;
    boolean internal = false;

    Set<String> seen = new HashSet<>();
    for (Directive directive : declaration.directives()) {
      ensureNotRepeated(directive, seen);
      switch (directive.key()) {
        case NAME -> name = text(directive);
        case DESCRIPTION -> description = text(directive);
        case SCALAR -> scalar = singleType(directive);
        case IMPLEMENTS -> {
          for (TypeRef type : types(directive)) {
            implementers.add(new Spanned<>(type, directive.span()));
          }
        }
        case EXTERNAL_DOWNCAST -> {
          if (!(directive.value() instanceof DirectiveValue.Binding binding)) {
            throw invalidValue(directive, "a `Type => function` binding");
          }
          externalDowncasts.add(
              new ExternalDowncastOption(binding.type(), binding.function(), directive.span()));
        }
        case CONTEXT -> context = singleType(directive);
        case DISPATCH -> dispatch = dispatch(directive);
        case ASYNC -> async = flag(directive);
        case INTERNAL -> internal = flag(directive);
        default -> throw unknownKey(directive, "interface");
      }
    }

    return new ContractOptions(
        name,
        description,
        scalar,
        implementers,
        externalDowncasts,
        context,
        dispatch,
        async,
        internal);
  }

  @Override
  public MethodOptions methodOptions(MethodDeclaration method) throws DirectiveParseException {
    Spanned<String> name = null;
    Spanned<String> description = null;
    Spanned<String> deprecation = null;
    boolean ignore = false;
    boolean downcast = false;

    Set<String> seen = new HashSet<>();
    for (Directive directive : method.directives()) {
      ensureNotRepeated(directive, seen);
      switch (directive.key()) {
        case NAME -> name = text(directive);
        case DESCRIPTION -> description = text(directive);
        case DEPRECATED -> {
          if (directive.value() instanceof DirectiveValue.Flag) {
            deprecation = new Spanned<>("", directive.span());
          } else {
            deprecation = text(directive);
          }
        }
        case IGNORE -> ignore = flag(directive);
        case DOWNCAST -> downcast = flag(directive);
        default -> throw unknownKey(directive, "method");
      }
    }

    return new MethodOptions(name, description, deprecation, ignore, downcast);
  }

  @Override
  public ArgumentOptions argumentOptions(ParameterDeclaration parameter)
      throws DirectiveParseException {
    Spanned<String> name = null;
    Spanned<String> description = null;
    Spanned<String> defaultValue = null;
    SourceSpan context = null;
    SourceSpan executor = null;

    Set<String> seen = new HashSet<>();
    for (Directive directive : parameter.directives()) {
      ensureNotRepeated(directive, seen);
      switch (directive.key()) {
        case NAME -> name = text(directive);
        case DESCRIPTION -> description = text(directive);
        case DEFAULT -> defaultValue = text(directive);
        case CONTEXT -> context = flagSpan(directive);
        case EXECUTOR -> executor = flagSpan(directive);
        default -> throw unknownKey(directive, "argument");
      }
    }

    return new ArgumentOptions(name, description, defaultValue, context, executor);
  }

  private static void ensureNotRepeated(Directive directive, Set<String> seen)
      throws DirectiveParseException {
    if (!REPEATABLE.contains(directive.key()) && !seen.add(directive.key())) {
      throw new DirectiveParseException(
          directive.span(), "duplicated directive `" + directive.key() + "`");
    }
  }

  private static Spanned<String> text(Directive directive) throws DirectiveParseException {
    if (directive.value() instanceof DirectiveValue.Text text) {
      return new Spanned<>(text.text(), directive.span());
    }
    throw invalidValue(directive, "a string value");
  }

  private static boolean flag(Directive directive) throws DirectiveParseException {
    flagSpan(directive);
    return true;
  }

  private static SourceSpan flagSpan(Directive directive) throws DirectiveParseException {
    if (directive.value() instanceof DirectiveValue.Flag) {
      return directive.span();
    }
    throw invalidValue(directive, "no value");
  }

  private static List<TypeRef> types(Directive directive) throws DirectiveParseException {
    if (directive.value() instanceof DirectiveValue.Types types && !types.types().isEmpty()) {
      return types.types();
    }
    throw invalidValue(directive, "one or more types");
  }

  private static Spanned<TypeRef> singleType(Directive directive) throws DirectiveParseException {
    List<TypeRef> types = types(directive);
    if (types.size() != 1) {
      throw invalidValue(directive, "exactly one type");
    }
    return new Spanned<>(types.get(0), directive.span());
  }

  private static Spanned<DispatchOption> dispatch(Directive directive)
      throws DirectiveParseException {
    Spanned<String> text = text(directive);
    Matcher matcher = DISPATCH_VALUE.matcher(text.value().trim());
    if (!matcher.matches()) {
      throw invalidValue(directive, "`open`, `closed`, `open(Name)` or `closed(Name)`");
    }
    boolean open = matcher.group(1).equals("open");
    @Nullable String artifactName = matcher.group(2);
    return new Spanned<>(new DispatchOption(open, artifactName), directive.span());
  }

  private static DirectiveParseException invalidValue(Directive directive, String expected) {
    return new DirectiveParseException(
        directive.span(), "directive `" + directive.key() + "` expects " + expected);
  }

  private static DirectiveParseException unknownKey(Directive directive, String element) {
    return new DirectiveParseException(
        directive.span(), "unknown " + element + " directive `" + directive.key() + "`");
  }
}
