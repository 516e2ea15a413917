package facet.x.iface.compiler.reflect;

import facet.java.api.annotations.Downcast;
import facet.java.api.annotations.ExternalDowncast;
import facet.java.api.annotations.GraphQLArgument;
import facet.java.api.annotations.GraphQLField;
import facet.java.api.annotations.GraphQLInterface;
import facet.java.api.annotations.Ignore;
import facet.java.api.annotations.InjectContext;
import facet.java.api.annotations.InjectExecutor;
import facet.x.iface.compiler.declaration.AssociatedConstant;
import facet.x.iface.compiler.declaration.AssociatedType;
import facet.x.iface.compiler.declaration.ContractDeclaration;
import facet.x.iface.compiler.declaration.Directive;
import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.ParameterDeclaration;
import facet.x.iface.compiler.declaration.Receiver;
import facet.x.iface.compiler.declaration.SourceSpan;
import facet.x.iface.compiler.declaration.TypeRef;
import facet.x.iface.compiler.declaration.Visibility;
import facet.x.iface.compiler.directive.KeyValueDirectiveExtractor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an annotated Java interface into a {@link ContractDeclaration}. Annotations become raw
 * directives keyed the way {@link KeyValueDirectiveExtractor} expects, so they are validated by
 * the compiler like any other directive source.
 *
 * <p>Reflection does not expose declaration order, so methods are read sorted by name and arity.
 */
public final class AnnotatedInterfaceReader {

  private static final Logger log = LoggerFactory.getLogger(AnnotatedInterfaceReader.class);

  /**
   * Reads the declaration of an interface annotated with {@link GraphQLInterface}.
   *
   * @param type the interface
   * @return its declaration
   * @throws IllegalArgumentException if the type is not an annotated interface
   */
  public ContractDeclaration read(Class<?> type) {
    if (!type.isInterface() || type.isAnnotation()) {
      throw new IllegalArgumentException(type.getName() + " is not an interface");
    }
    GraphQLInterface annotation = type.getAnnotation(GraphQLInterface.class);
    if (annotation == null) {
      throw new IllegalArgumentException(
          type.getName() + " is not annotated with @" + GraphQLInterface.class.getSimpleName());
    }

    SourceSpan span = SourceSpan.of(type.getName());
    ContractDeclaration.Builder builder =
        ContractDeclaration.builder(type.getSimpleName())
            .packageName(enclosingName(type))
            .visibility(
                Modifier.isPublic(type.getModifiers())
                    ? Visibility.PUBLIC
                    : Visibility.PACKAGE_PRIVATE)
            .span(span);

    List<String> typeVariables = new ArrayList<>();
    for (TypeVariable<?> variable : type.getTypeParameters()) {
      typeVariables.add(variable.getName());
      builder.genericParameter(variable.getName());
    }

    contractDirectives(type, annotation, typeVariables, span).forEach(builder::directive);

    List<Method> methods = new ArrayList<>(Arrays.asList(type.getDeclaredMethods()));
    methods.sort(
        Comparator.comparing(Method::getName).thenComparingInt(Method::getParameterCount));
    int count = 0;
    for (Method method : methods) {
      if (method.isSynthetic()
          || method.isBridge()
          || Modifier.isPrivate(method.getModifiers())
          || redeclaresObjectMethod(method)) {
        continue;
      }
      builder.method(method(type, method));
      count++;
    }

    for (Field field : type.getDeclaredFields()) {
      if (!field.isSynthetic()) {
        builder.associatedConstant(
            new AssociatedConstant(field.getName(), typeRef(field.getGenericType())));
      }
    }
    for (Class<?> nested : type.getDeclaredClasses()) {
      List<String> parameters = new ArrayList<>();
      for (TypeVariable<?> variable : nested.getTypeParameters()) {
        parameters.add(variable.getName());
      }
      builder.associatedType(new AssociatedType(nested.getSimpleName(), parameters));
    }

    log.debug("Read {} methods from interface {}", count, type.getName());
    return builder.build();
  }

  private static List<Directive> contractDirectives(
      Class<?> type, GraphQLInterface annotation, List<String> typeVariables, SourceSpan span) {
    List<Directive> directives = new ArrayList<>();
    if (!annotation.name().isEmpty()) {
      directives.add(Directive.text(KeyValueDirectiveExtractor.NAME, annotation.name(), span));
    }
    if (!annotation.description().isEmpty()) {
      directives.add(
          Directive.text(KeyValueDirectiveExtractor.DESCRIPTION, annotation.description(), span));
    }
    if (!annotation.scalar().isEmpty()) {
      String scalar = annotation.scalar();
      TypeRef scalarType =
          typeVariables.contains(scalar) ? TypeRef.generic(scalar) : TypeRef.named(scalar);
      directives.add(
          Directive.types(KeyValueDirectiveExtractor.SCALAR, List.of(scalarType), span));
    }
    if (annotation.implementers().length > 0) {
      List<TypeRef> implementers = new ArrayList<>();
      for (Class<?> implementer : annotation.implementers()) {
        implementers.add(typeRef(implementer));
      }
      directives.add(Directive.types(KeyValueDirectiveExtractor.IMPLEMENTS, implementers, span));
    }
    for (ExternalDowncast external : type.getAnnotationsByType(ExternalDowncast.class)) {
      directives.add(
          Directive.binding(
              KeyValueDirectiveExtractor.EXTERNAL_DOWNCAST,
              typeRef(external.implementer()),
              external.function(),
              span));
    }
    if (annotation.context() != void.class) {
      directives.add(
          Directive.types(
              KeyValueDirectiveExtractor.CONTEXT, List.of(typeRef(annotation.context())), span));
    }
    String dispatch = annotation.dispatch().name().toLowerCase(Locale.ROOT);
    if (!annotation.dispatchName().isEmpty()) {
      dispatch = dispatch + "(" + annotation.dispatchName() + ")";
    }
    directives.add(Directive.text(KeyValueDirectiveExtractor.DISPATCH, dispatch, span));
    if (annotation.async()) {
      directives.add(Directive.flag(KeyValueDirectiveExtractor.ASYNC, span));
    }
    if (annotation.internal()) {
      directives.add(Directive.flag(KeyValueDirectiveExtractor.INTERNAL, span));
    }
    return directives;
  }

  private static MethodDeclaration method(Class<?> type, Method method) {
    SourceSpan span = SourceSpan.of(type.getName() + "#" + method.getName());
    Class<?> rawResult = method.getReturnType();
    MethodDeclaration.Builder builder =
        MethodDeclaration.builder(method.getName())
            .receiver(
                Modifier.isStatic(method.getModifiers())
                    ? Receiver.NONE
                    : Receiver.SHARED_REFERENCE)
            .result(typeRef(method.getGenericReturnType()))
            .async(rawResult == CompletableFuture.class || rawResult == CompletionStage.class)
            .defaultBody(method.isDefault())
            .span(span);

    GraphQLField field = method.getAnnotation(GraphQLField.class);
    if (field != null && !field.name().isEmpty()) {
      builder.directive(Directive.text(KeyValueDirectiveExtractor.NAME, field.name(), span));
    }
    if (field != null && !field.description().isEmpty()) {
      builder.directive(
          Directive.text(KeyValueDirectiveExtractor.DESCRIPTION, field.description(), span));
    }
    if (field != null && !field.deprecationReason().isEmpty()) {
      builder.directive(
          Directive.text(KeyValueDirectiveExtractor.DEPRECATED, field.deprecationReason(), span));
    } else if (method.isAnnotationPresent(Deprecated.class)) {
      builder.directive(Directive.flag(KeyValueDirectiveExtractor.DEPRECATED, span));
    }
    if (method.isAnnotationPresent(Ignore.class)) {
      builder.directive(Directive.flag(KeyValueDirectiveExtractor.IGNORE, span));
    }
    if (method.isAnnotationPresent(Downcast.class)) {
      builder.directive(Directive.flag(KeyValueDirectiveExtractor.DOWNCAST, span));
    }

    Parameter[] parameters = method.getParameters();
    for (int i = 0; i < parameters.length; i++) {
      builder.parameter(parameter(span, parameters[i], i));
    }
    return builder.build();
  }

  private static ParameterDeclaration parameter(
      SourceSpan methodSpan, Parameter parameter, int i) {
    SourceSpan span = new SourceSpan(methodSpan.source(), methodSpan.line(), i + 1);
    List<Directive> directives = new ArrayList<>();
    GraphQLArgument argument = parameter.getAnnotation(GraphQLArgument.class);
    if (argument != null && !argument.name().isEmpty()) {
      directives.add(Directive.text(KeyValueDirectiveExtractor.NAME, argument.name(), span));
    }
    if (argument != null && !argument.description().isEmpty()) {
      directives.add(
          Directive.text(KeyValueDirectiveExtractor.DESCRIPTION, argument.description(), span));
    }
    if (argument != null && !argument.defaultValue().isEmpty()) {
      directives.add(
          Directive.text(KeyValueDirectiveExtractor.DEFAULT, argument.defaultValue(), span));
    }
    if (parameter.isAnnotationPresent(InjectContext.class)) {
      directives.add(Directive.flag(KeyValueDirectiveExtractor.CONTEXT, span));
    }
    if (parameter.isAnnotationPresent(InjectExecutor.class)) {
      directives.add(Directive.flag(KeyValueDirectiveExtractor.EXECUTOR, span));
    }

    // Without -parameters metadata the name is synthetic and cannot name an argument.
    @Nullable String identifier = parameter.isNamePresent() ? parameter.getName() : null;
    return new ParameterDeclaration(
        identifier,
        parameter.getName(),
        typeRef(parameter.getParameterizedType()),
        directives,
        span);
  }

  /** Whether the method restates one of {@code Object}'s public methods, like {@code toString}. */
  private static boolean redeclaresObjectMethod(Method method) {
    try {
      Object.class.getMethod(method.getName(), method.getParameterTypes());
      return true;
    } catch (NoSuchMethodException e) {
      return false;
    }
  }

  /** The qualifier of a type: its package, or its enclosing type for a nested type. */
  private static String enclosingName(Class<?> type) {
    String canonical = type.getCanonicalName();
    if (canonical == null) {
      return type.getPackageName();
    }
    int dot = canonical.lastIndexOf('.');
    return dot < 0 ? "" : canonical.substring(0, dot);
  }

  /** Converts a reflected type to a declaration type reference. */
  static TypeRef typeRef(Type type) {
    if (type instanceof Class<?> cls) {
      if (cls.isArray()) {
        return TypeRef.named(typeRef(cls.getComponentType()).render() + "[]");
      }
      String name = cls.getCanonicalName();
      return TypeRef.named(name != null ? name : cls.getName());
    }
    if (type instanceof ParameterizedType parameterized) {
      Class<?> raw = (Class<?>) parameterized.getRawType();
      Type[] arguments = parameterized.getActualTypeArguments();
      TypeRef[] refs = new TypeRef[arguments.length];
      for (int i = 0; i < arguments.length; i++) {
        refs[i] = typeRef(arguments[i]);
      }
      String name = raw.getCanonicalName();
      return TypeRef.named(name != null ? name : raw.getName(), refs);
    }
    if (type instanceof TypeVariable<?> variable) {
      return TypeRef.generic(variable.getName());
    }
    if (type instanceof WildcardType wildcard) {
      Type[] upper = wildcard.getUpperBounds();
      return upper.length == 0 ? TypeRef.named(Object.class.getName()) : typeRef(upper[0]);
    }
    if (type instanceof GenericArrayType array) {
      return TypeRef.named(typeRef(array.getGenericComponentType()).render() + "[]");
    }
    throw new IllegalArgumentException("Unsupported type: " + type);
  }
}
