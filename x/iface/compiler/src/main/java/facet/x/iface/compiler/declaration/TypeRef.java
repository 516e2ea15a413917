package facet.x.iface.compiler.declaration;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A type as written in a contract declaration. Types are compared structurally, so two
 * occurrences of {@code Optional<Human>} are equal wherever they appear.
 */
public sealed interface TypeRef {

  Set<String> OPTION_TYPES = Set.of("Optional", "java.util.Optional", "Option");

  Set<String> SUSPENDABLE_TYPES =
      Set.of(
          "CompletableFuture",
          "java.util.concurrent.CompletableFuture",
          "CompletionStage",
          "java.util.concurrent.CompletionStage");

  /** Renders the type the way it would be written in Java source. */
  String render();

  /** Returns this type with every lifetime label removed. */
  TypeRef anonymized();

  static Named named(String name, TypeRef... arguments) {
    return new Named(name, List.of(arguments));
  }

  static Reference ref(TypeRef target) {
    return new Reference(target, false, null);
  }

  static Reference mutRef(TypeRef target) {
    return new Reference(target, true, null);
  }

  static GenericParameter generic(String name) {
    return new GenericParameter(name);
  }

  /** A nominal type with optional type arguments, e.g. {@code String} or {@code List<Human>}. */
  record Named(String name, List<TypeRef> arguments) implements TypeRef {

    public Named {
      arguments = List.copyOf(arguments);
    }

    /** The name without its package qualifier. */
    public String simpleName() {
      int dot = name.lastIndexOf('.');
      return dot < 0 ? name : name.substring(dot + 1);
    }

    public boolean isOption() {
      return OPTION_TYPES.contains(name) && arguments.size() == 1;
    }

    public boolean isSuspendable() {
      return SUSPENDABLE_TYPES.contains(name) && arguments.size() == 1;
    }

    @Override
    public String render() {
      if (arguments.isEmpty()) {
        return name;
      }
      return name
          + arguments.stream().map(TypeRef::render).collect(Collectors.joining(", ", "<", ">"));
    }

    @Override
    public TypeRef anonymized() {
      return new Named(name, arguments.stream().map(TypeRef::anonymized).toList());
    }
  }

  /**
   * A borrowed reference to another type. Only shared references can be used as receivers and
   * downcast targets; the lifetime label is informational and never part of a field's shape.
   */
  record Reference(TypeRef target, boolean mutable, @Nullable String lifetime) implements TypeRef {

    @Override
    public String render() {
      StringBuilder sb = new StringBuilder("&");
      if (lifetime != null) {
        sb.append('\'').append(lifetime).append(' ');
      }
      if (mutable) {
        sb.append("mut ");
      }
      return sb.append(target.render()).toString();
    }

    @Override
    public TypeRef anonymized() {
      return new Reference(target.anonymized(), mutable, null);
    }
  }

  /** A type variable of the contract itself, e.g. {@code S}. */
  record GenericParameter(String name) implements TypeRef {

    @Override
    public String render() {
      return name;
    }

    @Override
    public TypeRef anonymized() {
      return this;
    }
  }

  /** Strips any number of reference layers, e.g. {@code &Database} becomes {@code Database}. */
  static TypeRef unreferenced(TypeRef type) {
    TypeRef current = type;
    while (current instanceof Reference reference) {
      current = reference.target();
    }
    return current;
  }
}
