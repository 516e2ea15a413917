package facet.x.iface.compiler.model;

import facet.x.iface.compiler.declaration.AssociatedConstant;
import facet.x.iface.compiler.declaration.AssociatedType;
import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.TypeRef;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The runtime dispatch representation of a compiled interface. Exactly one of the two shapes is
 * chosen per contract.
 */
public sealed interface DispatchArtifact {

  /** Accessor of the implementation held by the generated type. */
  String VALUE_ACCESSOR = "dispatchValue";

  /** Accessor of the implementer's GraphQL name, declared by {@code GraphQLInterfaceValue}. */
  String TYPE_NAME_ACCESSOR = "concreteTypeName";

  /** Name of the generated dispatch type. */
  String name();

  /** Directive-free signatures of the contract methods the artifact exposes. */
  List<MethodDeclaration> methods();

  /** Method names declared by the generated type itself, which contract methods cannot reuse. */
  Set<String> reservedMethodNames();

  /**
   * A handle to any implementation of the contract. Membership is unbounded: implementers added
   * later work without regenerating the artifact.
   *
   * @param name the alias of the handle type
   * @param contractIdentifier the qualified contract the handle wraps
   * @param methods the contract methods forwarded through the handle
   */
  record OpenDispatch(String name, String contractIdentifier, List<MethodDeclaration> methods)
      implements DispatchArtifact {

    public OpenDispatch {
      methods = List.copyOf(methods);
    }

    @Override
    public Set<String> reservedMethodNames() {
      return Set.of(VALUE_ACCESSOR, TYPE_NAME_ACCESSOR);
    }
  }

  /**
   * A tagged union with exactly one variant per implementer. Also re-exposes the contract's
   * associated types, constants and methods, since code reaches the contract through the union.
   *
   * @param name the name of the union type
   * @param variants one variant per implementer, in implementer order
   * @param associatedTypes the contract's type members
   * @param associatedConstants the contract's constants
   * @param methods every contract method, each delegating to the tagged implementer
   */
  record ClosedDispatch(
      String name,
      List<Variant> variants,
      List<AssociatedType> associatedTypes,
      List<AssociatedConstant> associatedConstants,
      List<MethodDeclaration> methods)
      implements DispatchArtifact {

    /** Accessor of the variant tag, also the name of the field holding it. */
    public static final String KIND_ACCESSOR = "dispatchKind";

    public ClosedDispatch {
      variants = List.copyOf(variants);
      associatedTypes = List.copyOf(associatedTypes);
      associatedConstants = List.copyOf(associatedConstants);
      methods = List.copyOf(methods);
    }

    @Override
    public Set<String> reservedMethodNames() {
      Set<String> names = new LinkedHashSet<>();
      names.add(KIND_ACCESSOR);
      names.add(VALUE_ACCESSOR);
      names.add(TYPE_NAME_ACCESSOR);
      for (Variant variant : variants) {
        names.add(variant.factoryName());
      }
      return names;
    }

    /** Field names of the generated union, which contract constants cannot reuse. */
    public Set<String> reservedFieldNames() {
      return Set.of(KIND_ACCESSOR, VALUE_ACCESSOR);
    }
  }

  /**
   * One variant of a closed union.
   *
   * @param tag the variant tag, unique within the union
   * @param implementer the implementer type the variant holds
   */
  record Variant(String tag, TypeRef implementer) {

    /** The static factory of the variant: tag {@code HUMAN_BEING} gives {@code ofHumanBeing}. */
    public String factoryName() {
      StringBuilder sb = new StringBuilder("of");
      for (String part : tag.split("_")) {
        if (part.isEmpty()) {
          continue;
        }
        sb.append(Character.toUpperCase(part.charAt(0)))
            .append(part.substring(1).toLowerCase(Locale.ROOT));
      }
      return sb.toString();
    }
  }
}
