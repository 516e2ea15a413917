package facet.x.iface.compiler;

import java.util.Locale;

/** Naming rules shared by the compiler stages and the source generator. */
public final class Names {

  /** Prefix reserved for the GraphQL introspection system. */
  public static final String RESERVED_PREFIX = "__";

  private Names() {
    // Static utility class
  }

  /**
   * Converts an identifier to camelCase, e.g. {@code home_planet} to {@code homePlanet}. Leading
   * underscores are kept, so {@code __typename} stays reserved.
   *
   * @param identifier the identifier as written
   * @return the camel-cased name
   */
  public static String toCamelCase(String identifier) {
    int start = 0;
    while (start < identifier.length() && identifier.charAt(start) == '_') {
      start++;
    }
    StringBuilder sb = new StringBuilder(identifier.substring(0, start));
    boolean upperNext = false;
    for (int i = start; i < identifier.length(); i++) {
      char c = identifier.charAt(i);
      if (c == '_') {
        upperNext = sb.length() > start;
      } else if (upperNext) {
        sb.append(Character.toUpperCase(c));
        upperNext = false;
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Converts a type name to an UPPER_SNAKE constant name, e.g. {@code HumanBeing} to {@code
   * HUMAN_BEING}.
   *
   * @param name the type name
   * @return the constant name
   */
  public static String toConstantCase(String name) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)
          && i > 0
          && (Character.isLowerCase(name.charAt(i - 1))
              || (i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1))))
          && name.charAt(i - 1) != '_') {
        sb.append('_');
      }
      sb.append(c);
    }
    return sb.toString().toUpperCase(Locale.ROOT);
  }

  public static boolean isReserved(String name) {
    return name.startsWith(RESERVED_PREFIX);
  }

  /** Message for a name that uses the reserved prefix. */
  static String reservedNameMessage(String name) {
    return "`"
        + name
        + "` starts with `__` (two underscores), which is reserved for the GraphQL"
        + " introspection system";
  }
}
