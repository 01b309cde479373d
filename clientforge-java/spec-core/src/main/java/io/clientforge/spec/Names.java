package io.clientforge.spec;

import java.util.Locale;

/**
 * Naming conventions for identifiers derived from document names.
 */
public final class Names {

  private Names() {
  }

  /**
   * Converts a document name to a type name: every run of non-alphanumeric characters is a
   * word boundary and each word is capitalised. {@code team_list} and {@code team-list}
   * become {@code TeamList}; {@code teamList} stays {@code TeamList}.
   */
  public static String toTypeName(String name) {
    if (name == null || name.isEmpty()) {
      return name;
    }
    StringBuilder sb = new StringBuilder();
    for (String part : name.split("[^A-Za-z0-9]+")) {
      if (part.isEmpty()) continue;
      sb.append(Character.toUpperCase(part.charAt(0)));
      sb.append(part, 1, part.length());
    }
    if (sb.isEmpty()) {
      return "Unnamed";
    }
    if (Character.isDigit(sb.charAt(0))) {
      sb.insert(0, '_');
    }
    return sb.toString();
  }

  /**
   * Converts a document name to a member (field, parameter) name. All-caps single words are
   * lower-cased ({@code TTL} becomes {@code ttl}); otherwise the type name with a lower-case
   * first letter.
   */
  public static String toMemberName(String name) {
    if (name == null || name.isEmpty()) {
      return name;
    }
    if (name.length() > 1 && name.matches("[A-Z0-9]+")) {
      String lower = name.toLowerCase(Locale.ROOT);
      return Character.isDigit(lower.charAt(0)) ? "_" + lower : lower;
    }
    String type = toTypeName(name);
    if (type.startsWith("_")) {
      return type;
    }
    return Character.toLowerCase(type.charAt(0)) + type.substring(1);
  }

  public static String capitalize(String s) {
    if (s == null || s.isEmpty()) return s;
    return Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
