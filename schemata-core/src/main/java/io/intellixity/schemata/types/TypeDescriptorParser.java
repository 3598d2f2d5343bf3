package io.intellixity.schemata.types;

import java.util.Locale;

/**
 * Tiny type DSL: {@code int}, {@code float}, {@code string}, {@code bool}, {@code any}, {@code none},
 * {@code list<T>}, {@code map<K,V>}, {@code ref(SchemaId)} and the bare {@code list}/{@code map}.
 */
public final class TypeDescriptorParser {
  private TypeDescriptorParser() {}

  public static TypeDescriptor parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("type is blank");
    s = s.trim();

    if (s.startsWith("ref(") && s.endsWith(")")) {
      String id = s.substring("ref(".length(), s.length() - 1).trim();
      if (id.isEmpty()) throw new IllegalArgumentException("ref() requires a schema id: " + s);
      return new NestedType(id);
    }

    String lower = s.toLowerCase(Locale.ROOT);
    if (lower.startsWith("list<") && lower.endsWith(">")) {
      String inside = s.substring(5, s.length() - 1);
      if (inside.isBlank()) return Types.untypedList();
      return new ListType(parse(inside));
    }
    if (lower.startsWith("map<") && lower.endsWith(">")) {
      String inside = s.substring(4, s.length() - 1);
      if (inside.isBlank()) return Types.untypedMap();
      int comma = findTopComma(inside);
      if (comma < 0) throw new IllegalArgumentException("map<K,V> requires comma: " + s);
      TypeDescriptor k = parse(inside.substring(0, comma));
      TypeDescriptor v = parse(inside.substring(comma + 1));
      return new MapType(k, v);
    }

    return scalar(lower, s);
  }

  private static TypeDescriptor scalar(String id, String original) {
    return switch (id) {
      case "int", "integer", "long" -> Types.INT;
      case "float", "double", "number" -> Types.FLOAT;
      case "string", "str" -> Types.STRING;
      case "bool", "boolean" -> Types.BOOL;
      case "any", "object" -> Types.ANY;
      case "none", "null" -> Types.NONE;
      case "list" -> Types.untypedList();
      case "map" -> Types.untypedMap();
      default -> throw new IllegalArgumentException("Unknown type: " + original);
    };
  }

  private static int findTopComma(String s) {
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '<' || c == '(') depth++;
      else if (c == '>' || c == ')') depth--;
      else if (c == ',' && depth == 0) return i;
    }
    return -1;
  }
}
