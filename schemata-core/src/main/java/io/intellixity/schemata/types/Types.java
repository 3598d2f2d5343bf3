package io.intellixity.schemata.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Descriptor constants and factories. */
public final class Types {
  private Types() {}

  public static final PrimitiveType INT = new PrimitiveType(PrimitiveKind.INTEGER);
  public static final PrimitiveType FLOAT = new PrimitiveType(PrimitiveKind.FLOAT);
  public static final PrimitiveType STRING = new PrimitiveType(PrimitiveKind.STRING);
  public static final PrimitiveType BOOL = new PrimitiveType(PrimitiveKind.BOOLEAN);
  public static final AnyType ANY = new AnyType();
  public static final NoneType NONE = new NoneType();

  public static PrimitiveType primitive(PrimitiveKind kind) {
    return switch (Objects.requireNonNull(kind, "kind")) {
      case INTEGER -> INT;
      case FLOAT -> FLOAT;
      case STRING -> STRING;
      case BOOLEAN -> BOOL;
    };
  }

  public static ListType listOf(TypeDescriptor element) {
    return new ListType(Objects.requireNonNull(element, "element"));
  }

  public static MapType mapOf(TypeDescriptor key, TypeDescriptor value) {
    return new MapType(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  public static NestedType nested(String schemaId) {
    return new NestedType(schemaId);
  }

  /** The unparameterized list; representable, never registrable. */
  public static ListType untypedList() { return new ListType(null); }

  /** The unparameterized map; representable, never registrable. */
  public static MapType untypedMap() { return new MapType(null, null); }

  /**
   * Converts an explicitly supplied Java type token, e.g. {@code new TypeToken<Map<String, List<Integer>>>(){}}.
   * <p>
   * Raw {@code List}/{@code Map} become unparameterized containers and unmapped types become {@link OpaqueType};
   * both are left for schema validation to reject.
   */
  public static TypeDescriptor of(Type type) {
    Objects.requireNonNull(type, "type");
    if (type instanceof Class<?> c) return ofClass(c);

    if (type instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> raw) {
      Type[] args = pt.getActualTypeArguments();
      if (List.class.isAssignableFrom(raw)) {
        if (args.length != 1) throw new IllegalArgumentException("List must have exactly one type argument: " + type);
        return new ListType(of(args[0]));
      }
      if (Map.class.isAssignableFrom(raw)) {
        if (args.length != 2) throw new IllegalArgumentException("Map must have exactly two type arguments: " + type);
        return new MapType(of(args[0]), of(args[1]));
      }
      return new OpaqueType(type);
    }

    if (type instanceof GenericArrayType) return new OpaqueType(type);
    // wildcards and type variables
    return new OpaqueType(type);
  }

  private static TypeDescriptor ofClass(Class<?> c) {
    if (c == Integer.class || c == int.class || c == Long.class || c == long.class
        || c == Short.class || c == short.class || c == Byte.class || c == byte.class
        || c == BigInteger.class) return INT;
    if (c == Double.class || c == double.class || c == Float.class || c == float.class
        || c == BigDecimal.class) return FLOAT;
    if (c == String.class) return STRING;
    if (c == Boolean.class || c == boolean.class) return BOOL;
    if (c == Object.class) return ANY;
    if (c == Void.class || c == void.class) return NONE;
    if (List.class.isAssignableFrom(c)) return untypedList();
    if (Map.class.isAssignableFrom(c)) return untypedMap();
    return new OpaqueType(c);
  }
}
