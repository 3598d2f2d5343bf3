package io.intellixity.schemata.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Kind of a raw value in an untyped document tree.
 * <p>
 * Integer and float kinds never overlap: a {@code 1} is never a float and a {@code 1.0} is never an integer.
 */
public enum NativeKind {
  NONE, STRING, INTEGER, FLOAT, BOOLEAN, SEQUENCE, MAPPING, OTHER;

  public static NativeKind of(Object value) {
    if (value == null) return NONE;
    if (value instanceof String) return STRING;
    if (value instanceof Boolean) return BOOLEAN;
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof BigInteger) return INTEGER;
    if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) return FLOAT;
    if (value instanceof List<?>) return SEQUENCE;
    if (value instanceof Map<?, ?>) return MAPPING;
    return OTHER;
  }

  /** Kinds accepted as a raw field value by construction. */
  public boolean isSupportedFieldValue() {
    return this != NONE && this != OTHER;
  }

  public boolean isScalar() {
    return this == STRING || this == INTEGER || this == FLOAT || this == BOOLEAN;
  }

  /** Simple class name used in messages, {@code "None"} for null. */
  public static String typeName(Object value) {
    return value == null ? "None" : value.getClass().getSimpleName();
  }
}
