package io.intellixity.schemata.exceptions;

import io.intellixity.schemata.types.NativeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Raised when one construction call rejects its input.
 * <p>
 * Construction is fail-fast: the first error aborts the call and no partial instance is returned.
 * Errors raised inside nested schemas and containers carry the full path from the outermost field.
 */
public final class ConstructionException extends RuntimeException {

  public enum Kind {
    WRONG_TYPE,
    UNKNOWN_ARGUMENT,
    MISSING_REQUIRED_ARGUMENT,
    UNSUPPORTED_TYPE,
    VALUE_NOT_AN_OPTION,
    USAGE_ERROR,
    NESTING_TOO_DEEP
  }

  private final Kind kind;
  private final List<String> path;
  private final transient Object value;
  private final String expected;
  private final String detail;

  private ConstructionException(Kind kind, List<String> path, Object value, String expected, String detail,
                                Throwable cause) {
    super(format(kind, path, value, expected, detail), cause);
    this.kind = kind;
    this.path = List.copyOf(path);
    this.value = value;
    this.expected = expected;
    this.detail = detail;
  }

  public static ConstructionException wrongType(String field, Object value, String expected) {
    return new ConstructionException(Kind.WRONG_TYPE, List.of(field), value, expected, null, null);
  }

  public static ConstructionException unknownArgument(String key, Object value) {
    return new ConstructionException(Kind.UNKNOWN_ARGUMENT, List.of(key), value, null, null, null);
  }

  /** {@code schemaId} is the schema that declares the missing field. */
  public static ConstructionException missingRequiredArgument(String field, String schemaId) {
    return new ConstructionException(Kind.MISSING_REQUIRED_ARGUMENT, List.of(field), null, schemaId, null, null);
  }

  public static ConstructionException unsupportedType(String field, Object value) {
    return new ConstructionException(Kind.UNSUPPORTED_TYPE, List.of(field), value, null, null, null);
  }

  public static ConstructionException valueNotAnOption(String field, Object value, List<?> options) {
    return new ConstructionException(Kind.VALUE_NOT_AN_OPTION, List.of(field), value, String.valueOf(options), null, null);
  }

  public static ConstructionException usageError(String schemaId, String detail) {
    return new ConstructionException(Kind.USAGE_ERROR, List.of(), null, schemaId, detail, null);
  }

  public static ConstructionException nestingTooDeep(String field, int maxDepth) {
    return new ConstructionException(Kind.NESTING_TOO_DEEP, List.of(field), null, String.valueOf(maxDepth), null, null);
  }

  /** Copy of this error with {@code segment} prepended to the path; this error becomes the cause. */
  public ConstructionException withParent(String segment) {
    Objects.requireNonNull(segment, "segment");
    List<String> p = new ArrayList<>(path.size() + 1);
    p.add(segment);
    p.addAll(path);
    return new ConstructionException(kind, p, value, expected, detail, this);
  }

  public Kind kind() { return kind; }
  public List<String> path() { return path; }
  public String pathString() { return render(path); }
  public Object value() { return value; }
  /** Expected shape (descriptor id or allow-list), owning schema id for missing/usage errors. */
  public String expected() { return expected; }

  /** Joins segments with dots; index segments such as {@code [2]} attach to their parent. */
  public static String render(List<String> path) {
    StringBuilder sb = new StringBuilder();
    for (String s : path) {
      if (sb.length() > 0 && !s.startsWith("[")) sb.append('.');
      sb.append(s);
    }
    return sb.toString();
  }

  private static String format(Kind kind, List<String> path, Object value, String expected, String detail) {
    String key = render(path);
    String type = NativeKind.typeName(value);
    return switch (kind) {
      case WRONG_TYPE ->
          "Wrong type '" + type + "' with value '" + value + "' for key '" + key + "'. Expected '" + expected + "'.";
      case UNKNOWN_ARGUMENT -> "Unknown argument '" + value + "' of type '" + type + "' with key '" + key + "'.";
      case MISSING_REQUIRED_ARGUMENT -> "Missing required argument '" + key + "' for '" + expected + "'";
      case UNSUPPORTED_TYPE -> "Value of type '" + type + "' is not supported for key '" + key + "'";
      case VALUE_NOT_AN_OPTION -> "Value '" + value + "' of type '" + type + "' for key '" + key
          + "' is not an option. Choose one of: " + expected;
      case NESTING_TOO_DEEP -> "Nesting deeper than " + expected + " levels at key '" + key + "'";
      case USAGE_ERROR -> key.isEmpty()
          ? "Invalid construction of '" + expected + "': " + detail
          : "Invalid construction of '" + expected + "' at '" + key + "': " + detail;
    };
  }
}
