package io.intellixity.schemata.exceptions;

/**
 * Raised while building a schema; fatal to defining that record type.
 * <p>
 * Never raised by construction calls, which only see schemas that passed these checks.
 */
public final class SchemaDefinitionException extends RuntimeException {

  public enum Kind {
    UNTYPED_CONTAINER,
    INVALID_MAP_KEY,
    UNSUPPORTED_TYPE,
    INVALID_DEFAULT,
    DEFAULT_NOT_IN_OPTIONS,
    INVALID_OPTIONS,
    DUPLICATE_FIELD
  }

  private final Kind kind;
  private final String schemaId;
  private final String field;

  public SchemaDefinitionException(Kind kind, String schemaId, String field, String message) {
    this(kind, schemaId, field, message, null);
  }

  public SchemaDefinitionException(Kind kind, String schemaId, String field, String message, Throwable cause) {
    super("Schema '" + schemaId + "', field '" + field + "': " + message, cause);
    this.kind = kind;
    this.schemaId = schemaId;
    this.field = field;
  }

  public Kind kind() { return kind; }
  public String schemaId() { return schemaId; }
  public String field() { return field; }
}
