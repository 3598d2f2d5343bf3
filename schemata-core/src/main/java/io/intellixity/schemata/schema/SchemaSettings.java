package io.intellixity.schemata.schema;

/**
 * Per-schema construction policy.
 *
 * @param ignoreUnknownFields drop document keys that map to no field instead of failing
 * @param ignoreMissingFields leave absent required fields unset instead of failing
 */
public record SchemaSettings(boolean ignoreUnknownFields, boolean ignoreMissingFields) {
  public static final SchemaSettings DEFAULTS = new SchemaSettings(false, false);

  public static SchemaSettings lenient() {
    return new SchemaSettings(true, true);
  }

  public SchemaSettings withIgnoreUnknownFields(boolean v) { return new SchemaSettings(v, ignoreMissingFields); }
  public SchemaSettings withIgnoreMissingFields(boolean v) { return new SchemaSettings(ignoreUnknownFields, v); }
}
