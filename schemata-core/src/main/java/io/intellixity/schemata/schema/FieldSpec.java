package io.intellixity.schemata.schema;

import io.intellixity.schemata.types.TypeDescriptor;

import java.util.List;

/** A classified field of a built {@link Schema}. {@code allowedValues} is null when unrestricted. */
public record FieldSpec(
    String name,
    TypeDescriptor type,
    FieldCategory category,
    /** Null for required fields. */
    FieldDefault defaultValue,
    String alias,
    List<Object> allowedValues
) {
  public boolean isRequired() { return category == FieldCategory.REQUIRED; }
  public boolean hasAllowedValues() { return allowedValues != null; }
}
