package io.intellixity.schemata.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Explicit field spec: alternate document key, default and allowed values.
 * <p>
 * A field declared with options and no default (or a null default) is required.
 */
public record FieldOptions(String alias, FieldDefault defaultValue, List<Object> allowedValues) {
  public FieldOptions {
    if (alias != null && alias.isBlank()) throw new IllegalArgumentException("alias is blank");
    if (allowedValues != null) allowedValues = Collections.unmodifiableList(new ArrayList<>(allowedValues));
  }

  public static FieldOptions options() {
    return new FieldOptions(null, null, null);
  }

  public FieldOptions alias(String alias) {
    return new FieldOptions(Objects.requireNonNull(alias, "alias"), defaultValue, allowedValues);
  }

  public FieldOptions defaultValue(Object value) {
    return new FieldOptions(alias, value == null ? null : FieldDefault.literal(value), allowedValues);
  }

  public FieldOptions defaultFactory(Supplier<?> factory) {
    return new FieldOptions(alias, FieldDefault.factory(factory), allowedValues);
  }

  public FieldOptions allowedValues(Object... values) {
    return allowedValues(Arrays.asList(values));
  }

  public FieldOptions allowedValues(Collection<?> values) {
    return new FieldOptions(alias, defaultValue, new ArrayList<>(Objects.requireNonNull(values, "values")));
  }

  public boolean hasDefault() { return defaultValue != null; }
}
