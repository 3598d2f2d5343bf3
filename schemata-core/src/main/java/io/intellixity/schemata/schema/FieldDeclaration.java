package io.intellixity.schemata.schema;

import io.intellixity.schemata.types.TypeDescriptor;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One declared field: name, type and optional default spec.
 * <p>
 * The default spec is a scalar literal (or null), a {@link Supplier} factory, a {@link FieldDefault}
 * or a {@link FieldOptions} token. {@code hasDefault} distinguishes "no default" from a null literal.
 */
public record FieldDeclaration(String name, TypeDescriptor type, Object defaultSpec, boolean hasDefault) {
  public FieldDeclaration {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("field name is blank");
    Objects.requireNonNull(type, "type");
    if (!hasDefault && defaultSpec != null) {
      throw new IllegalArgumentException("defaultSpec given for field without default: " + name);
    }
  }

  public static FieldDeclaration of(String name, TypeDescriptor type) {
    return new FieldDeclaration(name, type, null, false);
  }

  public static FieldDeclaration of(String name, TypeDescriptor type, Object defaultSpec) {
    return new FieldDeclaration(name, type, defaultSpec, true);
  }
}
