package io.intellixity.schemata.types;

import java.lang.reflect.Type;
import java.util.Objects;

/** A Java type with no engine mapping. Schema validation always rejects it. */
public record OpaqueType(Type javaType) implements TypeDescriptor {
  public OpaqueType {
    Objects.requireNonNull(javaType, "javaType");
  }

  @Override
  public <R> R accept(TypeDescriptorVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeIds.id(this); }
}
