package io.intellixity.schemata.types;

import java.util.Objects;

public record PrimitiveType(PrimitiveKind kind) implements TypeDescriptor {
  public PrimitiveType {
    Objects.requireNonNull(kind, "kind");
  }

  @Override
  public <R> R accept(TypeDescriptorVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeIds.id(this); }
}
