package io.intellixity.schemata.types;

/** Accepts any value unchanged. */
public record AnyType() implements TypeDescriptor {
  @Override
  public <R> R accept(TypeDescriptorVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeIds.id(this); }
}
