package io.intellixity.schemata.types;

/** Accepts only the absent value. */
public record NoneType() implements TypeDescriptor {
  @Override
  public <R> R accept(TypeDescriptorVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeIds.id(this); }
}
