package io.intellixity.schemata.types;

/**
 * Mapping from keys of one type to values of another.
 * <p>
 * A {@code null} key or value is the unparameterized map; it can be represented but never registered.
 */
public record MapType(TypeDescriptor key, TypeDescriptor value) implements TypeDescriptor {
  public boolean isParameterized() { return key != null && value != null; }

  @Override
  public <R> R accept(TypeDescriptorVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeIds.id(this); }
}
