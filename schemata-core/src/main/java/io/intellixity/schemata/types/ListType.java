package io.intellixity.schemata.types;

/**
 * Sequence of elements of one type.
 * <p>
 * A {@code null} element is the unparameterized list; it can be represented but never registered.
 */
public record ListType(TypeDescriptor element) implements TypeDescriptor {
  public boolean isParameterized() { return element != null; }

  @Override
  public <R> R accept(TypeDescriptorVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeIds.id(this); }
}
