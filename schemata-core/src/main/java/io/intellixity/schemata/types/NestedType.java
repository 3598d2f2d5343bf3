package io.intellixity.schemata.types;

/** Reference to another registered schema, built recursively from a sub-mapping. */
public record NestedType(String schemaId) implements TypeDescriptor {
  public NestedType {
    if (schemaId == null || schemaId.isBlank()) throw new IllegalArgumentException("schemaId is blank");
    schemaId = schemaId.trim();
  }

  @Override
  public <R> R accept(TypeDescriptorVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return TypeIds.id(this); }
}
