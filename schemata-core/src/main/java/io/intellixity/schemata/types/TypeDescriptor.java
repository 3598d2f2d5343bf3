package io.intellixity.schemata.types;

/**
 * Expected shape of a value.
 * <p>
 * Descriptors are immutable, finite trees. Every consumer dispatches through
 * {@link TypeDescriptorVisitor}, so adding a shape breaks every consumer at compile time.
 */
public sealed interface TypeDescriptor
    permits PrimitiveType, AnyType, NoneType, ListType, MapType, NestedType, OpaqueType {

  <R> R accept(TypeDescriptorVisitor<R> visitor);
}
