package io.intellixity.schemata.types;

public interface TypeDescriptorVisitor<R> {
  R visit(PrimitiveType primitive);
  R visit(AnyType any);
  R visit(NoneType none);
  R visit(ListType list);
  R visit(MapType map);
  R visit(NestedType nested);
  R visit(OpaqueType opaque);
}
