package io.intellixity.schemata.types;

/** Canonical ids for {@link TypeDescriptor} shapes, e.g. {@code map<string,list<int>>}. */
public final class TypeIds {
  private TypeIds() {}

  private static final TypeDescriptorVisitor<String> ID = new TypeDescriptorVisitor<>() {
    @Override public String visit(PrimitiveType primitive) { return primitive.kind().id(); }
    @Override public String visit(AnyType any) { return "any"; }
    @Override public String visit(NoneType none) { return "none"; }

    @Override
    public String visit(ListType list) {
      if (!list.isParameterized()) return "list";
      return "list<" + id(list.element()) + ">";
    }

    @Override
    public String visit(MapType map) {
      if (!map.isParameterized()) return "map";
      return "map<" + id(map.key()) + "," + id(map.value()) + ">";
    }

    @Override public String visit(NestedType nested) { return "ref(" + nested.schemaId() + ")"; }
    @Override public String visit(OpaqueType opaque) { return "opaque(" + opaque.javaType().getTypeName() + ")"; }
  };

  /** Returns the canonical id; parses back with {@link TypeDescriptorParser} except for opaque types. */
  public static String id(TypeDescriptor t) {
    if (t == null) return "?";
    return t.accept(ID);
  }
}
