package io.intellixity.schemata.schema;

import io.intellixity.schemata.exceptions.SchemaDefinitionException;
import io.intellixity.schemata.exceptions.SchemaDefinitionException.Kind;
import io.intellixity.schemata.types.*;

/**
 * Rejects field types the engine cannot check: unparameterized containers, map keys that are not
 * int/float/string/any, and Java types without a mapping.
 * <p>
 * Nested schema references are accepted as-is; they are looked up when an instance is built.
 */
public final class SchemaValidator {
  private SchemaValidator() {}

  public static void validate(String schemaId, String field, TypeDescriptor type) {
    if (type == null) {
      throw new SchemaDefinitionException(Kind.UNSUPPORTED_TYPE, schemaId, field, "type is missing");
    }
    type.accept(new Check(schemaId, field));
  }

  private static final class Check implements TypeDescriptorVisitor<Void> {
    private final String schemaId;
    private final String field;

    Check(String schemaId, String field) {
      this.schemaId = schemaId;
      this.field = field;
    }

    @Override public Void visit(PrimitiveType primitive) { return null; }
    @Override public Void visit(AnyType any) { return null; }
    @Override public Void visit(NoneType none) { return null; }
    @Override public Void visit(NestedType nested) { return null; }

    @Override
    public Void visit(ListType list) {
      if (!list.isParameterized()) {
        throw fail(Kind.UNTYPED_CONTAINER, "cannot use untyped list, declare its element type");
      }
      return list.element().accept(this);
    }

    @Override
    public Void visit(MapType map) {
      if (!map.isParameterized()) {
        throw fail(Kind.UNTYPED_CONTAINER, "cannot use untyped map, declare its key and value types");
      }
      if (!isKeyType(map.key())) {
        throw fail(Kind.INVALID_MAP_KEY, "map key type '" + TypeIds.id(map.key())
            + "' is not allowed, use one of int, float, string or any");
      }
      return map.value().accept(this);
    }

    @Override
    public Void visit(OpaqueType opaque) {
      throw fail(Kind.UNSUPPORTED_TYPE, "unsupported type '" + opaque.javaType().getTypeName() + "'");
    }

    private SchemaDefinitionException fail(Kind kind, String message) {
      return new SchemaDefinitionException(kind, schemaId, field, message);
    }
  }

  static boolean isKeyType(TypeDescriptor key) {
    if (key instanceof AnyType) return true;
    return key instanceof PrimitiveType p && p.kind().isKeyKind();
  }
}
