package io.intellixity.schemata.schema;

import io.intellixity.schemata.construct.ResolverSettings;
import io.intellixity.schemata.construct.TypeResolver;
import io.intellixity.schemata.exceptions.ConstructionException;
import io.intellixity.schemata.exceptions.SchemaDefinitionException;
import io.intellixity.schemata.exceptions.SchemaDefinitionException.Kind;
import io.intellixity.schemata.types.*;
import io.intellixity.schemata.util.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Turns field declarations into required/optional {@link FieldSpec}s plus the alias and allow-list tables.
 * <p>
 * Literal defaults and allowed values are checked against the field type here; factory defaults are not
 * invoked until an instance needs them.
 */
final class FieldClassifier {
  private FieldClassifier() {}

  /** Literal defaults and allowed values never reach a schema reference, so nested lookups are refused. */
  private static final TypeResolver LITERALS = new TypeResolver((schemaId, mapping, depth) -> {
    throw new IllegalStateException("schema '" + schemaId + "' cannot be referenced while defining a schema");
  }, ResolverSettings.DEFAULTS);

  record Classification(
      List<FieldSpec> fields,
      /** External key to internal field name. */
      Map<String, String> aliases,
      Map<String, List<Object>> options
  ) {}

  static Classification classify(String schemaId, List<FieldDeclaration> declarations) {
    Map<String, FieldSpec> fields = new LinkedHashMap<>();
    Map<String, String> aliases = new LinkedHashMap<>();
    Map<String, List<Object>> options = new LinkedHashMap<>();

    for (FieldDeclaration d : declarations) {
      String name = d.name();
      SchemaValidator.validate(schemaId, name, d.type());
      if (fields.containsKey(name)) {
        throw new SchemaDefinitionException(Kind.DUPLICATE_FIELD, schemaId, name, "field declared twice");
      }

      FieldSpec spec = classify(schemaId, d);
      if (aliases.containsKey(spec.alias())) {
        throw new SchemaDefinitionException(Kind.DUPLICATE_FIELD, schemaId, name,
            "document key '" + spec.alias() + "' already maps to field '" + aliases.get(spec.alias()) + "'");
      }
      fields.put(name, spec);
      aliases.put(spec.alias(), name);
      if (spec.hasAllowedValues()) options.put(name, spec.allowedValues());
    }

    return new Classification(
        List.copyOf(fields.values()),
        Collections.unmodifiableMap(aliases),
        Collections.unmodifiableMap(options));
  }

  private static FieldSpec classify(String schemaId, FieldDeclaration d) {
    String name = d.name();
    TypeDescriptor type = d.type();
    if (!d.hasDefault()) {
      return new FieldSpec(name, type, FieldCategory.REQUIRED, null, name, null);
    }
    if (!(d.defaultSpec() instanceof FieldOptions o)) {
      FieldDefault def = checkDefault(schemaId, name, type, d.defaultSpec());
      return new FieldSpec(name, type, FieldCategory.OPTIONAL, def, name, null);
    }

    FieldDefault def = o.hasDefault() ? checkDefault(schemaId, name, type, o.defaultValue()) : null;
    List<Object> allowed = null;
    if (o.allowedValues() != null) {
      allowed = checkOptions(schemaId, name, type, o.allowedValues());
      if (def instanceof FieldDefault.Literal lit && lit.value() != null && !Values.isOneOf(lit.value(), allowed)) {
        throw new SchemaDefinitionException(Kind.DEFAULT_NOT_IN_OPTIONS, schemaId, name,
            "default '" + lit.value() + "' is not one of " + allowed);
      }
    }
    String alias = o.alias() != null ? o.alias() : name;
    FieldCategory category = def == null ? FieldCategory.REQUIRED : FieldCategory.OPTIONAL;
    return new FieldSpec(name, type, category, def, alias, allowed);
  }

  private static FieldDefault checkDefault(String schemaId, String name, TypeDescriptor type, Object spec) {
    if (spec instanceof FieldDefault.Factory f) return f;
    if (spec instanceof Supplier<?> s) return FieldDefault.factory(s);

    Object literal = spec instanceof FieldDefault.Literal l ? l.value() : spec;
    NativeKind kind = NativeKind.of(literal);
    if (kind != NativeKind.NONE && !kind.isScalar()) {
      throw new SchemaDefinitionException(Kind.INVALID_DEFAULT, schemaId, name,
          "default must be a string, number, boolean, null or a factory, got " + NativeKind.typeName(literal));
    }
    try {
      LITERALS.resolve("Default of " + name, literal, type);
    } catch (ConstructionException e) {
      throw new SchemaDefinitionException(Kind.INVALID_DEFAULT, schemaId, name, e.getMessage(), e);
    }
    return FieldDefault.literal(literal);
  }

  private static List<Object> checkOptions(String schemaId, String name, TypeDescriptor type, List<Object> allowed) {
    if (referencesSchema(type)) {
      throw new SchemaDefinitionException(Kind.INVALID_OPTIONS, schemaId, name,
          "allowed values are not supported for fields of type '" + TypeIds.id(type) + "'");
    }
    try {
      LITERALS.resolve("Options of " + schemaId + "." + name, new ArrayList<>(allowed), new ListType(type));
    } catch (ConstructionException e) {
      throw new SchemaDefinitionException(Kind.INVALID_OPTIONS, schemaId, name, e.getMessage(), e);
    }
    return allowed;
  }

  private static boolean referencesSchema(TypeDescriptor type) {
    return type.accept(new TypeDescriptorVisitor<Boolean>() {
      @Override public Boolean visit(PrimitiveType primitive) { return false; }
      @Override public Boolean visit(AnyType any) { return false; }
      @Override public Boolean visit(NoneType none) { return false; }
      @Override public Boolean visit(ListType list) { return list.element().accept(this); }
      @Override public Boolean visit(MapType map) { return map.key().accept(this) || map.value().accept(this); }
      @Override public Boolean visit(NestedType nested) { return true; }
      @Override public Boolean visit(OpaqueType opaque) { return false; }
    });
  }
}
