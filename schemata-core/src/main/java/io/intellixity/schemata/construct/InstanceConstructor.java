package io.intellixity.schemata.construct;

import io.intellixity.schemata.exceptions.ConstructionException;
import io.intellixity.schemata.schema.FieldDefault;
import io.intellixity.schemata.schema.FieldSpec;
import io.intellixity.schemata.schema.Schema;
import io.intellixity.schemata.schema.SchemaRegistry;
import io.intellixity.schemata.types.NativeKind;
import io.intellixity.schemata.util.Values;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds {@link Instance}s of registered schemas from untyped input.
 * <p>
 * Per call: choose the input source, then for every input entry translate its key through the alias
 * table, check the raw value kind and allow-list, and resolve it against the field type. Required fields
 * not seen fail the call (unless the schema ignores missing fields); optional fields not seen get their
 * default, factories being invoked and checked here. The first error aborts the call.
 * <p>
 * Stateless apart from the registry, so concurrent calls are safe as long as callers do not mutate
 * the input while it is being read.
 */
public final class InstanceConstructor {
  private final SchemaRegistry registry;
  private final TypeResolver resolver;

  public InstanceConstructor(SchemaRegistry registry) {
    this(registry, ResolverSettings.DEFAULTS);
  }

  public InstanceConstructor(SchemaRegistry registry, ResolverSettings settings) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.resolver = new TypeResolver(this::constructNested, settings);
  }

  public SchemaRegistry registry() { return registry; }

  public Instance construct(String schemaId, Arguments args) {
    return construct(registry.get(schemaId), args);
  }

  public Instance construct(Schema schema, Arguments args) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(args, "args");
    return build(schema, chooseSource(schema, args), 0);
  }

  public Instance fromMapping(String schemaId, Map<?, ?> mapping) {
    return construct(schemaId, Arguments.of(mapping));
  }

  public Instance fromFields(String schemaId, Map<String, ?> fields) {
    return construct(schemaId, Arguments.named(fields));
  }

  /** Construction function closed over one schema, mapping each instance to an application type. */
  public <T> TypedConstructor<T> typed(String schemaId, Function<Instance, T> mapper) {
    return new TypedConstructor<>(this, registry.get(schemaId), mapper);
  }

  private Instance constructNested(String schemaId, Map<?, ?> mapping, int depth) {
    return build(registry.get(schemaId), mapping, depth);
  }

  private static Map<?, ?> chooseSource(Schema schema, Arguments args) {
    List<Object> positional = args.positional();
    Map<String, Object> named = args.named();
    if (!positional.isEmpty() && !named.isEmpty()) {
      throw ConstructionException.usageError(schema.id(), "pass either a mapping or named fields, not both");
    }
    if (positional.size() > 1) {
      throw ConstructionException.usageError(schema.id(), "expected one mapping, got " + positional.size() + " arguments");
    }
    if (positional.isEmpty()) return named;
    Object only = positional.get(0);
    if (!(only instanceof Map<?, ?> m)) {
      throw ConstructionException.usageError(schema.id(), "expected a mapping, got " + NativeKind.typeName(only));
    }
    return m;
  }

  private Instance build(Schema schema, Map<?, ?> source, int depth) {
    Map<String, Object> values = new LinkedHashMap<>();
    Set<String> seen = new HashSet<>();

    for (var e : source.entrySet()) {
      Object rawKey = e.getKey();
      Object raw = e.getValue();
      String external = String.valueOf(rawKey);

      FieldSpec field = schema.fieldForKey(rawKey);
      if (field == null) {
        if (!schema.settings().ignoreUnknownFields()) throw ConstructionException.unknownArgument(external, raw);
        continue;
      }
      seen.add(field.name());

      if (!NativeKind.of(raw).isSupportedFieldValue()) throw ConstructionException.unsupportedType(external, raw);
      if (field.hasAllowedValues() && !Values.isOneOf(raw, field.allowedValues())) {
        throw ConstructionException.valueNotAnOption(external, raw, field.allowedValues());
      }
      values.put(field.name(), resolver.resolve(external, raw, field.type(), depth));
    }

    for (FieldSpec field : schema.fields()) {
      if (seen.contains(field.name())) continue;
      if (field.isRequired()) {
        if (!schema.settings().ignoreMissingFields()) {
          throw ConstructionException.missingRequiredArgument(field.name(), schema.id());
        }
        continue;
      }
      values.put(field.name(), defaultValue(field, depth));
    }

    return new Instance(schema, values);
  }

  private Object defaultValue(FieldSpec field, int depth) {
    FieldDefault d = field.defaultValue();
    if (d instanceof FieldDefault.Factory f) {
      return resolver.resolve(field.name(), f.supplier().get(), field.type(), depth);
    }
    return ((FieldDefault.Literal) d).value();
  }
}
