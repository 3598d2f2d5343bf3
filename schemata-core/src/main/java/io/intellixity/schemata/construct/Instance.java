package io.intellixity.schemata.construct;

import io.intellixity.schemata.schema.FieldSpec;
import io.intellixity.schemata.schema.Schema;
import io.intellixity.schemata.types.NativeKind;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Typed record built from one document mapping.
 * <p>
 * Holds only fields that were set, either from the document or from a default. Required fields left out
 * under {@code ignoreMissingFields} are simply not set. Values own their containers; nothing aliases the input.
 */
public final class Instance {
  private final Schema schema;
  private final Map<String, Object> values;

  Instance(Schema schema, Map<String, Object> values) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public Schema schema() { return schema; }
  public String schemaId() { return schema.id(); }

  public boolean isSet(String field) {
    requireDeclared(field);
    return values.containsKey(field);
  }

  /** Value of a declared field, null when unset. */
  public Object get(String field) {
    requireDeclared(field);
    return values.get(field);
  }

  public String getString(String field) {
    Object v = get(field);
    if (v == null || v instanceof String) return (String) v;
    throw kindMismatch(field, v, "string");
  }

  public Long getLong(String field) {
    Object v = get(field);
    if (v == null) return null;
    if (NativeKind.of(v) != NativeKind.INTEGER) throw kindMismatch(field, v, "int");
    if (v instanceof BigInteger b) {
      if (b.bitLength() > 63) {
        throw new IllegalStateException("Field '" + field + "' holds " + b + ", outside the long range; use getBigInteger");
      }
      return b.longValue();
    }
    return ((Number) v).longValue();
  }

  /** Any integer value, widened to {@link BigInteger}. */
  public BigInteger getBigInteger(String field) {
    Object v = get(field);
    if (v == null) return null;
    if (NativeKind.of(v) != NativeKind.INTEGER) throw kindMismatch(field, v, "int");
    if (v instanceof BigInteger b) return b;
    return BigInteger.valueOf(((Number) v).longValue());
  }

  public Double getDouble(String field) {
    Object v = get(field);
    if (v == null) return null;
    if (NativeKind.of(v) != NativeKind.FLOAT) throw kindMismatch(field, v, "float");
    return ((Number) v).doubleValue();
  }

  public Boolean getBoolean(String field) {
    Object v = get(field);
    if (v == null || v instanceof Boolean) return (Boolean) v;
    throw kindMismatch(field, v, "bool");
  }

  @SuppressWarnings("unchecked")
  public List<Object> getList(String field) {
    Object v = get(field);
    if (v == null || v instanceof List<?>) return (List<Object>) v;
    throw kindMismatch(field, v, "list");
  }

  @SuppressWarnings("unchecked")
  public Map<Object, Object> getMap(String field) {
    Object v = get(field);
    if (v == null || v instanceof Map<?, ?>) return (Map<Object, Object>) v;
    throw kindMismatch(field, v, "map");
  }

  public Instance getNested(String field) {
    Object v = get(field);
    if (v == null || v instanceof Instance) return (Instance) v;
    throw kindMismatch(field, v, "ref");
  }

  /** Top-level field name to value, in declaration order. Nested instances stay {@link Instance}s. */
  public Map<String, Object> asMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldSpec f : schema.fields()) {
      if (values.containsKey(f.name())) out.put(f.name(), values.get(f.name()));
    }
    return out;
  }

  private void requireDeclared(String field) {
    if (schema.field(field) == null) {
      throw new IllegalArgumentException("Unknown field '" + field + "' for schema '" + schema.id() + "'");
    }
  }

  private static IllegalStateException kindMismatch(String field, Object v, String wanted) {
    return new IllegalStateException("Field '" + field + "' holds " + NativeKind.typeName(v) + ", not " + wanted);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Instance other)) return false;
    return schema.id().equals(other.schema.id()) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema.id(), values);
  }

  /** {@code Server(host=db, port=5432)}: required fields first, then optional, unset fields skipped. */
  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", schema.id() + "(", ")");
    appendFields(sj, true);
    appendFields(sj, false);
    return sj.toString();
  }

  private void appendFields(StringJoiner sj, boolean required) {
    for (FieldSpec f : schema.fields()) {
      if (f.isRequired() == required && values.containsKey(f.name())) {
        sj.add(f.name() + "=" + values.get(f.name()));
      }
    }
  }
}
