package io.intellixity.schemata.construct;

import io.intellixity.schemata.schema.Schema;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/** Builds application objects of one schema: construct the {@link Instance}, then map it. */
public final class TypedConstructor<T> {
  private final InstanceConstructor constructor;
  private final Schema schema;
  private final Function<Instance, T> mapper;

  TypedConstructor(InstanceConstructor constructor, Schema schema, Function<Instance, T> mapper) {
    this.constructor = Objects.requireNonNull(constructor, "constructor");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public Schema schema() { return schema; }

  public T construct(Arguments args) {
    return mapper.apply(constructor.construct(schema, args));
  }

  public T fromMapping(Map<?, ?> mapping) {
    return construct(Arguments.of(mapping));
  }

  public T fromFields(Map<String, ?> fields) {
    return construct(Arguments.named(fields));
  }
}
