package io.intellixity.schemata.schema;

import io.intellixity.schemata.util.SchemataFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory {@link SchemaRegistry}.
 * <p>
 * Register every schema before constructing instances from it; construction only reads the registry.
 */
public final class InMemorySchemaRegistry implements SchemaRegistry {
  private static final Logger log = LoggerFactory.getLogger(InMemorySchemaRegistry.class);

  private final Map<String, Schema> schemas = new ConcurrentHashMap<>();

  public InMemorySchemaRegistry() {}

  public InMemorySchemaRegistry(Collection<Schema> schemas) {
    register(schemas);
  }

  /** Registry holding the schemas of every {@link SchemaProvider} in {@code META-INF/schemata.factories}. */
  public static InMemorySchemaRegistry discover() {
    return discover(SchemataFactoriesLoader.load(SchemaProvider.class));
  }

  static InMemorySchemaRegistry discover(List<SchemaProvider> providers) {
    InMemorySchemaRegistry reg = new InMemorySchemaRegistry();
    for (SchemaProvider p : providers) {
      if (p == null) continue;
      Collection<Schema> contributed = p.schemas();
      if (contributed == null) continue;
      reg.register(contributed);
      log.debug("schemata.provider_registered provider={} schemas={}", p.getClass().getName(), contributed.size());
    }
    return reg;
  }

  public InMemorySchemaRegistry register(Schema schema) {
    Objects.requireNonNull(schema, "schema");
    Schema prev = schemas.putIfAbsent(schema.id(), schema);
    if (prev != null) throw new IllegalArgumentException("Schema already registered: " + schema.id());
    log.debug("schemata.schema_registered id={}", schema.id());
    return this;
  }

  public InMemorySchemaRegistry register(Collection<Schema> schemas) {
    for (Schema s : Objects.requireNonNull(schemas, "schemas")) register(s);
    return this;
  }

  @Override
  public Schema get(String schemaId) {
    Schema s = schemaId == null ? null : schemas.get(schemaId);
    if (s == null) throw new IllegalArgumentException("Unknown schema: " + schemaId);
    return s;
  }

  @Override
  public boolean contains(String schemaId) {
    return schemaId != null && schemas.containsKey(schemaId);
  }

  @Override
  public Collection<Schema> all() {
    return Collections.unmodifiableCollection(schemas.values());
  }
}
