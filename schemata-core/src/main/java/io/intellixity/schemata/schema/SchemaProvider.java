package io.intellixity.schemata.schema;

import java.util.Collection;

/**
 * Contributes schemas to {@link InMemorySchemaRegistry#discover()}.
 * <p>
 * Implementations are listed in {@code META-INF/schemata.factories} and need a public no-arg constructor.
 */
public interface SchemaProvider {
  Collection<Schema> schemas();
}
