package io.intellixity.schemata.schema;

import java.util.Collection;

/** Lookup of built schemas by id; nested schema references resolve through it. */
public interface SchemaRegistry {
  /** @throws IllegalArgumentException for an unknown id */
  Schema get(String schemaId);

  boolean contains(String schemaId);

  Collection<Schema> all();
}
