package io.intellixity.schemata.schema;

import io.intellixity.schemata.types.Types;

import java.util.Collection;
import java.util.List;

/** Listed in the test {@code META-INF/schemata.factories}. */
public final class DatabaseSchemaProvider implements SchemaProvider {
  static final String DATABASE = "Database";

  @Override
  public Collection<Schema> schemas() {
    return List.of(Schema.builder(DATABASE)
        .required("url", Types.STRING)
        .optional("poolSize", Types.INT, 4)
        .build());
  }
}
