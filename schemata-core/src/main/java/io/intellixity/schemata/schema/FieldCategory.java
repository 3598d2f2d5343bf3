package io.intellixity.schemata.schema;

public enum FieldCategory {
  REQUIRED,
  OPTIONAL
}
