package io.intellixity.schemata.schema;

import java.util.Objects;
import java.util.function.Supplier;

/** Default of an optional field: a literal, or a factory invoked at construction time. */
public sealed interface FieldDefault permits FieldDefault.Literal, FieldDefault.Factory {

  static Literal literal(Object value) { return new Literal(value); }

  static Factory factory(Supplier<?> supplier) { return new Factory(supplier); }

  /** Scalar or null literal; checked against the field type when the schema is built. */
  record Literal(Object value) implements FieldDefault {}

  /** Never invoked while building a schema; its product is checked on every use. */
  record Factory(Supplier<?> supplier) implements FieldDefault {
    public Factory {
      Objects.requireNonNull(supplier, "supplier");
    }
  }
}
