package io.intellixity.schemata.schema;

import io.intellixity.schemata.exceptions.SchemaDefinitionException;
import io.intellixity.schemata.exceptions.SchemaDefinitionException.Kind;
import io.intellixity.schemata.types.Types;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaTest {

  private static Kind rejected(Schema.Builder b) {
    return assertThrows(SchemaDefinitionException.class, b::build).kind();
  }

  @Test
  void classification_followsDefaults() {
    Schema s = Schema.builder("Server")
        .required("host", Types.STRING)
        .optional("port", Types.INT, 8080)
        .optional("comment", Types.STRING, null)
        .field("mode", Types.STRING, FieldOptions.options().alias("run-mode"))
        .field("level", Types.INT, FieldOptions.options().defaultValue(1).allowedValues(1, 2))
        .build();

    assertEquals(List.of("host", "mode"), s.requiredFields().stream().map(FieldSpec::name).toList());
    assertEquals(List.of("port", "comment", "level"), s.optionalFields().stream().map(FieldSpec::name).toList());
    assertEquals(FieldDefault.literal(null), s.field("comment").defaultValue());
    assertEquals("run-mode", s.field("mode").alias());
    assertEquals(Map.of("level", List.of(1, 2)), s.options());
    assertEquals("mode", s.aliases().get("run-mode"));
    assertNull(s.fieldForKey("mode"));
    assertSame(s.field("host"), s.fieldForKey("host"));
  }

  @Test
  void literalDefault_ofWrongKind_isRejected() {
    assertEquals(Kind.INVALID_DEFAULT, rejected(Schema.builder("S").optional("port", Types.INT, "8080")));
    assertEquals(Kind.INVALID_DEFAULT, rejected(Schema.builder("S").optional("ratio", Types.FLOAT, 1)));
    assertEquals(Kind.INVALID_DEFAULT, rejected(Schema.builder("S").optional("tags", Types.listOf(Types.STRING), List.of())));
  }

  @Test
  void factoryDefault_isNotInvokedWhileBuilding() {
    AtomicInteger calls = new AtomicInteger();
    Supplier<Object> wrong = () -> {
      calls.incrementAndGet();
      return "not a list";
    };
    Schema s = Schema.builder("S").optional("tags", Types.listOf(Types.STRING), wrong).build();

    assertEquals(0, calls.get());
    assertInstanceOf(FieldDefault.Factory.class, s.field("tags").defaultValue());
  }

  @Test
  void defaultOutsideOptions_isRejected() {
    assertEquals(Kind.DEFAULT_NOT_IN_OPTIONS, rejected(Schema.builder("S")
        .field("level", Types.INT, FieldOptions.options().defaultValue(3).allowedValues(1, 2))));
  }

  @Test
  void options_mustMatchTheFieldType() {
    assertEquals(Kind.INVALID_OPTIONS, rejected(Schema.builder("S")
        .field("level", Types.INT, FieldOptions.options().allowedValues(1, "2"))));
    assertEquals(Kind.INVALID_OPTIONS, rejected(Schema.builder("S")
        .field("tls", Types.nested("Tls"), FieldOptions.options().allowedValues(Map.of()))));
  }

  @Test
  void duplicateNamesAndKeys_areRejected() {
    assertEquals(Kind.DUPLICATE_FIELD, rejected(Schema.builder("S")
        .required("a", Types.INT)
        .required("a", Types.STRING)));
    assertEquals(Kind.DUPLICATE_FIELD, rejected(Schema.builder("S")
        .required("a", Types.INT)
        .field("b", Types.INT, FieldOptions.options().alias("a"))));
  }

  @Test
  void invalidFieldType_failsTheWholeSchema() {
    assertEquals(Kind.UNTYPED_CONTAINER, rejected(Schema.builder("S")
        .required("ok", Types.INT)
        .required("bad", Types.untypedMap())));
  }

  @Test
  void settings_defaultToStrict() {
    assertEquals(SchemaSettings.DEFAULTS, Schema.builder("S").build().settings());
    assertEquals(new SchemaSettings(true, false), Schema.builder("S").ignoreUnknownFields(true).build().settings());
  }
}
