package io.intellixity.schemata.schema;

import io.intellixity.schemata.types.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record type definition: ordered fields plus alias and allow-list tables.
 * <p>
 * Built once through {@link #builder(String)}, which validates every field type and default and fails with
 * {@link io.intellixity.schemata.exceptions.SchemaDefinitionException}. Shared read-only by every
 * construction call.
 */
public final class Schema {
  private static final Logger log = LoggerFactory.getLogger(Schema.class);

  private final String id;
  private final SchemaSettings settings;
  private final List<FieldSpec> fields;
  private final Map<String, FieldSpec> byName;
  private final Map<String, String> aliases;
  private final Map<String, List<Object>> options;

  private Schema(String id, SchemaSettings settings, FieldClassifier.Classification c) {
    this.id = id;
    this.settings = settings;
    this.fields = c.fields();
    Map<String, FieldSpec> m = new LinkedHashMap<>();
    for (FieldSpec f : fields) m.put(f.name(), f);
    this.byName = Map.copyOf(m);
    this.aliases = c.aliases();
    this.options = c.options();
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public String id() { return id; }
  public SchemaSettings settings() { return settings; }

  /** Fields in declaration order. */
  public List<FieldSpec> fields() { return fields; }

  /** Field by internal name, or null. */
  public FieldSpec field(String name) { return byName.get(name); }

  /** Field a document key maps to, or null. A field with an alias is not reachable under its own name. */
  public FieldSpec fieldForKey(Object externalKey) {
    String name = aliases.get(externalKey);
    return name == null ? null : byName.get(name);
  }

  /** Document key to internal field name. */
  public Map<String, String> aliases() { return aliases; }

  /** Field name to allowed values, for fields that restrict them. */
  public Map<String, List<Object>> options() { return options; }

  public List<FieldSpec> requiredFields() {
    return fields.stream().filter(FieldSpec::isRequired).toList();
  }

  public List<FieldSpec> optionalFields() {
    return fields.stream().filter(f -> !f.isRequired()).toList();
  }

  @Override
  public String toString() {
    return "Schema(" + id + ", fields=" + byName.keySet() + ")";
  }

  public static final class Builder {
    private final String id;
    private final List<FieldDeclaration> declarations = new ArrayList<>();
    private SchemaSettings settings = SchemaSettings.DEFAULTS;

    private Builder(String id) {
      if (id == null || id.isBlank()) throw new IllegalArgumentException("schema id is blank");
      this.id = id.trim();
    }

    public Builder field(FieldDeclaration declaration) {
      declarations.add(Objects.requireNonNull(declaration, "declaration"));
      return this;
    }

    public Builder required(String name, TypeDescriptor type) {
      return field(FieldDeclaration.of(name, type));
    }

    /** {@code defaultSpec} is a scalar literal, null, a {@link java.util.function.Supplier} or a {@link FieldDefault}. */
    public Builder optional(String name, TypeDescriptor type, Object defaultSpec) {
      return field(FieldDeclaration.of(name, type, defaultSpec));
    }

    public Builder field(String name, TypeDescriptor type, FieldOptions options) {
      return field(FieldDeclaration.of(name, type, Objects.requireNonNull(options, "options")));
    }

    public Builder settings(SchemaSettings settings) {
      this.settings = Objects.requireNonNull(settings, "settings");
      return this;
    }

    public Builder ignoreUnknownFields(boolean v) {
      this.settings = settings.withIgnoreUnknownFields(v);
      return this;
    }

    public Builder ignoreMissingFields(boolean v) {
      this.settings = settings.withIgnoreMissingFields(v);
      return this;
    }

    public Schema build() {
      Schema schema = new Schema(id, settings, FieldClassifier.classify(id, declarations));
      log.debug("schemata.schema_built id={} required={} optional={} aliases={} settings={}",
          id, schema.requiredFields().size(), schema.optionalFields().size(), schema.aliases().size(), settings);
      return schema;
    }
  }
}
