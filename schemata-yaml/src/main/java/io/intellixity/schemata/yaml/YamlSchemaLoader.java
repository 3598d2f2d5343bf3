package io.intellixity.schemata.yaml;

import io.intellixity.schemata.schema.FieldDeclaration;
import io.intellixity.schemata.schema.FieldOptions;
import io.intellixity.schemata.schema.Schema;
import io.intellixity.schemata.types.TypeDescriptor;
import io.intellixity.schemata.types.TypeDescriptorParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads schema declarations from YAML.
 * <pre>
 * schemas:
 *   Server:
 *     ignoreUnknownFields: false
 *     fields:
 *       host: string
 *       port: { type: int, default: 8080 }
 *       mode: { type: string, alias: run-mode, default: dev, options: [dev, prod] }
 *       tls: ref(Tls)
 * </pre>
 * A field given as a type string is required. A field mapping without {@code alias}/{@code options} is
 * optional exactly when it has a {@code default} key; with them, a missing or null default means required.
 */
public final class YamlSchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlSchemaLoader.class);

  private static final Set<String> SCHEMA_KEYS = Set.of("fields", "ignoreUnknownFields", "ignoreMissingFields");
  private static final Set<String> FIELD_KEYS = Set.of("type", "alias", "default", "options");

  private final DocumentReader reader = new DocumentReader();

  public List<Schema> load(String yaml) {
    return parse(reader.readMapping(yaml, DocumentFormat.YAML), "<string>");
  }

  public List<Schema> load(Path file) {
    return parse(reader.readMapping(DocumentReader.readText(file), DocumentFormat.YAML), file.toString());
  }

  /** All {@code *.yaml}/{@code *.yml} files directly in {@code dir}, in file name order. */
  public List<Schema> loadDir(Path dir) {
    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files = s.filter(Files::isRegularFile)
          .filter(p -> {
            String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
            return n.endsWith(".yaml") || n.endsWith(".yml");
          })
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new DocumentException("Failed to list schema directory " + dir, e);
    }
    List<Schema> out = new ArrayList<>();
    for (Path f : files) out.addAll(load(f));
    log.debug("schemata.schema_dir_loaded dir={} files={} schemas={}", dir, files.size(), out.size());
    return out;
  }

  private List<Schema> parse(Map<Object, Object> root, String source) {
    Object schemas = root.get("schemas");
    if (!(schemas instanceof Map<?, ?> sm)) {
      throw new DocumentException("Schema file " + source + " must have a 'schemas' mapping");
    }
    if (root.size() > 1) {
      throw new DocumentException("Unknown top-level keys in " + source + ": " + without(root.keySet(), Set.of("schemas")));
    }

    List<Schema> out = new ArrayList<>();
    for (var e : sm.entrySet()) {
      String schemaId = String.valueOf(e.getKey());
      out.add(parseSchema(schemaId, e.getValue(), source));
    }
    log.debug("schemata.schemas_loaded source={} ids={}", source, out.stream().map(Schema::id).toList());
    return out;
  }

  private Schema parseSchema(String schemaId, Object body, String source) {
    Schema.Builder b = Schema.builder(schemaId);
    if (body == null) return b.build();
    if (!(body instanceof Map<?, ?> m)) {
      throw new DocumentException("Schema '" + schemaId + "' in " + source + " must be a mapping");
    }
    List<String> unknown = without(m.keySet(), SCHEMA_KEYS);
    if (!unknown.isEmpty()) {
      throw new DocumentException("Unknown keys for schema '" + schemaId + "' in " + source + ": " + unknown);
    }

    b.ignoreUnknownFields(flag(m.get("ignoreUnknownFields"), schemaId, "ignoreUnknownFields"));
    b.ignoreMissingFields(flag(m.get("ignoreMissingFields"), schemaId, "ignoreMissingFields"));

    Object fields = m.get("fields");
    if (fields != null) {
      if (!(fields instanceof Map<?, ?> fm)) {
        throw new DocumentException("'fields' of schema '" + schemaId + "' must be a mapping");
      }
      for (var f : fm.entrySet()) {
        b.field(parseField(schemaId, String.valueOf(f.getKey()), f.getValue()));
      }
    }
    return b.build();
  }

  private static FieldDeclaration parseField(String schemaId, String name, Object spec) {
    if (spec instanceof String typeId) {
      return FieldDeclaration.of(name, type(schemaId, name, typeId));
    }
    if (!(spec instanceof Map<?, ?> m)) {
      throw new DocumentException("Field '" + name + "' of schema '" + schemaId + "' must be a type or a mapping");
    }
    List<String> unknown = without(m.keySet(), FIELD_KEYS);
    if (!unknown.isEmpty()) {
      throw new DocumentException("Unknown keys for field '" + name + "' of schema '" + schemaId + "': " + unknown);
    }
    if (!(m.get("type") instanceof String typeId)) {
      throw new DocumentException("Field '" + name + "' of schema '" + schemaId + "' needs a 'type'");
    }
    TypeDescriptor type = type(schemaId, name, typeId);

    if (!m.containsKey("alias") && !m.containsKey("options")) {
      return m.containsKey("default")
          ? FieldDeclaration.of(name, type, m.get("default"))
          : FieldDeclaration.of(name, type);
    }

    FieldOptions o = FieldOptions.options();
    Object alias = m.get("alias");
    if (alias != null) o = o.alias(String.valueOf(alias));
    o = o.defaultValue(m.get("default"));
    Object options = m.get("options");
    if (options != null) {
      if (!(options instanceof List<?> l)) {
        throw new DocumentException("'options' of field '" + name + "' of schema '" + schemaId + "' must be a list");
      }
      o = o.allowedValues(l);
    }
    return FieldDeclaration.of(name, type, o);
  }

  private static TypeDescriptor type(String schemaId, String name, String typeId) {
    try {
      return TypeDescriptorParser.parse(typeId);
    } catch (IllegalArgumentException e) {
      throw new DocumentException("Field '" + name + "' of schema '" + schemaId + "': " + e.getMessage(), e);
    }
  }

  private static boolean flag(Object v, String schemaId, String key) {
    if (v == null) return false;
    if (v instanceof Boolean b) return b;
    throw new DocumentException("'" + key + "' of schema '" + schemaId + "' must be true or false");
  }

  private static List<String> without(Set<?> keys, Set<String> allowed) {
    List<String> out = new ArrayList<>();
    for (Object k : keys) {
      if (!allowed.contains(String.valueOf(k))) out.add(String.valueOf(k));
    }
    return out;
  }
}
