package io.intellixity.schemata.yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Parses YAML or JSON text into the untyped tree construction consumes.
 * <p>
 * The tree contains {@code Map} (insertion ordered), {@code List}, {@code String},
 * {@code Integer}/{@code Long}/{@code BigInteger}, {@code Double}, {@code Boolean} and null.
 * YAML mapping keys keep their scalar type ({@code 1: a} has an {@code Integer} key); JSON keys are strings.
 */
public final class DocumentReader {
  private static final Logger log = LoggerFactory.getLogger(DocumentReader.class);

  private static final ObjectMapper JSON = new ObjectMapper();

  public Object read(String text, DocumentFormat format) {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(format, "format");
    return format == DocumentFormat.YAML ? readYaml(text) : readJson(text);
  }

  public Object read(Path file) {
    DocumentFormat format = DocumentFormat.of(file);
    log.debug("schemata.document_read path={} format={}", file, format);
    return read(readText(file), format);
  }

  /** Like {@link #read(String, DocumentFormat)} but the root must be a mapping. */
  public Map<Object, Object> readMapping(String text, DocumentFormat format) {
    return requireMapping(read(text, format), format.toString());
  }

  public Map<Object, Object> readMapping(Path file) {
    return requireMapping(read(file), file.toString());
  }

  static String readText(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DocumentException("Failed to read " + file, e);
    }
  }

  private static Object readJson(String text) {
    try {
      return JSON.readValue(text, Object.class);
    } catch (JsonProcessingException e) {
      throw new DocumentException("Malformed JSON document: " + e.getOriginalMessage(), e);
    }
  }

  // Yaml instances are not thread-safe.
  private static Object readYaml(String text) {
    try {
      return new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
    } catch (YAMLException e) {
      throw new DocumentException("Malformed YAML document: " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<Object, Object> requireMapping(Object root, String source) {
    if (root instanceof Map<?, ?> m) return (Map<Object, Object>) m;
    String actual = root == null ? "an empty document" : root.getClass().getSimpleName();
    throw new DocumentException("Document root must be a mapping in " + source + ", got " + actual);
  }
}
