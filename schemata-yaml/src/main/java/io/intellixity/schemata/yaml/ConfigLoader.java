package io.intellixity.schemata.yaml;

import io.intellixity.schemata.construct.Instance;
import io.intellixity.schemata.construct.InstanceConstructor;
import io.intellixity.schemata.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/** Reads a configuration document and constructs an instance of a registered schema from it. */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private final DocumentReader reader = new DocumentReader();
  private final InstanceConstructor constructor;

  public ConfigLoader(SchemaRegistry registry) {
    this(new InstanceConstructor(registry));
  }

  public ConfigLoader(InstanceConstructor constructor) {
    this.constructor = Objects.requireNonNull(constructor, "constructor");
  }

  public Instance load(Path document, String schemaId) {
    Map<Object, Object> root = reader.readMapping(document);
    Instance instance = constructor.fromMapping(schemaId, root);
    log.debug("schemata.config_loaded path={} schema={}", document, schemaId);
    return instance;
  }

  public <T> T load(Path document, String schemaId, Function<Instance, T> mapper) {
    return Objects.requireNonNull(mapper, "mapper").apply(load(document, schemaId));
  }

  public Instance load(String text, DocumentFormat format, String schemaId) {
    return constructor.fromMapping(schemaId, reader.readMapping(text, format));
  }
}
