package io.intellixity.schemata.yaml;

import io.intellixity.schemata.construct.Instance;
import io.intellixity.schemata.exceptions.ConstructionException;
import io.intellixity.schemata.schema.InMemorySchemaRegistry;
import io.intellixity.schemata.schema.Schema;
import io.intellixity.schemata.types.Types;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.schemata.yaml.YamlSchemaLoaderTest.resource;
import static org.junit.jupiter.api.Assertions.*;

final class ConfigLoaderTest {

  private static final InMemorySchemaRegistry REGISTRY =
      new InMemorySchemaRegistry(new YamlSchemaLoader().loadDir(resource("/schemas")));

  private final ConfigLoader loader = new ConfigLoader(REGISTRY);

  @Test
  void yamlDocument_buildsNestedInstances() {
    Instance server = loader.load(resource("/config/server.yaml"), "Server");

    assertEquals("db.internal", server.getString("host"));
    assertEquals(5432L, server.getLong("port"));
    assertEquals("prod", server.getString("mode"));
    assertEquals("/etc/tls/db.pem", server.getNested("tls").getString("cert"));
    assertTrue(server.getNested("tls").getBoolean("verify"));
    assertEquals(Map.of("zone", "eu-1"), server.getMap("labels"));
  }

  @Test
  void jsonDocument_buildsTheSameInstance() {
    assertEquals(
        loader.load(resource("/config/server.yaml"), "Server"),
        loader.load(resource("/config/server.json"), "Server"));
  }

  @Test
  void errorsInsideLists_carryTheDocumentPath() {
    ConstructionException e = assertThrows(ConstructionException.class,
        () -> loader.load(resource("/config/cluster.yml"), "Cluster"));
    assertEquals(ConstructionException.Kind.WRONG_TYPE, e.kind());
    assertEquals("servers[1].tls.cert", e.pathString());
  }

  @Test
  void yamlKeys_matchTheirDeclaredKeyType() {
    ConfigLoader c = new ConfigLoader(new InMemorySchemaRegistry(List.of(
        Schema.builder("ByName").required("m", Types.mapOf(Types.STRING, Types.INT)).build(),
        Schema.builder("ById").required("m", Types.mapOf(Types.INT, Types.INT)).build())));

    assertEquals(Map.of(1, 10, 2, 20), c.load("m:\n  1: 10\n  2: 20\n", DocumentFormat.YAML, "ById").getMap("m"));
    assertEquals(Map.of("a", 10), c.load("m:\n  a: 10\n", DocumentFormat.YAML, "ByName").getMap("m"));

    ConstructionException e = assertThrows(ConstructionException.class,
        () -> c.load("m:\n  1: 10\n", DocumentFormat.YAML, "ByName"));
    assertEquals("m[1]", e.pathString());
    assertEquals(ConstructionException.Kind.WRONG_TYPE,
        assertThrows(ConstructionException.class, () -> c.load("{\"m\": {\"1\": 10}}", DocumentFormat.JSON, "ById")).kind());
  }

  @Test
  void nestedListsAndIntKeyedMaps_loadFromYaml() {
    ConfigLoader c = new ConfigLoader(new InMemorySchemaRegistry(List.of(Schema.builder("A")
        .required("a", Types.listOf(Types.listOf(Types.INT)))
        .required("b", Types.listOf(Types.mapOf(Types.INT, Types.INT)))
        .build())));

    Instance a = c.load("a: [[1, 2, 3]]\nb:\n- 1: 1\n- 2: 2\n", DocumentFormat.YAML, "A");
    assertEquals(List.of(List.of(1, 2, 3)), a.getList("a"));
    assertEquals(List.of(Map.of(1, 1), Map.of(2, 2)), a.getList("b"));
  }

  record Endpoint(String host, long port) {}

  @Test
  void mapper_turnsInstancesIntoApplicationTypes() {
    Endpoint ep = loader.load(resource("/config/server.yaml"), "Server",
        i -> new Endpoint(i.getString("host"), i.getLong("port")));
    assertEquals(new Endpoint("db.internal", 5432), ep);
  }

  @Test
  void defaultsAndUnknownKeys_followTheSchema() {
    Instance server = loader.load("host: db\n", DocumentFormat.YAML, "Server");
    assertEquals(8080, server.get("port"));
    assertEquals("dev", server.get("mode"));

    ConstructionException unknown = assertThrows(ConstructionException.class,
        () -> loader.load("host: db\nmode: prod\n", DocumentFormat.YAML, "Server"));
    assertEquals(ConstructionException.Kind.UNKNOWN_ARGUMENT, unknown.kind());

    Instance cluster = loader.load("name: c\nservers: []\nowner: me\n", DocumentFormat.YAML, "Cluster");
    assertEquals(List.of(), cluster.getList("servers"));
  }
}
