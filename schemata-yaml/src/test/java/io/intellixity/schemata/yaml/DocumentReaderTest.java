package io.intellixity.schemata.yaml;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DocumentReaderTest {

  private final DocumentReader reader = new DocumentReader();

  @Test
  void yaml_yieldsNativeKinds() {
    Map<Object, Object> m = reader.readMapping("""
        i: 1
        l: 10000000000
        f: 1.5
        b: true
        s: x
        seq: [1, two]
        nested: { k: null }
        """, DocumentFormat.YAML);

    assertEquals(1, m.get("i"));
    assertEquals(10000000000L, m.get("l"));
    assertEquals(1.5d, m.get("f"));
    assertEquals(Boolean.TRUE, m.get("b"));
    assertEquals("x", m.get("s"));
    assertEquals(List.of(1, "two"), m.get("seq"));
    assertTrue(((Map<?, ?>) m.get("nested")).containsKey("k"));
    assertEquals(List.of("i", "l", "f", "b", "s", "seq", "nested"), new ArrayList<>(m.keySet()));
  }

  @Test
  void yamlKeys_keepTheirScalarType() {
    Map<Object, Object> m = reader.readMapping("1: one\n2.5: half\n'3': three\nx: ex\n", DocumentFormat.YAML);
    assertEquals(List.of(1, 2.5d, "3", "x"), new ArrayList<>(m.keySet()));
  }

  @Test
  void jsonKeys_areStrings() {
    Map<Object, Object> m = reader.readMapping("{\"1\": \"one\"}", DocumentFormat.JSON);
    assertEquals(List.of("1"), new ArrayList<>(m.keySet()));
  }

  @Test
  void json_andYaml_readTheSameTree() {
    assertEquals(
        reader.read("a: [1, 2.5, {b: false}]", DocumentFormat.YAML),
        reader.read("{\"a\": [1, 2.5, {\"b\": false}]}", DocumentFormat.JSON));
  }

  @Test
  void malformedText_isADocumentError() {
    DocumentException e = assertThrows(DocumentException.class, () -> reader.read("{\"a\": ", DocumentFormat.JSON));
    assertTrue(e.getMessage().startsWith("Malformed JSON document"), e.getMessage());
    assertThrows(DocumentException.class, () -> reader.read("a: [1, 2", DocumentFormat.YAML));
  }

  @Test
  void nonMappingRoot_isRejected() {
    assertThrows(DocumentException.class, () -> reader.readMapping("- 1\n- 2\n", DocumentFormat.YAML));
    assertThrows(DocumentException.class, () -> reader.readMapping("null", DocumentFormat.JSON));
  }

  @Test
  void files_areReadByExtension(@TempDir Path dir) throws Exception {
    Path json = Files.writeString(dir.resolve("a.json"), "{\"x\": 1}");
    Path yml = Files.writeString(dir.resolve("a.yml"), "x: 1\n");
    Path txt = Files.writeString(dir.resolve("a.txt"), "x: 1\n");

    assertEquals(Map.of("x", 1), reader.readMapping(json));
    assertEquals(Map.of("x", 1), reader.readMapping(yml));
    assertThrows(DocumentException.class, () -> reader.read(txt));
    assertThrows(DocumentException.class, () -> reader.read(dir.resolve("missing.yaml")));
  }
}
