package ca.gc.cra.netsim.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  void profileOverridesCommonAndNestedKeysFlatten() throws Exception {
    Path path = Path.of(YamlConfigLoaderTest.class.getResource("/config/lab.yaml").toURI());

    Map<String, String> values = YamlConfigLoader.load(path, "LAB").orElseThrow();

    assertEquals("5", values.get("ospf.helloIntervalSeconds"));
    assertEquals("20", values.get("ospf.deadIntervalSeconds"));
    assertEquals("2", values.get("routers"));
    assertEquals("32", values.get("host.defaultTtl"));
    assertEquals(32, SimulationConfig.fromMap(values).hostDefaultTtl());
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "lab").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertTrue(YamlConfigLoader.load(file, "lab").orElseThrow().isEmpty());
  }

  @Test
  void rejectsArraysAndMalformedYaml() throws Exception {
    Path arrays = Files.writeString(tempDir.resolve("arrays.yaml"), "common:\n  routers: [1, 2]\n");
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "lab"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "lab"));
  }
}
