package ca.gc.cra.netsim.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> yaml = Map.of(SimulationConfig.HELLO_INTERVAL, "5", SimulationConfig.DEAD_INTERVAL, "20");
    Map<String, String> cli = Map.of(SimulationConfig.HELLO_INTERVAL, "2", SimulationConfig.DEAD_INTERVAL, "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(yaml), cli, SimulationConfig.defaultsAsFlatMap(), warnings::add);

    assertEquals("2", merged.get(SimulationConfig.HELLO_INTERVAL));
    assertEquals("8", merged.get(SimulationConfig.DEAD_INTERVAL));
    assertEquals("64", merged.get(SimulationConfig.HOST_TTL));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: " + SimulationConfig.HELLO_INTERVAL));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of(SimulationConfig.HOST_TTL, "32")), Map.of(), SimulationConfig.defaultsAsFlatMap(),
        warnings::add);

    assertEquals("32", merged.get(SimulationConfig.HOST_TTL));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void unknownKeysPassThrough() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("routers", "4"), SimulationConfig.defaultsAsFlatMap(), msg -> {});

    assertEquals("4", merged.get("routers"));
  }

  @Test
  void invalidMergedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of(SimulationConfig.HELLO_INTERVAL, "30")), Map.of(),
        SimulationConfig.defaultsAsFlatMap(), msg -> {}));
  }
}
