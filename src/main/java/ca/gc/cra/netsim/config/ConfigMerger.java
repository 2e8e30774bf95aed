package ca.gc.cra.netsim.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * <p>The merged map is validated by parsing it into a {@link SimulationConfig}, so a bad value fails here
   * rather than when the first device is built. Keys that the simulation does not know (for example the lab
   * CLI's {@code routers}) pass through untouched.</p>
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    SimulationConfig.fromMap(merged);
    return Map.copyOf(merged);
  }
}
