package ca.gc.cra.warden.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be {@code null})
   * @param defaults embedded defaults (may be {@code null})
   * @param knownKeys keys accepted by the command; anything else is rejected
   * @param warn receives a message whenever a CLI value overrides a YAML value; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when a key is not in {@code knownKeys}
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Set<String> knownKeys,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Objects.requireNonNull(knownKeys, "knownKeys");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    requireKnown("YAML", yamlCopy, knownKeys);
    requireKnown("CLI", cliCopy, knownKeys);

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      // an empty YAML value (key present, no value) keeps the default
      if (!entry.getValue().isEmpty()) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  private static void requireKnown(String source, Map<String, String> values, Set<String> knownKeys) {
    for (String key : values.keySet()) {
      if (!knownKeys.contains(key)) {
        throw new IllegalArgumentException("Unknown " + source + " configuration key: " + key);
      }
    }
  }
}
