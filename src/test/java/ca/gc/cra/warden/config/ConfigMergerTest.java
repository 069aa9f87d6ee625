package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private static final Set<String> KEYS = Set.of("snapshot", "moreLikeLimit", "capability");

  @Test
  void cliBeatsYamlBeatsDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("moreLikeLimit", "20", "capability", "ADMIN")),
        Map.of("moreLikeLimit", "3"),
        Map.of("moreLikeLimit", "10", "capability", "HUNTER", "snapshot", "default.json"),
        KEYS,
        warnings::add);

    assertEquals("3", merged.get("moreLikeLimit"));
    assertEquals("ADMIN", merged.get("capability"));
    assertEquals("default.json", merged.get("snapshot"));
    assertEquals(List.of("CLI overrides YAML for key: moreLikeLimit"), warnings);
  }

  @Test
  void emptyYamlValueKeepsDefault() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("capability", "")), null, Map.of("capability", "HUNTER"), KEYS, null);

    assertEquals("HUNTER", merged.get("capability"));
  }

  @Test
  void unknownKeysAreRejected() {
    IllegalArgumentException yaml = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(Optional.of(Map.of("colour", "red")), Map.of(), Map.of(), KEYS, null));
    assertEquals("Unknown YAML configuration key: colour", yaml.getMessage());

    IllegalArgumentException cli = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(Optional.empty(), Map.of("limit", "1"), Map.of(), KEYS, null));
    assertEquals("Unknown CLI configuration key: limit", cli.getMessage());
  }
}
