package ca.gc.cra.subconv.config;

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
  void cliOverridesYamlOverridesDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("extract");
    Map<String, String> yaml = Map.of("in", "a.txt", "format", "uris");
    Map<String, String> cli = Map.of("format", "base64");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "extract",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("a.txt", merged.get("in"));
    assertEquals("base64", merged.get("format"));
    assertEquals("false", merged.get("verbose"));
    assertEquals(List.of("CLI overrides YAML for key: format"), warnings);
  }

  @Test
  void unknownFormatIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "extract",
            Optional.empty(),
            Map.of("in", "a.txt", "format", "json"),
            DefaultsForMode.asFlatMap("extract"),
            msg -> {}));
  }

  @Test
  void outputMustDifferFromInput() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "extract",
            Optional.empty(),
            Map.of("in", "a.txt", "out", " a.txt "),
            Map.of(),
            null));
    assertTrue(ex.getMessage().contains("out"));
  }
}
