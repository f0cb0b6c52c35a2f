package ca.gc.cra.subconv.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ExtractConfigTest {

  @Test
  void parsesAllOptions() {
    ExtractConfig config = ExtractConfig.fromMap(Map.of(
        "in", " ./dir/../sub.txt ",
        "format", "BASE64",
        "out", "out.txt",
        "allowOverwrite", "true"));

    assertEquals(Path.of("sub.txt"), config.input());
    assertEquals(OutputFormat.BASE64, config.format());
    assertEquals(Optional.of(Path.of("out.txt")), config.output());
    assertTrue(config.allowOverwrite());
  }

  @Test
  void blankOutMeansStdout() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("extract"));
    options.put("in", "sub.txt");

    ExtractConfig config = ExtractConfig.fromMap(options);

    assertTrue(config.output().isEmpty());
    assertEquals(OutputFormat.YAML, config.format());
    assertFalse(config.allowOverwrite());
  }

  @Test
  void inputIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> ExtractConfig.fromMap(DefaultsForMode.asFlatMap("extract")));
    assertThrows(IllegalArgumentException.class, () -> ExtractConfig.fromMap(Map.of("in", "a\u0001b")));
  }

  @Test
  void unknownFormatNamesExpectedValues() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> ExtractConfig.fromMap(Map.of("in", "a", "format", "json")));

    assertTrue(ex.getMessage().contains("yaml, uris or base64"));
  }
}
