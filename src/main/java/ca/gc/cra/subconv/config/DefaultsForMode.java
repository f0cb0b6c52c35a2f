package ca.gc.cra.subconv.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each configurable CLI command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of("verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a command merged with common defaults.
   *
   * @param mode command name ({@code extract})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for commands without configuration
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "extract" -> buildExtractDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildExtractDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("format", OutputFormat.YAML.name().toLowerCase(Locale.ROOT));
    map.put("out", "");
    map.put("allowOverwrite", "false");
    return map;
  }
}
