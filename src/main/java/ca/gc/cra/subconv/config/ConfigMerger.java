package ca.gc.cra.subconv.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("extract".equalsIgnoreCase(mode)) {
      OutputFormat.fromString(effective.get("format"));
      String out = effective.getOrDefault("out", "").trim();
      if (!out.isEmpty() && out.equals(effective.getOrDefault("in", "").trim())) {
        throw new IllegalArgumentException("out must differ from in");
      }
    }
  }
}
