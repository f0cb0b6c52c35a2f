package ca.gc.cra.subconv.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads CLI configuration from a YAML document, merging the {@code common} section with a command section and
 * flattening nested mappings to dotted keys.
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads configuration for {@code mode} from a file.
   *
   * @param path location of the YAML configuration
   * @param mode command name, e.g. {@code extract}
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String text = Files.readString(path, StandardCharsets.UTF_8);
    try {
      return Optional.of(parse(text, mode));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid YAML config at " + path + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Parses configuration text for {@code mode}. Sequences of scalars are joined with commas.
   *
   * @param text YAML document
   * @param mode command name
   * @return flat settings; command keys override {@code common} keys
   * @throws IllegalArgumentException when the YAML is malformed or a section is not a mapping
   */
  public static Map<String, String> parse(String text, String mode) {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(mode, "mode");
    Object document;
    try {
      document = new Yaml().load(text);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("malformed YAML", ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = findSection(root, "common");
    if (common != null) {
      flatten(asMap(common, "common"), "", flattened);
    }
    String section = mode.trim().toLowerCase(Locale.ROOT);
    Object modeSection = findSection(root, section);
    if (modeSection != null) {
      flatten(asMap(modeSection, section), "", flattened);
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        StringJoiner joined = new StringJoiner(",");
        for (Object item : items) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("nested sequences are not supported for key " + composite);
          }
          joined.add(String.valueOf(item));
        }
        target.put(composite, joined.toString());
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
