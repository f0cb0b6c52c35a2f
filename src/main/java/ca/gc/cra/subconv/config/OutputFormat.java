package ca.gc.cra.subconv.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Rendering formats for extracted nodes.
 * <p><strong>Role:</strong> Configuration enum selected by {@code format=} on the extract command.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum OutputFormat {
  /** {@code proxies:} YAML document. */
  YAML,
  /** One share link per line. */
  URIS,
  /** Base64 subscription blob of the share-link lines. */
  BASE64;

  /**
   * Parses a format name, defaulting to {@link #YAML} when blank.
   *
   * @param value textual representation such as {@code "yaml"} or {@code "base64"}
   * @return parsed format
   * @throws IllegalArgumentException if the string does not match a known format
   */
  public static OutputFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return YAML;
    }
    try {
      return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown format: " + value + " (expected yaml, uris or base64)", ex);
    }
  }
}
