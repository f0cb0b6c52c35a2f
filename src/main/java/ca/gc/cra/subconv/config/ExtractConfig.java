package ca.gc.cra.subconv.config;

import ca.gc.cra.subconv.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings for one run of the extract command.
 * <p><strong>Why:</strong> Collapses CLI arguments, YAML configuration and defaults into one validated value.</p>
 * <p><strong>Role:</strong> Adapter configuration consumed by {@code ExtractCli}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param input subscription file to read
 * @param format rendering format; {@code null} defaults to {@link OutputFormat#YAML}
 * @param output optional destination file; empty prints to stdout
 * @param allowOverwrite whether an existing {@code output} file may be replaced
 * @since 0.1.0
 */
public record ExtractConfig(Path input, OutputFormat format, Optional<Path> output, boolean allowOverwrite) {

  public ExtractConfig {
    Objects.requireNonNull(input, "input");
    format = Objects.requireNonNullElse(format, OutputFormat.YAML);
    output = output == null ? Optional.empty() : output;
  }

  /**
   * Builds configuration from a merged key/value map.
   *
   * @param options merged settings ({@code in}, {@code format}, {@code out}, {@code allowOverwrite})
   * @return validated configuration
   * @throws IllegalArgumentException when {@code in} is missing or a value is malformed
   */
  public static ExtractConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = options.get("in");
    if (in == null || in.isBlank()) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = parsePath("in", in);
    OutputFormat format = OutputFormat.fromString(options.get("format"));
    String out = options.get("out");
    Optional<Path> output = out == null || out.isBlank() ? Optional.empty() : Optional.of(parsePath("out", out));
    boolean allowOverwrite = Boolean.parseBoolean(options.getOrDefault("allowOverwrite", "false").trim());
    return new ExtractConfig(input, format, output, allowOverwrite);
  }

  private static Path parsePath(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    try {
      return Path.of(sanitized).normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
