package ca.gc.cra.subconv.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed CLI arguments split into flags and {@code key=value} pairs.
 *
 * @param keyValueArgs arguments that are not flags, in order
 * @param flags normalized (lower-case) flags
 * @param help whether a help flag was supplied
 * @param verbose whether verbose logging was requested
 */
public record CliInput(List<String> keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments into flag and key/value partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(List.of(), Set.of(), false, false);
    }
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv, flags, help, verbose);
  }

  /**
   * Checks whether a flag such as {@code --allow-overwrite} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * @return key/value arguments as an array for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }
}
