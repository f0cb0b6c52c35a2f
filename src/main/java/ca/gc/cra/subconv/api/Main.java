package ca.gc.cra.subconv.api;

import ca.gc.cra.subconv.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SUBCONV CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: subconv <decode|encode|extract> [options]";
  private static final String HELP_TEXT = """
      SUBCONV proxy share-link converter

      Usage:
        subconv <command> [options]

      Commands:
        decode      Decode one share link into a proxies: YAML entry
        encode      Encode the proxies: list of a YAML file into share links
        extract     Extract proxies from a subscription file (YAML or base64 link list)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      if (safeArgs[i] != null && !safeArgs[i].isBlank() && !safeArgs[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    CliInput input = CliInput.parse(commandIndex < 0 ? safeArgs : Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex < 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);

    return switch (command) {
      case "decode" -> DecodeCli.run(delegateArgs);
      case "encode" -> EncodeCli.run(delegateArgs);
      case "extract" -> ExtractCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
