package ca.gc.cra.subconv.api;

import ca.gc.cra.subconv.application.convert.NodeLink;
import ca.gc.cra.subconv.application.convert.SubscriptionWriter;
import ca.gc.cra.subconv.domain.proxy.NoProxiesFoundException;
import ca.gc.cra.subconv.domain.proxy.ProxyConversionException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.infrastructure.yaml.ProxyYamlReader;
import ca.gc.cra.subconv.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes the {@code proxies:} list of a YAML file into share links, one per line.
 *
 * @since 0.1.0
 */
public final class EncodeCli {
  private static final Logger log = LoggerFactory.getLogger(EncodeCli.class);
  private static final String SUMMARY_USAGE = "usage: encode in=PATH";
  private static final String HELP_TEXT = """
      SUBCONV encode

      Usage:
        encode in=./config.yaml

      Required:
        in=PATH     YAML document with a proxies: list

      Optional:
        --verbose   Enable DEBUG logging
        --help      Show this message

      Notes:
        Entries whose type has no share-link form (e.g. socks5) are skipped with a warning.
      """;

  private EncodeCli() {}

  /**
   * Runs the encode command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path in;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArray());
      String raw = kv.get("in");
      if (raw == null) {
        throw new IllegalArgumentException("in is required");
      }
      in = Path.of(raw);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      String yaml = Files.readString(in, StandardCharsets.UTF_8);
      List<ProxyNode> nodes = new ProxyYamlReader().read(yaml);
      if (nodes.isEmpty()) {
        throw new NoProxiesFoundException("no proxies listed in " + in);
      }
      int encoded = 0;
      for (NodeLink link : new SubscriptionWriter().toLinks(nodes)) {
        if (link.encoded()) {
          CliPrinter.println(link.uri());
          encoded++;
        }
      }
      if (encoded == 0) {
        throw new NoProxiesFoundException("none of the " + nodes.size() + " proxies could be encoded");
      }
      log.info("Encoded {} of {} proxies from {}", encoded, nodes.size(), in);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read {}", in, ex);
      return ExitCode.IO_ERROR;
    } catch (ProxyConversionException ex) {
      log.error("Cannot encode {}: {}", in, ex.getMessage());
      return ExitCode.CONVERSION_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure encoding {}", in, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
