package ca.gc.cra.subconv.api;

import ca.gc.cra.subconv.application.convert.ProxyLinkConverter;
import ca.gc.cra.subconv.domain.proxy.ProxyConversionException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.infrastructure.yaml.ProxyYamlWriter;
import ca.gc.cra.subconv.logging.LoggingConfigurator;
import ca.gc.cra.subconv.logging.Logs;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a single share link and prints it as a {@code proxies:} YAML document.
 *
 * @since 0.1.0
 */
public final class DecodeCli {
  private static final Logger log = LoggerFactory.getLogger(DecodeCli.class);
  private static final String SUMMARY_USAGE = "usage: decode uri=SHARE_LINK";
  private static final String HELP_TEXT = """
      SUBCONV decode

      Usage:
        decode uri='vless://uuid@host:443?security=tls#name'

      Required:
        uri=LINK    Share link (ss, ssr, vmess, vless, trojan, hysteria, hysteria2/hy2, tuic)

      Optional:
        --verbose   Enable DEBUG logging
        --help      Show this message
      """;

  private DecodeCli() {}

  /**
   * Runs the decode command.
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

    String uri;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArray());
      uri = kv.get("uri");
      if (uri == null) {
        throw new IllegalArgumentException("uri is required");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      ProxyNode node = ProxyLinkConverter.withDefaultCodecs().decode(uri);
      CliPrinter.printBlock(new ProxyYamlWriter().write(List.of(node)));
      return ExitCode.SUCCESS;
    } catch (ProxyConversionException ex) {
      log.error("Cannot decode {}: {}", Logs.describeUri(uri), ex.getMessage());
      return ExitCode.CONVERSION_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure decoding {}", Logs.describeUri(uri), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
