package ca.gc.cra.subconv.api;

import ca.gc.cra.subconv.application.convert.SubscriptionExtractor;
import ca.gc.cra.subconv.application.convert.SubscriptionWriter;
import ca.gc.cra.subconv.config.ConfigMerger;
import ca.gc.cra.subconv.config.DefaultsForMode;
import ca.gc.cra.subconv.config.ExtractConfig;
import ca.gc.cra.subconv.config.YamlConfigLoader;
import ca.gc.cra.subconv.domain.proxy.ProxyConversionException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.infrastructure.yaml.ProxyYamlWriter;
import ca.gc.cra.subconv.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts proxies from a subscription file and renders them as YAML, share links or a base64 blob.
 *
 * @since 0.1.0
 */
public final class ExtractCli {
  private static final Logger log = LoggerFactory.getLogger(ExtractCli.class);
  private static final String MODE = "extract";
  private static final String SUMMARY_USAGE =
      "usage: extract in=PATH [format=yaml|uris|base64] [out=PATH] [config=PATH] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      SUBCONV extract

      Usage:
        extract in=./subscription.txt [options]

      Required:
        in=PATH                   Subscription content: a proxies: YAML document or base64 share-link list

      Optional:
        format=yaml|uris|base64   Output format (default yaml)
        out=PATH                  Write to a file instead of stdout
        config=PATH               YAML file with common/extract sections; CLI values win
        --allow-overwrite         Replace an existing out file
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        Lines that fail to decode are skipped and logged with their line number.
      """;

  private ExtractCli() {}

  /**
   * Runs the extract command.
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
      log.debug("Verbose logging enabled for extract CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArray()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return ExitCode.CONFIG_ERROR;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    ExtractConfig config;
    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      config = ExtractConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean allowOverwrite = config.allowOverwrite() || input.hasFlag("--allow-overwrite");
    if (config.output().isPresent() && Files.exists(config.output().get()) && !allowOverwrite) {
      log.error("Output file {} exists; pass --allow-overwrite to replace it", config.output().get());
      return ExitCode.INVALID_ARGS;
    }

    try {
      String content = Files.readString(config.input(), StandardCharsets.UTF_8);
      List<ProxyNode> nodes = new SubscriptionExtractor().extract(content);
      String rendered = render(config, nodes);
      if (config.output().isPresent()) {
        Files.writeString(config.output().get(), rendered, StandardCharsets.UTF_8);
        log.info("Wrote {} proxies as {} to {}", nodes.size(), config.format(), config.output().get());
      } else {
        CliPrinter.printBlock(rendered);
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Extract I/O failure for {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (ProxyConversionException ex) {
      log.error("Cannot extract proxies from {}: {}", config.input(), ex.getMessage());
      return ExitCode.CONVERSION_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in extract", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static String render(ExtractConfig config, List<ProxyNode> nodes) {
    return switch (config.format()) {
      case YAML -> new ProxyYamlWriter().write(nodes);
      case URIS -> new SubscriptionWriter().toUriLines(nodes) + "\n";
      case BASE64 -> new SubscriptionWriter().toBase64(nodes) + "\n";
    };
  }
}
