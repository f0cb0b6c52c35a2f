package ca.gc.cra.subconv.application.convert;

import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.NoProxiesFoundException;
import ca.gc.cra.subconv.domain.proxy.ProxyConversionException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.infrastructure.yaml.ProxyYamlReader;
import ca.gc.cra.subconv.logging.Logs;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns raw subscription content into nodes.
 * <p><strong>Why:</strong> Providers serve either a ready-made routing-client document or a base64 blob of share
 * links; callers should not have to know which.</p>
 * <p><strong>Role:</strong> Application-layer use case composing {@link ProxyLinkConverter} and
 * {@link ProxyYamlReader}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify content as structured YAML or a base64 link list.</li>
 *   <li>Decode link lines best-effort, dropping and logging failed lines.</li>
 *   <li>Report an empty result as {@link NoProxiesFoundException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs the detected format and node counts at INFO and dropped lines at WARN with
 * the line number and scheme only.</p>
 *
 * @since 0.1.0
 */
public final class SubscriptionExtractor {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionExtractor.class);

  private static final String PROXIES_MARKER = "proxies:";
  private static final String GROUPS_MARKER = "proxy-groups:";

  private final ProxyLinkConverter converter;
  private final ProxyYamlReader yamlReader;

  /** Creates an extractor over the built-in codecs. */
  public SubscriptionExtractor() {
    this(ProxyLinkConverter.withDefaultCodecs(), new ProxyYamlReader());
  }

  /**
   * @param converter link converter; must not be {@code null}
   * @param yamlReader structured document reader; must not be {@code null}
   */
  public SubscriptionExtractor(ProxyLinkConverter converter, ProxyYamlReader yamlReader) {
    this.converter = Objects.requireNonNull(converter, "converter");
    this.yamlReader = Objects.requireNonNull(yamlReader, "yamlReader");
  }

  /**
   * Extracts nodes from subscription content.
   *
   * @param content raw subscription text; must not be {@code null}
   * @return nodes in source order
   * @throws NoProxiesFoundException when nothing could be decoded or the text is neither YAML nor base64
   * @throws InvalidFormatException when structured content is not valid YAML
   */
  public List<ProxyNode> extract(String content) throws ProxyConversionException {
    Objects.requireNonNull(content, "content");
    String trimmed = content.trim();
    if (isStructured(trimmed)) {
      log.info("Detected YAML subscription format");
      List<ProxyNode> nodes = yamlReader.read(trimmed);
      if (nodes.isEmpty()) {
        throw new NoProxiesFoundException("YAML document lists no proxies");
      }
      log.info("Read {} proxies from YAML document", nodes.size());
      return nodes;
    }

    String decoded = decodeBase64(trimmed);
    String[] lines = decoded.split("\\r?\\n");
    log.info("Processing {} subscription lines", lines.length);
    return decodeLines(List.of(lines));
  }

  /**
   * Decodes an explicit list of share links with the same best-effort rules as {@link #extract(String)}.
   *
   * @param uris share links; blank and {@code #} entries are ignored
   * @return nodes in input order
   * @throws NoProxiesFoundException when no entry decodes
   */
  public List<ProxyNode> extractFromUris(List<String> uris) throws NoProxiesFoundException {
    Objects.requireNonNull(uris, "uris");
    return decodeLines(uris);
  }

  static boolean isStructured(String trimmed) {
    return trimmed.startsWith(PROXIES_MARKER)
        || trimmed.startsWith(GROUPS_MARKER)
        || trimmed.contains("\n" + PROXIES_MARKER)
        || trimmed.contains("\n" + GROUPS_MARKER);
  }

  private List<ProxyNode> decodeLines(List<String> lines) throws NoProxiesFoundException {
    List<ProxyNode> nodes = new ArrayList<>();
    int lineNumber = 0;
    for (String raw : lines) {
      lineNumber++;
      String line = raw == null ? "" : raw.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      try {
        nodes.add(converter.decode(line));
      } catch (ProxyConversionException ex) {
        log.warn("Line {} parse failed ({}): {}", lineNumber, Logs.describeUri(line), ex.getMessage());
      }
    }
    if (nodes.isEmpty()) {
      throw new NoProxiesFoundException("no valid proxy links found");
    }
    log.info("Successfully parsed {} valid nodes", nodes.size());
    return nodes;
  }

  private static String decodeBase64(String text) throws NoProxiesFoundException {
    String compact = text.replace("\r", "").replace("\n", "");
    try {
      return new String(Base64.getDecoder().decode(compact), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException standardFailure) {
      try {
        return new String(Base64.getUrlDecoder().decode(compact), StandardCharsets.UTF_8);
      } catch (IllegalArgumentException urlSafeFailure) {
        urlSafeFailure.addSuppressed(standardFailure);
        throw new NoProxiesFoundException("subscription is neither YAML nor base64", urlSafeFailure);
      }
    }
  }
}
