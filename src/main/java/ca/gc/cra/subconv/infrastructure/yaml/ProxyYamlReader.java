package ca.gc.cra.subconv.infrastructure.yaml;

import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the {@code proxies:} list of a routing-client YAML document into nodes.
 *
 * <p>Entries that are not mappings, or that carry no {@code type}, are skipped with a warning. A missing
 * {@code proxies} key yields an empty list.</p>
 *
 * @since 0.1.0
 */
public final class ProxyYamlReader {
  private static final Logger log = LoggerFactory.getLogger(ProxyYamlReader.class);

  /**
   * Parses a YAML document and maps its proxy entries.
   *
   * @param yamlText YAML document; never {@code null}
   * @return nodes in document order; empty when the document lists none
   * @throws InvalidFormatException when the text is not YAML, the root is not a mapping, or {@code proxies} is not
   *     a list
   */
  public List<ProxyNode> read(String yamlText) throws InvalidFormatException {
    Objects.requireNonNull(yamlText, "yamlText");
    Object document;
    try {
      document = new Yaml().load(yamlText);
    } catch (YAMLException ex) {
      throw new InvalidFormatException("document is not valid YAML", ex);
    }
    if (document == null) {
      return List.of();
    }
    Map<String, Object> root = ProxySchema.asMap(document);
    if (root == null) {
      throw new InvalidFormatException("YAML root must be a mapping");
    }
    Object proxies = root.get(ProxySchema.PROXIES);
    if (proxies == null) {
      return List.of();
    }
    if (!(proxies instanceof List<?> entries)) {
      throw new InvalidFormatException("'proxies' must be a list");
    }

    List<ProxyNode> nodes = new ArrayList<>(entries.size());
    int index = 0;
    for (Object item : entries) {
      index++;
      Map<String, Object> entry = ProxySchema.asMap(item);
      if (entry == null) {
        log.warn("Skipping proxies entry {}: not a mapping", index);
        continue;
      }
      try {
        nodes.add(ProxySchema.fromEntry(entry));
      } catch (InvalidFormatException ex) {
        log.warn("Skipping proxies entry {}: {}", index, ex.getMessage());
      }
    }
    return nodes;
  }
}
