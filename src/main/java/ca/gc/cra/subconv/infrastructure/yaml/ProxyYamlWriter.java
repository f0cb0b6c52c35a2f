package ca.gc.cra.subconv.infrastructure.yaml;

import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders nodes as a {@code proxies:} YAML document in block style with two-space indentation.
 *
 * @since 0.1.0
 */
public final class ProxyYamlWriter {
  private static final int INDENT = 2;

  /**
   * @param nodes nodes in output order; never {@code null}
   * @return YAML text ending with a newline
   */
  public String write(List<ProxyNode> nodes) {
    Objects.requireNonNull(nodes, "nodes");
    List<Map<String, Object>> entries = new ArrayList<>(nodes.size());
    for (ProxyNode node : nodes) {
      entries.add(ProxySchema.toEntry(node));
    }
    Map<String, Object> root = new LinkedHashMap<>();
    root.put(ProxySchema.PROXIES, entries);
    return newYaml().dump(root);
  }

  // Yaml instances are not thread-safe.
  private static Yaml newYaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(INDENT);
    options.setIndicatorIndent(INDENT);
    options.setIndentWithIndicator(true);
    options.setAllowUnicode(true);
    options.setWidth(Integer.MAX_VALUE);
    return new Yaml(options);
  }
}
