package ca.gc.cra.subconv.application.convert;

import ca.gc.cra.subconv.domain.proxy.ProxyConversionException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.util.Base64Text;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders nodes back into share links and base64 subscription blobs that {@link SubscriptionExtractor} accepts.
 *
 * @since 0.1.0
 */
public final class SubscriptionWriter {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionWriter.class);

  private final ProxyLinkConverter converter;

  public SubscriptionWriter() {
    this(ProxyLinkConverter.withDefaultCodecs());
  }

  public SubscriptionWriter(ProxyLinkConverter converter) {
    this.converter = Objects.requireNonNull(converter, "converter");
  }

  /**
   * Encodes each node, pairing failures with an empty link.
   *
   * @param nodes nodes in output order
   * @return one entry per node
   */
  public List<NodeLink> toLinks(List<ProxyNode> nodes) {
    Objects.requireNonNull(nodes, "nodes");
    List<NodeLink> links = new ArrayList<>(nodes.size());
    for (ProxyNode node : nodes) {
      String uri = "";
      try {
        uri = converter.encode(node);
      } catch (ProxyConversionException ex) {
        log.warn("Cannot encode node '{}' of type {}: {}", node.name(), node.type(), ex.getMessage());
      }
      links.add(new NodeLink(node, uri));
    }
    return links;
  }

  /**
   * @param nodes nodes in output order
   * @return newline-separated links of the nodes that could be encoded
   */
  public String toUriLines(List<ProxyNode> nodes) {
    StringJoiner lines = new StringJoiner("\n");
    for (NodeLink link : toLinks(nodes)) {
      if (link.encoded()) {
        lines.add(link.uri());
      }
    }
    return lines.toString();
  }

  /**
   * @param nodes nodes in output order
   * @return standard padded base64 of {@link #toUriLines(List)}
   */
  public String toBase64(List<ProxyNode> nodes) {
    return Base64Text.encodeStandard(toUriLines(nodes));
  }
}
