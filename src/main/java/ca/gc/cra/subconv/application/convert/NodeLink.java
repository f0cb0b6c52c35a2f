package ca.gc.cra.subconv.application.convert;

import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import java.util.Objects;

/**
 * A node paired with its share link.
 *
 * @param node source node
 * @param uri encoded link; empty when the node could not be encoded
 * @since 0.1.0
 */
public record NodeLink(ProxyNode node, String uri) {
  public NodeLink {
    Objects.requireNonNull(node, "node");
    uri = uri == null ? "" : uri;
  }

  /**
   * @return whether encoding produced a link
   */
  public boolean encoded() {
    return !uri.isEmpty();
  }
}
