package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.domain.proxy.GrpcOptions;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.proxy.WsOptions;
import ca.gc.cra.subconv.infrastructure.uri.AuthorityUri;
import ca.gc.cra.subconv.infrastructure.uri.ShareLinkBuilder;

/** Transport query parameters shared by the vless and trojan dialects. */
final class Transports {
  static final String DEFAULT_NETWORK = "tcp";

  private Transports() {}

  static String network(AuthorityUri link) {
    String network = link.param("type");
    return network.isEmpty() ? DEFAULT_NETWORK : network;
  }

  static void read(AuthorityUri link, String network, ProxyNode.Builder builder) {
    if ("ws".equals(network)) {
      builder.wsOpts(WsOptions.of(link.param("path"), link.param("host")));
    } else if ("grpc".equals(network)) {
      builder.grpcOpts(new GrpcOptions(link.param("serviceName")));
    }
  }

  static String network(ProxyNode node) {
    return node.network() == null ? DEFAULT_NETWORK : node.network();
  }

  static void write(ProxyNode node, String network, ShareLinkBuilder link) {
    if ("ws".equals(network) && node.wsOpts() != null) {
      link.param("path", node.wsOpts().path()).param("host", node.wsOpts().host());
    } else if ("grpc".equals(network) && node.grpcOpts() != null) {
      link.param("serviceName", node.grpcOpts().serviceName());
    }
  }
}
