package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.proxy.RealityOptions;
import ca.gc.cra.subconv.infrastructure.uri.AuthorityUri;
import ca.gc.cra.subconv.infrastructure.uri.ShareLinkBuilder;

/**
 * VLESS ({@code vless://uuid@host:port?...}) share links. {@code security=reality} and {@code security=tls} select
 * mutually exclusive option sets.
 *
 * @since 0.1.0
 */
public final class VlessCodec implements ProxyUriCodec {
  @Override
  public ProtocolType type() {
    return ProtocolType.VLESS;
  }

  @Override
  public ProxyNode decode(String uri) throws InvalidFormatException {
    AuthorityUri link = AuthorityUri.parse(uri);
    String network = Transports.network(link);
    ProxyNode.Builder builder = ProxyNode.builder(type())
        .name(link.nameOr(type().tag()))
        .server(link.host())
        .port(link.port())
        .uuid(link.user())
        .network(network)
        .encryption(link.param("encryption"))
        .flow(link.param("flow"));

    String security = link.param("security");
    if ("reality".equals(security)) {
      builder.tls(true)
          .realityOpts(new RealityOptions(link.param("pbk"), link.param("sid")))
          .servername(link.param("sni"))
          .clientFingerprint(link.param("fp"));
    } else if ("tls".equals(security)) {
      builder.tls(true)
          .servername(link.param("sni"))
          .alpn(link.listParam("alpn"))
          .clientFingerprint(link.param("fp"));
    }
    Transports.read(link, network, builder);
    return builder.build();
  }

  @Override
  public String encode(ProxyNode node) {
    String network = Transports.network(node);
    ShareLinkBuilder link = ShareLinkBuilder.create(type().tag())
        .user(node.uuid())
        .host(node.server(), node.port())
        .param("type", network)
        .param("encryption", node.encryption())
        .param("flow", node.flow());
    String serverName = node.servername() != null ? node.servername() : node.sni();
    RealityOptions reality = node.realityOpts();
    if (reality != null) {
      link.param("security", "reality")
          .param("pbk", reality.publicKey())
          .param("sid", reality.shortId())
          .param("sni", serverName)
          .param("fp", node.clientFingerprint());
    } else if (node.tls()) {
      link.param("security", "tls")
          .param("sni", serverName)
          .list("alpn", node.alpn())
          .param("fp", node.clientFingerprint());
    }
    Transports.write(node, network, link);
    return link.name(node.name()).build();
  }
}
