package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.proxy.RealityOptions;
import ca.gc.cra.subconv.infrastructure.uri.AuthorityUri;
import ca.gc.cra.subconv.infrastructure.uri.ShareLinkBuilder;

/**
 * Trojan ({@code trojan://password@host:port?...}) share links. TLS is on unless {@code security} names something
 * other than {@code tls} or {@code reality}.
 *
 * @since 0.1.0
 */
public final class TrojanCodec implements ProxyUriCodec {
  @Override
  public ProtocolType type() {
    return ProtocolType.TROJAN;
  }

  @Override
  public ProxyNode decode(String uri) throws InvalidFormatException {
    AuthorityUri link = AuthorityUri.parse(uri);
    String network = Transports.network(link);
    ProxyNode.Builder builder = ProxyNode.builder(type())
        .name(link.nameOr(type().tag()))
        .server(link.host())
        .port(link.port())
        .password(link.user())
        .network(network)
        .sni(link.firstParam("sni", "peer"))
        .clientFingerprint(link.param("fp"));

    String security = link.param("security");
    if ("reality".equals(security)) {
      builder.realityOpts(new RealityOptions(link.param("pbk"), link.param("sid")));
    } else {
      builder.tls(security.isEmpty() || "tls".equals(security)).alpn(link.listParam("alpn"));
    }
    Transports.read(link, network, builder);
    return builder.build();
  }

  @Override
  public String encode(ProxyNode node) {
    String network = Transports.network(node);
    ShareLinkBuilder link = ShareLinkBuilder.create(type().tag())
        .user(node.password())
        .host(node.server(), node.port())
        .param("type", network);
    RealityOptions reality = node.realityOpts();
    if (reality != null) {
      link.param("security", "reality").param("pbk", reality.publicKey()).param("sid", reality.shortId());
    } else {
      link.param("security", node.tls() ? "tls" : "none");
    }
    link.param("sni", node.sni() != null ? node.sni() : node.servername())
        .list("alpn", node.alpn())
        .param("fp", node.clientFingerprint());
    Transports.write(node, network, link);
    return link.name(node.name()).build();
  }
}
