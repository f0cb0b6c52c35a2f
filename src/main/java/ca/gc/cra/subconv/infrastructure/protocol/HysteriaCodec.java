package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.infrastructure.uri.AuthorityUri;
import ca.gc.cra.subconv.infrastructure.uri.ShareLinkBuilder;

/**
 * Hysteria v1 ({@code hysteria://}) share links. The auth string is read from userinfo or the {@code auth} query value.
 *
 * @since 0.1.0
 */
public final class HysteriaCodec implements ProxyUriCodec {
  private static final String DEFAULT_PROTOCOL = "udp";

  @Override
  public ProtocolType type() {
    return ProtocolType.HYSTERIA;
  }

  @Override
  public ProxyNode decode(String uri) throws InvalidFormatException {
    AuthorityUri link = AuthorityUri.parse(uri);
    String protocol = link.param("protocol");
    return ProxyNode.builder(type())
        .name(link.nameOr(type().tag()))
        .server(link.host())
        .port(link.port())
        .authStr(link.user().isEmpty() ? link.param("auth") : link.user())
        .protocol(protocol.isEmpty() ? DEFAULT_PROTOCOL : protocol)
        .up(link.firstParam("up", "upmbps"))
        .down(link.firstParam("down", "downmbps"))
        .sni(link.firstParam("sni", "peer"))
        .skipCertVerify("1".equals(link.param("insecure")))
        .obfs(link.param("obfs"))
        .alpn(link.listParam("alpn"))
        .build();
  }

  @Override
  public String encode(ProxyNode node) {
    return ShareLinkBuilder.create(type().tag())
        .user(node.authStr())
        .host(node.server(), node.port())
        .param("protocol", node.protocol() == null ? DEFAULT_PROTOCOL : node.protocol())
        .param("up", node.up())
        .param("down", node.down())
        .param("sni", node.sni())
        .param("obfs", node.obfs())
        .list("alpn", node.alpn())
        .flag("insecure", node.skipCertVerify())
        .name(node.name())
        .build();
  }
}
