package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.infrastructure.uri.AuthorityUri;
import ca.gc.cra.subconv.infrastructure.uri.ShareLinkBuilder;

/**
 * Hysteria v2 ({@code hysteria2://} or {@code hy2://}) share links. A {@code user:pass} userinfo is kept whole as the
 * password.
 *
 * @since 0.1.0
 */
public final class Hysteria2Codec implements ProxyUriCodec {
  @Override
  public ProtocolType type() {
    return ProtocolType.HYSTERIA2;
  }

  @Override
  public ProxyNode decode(String uri) throws InvalidFormatException {
    AuthorityUri link = AuthorityUri.parse(uri);
    String password = link.password() == null ? link.user() : link.user() + ":" + link.password();
    return ProxyNode.builder(type())
        .name(link.nameOr(type().tag()))
        .server(link.host())
        .port(link.port())
        .password(password)
        .up(link.firstParam("up", "upmbps"))
        .down(link.firstParam("down", "downmbps"))
        .sni(link.param("sni"))
        .skipCertVerify("1".equals(link.param("insecure")))
        .obfs(link.param("obfs"))
        .obfsPassword(link.param("obfs-password"))
        .alpn(link.listParam("alpn"))
        .ports(link.param("ports"))
        .build();
  }

  @Override
  public String encode(ProxyNode node) {
    return ShareLinkBuilder.create(type().tag())
        .user(node.password())
        .host(node.server(), node.port())
        .param("up", node.up())
        .param("down", node.down())
        .param("sni", node.sni())
        .param("obfs", node.obfs())
        .param("obfs-password", node.obfsPassword())
        .list("alpn", node.alpn())
        .param("ports", node.ports())
        .flag("insecure", node.skipCertVerify())
        .name(node.name())
        .build();
  }
}
