package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.infrastructure.uri.AuthorityUri;
import ca.gc.cra.subconv.infrastructure.uri.ShareLinkBuilder;
import java.util.regex.Pattern;

/**
 * TUIC ({@code tuic://}) share links.
 *
 * <p>The userinfo user slot is a v5 UUID when it has the 36-character UUID shape, otherwise a v4 token; the password
 * slot is always the password. An explicit {@code token} query value overrides the token.</p>
 *
 * @since 0.1.0
 */
public final class TuicCodec implements ProxyUriCodec {
  private static final Pattern UUID_SHAPE = Pattern.compile("^[0-9a-fA-F-]{36}$");

  @Override
  public ProtocolType type() {
    return ProtocolType.TUIC;
  }

  @Override
  public ProxyNode decode(String uri) throws InvalidFormatException {
    AuthorityUri link = AuthorityUri.parse(uri);
    String user = link.user();
    ProxyNode.Builder builder = ProxyNode.builder(type())
        .name(link.nameOr(type().tag()))
        .server(link.host())
        .port(link.port())
        .password(link.password());

    String token = link.param("token");
    if (UUID_SHAPE.matcher(user).matches()) {
      builder.uuid(user);
    } else if (token.isEmpty()) {
      token = user;
    }
    return builder.token(token)
        .sni(link.param("sni"))
        .skipCertVerify("1".equals(link.param("skip-cert-verify")) || "1".equals(link.param("allow_insecure")))
        .alpn(link.listParam("alpn"))
        .disableSni("1".equals(link.param("disable-sni")))
        .reduceRtt("1".equals(link.param("reduce-rtt")))
        .udpRelayMode(link.firstParam("udp-relay-mode", "udp_relay_mode"))
        .congestionController(link.firstParam("congestion-controller", "congestion_control"))
        .build();
  }

  @Override
  public String encode(ProxyNode node) {
    String user = node.uuid() != null ? node.uuid() : node.token();
    return ShareLinkBuilder.create(type().tag())
        .user(user, node.password())
        .host(node.server(), node.port())
        .param("token", node.uuid() != null ? node.token() : null)
        .param("sni", node.sni())
        .flag("skip-cert-verify", node.skipCertVerify())
        .list("alpn", node.alpn())
        .flag("disable-sni", node.disableSni())
        .flag("reduce-rtt", node.reduceRtt())
        .param("udp-relay-mode", node.udpRelayMode())
        .param("congestion-controller", node.congestionController())
        .name(node.name())
        .build();
  }
}
