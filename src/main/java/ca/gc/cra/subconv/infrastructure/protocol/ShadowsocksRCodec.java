package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.util.Base64Text;
import ca.gc.cra.subconv.infrastructure.uri.QueryString;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ShadowsocksR ({@code ssr://}) share links.
 *
 * <p>The whole body is base64 of {@code host:port:protocol:cipher:obfs:base64(password)[/?query]}. Fields are split on
 * every colon, so an IPv6 host shifts every following field.</p>
 *
 * @since 0.1.0
 */
public final class ShadowsocksRCodec implements ProxyUriCodec {
  private static final String DEFAULT_PROTOCOL = "origin";
  private static final String DEFAULT_CIPHER = "aes-128-ctr";
  private static final String DEFAULT_OBFS = "plain";

  @Override
  public ProtocolType type() {
    return ProtocolType.SHADOWSOCKS_R;
  }

  @Override
  public ProxyNode decode(String uri) throws InvalidFormatException {
    int sep = uri.indexOf("://");
    if (sep < 0) {
      throw new InvalidFormatException("missing '://' separator");
    }
    String content = Base64Text.decode(uri.substring(sep + 3));

    String main = content;
    Map<String, String> query = Map.of();
    int suffix = content.indexOf("/?");
    if (suffix >= 0) {
      main = content.substring(0, suffix);
      query = QueryString.parse(content.substring(suffix + 2));
    }

    String[] fields = main.split(":", -1);
    if (fields.length < 6) {
      throw new InvalidFormatException("ssr body has " + fields.length + " fields, expected 6");
    }

    String remarks = optionalBase64(query, "remarks");
    return ProxyNode.builder(type())
        .name(remarks == null || remarks.isEmpty() ? type().tag() : remarks)
        .server(fields[0])
        .port(Ports.parse(fields[1]))
        .protocol(fields[2])
        .cipher(fields[3])
        .obfs(fields[4])
        .password(Base64Text.decode(fields[5]))
        .obfsParam(optionalBase64(query, "obfsparam"))
        .protocolParam(optionalBase64(query, "protoparam"))
        .build();
  }

  private static String optionalBase64(Map<String, String> query, String key) throws InvalidFormatException {
    String value = query.get(key);
    // form decoding turns a standard-alphabet '+' into a space
    return value == null || value.isEmpty() ? null : Base64Text.decode(value.replace(' ', '+'));
  }

  @Override
  public String encode(ProxyNode node) {
    String main = String.join(":",
        node.server(),
        Integer.toString(node.port()),
        orDefault(node.protocol(), DEFAULT_PROTOCOL),
        orDefault(node.cipher(), DEFAULT_CIPHER),
        orDefault(node.obfs(), DEFAULT_OBFS),
        Base64Text.encodeUrlSafe(orDefault(node.password(), "")));

    Map<String, String> query = new LinkedHashMap<>();
    if (node.obfsParam() != null) {
      query.put("obfsparam", Base64Text.encodeUrlSafe(node.obfsParam()));
    }
    if (node.protocolParam() != null) {
      query.put("protoparam", Base64Text.encodeUrlSafe(node.protocolParam()));
    }
    if (!node.name().isEmpty()) {
      query.put("remarks", Base64Text.encodeUrlSafe(node.name()));
    }
    String body = query.isEmpty() ? main : main + "/?" + QueryString.format(query);
    return type().tag() + "://" + Base64Text.encodeUrlSafe(body);
  }

  private static String orDefault(String value, String fallback) {
    return value == null ? fallback : value;
  }
}
