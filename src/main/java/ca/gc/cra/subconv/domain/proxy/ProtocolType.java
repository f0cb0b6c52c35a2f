package ca.gc.cra.subconv.domain.proxy;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Proxy protocols understood by the share-link codec.
 * <p><strong>Why:</strong> Routes share links to the matching codec and stamps the {@code type} tag written into
 * structured configuration.</p>
 * <p><strong>Role:</strong> Domain enumeration referenced by the dispatcher, the codecs, and the YAML schema.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum ProtocolType {
  /** Shadowsocks ({@code ss://}). */
  SHADOWSOCKS("ss"),
  /** ShadowsocksR ({@code ssr://}). */
  SHADOWSOCKS_R("ssr"),
  /** VMess ({@code vmess://}) with a base64 JSON payload. */
  VMESS("vmess"),
  /** VLESS ({@code vless://}). */
  VLESS("vless"),
  /** Trojan ({@code trojan://}). */
  TROJAN("trojan"),
  /** Hysteria v1 ({@code hysteria://}). */
  HYSTERIA("hysteria"),
  /** Hysteria v2 ({@code hysteria2://}, also {@code hy2://}). */
  HYSTERIA2("hysteria2"),
  /** TUIC ({@code tuic://}). */
  TUIC("tuic");

  private static final String HYSTERIA2_ALIAS = "hy2";

  private final String tag;

  ProtocolType(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the tag used both as URI scheme and as the {@code type} value in structured configuration.
   *
   * @return lower-case protocol tag
   */
  public String tag() {
    return tag;
  }

  /**
   * Resolves a URI scheme token, applying the {@code hy2} alias.
   *
   * @param scheme scheme token in any case; may be {@code null}
   * @return matching protocol, or empty when the scheme is unknown
   */
  public static Optional<ProtocolType> fromScheme(String scheme) {
    if (scheme == null) {
      return Optional.empty();
    }
    String normalized = scheme.trim().toLowerCase(Locale.ROOT);
    if (HYSTERIA2_ALIAS.equals(normalized)) {
      return Optional.of(HYSTERIA2);
    }
    return fromTag(normalized);
  }

  /**
   * Resolves a {@code type} tag as carried by a {@link ProxyNode}.
   *
   * @param tag protocol tag in any case; may be {@code null}
   * @return matching protocol, or empty when the tag is unknown
   */
  public static Optional<ProtocolType> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    for (ProtocolType type : values()) {
      if (type.tag.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
