package ca.gc.cra.subconv.infrastructure.uri;

import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Lenient split of a {@code scheme://[user[:pass]@]host:port[/path][?query][#fragment]} share link.
 *
 * <p>Share links routinely violate RFC 3986 (raw base64 in userinfo, unescaped spaces in fragments), so this parser
 * only splits on delimiters and never validates host syntax. The port is read permissively: a missing or
 * non-numeric port is {@code 0}.</p>
 *
 * @param scheme lower-cased scheme token
 * @param user decoded user slot; empty when absent
 * @param password decoded password slot, or {@code null} when the userinfo has no {@code :}
 * @param hasUserInfo whether an {@code @} separated userinfo was present
 * @param host host without IPv6 brackets
 * @param port port, {@code 0} when missing or unparsable
 * @param body raw text between {@code ://} and the first {@code ?} or {@code #}
 * @param query decoded query pairs in document order
 * @param fragment decoded fragment; empty when absent
 * @since 0.1.0
 */
public record AuthorityUri(
    String scheme,
    String user,
    String password,
    boolean hasUserInfo,
    String host,
    int port,
    String body,
    Map<String, String> query,
    String fragment) {

  public AuthorityUri {
    Objects.requireNonNull(scheme, "scheme");
    query = query == null ? Map.of() : query;
  }

  /**
   * Splits a share link into its components.
   *
   * @param uri share link; never {@code null}
   * @return parsed components
   * @throws InvalidFormatException when the link lacks {@code ://} or carries malformed escapes
   */
  public static AuthorityUri parse(String uri) throws InvalidFormatException {
    Objects.requireNonNull(uri, "uri");
    String text = uri.trim();
    int sep = text.indexOf("://");
    if (sep < 0) {
      throw new InvalidFormatException("missing '://' separator");
    }
    String scheme = text.substring(0, sep).toLowerCase(Locale.ROOT);
    String rest = text.substring(sep + 3);

    String fragment = "";
    int hash = rest.indexOf('#');
    if (hash >= 0) {
      fragment = PercentCodec.decode(rest.substring(hash + 1));
      rest = rest.substring(0, hash);
    }
    String rawQuery = null;
    int question = rest.indexOf('?');
    if (question >= 0) {
      rawQuery = rest.substring(question + 1);
      rest = rest.substring(0, question);
    }
    String body = rest;

    String user = "";
    String password = null;
    boolean hasUserInfo = false;
    String hostPart = body;
    int at = body.lastIndexOf('@');
    if (at >= 0) {
      hasUserInfo = true;
      String userInfo = body.substring(0, at);
      hostPart = body.substring(at + 1);
      int colon = userInfo.indexOf(':');
      if (colon >= 0) {
        user = PercentCodec.decode(userInfo.substring(0, colon));
        password = PercentCodec.decode(userInfo.substring(colon + 1));
      } else {
        user = PercentCodec.decode(userInfo);
      }
    }
    int slash = hostPart.indexOf('/');
    if (slash >= 0) {
      hostPart = hostPart.substring(0, slash);
    }

    String host;
    String rawPort = "";
    if (hostPart.startsWith("[")) {
      int close = hostPart.indexOf(']');
      if (close < 0) {
        throw new InvalidFormatException("unterminated IPv6 host literal");
      }
      host = hostPart.substring(1, close);
      String after = hostPart.substring(close + 1);
      if (after.startsWith(":")) {
        rawPort = after.substring(1);
      }
    } else {
      int colon = hostPart.lastIndexOf(':');
      if (colon >= 0 && hostPart.indexOf(':') == colon) {
        host = hostPart.substring(0, colon);
        rawPort = hostPart.substring(colon + 1);
      } else {
        host = hostPart;
      }
    }

    return new AuthorityUri(
        scheme, user, password, hasUserInfo, host, parsePort(rawPort), body, QueryString.parse(rawQuery), fragment);
  }

  /**
   * Returns a query value.
   *
   * @param key exact key
   * @return value, or {@code ""} when absent
   */
  public String param(String key) {
    return query.getOrDefault(key, "");
  }

  /**
   * Returns the first non-empty value among the given keys.
   *
   * @param keys keys in priority order
   * @return value, or {@code ""} when none is present
   */
  public String firstParam(String... keys) {
    for (String key : keys) {
      String value = param(key);
      if (!value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  /**
   * Returns a comma-separated query value as a list.
   *
   * @param key exact key
   * @return list items, empty when the key is absent
   */
  public List<String> listParam(String key) {
    String value = param(key);
    return value.isEmpty() ? List.of() : List.of(value.split(","));
  }

  /**
   * @param fallback value used when the fragment is empty
   * @return display name
   */
  public String nameOr(String fallback) {
    return fragment.isEmpty() ? fallback : fragment;
  }

  static int parsePort(String rawPort) {
    if (rawPort == null || rawPort.isEmpty()) {
      return 0;
    }
    try {
      return Integer.parseInt(rawPort.trim());
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
