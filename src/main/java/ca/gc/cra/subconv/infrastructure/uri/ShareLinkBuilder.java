package ca.gc.cra.subconv.infrastructure.uri;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles an authority-style share link. Query parameters keep insertion order and empty values are skipped.
 *
 * @since 0.1.0
 */
public final class ShareLinkBuilder {
  private final String scheme;
  private String userInfo = "";
  private String host = "";
  private int port;
  private final Map<String, String> query = new LinkedHashMap<>();
  private String fragment = "";

  private ShareLinkBuilder(String scheme) {
    this.scheme = scheme;
  }

  /**
   * Starts a link for the given scheme.
   *
   * @param scheme scheme token without {@code ://}
   * @return new builder
   */
  public static ShareLinkBuilder create(String scheme) {
    return new ShareLinkBuilder(Objects.requireNonNull(scheme, "scheme"));
  }

  /**
   * Sets a single-slot userinfo, percent-encoded. A {@code null} or empty user omits the userinfo.
   *
   * @param user user slot
   * @return this builder
   */
  public ShareLinkBuilder user(String user) {
    this.userInfo = user == null || user.isEmpty() ? "" : PercentCodec.encode(user);
    return this;
  }

  /**
   * Sets a two-slot {@code user:password} userinfo, both percent-encoded. An empty password yields a single slot.
   *
   * @param user user slot
   * @param password password slot
   * @return this builder
   */
  public ShareLinkBuilder user(String user, String password) {
    if (password == null || password.isEmpty()) {
      return user(user);
    }
    this.userInfo = PercentCodec.encode(user == null ? "" : user) + ":" + PercentCodec.encode(password);
    return this;
  }

  /**
   * Sets userinfo text that is already URI-safe (for example unpadded url-safe base64).
   *
   * @param encodedUserInfo userinfo text
   * @return this builder
   */
  public ShareLinkBuilder rawUser(String encodedUserInfo) {
    this.userInfo = encodedUserInfo == null ? "" : encodedUserInfo;
    return this;
  }

  /**
   * @param host host name or address; IPv6 literals are bracketed on output
   * @param port port number
   * @return this builder
   */
  public ShareLinkBuilder host(String host, int port) {
    this.host = host == null ? "" : host;
    this.port = port;
    return this;
  }

  /**
   * Adds a query parameter unless the value is {@code null} or empty.
   *
   * @param key parameter name
   * @param value parameter value
   * @return this builder
   */
  public ShareLinkBuilder param(String key, String value) {
    if (value != null && !value.isEmpty()) {
      query.put(key, value);
    }
    return this;
  }

  /**
   * Adds {@code key=1} when the flag is set.
   *
   * @param key parameter name
   * @param flag flag value
   * @return this builder
   */
  public ShareLinkBuilder flag(String key, boolean flag) {
    if (flag) {
      query.put(key, "1");
    }
    return this;
  }

  /**
   * Adds a comma-joined list parameter unless the list is empty.
   *
   * @param key parameter name
   * @param values list values
   * @return this builder
   */
  public ShareLinkBuilder list(String key, List<String> values) {
    if (values != null && !values.isEmpty()) {
      query.put(key, String.join(",", values));
    }
    return this;
  }

  /**
   * @param name display name; empty falls back to the scheme
   * @return this builder
   */
  public ShareLinkBuilder name(String name) {
    this.fragment = name == null ? "" : name;
    return this;
  }

  /**
   * Renders the link.
   *
   * @return share link text
   */
  public String build() {
    StringBuilder out = new StringBuilder(scheme).append("://");
    if (!userInfo.isEmpty()) {
      out.append(userInfo).append('@');
    }
    out.append(host.indexOf(':') >= 0 ? "[" + host + "]" : host).append(':').append(port);
    if (!query.isEmpty()) {
      out.append('?').append(QueryString.format(query));
    }
    out.append('#').append(PercentCodec.encode(fragment.isEmpty() ? scheme : fragment));
    return out.toString();
  }
}
