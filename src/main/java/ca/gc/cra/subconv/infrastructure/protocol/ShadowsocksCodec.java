package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.util.Base64Text;
import ca.gc.cra.subconv.infrastructure.uri.AuthorityUri;
import ca.gc.cra.subconv.infrastructure.uri.ShareLinkBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shadowsocks ({@code ss://}) share links.
 *
 * <p>Two forms are read. The authority form carries {@code base64(cipher:password)} as userinfo and an optional
 * {@code plugin=name;k=v;...} query value; a plain {@code cipher:password} userinfo is also accepted. The legacy form
 * is a single base64 blob of {@code cipher:password@host:port}. Links are always written in the authority form.</p>
 *
 * @since 0.1.0
 */
public final class ShadowsocksCodec implements ProxyUriCodec {
  static final String OBFS_PLUGIN = "obfs";

  // Split positionally: an '@' inside the password moves the host boundary.
  private static final Pattern LEGACY_BODY = Pattern.compile("^([^:@]+):([^@]+)@([^:]+):(\\d+)$");

  @Override
  public ProtocolType type() {
    return ProtocolType.SHADOWSOCKS;
  }

  @Override
  public ProxyNode decode(String uri) throws InvalidFormatException {
    AuthorityUri link = AuthorityUri.parse(uri);
    String name = link.nameOr(type().tag());
    if (!link.hasUserInfo()) {
      return decodeLegacy(link, name);
    }

    String cipher;
    String password;
    if (link.password() != null) {
      cipher = link.user();
      password = link.password();
    } else {
      String credentials = Base64Text.decode(link.user());
      int colon = credentials.indexOf(':');
      if (colon < 0) {
        throw new InvalidFormatException("ss userinfo is not cipher:password");
      }
      cipher = credentials.substring(0, colon);
      password = credentials.substring(colon + 1);
    }

    ProxyNode.Builder builder = ProxyNode.builder(type())
        .name(name)
        .server(link.host())
        .port(link.port())
        .cipher(cipher)
        .password(password);
    String plugin = link.param("plugin");
    if (!plugin.isEmpty()) {
      String[] parts = plugin.split(";");
      String pluginName = parts[0];
      Map<String, Object> opts = new LinkedHashMap<>();
      for (int i = 1; i < parts.length; i++) {
        int eq = parts[i].indexOf('=');
        if (eq < 0) {
          continue;
        }
        String key = parts[i].substring(0, eq);
        if (OBFS_PLUGIN.equals(pluginName) && "host".equals(key)) {
          key = "obfs-host";
        }
        opts.putIfAbsent(key, parts[i].substring(eq + 1));
      }
      builder.plugin(pluginName).pluginOpts(opts);
    }
    return builder.build();
  }

  private ProxyNode decodeLegacy(AuthorityUri link, String name) throws InvalidFormatException {
    String body = link.body();
    while (body.startsWith("/")) {
      body = body.substring(1);
    }
    String content = Base64Text.decode(body);
    Matcher matcher = LEGACY_BODY.matcher(content);
    if (!matcher.matches()) {
      throw new InvalidFormatException("ss legacy body does not match cipher:password@host:port");
    }
    return ProxyNode.builder(type())
        .name(name)
        .server(matcher.group(3))
        .port(Ports.parse(matcher.group(4)))
        .cipher(matcher.group(1))
        .password(matcher.group(2))
        .build();
  }

  @Override
  public String encode(ProxyNode node) {
    String cipher = node.cipher() == null ? "" : node.cipher();
    String password = node.password() == null ? "" : node.password();
    return ShareLinkBuilder.create(type().tag())
        .rawUser(Base64Text.encodeUrlSafe(cipher + ":" + password))
        .host(node.server(), node.port())
        .param("plugin", pluginValue(node))
        .name(node.name())
        .build();
  }

  private static String pluginValue(ProxyNode node) {
    if (node.plugin() == null) {
      return null;
    }
    Map<String, Object> opts = node.pluginOpts();
    List<String> parts = new ArrayList<>();
    parts.add(node.plugin());
    if (OBFS_PLUGIN.equals(node.plugin())) {
      Object mode = opts.containsKey("mode") ? opts.get("mode") : opts.get("obfs");
      Object host = opts.containsKey("host") ? opts.get("host") : opts.get("obfs-host");
      if (mode != null) {
        parts.add("obfs=" + mode);
      }
      if (host != null) {
        parts.add("obfs-host=" + host);
      }
    } else {
      for (Map.Entry<String, Object> entry : opts.entrySet()) {
        parts.add(entry.getKey() + "=" + entry.getValue());
      }
    }
    return String.join(";", parts);
  }
}
