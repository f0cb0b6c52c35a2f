package ca.gc.cra.subconv.domain.proxy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Canonical, protocol-agnostic description of one proxy endpoint.
 * <p><strong>Why:</strong> Every share-link dialect decodes into, and encodes from, this single flat shape, which maps
 * one-to-one onto an entry of the routing client's {@code proxies:} list.</p>
 * <p><strong>Role:</strong> Domain value object produced by codecs, the subscription extractor and the YAML reader.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied on construction.</p>
 *
 * <p>Optional values are absent rather than defaulted: strings are {@code null}, {@code alterId} is {@code 0},
 * flags are {@code false} and {@code alpn} is empty. Empty strings passed to the builder are treated as absent.
 * A node with {@link RealityOptions} always reports {@link #tls()} as {@code true}.</p>
 *
 * @since 0.1.0
 */
public final class ProxyNode {
  private final String name;
  private final String type;
  private final String server;
  private final int port;
  private final String uuid;
  private final String password;
  private final String cipher;
  private final int alterId;
  private final String network;
  private final boolean tls;
  private final String sni;
  private final String servername;
  private final String flow;
  private final String encryption;
  private final String clientFingerprint;
  private final String plugin;
  private final Map<String, Object> pluginOpts;
  private final String protocol;
  private final String obfs;
  private final String obfsParam;
  private final String protocolParam;
  private final String authStr;
  private final String up;
  private final String down;
  private final String obfsPassword;
  private final boolean skipCertVerify;
  private final List<String> alpn;
  private final WsOptions wsOpts;
  private final GrpcOptions grpcOpts;
  private final RealityOptions realityOpts;
  private final String token;
  private final boolean disableSni;
  private final boolean reduceRtt;
  private final String udpRelayMode;
  private final String congestionController;
  private final String ports;

  private ProxyNode(Builder builder) {
    this.type = Objects.requireNonNull(builder.type, "type");
    this.name = Objects.requireNonNullElse(builder.name, "");
    this.server = Objects.requireNonNullElse(builder.server, "");
    this.port = builder.port;
    this.uuid = emptyToNull(builder.uuid);
    this.password = emptyToNull(builder.password);
    this.cipher = emptyToNull(builder.cipher);
    this.alterId = builder.alterId;
    this.network = emptyToNull(builder.network);
    this.realityOpts = builder.realityOpts;
    this.tls = builder.tls || builder.realityOpts != null;
    this.sni = emptyToNull(builder.sni);
    this.servername = emptyToNull(builder.servername);
    this.flow = emptyToNull(builder.flow);
    this.encryption = emptyToNull(builder.encryption);
    this.clientFingerprint = emptyToNull(builder.clientFingerprint);
    this.plugin = emptyToNull(builder.plugin);
    this.pluginOpts = copyOptions(builder.pluginOpts);
    this.protocol = emptyToNull(builder.protocol);
    this.obfs = emptyToNull(builder.obfs);
    this.obfsParam = emptyToNull(builder.obfsParam);
    this.protocolParam = emptyToNull(builder.protocolParam);
    this.authStr = emptyToNull(builder.authStr);
    this.up = emptyToNull(builder.up);
    this.down = emptyToNull(builder.down);
    this.obfsPassword = emptyToNull(builder.obfsPassword);
    this.skipCertVerify = builder.skipCertVerify;
    this.alpn = builder.alpn == null ? List.of() : List.copyOf(builder.alpn);
    this.wsOpts = builder.wsOpts;
    this.grpcOpts = builder.grpcOpts;
    this.token = emptyToNull(builder.token);
    this.disableSni = builder.disableSni;
    this.reduceRtt = builder.reduceRtt;
    this.udpRelayMode = emptyToNull(builder.udpRelayMode);
    this.congestionController = emptyToNull(builder.congestionController);
    this.ports = emptyToNull(builder.ports);
  }

  /**
   * Starts a builder for a node of the given protocol.
   *
   * @param type protocol of the node
   * @return builder with {@code type} set to the protocol tag
   */
  public static Builder builder(ProtocolType type) {
    return new Builder(Objects.requireNonNull(type, "type").tag());
  }

  /**
   * Starts a builder with a raw {@code type} tag, as read from structured configuration.
   *
   * @param type protocol tag; may name a protocol this codec cannot encode
   * @return builder
   */
  public static Builder builder(String type) {
    return new Builder(Objects.requireNonNull(type, "type"));
  }

  /**
   * Returns a builder pre-populated with this node's values.
   *
   * @return builder copy
   */
  public Builder toBuilder() {
    Builder copy = new Builder(type)
        .name(name)
        .server(server)
        .port(port)
        .uuid(uuid)
        .password(password)
        .cipher(cipher)
        .alterId(alterId)
        .network(network)
        .tls(tls)
        .sni(sni)
        .servername(servername)
        .flow(flow)
        .encryption(encryption)
        .clientFingerprint(clientFingerprint)
        .plugin(plugin)
        .pluginOpts(pluginOpts)
        .protocol(protocol)
        .obfs(obfs)
        .obfsParam(obfsParam)
        .protocolParam(protocolParam)
        .authStr(authStr)
        .up(up)
        .down(down)
        .obfsPassword(obfsPassword)
        .skipCertVerify(skipCertVerify)
        .alpn(alpn)
        .wsOpts(wsOpts)
        .grpcOpts(grpcOpts)
        .realityOpts(realityOpts)
        .token(token)
        .disableSni(disableSni)
        .reduceRtt(reduceRtt)
        .udpRelayMode(udpRelayMode)
        .congestionController(congestionController);
    return copy.ports(ports);
  }

  /** @return display name; never {@code null} */
  public String name() { return name; }

  /** @return protocol tag ({@code ss}, {@code vmess}, ...) */
  public String type() { return type; }

  /** @return server host without IPv6 brackets; never {@code null} */
  public String server() { return server; }

  /** @return server port; {@code 0} when the source carried no usable port */
  public int port() { return port; }

  /** @return user id (vmess, vless, tuic v5) or {@code null} */
  public String uuid() { return uuid; }

  /** @return password or {@code null} */
  public String password() { return password; }

  /** @return cipher / security method or {@code null} */
  public String cipher() { return cipher; }

  /** @return vmess alter id; {@code 0} when absent */
  public int alterId() { return alterId; }

  /** @return transport network ({@code tcp}, {@code ws}, {@code grpc}, ...) or {@code null} */
  public String network() { return network; }

  /** @return whether TLS is enabled */
  public boolean tls() { return tls; }

  /** @return TLS server name indication (trojan, hysteria, tuic) or {@code null} */
  public String sni() { return sni; }

  /** @return TLS server name (vmess, vless) or {@code null} */
  public String servername() { return servername; }

  /** @return vless flow control or {@code null} */
  public String flow() { return flow; }

  /** @return vless encryption or {@code null} */
  public String encryption() { return encryption; }

  /** @return uTLS client fingerprint or {@code null} */
  public String clientFingerprint() { return clientFingerprint; }

  /** @return shadowsocks plugin name or {@code null} */
  public String plugin() { return plugin; }

  /** @return shadowsocks plugin options; empty when absent */
  public Map<String, Object> pluginOpts() { return pluginOpts; }

  /** @return ssr protocol or hysteria transport protocol, or {@code null} */
  public String protocol() { return protocol; }

  /** @return obfuscation mode / password or {@code null} */
  public String obfs() { return obfs; }

  /** @return ssr obfs parameter or {@code null} */
  public String obfsParam() { return obfsParam; }

  /** @return ssr protocol parameter or {@code null} */
  public String protocolParam() { return protocolParam; }

  /** @return hysteria v1 auth string or {@code null} */
  public String authStr() { return authStr; }

  /** @return upstream bandwidth hint or {@code null} */
  public String up() { return up; }

  /** @return downstream bandwidth hint or {@code null} */
  public String down() { return down; }

  /** @return hysteria2 obfuscation password or {@code null} */
  public String obfsPassword() { return obfsPassword; }

  /** @return whether certificate verification is skipped */
  public boolean skipCertVerify() { return skipCertVerify; }

  /** @return ALPN protocols; empty when absent */
  public List<String> alpn() { return alpn; }

  /** @return websocket options or {@code null} */
  public WsOptions wsOpts() { return wsOpts; }

  /** @return gRPC options or {@code null} */
  public GrpcOptions grpcOpts() { return grpcOpts; }

  /** @return Reality options or {@code null} */
  public RealityOptions realityOpts() { return realityOpts; }

  /** @return tuic v4 token or {@code null} */
  public String token() { return token; }

  /** @return whether tuic disables SNI */
  public boolean disableSni() { return disableSni; }

  /** @return whether tuic 0-RTT is enabled */
  public boolean reduceRtt() { return reduceRtt; }

  /** @return tuic UDP relay mode or {@code null} */
  public String udpRelayMode() { return udpRelayMode; }

  /** @return tuic congestion controller or {@code null} */
  public String congestionController() { return congestionController; }

  /** @return hysteria2 port-hopping range or {@code null} */
  public String ports() { return ports; }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProxyNode that)) {
      return false;
    }
    return port == that.port
        && alterId == that.alterId
        && tls == that.tls
        && skipCertVerify == that.skipCertVerify
        && disableSni == that.disableSni
        && reduceRtt == that.reduceRtt
        && name.equals(that.name)
        && type.equals(that.type)
        && server.equals(that.server)
        && Objects.equals(uuid, that.uuid)
        && Objects.equals(password, that.password)
        && Objects.equals(cipher, that.cipher)
        && Objects.equals(network, that.network)
        && Objects.equals(sni, that.sni)
        && Objects.equals(servername, that.servername)
        && Objects.equals(flow, that.flow)
        && Objects.equals(encryption, that.encryption)
        && Objects.equals(clientFingerprint, that.clientFingerprint)
        && Objects.equals(plugin, that.plugin)
        && pluginOpts.equals(that.pluginOpts)
        && Objects.equals(protocol, that.protocol)
        && Objects.equals(obfs, that.obfs)
        && Objects.equals(obfsParam, that.obfsParam)
        && Objects.equals(protocolParam, that.protocolParam)
        && Objects.equals(authStr, that.authStr)
        && Objects.equals(up, that.up)
        && Objects.equals(down, that.down)
        && Objects.equals(obfsPassword, that.obfsPassword)
        && alpn.equals(that.alpn)
        && Objects.equals(wsOpts, that.wsOpts)
        && Objects.equals(grpcOpts, that.grpcOpts)
        && Objects.equals(realityOpts, that.realityOpts)
        && Objects.equals(token, that.token)
        && Objects.equals(udpRelayMode, that.udpRelayMode)
        && Objects.equals(congestionController, that.congestionController)
        && Objects.equals(ports, that.ports);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, name, server, port, uuid, password, network, tls);
  }

  // Credentials are left out so nodes can be logged.
  @Override
  public String toString() {
    return "ProxyNode[type=" + type + ", name=" + name + ", server=" + server + ", port=" + port
        + ", network=" + network + ", tls=" + tls + "]";
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  private static Map<String, Object> copyOptions(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      if (entry.getKey() != null && entry.getValue() != null) {
        copy.put(entry.getKey(), entry.getValue());
      }
    }
    return Collections.unmodifiableMap(copy);
  }

  /** Builder for {@link ProxyNode}. */
  public static final class Builder {
    private final String type;
    private String name;
    private String server;
    private int port;
    private String uuid;
    private String password;
    private String cipher;
    private int alterId;
    private String network;
    private boolean tls;
    private String sni;
    private String servername;
    private String flow;
    private String encryption;
    private String clientFingerprint;
    private String plugin;
    private Map<String, ?> pluginOpts;
    private String protocol;
    private String obfs;
    private String obfsParam;
    private String protocolParam;
    private String authStr;
    private String up;
    private String down;
    private String obfsPassword;
    private boolean skipCertVerify;
    private List<String> alpn;
    private WsOptions wsOpts;
    private GrpcOptions grpcOpts;
    private RealityOptions realityOpts;
    private String token;
    private boolean disableSni;
    private boolean reduceRtt;
    private String udpRelayMode;
    private String congestionController;
    private String ports;

    private Builder(String type) {
      this.type = type;
    }

    /**
     * @param name display name
     * @return this builder
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * @param server host name or address, without IPv6 brackets
     * @return this builder
     */
    public Builder server(String server) {
      this.server = server;
      return this;
    }

    /**
     * @param port server port; {@code 0} when unknown
     * @return this builder
     */
    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder uuid(String uuid) {
      this.uuid = uuid;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder cipher(String cipher) {
      this.cipher = cipher;
      return this;
    }

    public Builder alterId(int alterId) {
      this.alterId = alterId;
      return this;
    }

    public Builder network(String network) {
      this.network = network;
      return this;
    }

    public Builder tls(boolean tls) {
      this.tls = tls;
      return this;
    }

    public Builder sni(String sni) {
      this.sni = sni;
      return this;
    }

    public Builder servername(String servername) {
      this.servername = servername;
      return this;
    }

    public Builder flow(String flow) {
      this.flow = flow;
      return this;
    }

    public Builder encryption(String encryption) {
      this.encryption = encryption;
      return this;
    }

    public Builder clientFingerprint(String clientFingerprint) {
      this.clientFingerprint = clientFingerprint;
      return this;
    }

    public Builder plugin(String plugin) {
      this.plugin = plugin;
      return this;
    }

    /**
     * Sets shadowsocks plugin options. Insertion order is kept; {@code null} keys and values are dropped.
     *
     * @param pluginOpts option map; may be {@code null}
     * @return this builder
     */
    public Builder pluginOpts(Map<String, ?> pluginOpts) {
      this.pluginOpts = pluginOpts;
      return this;
    }

    public Builder protocol(String protocol) {
      this.protocol = protocol;
      return this;
    }

    public Builder obfs(String obfs) {
      this.obfs = obfs;
      return this;
    }

    public Builder obfsParam(String obfsParam) {
      this.obfsParam = obfsParam;
      return this;
    }

    public Builder protocolParam(String protocolParam) {
      this.protocolParam = protocolParam;
      return this;
    }

    public Builder authStr(String authStr) {
      this.authStr = authStr;
      return this;
    }

    public Builder up(String up) {
      this.up = up;
      return this;
    }

    public Builder down(String down) {
      this.down = down;
      return this;
    }

    public Builder obfsPassword(String obfsPassword) {
      this.obfsPassword = obfsPassword;
      return this;
    }

    public Builder skipCertVerify(boolean skipCertVerify) {
      this.skipCertVerify = skipCertVerify;
      return this;
    }

    /**
     * @param alpn ALPN protocol list (copied); {@code null} clears it
     * @return this builder
     */
    public Builder alpn(List<String> alpn) {
      this.alpn = alpn;
      return this;
    }

    public Builder wsOpts(WsOptions wsOpts) {
      this.wsOpts = wsOpts;
      return this;
    }

    public Builder grpcOpts(GrpcOptions grpcOpts) {
      this.grpcOpts = grpcOpts;
      return this;
    }

    /**
     * @param realityOpts Reality options; a non-null value forces TLS on
     * @return this builder
     */
    public Builder realityOpts(RealityOptions realityOpts) {
      this.realityOpts = realityOpts;
      return this;
    }

    public Builder token(String token) {
      this.token = token;
      return this;
    }

    public Builder disableSni(boolean disableSni) {
      this.disableSni = disableSni;
      return this;
    }

    public Builder reduceRtt(boolean reduceRtt) {
      this.reduceRtt = reduceRtt;
      return this;
    }

    public Builder udpRelayMode(String udpRelayMode) {
      this.udpRelayMode = udpRelayMode;
      return this;
    }

    public Builder congestionController(String congestionController) {
      this.congestionController = congestionController;
      return this;
    }

    public Builder ports(String ports) {
      this.ports = ports;
      return this;
    }

    /**
     * Builds the immutable node.
     *
     * @return node instance
     */
    public ProxyNode build() {
      return new ProxyNode(this);
    }
  }
}
