package ca.gc.cra.subconv.infrastructure.yaml;

import ca.gc.cra.subconv.application.json.LooseFields;
import ca.gc.cra.subconv.domain.proxy.GrpcOptions;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.proxy.RealityOptions;
import ca.gc.cra.subconv.domain.proxy.WsOptions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field mapping between {@link ProxyNode} and one entry of a routing-client {@code proxies:} list.
 *
 * <p>Key names are the client's wire contract, hyphens included. Entries are written in a fixed key order with
 * absent values omitted; reading coerces loosely typed scalars.</p>
 *
 * @since 0.1.0
 */
public final class ProxySchema {
  public static final String PROXIES = "proxies";

  static final String NAME = "name";
  static final String TYPE = "type";
  static final String SERVER = "server";
  static final String PORT = "port";
  static final String UUID = "uuid";
  static final String PASSWORD = "password";
  static final String CIPHER = "cipher";
  static final String ALTER_ID = "alterId";
  static final String NETWORK = "network";
  static final String TLS = "tls";
  static final String SNI = "sni";
  static final String SERVERNAME = "servername";
  static final String FLOW = "flow";
  static final String ENCRYPTION = "encryption";
  static final String CLIENT_FINGERPRINT = "client-fingerprint";
  static final String PLUGIN = "plugin";
  static final String PLUGIN_OPTS = "plugin-opts";
  static final String PROTOCOL = "protocol";
  static final String OBFS = "obfs";
  static final String OBFS_PARAM = "obfs-param";
  static final String PROTOCOL_PARAM = "protocol-param";
  static final String AUTH_STR = "auth-str";
  static final String UP = "up";
  static final String DOWN = "down";
  static final String OBFS_PASSWORD = "obfs-password";
  static final String SKIP_CERT_VERIFY = "skip-cert-verify";
  static final String ALPN = "alpn";
  static final String WS_OPTS = "ws-opts";
  static final String WS_PATH = "path";
  static final String WS_HEADERS = "headers";
  static final String GRPC_OPTS = "grpc-opts";
  static final String GRPC_SERVICE_NAME = "grpc-service-name";
  static final String REALITY_OPTS = "reality-opts";
  static final String REALITY_PUBLIC_KEY = "public-key";
  static final String REALITY_SHORT_ID = "short-id";
  static final String TOKEN = "token";
  static final String DISABLE_SNI = "disable-sni";
  static final String REDUCE_RTT = "reduce-rtt";
  static final String UDP_RELAY_MODE = "udp-relay-mode";
  static final String CONGESTION_CONTROLLER = "congestion-controller";
  static final String PORTS = "ports";

  private ProxySchema() {}

  /**
   * Renders a node as an ordered entry map.
   *
   * @param node node to render
   * @return entry with schema keys; absent values are left out
   */
  public static Map<String, Object> toEntry(ProxyNode node) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put(NAME, node.name());
    entry.put(TYPE, node.type());
    entry.put(SERVER, node.server());
    entry.put(PORT, node.port());
    putText(entry, UUID, node.uuid());
    putText(entry, PASSWORD, node.password());
    putText(entry, CIPHER, node.cipher());
    if (node.alterId() != 0) {
      entry.put(ALTER_ID, node.alterId());
    }
    putText(entry, NETWORK, node.network());
    putFlag(entry, TLS, node.tls());
    putText(entry, SNI, node.sni());
    putText(entry, SERVERNAME, node.servername());
    putText(entry, FLOW, node.flow());
    putText(entry, ENCRYPTION, node.encryption());
    putText(entry, CLIENT_FINGERPRINT, node.clientFingerprint());
    putText(entry, PLUGIN, node.plugin());
    if (!node.pluginOpts().isEmpty()) {
      entry.put(PLUGIN_OPTS, new LinkedHashMap<>(node.pluginOpts()));
    }
    putText(entry, PROTOCOL, node.protocol());
    putText(entry, OBFS, node.obfs());
    putText(entry, OBFS_PARAM, node.obfsParam());
    putText(entry, PROTOCOL_PARAM, node.protocolParam());
    putText(entry, AUTH_STR, node.authStr());
    putText(entry, UP, node.up());
    putText(entry, DOWN, node.down());
    putText(entry, OBFS_PASSWORD, node.obfsPassword());
    putFlag(entry, SKIP_CERT_VERIFY, node.skipCertVerify());
    if (!node.alpn().isEmpty()) {
      entry.put(ALPN, new ArrayList<>(node.alpn()));
    }
    if (node.wsOpts() != null) {
      Map<String, Object> ws = new LinkedHashMap<>();
      ws.put(WS_PATH, node.wsOpts().path());
      if (!node.wsOpts().headers().isEmpty()) {
        ws.put(WS_HEADERS, new LinkedHashMap<>(node.wsOpts().headers()));
      }
      entry.put(WS_OPTS, ws);
    }
    if (node.grpcOpts() != null) {
      Map<String, Object> grpc = new LinkedHashMap<>();
      grpc.put(GRPC_SERVICE_NAME, node.grpcOpts().serviceName());
      entry.put(GRPC_OPTS, grpc);
    }
    if (node.realityOpts() != null) {
      Map<String, Object> reality = new LinkedHashMap<>();
      reality.put(REALITY_PUBLIC_KEY, node.realityOpts().publicKey());
      reality.put(REALITY_SHORT_ID, node.realityOpts().shortId());
      entry.put(REALITY_OPTS, reality);
    }
    putText(entry, TOKEN, node.token());
    putFlag(entry, DISABLE_SNI, node.disableSni());
    putFlag(entry, REDUCE_RTT, node.reduceRtt());
    putText(entry, UDP_RELAY_MODE, node.udpRelayMode());
    putText(entry, CONGESTION_CONTROLLER, node.congestionController());
    putText(entry, PORTS, node.ports());
    return entry;
  }

  /**
   * Builds a node from one entry map.
   *
   * @param entry entry with schema keys
   * @return node; its {@code type} is kept verbatim even when no codec serves it
   * @throws InvalidFormatException when the entry has no {@code type}
   */
  public static ProxyNode fromEntry(Map<String, Object> entry) throws InvalidFormatException {
    String type = LooseFields.getString(entry, TYPE).trim();
    if (type.isEmpty()) {
      throw new InvalidFormatException("proxy entry has no type");
    }
    ProxyNode.Builder builder = ProxyNode.builder(type)
        .name(LooseFields.getString(entry, NAME))
        .server(LooseFields.getString(entry, SERVER))
        .port(LooseFields.getInt(entry, PORT))
        .uuid(LooseFields.getString(entry, UUID))
        .password(LooseFields.getString(entry, PASSWORD))
        .cipher(LooseFields.getString(entry, CIPHER))
        .alterId(LooseFields.getInt(entry, ALTER_ID))
        .network(LooseFields.getString(entry, NETWORK))
        .tls(LooseFields.getBool(entry, TLS))
        .sni(LooseFields.getString(entry, SNI))
        .servername(LooseFields.getString(entry, SERVERNAME))
        .flow(LooseFields.getString(entry, FLOW))
        .encryption(LooseFields.getString(entry, ENCRYPTION))
        .clientFingerprint(LooseFields.getString(entry, CLIENT_FINGERPRINT))
        .plugin(LooseFields.getString(entry, PLUGIN))
        .pluginOpts(asMap(entry.get(PLUGIN_OPTS)))
        .protocol(LooseFields.getString(entry, PROTOCOL))
        .obfs(LooseFields.getString(entry, OBFS))
        .obfsParam(LooseFields.getString(entry, OBFS_PARAM))
        .protocolParam(LooseFields.getString(entry, PROTOCOL_PARAM))
        .authStr(LooseFields.getString(entry, AUTH_STR))
        .up(LooseFields.getString(entry, UP))
        .down(LooseFields.getString(entry, DOWN))
        .obfsPassword(LooseFields.getString(entry, OBFS_PASSWORD))
        .skipCertVerify(LooseFields.getBool(entry, SKIP_CERT_VERIFY))
        .alpn(asList(entry.get(ALPN)))
        .token(LooseFields.getString(entry, TOKEN))
        .disableSni(LooseFields.getBool(entry, DISABLE_SNI))
        .reduceRtt(LooseFields.getBool(entry, REDUCE_RTT))
        .udpRelayMode(LooseFields.getString(entry, UDP_RELAY_MODE))
        .congestionController(LooseFields.getString(entry, CONGESTION_CONTROLLER))
        .ports(LooseFields.getString(entry, PORTS));

    Map<String, Object> ws = asMap(entry.get(WS_OPTS));
    if (ws != null) {
      Map<String, String> headers = new LinkedHashMap<>();
      Map<String, Object> rawHeaders = asMap(ws.get(WS_HEADERS));
      if (rawHeaders != null) {
        for (String key : rawHeaders.keySet()) {
          headers.put(key, LooseFields.getString(rawHeaders, key));
        }
      }
      builder.wsOpts(new WsOptions(LooseFields.getString(ws, WS_PATH), headers));
    }
    Map<String, Object> grpc = asMap(entry.get(GRPC_OPTS));
    if (grpc != null) {
      builder.grpcOpts(new GrpcOptions(LooseFields.getString(grpc, GRPC_SERVICE_NAME)));
    }
    Map<String, Object> reality = asMap(entry.get(REALITY_OPTS));
    if (reality != null) {
      builder.realityOpts(new RealityOptions(
          LooseFields.getString(reality, REALITY_PUBLIC_KEY), LooseFields.getString(reality, REALITY_SHORT_ID)));
    }
    return builder.build();
  }

  /**
   * Copies a YAML mapping into a string-keyed map.
   *
   * @param node parsed YAML value
   * @return copy with string keys, or {@code null} when {@code node} is not a mapping; non-string keys are dropped
   */
  static Map<String, Object> asMap(Object node) {
    if (!(node instanceof Map<?, ?> raw)) {
      return null;
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (entry.getKey() instanceof String key) {
        map.put(key, entry.getValue());
      }
    }
    return map;
  }

  private static List<String> asList(Object node) {
    List<String> values = new ArrayList<>();
    if (node instanceof List<?> items) {
      for (Object item : items) {
        if (item != null) {
          values.add(item.toString());
        }
      }
    } else if (node instanceof String text && !text.isBlank()) {
      for (String item : text.split(",")) {
        values.add(item.trim());
      }
    }
    return values;
  }

  private static void putText(Map<String, Object> entry, String key, String value) {
    if (value != null) {
      entry.put(key, value);
    }
  }

  private static void putFlag(Map<String, Object> entry, String key, boolean value) {
    if (value) {
      entry.put(key, Boolean.TRUE);
    }
  }
}
