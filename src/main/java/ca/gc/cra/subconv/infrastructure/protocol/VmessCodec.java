package ca.gc.cra.subconv.infrastructure.protocol;

import ca.gc.cra.subconv.application.json.JsonSupport;
import ca.gc.cra.subconv.application.json.LooseFields;
import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.GrpcOptions;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.proxy.WsOptions;
import ca.gc.cra.subconv.domain.util.Base64Text;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * VMess ({@code vmess://}) share links: base64 of a JSON object in the v2 share format.
 *
 * @since 0.1.0
 */
public final class VmessCodec implements ProxyUriCodec {
  private final JsonSupport json;

  public VmessCodec() {
    this(new JsonSupport());
  }

  /**
   * @param json JSON helper shared across calls
   */
  public VmessCodec(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public ProtocolType type() {
    return ProtocolType.VMESS;
  }

  @Override
  public ProxyNode decode(String uri) throws InvalidFormatException {
    int sep = uri.indexOf("://");
    if (sep < 0) {
      throw new InvalidFormatException("missing '://' separator");
    }
    String payload = Base64Text.decode(uri.substring(sep + 3));
    Map<String, Object> data;
    try {
      data = json.parseObject(payload);
    } catch (IllegalArgumentException ex) {
      throw new InvalidFormatException("vmess payload is not a JSON object", ex);
    }

    String name = LooseFields.getString(data, "ps");
    String cipher = LooseFields.getString(data, "scy");
    String network = LooseFields.getString(data, "net");
    ProxyNode.Builder builder = ProxyNode.builder(type())
        .name(name.isEmpty() ? type().tag() : name)
        .server(LooseFields.getString(data, "add"))
        .port(LooseFields.getInt(data, "port"))
        .uuid(LooseFields.getString(data, "id"))
        .alterId(LooseFields.getInt(data, "aid"))
        .cipher(cipher.isEmpty() ? "auto" : cipher)
        .network(network.isEmpty() ? "tcp" : network);

    if ("tls".equals(LooseFields.getString(data, "tls"))) {
      builder.tls(true).servername(LooseFields.getString(data, "sni"));
      String alpn = LooseFields.getString(data, "alpn");
      if (!alpn.isEmpty()) {
        builder.alpn(List.of(alpn.split(",")));
      }
      builder.clientFingerprint(LooseFields.getString(data, "fp"));
    }

    if ("ws".equals(network)) {
      builder.wsOpts(WsOptions.of(LooseFields.getString(data, "path"), LooseFields.getString(data, "host")));
    } else if ("grpc".equals(network)) {
      builder.grpcOpts(new GrpcOptions(LooseFields.getString(data, "path")));
    }
    return builder.build();
  }

  @Override
  public String encode(ProxyNode node) {
    String network = node.network() == null ? "tcp" : node.network();
    String host = "";
    String path = "";
    if ("ws".equals(network) && node.wsOpts() != null) {
      path = node.wsOpts().path();
      host = Objects.requireNonNullElse(node.wsOpts().host(), "");
    } else if ("grpc".equals(network) && node.grpcOpts() != null) {
      path = node.grpcOpts().serviceName();
    }
    String sni = "";
    if (node.tls()) {
      sni = node.servername() != null ? node.servername() : Objects.requireNonNullElse(node.sni(), "");
    }

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("v", "2");
    data.put("ps", node.name());
    data.put("add", node.server());
    data.put("port", node.port());
    data.put("id", Objects.requireNonNullElse(node.uuid(), ""));
    data.put("aid", node.alterId());
    data.put("scy", node.cipher() == null ? "auto" : node.cipher());
    data.put("net", network);
    data.put("type", "none");
    data.put("host", host);
    data.put("path", path);
    data.put("tls", node.tls() ? "tls" : "");
    data.put("sni", sni);
    if (node.tls() && !node.alpn().isEmpty()) {
      data.put("alpn", String.join(",", node.alpn()));
    }
    if (node.tls() && node.clientFingerprint() != null) {
      data.put("fp", node.clientFingerprint());
    }
    return type().tag() + "://" + Base64Text.encodeUrlSafe(json.writeObject(data));
  }
}
