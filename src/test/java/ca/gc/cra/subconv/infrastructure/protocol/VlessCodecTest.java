package ca.gc.cra.subconv.infrastructure.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.proxy.RealityOptions;
import ca.gc.cra.subconv.domain.proxy.WsOptions;
import java.util.List;
import org.junit.jupiter.api.Test;

class VlessCodecTest {
  private static final String UUID = "b831381d-6324-4d53-ad4f-8cda48b30811";

  private final VlessCodec codec = new VlessCodec();

  @Test
  void decodesReality() throws Exception {
    ProxyNode node = codec.decode("vless://" + UUID + "@example.com:443?type=tcp&security=reality&pbk=PUBKEY&sid=ab12"
        + "&sni=www.microsoft.com&fp=chrome&flow=xtls-rprx-vision&encryption=none#Reality");

    assertEquals("Reality", node.name());
    assertEquals(UUID, node.uuid());
    assertEquals("tcp", node.network());
    assertTrue(node.tls());
    assertEquals(new RealityOptions("PUBKEY", "ab12"), node.realityOpts());
    assertEquals("www.microsoft.com", node.servername());
    assertEquals("chrome", node.clientFingerprint());
    assertEquals("xtls-rprx-vision", node.flow());
    assertEquals("none", node.encryption());
  }

  @Test
  void decodesWebsocketTlsOverIpv6() throws Exception {
    ProxyNode node = codec.decode("vless://" + UUID + "@[2001:db8::1]:443?type=ws&security=tls&path=%2Fws"
        + "&host=cdn.example.com&sni=cdn.example.com&alpn=h2%2Chttp%2F1.1");

    assertEquals("2001:db8::1", node.server());
    assertEquals("vless", node.name());
    assertTrue(node.tls());
    assertNull(node.realityOpts());
    assertEquals(List.of("h2", "http/1.1"), node.alpn());
    assertEquals(WsOptions.of("/ws", "cdn.example.com"), node.wsOpts());
  }

  @Test
  void missingSecurityMeansPlain() throws Exception {
    ProxyNode node = codec.decode("vless://" + UUID + "@example.com:80");

    assertFalse(node.tls());
    assertEquals("tcp", node.network());
  }

  @Test
  void encodesRealityParameters() {
    ProxyNode node = ProxyNode.builder(ProtocolType.VLESS)
        .name("r")
        .server("example.com")
        .port(443)
        .uuid(UUID)
        .flow("xtls-rprx-vision")
        .realityOpts(new RealityOptions("PUBKEY", "ab12"))
        .servername("www.microsoft.com")
        .build();

    assertEquals("vless://" + UUID + "@example.com:443?type=tcp&flow=xtls-rprx-vision&security=reality&pbk=PUBKEY"
        + "&sid=ab12&sni=www.microsoft.com#r", codec.encode(node));
  }

  @Test
  void plainNodeHasNoSecurityParameter() {
    ProxyNode node = ProxyNode.builder(ProtocolType.VLESS).server("example.com").port(80).uuid(UUID).build();

    assertFalse(codec.encode(node).contains("security="));
  }
}
