package ca.gc.cra.subconv.domain.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProxyNodeTest {

  @Test
  void emptyStringsAreTreatedAsAbsent() {
    ProxyNode node = ProxyNode.builder(ProtocolType.TROJAN)
        .server("example.com")
        .password("")
        .sni("")
        .build();

    assertNull(node.password());
    assertNull(node.sni());
    assertEquals("", node.name());
    assertTrue(node.alpn().isEmpty());
    assertTrue(node.pluginOpts().isEmpty());
  }

  @Test
  void realityForcesTls() {
    ProxyNode node = ProxyNode.builder(ProtocolType.VLESS)
        .server("example.com")
        .tls(false)
        .realityOpts(new RealityOptions("pub", "ab"))
        .build();

    assertTrue(node.tls());
  }

  @Test
  void collectionsAreCopied() {
    List<String> alpn = new ArrayList<>(List.of("h2"));
    Map<String, Object> opts = new HashMap<>();
    opts.put("mode", "tls");
    opts.put("host", null);
    ProxyNode node = ProxyNode.builder(ProtocolType.SHADOWSOCKS)
        .alpn(alpn)
        .plugin("obfs")
        .pluginOpts(opts)
        .build();
    alpn.add("http/1.1");
    opts.put("extra", "x");

    assertEquals(List.of("h2"), node.alpn());
    assertEquals(Map.of("mode", "tls"), node.pluginOpts());
    assertThrows(UnsupportedOperationException.class, () -> node.alpn().add("h3"));
  }

  @Test
  void toBuilderCopiesEveryField() {
    ProxyNode original = ProxyNode.builder(ProtocolType.TUIC)
        .name("edge")
        .server("example.com")
        .port(443)
        .uuid("00000000-0000-0000-0000-000000000001")
        .password("pw")
        .token("tok")
        .alpn(List.of("h3"))
        .reduceRtt(true)
        .udpRelayMode("quic")
        .congestionController("bbr")
        .build();

    ProxyNode copy = original.toBuilder().build();

    assertEquals(original, copy);
    assertEquals(original.hashCode(), copy.hashCode());
    assertFalse(original.equals(original.toBuilder().port(8443).build()));
  }

  @Test
  void toStringOmitsCredentials() {
    ProxyNode node = ProxyNode.builder(ProtocolType.TROJAN)
        .server("example.com")
        .port(443)
        .password("s3cret")
        .build();

    assertFalse(node.toString().contains("s3cret"));
  }
}
