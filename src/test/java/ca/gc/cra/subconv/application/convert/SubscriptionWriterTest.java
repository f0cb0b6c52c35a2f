package ca.gc.cra.subconv.application.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.util.Base64Text;
import java.util.List;
import org.junit.jupiter.api.Test;

class SubscriptionWriterTest {
  private final SubscriptionWriter writer = new SubscriptionWriter();

  @Test
  void unencodableNodesPairWithEmptyLink() {
    ProxyNode socks = ProxyNode.builder("socks5").name("s").server("example.com").port(1080).build();
    ProxyNode trojan = ProxyNode.builder(ProtocolType.TROJAN).name("t").server("example.com").port(443).build();

    List<NodeLink> links = writer.toLinks(List.of(socks, trojan));

    assertEquals(2, links.size());
    assertFalse(links.get(0).encoded());
    assertEquals("", links.get(0).uri());
    assertTrue(links.get(1).encoded());
    assertEquals(trojan, links.get(1).node());
  }

  @Test
  void uriLinesSkipFailuresAndKeepOrder() {
    ProxyNode socks = ProxyNode.builder("socks5").server("example.com").port(1080).build();
    ProxyNode first = ProxyNode.builder(ProtocolType.HYSTERIA2).name("a").server("a.example.com").port(1).build();
    ProxyNode second = ProxyNode.builder(ProtocolType.HYSTERIA2).name("b").server("b.example.com").port(2).build();

    String lines = writer.toUriLines(List.of(first, socks, second));

    assertEquals("hysteria2://a.example.com:1#a\nhysteria2://b.example.com:2#b", lines);
  }

  @Test
  void base64WrapsUriLines() throws Exception {
    List<ProxyNode> nodes = SampleNodes.all();

    assertEquals(writer.toUriLines(nodes), Base64Text.decode(writer.toBase64(nodes)));
  }
}
