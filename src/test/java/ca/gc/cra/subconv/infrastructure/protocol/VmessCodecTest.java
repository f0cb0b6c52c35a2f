package ca.gc.cra.subconv.infrastructure.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subconv.application.json.JsonSupport;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.proxy.WsOptions;
import ca.gc.cra.subconv.domain.util.Base64Text;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VmessCodecTest {
  private static final String UUID = "b831381d-6324-4d53-ad4f-8cda48b30811";

  private final VmessCodec codec = new VmessCodec();

  @Test
  void decodesWebsocketTlsPayloadWithStringNumbers() throws Exception {
    ProxyNode node = codec.decode("vmess://eyJ2IjogIjIiLCAicHMiOiAiVG9reW8iLCAiYWRkIjogImV4YW1wbGUuY29tIiwgInBvcnQiOiAi"
        + "NDQzIiwgImlkIjogImI4MzEzODFkLTYzMjQtNGQ1My1hZDRmLThjZGE0OGIzMDgxMSIsICJhaWQiOiAiMCIsICJzY3kiOiAiIiwgIm5ldCI6ICJ3"
        + "cyIsICJ0eXBlIjogIm5vbmUiLCAiaG9zdCI6ICJjZG4uZXhhbXBsZS5jb20iLCAicGF0aCI6ICIvd3MiLCAidGxzIjogInRscyIsICJzbmkiOiAi"
        + "Y2RuLmV4YW1wbGUuY29tIiwgImFscG4iOiAiaDIsaHR0cC8xLjEiLCAiZnAiOiAiY2hyb21lIn0=");

    assertEquals("Tokyo", node.name());
    assertEquals("example.com", node.server());
    assertEquals(443, node.port());
    assertEquals(UUID, node.uuid());
    assertEquals(0, node.alterId());
    assertEquals("auto", node.cipher());
    assertEquals("ws", node.network());
    assertTrue(node.tls());
    assertEquals("cdn.example.com", node.servername());
    assertEquals(List.of("h2", "http/1.1"), node.alpn());
    assertEquals("chrome", node.clientFingerprint());
    assertEquals(WsOptions.of("/ws", "cdn.example.com"), node.wsOpts());
  }

  @Test
  void decodesGrpcWithNumericFieldsAndDefaults() throws Exception {
    ProxyNode node = codec.decode("vmess://eyJhZGQiOiAiZXhhbXBsZS5jb20iLCAicG9ydCI6IDgwODAsICJpZCI6ICJiODMxMzgxZC02MzI0"
        + "LTRkNTMtYWQ0Zi04Y2RhNDhiMzA4MTEiLCAiYWlkIjogMiwgIm5ldCI6ICJncnBjIiwgInBhdGgiOiAic3ZjIiwgInRscyI6ICIifQ==");

    assertEquals("vmess", node.name());
    assertEquals(8080, node.port());
    assertEquals(2, node.alterId());
    assertFalse(node.tls());
    assertNull(node.servername());
    assertEquals("svc", node.grpcOpts().serviceName());
  }

  @Test
  void rejectsPayloadThatIsNotAnObject() {
    assertThrows(InvalidFormatException.class, () -> codec.decode("vmess://WzEsMl0="));
    assertThrows(InvalidFormatException.class, () -> codec.decode("vmess://bm90IGpzb24"));
  }

  @Test
  void encodesFullFieldSet() throws Exception {
    ProxyNode node = ProxyNode.builder(ProtocolType.VMESS)
        .name("Tokyo")
        .server("example.com")
        .port(443)
        .uuid(UUID)
        .network("ws")
        .tls(true)
        .sni("sni.example.com")
        .wsOpts(WsOptions.of("/ws", "cdn.example.com"))
        .build();

    String link = codec.encode(node);
    Map<String, Object> payload =
        new JsonSupport().parseObject(Base64Text.decode(link.substring("vmess://".length())));

    assertEquals("2", payload.get("v"));
    assertEquals(443, ((Number) payload.get("port")).intValue());
    assertEquals(0, ((Number) payload.get("aid")).intValue());
    assertEquals("auto", payload.get("scy"));
    assertEquals("none", payload.get("type"));
    assertEquals("/ws", payload.get("path"));
    assertEquals("cdn.example.com", payload.get("host"));
    assertEquals("tls", payload.get("tls"));
    assertEquals("sni.example.com", payload.get("sni"));
    assertFalse(payload.containsKey("alpn"));
  }
}
