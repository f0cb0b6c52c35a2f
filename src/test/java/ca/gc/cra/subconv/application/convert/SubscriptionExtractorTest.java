package ca.gc.cra.subconv.application.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.NoProxiesFoundException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.util.Base64Text;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SubscriptionExtractorTest {
  private final SubscriptionExtractor extractor = new SubscriptionExtractor();

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(SubscriptionExtractor.class);
    originalLevel = logger.getLevel();
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setLevel(originalLevel);
  }

  @Test
  void corruptLineIsDroppedAndLoggedWithoutSecrets() throws Exception {
    String content = String.join("\n",
        "trojan://first@a.example.com:443#one",
        "vmess://c2VjcmV0LW5vdC1qc29u",
        "trojan://third@c.example.com:443#three");

    List<ProxyNode> nodes = extractor.extract(Base64Text.encodeStandard(content));

    assertEquals(List.of("one", "three"), nodes.stream().map(ProxyNode::name).toList());
    ILoggingEvent warning = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .findFirst()
        .orElseThrow();
    assertTrue(warning.getFormattedMessage().startsWith("Line 2 parse failed (vmess://[REDACTED]"),
        warning.getFormattedMessage());
    assertFalse(warning.getFormattedMessage().contains("c2VjcmV0"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().equals("Successfully parsed 2 valid nodes")));
  }

  @Test
  void malformedEscapeWarningDoesNotEchoPassword() throws Exception {
    String content = String.join("\n",
        "trojan://s3cretPass%ZZ@a.example.com:443#one",
        "trojan://ok@b.example.com:443#two");

    List<ProxyNode> nodes = extractor.extract(Base64Text.encodeStandard(content));

    assertEquals(List.of("two"), nodes.stream().map(ProxyNode::name).toList());
    ILoggingEvent warning = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .findFirst()
        .orElseThrow();
    assertTrue(warning.getFormattedMessage().startsWith("Line 1 parse failed (trojan://[REDACTED]"),
        warning.getFormattedMessage());
    assertFalse(warning.getFormattedMessage().contains("s3cretPass"), warning.getFormattedMessage());
  }

  @Test
  void nonBase64TextFindsNoProxies() {
    assertThrows(NoProxiesFoundException.class, () -> extractor.extract("not a url"));
  }

  @Test
  void allLinesFailingFindsNoProxies() {
    String content = Base64Text.encodeStandard("socks5://u:p@h:1\n\n# comment\n");

    NoProxiesFoundException ex = assertThrows(NoProxiesFoundException.class, () -> extractor.extract(content));
    assertEquals("no valid proxy links found", ex.getMessage());
  }

  @Test
  void acceptsUrlSafeBlobWrappedAcrossLines() throws Exception {
    String links = "trojan://pw@a.example.com:443?sni=%3F%3F%3E#one\r\ntrojan://pw@b.example.com:443#two";
    String encoded = Base64.getUrlEncoder().encodeToString(links.getBytes(StandardCharsets.UTF_8));
    String wrapped = encoded.substring(0, 20) + "\r\n" + encoded.substring(20);

    List<ProxyNode> nodes = extractor.extract(wrapped);

    assertEquals(2, nodes.size());
    assertEquals("b.example.com", nodes.get(1).server());
  }

  @Test
  void writerOutputIsReadBackInOrder() throws Exception {
    List<ProxyNode> nodes = SampleNodes.all();

    assertEquals(nodes, extractor.extract(new SubscriptionWriter().toBase64(nodes)));
  }

  @Test
  void yamlDocumentIsReadDirectly() throws Exception {
    String yaml = String.join("\n",
        "port: 7890",
        "proxies:",
        "  - name: a",
        "    type: trojan",
        "    server: a.example.com",
        "    port: 443",
        "    password: pw",
        "proxy-groups: []");

    List<ProxyNode> nodes = extractor.extract(yaml);

    assertEquals(1, nodes.size());
    assertEquals("trojan", nodes.get(0).type());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().equals("Detected YAML subscription format")));
  }

  @Test
  void yamlWithoutProxiesFindsNoProxies() {
    assertThrows(NoProxiesFoundException.class, () -> extractor.extract("proxy-groups: []\n"));
  }

  @Test
  void brokenYamlIsInvalidFormat() {
    assertThrows(InvalidFormatException.class, () -> extractor.extract("proxies: [unclosed\n"));
  }

  @Test
  void explicitUriListSkipsBlankAndCommentEntries() throws Exception {
    List<ProxyNode> nodes = extractor.extractFromUris(
        List.of("", "# header", "hy2://pw@example.com:443#x", "bogus"));

    assertEquals(1, nodes.size());
    assertEquals("hysteria2", nodes.get(0).type());
  }

  @Test
  void structuredDetectionNeedsMarkerAtLineStart() {
    assertTrue(SubscriptionExtractor.isStructured("proxies:\n  - {}"));
    assertTrue(SubscriptionExtractor.isStructured("mixed-port: 1\nproxy-groups: []"));
    assertFalse(SubscriptionExtractor.isStructured("dHJvamFuOi8v"));
  }
}
