package ca.gc.cra.subconv.domain.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ProtocolTypeTest {

  @Test
  void hy2SchemeResolvesToHysteria2() {
    assertEquals(Optional.of(ProtocolType.HYSTERIA2), ProtocolType.fromScheme("hy2"));
    assertEquals(Optional.of(ProtocolType.HYSTERIA2), ProtocolType.fromScheme("HYSTERIA2"));
  }

  @Test
  void aliasIsNotAcceptedAsTypeTag() {
    assertTrue(ProtocolType.fromTag("hy2").isEmpty());
    assertEquals("hysteria2", ProtocolType.HYSTERIA2.tag());
  }

  @Test
  void unknownAndNullResolveToEmpty() {
    assertTrue(ProtocolType.fromScheme("socks5").isEmpty());
    assertTrue(ProtocolType.fromScheme(null).isEmpty());
    assertTrue(ProtocolType.fromTag(null).isEmpty());
  }

  @Test
  void tagsMatchSchemes() {
    for (ProtocolType type : ProtocolType.values()) {
      assertEquals(Optional.of(type), ProtocolType.fromScheme(type.tag()));
    }
  }
}
