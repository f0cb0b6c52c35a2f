package ca.gc.cra.subconv.infrastructure.uri;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import java.util.List;
import org.junit.jupiter.api.Test;

class AuthorityUriTest {

  @Test
  void splitsAllComponents() throws Exception {
    AuthorityUri uri = AuthorityUri.parse("Trojan://pa%40ss@example.com:443/?sni=a.example.com&alpn=h2,http/1.1#My%20Node");

    assertEquals("trojan", uri.scheme());
    assertEquals("pa@ss", uri.user());
    assertNull(uri.password());
    assertTrue(uri.hasUserInfo());
    assertEquals("example.com", uri.host());
    assertEquals(443, uri.port());
    assertEquals("a.example.com", uri.param("sni"));
    assertEquals(List.of("h2", "http/1.1"), uri.listParam("alpn"));
    assertEquals("My Node", uri.fragment());
  }

  @Test
  void splitsUserAndPasswordAtFirstColon() throws Exception {
    AuthorityUri uri = AuthorityUri.parse("tuic://id:pa:ss@example.com:443");

    assertEquals("id", uri.user());
    assertEquals("pa:ss", uri.password());
  }

  @Test
  void userinfoEndsAtLastAt() throws Exception {
    AuthorityUri uri = AuthorityUri.parse("trojan://a@b@example.com:443");

    assertEquals("a@b", uri.user());
    assertEquals("example.com", uri.host());
  }

  @Test
  void stripsIpv6Brackets() throws Exception {
    AuthorityUri uri = AuthorityUri.parse("vless://id@[2001:db8::1]:8443?type=ws");

    assertEquals("2001:db8::1", uri.host());
    assertEquals(8443, uri.port());
  }

  @Test
  void missingOrBadPortIsZero() throws Exception {
    assertEquals(0, AuthorityUri.parse("trojan://pw@example.com").port());
    assertEquals(0, AuthorityUri.parse("trojan://pw@example.com:abc").port());
    assertEquals(0, AuthorityUri.parsePort(" "));
  }

  @Test
  void withoutUserinfoBodyIsKept() throws Exception {
    AuthorityUri uri = AuthorityUri.parse("ss://YWJj#name");

    assertFalse(uri.hasUserInfo());
    assertEquals("YWJj", uri.body());
    assertEquals("", uri.user());
  }

  @Test
  void plusInFragmentStaysLiteral() throws Exception {
    assertEquals("a+b c", AuthorityUri.parse("trojan://pw@h:1#a+b%20c").fragment());
  }

  @Test
  void nameFallsBackWhenFragmentEmpty() throws Exception {
    assertEquals("trojan", AuthorityUri.parse("trojan://pw@h:1").nameOr("trojan"));
  }

  @Test
  void firstParamUsesPriorityOrder() throws Exception {
    AuthorityUri uri = AuthorityUri.parse("hysteria://h:1?peer=b.example.com");

    assertEquals("b.example.com", uri.firstParam("sni", "peer"));
    assertEquals("", uri.firstParam("missing"));
  }

  @Test
  void rejectsMissingSeparatorAndBadEscapes() {
    assertThrows(InvalidFormatException.class, () -> AuthorityUri.parse("example.com:443"));
    assertThrows(InvalidFormatException.class, () -> AuthorityUri.parse("trojan://%zz@h:1"));
    assertThrows(InvalidFormatException.class, () -> AuthorityUri.parse("vless://id@[::1:443"));
  }
}
