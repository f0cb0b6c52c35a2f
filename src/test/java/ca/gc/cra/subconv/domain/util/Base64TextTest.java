package ca.gc.cra.subconv.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import org.junit.jupiter.api.Test;

class Base64TextTest {

  @Test
  void decodesStandardAlphabetWithPadding() throws Exception {
    assertEquals("aes-256-gcm:pass", Base64Text.decode("YWVzLTI1Ni1nY206cGFzcw=="));
  }

  @Test
  void decodesUnpaddedAndUrlSafeInput() throws Exception {
    // "??>" encodes to "Pz8+" (standard) and "Pz8-" (url-safe)
    assertEquals("??>", Base64Text.decode("Pz8-"));
    assertEquals("??>", Base64Text.decode("Pz8+"));
    assertEquals("ab", Base64Text.decode("YWI"));
    assertEquals("ab", Base64Text.decode("  YWI=\n"));
  }

  @Test
  void rejectsNonBase64() {
    assertThrows(InvalidFormatException.class, () -> Base64Text.decode("not base64!"));
    assertThrows(InvalidFormatException.class, () -> Base64Text.decode(null));
  }

  @Test
  void urlSafeEncodingHasNoPaddingOrReservedCharacters() {
    String encoded = Base64Text.encodeUrlSafe("??>a");

    assertFalse(encoded.contains("="));
    assertFalse(encoded.contains("+"));
    assertFalse(encoded.contains("/"));
  }

  @Test
  void standardEncodingIsPadded() {
    assertEquals("YWI=", Base64Text.encodeStandard("ab"));
  }
}
