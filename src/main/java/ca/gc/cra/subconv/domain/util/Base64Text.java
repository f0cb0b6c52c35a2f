package ca.gc.cra.subconv.domain.util;

import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Base64 helpers for share-link payloads.
 *
 * <p>Producers disagree on alphabet and padding, so decoding accepts both the standard and URL-safe alphabets with
 * or without padding. Encoding always emits the URL-safe alphabet without padding.</p>
 *
 * @since 0.1.0
 */
public final class Base64Text {
  private Base64Text() {}

  /**
   * Decodes base64 text leniently.
   *
   * @param text encoded text; surrounding whitespace is ignored
   * @return decoded bytes as UTF-8 text
   * @throws InvalidFormatException if the text is not base64 in either alphabet
   */
  public static String decode(String text) throws InvalidFormatException {
    return new String(decodeBytes(text), StandardCharsets.UTF_8);
  }

  /**
   * Decodes base64 text leniently into raw bytes.
   *
   * @param text encoded text; surrounding whitespace is ignored
   * @return decoded bytes
   * @throws InvalidFormatException if the text is not base64 in either alphabet
   */
  public static byte[] decodeBytes(String text) throws InvalidFormatException {
    if (text == null) {
      throw new InvalidFormatException("base64 payload is missing");
    }
    String normalized = text.trim().replace('-', '+').replace('_', '/');
    int end = normalized.length();
    while (end > 0 && normalized.charAt(end - 1) == '=') {
      end--;
    }
    try {
      return Base64.getDecoder().decode(normalized.substring(0, end));
    } catch (IllegalArgumentException ex) {
      throw new InvalidFormatException("invalid base64 payload", ex);
    }
  }

  /**
   * Encodes text with the URL-safe alphabet and no padding.
   *
   * @param text plain text
   * @return encoded text
   */
  public static String encodeUrlSafe(String text) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Encodes text with the standard alphabet and padding.
   *
   * @param text plain text
   * @return encoded text
   */
  public static String encodeStandard(String text) {
    return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
  }
}
