package ca.gc.cra.subconv.infrastructure.uri;

import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding for URI components that are not form-encoded (userinfo, fragment).
 *
 * @since 0.1.0
 */
public final class PercentCodec {
  private PercentCodec() {}

  /**
   * Decodes percent escapes, leaving {@code +} as a literal plus.
   *
   * @param component raw component text
   * @return decoded text
   * @throws InvalidFormatException on a malformed escape
   */
  public static String decode(String component) throws InvalidFormatException {
    if (component.indexOf('%') < 0) {
      return component;
    }
    try {
      return URLDecoder.decode(component.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      throw new InvalidFormatException("malformed percent escape in share link", ex);
    }
  }

  /**
   * Percent-encodes every character outside the unreserved set; spaces become {@code %20}.
   *
   * @param component plain text
   * @return encoded text
   */
  public static String encode(String component) {
    return URLEncoder.encode(component, StandardCharsets.UTF_8)
        .replace("+", "%20")
        .replace("*", "%2A")
        .replace("%7E", "~");
  }
}
