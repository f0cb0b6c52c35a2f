package ca.gc.cra.subconv.infrastructure.uri;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Form-style query string codec used by share links.
 *
 * @since 0.1.0
 */
public final class QueryString {
  private static final Logger log = LoggerFactory.getLogger(QueryString.class);

  private QueryString() {}

  /**
   * Parses {@code k=v&k=v} into an ordered map.
   *
   * <p>Pairs are separated by {@code &} only, so a {@code ;} inside a value (as in shadowsocks plugin strings) is
   * data. The first {@code =} separates key and value; a pair without {@code =} maps to an empty value. The first
   * occurrence of a key wins. Pairs with malformed percent escapes are skipped.</p>
   *
   * @param rawQuery query text without the leading {@code ?}; may be {@code null}
   * @return unmodifiable map of decoded keys to decoded values
   */
  public static Map<String, String> parse(String rawQuery) {
    if (rawQuery == null || rawQuery.isEmpty()) {
      return Map.of();
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String rawKey = eq < 0 ? pair : pair.substring(0, eq);
      String rawValue = eq < 0 ? "" : pair.substring(eq + 1);
      try {
        String key = URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
        String value = URLDecoder.decode(rawValue, StandardCharsets.UTF_8);
        values.putIfAbsent(key, value);
      } catch (IllegalArgumentException ex) {
        log.debug("Dropping query pair with malformed escape: {}", ex.getMessage());
      }
    }
    return Collections.unmodifiableMap(values);
  }

  /**
   * Encodes an ordered map as {@code k=v&k=v} with form encoding.
   *
   * @param values pairs in output order
   * @return encoded query, empty when {@code values} is empty
   */
  public static String format(Map<String, String> values) {
    StringJoiner joiner = new StringJoiner("&");
    for (Map.Entry<String, String> entry : values.entrySet()) {
      joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
          + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
    }
    return joiner.toString();
  }
}
