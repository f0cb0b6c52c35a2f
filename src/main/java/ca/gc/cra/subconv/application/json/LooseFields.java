package ca.gc.cra.subconv.application.json;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Type-tolerant accessors for parsed JSON/YAML maps.
 *
 * <p>Share-link producers disagree on whether ports and ids are numbers or strings, so these accessors accept
 * either and never throw: a value of the wrong shape reads as absent.</p>
 *
 * @since 0.1.0
 */
public final class LooseFields {
  private LooseFields() {}

  /**
   * Reads a field as text. Integral numbers print without a fraction; booleans print as {@code true}/{@code false}.
   *
   * @param fields source map
   * @param key field name
   * @return text value, or {@code ""} when absent or not scalar
   */
  public static String getString(Map<String, ?> fields, String key) {
    Object value = fields.get(key);
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof Number number) {
      return formatNumber(number);
    }
    if (value instanceof Boolean flag) {
      return flag.toString();
    }
    return "";
  }

  /**
   * Reads a field as an int.
   *
   * @param fields source map
   * @param key field name
   * @return number value, or {@code 0} when absent or not numeric
   */
  public static int getInt(Map<String, ?> fields, String key) {
    Object value = fields.get(key);
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException ex) {
        return 0;
      }
    }
    return 0;
  }

  /**
   * Reads a field as a boolean. Strings {@code "true"} and {@code "1"} count as true.
   *
   * @param fields source map
   * @param key field name
   * @return flag value, {@code false} when absent
   */
  public static boolean getBool(Map<String, ?> fields, String key) {
    Object value = fields.get(key);
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof String text) {
      String trimmed = text.trim();
      return "true".equalsIgnoreCase(trimmed) || "1".equals(trimmed);
    }
    if (value instanceof Number number) {
      return number.intValue() != 0;
    }
    return false;
  }

  private static String formatNumber(Number number) {
    if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
      return Long.toString(number.longValue());
    }
    double value = number.doubleValue();
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return Long.toString((long) value);
    }
    return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
  }
}
