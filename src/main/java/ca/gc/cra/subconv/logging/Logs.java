package ca.gc.cra.subconv.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep credentials out of logs.
 * <p><strong>Why:</strong> Share links embed passwords, UUIDs and tokens inline; a failed line must be reportable
 * without echoing its secrets.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by the extractor and the CLI.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int MAX_SCHEME_CHARS = 16;

  private Logs() {
    // Utility
  }

  /**
   * Describes a share link by scheme and length only, e.g. {@code vmess://[REDACTED] (212 chars)}.
   *
   * @param uri share link or arbitrary line; {@code null} results in {@code "<null>"}
   * @return description safe to log
   */
  public static String describeUri(String uri) {
    if (uri == null) {
      return NULL_PLACEHOLDER;
    }
    String trimmed = uri.trim();
    int sep = trimmed.indexOf("://");
    String scheme = sep > 0 && sep <= MAX_SCHEME_CHARS ? trimmed.substring(0, sep) + "://" : "";
    return scheme + REDACTED_PLACEHOLDER + " (" + trimmed.length() + " chars)";
  }
}
