package ca.gc.cra.subconv.domain.proxy;

/**
 * Checked base type for failures while converting between share links and {@link ProxyNode}s.
 *
 * @since 0.1.0
 * @see InvalidFormatException
 * @see UnsupportedProtocolException
 * @see NoProxiesFoundException
 */
public abstract class ProxyConversionException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  protected ProxyConversionException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause (base64, JSON or YAML parser failure)
   */
  protected ProxyConversionException(String msg, Throwable cause) { super(msg, cause); }
}
