package ca.gc.cra.subconv.domain.proxy;

/**
 * Thrown when a batch conversion (subscription extraction, URI list decoding) yields no nodes at all.
 *
 * @since 0.1.0
 */
public final class NoProxiesFoundException extends ProxyConversionException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public NoProxiesFoundException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause failure that left the batch empty
   */
  public NoProxiesFoundException(String msg, Throwable cause) { super(msg, cause); }
}
