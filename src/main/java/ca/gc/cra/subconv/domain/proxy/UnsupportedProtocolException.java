package ca.gc.cra.subconv.domain.proxy;

/**
 * Thrown when a URI scheme or node {@code type} tag names a protocol without a registered codec.
 *
 * @since 0.1.0
 */
public final class UnsupportedProtocolException extends ProxyConversionException {
  private final String protocol;

  /**
   * Creates an exception for the given scheme or tag.
   *
   * @param protocol offending scheme token or type tag; may be {@code null}
   */
  public UnsupportedProtocolException(String protocol) {
    super("unsupported protocol: " + protocol);
    this.protocol = protocol;
  }

  /**
   * @return the scheme token or type tag that could not be routed
   */
  public String protocol() {
    return protocol;
  }
}
