package ca.gc.cra.subconv.domain.proxy;

/**
 * Thrown when input text does not have the shape its protocol or format requires: a missing
 * {@code ://} separator, a positional pattern mismatch, or malformed base64, JSON or YAML.
 *
 * @since 0.1.0
 */
public final class InvalidFormatException extends ProxyConversionException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public InvalidFormatException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause parser failure that triggered the rejection
   */
  public InvalidFormatException(String msg, Throwable cause) { super(msg, cause); }
}
