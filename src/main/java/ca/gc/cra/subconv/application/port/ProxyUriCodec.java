package ca.gc.cra.subconv.application.port;

import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyConversionException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;

/**
 * <strong>What:</strong> Pluggable codec translating one share-link dialect to and from {@link ProxyNode}.
 * <p><strong>Why:</strong> Lets the converter dispatch by scheme without hard-coding protocol parsing.</p>
 * <p><strong>Role:</strong> Application port implemented by protocol adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the protocol served.</li>
 *   <li>Decode a share link of that protocol into a canonical node.</li>
 *   <li>Encode a canonical node back into a share link.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.subconv.application.convert.ProxyLinkConverter
 */
public interface ProxyUriCodec {
  /**
   * Returns the protocol served by this codec.
   *
   * @return protocol; never {@code null}
   */
  ProtocolType type();

  /**
   * Decodes a share link. The caller has already matched the scheme to {@link #type()}.
   *
   * @param uri complete share link including scheme; never {@code null}
   * @return decoded node
   * @throws ProxyConversionException when the link is malformed
   *
   * <p><strong>Concurrency:</strong> Safe for concurrent invocation.</p>
   */
  ProxyNode decode(String uri) throws ProxyConversionException;

  /**
   * Encodes a node into a share link of this protocol.
   *
   * @param node node whose {@code type} matches {@link #type()}; never {@code null}
   * @return share link
   * @throws ProxyConversionException when the node cannot be represented
   *
   * <p><strong>Concurrency:</strong> Safe for concurrent invocation.</p>
   */
  String encode(ProxyNode node) throws ProxyConversionException;
}
