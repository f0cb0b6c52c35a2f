/**
 * <strong>Purpose:</strong> Ports implemented by protocol adapters.
 * <p><strong>Role:</strong> {@link ca.gc.cra.subconv.application.port.ProxyUriCodec} is the seam between the
 * converter and the per-protocol share-link codecs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.application.port;
