/**
 * <strong>Purpose:</strong> Share-link codecs, one per supported protocol.
 * <p><strong>Concurrency:</strong> Codecs are stateless and safe for concurrent use.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.infrastructure.protocol;
