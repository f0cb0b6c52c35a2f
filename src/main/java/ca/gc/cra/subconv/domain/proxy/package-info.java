/**
 * <strong>Purpose:</strong> Proxy node model, protocol identifiers and the conversion error hierarchy.
 * <p><strong>Concurrency:</strong> All types are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.domain.proxy;
