/**
 * <strong>Purpose:</strong> Use cases: single-link conversion, subscription extraction and subscription rendering.
 * <p><strong>Observability:</strong> Dropped links are logged at WARN without their credentials.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.application.convert;
