/**
 * JSON parsing and writing on Jackson's streaming API, plus lenient field coercion.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.application.json;
