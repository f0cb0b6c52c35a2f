/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep share-link secrets out of log output.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Security:</strong> {@link ca.gc.cra.subconv.logging.Logs#describeUri(String)} reduces links to their
 * scheme before they are logged.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.logging;
