/**
 * <strong>Purpose:</strong> Command-line adapter: argument parsing, console output and the decode, encode and
 * extract commands.
 * <p><strong>Observability:</strong> Commands log through SLF4J and report outcomes as {@link
 * ca.gc.cra.subconv.api.ExitCode} values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.api;
