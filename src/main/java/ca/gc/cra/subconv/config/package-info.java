/**
 * <strong>Purpose:</strong> CLI configuration: YAML loading, defaults, precedence merging and typed settings.
 * <p><strong>Concurrency:</strong> Stateless loaders and immutable records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.config;
