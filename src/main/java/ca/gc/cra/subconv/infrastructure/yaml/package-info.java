/**
 * Mapping between nodes and the {@code proxies:} YAML schema, backed by SnakeYAML.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.infrastructure.yaml;
