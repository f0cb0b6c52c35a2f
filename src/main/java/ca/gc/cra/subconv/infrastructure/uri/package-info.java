/**
 * Share-link URI parsing and building helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.infrastructure.uri;
