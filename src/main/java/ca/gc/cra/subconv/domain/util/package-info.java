/**
 * Text helpers shared by the domain and codecs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subconv.domain.util;
