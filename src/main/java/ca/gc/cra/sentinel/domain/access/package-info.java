/**
 * <strong>Purpose:</strong> Caller identities and the roles that gate registry writes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.domain.access;
