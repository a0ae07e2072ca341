/**
 * Exception hierarchy for analysis failures.
 * <p><strong>Role:</strong> Domain layer; every analytical exception is unchecked and carries an
 * {@link ca.gc.dfo.tides.domain.error.ErrorKind}. Empty selections are results, not exceptions.</p>
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.domain.error;
