/**
 * Report writers rendering station reports and extracted series as text or JSON.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.infrastructure.report;
