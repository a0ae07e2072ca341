/**
 * <strong>Purpose:</strong> Configuration sources (defaults, YAML, CLI), typed command settings and the composition
 * root.
 * <p><strong>Precedence:</strong> CLI &gt; YAML &gt; embedded defaults.
 * <p><strong>Concurrency:</strong> Configuration records are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.config;
