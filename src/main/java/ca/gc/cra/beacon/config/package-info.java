/**
 * <strong>Purpose:</strong> Configuration records, YAML loading, precedence merging, and component wiring.
 * <p><strong>Precedence:</strong> CLI {@code key=value} &gt; YAML ({@code common} plus mode section) &gt; defaults.</p>
 * <p><strong>Concurrency:</strong> Built once at startup; resulting records are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.config;
