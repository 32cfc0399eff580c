/**
 * Telemetry value types relayed from producer processes to the upstream reporter.
 * <p>All types are immutable and safe to share across connection and reporter threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.domain.collect;
