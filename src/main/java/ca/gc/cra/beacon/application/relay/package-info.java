/**
 * Bounded relay between producer connections and the upstream reporter.
 * <p>Backpressure policy: drop on full, never block the producer.</p>
 */
package ca.gc.cra.beacon.application.relay;
