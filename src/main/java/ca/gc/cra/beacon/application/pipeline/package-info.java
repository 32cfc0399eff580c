/**
 * Daemon pipeline: per-connection decode loops and the lifecycle coordinator.
 * <p>The coordinator owns the reporter thread ({@code beacon-reporter}); decode loops run on the
 * listener's connection pool ({@code beacon-conn-*}) and never block on the relay queue.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.application.pipeline;
