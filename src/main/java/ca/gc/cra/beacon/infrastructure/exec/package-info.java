/**
 * Executor factories producing named, tuned thread pools for connection handling, reporting, and heartbeats.
 */
package ca.gc.cra.beacon.infrastructure.exec;
