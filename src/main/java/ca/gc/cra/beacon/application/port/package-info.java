/**
 * Ports separating the relay core from IPC, locking, signals, reporters, and metrics.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters live under {@code infrastructure} and {@code adapter}.</p>
 * <p><strong>Concurrency:</strong> Each port documents its own threading contract.</p>
 */
package ca.gc.cra.beacon.application.port;
