/**
 * Single-instance guard built on OS advisory file locks.
 */
package ca.gc.cra.beacon.infrastructure.lock;
