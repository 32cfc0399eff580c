/**
 * Process-level adapters: host facts for registration, JVM shutdown signals, and the detached worker launcher.
 */
package ca.gc.cra.beacon.infrastructure.process;
