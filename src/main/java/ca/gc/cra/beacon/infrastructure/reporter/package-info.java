/**
 * Local {@link ca.gc.cra.beacon.application.port.UpstreamReporter} implementations.
 */
package ca.gc.cra.beacon.infrastructure.reporter;
