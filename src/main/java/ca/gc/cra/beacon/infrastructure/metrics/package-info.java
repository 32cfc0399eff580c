/**
 * OpenTelemetry-backed {@link ca.gc.cra.beacon.application.port.MetricsPort} implementation.
 * <p>Exporter selection follows {@code otel.*} system properties, then {@code OTEL_*} environment variables.</p>
 */
package ca.gc.cra.beacon.infrastructure.metrics;
