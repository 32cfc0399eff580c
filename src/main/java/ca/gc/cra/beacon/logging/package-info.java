/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound payload previews.
 * <p><strong>Concurrency:</strong> Configuration runs once on the bootstrap thread; {@link ca.gc.cra.beacon.logging.Logs}
 * is stateless.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.logging;
