/**
 * <strong>Purpose:</strong> Input validation for CLI and YAML configuration.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Observability:</strong> Emits no logs; failures surface as {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.validation;
