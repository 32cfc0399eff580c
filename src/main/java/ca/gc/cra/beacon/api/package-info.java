/**
 * <strong>Purpose:</strong> Command-line entry points: {@code start}, {@code worker}, and {@code send}.
 * <p><strong>Conventions:</strong> Arguments are {@code key=value} pairs plus {@code --flags}; every command maps
 * failures to an {@link ca.gc.cra.beacon.api.ExitCode}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.api;
