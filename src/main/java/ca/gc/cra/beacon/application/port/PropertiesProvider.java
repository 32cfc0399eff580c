package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.collect.InstanceProperties;

/**
 * Builds a fresh {@link InstanceProperties} snapshot from live host facts.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PropertiesProvider {
  /**
   * Reads host facts and returns a new snapshot. Implementations must not cache.
   *
   * @return current instance properties
   */
  InstanceProperties snapshot();
}
