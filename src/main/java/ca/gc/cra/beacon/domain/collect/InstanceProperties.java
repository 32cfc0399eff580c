package ca.gc.cra.beacon.domain.collect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of the service instance identity and host facts announced on each heartbeat.
 * <p>Never cached: a fresh snapshot is built on every tick so host changes are observed.</p>
 *
 * @param service logical service name
 * @param serviceInstance unique instance name
 * @param attributes ordered host attributes (hostname, ipv4, os_name, language, process_no)
 * @since 0.1.0
 */
public record InstanceProperties(String service, String serviceInstance, Map<String, String> attributes) {
  /** Host name attribute key. */
  public static final String KEY_HOST_NAME = "hostname";
  /** Comma separated IPv4 addresses attribute key. */
  public static final String KEY_IPV4 = "ipv4";
  /** Operating system name attribute key. */
  public static final String KEY_OS_NAME = "os_name";
  /** Instrumented language attribute key. */
  public static final String KEY_LANGUAGE = "language";
  /** Host process id attribute key. */
  public static final String KEY_PROCESS_NO = "process_no";

  public InstanceProperties {
    service = Objects.requireNonNull(service, "service");
    serviceInstance = Objects.requireNonNull(serviceInstance, "serviceInstance");
    attributes = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(attributes, "attributes")));
  }

  /**
   * Looks up a single attribute.
   *
   * @param key attribute key
   * @return attribute value or {@code null} when absent
   */
  public String attribute(String key) {
    return attributes.get(key);
  }
}
