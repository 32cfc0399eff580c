package ca.gc.cra.beacon.infrastructure.process;

import ca.gc.cra.beacon.application.port.PropertiesProvider;
import ca.gc.cra.beacon.domain.collect.InstanceProperties;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads host facts for instance registration. Every {@link #snapshot()} re-reads the host, so address
 * changes show up on the next registration.
 *
 * <p>{@code process_no} is the configured host pid when present, otherwise the parent of this process.</p>
 *
 * @since 0.1.0
 */
public final class HostPropertiesProvider implements PropertiesProvider {
  private static final Logger log = LoggerFactory.getLogger(HostPropertiesProvider.class);

  private final String service;
  private final String serviceInstance;
  private final String language;
  private final OptionalLong hostPid;

  /**
   * Creates a provider.
   *
   * @param service service name
   * @param serviceInstance instance name
   * @param language language tag reported upstream
   * @param hostPid pid of the host process when known
   */
  public HostPropertiesProvider(String service, String serviceInstance, String language, OptionalLong hostPid) {
    this.service = Objects.requireNonNull(service, "service");
    this.serviceInstance = Objects.requireNonNull(serviceInstance, "serviceInstance");
    this.language = Objects.requireNonNull(language, "language");
    this.hostPid = Objects.requireNonNull(hostPid, "hostPid");
  }

  @Override
  public InstanceProperties snapshot() {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put(InstanceProperties.KEY_HOST_NAME, hostName());
    List<String> ipv4 = ipv4Addresses();
    if (!ipv4.isEmpty()) {
      attributes.put(InstanceProperties.KEY_IPV4, String.join(",", ipv4));
    }
    String osName = System.getProperty("os.name", "unknown");
    attributes.put(InstanceProperties.KEY_OS_NAME, osName.toLowerCase(Locale.ROOT));
    attributes.put(InstanceProperties.KEY_LANGUAGE, language);
    attributes.put(InstanceProperties.KEY_PROCESS_NO, Long.toString(processNo()));
    return new InstanceProperties(service, serviceInstance, attributes);
  }

  long processNo() {
    if (hostPid.isPresent()) {
      return hostPid.getAsLong();
    }
    return ProcessHandle.current().parent().map(ProcessHandle::pid).orElse(ProcessHandle.current().pid());
  }

  /**
   * Returns the local host name or {@code "unknown"}.
   *
   * @return host name
   */
  public static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Unable to resolve local host name", ex);
      return "unknown";
    }
  }

  static List<String> ipv4Addresses() {
    List<String> addresses = new ArrayList<>();
    try {
      Enumeration<NetworkInterface> nics = NetworkInterface.getNetworkInterfaces();
      if (nics == null) {
        return addresses;
      }
      for (NetworkInterface nic : Collections.list(nics)) {
        if (!nic.isUp() || nic.isLoopback()) {
          continue;
        }
        for (InetAddress address : Collections.list(nic.getInetAddresses())) {
          if (address instanceof Inet4Address) {
            addresses.add(address.getHostAddress());
          }
        }
      }
    } catch (SocketException ex) {
      log.debug("Unable to enumerate network interfaces", ex);
    }
    return addresses;
  }
}
