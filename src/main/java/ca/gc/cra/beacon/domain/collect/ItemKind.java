package ca.gc.cra.beacon.domain.collect;

/**
 * <strong>What:</strong> Categories of telemetry relayed by the BEACON daemon.
 * <p><strong>Why:</strong> Upstream reporters route items by kind (e.g., one Kafka topic per kind) without
 * inspecting payloads.</p>
 * <p><strong>Role:</strong> Domain enum shared by the frame decoder, relay queue, and reporters.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ItemKind {
  /** Batch of trace segments produced by instrumentation. */
  SEGMENT((byte) 1, true),
  /** Batch of meter samples. */
  METER((byte) 2, true),
  /** Batch of log records. */
  LOG((byte) 3, true),
  /** Service instance registration carrying host properties. */
  INSTANCE_PROPERTIES((byte) 4, false),
  /** Periodic liveness ping for the service instance. */
  KEEP_ALIVE((byte) 5, false);

  private final byte tag;
  private final boolean telemetry;

  ItemKind(byte tag, boolean telemetry) {
    this.tag = tag;
    this.telemetry = telemetry;
  }

  /**
   * Returns the one-byte tag written ahead of the payload in each IPC frame.
   *
   * @return wire tag
   */
  public byte tag() {
    return tag;
  }

  /**
   * Indicates whether the kind carries producer telemetry rather than daemon management data.
   *
   * @return {@code true} for segments, meters, and logs
   */
  public boolean telemetry() {
    return telemetry;
  }

  /**
   * Resolves a wire tag back to its kind.
   *
   * @param tag tag byte read from a frame
   * @return matching kind
   * @throws IllegalArgumentException if the tag is unknown
   */
  public static ItemKind fromTag(byte tag) {
    for (ItemKind kind : values()) {
      if (kind.tag == tag) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown item kind tag: " + (tag & 0xFF));
  }
}
