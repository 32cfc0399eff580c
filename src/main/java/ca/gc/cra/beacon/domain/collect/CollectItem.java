package ca.gc.cra.beacon.domain.collect;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> One decoded unit of telemetry handed from a producer connection to the relay queue.
 * <p><strong>Why:</strong> The daemon treats telemetry as opaque; only the kind is needed for routing.</p>
 * <p><strong>Role:</strong> Domain value object owned by the relay queue until a reporter drains it.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payload bytes are defensively copied on construction and access.</p>
 *
 * @param kind telemetry category; never {@code null}
 * @param payload serialized batch exactly as the producer wrote it
 * @since 0.1.0
 */
public record CollectItem(ItemKind kind, byte[] payload) {

  /**
   * Validates and copies the payload.
   *
   * @throws IllegalArgumentException if a telemetry kind carries an empty payload
   */
  public CollectItem {
    kind = Objects.requireNonNull(kind, "kind");
    payload = payload == null ? new byte[0] : payload.clone();
    if (kind.telemetry() && payload.length == 0) {
      throw new IllegalArgumentException(kind + " item must carry a payload");
    }
  }

  /**
   * Returns a copy of the payload bytes.
   *
   * @return payload copy
   */
  @Override
  public byte[] payload() {
    return payload.clone();
  }

  /**
   * Returns the payload size without copying.
   *
   * @return payload length in bytes
   */
  public int size() {
    return payload.length;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CollectItem that)) {
      return false;
    }
    return kind == that.kind && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "CollectItem[kind=" + kind + ", size=" + payload.length + ']';
  }
}
