package ca.gc.cra.beacon.application.announce;

import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.InstanceProperties;
import ca.gc.cra.beacon.domain.collect.ItemKind;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes instance announcements into {@link CollectItem}s so they travel the same relay as telemetry.
 *
 * <p>Properties announcements carry the full attribute map; keep-alive announcements carry identity only.</p>
 *
 * @since 0.1.0
 */
public final class AnnouncementCodec {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Encodes a registration carrying the instance properties.
   *
   * @param properties fresh snapshot
   * @param timestampMillis announcement time
   * @return item of kind {@link ItemKind#INSTANCE_PROPERTIES}
   */
  public CollectItem properties(InstanceProperties properties, long timestampMillis) {
    return encode(ItemKind.INSTANCE_PROPERTIES, properties, timestampMillis, true);
  }

  /**
   * Encodes a liveness ping.
   *
   * @param properties fresh snapshot (identity fields only are written)
   * @param timestampMillis announcement time
   * @return item of kind {@link ItemKind#KEEP_ALIVE}
   */
  public CollectItem keepAlive(InstanceProperties properties, long timestampMillis) {
    return encode(ItemKind.KEEP_ALIVE, properties, timestampMillis, false);
  }

  private CollectItem encode(
      ItemKind kind, InstanceProperties properties, long timestampMillis, boolean includeAttributes) {
    Objects.requireNonNull(properties, "properties");
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator json = factory.createGenerator(out, JsonEncoding.UTF8)) {
      json.writeStartObject();
      json.writeStringField("type", kind == ItemKind.KEEP_ALIVE ? "keepAlive" : "properties");
      json.writeStringField("service", properties.service());
      json.writeStringField("serviceInstance", properties.serviceInstance());
      json.writeNumberField("timestamp", timestampMillis);
      if (includeAttributes) {
        json.writeObjectFieldStart("properties");
        for (Map.Entry<String, String> entry : properties.attributes().entrySet()) {
          json.writeStringField(entry.getKey(), entry.getValue());
        }
        json.writeEndObject();
      }
      json.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode " + kind + " announcement", ex);
    }
    return new CollectItem(kind, out.toByteArray());
  }
}
