package ca.gc.cra.beacon.infrastructure.reporter;

import ca.gc.cra.beacon.application.relay.DrainingReporter;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reporter that writes one log line per relayed item. Announcement JSON is previewed; telemetry payloads
 * are reported by size only.
 */
public final class LoggingUpstreamReporter extends DrainingReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingUpstreamReporter.class);
  private static final int PREVIEW_BYTES = 256;

  @Override
  protected void forward(CollectItem item) {
    if (item.kind().telemetry()) {
      log.info("Relayed {} item ({} bytes)", item.kind(), item.size());
    } else {
      log.info("Relayed {} item: {}", item.kind(), Logs.truncate(item.payload(), PREVIEW_BYTES));
    }
  }

  @Override
  protected void flush() {
    // log output is synchronous
  }

  @Override
  public String name() {
    return "log";
  }
}
