package ca.gc.cra.beacon.infrastructure.process;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class JvmShutdownSignalsTest {

  @Test
  void registersOnceAndUnregistersCleanly() {
    JvmShutdownSignals signals = new JvmShutdownSignals();
    signals.register(() -> { });
    try {
      assertThrows(IllegalStateException.class, () -> signals.register(() -> { }));
    } finally {
      signals.unregister();
    }
    signals.unregister();
    signals.register(() -> { });
    signals.unregister();
    assertFalse(JvmShutdownSignals.shutdownInProgress());
  }
}
