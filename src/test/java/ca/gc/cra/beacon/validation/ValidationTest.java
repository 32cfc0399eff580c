package ca.gc.cra.beacon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ValidationTest {

  @Test
  void numbersEnforceInclusiveRange() {
    assertEquals(5, Numbers.parseIntInRange("queueCapacity", " 5 ", 1, 10));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("queueCapacity", "0", 1, 10));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("queueCapacity", "many", 1, 10));
    assertTrue(ex.getMessage().contains("queueCapacity"));
  }

  @Test
  void stringsRejectBlankAndControlCharacters() {
    assertEquals("svc", Strings.requireNonBlank("service", "  svc "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("service", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("service", "a\u0007b"));
    assertEquals("beacon.v1", Strings.sanitizeTopic("topic", "beacon.v1"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("topic", "bad topic"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("lang", "jävä", 10));
  }

  @Test
  void hostPortListsAreNormalized() {
    assertEquals("broker-1:9092,10.0.0.1:9093,[::1]:9094",
        Net.validateHostPortList("kafkaBootstrap", "broker-1:9092, 10.0.0.1:9093,[::1]:9094"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("broker"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("broker:70000"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("300.1.1.1:80"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPortList("kafkaBootstrap", "a:1,,b:2"));
  }

  @Test
  void socketPathsMustFitKernelLimit() {
    Path shortPath = Paths.requireUsablePath("socketPath", "/tmp/beacon/./beacon.sock");
    assertEquals(Path.of("/tmp/beacon/beacon.sock"), Paths.requireSocketPath("socketPath", shortPath));
    Path longPath = Path.of("/tmp/" + "x".repeat(Paths.MAX_SOCKET_PATH_BYTES));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireSocketPath("socketPath", longPath));
  }
}
