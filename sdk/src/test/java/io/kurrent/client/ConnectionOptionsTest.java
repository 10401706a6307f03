package io.kurrent.client;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Tests for connection options. */
public class ConnectionOptionsTest {

  @Test
  public void testDefaults() {
    ConnectionOptions options = ConnectionOptions.getDefault();

    assertEquals(10000, options.keepAliveTimeMs());
    assertEquals(10000, options.keepAliveTimeoutMs());
    assertEquals(
        ConnectionOptions.DEFAULT_MAX_INBOUND_MESSAGE_SIZE_BYTES,
        options.maxInboundMessageSizeBytes());
    assertFalse(options.defaultDeadlineMs().isPresent());
    assertFalse(options.connectionName().isPresent());
  }

  @Test
  public void testToBuilderPreservesValues() {
    ConnectionOptions options =
        ConnectionOptions.builder()
            .setKeepAliveTimeMs(2000)
            .setDefaultDeadlineMs(15000)
            .setConnectionName("billing-worker")
            .build();

    ConnectionOptions copy = options.toBuilder().setKeepAliveTimeoutMs(3000).build();

    assertEquals(2000, copy.keepAliveTimeMs());
    assertEquals(3000, copy.keepAliveTimeoutMs());
    assertEquals(15000L, copy.defaultDeadlineMs().get().longValue());
    assertEquals("billing-worker", copy.connectionName().get());
  }

  @Test
  public void testRejectsNonPositiveValues() {
    assertThrows(
        IllegalArgumentException.class, () -> ConnectionOptions.builder().setKeepAliveTimeMs(0));
    assertThrows(
        IllegalArgumentException.class,
        () -> ConnectionOptions.builder().setMaxInboundMessageSizeBytes(-1));
    assertThrows(
        IllegalArgumentException.class, () -> ConnectionOptions.builder().setDefaultDeadlineMs(0));
  }
}
