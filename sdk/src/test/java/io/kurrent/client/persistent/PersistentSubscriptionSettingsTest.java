package io.kurrent.client.persistent;

import static org.junit.jupiter.api.Assertions.*;

import io.kurrent.client.model.LogPosition;
import org.junit.jupiter.api.Test;

/** Tests for PersistentSubscriptionSettings. */
public class PersistentSubscriptionSettingsTest {

  @Test
  public void testDefaults() {
    PersistentSubscriptionSettings settings = PersistentSubscriptionSettings.getDefault();

    assertFalse(settings.resolveLinkTos());
    assertTrue(settings.startFrom().isLatest());
    assertEquals(30000, settings.messageTimeoutMs());
    assertEquals(10, settings.maxRetryCount());
    assertEquals(500, settings.liveBufferSize());
    assertEquals(20, settings.readBatchSize());
    assertEquals(500, settings.historyBufferSize());
    assertEquals(2000, settings.checkPointAfterMs());
    assertEquals(10, settings.checkPointLowerBound());
    assertEquals(1000, settings.checkPointUpperBound());
    assertEquals(0, settings.maxSubscriberCount());
    assertEquals(ConsumerStrategy.ROUND_ROBIN, settings.consumerStrategy());
    assertEquals(settings, PersistentSubscriptionSettings.builder().build());
  }

  @Test
  public void testToBuilderCopiesValues() {
    PersistentSubscriptionSettings settings =
        PersistentSubscriptionSettings.builder()
            .setStartFrom(LogPosition.of(5))
            .setMaxRetryCount(3)
            .setConsumerStrategy(ConsumerStrategy.PINNED)
            .build();

    PersistentSubscriptionSettings copy = settings.toBuilder().build();

    assertEquals(settings, copy);
    assertEquals(settings.hashCode(), copy.hashCode());
    assertNotEquals(settings, copy.toBuilder().setMaxRetryCount(4).build());
  }

  @Test
  public void testRejectsInvalidValues() {
    PersistentSubscriptionSettings.PersistentSubscriptionSettingsBuilder builder =
        PersistentSubscriptionSettings.builder();

    assertThrows(IllegalArgumentException.class, () -> builder.setStartFrom(LogPosition.unset()));
    assertThrows(IllegalArgumentException.class, () -> builder.setMaxRetryCount(-1));
    assertThrows(IllegalArgumentException.class, () -> builder.setReadBatchSize(0));
    assertThrows(NullPointerException.class, () -> builder.setConsumerStrategy(null));
    assertThrows(
        IllegalArgumentException.class,
        () -> builder.setCheckPointLowerBound(50).setCheckPointUpperBound(20).build());
  }
}
