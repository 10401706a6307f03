package io.kurrent.client.persistent;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

/** Tests for PersistentSubscriptionFilter. */
class PersistentSubscriptionFilterTest {

  @Test
  void testStreamPrefix() {
    PersistentSubscriptionFilter filter = PersistentSubscriptionFilter.streamPrefix("a-", "b-");

    assertEquals(PersistentSubscriptionFilter.Scope.STREAM, filter.getScope());
    assertEquals(Arrays.asList("a-", "b-"), filter.getPrefixes());
    assertFalse(filter.getRegex().isPresent());
    assertEquals(PersistentSubscriptionFilter.DEFAULT_WINDOW_MAX, filter.getWindowMax());
  }

  @Test
  void testRecordTypeRegexWithWindow() {
    PersistentSubscriptionFilter filter =
        PersistentSubscriptionFilter.recordTypeRegex("^Order.*").withWindowMax(50);

    assertEquals(PersistentSubscriptionFilter.Scope.RECORD_TYPE, filter.getScope());
    assertEquals("^Order.*", filter.getRegex().get());
    assertEquals(50, filter.getWindowMax());
  }

  @Test
  void testRejectsInvalidInput() {
    assertThrows(IllegalArgumentException.class, PersistentSubscriptionFilter::streamPrefix);
    assertThrows(
        IllegalArgumentException.class, () -> PersistentSubscriptionFilter.recordTypePrefix(""));
    assertThrows(NullPointerException.class, () -> PersistentSubscriptionFilter.streamRegex(null));
    assertThrows(
        IllegalArgumentException.class,
        () -> PersistentSubscriptionFilter.streamRegex("x").withWindowMax(0));
  }
}
