package io.kurrent.client.persistent;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/** Tests for CancellationSource. */
class CancellationSourceTest {

  @Test
  void testParentCompletionCancels() {
    CompletableFuture<String> parent = new CompletableFuture<>();
    CancellationSource source = CancellationSource.linkedTo(parent);
    assertFalse(source.isCancellationRequested());

    parent.complete("done");

    assertTrue(source.isCancellationRequested());
  }

  @Test
  void testParentFailureCancels() {
    CompletableFuture<String> parent = new CompletableFuture<>();
    CancellationSource source = CancellationSource.linkedTo(parent);

    parent.completeExceptionally(new IllegalStateException("boom"));

    assertTrue(source.isCancellationRequested());
  }

  @Test
  void testAlreadyDoneParent() {
    CancellationSource source = CancellationSource.linkedTo(CompletableFuture.completedFuture(1));

    assertTrue(source.isCancellationRequested());
  }

  @Test
  void testCallbacksRunOnce() {
    CancellationSource source = CancellationSource.create();
    AtomicInteger calls = new AtomicInteger();
    source.onCancel(calls::incrementAndGet);

    source.cancel();
    source.close();

    assertEquals(1, calls.get());

    source.onCancel(calls::incrementAndGet);
    assertEquals(2, calls.get());
  }

  @Test
  void testTokenIsReadOnly() {
    CancellationSource source = CancellationSource.create();
    CompletableFuture<Void> token = source.token();

    token.complete(null);

    assertFalse(source.isCancellationRequested());
    source.cancel();
    assertTrue(source.token().isDone());
  }
}
