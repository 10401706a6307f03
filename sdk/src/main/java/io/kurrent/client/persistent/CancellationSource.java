package io.kurrent.client.persistent;

import java.util.concurrent.CompletableFuture;

/**
 * Cancellation signal owned by one subscription and linked to the caller's token.
 *
 * <p>The signal is a {@link CompletableFuture} that completes once cancellation is requested.
 * Completing the parent token, normally or exceptionally, cancels this source.
 */
final class CancellationSource implements AutoCloseable {

  private final CompletableFuture<Void> signal = new CompletableFuture<>();

  private CancellationSource() {}

  /**
   * Creates a source that is cancelled when the given token completes.
   *
   * @param parent The caller's cancellation token
   * @return A new linked source, already cancelled if the parent is done
   */
  static CancellationSource linkedTo(CompletableFuture<?> parent) {
    CancellationSource source = new CancellationSource();
    parent.whenComplete((ignored, error) -> source.cancel());
    return source;
  }

  /** Creates a source with no parent. */
  static CancellationSource create() {
    return new CancellationSource();
  }

  /** Requests cancellation. Idempotent. */
  void cancel() {
    signal.complete(null);
  }

  boolean isCancellationRequested() {
    return signal.isDone();
  }

  /**
   * Registers an action that runs once cancellation is requested.
   *
   * <p>If cancellation was already requested, the action runs on the calling thread.
   *
   * @param action The action to run
   */
  void onCancel(Runnable action) {
    signal.thenRun(action);
  }

  /** Returns a token that completes on cancellation. Completing the token has no effect here. */
  CompletableFuture<Void> token() {
    return signal.thenApply(ignored -> null);
  }

  /** Cancels the source. */
  @Override
  public void close() {
    cancel();
  }
}
