package io.kurrent.client.persistent;

import javax.annotation.Nullable;

/** Notified once when a {@link PersistentSubscription} is dropped. */
@FunctionalInterface
public interface SubscriptionDroppedHandler {

  /** A handler that does nothing. */
  SubscriptionDroppedHandler NONE = (subscription, reason, error) -> {};

  /**
   * Called exactly once, from whichever thread dropped the subscription.
   *
   * @param subscription the dropped subscription
   * @param reason why it was dropped
   * @param error the cause, if any
   */
  void onDropped(
      PersistentSubscription subscription,
      SubscriptionDroppedReason reason,
      @Nullable Throwable error);
}
