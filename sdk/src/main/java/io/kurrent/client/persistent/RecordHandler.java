package io.kurrent.client.persistent;

import io.kurrent.client.model.Record;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nullable;

/**
 * Receives the records of a {@link PersistentSubscription}.
 *
 * <p>Records are delivered one at a time, in the order the server sent them. The next record is
 * not delivered until this method returns.
 */
@FunctionalInterface
public interface RecordHandler {

  /**
   * Handles one record.
   *
   * <p>Throwing a {@link java.util.concurrent.CancellationException} or an {@link
   * InterruptedException}, or throwing anything after the token completed, drops the subscription
   * as {@link SubscriptionDroppedReason#DISPOSED}. Any other exception drops it as {@link
   * SubscriptionDroppedReason#SUBSCRIBER_ERROR}.
   *
   * @param subscription the subscription delivering the record
   * @param record the record
   * @param retryCount how many times the server retried the record, or null for a first delivery
   * @param cancellation completes when the subscription is cancelled
   * @throws Exception to drop the subscription
   */
  void onRecord(
      PersistentSubscription subscription,
      Record record,
      @Nullable Integer retryCount,
      CompletableFuture<Void> cancellation)
      throws Exception;
}
