package io.kurrent.client.persistent;

import io.kurrent.client.model.Record;
import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A callback-driven persistent subscription.
 *
 * <p>Once confirmed, a delivery loop on the client's executor passes each record to the {@link
 * RecordHandler}. The subscription is dropped exactly once, whichever of these happens first: the
 * handler fails, the server ends the call, the caller's token completes, or {@link #close()} is
 * called. The {@link SubscriptionDroppedHandler} is then notified and the call is released.
 */
public final class PersistentSubscription implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(PersistentSubscription.class);

  private final PersistentSubscriptionResult result;
  private final RecordHandler recordHandler;
  private final SubscriptionDroppedHandler droppedHandler;
  private final Executor executor;
  private final CompletableFuture<Void> cancellationToken;

  private final AtomicBoolean dropped = new AtomicBoolean(false);
  private volatile SubscriptionState state = SubscriptionState.UNCONFIRMED;
  private volatile String subscriptionId = "";

  private PersistentSubscription(
      PersistentSubscriptionResult result,
      RecordHandler recordHandler,
      SubscriptionDroppedHandler droppedHandler,
      Executor executor) {
    this.result = result;
    this.recordHandler = recordHandler;
    this.droppedHandler = droppedHandler;
    this.executor = executor;
    this.cancellationToken = result.cancellationToken();
  }

  /**
   * Waits for the server to confirm the subscription, then starts delivering records.
   *
   * <p>The returned future fails with {@link PersistentSubscriptionNotFoundException} if the group
   * does not exist, with {@link IllegalStateException} if the first frame is not a confirmation,
   * and with the call's own failure otherwise. On failure the call is released and no subscription
   * is returned.
   */
  static CompletableFuture<PersistentSubscription> confirm(
      PersistentSubscriptionResult result,
      RecordHandler recordHandler,
      SubscriptionDroppedHandler droppedHandler,
      Executor executor) {
    Objects.requireNonNull(result, "result cannot be null");
    Objects.requireNonNull(recordHandler, "recordHandler cannot be null");
    Objects.requireNonNull(droppedHandler, "droppedHandler cannot be null");

    PersistentSubscription subscription =
        new PersistentSubscription(result, recordHandler, droppedHandler, executor);
    CompletableFuture<PersistentSubscription> confirmed =
        CompletableFuture.supplyAsync(
            () -> {
              subscription.awaitConfirmation();
              return subscription;
            },
            executor);
    confirmed.whenComplete(
        (ignored, error) -> {
          if (error != null) {
            result.close();
          }
        });
    return confirmed;
  }

  private void awaitConfirmation() {
    Iterator<SubscriptionMessage> messages = result.messages();
    if (!messages.hasNext()) {
      throw new IllegalStateException("Subscription could not be confirmed.");
    }

    SubscriptionMessage first = messages.next();
    switch (first.getKind()) {
      case CONFIRMATION:
        subscriptionId = ((SubscriptionMessage.Confirmation) first).getSubscriptionId();
        state = SubscriptionState.ACTIVE;
        logger.debug("Persistent Subscription {} confirmed.", subscriptionId);
        executor.execute(() -> deliver(messages));
        return;
      case NOT_FOUND:
        state = SubscriptionState.DROPPED;
        throw new PersistentSubscriptionNotFoundException(
            result.getStreamName(), result.getGroupName());
      default:
        throw new IllegalStateException("Subscription could not be confirmed.");
    }
  }

  private void deliver(Iterator<SubscriptionMessage> messages) {
    try {
      while (messages.hasNext()) {
        SubscriptionMessage message = messages.next();
        switch (message.getKind()) {
          case EVENT:
            if (!handle((SubscriptionMessage.Event) message)) {
              return;
            }
            break;
          case NOT_FOUND:
            logger.error(
                "Persistent Subscription {} was dropped because the group no longer exists.",
                subscriptionId);
            drop(
                SubscriptionDroppedReason.SERVER_ERROR,
                new PersistentSubscriptionNotFoundException(
                    result.getStreamName(), result.getGroupName()));
            return;
          default:
            break;
        }
      }
    } catch (RuntimeException e) {
      if (dropped.get()) {
        logger.debug("Persistent Subscription {} stopped delivering.", subscriptionId);
      } else if (result.wasCancelledBeforeEnd()) {
        logger.warn(
            "Persistent Subscription {} was dropped because cancellation was requested.",
            subscriptionId);
        drop(SubscriptionDroppedReason.DISPOSED, null);
      } else {
        logger.error(
            "Persistent Subscription {} was dropped because of a server error.", subscriptionId, e);
        drop(SubscriptionDroppedReason.SERVER_ERROR, e);
      }
    } finally {
      if (!dropped.get()) {
        if (result.wasCancelledBeforeEnd()) {
          drop(SubscriptionDroppedReason.DISPOSED, null);
        } else {
          logger.error("Persistent Subscription {} was unexpectedly terminated.", subscriptionId);
          drop(SubscriptionDroppedReason.SERVER_ERROR, null);
        }
      }
    }
  }

  /** Passes one record to the handler. Returns false if the subscription was dropped. */
  private boolean handle(SubscriptionMessage.Event event) {
    Record record = event.getRecord();
    logger.trace("Persistent Subscription {} received record {}.", subscriptionId, record.getId());
    try {
      recordHandler.onRecord(this, record, event.getRetryCount().orElse(null), cancellationToken);
      return true;
    } catch (CancellationException e) {
      logger.warn(
          "Persistent Subscription {} was dropped because cancellation was requested by another"
              + " caller.",
          subscriptionId);
      drop(SubscriptionDroppedReason.DISPOSED, null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn(
          "Persistent Subscription {} was dropped because the handler was interrupted.",
          subscriptionId);
      drop(SubscriptionDroppedReason.DISPOSED, null);
    } catch (Throwable t) {
      if (result.isCancellationRequested()) {
        logger.warn(
            "Persistent Subscription {} was dropped because cancellation was requested.",
            subscriptionId);
        drop(SubscriptionDroppedReason.DISPOSED, null);
      } else {
        logger.error(
            "Persistent Subscription {} was dropped because the subscriber made an error.",
            subscriptionId,
            t);
        drop(SubscriptionDroppedReason.SUBSCRIBER_ERROR, t);
      }
    }
    return false;
  }

  private void drop(SubscriptionDroppedReason reason, @Nullable Throwable error) {
    if (!dropped.compareAndSet(false, true)) {
      return;
    }
    state = SubscriptionState.DROPPED;
    try {
      droppedHandler.onDropped(this, reason, error);
    } catch (RuntimeException e) {
      logger.error("Dropped handler of Persistent Subscription {} failed.", subscriptionId, e);
    } finally {
      result.close();
    }
  }

  /** Returns the id the server assigned to this subscription. */
  public String getSubscriptionId() {
    return subscriptionId;
  }

  public String getStreamName() {
    return result.getStreamName();
  }

  public String getGroupName() {
    return result.getGroupName();
  }

  public SubscriptionState getState() {
    return state;
  }

  // ==================== Acknowledgements ====================

  /**
   * Acknowledges records by id.
   *
   * @param ids up to 2000 record ids
   * @throws IllegalArgumentException if more than 2000 ids are given
   * @throws IllegalStateException if the subscription was dropped
   */
  public void ack(UUID... ids) {
    result.ack(ids);
  }

  /** Acknowledges records by id. See {@link #ack(UUID...)}. */
  public void ack(Collection<UUID> ids) {
    result.ack(ids);
  }

  /** Acknowledges records. See {@link #ack(UUID...)}. */
  public void ack(Record... records) {
    result.ack(records);
  }

  /**
   * Negatively acknowledges records by id.
   *
   * @param action what the server should do with the records
   * @param reason why the records could not be processed
   * @param ids up to 2000 record ids
   * @throws IllegalArgumentException if more than 2000 ids are given
   * @throws IllegalStateException if the subscription was dropped
   */
  public void nack(NackAction action, String reason, UUID... ids) {
    result.nack(action, reason, ids);
  }

  /** Negatively acknowledges records by id. See {@link #nack(NackAction, String, UUID...)}. */
  public void nack(NackAction action, String reason, Collection<UUID> ids) {
    result.nack(action, reason, ids);
  }

  /** Negatively acknowledges records. See {@link #nack(NackAction, String, UUID...)}. */
  public void nack(NackAction action, String reason, Record... records) {
    result.nack(action, reason, records);
  }

  /**
   * Drops the subscription with {@link SubscriptionDroppedReason#DISPOSED}.
   *
   * <p>Cancellation is requested first, so a handler waiting on its token observes it. The call
   * stays open until the dropped handler returns, so the handler may still ack or nack. Has no
   * effect if the subscription was already dropped.
   */
  @Override
  public void close() {
    result.cancel();
    drop(SubscriptionDroppedReason.DISPOSED, null);
  }
}
