package io.kurrent.client.persistent;

import io.kurrent.client.KurrentException;
import io.kurrent.client.model.Record;
import io.kurrent.client.protocol.persistent.ReadReq;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A raw persistent subscription: the caller pulls messages instead of receiving callbacks.
 *
 * <p>The message sequence can be enumerated only once, either through {@link #messages()} or
 * through the record view returned by {@link #iterator()}. Finishing the enumeration, normally or
 * with a fault, cancels the subscription.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try (PersistentSubscriptionResult subscription = client
 *     .subscribeToStream("orders-1", "billing")
 *     .join()
 *     .getValue()) {
 *   for (Record record : subscription) {
 *     process(record);
 *     subscription.ack(record);
 *   }
 * }
 * }</pre>
 */
public final class PersistentSubscriptionResult implements Iterable<Record>, AutoCloseable {

  private final String streamName;
  private final String groupName;
  private final DuplexSubscriptionChannel channel;
  private final AcknowledgementGateway gateway;
  private final CancellationSource cancellation;

  private final AtomicBoolean enumerated = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile boolean cancelledBeforeEnd = false;
  @Nullable private volatile String subscriptionId;

  private PersistentSubscriptionResult(
      String streamName,
      String groupName,
      DuplexSubscriptionChannel channel,
      CancellationSource cancellation) {
    this.streamName = streamName;
    this.groupName = groupName;
    this.channel = channel;
    this.gateway = new AcknowledgementGateway(channel);
    this.cancellation = cancellation;
  }

  /**
   * Opens the call and returns the handle that owns it.
   *
   * <p>If opening fails, the channel and the cancellation source are released before the failure
   * is rethrown.
   *
   * @param releaseCallOnCancel whether cancellation closes the call, or only ends the message
   *     sequence and leaves the call to be released by {@link #close()}
   * @throws CancellationException if cancellation was requested before the call was opened
   */
  static PersistentSubscriptionResult open(
      String streamName,
      String groupName,
      ReadReq request,
      DuplexSubscriptionChannel channel,
      CancellationSource cancellation,
      boolean releaseCallOnCancel) {
    PersistentSubscriptionResult result =
        new PersistentSubscriptionResult(streamName, groupName, channel, cancellation);
    if (cancellation.isCancellationRequested()) {
      result.close();
      throw new CancellationException("Subscription was cancelled before it started.");
    }
    if (releaseCallOnCancel) {
      cancellation.onCancel(channel::close);
    } else {
      cancellation.onCancel(channel::stopReading);
    }
    try {
      channel.open(request);
    } catch (RuntimeException e) {
      result.close();
      throw e;
    }
    return result;
  }

  public String getStreamName() {
    return streamName;
  }

  public String getGroupName() {
    return groupName;
  }

  /**
   * Returns the id the server assigned to this subscription.
   *
   * @return the id, or empty until the confirmation has been enumerated
   */
  public Optional<String> getSubscriptionId() {
    return Optional.ofNullable(subscriptionId);
  }

  /**
   * Returns the translated message sequence.
   *
   * <p>{@code hasNext()} blocks until the server sends the next frame. When the call fails, it
   * throws the failure: a {@link RuntimeException} as is, anything else wrapped in a {@link
   * KurrentException}. Closing the subscription ends the sequence with a {@link
   * java.util.concurrent.CancellationException}.
   *
   * @return the message iterator
   * @throws IllegalStateException if the messages were already enumerated
   */
  @Nonnull
  public Iterator<SubscriptionMessage> messages() {
    if (!enumerated.compareAndSet(false, true)) {
      throw new IllegalStateException("Messages may only be enumerated once.");
    }
    return new MessageIterator();
  }

  /**
   * Returns the delivered records, skipping every other kind of message.
   *
   * @return the record iterator
   * @throws IllegalStateException if the messages were already enumerated
   */
  @Nonnull
  @Override
  public Iterator<Record> iterator() {
    Iterator<SubscriptionMessage> messages = messages();
    return new Iterator<Record>() {
      @Nullable private Record next;

      @Override
      public boolean hasNext() {
        while (next == null && messages.hasNext()) {
          SubscriptionMessage message = messages.next();
          if (message.getKind() == SubscriptionMessage.Kind.EVENT) {
            next = ((SubscriptionMessage.Event) message).getRecord();
          }
        }
        return next != null;
      }

      @Override
      public Record next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        Record record = next;
        next = null;
        return record;
      }
    };
  }

  // ==================== Acknowledgements ====================

  /**
   * Acknowledges records by id.
   *
   * @param ids up to 2000 record ids
   * @throws IllegalArgumentException if more than 2000 ids are given
   */
  public void ack(UUID... ids) {
    gateway.ack(Arrays.asList(ids));
  }

  /** Acknowledges records by id. See {@link #ack(UUID...)}. */
  public void ack(Collection<UUID> ids) {
    gateway.ack(ids);
  }

  /** Acknowledges records. See {@link #ack(UUID...)}. */
  public void ack(Record... records) {
    gateway.ack(idsOf(records));
  }

  /**
   * Negatively acknowledges records by id.
   *
   * @param action what the server should do with the records
   * @param reason why the records could not be processed
   * @param ids up to 2000 record ids
   * @throws IllegalArgumentException if more than 2000 ids are given
   */
  public void nack(NackAction action, String reason, UUID... ids) {
    gateway.nack(action, reason, Arrays.asList(ids));
  }

  /** Negatively acknowledges records by id. See {@link #nack(NackAction, String, UUID...)}. */
  public void nack(NackAction action, String reason, Collection<UUID> ids) {
    gateway.nack(action, reason, ids);
  }

  /** Negatively acknowledges records. See {@link #nack(NackAction, String, UUID...)}. */
  public void nack(NackAction action, String reason, Record... records) {
    gateway.nack(action, reason, idsOf(records));
  }

  // ==================== Lifecycle ====================

  /** Cancels the subscription and closes the call. Safe to call more than once. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      cancellation.cancel();
      channel.close();
    }
  }

  /** Requests cancellation. Whether this also closes the call was decided in {@link #open}. */
  void cancel() {
    cancellation.cancel();
  }

  boolean isCancellationRequested() {
    return cancellation.isCancellationRequested();
  }

  /** Returns true if the enumeration ended because cancellation had already been requested. */
  boolean wasCancelledBeforeEnd() {
    return cancelledBeforeEnd;
  }

  CompletableFuture<Void> cancellationToken() {
    return cancellation.token();
  }

  private static List<UUID> idsOf(Record... records) {
    List<UUID> ids = new ArrayList<>(records.length);
    for (Record record : records) {
      ids.add(record.getId());
    }
    return ids;
  }

  private final class MessageIterator implements Iterator<SubscriptionMessage> {
    @Nullable private SubscriptionMessage next;
    private boolean done = false;

    @Override
    public boolean hasNext() {
      if (next != null) {
        return true;
      }
      if (done) {
        return false;
      }

      SubscriptionMessage message;
      try {
        message = channel.read();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        finish();
        throw new KurrentException("Interrupted while waiting for the next message", e);
      }

      if (message == null) {
        finish();
        Optional<Throwable> error = channel.completionError();
        if (error.isPresent()) {
          Throwable cause = error.get();
          if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
          }
          throw new KurrentException("Subscription failed: " + cause.getMessage(), cause);
        }
        return false;
      }

      if (message.getKind() == SubscriptionMessage.Kind.CONFIRMATION) {
        subscriptionId = ((SubscriptionMessage.Confirmation) message).getSubscriptionId();
      }
      next = message;
      return true;
    }

    @Override
    public SubscriptionMessage next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      SubscriptionMessage message = next;
      next = null;
      return message;
    }

    private void finish() {
      done = true;
      cancelledBeforeEnd = cancellation.isCancellationRequested();
      cancellation.cancel();
    }
  }
}
