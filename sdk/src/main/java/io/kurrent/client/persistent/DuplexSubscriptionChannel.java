package io.kurrent.client.persistent;

import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.kurrent.client.protocol.persistent.PersistentSubscriptionsGrpc;
import io.kurrent.client.protocol.persistent.ReadReq;
import io.kurrent.client.protocol.persistent.ReadResp;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one {@code Read} call to the server.
 *
 * <p>Inbound frames are translated and handed to a single consumer through a bounded {@link
 * MessageBuffer}. Inbound flow control is manual: the call requests as many frames as the buffer
 * holds and one more each time the consumer takes a frame, so the server can never run further
 * ahead than the buffer capacity.
 *
 * <p>Outbound frames (the initial subscribe request, acks and nacks) are serialized through one
 * write lock, so {@link #writeControl} may be called from any thread.
 */
final class DuplexSubscriptionChannel implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(DuplexSubscriptionChannel.class);

  /** Frames buffered between the call and the consumer. */
  static final int CAPACITY = 1;

  private final PersistentSubscriptionsGrpc.PersistentSubscriptionsStub stub;
  private final SubscriptionMessageTranslator translator;
  private final MessageBuffer<SubscriptionMessage> buffer;
  private final int capacity;

  private final Object writeLock = new Object();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  @Nullable private volatile ClientCallStreamObserver<ReadReq> requestStream;

  DuplexSubscriptionChannel(
      PersistentSubscriptionsGrpc.PersistentSubscriptionsStub stub,
      SubscriptionMessageTranslator translator) {
    this(stub, translator, CAPACITY);
  }

  /** Test-only: allows a different buffer capacity. */
  DuplexSubscriptionChannel(
      PersistentSubscriptionsGrpc.PersistentSubscriptionsStub stub,
      SubscriptionMessageTranslator translator,
      int capacity) {
    this.stub = Objects.requireNonNull(stub, "stub cannot be null");
    this.translator = Objects.requireNonNull(translator, "translator cannot be null");
    this.buffer = new MessageBuffer<>(capacity);
    this.capacity = capacity;
  }

  /**
   * Starts the call and writes the initial subscribe request.
   *
   * @param initialRequest The subscribe request
   * @throws CancellationException if the channel was closed before it was opened
   * @throws IllegalStateException if the channel is already open
   */
  @SuppressWarnings("unchecked")
  void open(ReadReq initialRequest) {
    synchronized (writeLock) {
      if (closed.get()) {
        throw new CancellationException("Subscription was cancelled before it started.");
      }
      if (requestStream != null) {
        throw new IllegalStateException("Subscription call is already open.");
      }
      ClientCallStreamObserver<ReadReq> call =
          (ClientCallStreamObserver<ReadReq>) stub.read(new InboundObserver());
      requestStream = call;
      call.onNext(initialRequest);
    }
    logger.debug(
        "Opened subscription call for group {}", initialRequest.getOptions().getGroupName());
  }

  /**
   * Takes the next translated frame, blocking until one is available.
   *
   * @return The next message, or null once the call has ended
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable
  SubscriptionMessage read() throws InterruptedException {
    SubscriptionMessage message = buffer.read();
    if (message != null && !buffer.isCompleted()) {
      ClientCallStreamObserver<ReadReq> call = requestStream;
      if (call != null) {
        call.request(1);
      }
    }
    return message;
  }

  /** Returns the fault that ended the inbound sequence, if any. */
  Optional<Throwable> completionError() {
    return buffer.completionError();
  }

  /**
   * Writes a control frame to the server.
   *
   * @param request The ack or nack frame
   * @throws IllegalStateException if the call has not been opened or was closed
   */
  void writeControl(ReadReq request) {
    synchronized (writeLock) {
      ClientCallStreamObserver<ReadReq> call = requestStream;
      if (call == null) {
        throw new IllegalStateException("Subscription call has not been established.");
      }
      if (closed.get()) {
        throw new IllegalStateException("Subscription call is closed.");
      }
      call.onNext(request);
    }
  }

  /**
   * Ends the inbound sequence with a {@link CancellationException} but keeps the call open.
   *
   * <p>A consumer blocked in {@link #read} wakes up. Control frames can still be written until
   * {@link #close} is called.
   */
  void stopReading() {
    buffer.abort(new CancellationException("Subscription was cancelled."));
  }

  boolean isClosed() {
    return closed.get();
  }

  /**
   * Cancels the call and ends the inbound sequence with a {@link CancellationException}.
   *
   * <p>Buffered frames are discarded. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    buffer.abort(new CancellationException("Subscription call was closed."));

    ClientCallStreamObserver<ReadReq> call;
    synchronized (writeLock) {
      call = requestStream;
    }
    if (call != null) {
      call.cancel("Subscription closed by client", null);
      logger.debug("Closed subscription call");
    }
  }

  private final class InboundObserver implements ClientResponseObserver<ReadReq, ReadResp> {

    @Override
    public void beforeStart(ClientCallStreamObserver<ReadReq> requestStream) {
      requestStream.disableAutoRequestWithInitial(capacity);
    }

    @Override
    public void onNext(ReadResp response) {
      SubscriptionMessage message;
      try {
        message = translator.translate(response);
      } catch (RuntimeException e) {
        logger.debug("Failed to translate subscription frame", e);
        buffer.complete(e);
        return;
      }

      try {
        buffer.write(message);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        buffer.complete(e);
      }
    }

    @Override
    public void onError(Throwable t) {
      if (closed.get()) {
        return;
      }
      if (GrpcErrorMapping.isNotFound(t)) {
        logger.debug("Subscription group was not found: {}", t.getMessage());
        buffer.completeWith(SubscriptionMessage.notFound());
        return;
      }
      logger.debug("Subscription call failed: {}", t.getMessage());
      buffer.complete(t);
    }

    @Override
    public void onCompleted() {
      logger.debug("Subscription call completed by server");
      buffer.complete(null);
    }
  }
}
