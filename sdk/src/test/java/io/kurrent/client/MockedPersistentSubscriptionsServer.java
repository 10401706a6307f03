package io.kurrent.client;

import com.google.protobuf.ByteString;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.kurrent.client.protocol.Shared;
import io.kurrent.client.protocol.persistent.ReadReq;
import io.kurrent.client.protocol.persistent.ReadResp;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * MockedPersistentSubscriptionsServer simulates the server side of the {@code Read} call.
 *
 * <p>Tests script the frames the server sends. Frames are only delivered while the client has
 * granted credits through {@code disableAutoRequestWithInitial} and {@code request}, the same way
 * a real call honors manual flow control. Errors and completion are delivered once every frame
 * scripted before them has been delivered.
 */
public class MockedPersistentSubscriptionsServer {
  private static class ScriptedAction {
    final ReadResp frame;
    final Throwable error;
    final boolean complete;

    ScriptedAction(ReadResp frame, Throwable error, boolean complete) {
      this.frame = frame;
      this.error = error;
      this.complete = complete;
    }

    boolean isTerminal() {
      return frame == null;
    }
  }

  private final ExecutorService executorService;
  private final List<ReadReq> capturedMessages;
  private final LinkedList<ScriptedAction> script = new LinkedList<>();
  private final CountDownLatch cancelled = new CountDownLatch(1);

  private ClientResponseObserver<ReadReq, ReadResp> responder;
  private int credits = 0;
  private int deliveredFrames = 0;
  private boolean serverRunning = false;
  private volatile String cancelMessage;

  private final ClientCallStreamObserver<ReadReq> messageReceiver =
      new ClientCallStreamObserver<ReadReq>() {
        @Override
        public void onNext(ReadReq request) {
          synchronized (MockedPersistentSubscriptionsServer.this) {
            capturedMessages.add(request);
            MockedPersistentSubscriptionsServer.this.notifyAll();
          }
        }

        @Override
        public void onError(Throwable t) {}

        @Override
        public void onCompleted() {}

        @Override
        public boolean isReady() {
          return true;
        }

        @Override
        public void setOnReadyHandler(Runnable onReadyHandler) {}

        @Override
        public void disableAutoInboundFlowControl() {}

        @Override
        public void disableAutoRequestWithInitial(int request) {
          grantCredits(request);
        }

        @Override
        public void request(int count) {
          grantCredits(count);
        }

        @Override
        public void setMessageCompression(boolean enable) {}

        @Override
        public void cancel(String message, Throwable cause) {
          onClientCancel(message, cause);
        }
      };

  public MockedPersistentSubscriptionsServer() {
    this.executorService = Executors.newSingleThreadExecutor();
    this.capturedMessages = Collections.synchronizedList(new ArrayList<>());
  }

  /** Initialize the mocked server with the client's response observer and start delivering. */
  public void initialize(ClientResponseObserver<ReadReq, ReadResp> responder) {
    synchronized (this) {
      this.responder = responder;
      startServerThread();
    }
  }

  // ==================== Scripting ====================

  /** Inject a subscription confirmation frame. */
  public void injectConfirmation(String subscriptionId) {
    injectFrame(confirmationFrame(subscriptionId));
  }

  /** Inject a record frame. */
  public void injectEvent(UUID id, String stream, long revision, String type) {
    injectFrame(eventFrame(id, stream, revision, type, null));
  }

  /** Inject any frame. */
  public synchronized void injectFrame(ReadResp frame) {
    script.addLast(new ScriptedAction(frame, null, false));
    notifyAll();
  }

  /** Inject a failure that ends the call. */
  public synchronized void injectError(Throwable error) {
    script.addLast(new ScriptedAction(null, error, false));
    notifyAll();
  }

  /** Inject a normal end of the call. */
  public synchronized void injectCompletion() {
    script.addLast(new ScriptedAction(null, null, true));
    notifyAll();
  }

  // ==================== Frames ====================

  public static ReadResp confirmationFrame(String subscriptionId) {
    return ReadResp.newBuilder()
        .setSubscriptionConfirmation(
            ReadResp.SubscriptionConfirmation.newBuilder().setSubscriptionId(subscriptionId))
        .build();
  }

  public static ReadResp eventFrame(
      UUID id, String stream, long revision, String type, Integer retryCount) {
    ReadResp.ReadEvent.Builder readEvent =
        ReadResp.ReadEvent.newBuilder()
            .setEvent(recordedEvent(id, stream, revision, type))
            .setCommitPosition(1000 + revision);
    if (retryCount != null) {
      readEvent.setRetryCount(retryCount);
    } else {
      readEvent.setNoRetryCount(Shared.Empty.getDefaultInstance());
    }
    return ReadResp.newBuilder().setEvent(readEvent).build();
  }

  public static ReadResp.ReadEvent.RecordedEvent recordedEvent(
      UUID id, String stream, long revision, String type) {
    return ReadResp.ReadEvent.RecordedEvent.newBuilder()
        .setId(
            Shared.UUID.newBuilder()
                .setStructured(
                    Shared.UUID.Structured.newBuilder()
                        .setMostSignificantBits(id.getMostSignificantBits())
                        .setLeastSignificantBits(id.getLeastSignificantBits())))
        .setStreamIdentifier(
            Shared.StreamIdentifier.newBuilder()
                .setStreamName(ByteString.copyFrom(stream, StandardCharsets.UTF_8)))
        .setStreamRevision(revision)
        .setCommitPosition(1000 + revision)
        .setPreparePosition(1000 + revision)
        .putMetadata("type", type)
        .putMetadata("content-type", "application/json")
        .putMetadata("created", "16094592000000000")
        .setData(ByteString.copyFromUtf8("{\"revision\":" + revision + "}"))
        .build();
  }

  /** A status failure carrying the server's {@code exception} trailer. */
  public static StatusRuntimeException statusError(Status status, String exceptionTrailer) {
    Metadata trailers = new Metadata();
    if (exceptionTrailer != null) {
      trailers.put(
          Metadata.Key.of("exception", Metadata.ASCII_STRING_MARSHALLER), exceptionTrailer);
    }
    return status.asRuntimeException(trailers);
  }

  // ==================== Observation ====================

  /** Get all captured messages sent by the client. */
  public List<ReadReq> getCapturedMessages() {
    synchronized (capturedMessages) {
      return new ArrayList<>(capturedMessages);
    }
  }

  /** Wait until the client has sent at least the given number of messages. */
  public synchronized boolean awaitCapturedMessages(int count, long timeoutMs)
      throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeoutMs;
    while (capturedMessages.size() < count) {
      long remaining = deadline - System.currentTimeMillis();
      if (remaining <= 0) {
        return false;
      }
      wait(remaining);
    }
    return true;
  }

  /** Number of frames handed to the client so far. */
  public synchronized int getDeliveredFrameCount() {
    return deliveredFrames;
  }

  /** Wait until the given number of frames has been handed to the client. */
  public synchronized boolean awaitDeliveredFrames(int count, long timeoutMs)
      throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeoutMs;
    while (deliveredFrames < count) {
      long remaining = deadline - System.currentTimeMillis();
      if (remaining <= 0) {
        return false;
      }
      wait(remaining);
    }
    return true;
  }

  /** Wait until the client cancels the call. */
  public boolean awaitCancelled(long timeoutMs) throws InterruptedException {
    return cancelled.await(timeoutMs, TimeUnit.MILLISECONDS);
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  public String getCancelMessage() {
    return cancelMessage;
  }

  /** Get the message receiver for the client to write to. */
  public ClientCallStreamObserver<ReadReq> getMessageReceiver() {
    return messageReceiver;
  }

  /** Destroy the mocked server and clean up resources. */
  public void destroy() {
    synchronized (this) {
      serverRunning = false;
      notifyAll();
    }
    executorService.shutdownNow();
    try {
      executorService.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  // ==================== Delivery ====================

  private synchronized void grantCredits(int count) {
    credits += count;
    notifyAll();
  }

  private void onClientCancel(String message, Throwable cause) {
    synchronized (this) {
      cancelMessage = message;
      script.clear();
      // A cancelled call reports CANCELLED to its response observer.
      script.addFirst(
          new ScriptedAction(
              null,
              Status.CANCELLED.withDescription(message).withCause(cause).asException(),
              false));
      notifyAll();
    }
    cancelled.countDown();
  }

  private boolean canDeliver() {
    if (script.isEmpty()) {
      return false;
    }
    return script.peekFirst().isTerminal() || credits > 0;
  }

  private void startServerThread() {
    if (serverRunning) {
      return;
    }
    serverRunning = true;

    executorService.submit(
        () -> {
          try {
            while (true) {
              ScriptedAction action;
              synchronized (this) {
                while (serverRunning && !canDeliver()) {
                  wait(100);
                }
                if (!serverRunning) {
                  return;
                }
                action = script.removeFirst();
                if (action.isTerminal()) {
                  serverRunning = false;
                } else {
                  credits--;
                }
              }

              deliver(action);

              synchronized (this) {
                if (!action.isTerminal()) {
                  deliveredFrames++;
                }
                notifyAll();
              }
            }
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        });
  }

  private void deliver(ScriptedAction action) {
    if (action.frame != null) {
      responder.onNext(action.frame);
    } else if (action.error != null) {
      responder.onError(action.error);
    } else {
      responder.onCompleted();
    }
  }
}
