package io.kurrent.client.persistent;

import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.StreamObserver;
import io.kurrent.client.Result;
import io.kurrent.client.Success;
import io.kurrent.client.model.RecordDecoder;
import io.kurrent.client.model.SystemStreams;
import io.kurrent.client.persistent.PersistentSubscriptionError.ErrorCode;
import io.kurrent.client.protocol.Shared;
import io.kurrent.client.protocol.persistent.CreateResp;
import io.kurrent.client.protocol.persistent.DeleteResp;
import io.kurrent.client.protocol.persistent.GetInfoResp;
import io.kurrent.client.protocol.persistent.ListResp;
import io.kurrent.client.protocol.persistent.PersistentSubscriptionsGrpc.PersistentSubscriptionsStub;
import io.kurrent.client.protocol.persistent.ReplayParkedResp;
import io.kurrent.client.protocol.persistent.SubscriptionInfo;
import io.kurrent.client.protocol.persistent.UpdateResp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistent subscriptions API: subscribing to groups and managing them.
 *
 * <p>Every operation returns a future of a {@link Result}. Expected failures (a missing group,
 * denied access and so on) complete the future with a failed result. Anything else completes it
 * exceptionally with a {@link io.kurrent.client.KurrentException}, or a {@link
 * java.util.concurrent.CancellationException} when the operation was cancelled. Invalid arguments
 * are rejected synchronously.
 *
 * <p>Obtain an instance from {@link io.kurrent.client.KurrentClient#persistentSubscriptions()}.
 */
public class PersistentSubscriptionsClient {
  private static final Logger logger = LoggerFactory.getLogger(PersistentSubscriptionsClient.class);

  /** Default number of records the server sends ahead of acknowledgements. */
  public static final int DEFAULT_BUFFER_SIZE = 10;

  private final Supplier<PersistentSubscriptionsStub> stubs;
  private final Executor executor;
  private final SubscriptionMessageTranslator translator;

  /**
   * Creates a client.
   *
   * @param stubs Supplies a configured stub for each call
   * @param executor Runs confirmation waits and delivery loops
   * @param recordDecoder Decodes record payloads
   */
  public PersistentSubscriptionsClient(
      @Nonnull Supplier<PersistentSubscriptionsStub> stubs,
      @Nonnull Executor executor,
      @Nonnull RecordDecoder recordDecoder) {
    this.stubs = Objects.requireNonNull(stubs, "stubs cannot be null");
    this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    this.translator = new SubscriptionMessageTranslator(recordDecoder);
  }

  // ==================== Subscribe (callback) ====================

  /**
   * Subscribes to a group on a stream and delivers its records to a handler.
   *
   * @param streamName The stream
   * @param groupName The subscription group
   * @param recordHandler Receives each record
   * @return A future of the confirmed subscription, or of the error that prevented it
   */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscription, PersistentSubscriptionError>>
      subscribeToStream(
          @Nonnull String streamName,
          @Nonnull String groupName,
          @Nonnull RecordHandler recordHandler) {
    return subscribeToStream(
        streamName,
        groupName,
        recordHandler,
        SubscriptionDroppedHandler.NONE,
        DEFAULT_BUFFER_SIZE,
        new CompletableFuture<Void>());
  }

  /** Same as {@link #subscribeToStream(String, String, RecordHandler)} with a dropped handler. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscription, PersistentSubscriptionError>>
      subscribeToStream(
          @Nonnull String streamName,
          @Nonnull String groupName,
          @Nonnull RecordHandler recordHandler,
          @Nonnull SubscriptionDroppedHandler droppedHandler) {
    return subscribeToStream(
        streamName,
        groupName,
        recordHandler,
        droppedHandler,
        DEFAULT_BUFFER_SIZE,
        new CompletableFuture<Void>());
  }

  /**
   * Subscribes to a group on a stream and delivers its records to a handler.
   *
   * <p>The returned future completes once the server confirms the subscription. Completing the
   * cancellation token before that fails the future with a {@link
   * java.util.concurrent.CancellationException}; completing it afterwards drops the subscription
   * as {@link SubscriptionDroppedReason#DISPOSED}. Cancelling the returned future also abandons a
   * pending subscription.
   *
   * @param streamName The stream, or {@code $all}
   * @param groupName The subscription group
   * @param recordHandler Receives each record
   * @param droppedHandler Notified once when the subscription is dropped
   * @param bufferSize Number of records the server sends ahead of acknowledgements
   * @param cancellation Completing this future cancels the subscription
   * @return A future of the confirmed subscription, or of the error that prevented it
   * @throws IllegalArgumentException if a name is empty or bufferSize is not positive
   */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscription, PersistentSubscriptionError>>
      subscribeToStream(
          @Nonnull String streamName,
          @Nonnull String groupName,
          @Nonnull RecordHandler recordHandler,
          @Nonnull SubscriptionDroppedHandler droppedHandler,
          int bufferSize,
          @Nonnull CompletableFuture<?> cancellation) {
    requireName(streamName, "streamName");
    requireName(groupName, "groupName");
    requirePositive(bufferSize);
    Objects.requireNonNull(recordHandler, "recordHandler cannot be null");
    Objects.requireNonNull(droppedHandler, "droppedHandler cannot be null");
    Objects.requireNonNull(cancellation, "cancellation cannot be null");

    CompletableFuture<Result<PersistentSubscription, PersistentSubscriptionError>> future =
        new CompletableFuture<>();
    String operation = "subscribe to " + groupName + " on " + streamName;

    PersistentSubscriptionResult result;
    try {
      result = open(streamName, groupName, bufferSize, cancellation, false);
    } catch (RuntimeException e) {
      completeWithFailure(
          future, e, streamName, groupName, GrpcErrorMapping.SUBSCRIBE_ERRORS, operation);
      return future;
    }

    CompletableFuture<PersistentSubscription> confirmed =
        PersistentSubscription.confirm(result, recordHandler, droppedHandler, executor);
    confirmed.whenComplete(
        (subscription, error) -> {
          if (error != null) {
            completeWithFailure(
                future,
                error,
                streamName,
                groupName,
                GrpcErrorMapping.SUBSCRIBE_ERRORS,
                operation);
          } else if (!future.complete(Result.success(subscription))) {
            subscription.close();
          }
        });
    future.whenComplete(
        (ignored, error) -> {
          if (future.isCancelled()) {
            result.close();
          }
        });
    return future;
  }

  /** Subscribes to a group on the all-stream. See {@link #subscribeToStream}. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscription, PersistentSubscriptionError>>
      subscribeToAll(@Nonnull String groupName, @Nonnull RecordHandler recordHandler) {
    return subscribeToStream(SystemStreams.ALL_STREAM, groupName, recordHandler);
  }

  /** Subscribes to a group on the all-stream. See {@link #subscribeToStream}. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscription, PersistentSubscriptionError>>
      subscribeToAll(
          @Nonnull String groupName,
          @Nonnull RecordHandler recordHandler,
          @Nonnull SubscriptionDroppedHandler droppedHandler) {
    return subscribeToStream(SystemStreams.ALL_STREAM, groupName, recordHandler, droppedHandler);
  }

  /** Subscribes to a group on the all-stream. See {@link #subscribeToStream}. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscription, PersistentSubscriptionError>>
      subscribeToAll(
          @Nonnull String groupName,
          @Nonnull RecordHandler recordHandler,
          @Nonnull SubscriptionDroppedHandler droppedHandler,
          int bufferSize,
          @Nonnull CompletableFuture<?> cancellation) {
    return subscribeToStream(
        SystemStreams.ALL_STREAM,
        groupName,
        recordHandler,
        droppedHandler,
        bufferSize,
        cancellation);
  }

  // ==================== Subscribe (raw handle) ====================

  /** Subscribes to a group on a stream, returning a handle to pull messages from. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscriptionResult, PersistentSubscriptionError>>
      subscribeToStream(@Nonnull String streamName, @Nonnull String groupName) {
    return subscribeToStream(
        streamName, groupName, DEFAULT_BUFFER_SIZE, new CompletableFuture<Void>());
  }

  /**
   * Subscribes to a group on a stream, returning a handle to pull messages from.
   *
   * <p>The future completes as soon as the subscribe request was sent. The confirmation, or a
   * {@link SubscriptionMessage.NotFound}, is the first message of the handle.
   *
   * @param streamName The stream, or {@code $all}
   * @param groupName The subscription group
   * @param bufferSize Number of records the server sends ahead of acknowledgements
   * @param cancellation Completing this future cancels the subscription
   * @return A future of the handle, or of the error that prevented it
   * @throws IllegalArgumentException if a name is empty or bufferSize is not positive
   */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscriptionResult, PersistentSubscriptionError>>
      subscribeToStream(
          @Nonnull String streamName,
          @Nonnull String groupName,
          int bufferSize,
          @Nonnull CompletableFuture<?> cancellation) {
    requireName(streamName, "streamName");
    requireName(groupName, "groupName");
    requirePositive(bufferSize);
    Objects.requireNonNull(cancellation, "cancellation cannot be null");

    CompletableFuture<Result<PersistentSubscriptionResult, PersistentSubscriptionError>> future =
        new CompletableFuture<>();
    try {
      PersistentSubscriptionResult result =
          open(streamName, groupName, bufferSize, cancellation, true);
      future.complete(Result.success(result));
    } catch (RuntimeException e) {
      completeWithFailure(
          future,
          e,
          streamName,
          groupName,
          GrpcErrorMapping.SUBSCRIBE_ERRORS,
          "subscribe to " + groupName + " on " + streamName);
    }
    return future;
  }

  /** Subscribes to a group on the all-stream, returning a handle to pull messages from. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscriptionResult, PersistentSubscriptionError>>
      subscribeToAll(@Nonnull String groupName) {
    return subscribeToStream(SystemStreams.ALL_STREAM, groupName);
  }

  /** Subscribes to a group on the all-stream. See {@link #subscribeToStream(String, String)}. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscriptionResult, PersistentSubscriptionError>>
      subscribeToAll(
          @Nonnull String groupName, int bufferSize, @Nonnull CompletableFuture<?> cancellation) {
    return subscribeToStream(SystemStreams.ALL_STREAM, groupName, bufferSize, cancellation);
  }

  private PersistentSubscriptionResult open(
      String streamName,
      String groupName,
      int bufferSize,
      CompletableFuture<?> cancellation,
      boolean releaseCallOnCancel) {
    logger.debug("Subscribing to group {} on {}", groupName, streamName);
    DuplexSubscriptionChannel channel = new DuplexSubscriptionChannel(stubs.get(), translator);
    return PersistentSubscriptionResult.open(
        streamName,
        groupName,
        PersistentSubscriptionRequests.read(streamName, groupName, bufferSize),
        channel,
        CancellationSource.linkedTo(cancellation),
        releaseCallOnCancel);
  }

  // ==================== Management ====================

  /**
   * Creates a subscription group on a stream.
   *
   * @param streamName The stream
   * @param groupName The group to create
   * @param settings The group settings
   * @return A future of the outcome; fails with PERSISTENT_SUBSCRIPTION_EXISTS for a duplicate
   */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> createToStream(
      @Nonnull String streamName,
      @Nonnull String groupName,
      @Nonnull PersistentSubscriptionSettings settings) {
    return create(streamName, groupName, settings, null);
  }

  /** Creates a subscription group on the all-stream. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> createToAll(
      @Nonnull String groupName, @Nonnull PersistentSubscriptionSettings settings) {
    return create(SystemStreams.ALL_STREAM, groupName, settings, null);
  }

  /** Creates a subscription group on the all-stream that only sees records matching a filter. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> createToAll(
      @Nonnull String groupName,
      @Nonnull PersistentSubscriptionFilter filter,
      @Nonnull PersistentSubscriptionSettings settings) {
    Objects.requireNonNull(filter, "filter cannot be null");
    return create(SystemStreams.ALL_STREAM, groupName, settings, filter);
  }

  private CompletableFuture<Result<Success, PersistentSubscriptionError>> create(
      String streamName,
      String groupName,
      PersistentSubscriptionSettings settings,
      @Nullable PersistentSubscriptionFilter filter) {
    requireName(streamName, "streamName");
    requireName(groupName, "groupName");
    Objects.requireNonNull(settings, "settings cannot be null");
    return this.<CreateResp, Success>unary(
        "create " + groupName + " on " + streamName,
        streamName,
        groupName,
        GrpcErrorMapping.CREATE_ERRORS,
        (stub, observer) ->
            stub.create(
                PersistentSubscriptionRequests.create(streamName, groupName, settings, filter),
                observer),
        response -> Success.INSTANCE);
  }

  /** Updates the settings of a subscription group on a stream. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> updateToStream(
      @Nonnull String streamName,
      @Nonnull String groupName,
      @Nonnull PersistentSubscriptionSettings settings) {
    requireName(streamName, "streamName");
    requireName(groupName, "groupName");
    Objects.requireNonNull(settings, "settings cannot be null");
    return this.<UpdateResp, Success>unary(
        "update " + groupName + " on " + streamName,
        streamName,
        groupName,
        GrpcErrorMapping.EXISTING_GROUP_ERRORS,
        (stub, observer) ->
            stub.update(
                PersistentSubscriptionRequests.update(streamName, groupName, settings), observer),
        response -> Success.INSTANCE);
  }

  /** Updates the settings of a subscription group on the all-stream. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> updateToAll(
      @Nonnull String groupName, @Nonnull PersistentSubscriptionSettings settings) {
    return updateToStream(SystemStreams.ALL_STREAM, groupName, settings);
  }

  /** Deletes a subscription group on a stream. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> deleteToStream(
      @Nonnull String streamName, @Nonnull String groupName) {
    requireName(streamName, "streamName");
    requireName(groupName, "groupName");
    return this.<DeleteResp, Success>unary(
        "delete " + groupName + " on " + streamName,
        streamName,
        groupName,
        GrpcErrorMapping.EXISTING_GROUP_ERRORS,
        (stub, observer) ->
            stub.delete(PersistentSubscriptionRequests.delete(streamName, groupName), observer),
        response -> Success.INSTANCE);
  }

  /** Deletes a subscription group on the all-stream. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> deleteToAll(
      @Nonnull String groupName) {
    return deleteToStream(SystemStreams.ALL_STREAM, groupName);
  }

  /** Returns the details of a subscription group on a stream. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscriptionInfo, PersistentSubscriptionError>>
      getInfoToStream(@Nonnull String streamName, @Nonnull String groupName) {
    requireName(streamName, "streamName");
    requireName(groupName, "groupName");
    return this.<GetInfoResp, PersistentSubscriptionInfo>unary(
        "get info of " + groupName + " on " + streamName,
        streamName,
        groupName,
        GrpcErrorMapping.EXISTING_GROUP_ERRORS,
        (stub, observer) ->
            stub.getInfo(PersistentSubscriptionRequests.getInfo(streamName, groupName), observer),
        response -> SubscriptionInfoMapper.toInfo(response.getSubscriptionInfo()));
  }

  /** Returns the details of a subscription group on the all-stream. */
  @Nonnull
  public CompletableFuture<Result<PersistentSubscriptionInfo, PersistentSubscriptionError>>
      getInfoToAll(@Nonnull String groupName) {
    return getInfoToStream(SystemStreams.ALL_STREAM, groupName);
  }

  /** Lists the subscription groups on a stream. */
  @Nonnull
  public CompletableFuture<Result<List<PersistentSubscriptionInfo>, PersistentSubscriptionError>>
      listToStream(@Nonnull String streamName) {
    requireName(streamName, "streamName");
    return list(
        "list groups on " + streamName,
        streamName,
        (stub, observer) ->
            stub.list(PersistentSubscriptionRequests.listFor(streamName), observer));
  }

  /** Lists the subscription groups on the all-stream. */
  @Nonnull
  public CompletableFuture<Result<List<PersistentSubscriptionInfo>, PersistentSubscriptionError>>
      listToAll() {
    return listToStream(SystemStreams.ALL_STREAM);
  }

  /** Lists every subscription group on the server. */
  @Nonnull
  public CompletableFuture<Result<List<PersistentSubscriptionInfo>, PersistentSubscriptionError>>
      listAll() {
    return list(
        "list all groups",
        null,
        (stub, observer) -> stub.list(PersistentSubscriptionRequests.listAll(), observer));
  }

  private CompletableFuture<Result<List<PersistentSubscriptionInfo>, PersistentSubscriptionError>>
      list(
          String operation,
          @Nullable String streamName,
          BiConsumer<PersistentSubscriptionsStub, StreamObserver<ListResp>> call) {
    return unary(
        operation,
        streamName,
        null,
        GrpcErrorMapping.EXISTING_GROUP_ERRORS,
        call,
        response -> {
          List<PersistentSubscriptionInfo> infos =
              new ArrayList<>(response.getSubscriptionsCount());
          for (SubscriptionInfo info : response.getSubscriptionsList()) {
            infos.add(SubscriptionInfoMapper.toInfo(info));
          }
          return infos;
        });
  }

  /**
   * Moves the parked messages of a group on a stream back into the group.
   *
   * @param streamName The stream
   * @param groupName The group
   * @param stopAt Replay at most this many messages, or null for all of them
   * @return A future of the outcome
   */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>>
      replayParkedMessagesToStream(
          @Nonnull String streamName, @Nonnull String groupName, @Nullable Long stopAt) {
    requireName(streamName, "streamName");
    requireName(groupName, "groupName");
    if (stopAt != null && stopAt < 0) {
      throw new IllegalArgumentException("stopAt cannot be negative");
    }
    return this.<ReplayParkedResp, Success>unary(
        "replay parked messages of " + groupName + " on " + streamName,
        streamName,
        groupName,
        GrpcErrorMapping.EXISTING_GROUP_ERRORS,
        (stub, observer) ->
            stub.replayParked(
                PersistentSubscriptionRequests.replayParked(streamName, groupName, stopAt),
                observer),
        response -> Success.INSTANCE);
  }

  /** Moves all parked messages of a group on a stream back into the group. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>>
      replayParkedMessagesToStream(@Nonnull String streamName, @Nonnull String groupName) {
    return replayParkedMessagesToStream(streamName, groupName, null);
  }

  /** Moves the parked messages of a group on the all-stream back into the group. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> replayParkedMessagesToAll(
      @Nonnull String groupName, @Nullable Long stopAt) {
    return replayParkedMessagesToStream(SystemStreams.ALL_STREAM, groupName, stopAt);
  }

  /** Moves all parked messages of a group on the all-stream back into the group. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> replayParkedMessagesToAll(
      @Nonnull String groupName) {
    return replayParkedMessagesToStream(SystemStreams.ALL_STREAM, groupName, null);
  }

  /** Restarts the persistent subscriptions subsystem of the server. */
  @Nonnull
  public CompletableFuture<Result<Success, PersistentSubscriptionError>> restartSubsystem() {
    return this.<Shared.Empty, Success>unary(
        "restart the persistent subscriptions subsystem",
        null,
        null,
        GrpcErrorMapping.ADMIN_ERRORS,
        (stub, observer) ->
            stub.restartSubsystem(Shared.Empty.getDefaultInstance(), observer),
        response -> Success.INSTANCE);
  }

  // ==================== Helpers ====================

  private <Resp, T> CompletableFuture<Result<T, PersistentSubscriptionError>> unary(
      String operation,
      @Nullable String streamName,
      @Nullable String groupName,
      Set<ErrorCode> allowed,
      BiConsumer<PersistentSubscriptionsStub, StreamObserver<Resp>> call,
      Function<Resp, T> mapper) {
    CompletableFuture<Result<T, PersistentSubscriptionError>> future = new CompletableFuture<>();
    logger.debug("Starting to {}", operation);
    try {
      call.accept(
          stubs.get(),
          new UnaryObserver<>(future, operation, streamName, groupName, allowed, mapper));
    } catch (RuntimeException e) {
      completeWithFailure(future, e, streamName, groupName, allowed, operation);
    }
    return future;
  }

  private static <T> void completeWithFailure(
      CompletableFuture<Result<T, PersistentSubscriptionError>> future,
      Throwable error,
      @Nullable String streamName,
      @Nullable String groupName,
      Set<ErrorCode> allowed,
      String operation) {
    Optional<PersistentSubscriptionError> expected =
        GrpcErrorMapping.toError(error, streamName, groupName, allowed);
    if (expected.isPresent()) {
      logger.debug("Failed to {}: {}", operation, expected.get());
      future.complete(Result.failure(expected.get()));
    } else {
      RuntimeException unexpected = GrpcErrorMapping.toException(error, operation);
      logger.debug("Failed to {}", operation, unexpected);
      future.completeExceptionally(unexpected);
    }
  }

  private static void requireName(String name, String parameter) {
    Objects.requireNonNull(name, parameter + " cannot be null");
    if (name.isEmpty()) {
      throw new IllegalArgumentException(parameter + " cannot be empty");
    }
  }

  private static void requirePositive(int bufferSize) {
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be positive");
    }
  }

  /** Completes a future from a unary call; cancelling the future cancels the call. */
  private static final class UnaryObserver<Req, Resp, T>
      implements ClientResponseObserver<Req, Resp> {
    private final CompletableFuture<Result<T, PersistentSubscriptionError>> future;
    private final String operation;
    @Nullable private final String streamName;
    @Nullable private final String groupName;
    private final Set<ErrorCode> allowed;
    private final Function<Resp, T> mapper;
    @Nullable private Resp response;

    UnaryObserver(
        CompletableFuture<Result<T, PersistentSubscriptionError>> future,
        String operation,
        @Nullable String streamName,
        @Nullable String groupName,
        Set<ErrorCode> allowed,
        Function<Resp, T> mapper) {
      this.future = future;
      this.operation = operation;
      this.streamName = streamName;
      this.groupName = groupName;
      this.allowed = allowed;
      this.mapper = mapper;
    }

    @Override
    public void beforeStart(ClientCallStreamObserver<Req> requestStream) {
      future.whenComplete(
          (ignored, error) -> {
            if (future.isCancelled()) {
              requestStream.cancel("Cancelled by caller", null);
            }
          });
    }

    @Override
    public void onNext(Resp value) {
      this.response = value;
    }

    @Override
    public void onError(Throwable t) {
      completeWithFailure(future, t, streamName, groupName, allowed, operation);
    }

    @Override
    public void onCompleted() {
      if (response == null) {
        future.completeExceptionally(
            new IllegalStateException("No response received to " + operation));
        return;
      }
      try {
        future.complete(Result.success(mapper.apply(response)));
      } catch (RuntimeException e) {
        completeWithFailure(future, e, streamName, groupName, allowed, operation);
      }
    }
  }
}
