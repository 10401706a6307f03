package io.kurrent.client.persistent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.StreamObserver;
import io.kurrent.client.BaseKurrentClientTest;
import io.kurrent.client.KurrentException;
import io.kurrent.client.MockedPersistentSubscriptionsServer;
import io.kurrent.client.Result;
import io.kurrent.client.Success;
import io.kurrent.client.model.LogPosition;
import io.kurrent.client.protocol.Shared;
import io.kurrent.client.protocol.persistent.CreateReq;
import io.kurrent.client.protocol.persistent.CreateResp;
import io.kurrent.client.protocol.persistent.DeleteReq;
import io.kurrent.client.protocol.persistent.DeleteResp;
import io.kurrent.client.protocol.persistent.GetInfoReq;
import io.kurrent.client.protocol.persistent.GetInfoResp;
import io.kurrent.client.protocol.persistent.ListReq;
import io.kurrent.client.protocol.persistent.ListResp;
import io.kurrent.client.protocol.persistent.ReplayParkedReq;
import io.kurrent.client.protocol.persistent.ReplayParkedResp;
import io.kurrent.client.protocol.persistent.SubscriptionInfo;
import io.kurrent.client.protocol.persistent.UpdateReq;
import io.kurrent.client.protocol.persistent.UpdateResp;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.stubbing.Answer;

/** Tests for the management operations of the persistent subscriptions client. */
public class PersistentSubscriptionsClientTest extends BaseKurrentClientTest {

  @SuppressWarnings("unchecked")
  private static Answer<Void> reply(Object response) {
    return invocation -> {
      StreamObserver<Object> observer = (StreamObserver<Object>) invocation.getArgument(1);
      observer.onNext(response);
      observer.onCompleted();
      return null;
    };
  }

  @SuppressWarnings("unchecked")
  private static Answer<Void> fail(Throwable error) {
    return invocation -> {
      StreamObserver<Object> observer = (StreamObserver<Object>) invocation.getArgument(1);
      observer.onError(error);
      return null;
    };
  }

  private static SubscriptionInfo subscriptionInfo(String eventSource, String group) {
    return SubscriptionInfo.newBuilder()
        .setEventSource(eventSource)
        .setGroupName(group)
        .setStatus("Live")
        .setStartFrom("-1")
        .setResolveLinkTos(true)
        .setMessageTimeoutMilliseconds(10000)
        .setMaxRetryCount(5)
        .setLiveBufferSize(100)
        .setBufferSize(200)
        .setReadBatchSize(10)
        .setCheckPointAfterMilliseconds(1000)
        .setMinCheckPointCount(5)
        .setMaxCheckPointCount(50)
        .setNamedConsumerStrategy("Pinned")
        .setMaxSubscriberCount(3)
        .setParkedMessageCount(7)
        .setLastCheckpointedEventPosition("42")
        .setLastKnownEventPosition("C:120/P:118")
        .addConnections(
            SubscriptionInfo.ConnectionInfo.newBuilder()
                .setFrom("10.0.0.1:4321")
                .setUsername("admin")
                .setConnectionName("billing-worker")
                .setInFlightMessages(2)
                .addObservedMeasurements(
                    SubscriptionInfo.Measurement.newBuilder().setKey("items").setValue(9)))
        .build();
  }

  @Test
  public void testCreateToStreamSendsSettings() throws Exception {
    ArgumentCaptor<CreateReq> request = ArgumentCaptor.forClass(CreateReq.class);
    doAnswer(reply(CreateResp.getDefaultInstance()))
        .when(persistentStub)
        .create(request.capture(), any());

    PersistentSubscriptionSettings settings =
        PersistentSubscriptionSettings.builder()
            .setStartFrom(LogPosition.of(12))
            .setResolveLinkTos(true)
            .setMaxRetryCount(3)
            .setConsumerStrategy(ConsumerStrategy.DISPATCH_TO_SINGLE)
            .build();
    Result<Success, PersistentSubscriptionError> result =
        client
            .persistentSubscriptions()
            .createToStream("orders-1", "billing", settings)
            .get(5, TimeUnit.SECONDS);

    assertTrue(result.isSuccess());
    CreateReq.Options options = request.getValue().getOptions();
    assertEquals("billing", options.getGroupName());
    assertEquals(
        "orders-1", options.getStream().getStreamIdentifier().getStreamName().toStringUtf8());
    assertEquals(12, options.getStream().getRevision());
    assertTrue(options.getSettings().getResolveLinks());
    assertEquals(3, options.getSettings().getMaxRetryCount());
    assertEquals(30000, options.getSettings().getMessageTimeoutMs());
    assertEquals("DispatchToSingle", options.getSettings().getConsumerStrategy());
  }

  @Test
  public void testCreateToAllWithFilter() throws Exception {
    ArgumentCaptor<CreateReq> request = ArgumentCaptor.forClass(CreateReq.class);
    doAnswer(reply(CreateResp.getDefaultInstance()))
        .when(persistentStub)
        .create(request.capture(), any());

    Result<Success, PersistentSubscriptionError> result =
        client
            .persistentSubscriptions()
            .createToAll(
                "audit",
                PersistentSubscriptionFilter.streamPrefix("orders-", "invoices-"),
                PersistentSubscriptionSettings.builder()
                    .setStartFrom(LogPosition.earliest())
                    .build())
            .get(5, TimeUnit.SECONDS);

    assertTrue(result.isSuccess());
    CreateReq.AllOptions all = request.getValue().getOptions().getAll();
    assertTrue(all.hasStart());
    assertTrue(all.hasFilter());
    assertEquals(
        Arrays.asList("orders-", "invoices-"),
        all.getFilter().getStreamIdentifier().getPrefixList());
    assertEquals(PersistentSubscriptionFilter.DEFAULT_WINDOW_MAX, all.getFilter().getMax());
    assertEquals(1, all.getFilter().getCheckpointIntervalMultiplier());
  }

  @Test
  public void testCreateOfExistingGroupIsAnErrorResult() throws Exception {
    doAnswer(
            fail(
                MockedPersistentSubscriptionsServer.statusError(
                    Status.ALREADY_EXISTS, "persistent-subscription-exists")))
        .when(persistentStub)
        .create(any(), any());

    Result<Success, PersistentSubscriptionError> result =
        client
            .persistentSubscriptions()
            .createToStream("orders-1", "billing", PersistentSubscriptionSettings.getDefault())
            .get(5, TimeUnit.SECONDS);

    assertTrue(result.isFailure());
    assertEquals(
        PersistentSubscriptionError.ErrorCode.PERSISTENT_SUBSCRIPTION_EXISTS,
        result.getError().getCode());
    assertEquals("orders-1", result.getError().getStreamName().get());
  }

  @Test
  public void testUnexpectedCreateFailureCompletesExceptionally() {
    doAnswer(fail(new StatusRuntimeException(Status.INTERNAL.withDescription("disk full"))))
        .when(persistentStub)
        .create(any(), any());

    CompletableFuture<Result<Success, PersistentSubscriptionError>> future =
        client
            .persistentSubscriptions()
            .createToStream("orders-1", "billing", PersistentSubscriptionSettings.getDefault());

    ExecutionException exception =
        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    assertTrue(exception.getCause() instanceof KurrentException);
    assertTrue(exception.getCause().getMessage().contains("disk full"));
  }

  @Test
  public void testUpdateOfMissingGroupIsNotFound() throws Exception {
    ArgumentCaptor<UpdateReq> request = ArgumentCaptor.forClass(UpdateReq.class);
    doAnswer(fail(new StatusRuntimeException(Status.NOT_FOUND)))
        .when(persistentStub)
        .update(request.capture(), any());

    Result<Success, PersistentSubscriptionError> result =
        client
            .persistentSubscriptions()
            .updateToAll("audit", PersistentSubscriptionSettings.getDefault())
            .get(5, TimeUnit.SECONDS);

    assertTrue(result.isFailure());
    assertEquals(
        PersistentSubscriptionError.ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND,
        result.getError().getCode());
    assertTrue(request.getValue().getOptions().getAll().hasEnd());
    assertEquals(
        UpdateReq.ConsumerStrategy.RoundRobin,
        request.getValue().getOptions().getSettings().getNamedConsumerStrategy());
  }

  @Test
  public void testDeleteWithoutPermissionIsAccessDenied() throws Exception {
    ArgumentCaptor<DeleteReq> request = ArgumentCaptor.forClass(DeleteReq.class);
    doAnswer(fail(new StatusRuntimeException(Status.PERMISSION_DENIED)))
        .when(persistentStub)
        .delete(request.capture(), any());

    Result<Success, PersistentSubscriptionError> result =
        client
            .persistentSubscriptions()
            .deleteToStream("orders-1", "billing")
            .get(5, TimeUnit.SECONDS);

    assertEquals(PersistentSubscriptionError.ErrorCode.ACCESS_DENIED, result.getError().getCode());
    assertEquals("Access denied.", result.getError().getMessage());
    assertEquals("billing", request.getValue().getOptions().getGroupName());
  }

  @Test
  public void testDeleteToAll() throws Exception {
    ArgumentCaptor<DeleteReq> request = ArgumentCaptor.forClass(DeleteReq.class);
    doAnswer(reply(DeleteResp.getDefaultInstance()))
        .when(persistentStub)
        .delete(request.capture(), any());

    Result<Success, PersistentSubscriptionError> result =
        client.persistentSubscriptions().deleteToAll("audit").get(5, TimeUnit.SECONDS);

    assertSame(Success.INSTANCE, result.getValue());
    assertTrue(request.getValue().getOptions().hasAll());
  }

  @Test
  public void testGetInfoMapsTheServerReport() throws Exception {
    ArgumentCaptor<GetInfoReq> request = ArgumentCaptor.forClass(GetInfoReq.class);
    doAnswer(
            reply(
                GetInfoResp.newBuilder()
                    .setSubscriptionInfo(subscriptionInfo("orders-1", "billing"))
                    .build()))
        .when(persistentStub)
        .getInfo(request.capture(), any());

    Result<PersistentSubscriptionInfo, PersistentSubscriptionError> result =
        client
            .persistentSubscriptions()
            .getInfoToStream("orders-1", "billing")
            .get(5, TimeUnit.SECONDS);

    PersistentSubscriptionInfo info = result.getValue();
    assertEquals("orders-1", info.getEventSource());
    assertEquals("billing", info.getGroupName());
    assertEquals("Live", info.getStatus());

    PersistentSubscriptionSettings settings = info.getSettings();
    assertTrue(settings.startFrom().isLatest());
    assertTrue(settings.resolveLinkTos());
    assertEquals(10000, settings.messageTimeoutMs());
    assertEquals(100, settings.liveBufferSize());
    assertEquals(200, settings.historyBufferSize());
    assertEquals(5, settings.checkPointLowerBound());
    assertEquals(50, settings.checkPointUpperBound());
    assertEquals(ConsumerStrategy.PINNED, settings.consumerStrategy());

    assertEquals(7, info.getStats().getParkedMessageCount());
    assertEquals(LogPosition.of(42), info.getStats().getLastCheckpointedEventPosition());
    assertEquals(LogPosition.of(120), info.getStats().getLastKnownEventPosition());

    assertEquals(1, info.getConnections().size());
    PersistentSubscriptionInfo.ConnectionInfo connection = info.getConnections().get(0);
    assertEquals("billing-worker", connection.getConnectionName());
    assertEquals(Long.valueOf(9), connection.getObservedMeasurements().get("items"));
    assertEquals(
        "orders-1",
        request.getValue().getOptions().getStreamIdentifier().getStreamName().toStringUtf8());
  }

  @Test
  public void testListAllReturnsEveryGroup() throws Exception {
    ArgumentCaptor<ListReq> request = ArgumentCaptor.forClass(ListReq.class);
    doAnswer(
            reply(
                ListResp.newBuilder()
                    .addSubscriptions(subscriptionInfo("orders-1", "billing"))
                    .addSubscriptions(subscriptionInfo("$all", "audit"))
                    .build()))
        .when(persistentStub)
        .list(request.capture(), any());

    Result<List<PersistentSubscriptionInfo>, PersistentSubscriptionError> result =
        client.persistentSubscriptions().listAll().get(5, TimeUnit.SECONDS);

    assertEquals(2, result.getValue().size());
    assertEquals("audit", result.getValue().get(1).getGroupName());
    assertTrue(request.getValue().getOptions().hasListAllSubscriptions());
  }

  @Test
  public void testListToAllTargetsTheAllStream() throws Exception {
    ArgumentCaptor<ListReq> request = ArgumentCaptor.forClass(ListReq.class);
    doAnswer(reply(ListResp.getDefaultInstance()))
        .when(persistentStub)
        .list(request.capture(), any());

    Result<List<PersistentSubscriptionInfo>, PersistentSubscriptionError> result =
        client.persistentSubscriptions().listToAll().get(5, TimeUnit.SECONDS);

    assertTrue(result.getValue().isEmpty());
    assertTrue(request.getValue().getOptions().getListForStream().hasAll());
  }

  @Test
  public void testReplayParkedMessagesHonorsStopAt() throws Exception {
    ArgumentCaptor<ReplayParkedReq> request = ArgumentCaptor.forClass(ReplayParkedReq.class);
    doAnswer(reply(ReplayParkedResp.getDefaultInstance()))
        .when(persistentStub)
        .replayParked(request.capture(), any());

    client
        .persistentSubscriptions()
        .replayParkedMessagesToStream("orders-1", "billing", 25L)
        .get(5, TimeUnit.SECONDS);
    client.persistentSubscriptions().replayParkedMessagesToAll("audit").get(5, TimeUnit.SECONDS);

    List<ReplayParkedReq> requests = request.getAllValues();
    assertEquals(25, requests.get(0).getOptions().getStopAt());
    assertTrue(requests.get(1).getOptions().hasNoLimit());
    assertTrue(requests.get(1).getOptions().hasAll());
  }

  @Test
  public void testReplayParkedMessagesRejectsNegativeStopAt() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            client
                .persistentSubscriptions()
                .replayParkedMessagesToStream("orders-1", "billing", -1L));
    verify(persistentStub, never()).replayParked(any(), any());
  }

  @Test
  public void testRestartSubsystem() throws Exception {
    doAnswer(reply(Shared.Empty.getDefaultInstance()))
        .when(persistentStub)
        .restartSubsystem(any(), any());

    Result<Success, PersistentSubscriptionError> result =
        client.persistentSubscriptions().restartSubsystem().get(5, TimeUnit.SECONDS);

    assertTrue(result.isSuccess());
  }

  @Test
  public void testRestartSubsystemWithoutCredentialsIsNotAuthenticated() throws Exception {
    doAnswer(fail(new StatusRuntimeException(Status.UNAUTHENTICATED)))
        .when(persistentStub)
        .restartSubsystem(any(), any());

    Result<Success, PersistentSubscriptionError> result =
        client.persistentSubscriptions().restartSubsystem().get(5, TimeUnit.SECONDS);

    assertEquals(
        PersistentSubscriptionError.ErrorCode.NOT_AUTHENTICATED, result.getError().getCode());
  }

  @Test
  public void testCancellingTheFutureCancelsTheCall() {
    @SuppressWarnings("unchecked")
    ClientCallStreamObserver<CreateReq> call = mock(ClientCallStreamObserver.class);
    doAnswer(
            invocation -> {
              @SuppressWarnings("unchecked")
              ClientResponseObserver<CreateReq, CreateResp> observer =
                  (ClientResponseObserver<CreateReq, CreateResp>) invocation.getArgument(1);
              observer.beforeStart(call);
              return null;
            })
        .when(persistentStub)
        .create(any(), any());

    CompletableFuture<Result<Success, PersistentSubscriptionError>> future =
        client
            .persistentSubscriptions()
            .createToStream("orders-1", "billing", PersistentSubscriptionSettings.getDefault());
    future.cancel(true);

    verify(call).cancel(anyString(), any());
  }

  @Test
  public void testEmptyNamesAreRejectedSynchronously() {
    PersistentSubscriptionsClient subscriptions = client.persistentSubscriptions();

    assertThrows(IllegalArgumentException.class, () -> subscriptions.deleteToStream("", "g"));
    assertThrows(IllegalArgumentException.class, () -> subscriptions.getInfoToAll(""));
    assertThrows(
        NullPointerException.class,
        () -> subscriptions.createToStream("orders-1", "billing", null));
    verifyNoInteractions(persistentStub);
  }
}
