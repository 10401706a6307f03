package io.kurrent.client.persistent;

import static org.junit.jupiter.api.Assertions.*;

import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.kurrent.client.KurrentException;
import io.kurrent.client.MockedPersistentSubscriptionsServer;
import io.kurrent.client.persistent.PersistentSubscriptionError.ErrorCode;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

/** Tests for the classification of gRPC failures. */
class GrpcErrorMappingTest {

  @Test
  void testToError_NotFoundStatus() {
    Optional<PersistentSubscriptionError> error =
        GrpcErrorMapping.toError(
            new StatusRuntimeException(Status.NOT_FOUND),
            "orders-1",
            "billing",
            GrpcErrorMapping.SUBSCRIBE_ERRORS);

    assertEquals(ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND, error.get().getCode());
    assertEquals(
        "Subscription group 'billing' on stream 'orders-1' does not exist.",
        error.get().getMessage());
    assertEquals("orders-1", error.get().getStreamName().get());
    assertEquals("billing", error.get().getGroupName().get());
  }

  @Test
  void testToError_ExceptionTrailer() {
    Optional<PersistentSubscriptionError> error =
        GrpcErrorMapping.toError(
            MockedPersistentSubscriptionsServer.statusError(
                Status.FAILED_PRECONDITION, "maximum-subscribers-reached"),
            "orders-1",
            "billing",
            GrpcErrorMapping.SUBSCRIBE_ERRORS);

    assertEquals(ErrorCode.MAXIMUM_SUBSCRIBERS_REACHED, error.get().getCode());
  }

  @Test
  void testToError_TrailersNameTheGroup() {
    Metadata trailers = new Metadata();
    trailers.put(GrpcErrorMapping.EXCEPTION_KEY, "persistent-subscription-exists");
    trailers.put(GrpcErrorMapping.STREAM_NAME_KEY, "orders-2");
    trailers.put(GrpcErrorMapping.GROUP_NAME_KEY, "shipping");

    Optional<PersistentSubscriptionError> error =
        GrpcErrorMapping.toError(
            Status.ALREADY_EXISTS.withDescription("already there").asRuntimeException(trailers),
            "orders-1",
            "billing",
            GrpcErrorMapping.CREATE_ERRORS);

    assertEquals(ErrorCode.PERSISTENT_SUBSCRIPTION_EXISTS, error.get().getCode());
    assertEquals("already there", error.get().getMessage());
    assertEquals("orders-2", error.get().getStreamName().get());
    assertEquals("shipping", error.get().getGroupName().get());
  }

  @Test
  void testToError_CodeOutsideTheAllowedSet() {
    assertFalse(
        GrpcErrorMapping.toError(
                new StatusRuntimeException(Status.NOT_FOUND),
                "orders-1",
                "billing",
                GrpcErrorMapping.CREATE_ERRORS)
            .isPresent());
    assertFalse(
        GrpcErrorMapping.toError(
                new StatusRuntimeException(Status.UNAVAILABLE),
                "orders-1",
                "billing",
                GrpcErrorMapping.SUBSCRIBE_ERRORS)
            .isPresent());
  }

  @Test
  void testToError_UnwrapsCompletionException() {
    Optional<PersistentSubscriptionError> error =
        GrpcErrorMapping.toError(
            new CompletionException(new StatusRuntimeException(Status.PERMISSION_DENIED)),
            "orders-1",
            "billing",
            GrpcErrorMapping.ADMIN_ERRORS);

    assertEquals(ErrorCode.ACCESS_DENIED, error.get().getCode());
    assertEquals("Access denied.", error.get().getMessage());
  }

  @Test
  void testIsNotFound() {
    assertTrue(
        GrpcErrorMapping.isNotFound(
            new PersistentSubscriptionNotFoundException("orders-1", "billing")));
    assertTrue(
        GrpcErrorMapping.isNotFound(
            MockedPersistentSubscriptionsServer.statusError(
                Status.UNKNOWN, GrpcErrorMapping.PERSISTENT_SUBSCRIPTION_DOES_NOT_EXIST)));
    assertFalse(GrpcErrorMapping.isNotFound(new StatusRuntimeException(Status.INTERNAL)));
  }

  @Test
  void testToException() {
    CancellationException cancelled = new CancellationException("stop");
    assertSame(cancelled, GrpcErrorMapping.toException(new CompletionException(cancelled), "x"));

    RuntimeException fromStatus =
        GrpcErrorMapping.toException(new StatusRuntimeException(Status.CANCELLED), "subscribe");
    assertTrue(fromStatus instanceof CancellationException);

    RuntimeException wrapped =
        GrpcErrorMapping.toException(
            new StatusRuntimeException(Status.UNAVAILABLE.withDescription("down")), "subscribe");
    assertTrue(wrapped instanceof KurrentException);
    assertTrue(wrapped.getMessage().startsWith("Failed to subscribe"));
    assertTrue(wrapped.getCause() instanceof StatusRuntimeException);
  }
}
