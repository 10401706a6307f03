package io.kurrent.client.persistent;

import io.grpc.Metadata;
import io.grpc.Status;
import io.kurrent.client.KurrentException;
import io.kurrent.client.persistent.PersistentSubscriptionError.ErrorCode;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import javax.annotation.Nullable;

/** Classifies gRPC failures into persistent subscription errors. */
final class GrpcErrorMapping {

  static final Metadata.Key<String> EXCEPTION_KEY =
      Metadata.Key.of("exception", Metadata.ASCII_STRING_MARSHALLER);
  static final Metadata.Key<String> STREAM_NAME_KEY =
      Metadata.Key.of("stream-name", Metadata.ASCII_STRING_MARSHALLER);
  static final Metadata.Key<String> GROUP_NAME_KEY =
      Metadata.Key.of("group-name", Metadata.ASCII_STRING_MARSHALLER);

  static final String PERSISTENT_SUBSCRIPTION_DOES_NOT_EXIST =
      "persistent-subscription-does-not-exist";

  /** Errors a subscribe call can report as a result. */
  static final Set<ErrorCode> SUBSCRIBE_ERRORS =
      EnumSet.of(
          ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND,
          ErrorCode.MAXIMUM_SUBSCRIBERS_REACHED,
          ErrorCode.PERSISTENT_SUBSCRIPTION_DROPPED,
          ErrorCode.ACCESS_DENIED,
          ErrorCode.NOT_AUTHENTICATED);

  static final Set<ErrorCode> CREATE_ERRORS =
      EnumSet.of(
          ErrorCode.ACCESS_DENIED,
          ErrorCode.NOT_AUTHENTICATED,
          ErrorCode.PERSISTENT_SUBSCRIPTION_EXISTS);

  static final Set<ErrorCode> EXISTING_GROUP_ERRORS =
      EnumSet.of(
          ErrorCode.ACCESS_DENIED,
          ErrorCode.NOT_AUTHENTICATED,
          ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND);

  static final Set<ErrorCode> ADMIN_ERRORS =
      EnumSet.of(ErrorCode.ACCESS_DENIED, ErrorCode.NOT_AUTHENTICATED);

  private static final Map<String, ErrorCode> EXCEPTION_CODES = new HashMap<>();

  static {
    EXCEPTION_CODES.put(
        PERSISTENT_SUBSCRIPTION_DOES_NOT_EXIST, ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND);
    EXCEPTION_CODES.put("maximum-subscribers-reached", ErrorCode.MAXIMUM_SUBSCRIBERS_REACHED);
    EXCEPTION_CODES.put(
        "persistent-subscription-dropped", ErrorCode.PERSISTENT_SUBSCRIPTION_DROPPED);
    EXCEPTION_CODES.put(
        "persistent-subscription-exists", ErrorCode.PERSISTENT_SUBSCRIPTION_EXISTS);
    EXCEPTION_CODES.put("access-denied", ErrorCode.ACCESS_DENIED);
    EXCEPTION_CODES.put("not-authenticated", ErrorCode.NOT_AUTHENTICATED);
  }

  private GrpcErrorMapping() {}

  /**
   * Classifies a failure.
   *
   * @param error The failure, possibly wrapped in a completion exception
   * @param streamName The stream the operation targeted, used when the server does not name it
   * @param groupName The group the operation targeted, used when the server does not name it
   * @param allowed The codes the operation may report as a result
   * @return The error, or empty if the failure is not an expected one for the operation
   */
  static Optional<PersistentSubscriptionError> toError(
      Throwable error,
      @Nullable String streamName,
      @Nullable String groupName,
      Set<ErrorCode> allowed) {
    Throwable cause = unwrap(error);
    Optional<ErrorCode> code = classify(cause);
    if (!code.isPresent() || !allowed.contains(code.get())) {
      return Optional.empty();
    }

    Metadata trailers = Status.trailersFromThrowable(cause);
    String stream = streamName;
    String group = groupName;
    if (trailers != null) {
      if (trailers.containsKey(STREAM_NAME_KEY)) {
        stream = trailers.get(STREAM_NAME_KEY);
      }
      if (trailers.containsKey(GROUP_NAME_KEY)) {
        group = trailers.get(GROUP_NAME_KEY);
      }
    }

    String description = Status.fromThrowable(cause).getDescription();
    String message = description != null ? description : defaultMessage(code.get(), stream, group);
    return Optional.of(new PersistentSubscriptionError(code.get(), message, stream, group));
  }

  /**
   * Returns true if the failure means the subscription group does not exist.
   *
   * @param error The failure
   * @return whether the failure is a not-found condition
   */
  static boolean isNotFound(Throwable error) {
    Optional<ErrorCode> code = classify(unwrap(error));
    return code.isPresent() && code.get() == ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND;
  }

  /**
   * Converts an unexpected failure into the exception a returned future completes with.
   *
   * @param error The failure
   * @param operation What was being attempted, for the message
   * @return A cancellation exception as is, any other exception as a {@link KurrentException}
   */
  static RuntimeException toException(Throwable error, String operation) {
    Throwable cause = unwrap(error);
    if (cause instanceof CancellationException) {
      return (CancellationException) cause;
    }
    if (cause instanceof KurrentException) {
      return (KurrentException) cause;
    }
    if (Status.fromThrowable(cause).getCode() == Status.Code.CANCELLED) {
      CancellationException cancelled = new CancellationException(operation + " was cancelled");
      cancelled.initCause(cause);
      return cancelled;
    }
    return new KurrentException("Failed to " + operation + ": " + cause.getMessage(), cause);
  }

  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static Optional<ErrorCode> classify(Throwable error) {
    if (error instanceof PersistentSubscriptionNotFoundException) {
      return Optional.of(ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND);
    }
    Status status = Status.fromThrowable(error);
    switch (status.getCode()) {
      case PERMISSION_DENIED:
        return Optional.of(ErrorCode.ACCESS_DENIED);
      case UNAUTHENTICATED:
        return Optional.of(ErrorCode.NOT_AUTHENTICATED);
      case NOT_FOUND:
        return Optional.of(ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND);
      default:
        break;
    }

    Metadata trailers = Status.trailersFromThrowable(error);
    if (trailers == null) {
      return Optional.empty();
    }
    String exception = trailers.get(EXCEPTION_KEY);
    return Optional.ofNullable(exception == null ? null : EXCEPTION_CODES.get(exception));
  }

  private static String defaultMessage(
      ErrorCode code, @Nullable String streamName, @Nullable String groupName) {
    switch (code) {
      case PERSISTENT_SUBSCRIPTION_NOT_FOUND:
        return "Subscription group '" + groupName + "' on stream '" + streamName
            + "' does not exist.";
      case MAXIMUM_SUBSCRIBERS_REACHED:
        return "Maximum subscriptions reached for group '" + groupName + "'.";
      case PERSISTENT_SUBSCRIPTION_DROPPED:
        return "Subscription group '" + groupName + "' was dropped.";
      case PERSISTENT_SUBSCRIPTION_EXISTS:
        return "Subscription group '" + groupName + "' on stream '" + streamName
            + "' already exists.";
      case ACCESS_DENIED:
        return "Access denied.";
      case NOT_AUTHENTICATED:
        return "Not authenticated.";
      default:
        return code.name();
    }
  }
}
