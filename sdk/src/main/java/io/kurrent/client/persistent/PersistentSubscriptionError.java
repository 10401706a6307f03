package io.kurrent.client.persistent;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * An expected failure of a persistent subscription operation.
 *
 * <p>Returned as the error arm of a {@link io.kurrent.client.Result}.
 */
public final class PersistentSubscriptionError {

  /** The kind of failure. */
  public enum ErrorCode {
    PERSISTENT_SUBSCRIPTION_NOT_FOUND,
    MAXIMUM_SUBSCRIBERS_REACHED,
    PERSISTENT_SUBSCRIPTION_DROPPED,
    ACCESS_DENIED,
    NOT_AUTHENTICATED,
    PERSISTENT_SUBSCRIPTION_EXISTS
  }

  private final ErrorCode code;
  private final String message;
  private final Optional<String> streamName;
  private final Optional<String> groupName;

  public PersistentSubscriptionError(
      ErrorCode code, String message, @Nullable String streamName, @Nullable String groupName) {
    this.code = Objects.requireNonNull(code, "code cannot be null");
    this.message = Objects.requireNonNull(message, "message cannot be null");
    this.streamName = Optional.ofNullable(streamName);
    this.groupName = Optional.ofNullable(groupName);
  }

  static PersistentSubscriptionError notFound(String streamName, String groupName) {
    return new PersistentSubscriptionError(
        ErrorCode.PERSISTENT_SUBSCRIPTION_NOT_FOUND,
        "Subscription group '" + groupName + "' on stream '" + streamName + "' does not exist.",
        streamName,
        groupName);
  }

  public ErrorCode getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public Optional<String> getStreamName() {
    return streamName;
  }

  public Optional<String> getGroupName() {
    return groupName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PersistentSubscriptionError that = (PersistentSubscriptionError) o;
    return code == that.code
        && message.equals(that.message)
        && streamName.equals(that.streamName)
        && groupName.equals(that.groupName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, streamName, groupName);
  }

  @Override
  public String toString() {
    return code + ": " + message;
  }
}
