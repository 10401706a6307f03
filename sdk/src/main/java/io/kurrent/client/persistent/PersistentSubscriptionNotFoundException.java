package io.kurrent.client.persistent;

import io.kurrent.client.KurrentException;

/**
 * Raised when the server reports that a persistent subscription group does not exist.
 *
 * <p>Before confirmation this surfaces as a failed result. After confirmation it is the exception
 * passed to the dropped handler.
 */
public class PersistentSubscriptionNotFoundException extends KurrentException {
  private final String streamName;
  private final String groupName;

  public PersistentSubscriptionNotFoundException(String streamName, String groupName) {
    super("Subscription group '" + groupName + "' on stream '" + streamName + "' does not exist.");
    this.streamName = streamName;
    this.groupName = groupName;
  }

  public String getStreamName() {
    return streamName;
  }

  public String getGroupName() {
    return groupName;
  }
}
