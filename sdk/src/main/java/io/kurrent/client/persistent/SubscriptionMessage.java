package io.kurrent.client.persistent;

import io.kurrent.client.model.Record;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A frame of a persistent subscription, translated from the wire.
 *
 * <p>The set of kinds is closed: a confirmation, a delivered record, a not-found signal, or an
 * unknown frame that consumers skip.
 */
public abstract class SubscriptionMessage {

  /** The kind of a {@link SubscriptionMessage}. */
  public enum Kind {
    CONFIRMATION,
    EVENT,
    NOT_FOUND,
    UNKNOWN
  }

  private SubscriptionMessage() {}

  public abstract Kind getKind();

  public static Confirmation confirmation(String subscriptionId) {
    return new Confirmation(subscriptionId);
  }

  public static Event event(Record record, @Nullable Integer retryCount) {
    return new Event(record, retryCount);
  }

  public static NotFound notFound() {
    return NotFound.INSTANCE;
  }

  public static Unknown unknown() {
    return Unknown.INSTANCE;
  }

  /** The server accepted the subscription. */
  public static final class Confirmation extends SubscriptionMessage {
    private final String subscriptionId;

    private Confirmation(String subscriptionId) {
      this.subscriptionId = Objects.requireNonNull(subscriptionId, "subscriptionId cannot be null");
    }

    public String getSubscriptionId() {
      return subscriptionId;
    }

    @Override
    public Kind getKind() {
      return Kind.CONFIRMATION;
    }

    @Override
    public String toString() {
      return "Confirmation{" + subscriptionId + "}";
    }
  }

  /** A record delivered to the subscription. */
  public static final class Event extends SubscriptionMessage {
    private final Record record;
    private final Optional<Integer> retryCount;

    private Event(Record record, @Nullable Integer retryCount) {
      this.record = Objects.requireNonNull(record, "record cannot be null");
      this.retryCount = Optional.ofNullable(retryCount);
    }

    public Record getRecord() {
      return record;
    }

    /**
     * Returns how many times the server has retried this record.
     *
     * @return the retry count, or empty when the server did not flag a redelivery
     */
    public Optional<Integer> getRetryCount() {
      return retryCount;
    }

    @Override
    public Kind getKind() {
      return Kind.EVENT;
    }

    @Override
    public String toString() {
      return "Event{" + record + ", retryCount=" + retryCount.orElse(null) + "}";
    }
  }

  /** The subscription group does not exist. */
  public static final class NotFound extends SubscriptionMessage {
    private static final NotFound INSTANCE = new NotFound();

    private NotFound() {}

    @Override
    public Kind getKind() {
      return Kind.NOT_FOUND;
    }

    @Override
    public String toString() {
      return "NotFound";
    }
  }

  /** A frame this client does not recognize. */
  public static final class Unknown extends SubscriptionMessage {
    private static final Unknown INSTANCE = new Unknown();

    private Unknown() {}

    @Override
    public Kind getKind() {
      return Kind.UNKNOWN;
    }

    @Override
    public String toString() {
      return "Unknown";
    }
  }
}
