package io.kurrent.client.persistent;

import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

/**
 * Writes ack and nack frames for one subscription call.
 *
 * <p>No retry and no buffering: a failed write is thrown to the caller.
 */
final class AcknowledgementGateway {

  /** Largest number of ids the server accepts in one ack or nack. */
  static final int MAX_ACK_BATCH_SIZE = 2000;

  private final DuplexSubscriptionChannel channel;

  AcknowledgementGateway(DuplexSubscriptionChannel channel) {
    this.channel = Objects.requireNonNull(channel, "channel cannot be null");
  }

  /**
   * Acknowledges records.
   *
   * @param ids The ids of the records, at most {@value #MAX_ACK_BATCH_SIZE}
   * @throws IllegalArgumentException if there are too many ids
   * @throws IllegalStateException if the call is not open
   */
  void ack(Collection<UUID> ids) {
    checkBatchSize(ids);
    channel.writeControl(SubscriptionMessageTranslator.ackRequest(ids));
  }

  /**
   * Negatively acknowledges records.
   *
   * @param action What the server should do with the records
   * @param reason Free text reason
   * @param ids The ids of the records, at most {@value #MAX_ACK_BATCH_SIZE}
   * @throws IllegalArgumentException if there are too many ids
   * @throws IllegalStateException if the call is not open
   */
  void nack(NackAction action, String reason, Collection<UUID> ids) {
    Objects.requireNonNull(action, "action cannot be null");
    Objects.requireNonNull(reason, "reason cannot be null");
    checkBatchSize(ids);
    channel.writeControl(SubscriptionMessageTranslator.nackRequest(action, reason, ids));
  }

  private static void checkBatchSize(Collection<UUID> ids) {
    Objects.requireNonNull(ids, "ids cannot be null");
    if (ids.size() > MAX_ACK_BATCH_SIZE) {
      throw new IllegalArgumentException(
          "The number of eventIds exceeds the maximum length of " + MAX_ACK_BATCH_SIZE + ".");
    }
  }
}
