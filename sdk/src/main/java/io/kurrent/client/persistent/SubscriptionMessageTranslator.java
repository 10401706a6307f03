package io.kurrent.client.persistent;

import io.kurrent.client.model.Link;
import io.kurrent.client.model.LogPosition;
import io.kurrent.client.model.Record;
import io.kurrent.client.model.RecordDecoder;
import io.kurrent.client.model.SystemMetadata;
import io.kurrent.client.protocol.Shared;
import io.kurrent.client.protocol.persistent.ReadReq;
import io.kurrent.client.protocol.persistent.ReadResp;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Maps between the wire frames of the {@code Read} call and {@link SubscriptionMessage}s.
 *
 * <p>Stateless apart from the record decoder, which must itself be thread-safe.
 */
final class SubscriptionMessageTranslator {
  private static final long TICKS_PER_SECOND = 10_000_000L;
  private static final long NANOS_PER_TICK = 100L;

  private final RecordDecoder decoder;

  SubscriptionMessageTranslator(RecordDecoder decoder) {
    this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
  }

  /**
   * Translates an inbound frame.
   *
   * @param response The frame received from the server
   * @return The translated message; {@link SubscriptionMessage.Unknown} for unrecognized frames
   * @throws io.kurrent.client.model.RecordDecodingException if a record payload cannot be decoded
   */
  SubscriptionMessage translate(ReadResp response) {
    switch (response.getContentCase()) {
      case SUBSCRIPTION_CONFIRMATION:
        return SubscriptionMessage.confirmation(
            response.getSubscriptionConfirmation().getSubscriptionId());
      case EVENT:
        ReadResp.ReadEvent readEvent = response.getEvent();
        Integer retryCount =
            readEvent.getCountCase() == ReadResp.ReadEvent.CountCase.RETRY_COUNT
                ? readEvent.getRetryCount()
                : null;
        return SubscriptionMessage.event(toRecord(readEvent), retryCount);
      default:
        return SubscriptionMessage.unknown();
    }
  }

  Record toRecord(ReadResp.ReadEvent readEvent) {
    ReadResp.ReadEvent.RecordedEvent event = readEvent.getEvent();
    Map<String, String> metadata = event.getMetadataMap();
    String stream = event.getStreamIdentifier().getStreamName().toStringUtf8();
    String schemaName = metadata.getOrDefault(SystemMetadata.TYPE, "");
    String contentType =
        metadata.getOrDefault(
            SystemMetadata.CONTENT_TYPE, SystemMetadata.CONTENT_TYPE_OCTET_STREAM);
    byte[] data = event.getData().toByteArray();

    Record.Builder builder =
        Record.builder()
            .setId(toUuid(event.getId()))
            .setStream(stream)
            .setStreamRevision(event.getStreamRevision())
            .setPosition(toPosition(event.getCommitPosition()))
            .setTimestamp(fromTicks(metadata.get(SystemMetadata.CREATED)))
            .setSchemaName(schemaName)
            .setContentType(contentType)
            .setSystemMetadata(metadata)
            .setCustomMetadata(event.getCustomMetadata().toByteArray())
            .setData(data)
            .setValue(decoder.decode(stream, schemaName, contentType, data));

    if (readEvent.hasLink()) {
      ReadResp.ReadEvent.RecordedEvent link = readEvent.getLink();
      builder.setLink(
          new Link(
              link.getMetadataMap().getOrDefault(SystemMetadata.TYPE, ""),
              link.getStreamIdentifier().getStreamName().toStringUtf8(),
              link.getStreamRevision(),
              toPosition(link.getCommitPosition())));
    }
    return builder.build();
  }

  /** Builds an ack frame for the given record ids. */
  static ReadReq ackRequest(Collection<UUID> ids) {
    ReadReq.Ack.Builder ack = ReadReq.Ack.newBuilder();
    for (UUID id : ids) {
      ack.addIds(toProto(id));
    }
    return ReadReq.newBuilder().setAck(ack).build();
  }

  /** Builds a nack frame for the given record ids. */
  static ReadReq nackRequest(NackAction action, String reason, Collection<UUID> ids) {
    ReadReq.Nack.Builder nack =
        ReadReq.Nack.newBuilder().setAction(toProto(action)).setReason(reason);
    for (UUID id : ids) {
      nack.addIds(toProto(id));
    }
    return ReadReq.newBuilder().setNack(nack).build();
  }

  static ReadReq.Nack.Action toProto(NackAction action) {
    switch (action) {
      case PARK:
        return ReadReq.Nack.Action.Park;
      case RETRY:
        return ReadReq.Nack.Action.Retry;
      case SKIP:
        return ReadReq.Nack.Action.Skip;
      case STOP:
        return ReadReq.Nack.Action.Stop;
      default:
        return ReadReq.Nack.Action.Unknown;
    }
  }

  static Shared.UUID toProto(UUID id) {
    return Shared.UUID.newBuilder()
        .setStructured(
            Shared.UUID.Structured.newBuilder()
                .setMostSignificantBits(id.getMostSignificantBits())
                .setLeastSignificantBits(id.getLeastSignificantBits()))
        .build();
  }

  static UUID toUuid(Shared.UUID id) {
    if (id.getValueCase() == Shared.UUID.ValueCase.STRING) {
      return UUID.fromString(id.getString());
    }
    return new UUID(
        id.getStructured().getMostSignificantBits(), id.getStructured().getLeastSignificantBits());
  }

  /** Converts .NET ticks since the Unix epoch to an instant. Missing values map to the epoch. */
  static Instant fromTicks(String ticks) {
    if (ticks == null || ticks.isEmpty()) {
      return Instant.EPOCH;
    }
    long value;
    try {
      value = Long.parseLong(ticks);
    } catch (NumberFormatException e) {
      return Instant.EPOCH;
    }
    long seconds = Math.floorDiv(value, TICKS_PER_SECOND);
    long nanos = Math.floorMod(value, TICKS_PER_SECOND) * NANOS_PER_TICK;
    return Instant.ofEpochSecond(seconds, nanos);
  }

  private static LogPosition toPosition(long commitPosition) {
    // uint64 on the wire; values past Long.MAX_VALUE are not real positions.
    return commitPosition < 0 ? LogPosition.unset() : LogPosition.of(commitPosition);
  }
}
