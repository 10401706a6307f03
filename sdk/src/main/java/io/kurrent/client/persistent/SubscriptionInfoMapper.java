package io.kurrent.client.persistent;

import io.kurrent.client.model.LogPosition;
import io.kurrent.client.protocol.persistent.SubscriptionInfo;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Maps {@link SubscriptionInfo} frames to {@link PersistentSubscriptionInfo}. */
final class SubscriptionInfoMapper {
  private static final String END_OF_STREAM = "-1";
  private static final String END_OF_ALL = "C:-1/P:-1";

  private SubscriptionInfoMapper() {}

  static PersistentSubscriptionInfo toInfo(SubscriptionInfo info) {
    List<PersistentSubscriptionInfo.ConnectionInfo> connections =
        new ArrayList<>(info.getConnectionsCount());
    for (SubscriptionInfo.ConnectionInfo connection : info.getConnectionsList()) {
      connections.add(toConnectionInfo(connection));
    }

    PersistentSubscriptionSettings.PersistentSubscriptionSettingsBuilder settings =
        PersistentSubscriptionSettings.builder()
            .setResolveLinkTos(info.getResolveLinkTos())
            .setExtraStatistics(info.getExtraStatistics())
            .setMessageTimeoutMs(info.getMessageTimeoutMilliseconds())
            .setMaxRetryCount(info.getMaxRetryCount())
            .setCheckPointAfterMs(info.getCheckPointAfterMilliseconds())
            .setMaxSubscriberCount(info.getMaxSubscriberCount())
            .setConsumerStrategy(
                ConsumerStrategy.fromWireName(info.getNamedConsumerStrategy())
                    .orElse(ConsumerStrategy.ROUND_ROBIN));
    if (info.getLiveBufferSize() > 0) {
      settings.setLiveBufferSize(info.getLiveBufferSize());
    }
    if (info.getReadBatchSize() > 0) {
      settings.setReadBatchSize(info.getReadBatchSize());
    }
    if (info.getBufferSize() > 0) {
      settings.setHistoryBufferSize(info.getBufferSize());
    }
    // Bounds the server reports inconsistently keep their defaults.
    if (info.getMaxCheckPointCount() > 0
        && info.getMinCheckPointCount() >= 0
        && info.getMinCheckPointCount() <= info.getMaxCheckPointCount()) {
      settings.setCheckPointLowerBound(info.getMinCheckPointCount());
      settings.setCheckPointUpperBound(info.getMaxCheckPointCount());
    }
    LogPosition startFrom = parseStartFrom(info.getStartFrom());
    if (!startFrom.isUnset()) {
      settings.setStartFrom(startFrom);
    }

    PersistentSubscriptionInfo.Stats stats =
        new PersistentSubscriptionInfo.Stats(
            info.getAveragePerSecond(),
            info.getTotalItems(),
            info.getCountSinceLastMeasurement(),
            info.getReadBufferCount(),
            info.getLiveBufferCount(),
            info.getRetryBufferCount(),
            info.getTotalInFlightMessages(),
            info.getOutstandingMessagesCount(),
            info.getParkedMessageCount(),
            LogPosition.parse(info.getLastCheckpointedEventPosition()),
            LogPosition.parse(info.getLastKnownEventPosition()));

    return new PersistentSubscriptionInfo(
        info.getEventSource(),
        info.getGroupName(),
        info.getStatus(),
        connections,
        settings.build(),
        stats);
  }

  /** The server reports a group that starts at the end as {@code -1}. */
  static LogPosition parseStartFrom(String startFrom) {
    if (END_OF_STREAM.equals(startFrom) || END_OF_ALL.equals(startFrom)) {
      return LogPosition.latest();
    }
    return LogPosition.parse(startFrom);
  }

  private static PersistentSubscriptionInfo.ConnectionInfo toConnectionInfo(
      SubscriptionInfo.ConnectionInfo connection) {
    Map<String, Long> measurements = new LinkedHashMap<>();
    for (SubscriptionInfo.Measurement measurement : connection.getObservedMeasurementsList()) {
      measurements.put(measurement.getKey(), measurement.getValue());
    }
    return new PersistentSubscriptionInfo.ConnectionInfo(
        connection.getFrom(),
        connection.getUsername(),
        connection.getAverageItemsPerSecond(),
        connection.getTotalItems(),
        connection.getCountSinceLastMeasurement(),
        connection.getAvailableSlots(),
        connection.getInFlightMessages(),
        connection.getConnectionName(),
        measurements);
  }
}
