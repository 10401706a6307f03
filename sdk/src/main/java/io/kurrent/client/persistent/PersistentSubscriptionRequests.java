package io.kurrent.client.persistent;

import com.google.protobuf.ByteString;
import io.kurrent.client.model.LogPosition;
import io.kurrent.client.model.SystemStreams;
import io.kurrent.client.protocol.Shared;
import io.kurrent.client.protocol.persistent.CreateReq;
import io.kurrent.client.protocol.persistent.DeleteReq;
import io.kurrent.client.protocol.persistent.GetInfoReq;
import io.kurrent.client.protocol.persistent.ListReq;
import io.kurrent.client.protocol.persistent.ReadReq;
import io.kurrent.client.protocol.persistent.ReplayParkedReq;
import io.kurrent.client.protocol.persistent.UpdateReq;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;

/** Builds the request messages of the persistent subscriptions service. */
final class PersistentSubscriptionRequests {
  private static final Shared.Empty EMPTY = Shared.Empty.getDefaultInstance();
  private static final int CHECKPOINT_INTERVAL_MULTIPLIER = 1;

  private PersistentSubscriptionRequests() {}

  static ReadReq read(String streamName, String groupName, int bufferSize) {
    ReadReq.Options.Builder options =
        ReadReq.Options.newBuilder()
            .setGroupName(groupName)
            .setBufferSize(bufferSize)
            .setUuidOption(ReadReq.Options.UUIDOption.newBuilder().setStructured(EMPTY));
    if (SystemStreams.isAllStream(streamName)) {
      options.setAll(EMPTY);
    } else {
      options.setStreamIdentifier(streamIdentifier(streamName));
    }
    return ReadReq.newBuilder().setOptions(options).build();
  }

  static CreateReq create(
      String streamName,
      String groupName,
      PersistentSubscriptionSettings settings,
      @Nullable PersistentSubscriptionFilter filter) {
    CreateReq.Settings.Builder wireSettings =
        CreateReq.Settings.newBuilder()
            .setResolveLinks(settings.resolveLinkTos())
            .setExtraStatistics(settings.extraStatistics())
            .setMaxRetryCount(settings.maxRetryCount())
            .setMinCheckpointCount(settings.checkPointLowerBound())
            .setMaxCheckpointCount(settings.checkPointUpperBound())
            .setMaxSubscriberCount(settings.maxSubscriberCount())
            .setLiveBufferSize(settings.liveBufferSize())
            .setReadBatchSize(settings.readBatchSize())
            .setHistoryBufferSize(settings.historyBufferSize())
            .setMessageTimeoutMs(settings.messageTimeoutMs())
            .setCheckpointAfterMs(settings.checkPointAfterMs())
            .setNamedConsumerStrategy(toCreateStrategy(settings.consumerStrategy()))
            .setConsumerStrategy(settings.consumerStrategy().getWireName());

    CreateReq.Options.Builder options =
        CreateReq.Options.newBuilder().setGroupName(groupName).setSettings(wireSettings);

    LogPosition start = settings.startFrom();
    if (SystemStreams.isAllStream(streamName)) {
      CreateReq.AllOptions.Builder all = CreateReq.AllOptions.newBuilder();
      if (start.isLatest()) {
        all.setEnd(EMPTY);
      } else if (start.isEarliest()) {
        all.setStart(EMPTY);
      } else {
        all.setPosition(
            CreateReq.Position.newBuilder()
                .setCommitPosition(start.getValue())
                .setPreparePosition(start.getValue()));
      }
      if (filter != null) {
        all.setFilter(toFilterOptions(filter));
      } else {
        all.setNoFilter(EMPTY);
      }
      options.setAll(all);
    } else {
      CreateReq.StreamOptions.Builder stream =
          CreateReq.StreamOptions.newBuilder().setStreamIdentifier(streamIdentifier(streamName));
      if (start.isLatest()) {
        stream.setEnd(EMPTY);
      } else if (start.isEarliest()) {
        stream.setStart(EMPTY);
      } else {
        stream.setRevision(start.getValue());
      }
      options.setStream(stream);
      // Older servers still read the deprecated top-level identifier.
      options.setStreamIdentifier(streamIdentifier(streamName));
    }
    return CreateReq.newBuilder().setOptions(options).build();
  }

  static UpdateReq update(
      String streamName, String groupName, PersistentSubscriptionSettings settings) {
    UpdateReq.Settings.Builder wireSettings =
        UpdateReq.Settings.newBuilder()
            .setResolveLinks(settings.resolveLinkTos())
            .setExtraStatistics(settings.extraStatistics())
            .setMaxRetryCount(settings.maxRetryCount())
            .setMinCheckpointCount(settings.checkPointLowerBound())
            .setMaxCheckpointCount(settings.checkPointUpperBound())
            .setMaxSubscriberCount(settings.maxSubscriberCount())
            .setLiveBufferSize(settings.liveBufferSize())
            .setReadBatchSize(settings.readBatchSize())
            .setHistoryBufferSize(settings.historyBufferSize())
            .setMessageTimeoutMs(settings.messageTimeoutMs())
            .setCheckpointAfterMs(settings.checkPointAfterMs())
            .setNamedConsumerStrategy(toUpdateStrategy(settings.consumerStrategy()));

    UpdateReq.Options.Builder options =
        UpdateReq.Options.newBuilder().setGroupName(groupName).setSettings(wireSettings);

    LogPosition start = settings.startFrom();
    if (SystemStreams.isAllStream(streamName)) {
      UpdateReq.AllOptions.Builder all = UpdateReq.AllOptions.newBuilder();
      if (start.isLatest()) {
        all.setEnd(EMPTY);
      } else if (start.isEarliest()) {
        all.setStart(EMPTY);
      } else {
        all.setPosition(
            UpdateReq.Position.newBuilder()
                .setCommitPosition(start.getValue())
                .setPreparePosition(start.getValue()));
      }
      options.setAll(all);
    } else {
      UpdateReq.StreamOptions.Builder stream =
          UpdateReq.StreamOptions.newBuilder().setStreamIdentifier(streamIdentifier(streamName));
      if (start.isLatest()) {
        stream.setEnd(EMPTY);
      } else if (start.isEarliest()) {
        stream.setStart(EMPTY);
      } else {
        stream.setRevision(start.getValue());
      }
      options.setStream(stream);
      options.setStreamIdentifier(streamIdentifier(streamName));
    }
    return UpdateReq.newBuilder().setOptions(options).build();
  }

  static DeleteReq delete(String streamName, String groupName) {
    DeleteReq.Options.Builder options = DeleteReq.Options.newBuilder().setGroupName(groupName);
    if (SystemStreams.isAllStream(streamName)) {
      options.setAll(EMPTY);
    } else {
      options.setStreamIdentifier(streamIdentifier(streamName));
    }
    return DeleteReq.newBuilder().setOptions(options).build();
  }

  static GetInfoReq getInfo(String streamName, String groupName) {
    GetInfoReq.Options.Builder options = GetInfoReq.Options.newBuilder().setGroupName(groupName);
    if (SystemStreams.isAllStream(streamName)) {
      options.setAll(EMPTY);
    } else {
      options.setStreamIdentifier(streamIdentifier(streamName));
    }
    return GetInfoReq.newBuilder().setOptions(options).build();
  }

  static ReplayParkedReq replayParked(
      String streamName, String groupName, @Nullable Long stopAt) {
    ReplayParkedReq.Options.Builder options =
        ReplayParkedReq.Options.newBuilder().setGroupName(groupName);
    if (SystemStreams.isAllStream(streamName)) {
      options.setAll(EMPTY);
    } else {
      options.setStreamIdentifier(streamIdentifier(streamName));
    }
    if (stopAt != null) {
      options.setStopAt(stopAt);
    } else {
      options.setNoLimit(EMPTY);
    }
    return ReplayParkedReq.newBuilder().setOptions(options).build();
  }

  static ListReq listAll() {
    return ListReq.newBuilder()
        .setOptions(ListReq.Options.newBuilder().setListAllSubscriptions(EMPTY))
        .build();
  }

  static ListReq listFor(String streamName) {
    ListReq.StreamOption.Builder stream = ListReq.StreamOption.newBuilder();
    if (SystemStreams.isAllStream(streamName)) {
      stream.setAll(EMPTY);
    } else {
      stream.setStream(streamIdentifier(streamName));
    }
    return ListReq.newBuilder()
        .setOptions(ListReq.Options.newBuilder().setListForStream(stream))
        .build();
  }

  static Shared.StreamIdentifier streamIdentifier(String streamName) {
    return Shared.StreamIdentifier.newBuilder()
        .setStreamName(ByteString.copyFrom(streamName, StandardCharsets.UTF_8))
        .build();
  }

  private static CreateReq.AllOptions.FilterOptions toFilterOptions(
      PersistentSubscriptionFilter filter) {
    CreateReq.AllOptions.FilterOptions.Expression.Builder expression =
        CreateReq.AllOptions.FilterOptions.Expression.newBuilder()
            .addAllPrefix(filter.getPrefixes());
    filter.getRegex().ifPresent(expression::setRegex);

    CreateReq.AllOptions.FilterOptions.Builder options =
        CreateReq.AllOptions.FilterOptions.newBuilder()
            .setMax(filter.getWindowMax())
            .setCheckpointIntervalMultiplier(CHECKPOINT_INTERVAL_MULTIPLIER);
    if (filter.getScope() == PersistentSubscriptionFilter.Scope.STREAM) {
      options.setStreamIdentifier(expression);
    } else {
      options.setEventType(expression);
    }
    return options.build();
  }

  private static CreateReq.ConsumerStrategy toCreateStrategy(ConsumerStrategy strategy) {
    switch (strategy) {
      case DISPATCH_TO_SINGLE:
        return CreateReq.ConsumerStrategy.DispatchToSingle;
      case PINNED:
        return CreateReq.ConsumerStrategy.Pinned;
      default:
        return CreateReq.ConsumerStrategy.RoundRobin;
    }
  }

  private static UpdateReq.ConsumerStrategy toUpdateStrategy(ConsumerStrategy strategy) {
    switch (strategy) {
      case DISPATCH_TO_SINGLE:
        return UpdateReq.ConsumerStrategy.DispatchToSingle;
      case PINNED:
        return UpdateReq.ConsumerStrategy.Pinned;
      default:
        return UpdateReq.ConsumerStrategy.RoundRobin;
    }
  }
}
