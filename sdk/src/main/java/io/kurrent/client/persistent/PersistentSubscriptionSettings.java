package io.kurrent.client.persistent;

import io.kurrent.client.model.LogPosition;
import java.util.Objects;

/**
 * Server-side settings of a persistent subscription group.
 *
 * <p>Use the builder to create instances:
 *
 * <pre>{@code
 * PersistentSubscriptionSettings settings = PersistentSubscriptionSettings.builder()
 *     .setStartFrom(LogPosition.earliest())
 *     .setMaxRetryCount(5)
 *     .setConsumerStrategy(ConsumerStrategy.PINNED)
 *     .build();
 * }</pre>
 */
public class PersistentSubscriptionSettings {

  private boolean resolveLinkTos = false;
  private LogPosition startFrom = LogPosition.latest();
  private boolean extraStatistics = false;
  private int messageTimeoutMs = 30000;
  private int maxRetryCount = 10;
  private int liveBufferSize = 500;
  private int readBatchSize = 20;
  private int historyBufferSize = 500;
  private int checkPointAfterMs = 2000;
  private int checkPointLowerBound = 10;
  private int checkPointUpperBound = 1000;
  private int maxSubscriberCount = 0;
  private ConsumerStrategy consumerStrategy = ConsumerStrategy.ROUND_ROBIN;

  private PersistentSubscriptionSettings() {}

  private PersistentSubscriptionSettings(PersistentSubscriptionSettingsBuilder builder) {
    this.resolveLinkTos = builder.resolveLinkTos;
    this.startFrom = builder.startFrom;
    this.extraStatistics = builder.extraStatistics;
    this.messageTimeoutMs = builder.messageTimeoutMs;
    this.maxRetryCount = builder.maxRetryCount;
    this.liveBufferSize = builder.liveBufferSize;
    this.readBatchSize = builder.readBatchSize;
    this.historyBufferSize = builder.historyBufferSize;
    this.checkPointAfterMs = builder.checkPointAfterMs;
    this.checkPointLowerBound = builder.checkPointLowerBound;
    this.checkPointUpperBound = builder.checkPointUpperBound;
    this.maxSubscriberCount = builder.maxSubscriberCount;
    this.consumerStrategy = builder.consumerStrategy;
  }

  /** Whether link events are resolved to the records they point to. */
  public boolean resolveLinkTos() {
    return resolveLinkTos;
  }

  /** Where the group starts reading when it is created. */
  public LogPosition startFrom() {
    return startFrom;
  }

  public boolean extraStatistics() {
    return extraStatistics;
  }

  /** How long the server waits for an ack before retrying a record. */
  public int messageTimeoutMs() {
    return messageTimeoutMs;
  }

  /** How many times a record is retried before it is parked. */
  public int maxRetryCount() {
    return maxRetryCount;
  }

  public int liveBufferSize() {
    return liveBufferSize;
  }

  public int readBatchSize() {
    return readBatchSize;
  }

  public int historyBufferSize() {
    return historyBufferSize;
  }

  public int checkPointAfterMs() {
    return checkPointAfterMs;
  }

  /** Minimum number of acked records before a checkpoint is written. */
  public int checkPointLowerBound() {
    return checkPointLowerBound;
  }

  /** Maximum number of acked records before a checkpoint is forced. */
  public int checkPointUpperBound() {
    return checkPointUpperBound;
  }

  /** Maximum number of consumers in the group; 0 means unbounded. */
  public int maxSubscriberCount() {
    return maxSubscriberCount;
  }

  public ConsumerStrategy consumerStrategy() {
    return consumerStrategy;
  }

  /**
   * Returns the default settings.
   *
   * <p>Default values: start from the end, no link resolution, 30s message timeout, 10 retries,
   * live buffer 500, read batch 20, history buffer 500, checkpoint after 2s between 10 and 1000
   * records, unbounded subscribers, round robin.
   *
   * @return the default settings
   */
  public static PersistentSubscriptionSettings getDefault() {
    return new PersistentSubscriptionSettings();
  }

  public static PersistentSubscriptionSettingsBuilder builder() {
    return new PersistentSubscriptionSettingsBuilder();
  }

  /**
   * Returns a builder initialized with this instance's values.
   *
   * @return a new builder pre-populated with this instance's values
   */
  public PersistentSubscriptionSettingsBuilder toBuilder() {
    return new PersistentSubscriptionSettingsBuilder()
        .setResolveLinkTos(resolveLinkTos)
        .setStartFrom(startFrom)
        .setExtraStatistics(extraStatistics)
        .setMessageTimeoutMs(messageTimeoutMs)
        .setMaxRetryCount(maxRetryCount)
        .setLiveBufferSize(liveBufferSize)
        .setReadBatchSize(readBatchSize)
        .setHistoryBufferSize(historyBufferSize)
        .setCheckPointAfterMs(checkPointAfterMs)
        .setCheckPointLowerBound(checkPointLowerBound)
        .setCheckPointUpperBound(checkPointUpperBound)
        .setMaxSubscriberCount(maxSubscriberCount)
        .setConsumerStrategy(consumerStrategy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PersistentSubscriptionSettings that = (PersistentSubscriptionSettings) o;
    return resolveLinkTos == that.resolveLinkTos
        && extraStatistics == that.extraStatistics
        && messageTimeoutMs == that.messageTimeoutMs
        && maxRetryCount == that.maxRetryCount
        && liveBufferSize == that.liveBufferSize
        && readBatchSize == that.readBatchSize
        && historyBufferSize == that.historyBufferSize
        && checkPointAfterMs == that.checkPointAfterMs
        && checkPointLowerBound == that.checkPointLowerBound
        && checkPointUpperBound == that.checkPointUpperBound
        && maxSubscriberCount == that.maxSubscriberCount
        && startFrom.equals(that.startFrom)
        && consumerStrategy == that.consumerStrategy;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        resolveLinkTos,
        startFrom,
        extraStatistics,
        messageTimeoutMs,
        maxRetryCount,
        liveBufferSize,
        readBatchSize,
        historyBufferSize,
        checkPointAfterMs,
        checkPointLowerBound,
        checkPointUpperBound,
        maxSubscriberCount,
        consumerStrategy);
  }

  /**
   * Builder for creating PersistentSubscriptionSettings instances.
   *
   * @see PersistentSubscriptionSettings
   */
  public static class PersistentSubscriptionSettingsBuilder {
    private PersistentSubscriptionSettings defaults = PersistentSubscriptionSettings.getDefault();

    private boolean resolveLinkTos = defaults.resolveLinkTos();
    private LogPosition startFrom = defaults.startFrom();
    private boolean extraStatistics = defaults.extraStatistics();
    private int messageTimeoutMs = defaults.messageTimeoutMs();
    private int maxRetryCount = defaults.maxRetryCount();
    private int liveBufferSize = defaults.liveBufferSize();
    private int readBatchSize = defaults.readBatchSize();
    private int historyBufferSize = defaults.historyBufferSize();
    private int checkPointAfterMs = defaults.checkPointAfterMs();
    private int checkPointLowerBound = defaults.checkPointLowerBound();
    private int checkPointUpperBound = defaults.checkPointUpperBound();
    private int maxSubscriberCount = defaults.maxSubscriberCount();
    private ConsumerStrategy consumerStrategy = defaults.consumerStrategy();

    private PersistentSubscriptionSettingsBuilder() {}

    public PersistentSubscriptionSettingsBuilder setResolveLinkTos(boolean resolveLinkTos) {
      this.resolveLinkTos = resolveLinkTos;
      return this;
    }

    /**
     * Sets where the group starts reading.
     *
     * <p>For a stream group this is a stream revision, for an all-stream group a log position.
     * {@link LogPosition#unset()} is not accepted.
     *
     * @param startFrom the start position
     * @return this builder for method chaining
     */
    public PersistentSubscriptionSettingsBuilder setStartFrom(LogPosition startFrom) {
      Objects.requireNonNull(startFrom, "startFrom cannot be null");
      if (startFrom.isUnset()) {
        throw new IllegalArgumentException("startFrom cannot be unset");
      }
      this.startFrom = startFrom;
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setExtraStatistics(boolean extraStatistics) {
      this.extraStatistics = extraStatistics;
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setMessageTimeoutMs(int messageTimeoutMs) {
      this.messageTimeoutMs = requireNonNegative(messageTimeoutMs, "messageTimeoutMs");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setMaxRetryCount(int maxRetryCount) {
      this.maxRetryCount = requireNonNegative(maxRetryCount, "maxRetryCount");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setLiveBufferSize(int liveBufferSize) {
      this.liveBufferSize = requirePositive(liveBufferSize, "liveBufferSize");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setReadBatchSize(int readBatchSize) {
      this.readBatchSize = requirePositive(readBatchSize, "readBatchSize");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setHistoryBufferSize(int historyBufferSize) {
      this.historyBufferSize = requirePositive(historyBufferSize, "historyBufferSize");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setCheckPointAfterMs(int checkPointAfterMs) {
      this.checkPointAfterMs = requireNonNegative(checkPointAfterMs, "checkPointAfterMs");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setCheckPointLowerBound(int checkPointLowerBound) {
      this.checkPointLowerBound = requireNonNegative(checkPointLowerBound, "checkPointLowerBound");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setCheckPointUpperBound(int checkPointUpperBound) {
      this.checkPointUpperBound = requirePositive(checkPointUpperBound, "checkPointUpperBound");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setMaxSubscriberCount(int maxSubscriberCount) {
      this.maxSubscriberCount = requireNonNegative(maxSubscriberCount, "maxSubscriberCount");
      return this;
    }

    public PersistentSubscriptionSettingsBuilder setConsumerStrategy(
        ConsumerStrategy consumerStrategy) {
      this.consumerStrategy =
          Objects.requireNonNull(consumerStrategy, "consumerStrategy cannot be null");
      return this;
    }

    /**
     * Builds a new PersistentSubscriptionSettings instance.
     *
     * @return the settings
     * @throws IllegalArgumentException if the checkpoint lower bound exceeds the upper bound
     */
    public PersistentSubscriptionSettings build() {
      if (checkPointLowerBound > checkPointUpperBound) {
        throw new IllegalArgumentException(
            "checkPointLowerBound cannot be greater than checkPointUpperBound");
      }
      return new PersistentSubscriptionSettings(this);
    }

    private static int requirePositive(int value, String name) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be positive");
      }
      return value;
    }

    private static int requireNonNegative(int value, String name) {
      if (value < 0) {
        throw new IllegalArgumentException(name + " cannot be negative");
      }
      return value;
    }
  }
}
