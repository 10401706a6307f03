package io.kurrent.client.persistent;

import io.kurrent.client.model.LogPosition;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Details of a persistent subscription group as reported by the server. */
public final class PersistentSubscriptionInfo {
  private final String eventSource;
  private final String groupName;
  private final String status;
  private final List<ConnectionInfo> connections;
  private final PersistentSubscriptionSettings settings;
  private final Stats stats;

  PersistentSubscriptionInfo(
      String eventSource,
      String groupName,
      String status,
      List<ConnectionInfo> connections,
      PersistentSubscriptionSettings settings,
      Stats stats) {
    this.eventSource = eventSource;
    this.groupName = groupName;
    this.status = status;
    this.connections = Collections.unmodifiableList(connections);
    this.settings = settings;
    this.stats = stats;
  }

  /** The stream the group reads from; {@code $all} for the all-stream. */
  public String getEventSource() {
    return eventSource;
  }

  public String getGroupName() {
    return groupName;
  }

  public String getStatus() {
    return status;
  }

  public List<ConnectionInfo> getConnections() {
    return connections;
  }

  public PersistentSubscriptionSettings getSettings() {
    return settings;
  }

  public Stats getStats() {
    return stats;
  }

  @Override
  public String toString() {
    return "PersistentSubscriptionInfo{"
        + groupName
        + " on "
        + eventSource
        + ", status="
        + status
        + ", connections="
        + connections.size()
        + "}";
  }

  /** A consumer connected to the group. */
  public static final class ConnectionInfo {
    private final String from;
    private final String username;
    private final int averageItemsPerSecond;
    private final long totalItems;
    private final long countSinceLastMeasurement;
    private final int availableSlots;
    private final int inFlightMessages;
    private final String connectionName;
    private final Map<String, Long> observedMeasurements;

    ConnectionInfo(
        String from,
        String username,
        int averageItemsPerSecond,
        long totalItems,
        long countSinceLastMeasurement,
        int availableSlots,
        int inFlightMessages,
        String connectionName,
        Map<String, Long> observedMeasurements) {
      this.from = from;
      this.username = username;
      this.averageItemsPerSecond = averageItemsPerSecond;
      this.totalItems = totalItems;
      this.countSinceLastMeasurement = countSinceLastMeasurement;
      this.availableSlots = availableSlots;
      this.inFlightMessages = inFlightMessages;
      this.connectionName = connectionName;
      this.observedMeasurements = Collections.unmodifiableMap(observedMeasurements);
    }

    public String getFrom() {
      return from;
    }

    public String getUsername() {
      return username;
    }

    public int getAverageItemsPerSecond() {
      return averageItemsPerSecond;
    }

    public long getTotalItems() {
      return totalItems;
    }

    public long getCountSinceLastMeasurement() {
      return countSinceLastMeasurement;
    }

    public int getAvailableSlots() {
      return availableSlots;
    }

    public int getInFlightMessages() {
      return inFlightMessages;
    }

    public String getConnectionName() {
      return connectionName;
    }

    public Map<String, Long> getObservedMeasurements() {
      return observedMeasurements;
    }
  }

  /** Runtime statistics of the group. */
  public static final class Stats {
    private final int averagePerSecond;
    private final long totalItems;
    private final long countSinceLastMeasurement;
    private final int readBufferCount;
    private final long liveBufferCount;
    private final int retryBufferCount;
    private final int totalInFlightMessages;
    private final int outstandingMessagesCount;
    private final long parkedMessageCount;
    private final LogPosition lastCheckpointedEventPosition;
    private final LogPosition lastKnownEventPosition;

    Stats(
        int averagePerSecond,
        long totalItems,
        long countSinceLastMeasurement,
        int readBufferCount,
        long liveBufferCount,
        int retryBufferCount,
        int totalInFlightMessages,
        int outstandingMessagesCount,
        long parkedMessageCount,
        LogPosition lastCheckpointedEventPosition,
        LogPosition lastKnownEventPosition) {
      this.averagePerSecond = averagePerSecond;
      this.totalItems = totalItems;
      this.countSinceLastMeasurement = countSinceLastMeasurement;
      this.readBufferCount = readBufferCount;
      this.liveBufferCount = liveBufferCount;
      this.retryBufferCount = retryBufferCount;
      this.totalInFlightMessages = totalInFlightMessages;
      this.outstandingMessagesCount = outstandingMessagesCount;
      this.parkedMessageCount = parkedMessageCount;
      this.lastCheckpointedEventPosition = lastCheckpointedEventPosition;
      this.lastKnownEventPosition = lastKnownEventPosition;
    }

    public int getAveragePerSecond() {
      return averagePerSecond;
    }

    public long getTotalItems() {
      return totalItems;
    }

    public long getCountSinceLastMeasurement() {
      return countSinceLastMeasurement;
    }

    public int getReadBufferCount() {
      return readBufferCount;
    }

    public long getLiveBufferCount() {
      return liveBufferCount;
    }

    public int getRetryBufferCount() {
      return retryBufferCount;
    }

    public int getTotalInFlightMessages() {
      return totalInFlightMessages;
    }

    public int getOutstandingMessagesCount() {
      return outstandingMessagesCount;
    }

    public long getParkedMessageCount() {
      return parkedMessageCount;
    }

    /** The last position the group checkpointed, or unset if it never did. */
    public LogPosition getLastCheckpointedEventPosition() {
      return lastCheckpointedEventPosition;
    }

    public LogPosition getLastKnownEventPosition() {
      return lastKnownEventPosition;
    }
  }
}
