package io.kurrent.client.persistent;

import java.util.Optional;

/** How the server spreads records across the consumers of a subscription group. */
public enum ConsumerStrategy {
  /** Send every record to one consumer while it has capacity, then to the next. */
  DISPATCH_TO_SINGLE("DispatchToSingle"),

  /** Distribute records evenly across consumers. */
  ROUND_ROBIN("RoundRobin"),

  /** Send records of the same stream to the same consumer. */
  PINNED("Pinned");

  private final String wireName;

  ConsumerStrategy(String wireName) {
    this.wireName = wireName;
  }

  /** Returns the name the server uses for this strategy. */
  public String getWireName() {
    return wireName;
  }

  /**
   * Looks up a strategy by the name the server uses.
   *
   * @param wireName the server-side name
   * @return the strategy, or empty if the name is not known
   */
  public static Optional<ConsumerStrategy> fromWireName(String wireName) {
    for (ConsumerStrategy strategy : values()) {
      if (strategy.wireName.equals(wireName)) {
        return Optional.of(strategy);
      }
    }
    return Optional.empty();
  }
}
