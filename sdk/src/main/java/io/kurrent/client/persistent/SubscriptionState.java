package io.kurrent.client.persistent;

/**
 * Represents the lifecycle state of a {@link PersistentSubscription}.
 *
 * <pre>
 * UNCONFIRMED → ACTIVE → DROPPED
 *      ↓                    ↑
 *      └────────────────────┘ (not found, cancelled or failed before confirmation)
 * </pre>
 */
public enum SubscriptionState {
  /** The subscribe request was sent; waiting for the server to confirm it */
  UNCONFIRMED,

  /** Confirmed; records are delivered to the handler */
  ACTIVE,

  /** Terminal. No further records are delivered */
  DROPPED
}
