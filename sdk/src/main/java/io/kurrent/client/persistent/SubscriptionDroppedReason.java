package io.kurrent.client.persistent;

/** Why a persistent subscription was dropped. */
public enum SubscriptionDroppedReason {
  /** The subscription was closed or its cancellation token completed. */
  DISPOSED,

  /** The record handler threw an exception. */
  SUBSCRIBER_ERROR,

  /** The server ended the call or the call failed. */
  SERVER_ERROR
}
