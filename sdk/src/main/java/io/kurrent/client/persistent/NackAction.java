package io.kurrent.client.persistent;

/** What the server should do with records that were negatively acknowledged. */
public enum NackAction {
  /** Let the server decide. */
  UNKNOWN,

  /** Move the records to the parked message stream. */
  PARK,

  /** Redeliver the records. */
  RETRY,

  /** Treat the records as processed. */
  SKIP,

  /** Stop the subscription. */
  STOP
}
