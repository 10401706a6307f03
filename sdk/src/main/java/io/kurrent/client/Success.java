package io.kurrent.client;

/** Value of a successful operation that has nothing else to return. */
public enum Success {
  INSTANCE
}
