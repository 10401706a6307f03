package io.kurrent.client.model;

/** Well-known stream names. */
public final class SystemStreams {
  /** The stream holding every record in the database. */
  public static final String ALL_STREAM = "$all";

  private SystemStreams() {}

  public static boolean isAllStream(String streamName) {
    return ALL_STREAM.equals(streamName);
  }
}
