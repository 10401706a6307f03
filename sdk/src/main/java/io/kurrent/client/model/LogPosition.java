package io.kurrent.client.model;

import java.util.Objects;

/**
 * A position in a stream or in the global log.
 *
 * <p>Besides concrete values there are three markers: {@link #earliest()}, {@link #latest()} and
 * {@link #unset()} for positions the server did not report.
 */
public final class LogPosition implements Comparable<LogPosition> {
  private static final long EARLIEST_VALUE = 0;
  private static final long LATEST_VALUE = Long.MAX_VALUE;
  private static final long UNSET_VALUE = -1;

  private static final LogPosition EARLIEST = new LogPosition(EARLIEST_VALUE);
  private static final LogPosition LATEST = new LogPosition(LATEST_VALUE);
  private static final LogPosition UNSET = new LogPosition(UNSET_VALUE);

  private final long value;

  private LogPosition(long value) {
    this.value = value;
  }

  public static LogPosition earliest() {
    return EARLIEST;
  }

  public static LogPosition latest() {
    return LATEST;
  }

  public static LogPosition unset() {
    return UNSET;
  }

  /**
   * Creates a position from a concrete value.
   *
   * @param value the position, zero or greater
   * @return the position
   * @throws IllegalArgumentException if value is negative
   */
  public static LogPosition of(long value) {
    if (value < 0) {
      throw new IllegalArgumentException("Log position cannot be negative: " + value);
    }
    if (value == EARLIEST_VALUE) {
      return EARLIEST;
    }
    if (value == LATEST_VALUE) {
      return LATEST;
    }
    return new LogPosition(value);
  }

  /**
   * Parses a position as reported by the server.
   *
   * <p>Accepts a plain number or the {@code C:<commit>/P:<prepare>} form used for the all-stream.
   * Anything else yields {@link #unset()}.
   *
   * @param text the textual position, may be null
   * @return the parsed position
   */
  public static LogPosition parse(String text) {
    if (text == null || text.isEmpty()) {
      return UNSET;
    }
    String commit = text;
    if (text.startsWith("C:")) {
      int separator = text.indexOf('/');
      commit = separator > 0 ? text.substring(2, separator) : text.substring(2);
    }
    try {
      long parsed = Long.parseLong(commit);
      return parsed < 0 ? UNSET : of(parsed);
    } catch (NumberFormatException e) {
      return UNSET;
    }
  }

  public long getValue() {
    return value;
  }

  public boolean isEarliest() {
    return value == EARLIEST_VALUE;
  }

  public boolean isLatest() {
    return value == LATEST_VALUE;
  }

  public boolean isUnset() {
    return value == UNSET_VALUE;
  }

  @Override
  public int compareTo(LogPosition other) {
    return Long.compare(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return value == ((LogPosition) o).value;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    if (isUnset()) return "Unset";
    if (isEarliest()) return "Earliest";
    if (isLatest()) return "Latest";
    return Long.toString(value);
  }
}
