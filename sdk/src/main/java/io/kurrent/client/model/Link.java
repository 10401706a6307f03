package io.kurrent.client.model;

import java.util.Objects;

/** The link event through which a record was resolved. */
public final class Link {
  private final String name;
  private final String stream;
  private final long revision;
  private final LogPosition position;

  public Link(String name, String stream, long revision, LogPosition position) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.stream = Objects.requireNonNull(stream, "stream cannot be null");
    this.revision = revision;
    this.position = Objects.requireNonNull(position, "position cannot be null");
  }

  /** The link event's type, usually {@code $>}. */
  public String getName() {
    return name;
  }

  public String getStream() {
    return stream;
  }

  public long getRevision() {
    return revision;
  }

  public LogPosition getPosition() {
    return position;
  }

  @Override
  public String toString() {
    return "Link{" + name + " " + revision + "@" + stream + "}";
  }
}
