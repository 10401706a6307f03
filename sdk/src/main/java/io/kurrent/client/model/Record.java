package io.kurrent.client.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * A record delivered by the server, together with its decoded value.
 *
 * <p>Records are immutable. The payload accessors return copies.
 */
public final class Record {
  private final UUID id;
  private final String stream;
  private final long streamRevision;
  private final LogPosition position;
  private final Instant timestamp;
  private final String schemaName;
  private final String contentType;
  private final Map<String, String> systemMetadata;
  private final byte[] customMetadata;
  private final byte[] data;
  private final Optional<Object> value;
  private final Optional<Link> link;

  private Record(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id cannot be null");
    this.stream = Objects.requireNonNull(builder.stream, "stream cannot be null");
    this.streamRevision = builder.streamRevision;
    this.position = builder.position;
    this.timestamp = builder.timestamp;
    this.schemaName = builder.schemaName;
    this.contentType = builder.contentType;
    this.systemMetadata = Collections.unmodifiableMap(new HashMap<>(builder.systemMetadata));
    this.customMetadata = builder.customMetadata;
    this.data = builder.data;
    this.value = builder.value;
    this.link = builder.link;
  }

  public static Builder builder() {
    return new Builder();
  }

  public UUID getId() {
    return id;
  }

  public String getStream() {
    return stream;
  }

  public long getStreamRevision() {
    return streamRevision;
  }

  public LogPosition getPosition() {
    return position;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  /** The record type as written by the producer. */
  public String getSchemaName() {
    return schemaName;
  }

  public String getContentType() {
    return contentType;
  }

  public Map<String, String> getSystemMetadata() {
    return systemMetadata;
  }

  public byte[] getCustomMetadata() {
    return customMetadata.clone();
  }

  public byte[] getData() {
    return data.clone();
  }

  /**
   * Returns the value produced by the configured {@link RecordDecoder}.
   *
   * @return the decoded value, or empty if the payload was empty
   */
  public Optional<Object> getValue() {
    return value;
  }

  /** Returns the link this record was resolved from, if any. */
  public Optional<Link> getLink() {
    return link;
  }

  @Override
  public String toString() {
    return "Record{"
        + "id="
        + id
        + ", stream="
        + stream
        + ", revision="
        + streamRevision
        + ", position="
        + position
        + ", type="
        + schemaName
        + "}";
  }

  /** Builder for {@link Record}. */
  public static final class Builder {
    private UUID id;
    private String stream;
    private long streamRevision;
    private LogPosition position = LogPosition.unset();
    private Instant timestamp = Instant.EPOCH;
    private String schemaName = "";
    private String contentType = SystemMetadata.CONTENT_TYPE_OCTET_STREAM;
    private Map<String, String> systemMetadata = Collections.emptyMap();
    private byte[] customMetadata = new byte[0];
    private byte[] data = new byte[0];
    private Optional<Object> value = Optional.empty();
    private Optional<Link> link = Optional.empty();

    private Builder() {}

    public Builder setId(UUID id) {
      this.id = id;
      return this;
    }

    public Builder setStream(String stream) {
      this.stream = stream;
      return this;
    }

    public Builder setStreamRevision(long streamRevision) {
      this.streamRevision = streamRevision;
      return this;
    }

    public Builder setPosition(LogPosition position) {
      this.position = Objects.requireNonNull(position, "position cannot be null");
      return this;
    }

    public Builder setTimestamp(Instant timestamp) {
      this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
      return this;
    }

    public Builder setSchemaName(String schemaName) {
      this.schemaName = Objects.requireNonNull(schemaName, "schemaName cannot be null");
      return this;
    }

    public Builder setContentType(String contentType) {
      this.contentType = Objects.requireNonNull(contentType, "contentType cannot be null");
      return this;
    }

    public Builder setSystemMetadata(Map<String, String> systemMetadata) {
      this.systemMetadata = Objects.requireNonNull(systemMetadata, "systemMetadata cannot be null");
      return this;
    }

    public Builder setCustomMetadata(byte[] customMetadata) {
      this.customMetadata = Arrays.copyOf(customMetadata, customMetadata.length);
      return this;
    }

    public Builder setData(byte[] data) {
      this.data = Arrays.copyOf(data, data.length);
      return this;
    }

    public Builder setValue(@Nullable Object value) {
      this.value = Optional.ofNullable(value);
      return this;
    }

    public Builder setLink(@Nullable Link link) {
      this.link = Optional.ofNullable(link);
      return this;
    }

    public Record build() {
      return new Record(this);
    }
  }
}
