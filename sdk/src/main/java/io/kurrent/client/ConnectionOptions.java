package io.kurrent.client;

import java.util.Optional;

/**
 * Connection settings shared by every call a {@link KurrentClient} makes.
 *
 * <p>Use the builder to create instances:
 *
 * <pre>{@code
 * ConnectionOptions options = ConnectionOptions.builder()
 *     .setKeepAliveTimeMs(20000)
 *     .setDefaultDeadlineMs(5000)
 *     .setConnectionName("billing-worker")
 *     .build();
 * }</pre>
 */
public class ConnectionOptions {

  /** Default max inbound message size: 17MB (server maximum record size plus framing). */
  public static final int DEFAULT_MAX_INBOUND_MESSAGE_SIZE_BYTES = 17 * 1024 * 1024;

  private long keepAliveTimeMs = 10000;
  private long keepAliveTimeoutMs = 10000;
  private int maxInboundMessageSizeBytes = DEFAULT_MAX_INBOUND_MESSAGE_SIZE_BYTES;
  private Optional<Long> defaultDeadlineMs = Optional.empty();
  private Optional<String> connectionName = Optional.empty();

  private ConnectionOptions() {}

  private ConnectionOptions(
      long keepAliveTimeMs,
      long keepAliveTimeoutMs,
      int maxInboundMessageSizeBytes,
      Optional<Long> defaultDeadlineMs,
      Optional<String> connectionName) {
    this.keepAliveTimeMs = keepAliveTimeMs;
    this.keepAliveTimeoutMs = keepAliveTimeoutMs;
    this.maxInboundMessageSizeBytes = maxInboundMessageSizeBytes;
    this.defaultDeadlineMs = defaultDeadlineMs;
    this.connectionName = connectionName;
  }

  /**
   * Returns the interval between keep-alive pings on an idle connection.
   *
   * @return the keep-alive interval in milliseconds
   */
  public long keepAliveTimeMs() {
    return this.keepAliveTimeMs;
  }

  /**
   * Returns how long to wait for a keep-alive acknowledgement before the connection is considered
   * dead.
   *
   * @return the keep-alive timeout in milliseconds
   */
  public long keepAliveTimeoutMs() {
    return this.keepAliveTimeoutMs;
  }

  /**
   * Returns the largest message the client accepts from the server.
   *
   * @return the maximum inbound message size in bytes
   */
  public int maxInboundMessageSizeBytes() {
    return this.maxInboundMessageSizeBytes;
  }

  /**
   * Returns the deadline applied to unary calls such as create, delete or list.
   *
   * <p>Streaming calls (subscriptions) never get a deadline; they live until closed.
   *
   * @return the deadline in milliseconds, or empty for no deadline
   */
  public Optional<Long> defaultDeadlineMs() {
    return this.defaultDeadlineMs;
  }

  /**
   * Returns the name sent to the server to identify this connection.
   *
   * @return the connection name, or empty if not set
   */
  public Optional<String> connectionName() {
    return this.connectionName;
  }

  /**
   * Returns the default connection options.
   *
   * <p>Default values: keepAliveTimeMs 10000, keepAliveTimeoutMs 10000, maxInboundMessageSizeBytes
   * 17MB, no default deadline, no connection name.
   *
   * @return the default connection options
   */
  public static ConnectionOptions getDefault() {
    return new ConnectionOptions();
  }

  /**
   * Returns a new builder for creating ConnectionOptions.
   *
   * @return a new ConnectionOptionsBuilder
   */
  public static ConnectionOptionsBuilder builder() {
    return new ConnectionOptionsBuilder();
  }

  /**
   * Returns a builder initialized with this instance's values.
   *
   * @return a new builder pre-populated with this instance's values
   */
  public ConnectionOptionsBuilder toBuilder() {
    ConnectionOptionsBuilder builder =
        new ConnectionOptionsBuilder()
            .setKeepAliveTimeMs(this.keepAliveTimeMs)
            .setKeepAliveTimeoutMs(this.keepAliveTimeoutMs)
            .setMaxInboundMessageSizeBytes(this.maxInboundMessageSizeBytes);
    this.defaultDeadlineMs.ifPresent(builder::setDefaultDeadlineMs);
    this.connectionName.ifPresent(builder::setConnectionName);
    return builder;
  }

  /**
   * Builder for creating ConnectionOptions instances.
   *
   * @see ConnectionOptions
   */
  public static class ConnectionOptionsBuilder {
    private ConnectionOptions defaultOptions = ConnectionOptions.getDefault();

    private long keepAliveTimeMs = defaultOptions.keepAliveTimeMs();
    private long keepAliveTimeoutMs = defaultOptions.keepAliveTimeoutMs();
    private int maxInboundMessageSizeBytes = defaultOptions.maxInboundMessageSizeBytes();
    private Optional<Long> defaultDeadlineMs = defaultOptions.defaultDeadlineMs();
    private Optional<String> connectionName = defaultOptions.connectionName();

    private ConnectionOptionsBuilder() {}

    /**
     * Sets the interval between keep-alive pings.
     *
     * @param keepAliveTimeMs the keep-alive interval in milliseconds
     * @return this builder for method chaining
     * @throws IllegalArgumentException if keepAliveTimeMs is not positive
     */
    public ConnectionOptionsBuilder setKeepAliveTimeMs(long keepAliveTimeMs) {
      if (keepAliveTimeMs <= 0) {
        throw new IllegalArgumentException("keepAliveTimeMs must be positive");
      }
      this.keepAliveTimeMs = keepAliveTimeMs;
      return this;
    }

    /**
     * Sets the keep-alive acknowledgement timeout.
     *
     * @param keepAliveTimeoutMs the timeout in milliseconds
     * @return this builder for method chaining
     * @throws IllegalArgumentException if keepAliveTimeoutMs is not positive
     */
    public ConnectionOptionsBuilder setKeepAliveTimeoutMs(long keepAliveTimeoutMs) {
      if (keepAliveTimeoutMs <= 0) {
        throw new IllegalArgumentException("keepAliveTimeoutMs must be positive");
      }
      this.keepAliveTimeoutMs = keepAliveTimeoutMs;
      return this;
    }

    /**
     * Sets the largest message the client accepts from the server.
     *
     * @param maxInboundMessageSizeBytes the size in bytes
     * @return this builder for method chaining
     * @throws IllegalArgumentException if maxInboundMessageSizeBytes is not positive
     */
    public ConnectionOptionsBuilder setMaxInboundMessageSizeBytes(int maxInboundMessageSizeBytes) {
      if (maxInboundMessageSizeBytes <= 0) {
        throw new IllegalArgumentException("maxInboundMessageSizeBytes must be positive");
      }
      this.maxInboundMessageSizeBytes = maxInboundMessageSizeBytes;
      return this;
    }

    /**
     * Sets the deadline applied to unary calls.
     *
     * @param defaultDeadlineMs the deadline in milliseconds
     * @return this builder for method chaining
     * @throws IllegalArgumentException if defaultDeadlineMs is not positive
     */
    public ConnectionOptionsBuilder setDefaultDeadlineMs(long defaultDeadlineMs) {
      if (defaultDeadlineMs <= 0) {
        throw new IllegalArgumentException("defaultDeadlineMs must be positive");
      }
      this.defaultDeadlineMs = Optional.of(defaultDeadlineMs);
      return this;
    }

    /**
     * Sets the name sent to the server to identify this connection.
     *
     * @param connectionName the connection name
     * @return this builder for method chaining
     */
    public ConnectionOptionsBuilder setConnectionName(String connectionName) {
      this.connectionName = Optional.of(connectionName);
      return this;
    }

    /**
     * Builds a new ConnectionOptions instance.
     *
     * @return a new ConnectionOptions with the configured settings
     */
    public ConnectionOptions build() {
      return new ConnectionOptions(
          this.keepAliveTimeMs,
          this.keepAliveTimeoutMs,
          this.maxInboundMessageSizeBytes,
          this.defaultDeadlineMs,
          this.connectionName);
    }
  }
}
