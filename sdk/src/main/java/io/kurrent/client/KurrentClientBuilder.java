package io.kurrent.client;

import io.kurrent.client.auth.BasicCredentialsHeadersProvider;
import io.kurrent.client.auth.HeadersProvider;
import io.kurrent.client.model.DefaultRecordDecoder;
import io.kurrent.client.model.RecordDecoder;
import io.kurrent.client.tls.SecureTlsConfig;
import io.kurrent.client.tls.TlsConfig;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import javax.annotation.Nonnull;

/**
 * Builder for creating {@link KurrentClient} instances with custom configuration.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * KurrentClient client = KurrentClient.builder("localhost:2113")
 *     .tlsConfig(new InsecureTlsConfig())
 *     .credentials("admin", "changeit")
 *     .build();
 * }</pre>
 *
 * @see KurrentClient#builder(String)
 */
public final class KurrentClientBuilder {
  private final String endpoint;
  private Optional<ExecutorService> executor = Optional.empty();
  private Optional<KurrentClientStubFactory> stubFactory = Optional.empty();
  private TlsConfig tlsConfig = new SecureTlsConfig();
  private HeadersProvider headersProvider = Collections::emptyMap;
  private ConnectionOptions options = ConnectionOptions.getDefault();
  private RecordDecoder recordDecoder = new DefaultRecordDecoder();

  KurrentClientBuilder(@Nonnull String endpoint) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
    if (endpoint.trim().isEmpty()) {
      throw new IllegalArgumentException("endpoint cannot be empty");
    }
  }

  /**
   * Sets a custom executor service for subscription work.
   *
   * <p>If not set, the client creates a cached pool of daemon threads. When providing a custom
   * executor, the caller is responsible for shutting it down.
   *
   * @param executor The executor service to use
   * @return This builder for method chaining
   */
  @Nonnull
  public KurrentClientBuilder executor(@Nonnull ExecutorService executor) {
    this.executor = Optional.of(Objects.requireNonNull(executor, "executor cannot be null"));
    return this;
  }

  /**
   * Sets the channel security configuration. Defaults to {@link SecureTlsConfig}.
   *
   * @param tlsConfig The TLS configuration
   * @return This builder for method chaining
   */
  @Nonnull
  public KurrentClientBuilder tlsConfig(@Nonnull TlsConfig tlsConfig) {
    this.tlsConfig = Objects.requireNonNull(tlsConfig, "tlsConfig cannot be null");
    return this;
  }

  /**
   * Sets the provider of headers attached to every call.
   *
   * @param headersProvider The headers provider
   * @return This builder for method chaining
   */
  @Nonnull
  public KurrentClientBuilder headersProvider(@Nonnull HeadersProvider headersProvider) {
    this.headersProvider =
        Objects.requireNonNull(headersProvider, "headersProvider cannot be null");
    return this;
  }

  /**
   * Authenticates every call with HTTP basic credentials.
   *
   * @param username The user name
   * @param password The password
   * @return This builder for method chaining
   */
  @Nonnull
  public KurrentClientBuilder credentials(@Nonnull String username, @Nonnull String password) {
    return headersProvider(new BasicCredentialsHeadersProvider(username, password));
  }

  /**
   * Sets the connection options.
   *
   * @param options The connection options
   * @return This builder for method chaining
   */
  @Nonnull
  public KurrentClientBuilder options(@Nonnull ConnectionOptions options) {
    this.options = Objects.requireNonNull(options, "options cannot be null");
    return this;
  }

  /**
   * Sets the decoder used to turn record payloads into values. Defaults to {@link
   * DefaultRecordDecoder}.
   *
   * @param recordDecoder The decoder
   * @return This builder for method chaining
   */
  @Nonnull
  public KurrentClientBuilder recordDecoder(@Nonnull RecordDecoder recordDecoder) {
    this.recordDecoder = Objects.requireNonNull(recordDecoder, "recordDecoder cannot be null");
    return this;
  }

  /**
   * Sets a custom stub factory.
   *
   * <p>This is primarily used for testing.
   *
   * @param stubFactory The stub factory to use
   * @return This builder for method chaining
   */
  @Nonnull
  KurrentClientBuilder stubFactory(@Nonnull KurrentClientStubFactory stubFactory) {
    this.stubFactory =
        Optional.of(Objects.requireNonNull(stubFactory, "stubFactory cannot be null"));
    return this;
  }

  /**
   * Builds the KurrentClient instance.
   *
   * @return A new KurrentClient instance
   */
  @Nonnull
  public KurrentClient build() {
    return new KurrentClient(
        endpoint,
        headersProvider,
        tlsConfig,
        options,
        recordDecoder,
        executor.orElseGet(KurrentClient::createDefaultExecutor),
        !executor.isPresent(),
        stubFactory.orElseGet(KurrentClientStubFactory::new));
  }
}
