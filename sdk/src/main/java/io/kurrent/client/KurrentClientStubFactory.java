package io.kurrent.client;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ChannelCredentials;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ClientInterceptors;
import io.grpc.ForwardingClientCall.SimpleForwardingClientCall;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.kurrent.client.auth.HeadersProvider;
import io.kurrent.client.protocol.persistent.PersistentSubscriptionsGrpc;
import io.kurrent.client.tls.TlsConfig;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Factory for KurrentDB gRPC stubs.
 *
 * <p>The channel is created on first use and shared by every stub this factory hands out, so all
 * subscriptions and management calls of a client are multiplexed over one connection.
 */
class KurrentClientStubFactory {

  static final int DEFAULT_PORT = 2113;
  static final String CONNECTION_NAME_HEADER = "connection-name";

  private static final String[] SCHEME_PREFIXES = {
    "https://", "http://", "kurrentdb://", "esdb://"
  };

  private final AtomicReference<ManagedChannel> cachedChannel = new AtomicReference<>(null);

  /**
   * Gets or creates the cached gRPC channel.
   *
   * @param endpoint The endpoint, {@code host[:port]} with an optional scheme prefix
   * @param tlsConfig The channel security configuration
   * @param options Connection settings
   * @return A configured ManagedChannel (cached)
   */
  ManagedChannel getOrCreateChannel(
      String endpoint, TlsConfig tlsConfig, ConnectionOptions options) {
    ManagedChannel channel = cachedChannel.get();
    if (channel != null) {
      return channel;
    }

    synchronized (this) {
      channel = cachedChannel.get();
      if (channel != null) {
        return channel;
      }

      channel = createChannel(endpoint, tlsConfig, options);
      cachedChannel.set(channel);
      return channel;
    }
  }

  /**
   * Creates a persistent subscriptions stub over the cached channel.
   *
   * <p>Every call made through the stub carries the provider's headers and, for unary calls, the
   * configured default deadline.
   *
   * @param endpoint The endpoint
   * @param headersProvider Provider that supplies headers for each call
   * @param tlsConfig The channel security configuration
   * @param options Connection settings
   * @return A configured async stub
   */
  PersistentSubscriptionsGrpc.PersistentSubscriptionsStub createPersistentSubscriptionsStub(
      String endpoint,
      HeadersProvider headersProvider,
      TlsConfig tlsConfig,
      ConnectionOptions options) {
    ManagedChannel channel = getOrCreateChannel(endpoint, tlsConfig, options);
    Channel interceptedChannel =
        ClientInterceptors.intercept(
            channel,
            new UnaryDeadlineInterceptor(options.defaultDeadlineMs()),
            new HeadersProviderInterceptor(headersProvider, options.connectionName()));
    return PersistentSubscriptionsGrpc.newStub(interceptedChannel)
        .withMaxInboundMessageSize(options.maxInboundMessageSizeBytes());
  }

  /** Shuts down the cached channel if it exists. */
  void shutdown() {
    ManagedChannel channel = cachedChannel.getAndSet(null);
    if (channel != null) {
      channel.shutdown();
    }
  }

  private ManagedChannel createChannel(
      String endpoint, TlsConfig tlsConfig, ConnectionOptions options) {
    EndpointInfo endpointInfo = parseEndpoint(endpoint);
    ChannelCredentials credentials = tlsConfig.toChannelCredentials();

    return Grpc.newChannelBuilder(endpointInfo.host + ":" + endpointInfo.port, credentials)
        .keepAliveTime(options.keepAliveTimeMs(), TimeUnit.MILLISECONDS)
        .keepAliveTimeout(options.keepAliveTimeoutMs(), TimeUnit.MILLISECONDS)
        .keepAliveWithoutCalls(true)
        .maxInboundMessageSize(options.maxInboundMessageSizeBytes())
        .build();
  }

  /** Container for parsed endpoint information. */
  static class EndpointInfo {
    final String host;
    final int port;

    EndpointInfo(String host, int port) {
      this.host = host;
      this.port = port;
    }
  }

  /**
   * Parses an endpoint string to extract host and port information.
   *
   * @param endpoint The endpoint string, optionally prefixed with a scheme
   * @return Parsed endpoint information
   * @throws IllegalArgumentException if the port is not a number
   */
  static EndpointInfo parseEndpoint(String endpoint) {
    String cleanEndpoint = endpoint;
    for (String prefix : SCHEME_PREFIXES) {
      if (cleanEndpoint.startsWith(prefix)) {
        cleanEndpoint = cleanEndpoint.substring(prefix.length());
        break;
      }
    }
    if (cleanEndpoint.endsWith("/")) {
      cleanEndpoint = cleanEndpoint.substring(0, cleanEndpoint.length() - 1);
    }

    String[] parts = cleanEndpoint.split(":", 2);
    String host = parts[0];
    int port;
    try {
      port = parts.length > 1 ? Integer.parseInt(parts[1]) : DEFAULT_PORT;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port in endpoint '" + endpoint + "'", e);
    }

    return new EndpointInfo(host, port);
  }

  /**
   * Copies provider headers and the connection name into call metadata.
   *
   * @param headers The call metadata to extend
   * @param providerHeaders Headers from the provider
   * @param connectionName Optional connection name
   */
  static void applyHeaders(
      Metadata headers, Map<String, String> providerHeaders, Optional<String> connectionName) {
    for (Map.Entry<String, String> entry : providerHeaders.entrySet()) {
      Metadata.Key<String> key = Metadata.Key.of(entry.getKey(), Metadata.ASCII_STRING_MARSHALLER);
      headers.put(key, entry.getValue());
    }
    connectionName.ifPresent(
        name ->
            headers.put(
                Metadata.Key.of(CONNECTION_NAME_HEADER, Metadata.ASCII_STRING_MARSHALLER), name));
  }

  /**
   * Applies the default deadline to unary calls that do not carry one.
   *
   * @param type The method type of the call
   * @param callOptions The call options
   * @param deadlineMs The default deadline, if configured
   * @return The call options to use
   */
  static CallOptions withUnaryDeadline(
      MethodDescriptor.MethodType type, CallOptions callOptions, Optional<Long> deadlineMs) {
    if (type != MethodDescriptor.MethodType.UNARY
        || !deadlineMs.isPresent()
        || callOptions.getDeadline() != null) {
      return callOptions;
    }
    return callOptions.withDeadlineAfter(deadlineMs.get(), TimeUnit.MILLISECONDS);
  }

  /** gRPC client interceptor that adds headers from a HeadersProvider to every call. */
  private static class HeadersProviderInterceptor implements ClientInterceptor {

    private final HeadersProvider headersProvider;
    private final Optional<String> connectionName;

    HeadersProviderInterceptor(HeadersProvider headersProvider, Optional<String> connectionName) {
      this.headersProvider = headersProvider;
      this.connectionName = connectionName;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
        MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
      return new SimpleForwardingClientCall<ReqT, RespT>(next.newCall(method, callOptions)) {
        @Override
        public void start(Listener<RespT> responseListener, Metadata headers) {
          applyHeaders(headers, headersProvider.getHeaders(), connectionName);
          super.start(responseListener, headers);
        }
      };
    }
  }

  /** gRPC client interceptor that bounds unary calls by the default deadline. */
  private static class UnaryDeadlineInterceptor implements ClientInterceptor {

    private final Optional<Long> deadlineMs;

    UnaryDeadlineInterceptor(Optional<Long> deadlineMs) {
      this.deadlineMs = deadlineMs;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
        MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
      return next.newCall(method, withUnaryDeadline(method.getType(), callOptions, deadlineMs));
    }
  }
}
