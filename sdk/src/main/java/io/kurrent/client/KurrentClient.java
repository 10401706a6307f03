package io.kurrent.client;

import io.kurrent.client.auth.HeadersProvider;
import io.kurrent.client.model.RecordDecoder;
import io.kurrent.client.persistent.PersistentSubscriptionsClient;
import io.kurrent.client.tls.TlsConfig;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for the KurrentDB client.
 *
 * <p>A client owns one gRPC channel to the server and a pool of worker threads that run
 * subscription delivery loops.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try (KurrentClient client = KurrentClient.builder("localhost:2113")
 *     .tlsConfig(new InsecureTlsConfig())
 *     .credentials("admin", "changeit")
 *     .build()) {
 *
 *   Result<PersistentSubscription, PersistentSubscriptionError> result = client
 *       .persistentSubscriptions()
 *       .subscribeToStream("orders-1", "billing", (subscription, record, retryCount, token) ->
 *           subscription.ack(record))
 *       .join();
 * }
 * }</pre>
 */
public class KurrentClient implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(KurrentClient.class);

  /** The current version of the client. */
  public static final String VERSION = "0.1.0";

  private final String endpoint;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final KurrentClientStubFactory stubFactory;
  private final PersistentSubscriptionsClient persistentSubscriptions;

  /**
   * Creates a new KurrentClient.
   *
   * <p>This constructor is package-private and intended for use by {@link KurrentClientBuilder}.
   */
  KurrentClient(
      @Nonnull String endpoint,
      @Nonnull HeadersProvider headersProvider,
      @Nonnull TlsConfig tlsConfig,
      @Nonnull ConnectionOptions options,
      @Nonnull RecordDecoder recordDecoder,
      @Nonnull ExecutorService executor,
      boolean ownsExecutor,
      @Nonnull KurrentClientStubFactory stubFactory) {
    this.endpoint = endpoint;
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
    this.stubFactory = stubFactory;
    this.persistentSubscriptions =
        new PersistentSubscriptionsClient(
            () ->
                stubFactory.createPersistentSubscriptionsStub(
                    endpoint, headersProvider, tlsConfig, options),
            executor,
            recordDecoder);
  }

  /**
   * Creates a new builder for configuring a KurrentClient instance.
   *
   * @param endpoint The server endpoint, {@code host[:port]}; the port defaults to 2113
   * @return A new KurrentClientBuilder instance
   */
  @Nonnull
  public static KurrentClientBuilder builder(@Nonnull String endpoint) {
    return new KurrentClientBuilder(endpoint);
  }

  /** Creates the default executor service. Package-private for use by the builder. */
  static ExecutorService createDefaultExecutor() {
    ThreadFactory factory =
        new ThreadFactory() {
          private final AtomicInteger counter = new AtomicInteger(0);

          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("KurrentClient-worker-" + counter.getAndIncrement());
            return t;
          }
        };
    return Executors.newCachedThreadPool(factory);
  }

  /**
   * Returns the persistent subscriptions API of this client.
   *
   * @return the shared persistent subscriptions client
   */
  @Nonnull
  public PersistentSubscriptionsClient persistentSubscriptions() {
    return persistentSubscriptions;
  }

  /** Returns the endpoint this client connects to. */
  public String getEndpoint() {
    return endpoint;
  }

  /**
   * Closes the client and releases resources.
   *
   * <p>The gRPC channel is shut down first so no new calls start. If the client created its own
   * executor, it then waits up to 5 seconds for delivery loops to finish before forcing a shutdown,
   * which interrupts subscriptions that are still open. A caller-supplied executor is left running.
   */
  @Override
  public void close() {
    logger.debug("Closing KurrentClient for {}", endpoint);
    stubFactory.shutdown();
    if (!ownsExecutor) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warn("Executor did not terminate gracefully, forcing shutdown");
        executor.shutdownNow();
        if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
          logger.error("Executor did not terminate after forced shutdown");
        }
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for executor shutdown");
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Returns the current version of the client.
   *
   * @return The version string
   */
  public static String getVersion() {
    return VERSION;
  }
}
