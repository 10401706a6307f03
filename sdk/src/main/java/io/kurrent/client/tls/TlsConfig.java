package io.kurrent.client.tls;

import io.grpc.ChannelCredentials;

/**
 * Abstract base class for channel security strategies.
 *
 * <p>Implementations define how the client's gRPC channel is secured. By default the client uses
 * {@link SecureTlsConfig}; nodes started without TLS need {@link InsecureTlsConfig}. Custom
 * implementations can supply a private certificate authority or mutual TLS.
 *
 * <p>Example usage with a custom certificate authority:
 *
 * <pre>{@code
 * public class CustomCaTlsConfig extends TlsConfig {
 *     private final File caCertFile;
 *
 *     public CustomCaTlsConfig(File caCertFile) {
 *         this.caCertFile = caCertFile;
 *     }
 *
 *     @Override
 *     public ChannelCredentials toChannelCredentials() {
 *         try {
 *             return TlsChannelCredentials.newBuilder()
 *                 .trustManager(caCertFile)
 *                 .build();
 *         } catch (IOException e) {
 *             throw new KurrentException("Failed to load CA certificate", e);
 *         }
 *     }
 * }
 *
 * KurrentClient client = KurrentClient.builder("node1.example.com:2113")
 *     .tlsConfig(new CustomCaTlsConfig(new File("/path/to/ca.pem")))
 *     .build();
 * }</pre>
 */
public abstract class TlsConfig {

  /**
   * Converts this configuration to gRPC channel credentials.
   *
   * @return Channel credentials for the connection
   */
  public abstract ChannelCredentials toChannelCredentials();
}
