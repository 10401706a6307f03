package io.kurrent.client.tls;

import io.grpc.ChannelCredentials;
import io.grpc.InsecureChannelCredentials;

/**
 * Plaintext connection without TLS.
 *
 * <p>Only for nodes started in insecure mode, typically local development.
 *
 * @see TlsConfig
 */
public class InsecureTlsConfig extends TlsConfig {

  @Override
  public ChannelCredentials toChannelCredentials() {
    return InsecureChannelCredentials.create();
  }
}
