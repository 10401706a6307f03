package io.kurrent.client.tls;

import io.grpc.ChannelCredentials;
import io.grpc.TlsChannelCredentials;

/**
 * TLS using the system's trusted certificate authorities.
 *
 * <p>This is the default configuration.
 *
 * @see TlsConfig
 */
public class SecureTlsConfig extends TlsConfig {

  @Override
  public ChannelCredentials toChannelCredentials() {
    return TlsChannelCredentials.create();
  }
}
