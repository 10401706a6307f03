package io.kurrent.client.auth;

import io.kurrent.client.KurrentException;
import java.util.Map;

/**
 * Supplies the headers attached to every gRPC call made by a client.
 *
 * <p>Use this to send credentials or other per-call metadata. {@link #getHeaders()} is called once
 * per call, right before the call starts, so implementations may refresh tokens lazily.
 *
 * <p>Example usage with a bearer token:
 *
 * <pre>{@code
 * public class BearerTokenHeadersProvider implements HeadersProvider {
 *     private final Supplier<String> tokens;
 *
 *     public BearerTokenHeadersProvider(Supplier<String> tokens) {
 *         this.tokens = tokens;
 *     }
 *
 *     @Override
 *     public Map<String, String> getHeaders() {
 *         return Collections.singletonMap("authorization", "Bearer " + tokens.get());
 *     }
 * }
 *
 * KurrentClient client = KurrentClient.builder("localhost:2113")
 *     .headersProvider(new BearerTokenHeadersProvider(tokenSource))
 *     .build();
 * }</pre>
 *
 * <p><b>Important:</b> implementations must be thread-safe; calls start concurrently.
 *
 * @see BasicCredentialsHeadersProvider
 */
public interface HeadersProvider {

  /**
   * Returns headers to be attached to a gRPC call.
   *
   * @return A map of header names to header values
   * @throws KurrentException if the headers cannot be produced; the call then fails
   */
  Map<String, String> getHeaders() throws KurrentException;
}
