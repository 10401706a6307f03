package io.kurrent.client.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Authenticates calls with a username and password using HTTP basic authentication.
 *
 * <pre>{@code
 * KurrentClient client = KurrentClient.builder("localhost:2113")
 *     .headersProvider(new BasicCredentialsHeadersProvider("admin", "changeit"))
 *     .build();
 * }</pre>
 */
public class BasicCredentialsHeadersProvider implements HeadersProvider {

  static final String AUTHORIZATION_HEADER = "authorization";
  private static final String BASIC_PREFIX = "Basic ";

  private final Map<String, String> headers;

  /**
   * Creates a provider for the given user.
   *
   * @param username The user name
   * @param password The password
   */
  public BasicCredentialsHeadersProvider(String username, String password) {
    Objects.requireNonNull(username, "username cannot be null");
    Objects.requireNonNull(password, "password cannot be null");
    String token =
        Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    this.headers = Collections.singletonMap(AUTHORIZATION_HEADER, BASIC_PREFIX + token);
  }

  @Override
  public Map<String, String> getHeaders() {
    return headers;
  }
}
