package io.kurrent.client.auth;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for BasicCredentialsHeadersProvider. */
class BasicCredentialsHeadersProviderTest {

  @Test
  void testEncodesCredentials() {
    Map<String, String> headers =
        new BasicCredentialsHeadersProvider("admin", "changeit").getHeaders();

    String header = headers.get(BasicCredentialsHeadersProvider.AUTHORIZATION_HEADER);
    assertTrue(header.startsWith("Basic "));
    String decoded =
        new String(Base64.getDecoder().decode(header.substring(6)), StandardCharsets.UTF_8);
    assertEquals("admin:changeit", decoded);
    assertEquals(1, headers.size());
  }

  @Test
  void testRejectsNullCredentials() {
    assertThrows(NullPointerException.class, () -> new BasicCredentialsHeadersProvider(null, "x"));
    assertThrows(
        NullPointerException.class, () -> new BasicCredentialsHeadersProvider("admin", null));
  }
}
