package io.kurrent.client.model;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/** Tests for DefaultRecordDecoder. */
class DefaultRecordDecoderTest {

  private final DefaultRecordDecoder decoder = new DefaultRecordDecoder();

  @Test
  void testDecodesJson() {
    Object value =
        decoder.decode(
            "orders-1",
            "OrderPlaced",
            SystemMetadata.CONTENT_TYPE_JSON,
            "{\"amount\":12}".getBytes(StandardCharsets.UTF_8));

    assertTrue(value instanceof JsonNode);
    assertEquals(12, ((JsonNode) value).get("amount").asInt());
  }

  @Test
  void testReturnsBytesForOtherContentTypes() {
    byte[] data = {1, 2, 3};

    Object value =
        decoder.decode("orders-1", "Blob", SystemMetadata.CONTENT_TYPE_OCTET_STREAM, data);

    assertSame(data, value);
  }

  @Test
  void testEmptyPayloadIsNull() {
    assertNull(
        decoder.decode("orders-1", "Marker", SystemMetadata.CONTENT_TYPE_JSON, new byte[0]));
  }

  @Test
  void testInvalidJsonFails() {
    RecordDecodingException exception =
        assertThrows(
            RecordDecodingException.class,
            () ->
                decoder.decode(
                    "orders-1",
                    "OrderPlaced",
                    SystemMetadata.CONTENT_TYPE_JSON,
                    "{broken".getBytes(StandardCharsets.UTF_8)));

    assertTrue(exception.getMessage().contains("OrderPlaced"));
    assertTrue(exception.getMessage().contains("orders-1"));
  }
}
