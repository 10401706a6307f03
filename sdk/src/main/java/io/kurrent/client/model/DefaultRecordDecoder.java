package io.kurrent.client.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Decoder used when none is configured.
 *
 * <p>JSON payloads become a Jackson {@link com.fasterxml.jackson.databind.JsonNode}; anything
 * else is handed back as the raw bytes.
 */
public final class DefaultRecordDecoder implements RecordDecoder {
  private final ObjectMapper mapper;

  public DefaultRecordDecoder() {
    this(new ObjectMapper());
  }

  public DefaultRecordDecoder(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
  }

  @Override
  @Nullable
  public Object decode(String stream, String schemaName, String contentType, byte[] data) {
    if (data.length == 0) {
      return null;
    }
    if (!isJson(contentType)) {
      return data;
    }
    try {
      return mapper.readTree(data);
    } catch (IOException e) {
      throw new RecordDecodingException(
          "Failed to decode JSON record of type '" + schemaName + "' from stream '" + stream + "'",
          e);
    }
  }

  private static boolean isJson(String contentType) {
    return contentType != null && contentType.startsWith(SystemMetadata.CONTENT_TYPE_JSON);
  }
}
