package io.kurrent.client.model;

import javax.annotation.Nullable;

/**
 * Turns the raw payload of a recorded event into an application value.
 *
 * <p>Implementations must be thread-safe; a single decoder is shared by every subscription of a
 * client.
 *
 * @see DefaultRecordDecoder
 */
@FunctionalInterface
public interface RecordDecoder {

  /**
   * Decodes a payload.
   *
   * @param stream the stream the record belongs to
   * @param schemaName the record's type
   * @param contentType the record's content type
   * @param data the raw payload
   * @return the decoded value, or null for an empty payload
   * @throws RecordDecodingException if the payload cannot be decoded
   */
  @Nullable Object decode(String stream, String schemaName, String contentType, byte[] data);
}
