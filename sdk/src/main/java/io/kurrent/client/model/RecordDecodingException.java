package io.kurrent.client.model;

import io.kurrent.client.KurrentException;

/** Thrown when a record payload cannot be decoded into a value. */
public class RecordDecodingException extends KurrentException {

  public RecordDecodingException(String message) {
    super(message);
  }

  public RecordDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
