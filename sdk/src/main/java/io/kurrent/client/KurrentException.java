package io.kurrent.client;

/**
 * Base exception class for all KurrentDB client errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). Expected failures of an
 * operation (a missing subscription group, denied access) are reported as a failed {@link Result}
 * instead; this exception covers everything else, such as transport failures, protocol violations
 * and server errors the client does not classify.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try {
 *     subscription.ack(record);
 * } catch (KurrentException e) {
 *     logger.warn("Could not acknowledge record", e);
 * }
 * }</pre>
 */
public class KurrentException extends RuntimeException {

  /**
   * Constructs a new KurrentException with the specified detail message.
   *
   * @param message the detail message
   */
  public KurrentException(String message) {
    super(message);
  }

  /**
   * Constructs a new KurrentException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public KurrentException(String message, Throwable cause) {
    super(message, cause);
  }
}
