package io.kurrent.client;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * The outcome of an operation: either a success value or an expected error.
 *
 * <p>Operations return a failed result for failures the caller is expected to handle (for example
 * a subscription group that does not exist). Unexpected failures are raised as {@link
 * KurrentException} instead.
 *
 * <pre>{@code
 * Result<PersistentSubscription, PersistentSubscriptionError> result =
 *     client.subscribeToStream("orders-1", "billing", handler).join();
 *
 * if (result.isFailure()) {
 *     logger.warn("Subscribe failed: {}", result.getError());
 * }
 * }</pre>
 *
 * @param <T> The success value type
 * @param <E> The error type
 */
public final class Result<T, E> {
  private final Optional<T> value;
  private final Optional<E> error;

  private Result(Optional<T> value, Optional<E> error) {
    this.value = value;
    this.error = error;
  }

  /**
   * Creates a successful result.
   *
   * @param value the success value
   * @return a successful result holding {@code value}
   */
  @Nonnull
  public static <T, E> Result<T, E> success(@Nonnull T value) {
    return new Result<>(
        Optional.of(Objects.requireNonNull(value, "value cannot be null")), Optional.empty());
  }

  /**
   * Creates a failed result.
   *
   * @param error the error
   * @return a failed result holding {@code error}
   */
  @Nonnull
  public static <T, E> Result<T, E> failure(@Nonnull E error) {
    return new Result<>(
        Optional.empty(), Optional.of(Objects.requireNonNull(error, "error cannot be null")));
  }

  public boolean isSuccess() {
    return value.isPresent();
  }

  public boolean isFailure() {
    return error.isPresent();
  }

  /**
   * Returns the success value.
   *
   * @return the success value
   * @throws NoSuchElementException if this result is a failure
   */
  @Nonnull
  public T getValue() {
    return value.orElseThrow(
        () -> new NoSuchElementException("Result is a failure: " + error.orElse(null)));
  }

  /**
   * Returns the error.
   *
   * @return the error
   * @throws NoSuchElementException if this result is a success
   */
  @Nonnull
  public E getError() {
    return error.orElseThrow(() -> new NoSuchElementException("Result is a success"));
  }

  /** Maps the success value, leaving a failure untouched. */
  @Nonnull
  public <U> Result<U, E> map(@Nonnull Function<? super T, ? extends U> mapper) {
    Objects.requireNonNull(mapper, "mapper cannot be null");
    if (isSuccess()) {
      return Result.success(mapper.apply(value.get()));
    }
    return Result.failure(error.get());
  }

  /** Collapses both arms into a single value. */
  public <R> R fold(
      @Nonnull Function<? super T, ? extends R> onSuccess,
      @Nonnull Function<? super E, ? extends R> onFailure) {
    return isSuccess() ? onSuccess.apply(value.get()) : onFailure.apply(error.get());
  }

  /**
   * Returns the success value or throws an exception built from the error.
   *
   * @param exceptionFactory builds the exception to throw for a failure
   * @return the success value
   */
  @Nonnull
  public <X extends RuntimeException> T orElseThrow(
      @Nonnull Function<? super E, ? extends X> exceptionFactory) {
    if (isSuccess()) {
      return value.get();
    }
    throw exceptionFactory.apply(error.get());
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success(" + value.get() + ")" : "Failure(" + error.get() + ")";
  }
}
