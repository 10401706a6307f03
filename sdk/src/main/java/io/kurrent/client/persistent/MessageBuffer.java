package io.kurrent.client.persistent;

import java.util.LinkedList;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * Bounded hand-off between the inbound pump of a subscription call and its single consumer.
 *
 * <p>This class coordinates:
 *
 * <ul>
 *   <li>The pump calling {@link #write} for every translated frame, blocking while the buffer is
 *       full
 *   <li>The consumer calling {@link #read}, blocking while the buffer is empty
 *   <li>Either side ending the sequence through {@link #complete}, {@link #completeWith} or {@link
 *       #abort}
 * </ul>
 *
 * <p>Once completed, the consumer still drains whatever was buffered before seeing the end.
 *
 * @param <T> The element type
 */
final class MessageBuffer<T> {

  private final LinkedList<T> queue = new LinkedList<>();
  private final int capacity;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();

  private boolean completed = false;
  @Nullable private Throwable error = null;

  /**
   * Creates a buffer with the given capacity.
   *
   * @param capacity Maximum number of elements held before {@link #write} blocks
   */
  MessageBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  /**
   * Appends an element, blocking while the buffer is full.
   *
   * @param item The element to append
   * @return true if appended, false if the buffer was completed first
   * @throws InterruptedException if interrupted while waiting for space
   */
  boolean write(T item) throws InterruptedException {
    lock.lock();
    try {
      while (queue.size() >= capacity && !completed) {
        notFull.await();
      }
      if (completed) {
        return false;
      }
      queue.addLast(item);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends a final element and completes the buffer without waiting for space.
   *
   * @param last The final element
   * @return true if this call completed the buffer, false if it was already completed
   */
  boolean completeWith(T last) {
    lock.lock();
    try {
      if (completed) {
        return false;
      }
      queue.addLast(last);
      markCompleted(null);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Completes the buffer. Buffered elements remain readable.
   *
   * @param error The fault that ended the sequence, or null for a normal end
   * @return true if this call completed the buffer, false if it was already completed
   */
  boolean complete(@Nullable Throwable error) {
    lock.lock();
    try {
      if (completed) {
        return false;
      }
      markCompleted(error);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Discards buffered elements and completes the buffer with the given fault.
   *
   * <p>Has no effect on the completion fault if the buffer was already completed, but buffered
   * elements are discarded either way.
   *
   * @param error The fault reported to the consumer
   */
  void abort(Throwable error) {
    lock.lock();
    try {
      queue.clear();
      if (!completed) {
        markCompleted(error);
      }
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the next element, blocking while the buffer is empty and not completed.
   *
   * @return The next element, or null once the buffer is completed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable
  T read() throws InterruptedException {
    lock.lock();
    try {
      while (queue.isEmpty() && !completed) {
        notEmpty.await();
      }
      if (queue.isEmpty()) {
        return null;
      }
      T item = queue.removeFirst();
      notFull.signal();
      return item;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the fault the buffer was completed with, if any. */
  Optional<Throwable> completionError() {
    lock.lock();
    try {
      return Optional.ofNullable(error);
    } finally {
      lock.unlock();
    }
  }

  boolean isCompleted() {
    lock.lock();
    try {
      return completed;
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  private void markCompleted(@Nullable Throwable error) {
    this.completed = true;
    this.error = error;
    notEmpty.signalAll();
    notFull.signalAll();
  }
}
