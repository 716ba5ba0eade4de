package dev.aahmedlab.workerpool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Internal implementation of an unbounded multi-producer, multi-consumer blocking queue. This class
 * is package-private and not part of the public API.
 *
 * <p>Every element is handed to exactly one consumer. Once closed, the queue rejects new elements
 * but still delivers the ones it already holds.
 *
 * @param <T> the type of elements held in this queue
 */
final class SharedQueue<T> {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Deque<T> queue = new ArrayDeque<>();
  private boolean closed;

  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public void push(T item) {
    if (item == null) throw new NullPointerException("item");
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("queue is closed");
      }
      queue.addLast(item);
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends {@code copies} references to {@code item} and closes the queue in one step, so that no
   * concurrent {@link #push} can be ordered after them.
   */
  public void pushAllAndClose(T item, int copies) {
    if (item == null) throw new NullPointerException("item");
    if (copies < 0) throw new IllegalArgumentException("copies must be >= 0");
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("queue is closed");
      }
      for (int i = 0; i < copies; i++) {
        queue.addLast(item);
      }
      closed = true;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the head of the queue, waiting until an element becomes available.
   *
   * @throws IllegalStateException if the queue is closed and has nothing left to deliver
   * @throws InterruptedException if interrupted while waiting
   */
  public T pop() throws InterruptedException {
    lock.lock();
    try {
      while (queue.isEmpty()) {
        if (closed) {
          throw new IllegalStateException("queue is closed");
        }
        notEmpty.await();
      }
      return queue.removeFirst();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }
}
