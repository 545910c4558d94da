/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded blocking FIFO queue that producers can close. Closing is one way and idempotent. Consumers keep receiving
 * the elements put before the queue was closed, and are told the queue is exhausted once it is closed and drained.
 *
 * @author jiratime
 */
public class ClosableQueue<T> {

  private final int capacity;
  private final Deque<T> items;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private boolean closed;

  public ClosableQueue(final int capacity) {
    Preconditions.checkArgument(capacity > 0, "Queue capacity must be positive");
    this.capacity = capacity;
    this.items = new ArrayDeque<>(capacity);
  }

  /**
   * Adds an element, waiting while the queue is full.
   *
   * @throws QueueClosedException if the queue is closed before the element could be added
   */
  public void put(final T item) throws InterruptedException {
    Preconditions.checkNotNull(item);
    lock.lockInterruptibly();
    try {
      while (items.size() >= capacity && !closed) {
        notFull.await();
      }
      if (closed) {
        throw new QueueClosedException();
      }
      items.addLast(item);
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the head of the queue, waiting while the queue is empty and open.
   *
   * @return the head of the queue, or empty once the queue is closed and drained
   */
  public Optional<T> take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (items.isEmpty() && !closed) {
        notEmpty.await();
      }
      if (items.isEmpty()) {
        return Optional.empty();
      }
      final T item = items.removeFirst();
      notFull.signal();
      return Optional.of(item);
    } finally {
      lock.unlock();
    }
  }

  public void close() {
    lock.lock();
    try {
      if (!closed) {
        closed = true;
        notEmpty.signalAll();
        notFull.signalAll();
      }
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

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * An element was offered to a queue that had already been closed.
   */
  public static class QueueClosedException extends IllegalStateException {

    QueueClosedException() {
      super("Queue is closed");
    }
  }
}
