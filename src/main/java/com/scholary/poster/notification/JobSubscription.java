package com.scholary.poster.notification;

import com.scholary.poster.job.JobSnapshot;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One observer's view of a job's updates.
 *
 * <p>Snapshots are buffered in a bounded queue owned by this subscription. When the consumer falls
 * behind, the oldest buffered snapshot is dropped; the newest one, and in particular the terminal
 * one, is always kept. Nothing is accepted after a terminal snapshot, so a subscription yields at
 * most one terminal snapshot and then finishes.
 *
 * <p>Obtain instances from {@link JobNotificationHub#subscribe(String)} and release them with
 * {@link JobNotificationHub#unsubscribe(JobSubscription)}.
 */
public final class JobSubscription {

  private final String jobId;
  private final int capacity;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final ArrayDeque<JobSnapshot> queue = new ArrayDeque<>();

  private boolean terminalQueued;
  private boolean closed;
  private long dropped;

  JobSubscription(String jobId, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.jobId = jobId;
    this.capacity = capacity;
  }

  public String jobId() {
    return jobId;
  }

  /**
   * Buffer a snapshot for the consumer. Never blocks.
   *
   * @return false if the subscription is closed or has already received its terminal snapshot
   */
  boolean offer(JobSnapshot snapshot) {
    lock.lock();
    try {
      if (closed || terminalQueued) {
        return false;
      }
      if (queue.size() >= capacity) {
        queue.pollFirst();
        dropped++;
      }
      queue.addLast(snapshot);
      if (snapshot.isTerminal()) {
        terminalQueued = true;
      }
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Wait for the next snapshot.
   *
   * @param timeout how long to wait when nothing is buffered
   * @return the next snapshot, or empty on timeout or once the subscription is finished
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<JobSnapshot> poll(Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    lock.lock();
    try {
      while (queue.isEmpty()) {
        if (closed || terminalQueued || remaining <= 0) {
          return Optional.empty();
        }
        remaining = changed.awaitNanos(remaining);
      }
      return Optional.of(queue.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  /** True once the terminal snapshot has been consumed, or the subscription was closed. */
  public boolean isFinished() {
    lock.lock();
    try {
      return closed || (terminalQueued && queue.isEmpty());
    } finally {
      lock.unlock();
    }
  }

  /** Number of intermediate snapshots dropped because the consumer was too slow. */
  public long droppedCount() {
    lock.lock();
    try {
      return dropped;
    } finally {
      lock.unlock();
    }
  }

  /** Discard anything buffered and wake up a waiting consumer. Safe to call repeatedly. */
  void close() {
    lock.lock();
    try {
      closed = true;
      queue.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }
}
