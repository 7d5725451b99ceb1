package com.github.flowengine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Single-flight serializer for the side-effecting work of one engine.
 * 
 * Notes:<br>
 * 1. operations run strictly one at a time on a dedicated daemon worker thread<br>
 * 2. ordering is urgent operations first (FIFO among themselves), then higher priority, then
 * enqueue order<br>
 * 3. an urgent operation never interrupts the one already in flight<br>
 * 4. bookkeeping runs in a finally block before the caller's future completes, so a failing
 * operation leaves the queue healthy and callers observe settled statistics<br>
 * 5. there are no timeouts: an operation that never returns stalls the queue until
 * {@link #shutdown()}<br>
 */
final class OperationQueue {
  static final int PRIORITY_NORMAL = 0;
  private static final int PRIORITY_IDLE_MARKER = Integer.MIN_VALUE;

  private static final Comparator<Entry<?>> executionOrder = new Comparator<Entry<?>>() {
    @Override
    public int compare(final Entry<?> left, final Entry<?> right) {
      if (left.urgent != right.urgent) {
        return left.urgent ? -1 : 1;
      }
      if (left.priority != right.priority) {
        return left.priority > right.priority ? -1 : 1;
      }
      return Long.compare(left.sequence, right.sequence);
    }
  };

  private final FlowLogger logger;
  private final Object lock = new Object();

  // all guarded by lock
  private final PriorityQueue<Entry<?>> pending = new PriorityQueue<>(11, executionOrder);
  private Entry<?> inFlight;
  private long sequence;
  private long completedOperations;
  private long failedOperations;
  private boolean paused;
  private boolean shutdown;

  private final Worker worker;

  OperationQueue(final FlowLogger logger, final String name) {
    this.logger = logger;
    this.worker = new Worker(name);
    this.worker.start();
  }

  <T> CompletableFuture<T> enqueue(final QueuedOperation<T> operation) {
    return enqueue(operation, PRIORITY_NORMAL);
  }

  <T> CompletableFuture<T> enqueue(final QueuedOperation<T> operation, final int priority) {
    return add(operation, priority, false);
  }

  <T> CompletableFuture<T> enqueueUrgent(final QueuedOperation<T> operation) {
    return add(operation, Integer.MAX_VALUE, true);
  }

  /**
   * Completes once every operation queued ahead of it, including ones those operations enqueue
   * while running, has finished.
   */
  CompletableFuture<Void> awaitIdle() {
    return add(new QueuedOperation<Void>() {
      @Override
      public Void execute() {
        return null;
      }
    }, PRIORITY_IDLE_MARKER, false);
  }

  private <T> CompletableFuture<T> add(final QueuedOperation<T> operation, final int priority,
      final boolean urgent) {
    final Entry<T> entry = new Entry<>(operation, priority, urgent);
    synchronized (lock) {
      if (shutdown) {
        entry.future.completeExceptionally(
            new FlowEngineException(Code.ENGINE_SHUT_DOWN, "Operation queue is shut down"));
        return entry.future;
      }
      entry.sequence = sequence++;
      pending.add(entry);
      lock.notifyAll();
    }
    return entry.future;
  }

  /**
   * Drop every pending operation, cancelling its future. The operation in flight is unaffected.
   * Returns the number of dropped operations.
   */
  int clear() {
    final List<Entry<?>> dropped;
    synchronized (lock) {
      dropped = new ArrayList<>(pending);
      pending.clear();
    }
    for (final Entry<?> entry : dropped) {
      entry.future.cancel(false);
    }
    if (!dropped.isEmpty()) {
      logger.debug("Cleared " + dropped.size() + " pending operations");
    }
    return dropped.size();
  }

  void pause() {
    synchronized (lock) {
      paused = true;
    }
  }

  void resume() {
    synchronized (lock) {
      paused = false;
      lock.notifyAll();
    }
  }

  /**
   * Cancel pending operations and stop the worker. The operation in flight, if any, is interrupted
   * and its outcome is still delivered to its caller.
   */
  void shutdown() {
    synchronized (lock) {
      if (shutdown) {
        return;
      }
      shutdown = true;
      lock.notifyAll();
    }
    clear();
    worker.interrupt();
  }

  boolean isShutdown() {
    synchronized (lock) {
      return shutdown;
    }
  }

  int pendingCount() {
    synchronized (lock) {
      return pending.size() + (inFlight == null ? 0 : 1);
    }
  }

  QueueStatistics getStatistics() {
    synchronized (lock) {
      long oldestCreated = Long.MAX_VALUE;
      for (final Entry<?> entry : pending) {
        oldestCreated = Math.min(oldestCreated, entry.createdMillis);
      }
      final long oldestAge =
          oldestCreated == Long.MAX_VALUE ? 0L : System.currentTimeMillis() - oldestCreated;
      return new QueueStatistics(pending.size(), inFlight == null ? 0 : 1, completedOperations,
          failedOperations, paused, oldestAge);
    }
  }

  private static final class Entry<T> {
    private final QueuedOperation<T> operation;
    private final int priority;
    private final boolean urgent;
    private final long createdMillis = System.currentTimeMillis();
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private long sequence;
    private T result;
    private Throwable failure;

    private Entry(final QueuedOperation<T> operation, final int priority, final boolean urgent) {
      this.operation = operation;
      this.priority = priority;
      this.urgent = urgent;
    }

    // outcome is held back until the worker settled its bookkeeping, see complete()
    private void run() {
      try {
        result = operation.execute();
      } catch (Throwable error) {
        failure = error;
      }
    }

    private void complete() {
      if (failure != null) {
        future.completeExceptionally(failure);
      } else {
        future.complete(result);
      }
    }
  }

  /**
   * Dedicated worker. Even though there is one per queue, it is non-static by design so it can
   * drain its enclosing queue.
   */
  private final class Worker extends Thread {

    private Worker(final String name) {
      setName(name);
      setDaemon(true);
    }

    @Override
    public void run() {
      while (true) {
        final Entry<?> entry;
        synchronized (lock) {
          while (!shutdown && (paused || pending.isEmpty())) {
            try {
              lock.wait();
            } catch (InterruptedException interrupted) {
              if (shutdown) {
                break;
              }
            }
          }
          if (shutdown) {
            break;
          }
          entry = pending.poll();
          inFlight = entry;
        }
        try {
          entry.run();
        } finally {
          synchronized (lock) {
            inFlight = null;
            if (entry.failure == null) {
              completedOperations++;
            } else {
              failedOperations++;
            }
          }
        }
        entry.complete();
        // an interrupt aimed at the finished operation must not leak into the next one
        if (!isShutdown()) {
          Thread.interrupted();
        }
      }
      logger.debug("Operation queue worker " + getName() + " stopped");
    }
  }
}
