package com.github.flowengine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Tests to maintain the sanity and correctness of the single-flight operation queue.
 */
public class OperationQueueTest {
  private OperationQueue queue;

  @Before
  public void startQueue() {
    queue = new OperationQueue(new FlowLogger(OperationQueueTest.class, "test-engine", "test-flow"),
        "test-queue");
  }

  @After
  public void stopQueue() {
    queue.shutdown();
  }

  @Test
  public void testPriorityOrder() throws Exception {
    // 1. hold the worker so everything else piles up
    final CountDownLatch release = new CountDownLatch(1);
    final CompletableFuture<Void> blocker = queue.enqueue(new Blocker(release));
    final List<String> order = Collections.synchronizedList(new ArrayList<String>());

    // 2. queue with mixed priorities
    queue.enqueue(new Recorder(order, "low-1"), -1);
    queue.enqueue(new Recorder(order, "normal-1"));
    queue.enqueue(new Recorder(order, "high"), 5);
    queue.enqueue(new Recorder(order, "normal-2"));
    queue.enqueueUrgent(new Recorder(order, "urgent-1"));
    queue.enqueueUrgent(new Recorder(order, "urgent-2"));
    final CompletableFuture<Void> idle = queue.awaitIdle();

    // 3. let go
    release.countDown();
    blocker.get(5, TimeUnit.SECONDS);
    idle.get(5, TimeUnit.SECONDS);
    assertEquals(Arrays.asList("urgent-1", "urgent-2", "high", "normal-1", "normal-2", "low-1"),
        order);
  }

  @Test
  public void testOneAtATime() throws Exception {
    final AtomicInteger concurrent = new AtomicInteger();
    final AtomicInteger maxConcurrent = new AtomicInteger();
    final List<CompletableFuture<Integer>> results = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      final int index = i;
      results.add(queue.enqueue(new QueuedOperation<Integer>() {
        @Override
        public Integer execute() throws Exception {
          final int now = concurrent.incrementAndGet();
          maxConcurrent.set(Math.max(maxConcurrent.get(), now));
          Thread.sleep(2L);
          concurrent.decrementAndGet();
          return index;
        }
      }));
    }
    for (int i = 0; i < 20; i++) {
      assertEquals(Integer.valueOf(i), results.get(i).get(5, TimeUnit.SECONDS));
    }
    assertEquals(1, maxConcurrent.get());
  }

  @Test
  public void testFailingOperationKeepsQueueHealthy() throws Exception {
    final CompletableFuture<Void> failing = queue.enqueue(new QueuedOperation<Void>() {
      @Override
      public Void execute() throws Exception {
        throw new FlowEngineException(Code.HOOK_FAILURE, "boom");
      }
    });
    try {
      failing.get(5, TimeUnit.SECONDS);
      fail("operation failure must reach the caller");
    } catch (ExecutionException expected) {
      assertEquals(Code.HOOK_FAILURE, ((FlowEngineException) expected.getCause()).getCode());
    }

    final CompletableFuture<String> after = queue.enqueue(new QueuedOperation<String>() {
      @Override
      public String execute() {
        return "still working";
      }
    });
    assertEquals("still working", after.get(5, TimeUnit.SECONDS));
    final QueueStatistics stats = queue.getStatistics();
    assertEquals(1L, stats.getFailedOperations());
    assertEquals(1L, stats.getCompletedOperations());
    assertEquals(0, stats.getQueueLength());
    assertEquals(0, queue.pendingCount());
  }

  @Test
  public void testClearCancelsPending() throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    final CompletableFuture<Void> blocker = queue.enqueue(new Blocker(release));
    final CompletableFuture<Void> pending =
        queue.enqueue(new Recorder(new ArrayList<String>(), "dropped"));
    waitUntilInFlight();

    assertEquals(1, queue.clear());
    assertTrue(pending.isCancelled());
    release.countDown();
    blocker.get(5, TimeUnit.SECONDS);
  }

  @Test
  public void testPauseAndResume() throws Exception {
    queue.pause();
    assertTrue(queue.getStatistics().isPaused());
    final List<String> order = Collections.synchronizedList(new ArrayList<String>());
    final CompletableFuture<Void> paused = queue.enqueue(new Recorder(order, "later"));
    Thread.sleep(50L);
    assertFalse(paused.isDone());
    assertEquals(1, queue.getStatistics().getQueueLength());

    queue.resume();
    paused.get(5, TimeUnit.SECONDS);
    assertEquals(Arrays.asList("later"), order);
  }

  @Test
  public void testShutdown() throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    queue.enqueue(new Blocker(release));
    final CompletableFuture<Void> pending =
        queue.enqueue(new Recorder(new ArrayList<String>(), "dropped"));
    waitUntilInFlight();

    queue.shutdown();
    assertTrue(queue.isShutdown());
    try {
      pending.get(5, TimeUnit.SECONDS);
      fail("pending operation must be cancelled");
    } catch (CancellationException expected) {
    }
    try {
      queue.enqueue(new Recorder(new ArrayList<String>(), "late")).get(5, TimeUnit.SECONDS);
      fail("enqueue after shutdown must fail");
    } catch (ExecutionException expected) {
      assertEquals(Code.ENGINE_SHUT_DOWN, ((FlowEngineException) expected.getCause()).getCode());
    }
  }

  @Test
  public void testWorkerThread() throws Exception {
    final Thread worker = queue.enqueue(new QueuedOperation<Thread>() {
      @Override
      public Thread execute() {
        return Thread.currentThread();
      }
    }).get(5, TimeUnit.SECONDS);
    assertNotSame(Thread.currentThread(), worker);
    assertEquals("test-queue", worker.getName());
    assertTrue(worker.isDaemon());
  }

  private void waitUntilInFlight() throws InterruptedException {
    for (int i = 0; i < 500 && !queue.getStatistics().isProcessing(); i++) {
      Thread.sleep(5L);
    }
    assertTrue(queue.getStatistics().isProcessing());
  }

  static final class Blocker implements QueuedOperation<Void> {
    private final CountDownLatch release;

    Blocker(final CountDownLatch release) {
      this.release = release;
    }

    @Override
    public Void execute() throws Exception {
      release.await(5, TimeUnit.SECONDS);
      return null;
    }
  }

  static final class Recorder implements QueuedOperation<Void> {
    private final List<String> order;
    private final String name;

    Recorder(final List<String> order, final String name) {
      this.order = order;
      this.name = name;
    }

    @Override
    public Void execute() {
      order.add(name);
      return null;
    }
  }
}
