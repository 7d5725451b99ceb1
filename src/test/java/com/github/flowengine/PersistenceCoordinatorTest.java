package com.github.flowengine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.github.flowengine.FlowEngineException.Code;
import com.github.flowengine.PersistenceHandlers.DataClearHandler;
import com.github.flowengine.PersistenceHandlers.DataLoadHandler;
import com.github.flowengine.PersistenceHandlers.DataPersistHandler;

/**
 * Tests to maintain the sanity and correctness of load, persist and clear with retries.
 */
public class PersistenceCoordinatorTest {
  private static final FlowLogger logger =
      new FlowLogger(PersistenceCoordinatorTest.class, "test-engine", "test-flow");
  private static final FlowContext context = FlowContext.initial(0L);

  private final EventBus bus = new EventBus(logger);
  private final List<ErrorRecord> reported = new ArrayList<>();
  private final ErrorHandler errorHandler =
      new ErrorHandler(logger, bus, ErrorHandler.DEFAULT_HISTORY_SIZE,
          new ErrorHandler.ErrorSink() {
            @Override
            public boolean accept(final ErrorRecord record) {
              reported.add(record);
              return true;
            }
          });
  private final List<PersistenceEvent> successes = new ArrayList<>();
  private final List<PersistenceEvent> failures = new ArrayList<>();

  private PersistenceCoordinator coordinator(final RetryPolicy policy) {
    bus.subscribe(EventType.PERSISTENCE_SUCCESS, new Collect(successes));
    bus.subscribe(EventType.PERSISTENCE_FAILURE, new Collect(failures));
    return new PersistenceCoordinator(logger, bus, errorHandler, policy);
  }

  @Test
  public void testRetriesUntilSuccess() {
    final PersistenceCoordinator coordinator = coordinator(new RetryPolicy(3, 1L, 2.0));
    final AtomicInteger calls = new AtomicInteger();
    coordinator.setPersistHandler(new DataPersistHandler() {
      @Override
      public CompletionStage<?> persist(final FlowContext context, final String currentStepId) {
        if (calls.incrementAndGet() < 3) {
          throw new IllegalStateException("flaky storage");
        }
        return CompletableFuture.completedFuture(null);
      }
    });

    assertTrue(coordinator.persist(context, "A").isSuccessful());
    assertEquals(3, calls.get());
    assertEquals(1, successes.size());
    assertEquals(3, successes.get(0).getAttempts());
    assertTrue(failures.isEmpty());
    assertTrue(reported.isEmpty());
  }

  @Test
  public void testExhaustedRetriesReportOnce() {
    final PersistenceCoordinator coordinator = coordinator(new RetryPolicy(2, 1L, 1.0));
    coordinator.setClearHandler(new DataClearHandler() {
      @Override
      public CompletionStage<?> clear() {
        final CompletableFuture<Void> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("no access"));
        return failed;
      }
    });

    final OperationResult<Void> result = coordinator.clear(context);
    assertFalse(result.isSuccessful());
    assertEquals(Code.PERSISTENCE_FAILURE, result.getError().getCode());
    assertEquals(1, failures.size());
    assertEquals(PersistenceEvent.Operation.CLEAR, failures.get(0).getOperation());
    assertEquals(2, failures.get(0).getAttempts());
    assertEquals(1, reported.size());
    assertEquals("clearPersistedData", reported.get(0).getOperation());
    assertEquals(ErrorKind.SIDE_EFFECT, reported.get(0).getKind());
  }

  @Test
  public void testLoad() {
    final PersistenceCoordinator coordinator = coordinator(RetryPolicy.noRetries());
    // without a handler the flow starts fresh
    assertNull(coordinator.load(context).getValue());
    assertTrue(successes.isEmpty());

    coordinator.setLoadHandler(new DataLoadHandler() {
      @Override
      public CompletionStage<LoadedData> load() {
        return CompletableFuture.completedFuture(LoadedData.newBuilder().currentStepId("B").build());
      }
    });
    assertEquals("B", coordinator.load(context).getValue().getCurrentStepId());
    assertEquals(1, successes.size());
    assertEquals(PersistenceEvent.Operation.LOAD, successes.get(0).getOperation());
  }

  @Test
  public void testLoadFailureIsFatal() {
    final PersistenceCoordinator coordinator = coordinator(RetryPolicy.defaultPolicy());
    final AtomicInteger calls = new AtomicInteger();
    coordinator.setLoadHandler(new DataLoadHandler() {
      @Override
      public CompletionStage<LoadedData> load() throws Exception {
        calls.incrementAndGet();
        throw new Exception("unreadable");
      }
    });

    final OperationResult<LoadedData> result = coordinator.load(context);
    assertFalse(result.isSuccessful());
    // loads are never retried
    assertEquals(1, calls.get());
    assertEquals(Code.DATA_LOAD_FAILURE, result.getError().getCode());
    assertEquals(ErrorKind.FATAL, reported.get(0).getKind());
    assertEquals(1, failures.size());
  }

  @Test
  public void testBackoff() {
    final RetryPolicy policy = new RetryPolicy(4, 100L, 2.0);
    assertEquals(100L, policy.backoffMillis(1));
    assertEquals(200L, policy.backoffMillis(2));
    assertEquals(400L, policy.backoffMillis(3));
  }

  @Test
  public void testDefaultBackoffStaysShort() {
    final RetryPolicy policy = RetryPolicy.defaultPolicy();
    long totalBackoff = 0L;
    for (int retry = 1; retry < policy.getMaxAttempts(); retry++) {
      totalBackoff += policy.backoffMillis(retry);
    }
    assertEquals(3, policy.getMaxAttempts());
    assertEquals(60L, totalBackoff);
  }

  @Test
  public void testFailingPersistWithDefaultPolicy() {
    final PersistenceCoordinator coordinator = coordinator(RetryPolicy.defaultPolicy());
    final AtomicInteger calls = new AtomicInteger();
    final long started = System.currentTimeMillis();
    coordinator.setPersistHandler(new DataPersistHandler() {
      @Override
      public CompletionStage<?> persist(final FlowContext context, final String currentStepId) {
        calls.incrementAndGet();
        throw new IllegalStateException("storage offline");
      }
    });

    assertFalse(coordinator.persist(context, "A").isSuccessful());
    assertEquals(3, calls.get());
    assertEquals(1, failures.size());
    assertTrue(System.currentTimeMillis() - started < 1000L);
  }

  static final class Collect implements FlowEventListener<PersistenceEvent> {
    private final List<PersistenceEvent> events;

    Collect(final List<PersistenceEvent> events) {
      this.events = events;
    }

    @Override
    public void onEvent(final PersistenceEvent event) {
      events.add(event);
    }
  }
}
