package com.github.flowengine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Tests to maintain the sanity and correctness of event dispatch.
 */
public class EventBusTest {
  private final EventBus bus =
      new EventBus(new FlowLogger(EventBusTest.class, "test-engine", "test-flow"));

  @Test
  public void testDeliveryInSubscriptionOrder() {
    final List<String> received = new ArrayList<>();
    bus.subscribe(EventType.CONTEXT_UPDATE, new Named(received, "first"));
    bus.subscribe(EventType.CONTEXT_UPDATE, new Named(received, "second"));
    assertEquals(0, bus.publish(EventType.STATE_CHANGE, null));

    assertEquals(2, bus.publish(EventType.CONTEXT_UPDATE, update()));
    assertEquals(Arrays.asList("first", "second"), received);
  }

  @Test
  public void testFailingListenerDoesNotStopDispatch() {
    final List<String> received = new ArrayList<>();
    bus.subscribe(EventType.CONTEXT_UPDATE, new FlowEventListener<ContextUpdateEvent>() {
      @Override
      public void onEvent(final ContextUpdateEvent event) {
        throw new IllegalStateException("listener bug");
      }
    });
    bus.subscribe(EventType.CONTEXT_UPDATE, new Named(received, "survivor"));

    assertEquals(1, bus.publish(EventType.CONTEXT_UPDATE, update()));
    assertEquals(Arrays.asList("survivor"), received);
  }

  @Test
  public void testUnsubscribeDuringDispatch() {
    final List<String> received = new ArrayList<>();
    final List<ListenerRegistration> registrations = new ArrayList<>();
    registrations.add(bus.subscribe(EventType.CONTEXT_UPDATE,
        new FlowEventListener<ContextUpdateEvent>() {
          @Override
          public void onEvent(final ContextUpdateEvent event) {
            received.add("self-removing");
            registrations.get(0).unsubscribe();
          }
        }));
    bus.subscribe(EventType.CONTEXT_UPDATE, new Named(received, "other"));

    // the current dispatch still reaches everyone captured at its start
    bus.publish(EventType.CONTEXT_UPDATE, update());
    assertEquals(Arrays.asList("self-removing", "other"), received);
    bus.publish(EventType.CONTEXT_UPDATE, update());
    assertEquals(Arrays.asList("self-removing", "other", "other"), received);
  }

  @Test
  public void testInterceptableDecisions() {
    // 1. first decision wins
    bus.subscribe(EventType.BEFORE_STEP_CHANGE, new FlowEventListener<BeforeStepChangeEvent>() {
      @Override
      public void onEvent(final BeforeStepChangeEvent event) {
        event.redirect("Z");
      }
    });
    bus.subscribe(EventType.BEFORE_STEP_CHANGE, new FlowEventListener<BeforeStepChangeEvent>() {
      @Override
      public void onEvent(final BeforeStepChangeEvent event) {
        assertFalse(event.cancel());
      }
    });
    final BeforeStepChangeEvent event = new BeforeStepChangeEvent(null, "B",
        NavigationDirection.NEXT, FlowContext.initial(0L));
    final OperationResult<BeforeStepChangeEvent> result = bus.publishInterceptable(event);
    assertTrue(result.isSuccessful());
    assertTrue(event.isRedirected());
    assertFalse(event.isCancelled());
    assertEquals("Z", event.getRedirectStepId());

    // 2. decisions after dispatch are ignored
    assertFalse(event.cancel());
    assertFalse(event.isCancelled());
  }

  @Test
  public void testInterceptableListenerFailure() {
    bus.subscribe(EventType.BEFORE_STEP_CHANGE, new FlowEventListener<BeforeStepChangeEvent>() {
      @Override
      public void onEvent(final BeforeStepChangeEvent event) {
        throw new IllegalArgumentException("guard crashed");
      }
    });
    final OperationResult<BeforeStepChangeEvent> result =
        bus.publishInterceptable(new BeforeStepChangeEvent(null, "B", NavigationDirection.NEXT,
            FlowContext.initial(0L)));
    assertFalse(result.isSuccessful());
    assertEquals(Code.NAVIGATION_LISTENER_FAILURE, result.getError().getCode());
    assertEquals(ErrorKind.RESOLUTION, result.getError().getKind());
  }

  @Test
  public void testClear() {
    bus.subscribe(EventType.CONTEXT_UPDATE, new Named(new ArrayList<String>(), "gone"));
    bus.clear();
    assertEquals(0, bus.publish(EventType.CONTEXT_UPDATE, update()));
  }

  private static ContextUpdateEvent update() {
    final FlowContext before = FlowContext.initial(0L);
    return new ContextUpdateEvent(before, before.merge(ContextPatch.ofFlowData("k", "v")));
  }

  static final class Named implements FlowEventListener<ContextUpdateEvent> {
    private final List<String> received;
    private final String name;

    Named(final List<String> received, final String name) {
      this.received = received;
      this.name = name;
    }

    @Override
    public void onEvent(final ContextUpdateEvent event) {
      received.add(name);
    }
  }
}
