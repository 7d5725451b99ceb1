package com.github.flowengine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Test;

import com.github.flowengine.FlowEngine.FlowEngineBuilder;
import com.github.flowengine.FlowEngineException.Code;

/**
 * Tests to maintain the sanity and correctness of analytics tracking.
 */
public class AnalyticsPluginTest {
  private final List<FlowEngine> engines = new ArrayList<>();

  @After
  public void shutdownEngines() {
    for (final FlowEngine engine : engines) {
      engine.shutdown();
    }
  }

  @Test
  public void testProgressMilestones() throws Exception {
    // 1. prep a four step flow
    final RecordingProvider provider = new RecordingProvider("recording");
    final AnalyticsPlugin analytics = new AnalyticsPlugin(provider);
    final FlowEngine engine = start(FlowEngineTest.newConfig(FlowEngineTest.information("A"),
        FlowEngineTest.information("B"), FlowEngineTest.information("C"),
        FlowEngineTest.information("D")).plugin(analytics).build());
    assertEquals(1, provider.count(AnalyticsEvent.FLOW_STARTED));
    assertTrue(analytics.getReachedMilestones().isEmpty());

    // 2. each completed step crosses one milestone
    FlowEngineTest.await(engine.next());
    assertEquals(Arrays.asList(25), analytics.getReachedMilestones());
    FlowEngineTest.await(engine.next());
    FlowEngineTest.await(engine.previous());
    FlowEngineTest.await(engine.next());
    assertEquals(Arrays.asList(25, 50), analytics.getReachedMilestones());
    assertEquals(1, provider.count(AnalyticsEvent.NAVIGATION_BACK));

    // 3. completion reaches the rest, each reported once
    FlowEngineTest.await(engine.next());
    FlowEngineTest.await(engine.next());
    assertTrue(engine.getState().isCompleted());
    assertEquals(Arrays.asList(25, 50, 75, 100), analytics.getReachedMilestones());
    assertEquals(4, provider.count(AnalyticsEvent.PROGRESS_MILESTONE));
    assertEquals(1, provider.count(AnalyticsEvent.FLOW_COMPLETED));

    final AnalyticsEvent last = provider.last(AnalyticsEvent.PROGRESS_MILESTONE);
    assertEquals(100, last.getProperty("milestone"));
    assertEquals("test-flow", last.getFlowId());
    assertEquals(engine.getId(), last.getEngineId());
  }

  @Test
  public void testSlowStepAndFailingProvider() throws Exception {
    final RecordingProvider provider = new RecordingProvider("recording");
    final AnalyticsPlugin analytics = new AnalyticsPlugin(
        Arrays.<AnalyticsProvider>asList(new FailingProvider(), provider), 200L, 50, 100);
    final FlowEngine engine = start(FlowEngineTest.newConfig(FlowEngineTest.information("A"),
        FlowEngineTest.information("B"), FlowEngineTest.information("C"))
        .plugin(analytics).build());

    // 1. linger on A past the threshold
    Thread.sleep(300L);
    FlowEngineTest.await(engine.next());
    final AnalyticsEvent slow = provider.last(AnalyticsEvent.STEP_SLOW);
    assertEquals("A", slow.getStepId());
    assertEquals(200L, slow.getProperty("threshold_ms"));
    assertTrue((Long) slow.getProperty("duration_ms") >= 300L);

    // 2. B is left right away
    FlowEngineTest.await(engine.next());
    assertEquals(1, provider.count(AnalyticsEvent.STEP_SLOW));
    assertEquals(2, provider.count(AnalyticsEvent.STEP_COMPLETED));
    assertEquals("B", provider.last(AnalyticsEvent.STEP_COMPLETED).getStepId());
  }

  @Test
  public void testResetStartsOver() throws Exception {
    final RecordingProvider provider = new RecordingProvider("recording");
    final AnalyticsPlugin analytics = new AnalyticsPlugin(provider);
    final FlowEngine engine = start(FlowEngineTest.newConfig(FlowEngineTest.information("A"),
        FlowEngineTest.information("B")).plugin(analytics).build());
    FlowEngineTest.await(engine.next());
    assertEquals(Arrays.asList(25, 50), analytics.getReachedMilestones());

    // 1. abandoning the flow flushes and reinstalls the plugin
    FlowEngineTest.await(engine.reset());
    assertEquals(1, provider.count(AnalyticsEvent.FLOW_ABANDONED));
    assertEquals(1, provider.flushes.get());
    assertTrue(analytics.getReachedMilestones().isEmpty());
    assertEquals(2, provider.count(AnalyticsEvent.FLOW_STARTED));

    // 2. errors are tracked too
    FlowEngineTest.await(engine.skip());
    assertEquals(Code.STEP_NOT_SKIPPABLE.name(),
        provider.last(AnalyticsEvent.ERROR).getProperty("code"));
  }

  @Test
  public void testInvalidSettings() {
    try {
      new AnalyticsPlugin(Collections.<AnalyticsProvider>emptyList(), 10L);
      fail("a provider is required");
    } catch (IllegalArgumentException expected) {
      // expected
    }
    try {
      new AnalyticsPlugin(Arrays.<AnalyticsProvider>asList(new RecordingProvider("r")), 10L, 0);
      fail("milestones must be within 1..100");
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  private FlowEngine start(final FlowEngineConfiguration config) throws Exception {
    final FlowEngine engine = FlowEngineBuilder.newBuilder().config(config).build();
    engines.add(engine);
    FlowEngineTest.await(engine.ready());
    return engine;
  }

  static final class RecordingProvider implements AnalyticsProvider {
    private final String name;
    private final List<AnalyticsEvent> events = new ArrayList<>();
    private final AtomicInteger flushes = new AtomicInteger();

    RecordingProvider(final String name) {
      this.name = name;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public synchronized void trackEvent(final AnalyticsEvent event) {
      events.add(event);
    }

    @Override
    public void flush() {
      flushes.incrementAndGet();
    }

    synchronized int count(final String type) {
      int count = 0;
      for (final AnalyticsEvent event : events) {
        if (event.getType().equals(type)) {
          count++;
        }
      }
      return count;
    }

    synchronized AnalyticsEvent last(final String type) {
      AnalyticsEvent last = null;
      for (final AnalyticsEvent event : events) {
        if (event.getType().equals(type)) {
          last = event;
        }
      }
      return last;
    }
  }

  static final class FailingProvider implements AnalyticsProvider {
    @Override
    public String getName() {
      return "failing";
    }

    @Override
    public void trackEvent(final AnalyticsEvent event) throws Exception {
      throw new IllegalStateException("collector unreachable");
    }
  }
}
