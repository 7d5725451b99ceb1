package com.github.flowengine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of context merging and equality.
 */
public class FlowContextTest {

  @Test
  public void testMergeKeepsUntouchedKeys() {
    final FlowContext base = FlowContext.initial(10L).merge(ContextPatch.newBuilder()
        .flowData("name", "Ada").flowData("age", 36).attribute("channel", "web").build());
    final FlowContext merged = base.merge(ContextPatch.newBuilder().flowData("age", 37)
        .attribute("locale", "en").currentUser("ada").build());

    assertEquals("Ada", merged.getFlowValue("name"));
    assertEquals(37, merged.getFlowValue("age"));
    assertEquals("web", merged.getAttribute("channel"));
    assertEquals("en", merged.getAttribute("locale"));
    assertEquals("ada", merged.getCurrentUser());
    assertEquals(10L, merged.getInternals().getStartedAt());
    // the original is untouched
    assertEquals(36, base.getFlowValue("age"));
  }

  @Test
  public void testEmptyPatchIsIdentity() {
    final FlowContext base = FlowContext.initial(0L);
    assertSame(base, base.merge(ContextPatch.empty()));
    assertSame(base, base.merge(null));
    assertTrue(ContextPatch.empty().isEmpty());
  }

  @Test
  public void testStructuralEquality() {
    final Map<String, Object> left = new LinkedHashMap<>();
    left.put("tags", new String[] {"a", "b"});
    left.put("scores", new int[] {1, 2});
    left.put("nested", Arrays.asList(Collections.singletonMap("k", "v")));
    final Map<String, Object> right = new LinkedHashMap<>();
    right.put("nested", Arrays.asList(Collections.singletonMap("k", "v")));
    right.put("scores", new int[] {1, 2});
    right.put("tags", new String[] {"a", "b"});

    final FlowContext first = FlowContext.initial(0L).merge(ContextPatch.ofFlowData(left));
    final FlowContext second = FlowContext.initial(0L).merge(ContextPatch.ofFlowData(right));
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());

    final FlowContext different =
        second.merge(ContextPatch.ofFlowData("scores", new int[] {1, 3}));
    assertNotEquals(first, different);
  }

  @Test
  public void testNestedArraysCompareByContent() {
    final Object left = new Object[] {Collections.singletonMap("ids", new long[] {7L, 8L}), "x"};
    final Object right = new Object[] {Collections.singletonMap("ids", new long[] {7L, 8L}), "x"};
    assertTrue(StructuralEquality.deepEquals(left, right));
    assertEquals(StructuralEquality.deepHashCode(left), StructuralEquality.deepHashCode(right));

    assertFalse(StructuralEquality.deepEquals(new int[] {1, 2}, new long[] {1L, 2L}));
    assertFalse(StructuralEquality.deepEquals(new Object[] {"x"}, Arrays.asList("x")));
    assertFalse(StructuralEquality.deepEquals(left,
        new Object[] {Collections.singletonMap("ids", new long[] {7L, 9L}), "x"}));
  }

  @Test
  public void testInternalsAreFirstWriteWins() {
    final FlowInternals internals =
        new FlowInternals(0L).withStepCompleted("A", 5L).withStepCompleted("A", 9L)
            .withStepStarted("B", 6L);
    assertEquals(Long.valueOf(5L), internals.getCompletedSteps().get("A"));
    assertTrue(internals.isStepCompleted("A"));
    assertFalse(internals.isStepCompleted("B"));

    final FlowInternals restored = FlowInternals.restore(-5L,
        Collections.singletonMap("A", 1L), Collections.singletonMap("C", 2L));
    final FlowInternals absorbed = internals.absorb(restored);
    assertEquals(-5L, absorbed.getStartedAt());
    assertEquals(Long.valueOf(5L), absorbed.getCompletedSteps().get("A"));
    assertEquals(Long.valueOf(2L), absorbed.getStepStartTimes().get("C"));
  }

  @Test
  public void testPatchLayering() {
    final ContextPatch layered = ContextPatch.ofFlowData("a", 1)
        .andThen(ContextPatch.newBuilder().flowData("a", 2).flowData("b", 3).build());
    assertEquals(2, layered.getFlowData().get("a"));
    assertEquals(3, layered.getFlowData().get("b"));
    assertFalse(layered.isCurrentUserSet());
  }
}
