package com.github.flowengine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.function.Predicate;

import org.junit.Test;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Tests to maintain the sanity and correctness of step resolution.
 */
public class NavigationResolverTest {
  private static final FlowLogger logger =
      new FlowLogger(NavigationResolverTest.class, "test-engine", "test-flow");

  private static final FlowContext emptyContext = FlowContext.initial(0L);

  @Test
  public void testSequenceNavigation() throws FlowEngineException {
    final Step a = step("A");
    final Step b = step("B");
    final Step c = step("C");
    final NavigationResolver resolver = resolver(a, b, c);

    assertEquals("B", next(resolver, a).getValue());
    assertEquals("C", next(resolver, b).getValue());
    // past the last step the flow completes
    final OperationResult<String> last = next(resolver, c);
    assertTrue(last.isSuccessful());
    assertNull(last.getValue());

    assertEquals("A",
        resolver.resolveTarget(b, NavigationDirection.PREVIOUS, emptyContext).getValue());
    assertNull(resolver.resolveTarget(a, NavigationDirection.PREVIOUS, emptyContext).getValue());
  }

  @Test
  public void testLiteralAndTerminalTargets() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep("C").build();
    final Step b = Step.newBuilder("B").type(StepType.INFORMATION)
        .nextStep(NavigationTarget.end()).build();
    final NavigationResolver resolver = resolver(a, b, step("C"));

    assertEquals("C", next(resolver, a).getValue());
    final OperationResult<String> terminal = next(resolver, b);
    assertTrue(terminal.isSuccessful());
    assertNull(terminal.getValue());
  }

  @Test
  public void testUnknownLiteralTargetFails() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep("missing").build();
    final OperationResult<String> result = next(resolver(a, step("B")), a);
    assertFalse(result.isSuccessful());
    assertEquals(Code.NAVIGATION_RESOLUTION_FAILURE, result.getError().getCode());
    assertEquals(ErrorKind.RESOLUTION, result.getError().getKind());
  }

  @Test
  public void testRouterNavigation() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.SINGLE_CHOICE)
        .nextStep(new FlowEngineTest.RoleRouter()).build();
    final NavigationResolver resolver = resolver(a, step("B"), step("C"));

    final FlowContext admin = emptyContext.merge(ContextPatch.ofFlowData("role", "admin"));
    assertEquals("B",
        resolver.resolveTarget(a, NavigationDirection.NEXT, admin).getValue());
    assertEquals("C", next(resolver, a).getValue());
  }

  @Test
  public void testRouterWithoutOpinionFallsBackToSequence() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep(new StepRouter() {
      @Override
      public NavigationTarget route(final FlowContext context) {
        return null;
      }
    }).build();
    assertEquals("B", next(resolver(a, step("B")), a).getValue());
  }

  @Test
  public void testFailingRouterIsResolutionError() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep(new StepRouter() {
      @Override
      public NavigationTarget route(final FlowContext context) {
        throw new IllegalStateException("no route");
      }
    }).build();
    final OperationResult<String> result = next(resolver(a, step("B")), a);
    assertFalse(result.isSuccessful());
    assertEquals(Code.NAVIGATION_RESOLUTION_FAILURE, result.getError().getCode());
  }

  @Test
  public void testIneligibleStepsArePassedOver() throws FlowEngineException {
    final Step b = Step.newBuilder("B").type(StepType.INFORMATION)
        .condition(new Never()).nextStep("D").build();
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep("B").build();
    final NavigationResolver resolver = resolver(a, b, step("C"), step("D"));

    // B is passed over by following its own nextStep
    assertEquals("D", next(resolver, a).getValue());
    // settle hands an ineligible target over the same way
    assertEquals("D", resolver.settle("B", emptyContext).getValue());
  }

  @Test
  public void testCircularNavigationDetected() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep("B").build();
    final Step b = Step.newBuilder("B").type(StepType.INFORMATION).condition(new Never())
        .nextStep("C").build();
    final Step c = Step.newBuilder("C").type(StepType.INFORMATION).condition(new Never())
        .nextStep("B").build();
    final OperationResult<String> result = next(resolver(a, b, c), a);
    assertFalse(result.isSuccessful());
    assertEquals(Code.NAVIGATION_RESOLUTION_FAILURE, result.getError().getCode());
  }

  @Test
  public void testSkipRequiresSkippableStep() throws FlowEngineException {
    final Step a = step("A");
    final Step b = Step.newBuilder("B").type(StepType.INFORMATION).skippable(true)
        .skipToStep("D").build();
    final NavigationResolver resolver = resolver(a, b, step("C"), step("D"));

    final OperationResult<String> refused =
        resolver.resolveTarget(a, NavigationDirection.SKIP, emptyContext);
    assertEquals(Code.STEP_NOT_SKIPPABLE, refused.getError().getCode());
    assertEquals(ErrorKind.PRECONDITION, refused.getError().getKind());
    assertEquals("D",
        resolver.resolveTarget(b, NavigationDirection.SKIP, emptyContext).getValue());
  }

  @Test
  public void testPreviousUsesHistory() throws FlowEngineException {
    final Step d = step("D");
    final NavigationResolver resolver = resolver(step("A"), step("B"), step("C"), d);
    // reached D by jumping from A
    assertEquals("A", resolver.resolveTarget(d, NavigationDirection.PREVIOUS, emptyContext,
        Arrays.asList("A")).getValue());
    assertEquals("C", resolver.resolveTarget(d, NavigationDirection.PREVIOUS, emptyContext,
        Collections.<String>emptyList()).getValue());
  }

  @Test
  public void testSettle() throws FlowEngineException {
    final NavigationResolver resolver = resolver(step("A"), step("B"));
    assertEquals("B", resolver.settle("B", emptyContext).getValue());
    assertNull(resolver.settle(null, emptyContext).getValue());
    assertEquals(Code.STEP_NOT_FOUND, resolver.settle("X", emptyContext).getError().getCode());
  }

  @Test
  public void testPreviewSwallowsFailures() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep("missing").build();
    final NavigationResolver resolver = resolver(a);
    assertNull(resolver.preview(a, NavigationDirection.NEXT, emptyContext,
        Collections.<String>emptyList()));
  }

  private static OperationResult<String> next(final NavigationResolver resolver,
      final Step step) {
    return resolver.resolveTarget(step, NavigationDirection.NEXT, emptyContext);
  }

  private static Step step(final String id) throws FlowEngineException {
    return FlowEngineTest.information(id);
  }

  private static NavigationResolver resolver(final Step... steps) {
    return new NavigationResolver(logger, new StepCatalog(Arrays.asList(steps)));
  }

  static final class Never implements Predicate<FlowContext> {
    @Override
    public boolean test(final FlowContext context) {
      return false;
    }
  }
}
