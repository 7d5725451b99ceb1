package com.github.flowengine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of static flow validation.
 */
public class StepValidatorTest {
  private final StepValidator validator = new StepValidator();

  @Test
  public void testValidFlow() throws FlowEngineException {
    final StepValidator.Report report = validator.validate(
        Arrays.asList(step("A"), step("B"), step("C")), null);
    assertTrue(report.isValid());
    assertTrue(report.getWarnings().isEmpty());
  }

  @Test
  public void testStructuralErrors() throws FlowEngineException {
    assertFalse(validator.validate(Collections.<Step>emptyList(), null).isValid());

    final StepValidator.Report duplicates =
        validator.validate(Arrays.asList(step("A"), step("A")), null);
    assertEquals(1, duplicates.getErrors().size());

    final StepValidator.Report unknownInitial =
        validator.validate(Arrays.asList(step("A")), "Z");
    assertFalse(unknownInitial.isValid());
  }

  @Test
  public void testChecklistPayloadErrors() throws FlowEngineException {
    final Step noPayload = Step.newBuilder("list").type(StepType.CHECKLIST).build();
    assertFalse(validator.validate(Arrays.asList(noPayload), null).isValid());

    final Step tooDemanding = Step.newBuilder("list").type(StepType.CHECKLIST)
        .payload(new ChecklistPayload(Arrays.asList(new ChecklistItem("a", "A")), "items", 3))
        .build();
    assertFalse(validator.validate(Arrays.asList(tooDemanding), null).isValid());
  }

  @Test
  public void testCycleReportedOnce() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep("B").build();
    final Step b = Step.newBuilder("B").type(StepType.INFORMATION).nextStep("C").build();
    final Step c = Step.newBuilder("C").type(StepType.INFORMATION).nextStep("A").build();
    final StepValidator.Report report = validator.validate(Arrays.asList(a, b, c), null);
    assertFalse(report.isValid());
    assertEquals(1, report.getErrors().size());
  }

  @Test
  public void testWarnings() throws FlowEngineException {
    // 1. dangling reference and dropped skip target
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep("C")
        .skipToStep("ghost").build();
    final Step b = Step.newBuilder("B").type(StepType.INFORMATION).nextStep("ghost").build();
    final Step c = Step.newBuilder("C").type(StepType.INFORMATION).nextStep(NavigationTarget.end())
        .build();
    final StepValidator.Report report = validator.validate(Arrays.asList(a, b, c), null);
    assertTrue(report.isValid());
    // skipToStep dropped on A, ghost reference on B
    assertEquals(2, report.getWarnings().size());
  }

  @Test
  public void testUnreachableStep() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.INFORMATION).nextStep("C").build();
    final Step c = Step.newBuilder("C").type(StepType.INFORMATION).nextStep(NavigationTarget.end())
        .previousStep("A").build();
    final StepValidator.Report report =
        validator.validate(Arrays.asList(a, step("B"), c), null);
    assertTrue(report.isValid());
    assertEquals(1, report.getWarnings().size());
    assertTrue(report.getWarnings().get(0).contains("B"));
  }

  @Test
  public void testDynamicLinksDisableReachability() throws FlowEngineException {
    final Step a = Step.newBuilder("A").type(StepType.SINGLE_CHOICE)
        .nextStep(new FlowEngineTest.RoleRouter()).build();
    final Step b = Step.newBuilder("B").type(StepType.INFORMATION)
        .nextStep(NavigationTarget.end()).build();
    final StepValidator.Report report =
        validator.validate(Arrays.asList(a, b, step("C")), null);
    assertTrue(report.isValid());
    assertTrue(report.getWarnings().isEmpty());
  }

  private static Step step(final String id) throws FlowEngineException {
    return FlowEngineTest.information(id);
  }
}
