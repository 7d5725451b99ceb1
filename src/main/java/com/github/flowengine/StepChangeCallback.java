package com.github.flowengine;

/**
 * Invoked after every committed change of the current step. The new step is null once the flow
 * completed, the old step is null for the initial activation.
 */
@FunctionalInterface
public interface StepChangeCallback {
  void onStepChange(final Step newStep, final Step oldStep, final FlowContext context);
}
