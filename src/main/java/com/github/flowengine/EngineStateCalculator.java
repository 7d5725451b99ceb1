package com.github.flowengine;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives an {@link EngineState} from the engine's raw fields. Pure apart from invoking step
 * conditions and routers for the lookahead.
 */
final class EngineStateCalculator {
  private final FlowLogger logger;

  EngineStateCalculator(final FlowLogger logger) {
    this.logger = logger;
  }

  EngineState compute(final FlowEngineConfiguration configuration, final StepCatalog catalog,
      final NavigationResolver resolver, final Step currentStep, final FlowContext context,
      final List<String> history, final EngineStatus status, final boolean hydrating,
      final FlowEngineException error, final int pendingOperations) {
    final boolean errored = status == EngineStatus.ERRORED;
    final Step nextCandidate = currentStep == null ? null
        : resolver.preview(currentStep, NavigationDirection.NEXT, context, history);
    final Step previousCandidate = currentStep == null ? null
        : resolver.preview(currentStep, NavigationDirection.PREVIOUS, context, history);
    final boolean first = currentStep != null
        && currentStep.getId().equals(configuration.getEffectiveInitialStepId());

    final List<Step> relevant = new ArrayList<>();
    for (final Step step : catalog.getSteps()) {
      if (isRelevant(step, context)) {
        relevant.add(step);
      }
    }
    int completed = 0;
    for (final Step step : relevant) {
      if (context.getInternals().isStepCompleted(step.getId())) {
        completed++;
      }
    }
    final int currentNumber = currentStep == null ? 0 : relevant.indexOf(currentStep) + 1;

    return EngineState.newBuilder()
        .identity(configuration.getFlowId(), configuration.getFlowName(),
            configuration.getFlowVersion())
        .status(status).currentStep(currentStep).context(context)
        .loading(hydrating || status == EngineStatus.NAVIGATING).hydrating(hydrating)
        .completed(status == EngineStatus.COMPLETED).error(error).firstStep(first)
        .lastStep(currentStep != null && nextCandidate == null)
        .canGoNext(currentStep != null && nextCandidate != null && !errored)
        .canGoPrevious(currentStep != null && !first && previousCandidate != null && !errored)
        .skippable(currentStep != null && currentStep.isSkippable() && !errored)
        .candidates(nextCandidate, previousCandidate)
        .progress(relevant.size(), completed, currentNumber).pendingOperations(pendingOperations)
        .build();
  }

  private boolean isRelevant(final Step step, final FlowContext context) {
    try {
      return step.isEligible(context);
    } catch (RuntimeException conditionFailure) {
      logger.debug("Condition of step " + step.getId() + " failed while computing progress: "
          + conditionFailure.getMessage());
      return false;
    }
  }
}
