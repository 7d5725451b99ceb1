package com.github.flowengine;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Computes the step a transition leads to. A successful result carries the target step id, or
 * null when the flow has nowhere further to go in that direction.
 * 
 * Resolution order for a step's navigation field:<br>
 * 1. a literal id is used as is<br>
 * 2. a router is invoked with the current context; a thrown exception fails the resolution, a
 * null answer falls through to step order<br>
 * 3. an absent field falls back to the navigation history (backwards only) and then to step
 * order<br>
 * 
 * A candidate whose condition fails is passed over and resolution continues from it in the same
 * direction, until an eligible step is found or the steps run out. Revisiting a candidate while
 * doing so is reported as a cycle.
 * 
 * Resolution never mutates anything and reports nothing: failures are returned to the caller.
 */
final class NavigationResolver {
  private final FlowLogger logger;
  private final StepCatalog catalog;

  NavigationResolver(final FlowLogger logger, final StepCatalog catalog) {
    this.logger = logger;
    this.catalog = catalog;
  }

  OperationResult<String> resolveTarget(final Step step, final NavigationDirection direction,
      final FlowContext context) {
    return resolveTarget(step, direction, context, Collections.<String>emptyList());
  }

  /**
   * @param history ids of previously visited steps, oldest first, consulted for backward
   *        navigation when the step has no previousStep
   */
  OperationResult<String> resolveTarget(final Step step, final NavigationDirection direction,
      final FlowContext context, final List<String> history) {
    if (step == null) {
      return OperationResult.failure(Code.INVARIANT_VIOLATION, "No step to resolve from");
    }
    if (direction == NavigationDirection.SKIP && !step.isSkippable()) {
      return OperationResult.failure(Code.STEP_NOT_SKIPPABLE,
          "Step " + step.getId() + " is not skippable");
    }
    final Set<String> visited = new HashSet<>();
    visited.add(step.getId());
    return resolve(step, direction, context, history, visited);
  }

  /**
   * Settle an explicitly requested target, as used by goToStep and redirects: the id must exist,
   * and an ineligible target hands over to the step it would lead to next.
   */
  OperationResult<String> settle(final String targetId, final FlowContext context) {
    if (targetId == null) {
      return OperationResult.success(null);
    }
    final Step target = catalog.find(targetId);
    if (target == null) {
      return OperationResult.failure(Code.STEP_NOT_FOUND, "Unknown step id: " + targetId);
    }
    return accept(target, NavigationDirection.NEXT, context, Collections.<String>emptyList(),
        new HashSet<String>());
  }

  /**
   * Best-effort lookahead used for state snapshots. Failures yield null and are only logged.
   */
  Step preview(final Step step, final NavigationDirection direction, final FlowContext context,
      final List<String> history) {
    if (step == null || (direction == NavigationDirection.SKIP && !step.isSkippable())) {
      return null;
    }
    final OperationResult<String> resolved = resolveTarget(step, direction, context, history);
    if (!resolved.isSuccessful()) {
      logger.debug("Preview of " + direction + " from " + step.getId() + " failed: "
          + resolved.getDescription());
      return null;
    }
    return catalog.find(resolved.getValue());
  }

  private OperationResult<String> resolve(final Step from, final NavigationDirection direction,
      final FlowContext context, final List<String> history, final Set<String> visited) {
    final OperationResult<NavigationTarget> evaluated =
        evaluate(fieldFor(from, direction), from, context);
    if (!evaluated.isSuccessful()) {
      return evaluated.propagate();
    }
    final NavigationTarget target = evaluated.getValue();
    switch (target.getKind()) {
      case TERMINAL:
        return OperationResult.success(null);
      case LITERAL:
        final Step candidate = catalog.find(target.getStepId());
        if (candidate == null) {
          return OperationResult.failure(Code.NAVIGATION_RESOLUTION_FAILURE,
              "Step " + from.getId() + " navigates to unknown step " + target.getStepId());
        }
        return accept(candidate, direction, context, history, visited);
      case SEQUENCE:
        if (direction == NavigationDirection.PREVIOUS && !history.isEmpty()) {
          final OperationResult<String> fromHistory = fromHistory(from, context, history);
          if (!fromHistory.isSuccessful() || fromHistory.getValue() != null) {
            return fromHistory;
          }
        }
        return scanSequence(from, direction, context);
      default:
        return OperationResult.failure(Code.NAVIGATION_RESOLUTION_FAILURE,
            "Unresolvable navigation target " + target + " on step " + from.getId());
    }
  }

  private OperationResult<String> accept(final Step candidate, final NavigationDirection direction,
      final FlowContext context, final List<String> history, final Set<String> visited) {
    if (!visited.add(candidate.getId())) {
      return OperationResult.failure(Code.NAVIGATION_RESOLUTION_FAILURE,
          "Circular navigation detected at step " + candidate.getId());
    }
    final OperationResult<Boolean> eligible = isEligible(candidate, context);
    if (!eligible.isSuccessful()) {
      return eligible.propagate();
    }
    if (eligible.getValue()) {
      return OperationResult.success(candidate.getId());
    }
    logger.debug("Passing over ineligible step " + candidate.getId());
    return resolve(candidate, continuation(direction), context, Collections.<String>emptyList(),
        visited);
  }

  private OperationResult<NavigationTarget> evaluate(final NavigationTarget field, final Step from,
      final FlowContext context) {
    if (field == null) {
      return OperationResult.success(NavigationTarget.sequence());
    }
    if (field.getKind() != NavigationTarget.Kind.PREDICATE) {
      return OperationResult.success(field);
    }
    final NavigationTarget routed;
    try {
      routed = field.getRouter().route(context);
    } catch (RuntimeException routerFailure) {
      return OperationResult.failure(new FlowEngineException(Code.NAVIGATION_RESOLUTION_FAILURE,
          "Navigation router of step " + from.getId() + " failed", routerFailure));
    }
    if (routed == null) {
      return OperationResult.success(NavigationTarget.sequence());
    }
    if (routed.getKind() == NavigationTarget.Kind.PREDICATE) {
      return OperationResult.failure(Code.NAVIGATION_RESOLUTION_FAILURE,
          "Navigation router of step " + from.getId() + " returned another router");
    }
    return OperationResult.success(routed);
  }

  private OperationResult<String> fromHistory(final Step from, final FlowContext context,
      final List<String> history) {
    for (int index = history.size() - 1; index >= 0; index--) {
      final Step candidate = catalog.find(history.get(index));
      if (candidate == null || candidate.getId().equals(from.getId())) {
        continue;
      }
      final OperationResult<Boolean> eligible = isEligible(candidate, context);
      if (!eligible.isSuccessful()) {
        return eligible.propagate();
      }
      if (eligible.getValue()) {
        return OperationResult.success(candidate.getId());
      }
    }
    return OperationResult.success(null);
  }

  private OperationResult<String> scanSequence(final Step from,
      final NavigationDirection direction, final FlowContext context) {
    final int origin = catalog.indexOf(from.getId());
    if (origin < 0) {
      return OperationResult.failure(Code.INVARIANT_VIOLATION,
          "Step " + from.getId() + " is not part of the flow");
    }
    final int stride = direction == NavigationDirection.PREVIOUS ? -1 : 1;
    for (int index = origin + stride; index >= 0 && index < catalog.size(); index += stride) {
      final Step candidate = catalog.get(index);
      final OperationResult<Boolean> eligible = isEligible(candidate, context);
      if (!eligible.isSuccessful()) {
        return eligible.propagate();
      }
      if (eligible.getValue()) {
        return OperationResult.success(candidate.getId());
      }
    }
    return OperationResult.success(null);
  }

  private static OperationResult<Boolean> isEligible(final Step step, final FlowContext context) {
    try {
      return OperationResult.success(step.isEligible(context));
    } catch (RuntimeException conditionFailure) {
      return OperationResult.failure(new FlowEngineException(Code.NAVIGATION_RESOLUTION_FAILURE,
          "Condition of step " + step.getId() + " failed", conditionFailure));
    }
  }

  private static NavigationTarget fieldFor(final Step step, final NavigationDirection direction) {
    switch (direction) {
      case PREVIOUS:
        return step.getPreviousStep();
      case SKIP:
        return step.getSkipToStep() != null ? step.getSkipToStep() : step.getNextStep();
      default:
        return step.getNextStep();
    }
  }

  // direction used when passing over an ineligible candidate
  private static NavigationDirection continuation(final NavigationDirection direction) {
    return direction == NavigationDirection.PREVIOUS ? NavigationDirection.PREVIOUS
        : NavigationDirection.NEXT;
  }
}
