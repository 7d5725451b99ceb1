package com.github.flowengine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static checks over a step list. Errors make a configuration unusable, warnings are only worth
 * logging. Checks only follow literal links: routers cannot be evaluated without a context.
 */
final class StepValidator {
  static final int maxNavigationDepth = 100;

  static final class Report {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    List<String> getErrors() {
      return Collections.unmodifiableList(errors);
    }

    List<String> getWarnings() {
      return Collections.unmodifiableList(warnings);
    }

    boolean isValid() {
      return errors.isEmpty();
    }
  }

  Report validate(final List<Step> steps, final String initialStepId) {
    final Report report = new Report();
    if (steps == null || steps.isEmpty()) {
      report.errors.add("At least one step is required.");
      return report;
    }
    final Map<String, Step> byId = new HashMap<>();
    for (int index = 0; index < steps.size(); index++) {
      final Step step = steps.get(index);
      if (step == null || step.getId() == null) {
        report.errors.add("Step at position " + index + " has no id.");
        continue;
      }
      if (byId.put(step.getId(), step) != null) {
        report.errors.add("Duplicate step id " + step.getId() + ".");
      }
      validatePayload(step, report);
      if (step.isSkipToStepDropped()) {
        report.warnings.add("Step " + step.getId() + " has a skipToStep but is not skippable.");
      }
    }
    if (initialStepId != null && !byId.containsKey(initialStepId)) {
      report.errors.add("Initial step " + initialStepId + " is not among the steps.");
    }
    for (final Step step : byId.values()) {
      checkReference(step, "nextStep", step.getNextStep(), byId, report);
      checkReference(step, "previousStep", step.getPreviousStep(), byId, report);
      checkReference(step, "skipToStep", step.getSkipToStep(), byId, report);
    }
    detectCycles(byId, report);
    if (report.isValid()) {
      detectUnreachable(steps, initialStepId, byId, report);
    }
    return report;
  }

  private static void validatePayload(final Step step, final Report report) {
    if (step.getType() != StepType.CHECKLIST) {
      return;
    }
    if (!(step.getPayload() instanceof ChecklistPayload)) {
      report.errors.add("Checklist step " + step.getId() + " needs a ChecklistPayload.");
      return;
    }
    final ChecklistPayload payload = (ChecklistPayload) step.getPayload();
    if (payload.getDataKey() == null || payload.getDataKey().trim().isEmpty()) {
      report.errors.add("Checklist step " + step.getId() + " has no data key.");
    }
    if (payload.getItems().isEmpty()) {
      report.errors.add("Checklist step " + step.getId() + " has no items.");
    }
    final Set<String> itemIds = new HashSet<>();
    for (final ChecklistItem item : payload.getItems()) {
      if (item == null || item.getId() == null) {
        report.errors.add("Checklist step " + step.getId() + " has an item without id.");
      } else if (!itemIds.add(item.getId())) {
        report.errors.add(
            "Checklist step " + step.getId() + " has duplicate item id " + item.getId() + ".");
      }
    }
    final Integer minItems = payload.getMinItemsToComplete();
    if (minItems != null && (minItems < 0 || minItems > payload.getItems().size())) {
      report.errors.add("Checklist step " + step.getId() + " requires " + minItems
          + " items but defines " + payload.getItems().size() + ".");
    }
  }

  private static void checkReference(final Step step, final String field,
      final NavigationTarget target, final Map<String, Step> byId, final Report report) {
    if (target != null && target.getKind() == NavigationTarget.Kind.LITERAL
        && !byId.containsKey(target.getStepId())) {
      report.warnings.add("Step " + step.getId() + " " + field + " references unknown step "
          + target.getStepId() + ".");
    }
  }

  // follows literal nextStep links only; dynamic links may legitimately loop
  private static void detectCycles(final Map<String, Step> byId, final Report report) {
    final Set<String> reported = new HashSet<>();
    for (final Step start : byId.values()) {
      final Set<String> path = new LinkedHashSet<>();
      Step current = start;
      int depth = 0;
      while (current != null && depth < maxNavigationDepth) {
        if (!path.add(current.getId())) {
          if (!reported.contains(current.getId())) {
            final List<String> cycle = new ArrayList<>(path);
            final List<String> members = cycle.subList(cycle.indexOf(current.getId()), cycle.size());
            reported.addAll(members);
            report.errors.add("Circular nextStep navigation through " + members + ".");
          }
          break;
        }
        final NavigationTarget next = current.getNextStep();
        if (next == null || next.getKind() != NavigationTarget.Kind.LITERAL) {
          break;
        }
        current = byId.get(next.getStepId());
        depth++;
      }
    }
  }

  private static void detectUnreachable(final List<Step> steps, final String initialStepId,
      final Map<String, Step> byId, final Report report) {
    // any dynamic link could reach anything
    for (final Step step : steps) {
      if (isDynamic(step.getNextStep()) || isDynamic(step.getPreviousStep())
          || isDynamic(step.getSkipToStep())) {
        return;
      }
    }
    final String start = initialStepId != null ? initialStepId : steps.get(0).getId();
    final Set<String> reached = new HashSet<>();
    final Deque<String> frontier = new ArrayDeque<>();
    frontier.add(start);
    while (!frontier.isEmpty()) {
      final String id = frontier.poll();
      if (!reached.add(id)) {
        continue;
      }
      final Step step = byId.get(id);
      if (step == null) {
        continue;
      }
      final int position = steps.indexOf(step);
      addLiteral(step.getNextStep(), frontier);
      addLiteral(step.getSkipToStep(), frontier);
      addLiteral(step.getPreviousStep(), frontier);
      if (followsSequence(step.getNextStep())) {
        addNeighbours(steps, position, 1, frontier);
      }
      if (followsSequence(step.getPreviousStep())) {
        addNeighbours(steps, position, -1, frontier);
      }
    }
    for (final Step step : steps) {
      if (!reached.contains(step.getId())) {
        report.warnings.add("Step " + step.getId() + " is unreachable from " + start + ".");
      }
    }
  }

  private static void addLiteral(final NavigationTarget target, final Deque<String> frontier) {
    if (target != null && target.getKind() == NavigationTarget.Kind.LITERAL) {
      frontier.add(target.getStepId());
    }
  }

  private static boolean followsSequence(final NavigationTarget target) {
    return target == null || target.getKind() == NavigationTarget.Kind.SEQUENCE;
  }

  // a conditional neighbour may be passed over, so keep going until an unconditional one
  private static void addNeighbours(final List<Step> steps, final int position, final int stride,
      final Deque<String> frontier) {
    for (int index = position + stride; index >= 0 && index < steps.size(); index += stride) {
      frontier.add(steps.get(index).getId());
      if (steps.get(index).getCondition() == null) {
        break;
      }
    }
  }

  private static boolean isDynamic(final NavigationTarget target) {
    return target != null && target.getKind() == NavigationTarget.Kind.PREDICATE;
  }
}
