package com.github.flowengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.flowengine.FlowEngineException.Code;

/**
 * Tracks per-item completion of checklist steps. State lives in flowData under the step's data
 * key as a list of {@link ChecklistItemState}; maps with {@code id} and {@code isCompleted} keys,
 * as restored by persistence adapters, are read as well.
 */
final class ChecklistManager {
  private static final String OPERATION = "updateChecklistItem";

  private final FlowLogger logger;
  private final EventBus eventBus;
  private final ErrorHandler errorHandler;

  ChecklistManager(final FlowLogger logger, final EventBus eventBus,
      final ErrorHandler errorHandler) {
    this.logger = logger;
    this.eventBus = eventBus;
    this.errorHandler = errorHandler;
  }

  static boolean isChecklist(final Step step) {
    return step != null && step.getType() == StepType.CHECKLIST
        && step.getPayload() instanceof ChecklistPayload;
  }

  List<ChecklistItemState> getItemStates(final Step step, final FlowContext context) {
    final ChecklistPayload payload = (ChecklistPayload) step.getPayload();
    final Map<String, Boolean> stored = readStored(context.getFlowValue(payload.getDataKey()));
    final List<ChecklistItemState> states = new ArrayList<>(payload.getItems().size());
    for (final ChecklistItem item : payload.getItems()) {
      final Boolean completed = stored.get(item.getId());
      states.add(new ChecklistItemState(item.getId(), completed != null && completed));
    }
    return Collections.unmodifiableList(states);
  }

  ChecklistProgress getProgress(final Step step, final FlowContext context) {
    final ChecklistPayload payload = (ChecklistPayload) step.getPayload();
    final Map<String, Boolean> completion = new HashMap<>();
    for (final ChecklistItemState state : getItemStates(step, context)) {
      completion.put(state.getId(), state.isCompleted());
    }
    int total = 0;
    int completed = 0;
    boolean allMandatoryDone = true;
    for (final ChecklistItem item : payload.getItems()) {
      if (!item.isRelevant(context)) {
        continue;
      }
      total++;
      final boolean done = Boolean.TRUE.equals(completion.get(item.getId()));
      if (done) {
        completed++;
      } else if (item.isMandatory()) {
        allMandatoryDone = false;
      }
    }
    final Integer minItems = payload.getMinItemsToComplete();
    final boolean complete = minItems != null ? completed >= minItems : allMandatoryDone;
    return new ChecklistProgress(completed, total, complete);
  }

  boolean isComplete(final Step step, final FlowContext context) {
    return getProgress(step, context).isComplete();
  }

  /**
   * flowData entries a completed checklist step contributes to its completion data.
   */
  Map<String, Object> completionData(final Step step, final FlowContext context) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put(((ChecklistPayload) step.getPayload()).getDataKey(), getItemStates(step, context));
    return data;
  }

  /**
   * Toggle one item. Precondition violations are reported through the error handler and returned
   * as a failed result. On success the item state is written through the context update path, then
   * {@code checklistItemToggled} fires and, if the completion flag flipped,
   * {@code checklistProgressChanged}.
   */
  OperationResult<ChecklistProgress> updateChecklistItem(final Step step, final String stepId,
      final String itemId, final boolean completed, final ContextAccess access) {
    final FlowContext before = access.currentContext();
    if (step == null) {
      return errorHandler.fail(
          new FlowEngineException(Code.STEP_NOT_FOUND, "No step to toggle items on: " + stepId),
          OPERATION, before, stepId);
    }
    if (!isChecklist(step)) {
      return errorHandler.fail(new FlowEngineException(Code.CHECKLIST_STEP_INVALID,
          "Step " + step.getId() + " is of type " + step.getType()), OPERATION, before,
          step.getId());
    }
    final ChecklistPayload payload = (ChecklistPayload) step.getPayload();
    if (payload.findItem(itemId) == null) {
      return errorHandler.fail(new FlowEngineException(Code.CHECKLIST_ITEM_NOT_FOUND,
          "Item " + itemId + " not found on step " + step.getId()), OPERATION, before,
          step.getId());
    }

    final boolean wasComplete = isComplete(step, before);
    final List<ChecklistItemState> updated = new ArrayList<>();
    for (final ChecklistItemState state : getItemStates(step, before)) {
      updated.add(state.getId().equals(itemId) ? new ChecklistItemState(itemId, completed) : state);
    }
    access.applyContextPatch(
        ContextPatch.ofFlowData(payload.getDataKey(), Collections.unmodifiableList(updated)));

    final FlowContext after = access.currentContext();
    final ChecklistProgress progress = getProgress(step, after);
    logger.debug("Checklist " + step.getId() + " item " + itemId + " -> " + completed + ", "
        + progress);
    eventBus.publish(EventType.CHECKLIST_ITEM_TOGGLED,
        new ChecklistEvent(step, itemId, completed, progress, after));
    if (wasComplete != progress.isComplete()) {
      eventBus.publish(EventType.CHECKLIST_PROGRESS_CHANGED,
          new ChecklistEvent(step, itemId, completed, progress, after));
    }
    return OperationResult.success(progress);
  }

  private static Map<String, Boolean> readStored(final Object stored) {
    final Map<String, Boolean> completion = new HashMap<>();
    if (!(stored instanceof List)) {
      return completion;
    }
    for (final Object element : (List<?>) stored) {
      if (element instanceof ChecklistItemState) {
        final ChecklistItemState state = (ChecklistItemState) element;
        completion.put(state.getId(), state.isCompleted());
      } else if (element instanceof Map) {
        final Map<?, ?> raw = (Map<?, ?>) element;
        final Object id = raw.get("id");
        if (id != null) {
          completion.put(String.valueOf(id), Boolean.TRUE.equals(raw.get("isCompleted")));
        }
      }
    }
    return completion;
  }
}
