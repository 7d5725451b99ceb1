package com.github.flowengine;

/**
 * Payload of {@code checklistItemToggled} and {@code checklistProgressChanged}. The item id and
 * flag describe the toggle that caused the event.
 */
public final class ChecklistEvent {
  private final Step step;
  private final String itemId;
  private final boolean itemCompleted;
  private final ChecklistProgress progress;
  private final FlowContext context;

  ChecklistEvent(final Step step, final String itemId, final boolean itemCompleted,
      final ChecklistProgress progress, final FlowContext context) {
    this.step = step;
    this.itemId = itemId;
    this.itemCompleted = itemCompleted;
    this.progress = progress;
    this.context = context;
  }

  public Step getStep() {
    return step;
  }

  public String getItemId() {
    return itemId;
  }

  public boolean isItemCompleted() {
    return itemCompleted;
  }

  public ChecklistProgress getProgress() {
    return progress;
  }

  public FlowContext getContext() {
    return context;
  }

  @Override
  public String toString() {
    return "ChecklistEvent [step=" + step.getId() + ", itemId=" + itemId + ", itemCompleted="
        + itemCompleted + ", progress=" + progress + "]";
  }
}
