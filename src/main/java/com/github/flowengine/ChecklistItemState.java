package com.github.flowengine;

/**
 * Completion flag of one checklist item as stored in flowData.
 */
public final class ChecklistItemState {
  private final String id;
  private final boolean completed;

  public ChecklistItemState(final String id, final boolean completed) {
    this.id = id;
    this.completed = completed;
  }

  public String getId() {
    return id;
  }

  public boolean isCompleted() {
    return completed;
  }

  @Override
  public int hashCode() {
    return 31 * id.hashCode() + (completed ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final ChecklistItemState other = (ChecklistItemState) obj;
    return completed == other.completed && id.equals(other.id);
  }

  @Override
  public String toString() {
    return "ChecklistItemState [id=" + id + ", completed=" + completed + "]";
  }
}
