package com.github.flowengine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of the shared flow state: collected {@code flowData}, the reserved
 * {@link FlowInternals} region, an optional current user and arbitrary caller attributes. Every
 * mutation produces a new instance. Equality is structural over the whole graph.
 */
public final class FlowContext {
  private final Map<String, Object> flowData;
  private final FlowInternals internals;
  private final Object currentUser;
  private final Map<String, Object> attributes;

  private FlowContext(final Map<String, Object> flowData, final FlowInternals internals,
      final Object currentUser, final Map<String, Object> attributes) {
    this.flowData = flowData;
    this.internals = internals;
    this.currentUser = currentUser;
    this.attributes = attributes;
  }

  static FlowContext initial(final long startedAt) {
    return new FlowContext(Collections.<String, Object>emptyMap(), new FlowInternals(startedAt),
        null, Collections.<String, Object>emptyMap());
  }

  public Map<String, Object> getFlowData() {
    return flowData;
  }

  public Object getFlowValue(final String key) {
    return flowData.get(key);
  }

  public FlowInternals getInternals() {
    return internals;
  }

  public Object getCurrentUser() {
    return currentUser;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public Object getAttribute(final String key) {
    return attributes.get(key);
  }

  /**
   * Apply a patch: attributes and the current user are replaced per key, flowData is merged one
   * level deeper, key by key. Values inside a flowData entry are replaced whole.
   */
  public FlowContext merge(final ContextPatch patch) {
    if (patch == null || patch.isEmpty()) {
      return this;
    }
    Map<String, Object> mergedFlowData = flowData;
    if (!patch.getFlowData().isEmpty()) {
      final Map<String, Object> copy = new LinkedHashMap<>(flowData);
      copy.putAll(patch.getFlowData());
      mergedFlowData = Collections.unmodifiableMap(copy);
    }
    Map<String, Object> mergedAttributes = attributes;
    if (!patch.getAttributes().isEmpty()) {
      final Map<String, Object> copy = new LinkedHashMap<>(attributes);
      copy.putAll(patch.getAttributes());
      mergedAttributes = Collections.unmodifiableMap(copy);
    }
    final Object mergedUser = patch.isCurrentUserSet() ? patch.getCurrentUser() : currentUser;
    return new FlowContext(mergedFlowData, internals, mergedUser, mergedAttributes);
  }

  FlowContext withInternals(final FlowInternals internals) {
    if (internals == this.internals) {
      return this;
    }
    return new FlowContext(flowData, internals, currentUser, attributes);
  }

  @Override
  public int hashCode() {
    int result = 1;
    result = 31 * result + StructuralEquality.deepHashCode(flowData);
    result = 31 * result + internals.hashCode();
    result = 31 * result + StructuralEquality.deepHashCode(currentUser);
    result = 31 * result + StructuralEquality.deepHashCode(attributes);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final FlowContext other = (FlowContext) obj;
    return internals.equals(other.internals)
        && StructuralEquality.deepEquals(flowData, other.flowData)
        && StructuralEquality.deepEquals(currentUser, other.currentUser)
        && StructuralEquality.deepEquals(attributes, other.attributes);
  }

  @Override
  public String toString() {
    return "FlowContext [flowData=" + flowData + ", internals=" + internals + ", attributes="
        + attributes + "]";
  }
}
