package com.github.flowengine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A partial context handed to {@link FlowEngine#updateContext(ContextPatch)}. Top-level entries
 * replace their counterparts, flowData entries replace their counterparts key by key. A
 * {@code currentUser} is applied only when explicitly set, so null can be used to clear it.
 */
public final class ContextPatch {
  private static final ContextPatch EMPTY = newBuilder().build();

  private final Map<String, Object> flowData;
  private final Map<String, Object> attributes;
  private final boolean currentUserSet;
  private final Object currentUser;

  private ContextPatch(final Map<String, Object> flowData, final Map<String, Object> attributes,
      final boolean currentUserSet, final Object currentUser) {
    this.flowData = Collections.unmodifiableMap(new LinkedHashMap<>(flowData));
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.currentUserSet = currentUserSet;
    this.currentUser = currentUser;
  }

  public static ContextPatch empty() {
    return EMPTY;
  }

  public static ContextPatch ofFlowData(final Map<String, ?> flowData) {
    return newBuilder().flowData(flowData).build();
  }

  public static ContextPatch ofFlowData(final String key, final Object value) {
    return newBuilder().flowData(key, value).build();
  }

  public Map<String, Object> getFlowData() {
    return flowData;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public boolean isCurrentUserSet() {
    return currentUserSet;
  }

  public Object getCurrentUser() {
    return currentUser;
  }

  public boolean isEmpty() {
    return flowData.isEmpty() && attributes.isEmpty() && !currentUserSet;
  }

  /**
   * Layer another patch on top of this one, the later patch winning per key.
   */
  public ContextPatch andThen(final ContextPatch next) {
    final Builder builder = newBuilder().flowData(flowData).attributes(attributes);
    if (currentUserSet) {
      builder.currentUser(currentUser);
    }
    builder.flowData(next.flowData).attributes(next.attributes);
    if (next.currentUserSet) {
      builder.currentUser(next.currentUser);
    }
    return builder.build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "ContextPatch [flowData=" + flowData + ", attributes=" + attributes
        + ", currentUserSet=" + currentUserSet + "]";
  }

  public final static class Builder {
    private final Map<String, Object> flowData = new LinkedHashMap<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private boolean currentUserSet;
    private Object currentUser;

    public Builder flowData(final String key, final Object value) {
      flowData.put(key, value);
      return this;
    }

    public Builder flowData(final Map<String, ?> values) {
      if (values != null) {
        flowData.putAll(values);
      }
      return this;
    }

    public Builder attribute(final String key, final Object value) {
      attributes.put(key, value);
      return this;
    }

    public Builder attributes(final Map<String, ?> values) {
      if (values != null) {
        attributes.putAll(values);
      }
      return this;
    }

    public Builder currentUser(final Object currentUser) {
      this.currentUserSet = true;
      this.currentUser = currentUser;
      return this;
    }

    public ContextPatch build() {
      return new ContextPatch(flowData, attributes, currentUserSet, currentUser);
    }

    private Builder() {}
  }
}
