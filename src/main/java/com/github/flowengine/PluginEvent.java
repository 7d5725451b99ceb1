package com.github.flowengine;

/**
 * Payload of {@code pluginInstalled} and {@code pluginError}.
 */
public final class PluginEvent {
  private final String pluginName;
  private final String pluginVersion;
  private final FlowEngineException error;

  PluginEvent(final String pluginName, final String pluginVersion,
      final FlowEngineException error) {
    this.pluginName = pluginName;
    this.pluginVersion = pluginVersion;
    this.error = error;
  }

  public String getPluginName() {
    return pluginName;
  }

  public String getPluginVersion() {
    return pluginVersion;
  }

  public FlowEngineException getError() {
    return error;
  }

  @Override
  public String toString() {
    return "PluginEvent [pluginName=" + pluginName + ", pluginVersion=" + pluginVersion
        + ", error=" + error + "]";
  }
}
