package com.github.flowengine;

import java.util.Collections;
import java.util.List;

/**
 * Extension point for code that reacts to engine events without modifying the engine. Plugins only
 * see the public {@link FlowEngine} surface: event listeners and the persistence hook setters.
 */
public interface FlowPlugin {

  /**
   * Unique within one engine.
   */
  String getName();

  String getVersion();

  /**
   * Names of plugins that must already be installed.
   */
  default List<String> getDependencies() {
    return Collections.emptyList();
  }

  PluginCleanup install(final FlowEngine engine) throws Exception;
}
