package com.github.flowengine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Convenience base for plugins. Listeners registered through {@link #on(EventType,
 * FlowEventListener)} are released automatically on cleanup, after {@link #onUninstall()} ran.
 */
public abstract class BasePlugin implements FlowPlugin {
  private final String name;
  private final String version;
  private final List<String> dependencies;
  private final List<ListenerRegistration> registrations = new ArrayList<>();
  private volatile FlowEngine engine;

  protected BasePlugin(final String name, final String version, final String... dependencies) {
    this.name = name;
    this.version = version;
    this.dependencies = Collections.unmodifiableList(Arrays.asList(dependencies));
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getVersion() {
    return version;
  }

  @Override
  public List<String> getDependencies() {
    return dependencies;
  }

  @Override
  public final PluginCleanup install(final FlowEngine engine) throws Exception {
    this.engine = engine;
    try {
      onInstall();
    } catch (Exception installFailure) {
      release();
      throw installFailure;
    }
    return new PluginCleanup() {
      @Override
      public void cleanup() throws Exception {
        try {
          onUninstall();
        } finally {
          release();
        }
      }
    };
  }

  protected abstract void onInstall() throws Exception;

  protected void onUninstall() throws Exception {}

  protected FlowEngine getEngine() {
    return engine;
  }

  protected <E> void on(final EventType<E> type, final FlowEventListener<E> listener) {
    final ListenerRegistration registration = engine.addEventListener(type, listener);
    synchronized (registrations) {
      registrations.add(registration);
    }
  }

  private void release() {
    synchronized (registrations) {
      for (final ListenerRegistration registration : registrations) {
        registration.unsubscribe();
      }
      registrations.clear();
    }
    engine = null;
  }
}
