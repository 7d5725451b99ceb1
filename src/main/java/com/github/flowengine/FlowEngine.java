package com.github.flowengine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.github.flowengine.PersistenceHandlers.DataClearHandler;
import com.github.flowengine.PersistenceHandlers.DataLoadHandler;
import com.github.flowengine.PersistenceHandlers.DataPersistHandler;

/**
 * A headless engine for one multi-step guided flow: decides which step is current, routes between
 * steps, tracks collected data and serializes the side effects transitions trigger.
 * 
 * Notes for users:<br>
 * 1. this engine instance is thread-safe and has no thread affinity: any thread may call it<br>
 * 
 * 2. every call that changes something is queued and processed one at a time on the engine's own
 * operation thread. The returned future completes once the call was processed. Calls made from
 * inside an event listener or hook are queued behind the current one, so never block on their
 * futures from there<br>
 * 
 * 3. failures are reported through the {@link EventType#ERROR} event and the error history.
 * Returned futures only fail when the engine is errored or shut down<br>
 * 
 * 4. it is designed to not be singleton within a process, so, if there's a desire to have many
 * flows, just create as many engines as needed<br>
 * 
 * 5. steps and their hooks are intended to be stateless. All flow state is kept within the engine
 * and handed to hooks as an immutable {@link FlowContext}<br>
 * 
 * @author gaurav
 */
public interface FlowEngine {

  ///// Navigation API /////
  /**
   * Completes once the engine installed its plugins, loaded stored data and activated the first
   * step. A failed load still completes it, leaving the engine errored.
   */
  CompletableFuture<Void> ready();

  /**
   * Complete the current step and move to the next one, or complete the flow.
   */
  CompletableFuture<EngineState> next();

  /**
   * Merge the given step data into flowData, complete the current step and move on.
   */
  CompletableFuture<EngineState> next(final Map<String, Object> stepData);

  CompletableFuture<EngineState> previous();

  /**
   * Leave a skippable step without completing it. Skipping a non-skippable step is reported as a
   * precondition error and changes nothing.
   */
  CompletableFuture<EngineState> skip();

  CompletableFuture<EngineState> goToStep(final String stepId);

  CompletableFuture<EngineState> goToStep(final String stepId, final Map<String, Object> stepData);

  /**
   * Merge a partial context. Subscribers are only notified when the merge changed anything.
   */
  CompletableFuture<Void> updateContext(final ContextPatch patch);

  /**
   * Abandon the current flow, clear stored data and start over with the same configuration.
   */
  CompletableFuture<Void> reset();

  /**
   * Abandon the current flow, clear stored data and start over with a new configuration.
   */
  CompletableFuture<Void> reset(final FlowEngineConfiguration newConfiguration);

  /**
   * Report the current state, recomputed on every call.
   */
  EngineState getState();

  ///// Checklists /////
  CompletableFuture<Void> updateChecklistItem(final String itemId, final boolean completed);

  CompletableFuture<Void> updateChecklistItem(final String itemId, final boolean completed,
      final String stepId);

  /**
   * Progress of the current step's checklist, null when it is not a checklist step.
   */
  ChecklistProgress getChecklistProgress();

  ChecklistProgress getChecklistProgress(final String stepId);

  ///// Events, hooks and plugins /////
  <E> ListenerRegistration addEventListener(final EventType<E> type,
      final FlowEventListener<E> listener);

  void setDataLoadHandler(final DataLoadHandler loadHandler);

  void setDataPersistHandler(final DataPersistHandler persistHandler);

  void setClearPersistedDataHandler(final DataClearHandler clearHandler);

  CompletableFuture<Void> use(final FlowPlugin plugin);

  CompletableFuture<Void> uninstall(final String pluginName);

  boolean isPluginInstalled(final String pluginName);

  List<FlowPlugin> getInstalledPlugins();

  ///// Diagnostics and lifecycle /////
  /**
   * Reports the id of this engine instance.
   */
  String getId();

  FlowEngineConfiguration getConfiguration();

  List<ErrorRecord> getErrorHistory();

  FlowStatistics getFlowStatistics();

  QueueStatistics getQueueStatistics();

  /**
   * Completes once everything queued so far, and everything it queued in turn, was processed.
   */
  CompletableFuture<Void> awaitIdle();

  boolean alive();

  /**
   * Stop the operation thread, cancel pending calls and clean up plugins. Irreversible.
   */
  void shutdown();

  /**
   * A simple builder to let users use fluent APIs to build engines.
   */
  public final static class FlowEngineBuilder {
    private FlowEngineConfiguration config;
    private final List<FlowPlugin> plugins = new ArrayList<>();

    public static FlowEngineBuilder newBuilder() {
      return new FlowEngineBuilder();
    }

    public FlowEngineBuilder config(final FlowEngineConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Install a plugin in addition to the configured ones.
     */
    public FlowEngineBuilder plugin(final FlowPlugin plugin) {
      this.plugins.add(plugin);
      return this;
    }

    public FlowEngine build() throws FlowEngineException {
      if (config == null) {
        throw new FlowEngineException(FlowEngineException.Code.INVALID_ENGINE_CONFIG,
            "Configuration cannot be null");
      }
      FlowEngineConfiguration effective = config;
      if (!plugins.isEmpty()) {
        final FlowEngineConfiguration.FlowEngineConfigurationBuilder builder = config.toBuilder();
        for (final FlowPlugin plugin : plugins) {
          builder.plugin(plugin);
        }
        effective = builder.build();
      }
      return new FlowEngineImpl(effective);
    }

    private FlowEngineBuilder() {}
  }

}
