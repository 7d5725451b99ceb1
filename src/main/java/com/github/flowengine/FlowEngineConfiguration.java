package com.github.flowengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.flowengine.PersistenceHandlers.DataClearHandler;
import com.github.flowengine.PersistenceHandlers.DataLoadHandler;
import com.github.flowengine.PersistenceHandlers.DataPersistHandler;

/**
 * This class encapsulates everything a {@link FlowEngine} is wired with: the steps, the initial
 * context, persistence handlers, callbacks and plugins. Use the
 * {@code FlowEngineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. if no initial step is set, the flow starts at the first step<br>
 * 2. error history is bounded, at 50 entries unless configured otherwise<br>
 * 3. persist and clear calls are retried 3 times with a 100ms doubling backoff unless configured
 * otherwise<br>
 * 4. step validation errors fail the build; validation warnings are only logged<br>
 */
public final class FlowEngineConfiguration {
  private static final Logger logger =
      LogManager.getLogger(FlowEngineConfiguration.class.getSimpleName());

  private final String flowId;
  private final String flowName;
  private final String flowVersion;
  private final List<Step> steps;
  private final String initialStepId;
  private final ContextPatch initialContext;
  private final DataLoadHandler loadHandler;
  private final DataPersistHandler persistHandler;
  private final DataClearHandler clearHandler;
  private final FlowCompleteHook onFlowComplete;
  private final StepChangeCallback onStepChange;
  private final List<FlowPlugin> plugins;
  private final int errorHistorySize;
  private final RetryPolicy persistenceRetry;

  public String getFlowId() {
    return flowId;
  }

  public String getFlowName() {
    return flowName;
  }

  public String getFlowVersion() {
    return flowVersion;
  }

  public List<Step> getSteps() {
    return steps;
  }

  public String getInitialStepId() {
    return initialStepId;
  }

  /**
   * The configured initial step, or the first step when none was configured.
   */
  public String getEffectiveInitialStepId() {
    if (initialStepId != null) {
      return initialStepId;
    }
    return steps.isEmpty() ? null : steps.get(0).getId();
  }

  public ContextPatch getInitialContext() {
    return initialContext;
  }

  public DataLoadHandler getLoadHandler() {
    return loadHandler;
  }

  public DataPersistHandler getPersistHandler() {
    return persistHandler;
  }

  public DataClearHandler getClearHandler() {
    return clearHandler;
  }

  public FlowCompleteHook getOnFlowComplete() {
    return onFlowComplete;
  }

  public StepChangeCallback getOnStepChange() {
    return onStepChange;
  }

  public List<FlowPlugin> getPlugins() {
    return plugins;
  }

  public int getErrorHistorySize() {
    return errorHistorySize;
  }

  public RetryPolicy getPersistenceRetry() {
    return persistenceRetry;
  }

  /**
   * A builder pre-filled with this configuration, for deriving a replacement for reset().
   */
  public FlowEngineConfigurationBuilder toBuilder() {
    final FlowEngineConfigurationBuilder builder = FlowEngineConfigurationBuilder.newBuilder()
        .flowId(flowId).flowName(flowName).flowVersion(flowVersion).steps(steps)
        .initialStepId(initialStepId).initialContext(initialContext).loadHandler(loadHandler)
        .persistHandler(persistHandler).clearHandler(clearHandler).onFlowComplete(onFlowComplete)
        .onStepChange(onStepChange).errorHistorySize(errorHistorySize)
        .persistenceRetry(persistenceRetry);
    for (final FlowPlugin plugin : plugins) {
      builder.plugin(plugin);
    }
    return builder;
  }

  public final static class FlowEngineConfigurationBuilder {
    private String flowId;
    private String flowName;
    private String flowVersion;
    private final List<Step> steps = new ArrayList<>();
    private String initialStepId;
    private ContextPatch initialContext;
    private DataLoadHandler loadHandler;
    private DataPersistHandler persistHandler;
    private DataClearHandler clearHandler;
    private FlowCompleteHook onFlowComplete;
    private StepChangeCallback onStepChange;
    private final List<FlowPlugin> plugins = new ArrayList<>();
    private int errorHistorySize = ErrorHandler.DEFAULT_HISTORY_SIZE;
    private RetryPolicy persistenceRetry = RetryPolicy.defaultPolicy();

    public static FlowEngineConfigurationBuilder newBuilder() {
      return new FlowEngineConfigurationBuilder();
    }

    public FlowEngineConfigurationBuilder flowId(final String flowId) {
      this.flowId = flowId;
      return this;
    }

    public FlowEngineConfigurationBuilder flowName(final String flowName) {
      this.flowName = flowName;
      return this;
    }

    public FlowEngineConfigurationBuilder flowVersion(final String flowVersion) {
      this.flowVersion = flowVersion;
      return this;
    }

    public FlowEngineConfigurationBuilder step(final Step step) {
      this.steps.add(step);
      return this;
    }

    /**
     * Replaces any steps added so far.
     */
    public FlowEngineConfigurationBuilder steps(final List<Step> steps) {
      this.steps.clear();
      if (steps != null) {
        this.steps.addAll(steps);
      }
      return this;
    }

    public FlowEngineConfigurationBuilder initialStepId(final String initialStepId) {
      this.initialStepId = initialStepId;
      return this;
    }

    public FlowEngineConfigurationBuilder initialContext(final ContextPatch initialContext) {
      this.initialContext = initialContext;
      return this;
    }

    public FlowEngineConfigurationBuilder loadHandler(final DataLoadHandler loadHandler) {
      this.loadHandler = loadHandler;
      return this;
    }

    public FlowEngineConfigurationBuilder persistHandler(final DataPersistHandler persistHandler) {
      this.persistHandler = persistHandler;
      return this;
    }

    public FlowEngineConfigurationBuilder clearHandler(final DataClearHandler clearHandler) {
      this.clearHandler = clearHandler;
      return this;
    }

    public FlowEngineConfigurationBuilder onFlowComplete(final FlowCompleteHook onFlowComplete) {
      this.onFlowComplete = onFlowComplete;
      return this;
    }

    public FlowEngineConfigurationBuilder onStepChange(final StepChangeCallback onStepChange) {
      this.onStepChange = onStepChange;
      return this;
    }

    public FlowEngineConfigurationBuilder plugin(final FlowPlugin plugin) {
      this.plugins.add(plugin);
      return this;
    }

    public FlowEngineConfigurationBuilder errorHistorySize(final int errorHistorySize) {
      this.errorHistorySize = errorHistorySize;
      return this;
    }

    public FlowEngineConfigurationBuilder persistenceRetry(final RetryPolicy persistenceRetry) {
      this.persistenceRetry = persistenceRetry;
      return this;
    }

    public FlowEngineConfiguration build() throws FlowEngineException {
      final FlowEngineConfiguration config = new FlowEngineConfiguration(this);
      config.validate();
      return config;
    }

    private FlowEngineConfigurationBuilder() {}
  }

  private void validate() throws FlowEngineException {
    final StringBuilder messages = new StringBuilder();
    if (errorHistorySize <= 0) {
      messages.append("errorHistorySize must be positive. ");
    }
    for (final FlowPlugin plugin : plugins) {
      if (plugin == null || plugin.getName() == null) {
        messages.append("Plugins must be non-null and named. ");
        break;
      }
    }
    final StepValidator.Report report = new StepValidator().validate(steps, initialStepId);
    for (final String error : report.getErrors()) {
      messages.append(error).append(' ');
    }
    for (final String warning : report.getWarnings()) {
      logger.warn("Flow " + flowId + ": " + warning);
    }
    if (messages.length() > 0) {
      throw new FlowEngineException(FlowEngineException.Code.INVALID_ENGINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "FlowEngineConfiguration [flowId=" + flowId + ", flowName=" + flowName
        + ", flowVersion=" + flowVersion + ", steps=" + steps.size() + ", initialStepId="
        + initialStepId + ", plugins=" + plugins.size() + ", errorHistorySize=" + errorHistorySize
        + ", persistenceRetry=" + persistenceRetry + "]";
  }

  private FlowEngineConfiguration(final FlowEngineConfigurationBuilder builder) {
    this.flowId = builder.flowId;
    this.flowName = builder.flowName;
    this.flowVersion = builder.flowVersion;
    this.steps = Collections.unmodifiableList(new ArrayList<>(builder.steps));
    this.initialStepId = builder.initialStepId;
    this.initialContext =
        builder.initialContext == null ? ContextPatch.empty() : builder.initialContext;
    this.loadHandler = builder.loadHandler;
    this.persistHandler = builder.persistHandler;
    this.clearHandler = builder.clearHandler;
    this.onFlowComplete = builder.onFlowComplete;
    this.onStepChange = builder.onStepChange;
    this.plugins = Collections.unmodifiableList(new ArrayList<>(builder.plugins));
    this.errorHistorySize = builder.errorHistorySize;
    this.persistenceRetry =
        builder.persistenceRetry == null ? RetryPolicy.defaultPolicy() : builder.persistenceRetry;
  }

}
