package com.github.flowengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import com.github.flowengine.FlowEngineException.Code;
import com.github.flowengine.PersistenceHandlers.DataClearHandler;
import com.github.flowengine.PersistenceHandlers.DataLoadHandler;
import com.github.flowengine.PersistenceHandlers.DataPersistHandler;

/**
 * The flow engine: owns the context and current step, wires the resolver, queue, event bus, error
 * handler, checklist manager, persistence coordinator and plugin host, and exposes the navigation
 * API.
 *
 * Notes:<br>
 * 1. all mutating calls run as operations on the engine's {@link OperationQueue}, so there is at
 * most one in flight and every call sees a serializable view of the context<br>
 *
 * 2. engine fields are guarded by {@code stateLock}, which is never held while user code (hooks,
 * listeners, routers, handlers) runs<br>
 *
 * 3. reset() swaps in a fresh queue and bumps {@code generation}. Operations of the old generation
 * that are still running can no longer commit anything<br>
 *
 * 4. the status machine is NOT_READY -> READY <-> NAVIGATING -> COMPLETED, with ERRORED reachable
 * from anywhere on a fatal error and left only through reset()<br>
 *
 * @author gaurav
 */
final class FlowEngineImpl implements FlowEngine {
  private final String engineId = UUID.randomUUID().toString();
  private final FlowLogger logger;
  private final AtomicBoolean engineAlive = new AtomicBoolean();

  private final EventBus eventBus;
  private final ErrorHandler errorHandler;
  private final ChecklistManager checklists;
  private final PersistenceCoordinator persistence;
  private final PluginHost plugins;
  private final EngineStateCalculator stateCalculator;
  private final FlowStatistics flowStats;

  // generation of the engine operation running on the current worker, unset elsewhere
  private final ThreadLocal<Long> runningGeneration = new ThreadLocal<>();

  private final Object stateLock = new Object();

  // all guarded by stateLock
  private FlowEngineConfiguration configuration;
  private StepCatalog catalog;
  private NavigationResolver resolver;
  private FlowContext context;
  private Step currentStep;
  // ids of steps navigated away from, oldest first
  private final List<String> history = new ArrayList<>();
  private EngineStatus status = EngineStatus.NOT_READY;
  private boolean hydrating;
  private FlowEngineException lastError;
  private long generation;
  private OperationQueue queue;
  private CompletableFuture<Void> readyFuture;


  FlowEngineImpl(final FlowEngineConfiguration configuration) throws FlowEngineException {
    if (configuration == null) {
      throw new FlowEngineException(Code.INVALID_ENGINE_CONFIG, "Configuration cannot be null");
    }
    this.logger = new FlowLogger(FlowEngineImpl.class, engineId, configuration.getFlowId());
    logger.info("Firing up flow engine");
    this.eventBus = new EventBus(logger.forComponent(EventBus.class));
    this.errorHandler = new ErrorHandler(logger.forComponent(ErrorHandler.class), eventBus,
        configuration.getErrorHistorySize(), new ErrorHandler.ErrorSink() {
          @Override
          public boolean accept(final ErrorRecord record) {
            return recordError(record);
          }
        });
    this.checklists =
        new ChecklistManager(logger.forComponent(ChecklistManager.class), eventBus, errorHandler);
    this.persistence = new PersistenceCoordinator(logger.forComponent(PersistenceCoordinator.class),
        eventBus, errorHandler, configuration.getPersistenceRetry());
    this.plugins = new PluginHost(logger.forComponent(PluginHost.class), eventBus);
    this.stateCalculator = new EngineStateCalculator(logger);
    this.flowStats = new FlowStatistics(engineId);

    synchronized (stateLock) {
      applyConfiguration(configuration);
      context = buildInitialContext(configuration);
      queue = newQueue();
      final long initGeneration = generation;
      readyFuture = queue.enqueueUrgent(tracked(initGeneration, new QueuedOperation<Void>() {
        @Override
        public Void execute() throws Exception {
          return initialize(initGeneration);
        }
      }));
    }
    engineAlive.set(true);
  }

  ///// Navigation API /////

  @Override
  public CompletableFuture<Void> ready() {
    synchronized (stateLock) {
      return readyFuture;
    }
  }

  @Override
  public CompletableFuture<EngineState> next() {
    return next(null);
  }

  @Override
  public CompletableFuture<EngineState> next(final Map<String, Object> stepData) {
    return navigation(NavigationDirection.NEXT, null, stepData);
  }

  @Override
  public CompletableFuture<EngineState> previous() {
    return navigation(NavigationDirection.PREVIOUS, null, null);
  }

  @Override
  public CompletableFuture<EngineState> skip() {
    return navigation(NavigationDirection.SKIP, null, null);
  }

  @Override
  public CompletableFuture<EngineState> goToStep(final String stepId) {
    return goToStep(stepId, null);
  }

  @Override
  public CompletableFuture<EngineState> goToStep(final String stepId,
      final Map<String, Object> stepData) {
    return navigation(NavigationDirection.GOTO, stepId, stepData);
  }

  @Override
  public CompletableFuture<Void> updateContext(final ContextPatch patch) {
    return submit(new GenerationalOperation<Void>() {
      @Override
      public Void execute(final long operationGeneration) {
        applyContextPatch(operationGeneration, patch, true);
        return null;
      }
    });
  }

  @Override
  public CompletableFuture<Void> reset() {
    return reset(null);
  }

  @Override
  public CompletableFuture<Void> reset(final FlowEngineConfiguration newConfiguration) {
    if (!engineAlive.get()) {
      return shutDownFuture();
    }
    final OperationQueue staleQueue;
    final OperationQueue freshQueue;
    final Step abandonedAt;
    final FlowContext abandonedContext;
    final boolean inProgress;
    final long resetGeneration;
    final RetryPolicy retryPolicy;
    synchronized (stateLock) {
      staleQueue = queue;
      abandonedAt = currentStep;
      abandonedContext = context;
      inProgress = currentStep != null && status != EngineStatus.COMPLETED;
      resetGeneration = ++generation;
      if (newConfiguration != null) {
        applyConfiguration(newConfiguration);
      }
      retryPolicy = configuration.getPersistenceRetry();
      context = buildInitialContext(configuration);
      currentStep = null;
      history.clear();
      status = EngineStatus.NOT_READY;
      hydrating = false;
      lastError = null;
      queue = newQueue();
      freshQueue = queue;
    }
    staleQueue.shutdown();
    logger.info("Resetting flow engine" + (inProgress ? ", abandoning step " + abandonedAt.getId()
        : ""));
    if (inProgress) {
      eventBus.publish(EventType.FLOW_ABANDONED, new FlowLifecycleEvent(abandonedContext,
          abandonedAt.getId(), elapsedSince(abandonedContext)));
    }
    final int failedCleanups = plugins.cleanupAll();
    if (failedCleanups > 0) {
      logger.warn(failedCleanups + " plugin cleanups failed during reset");
    }

    // stored data is cleared with the handlers of the abandoned flow, before re-initialization
    freshQueue.enqueueUrgent(tracked(resetGeneration, new QueuedOperation<Void>() {
      @Override
      public Void execute() {
        persistence.clear(abandonedContext);
        persistence.clearHandlers();
        persistence.setRetryPolicy(retryPolicy);
        return null;
      }
    }));
    final CompletableFuture<Void> reinitialized =
        freshQueue.enqueue(tracked(resetGeneration, new QueuedOperation<Void>() {
          @Override
          public Void execute() throws Exception {
            return initialize(resetGeneration);
          }
        }));
    synchronized (stateLock) {
      if (generation == resetGeneration) {
        readyFuture = reinitialized;
      }
    }
    publishStateChange();
    return reinitialized;
  }

  @Override
  public EngineState getState() {
    final FlowEngineConfiguration config;
    final StepCatalog steps;
    final NavigationResolver navigation;
    final Step current;
    final FlowContext snapshot;
    final List<String> visited;
    final EngineStatus engineStatus;
    final boolean hydratingNow;
    final FlowEngineException error;
    final OperationQueue operations;
    synchronized (stateLock) {
      config = configuration;
      steps = catalog;
      navigation = resolver;
      current = currentStep;
      snapshot = context;
      visited = new ArrayList<>(history);
      engineStatus = status;
      hydratingNow = hydrating;
      error = lastError;
      operations = queue;
    }
    return stateCalculator.compute(config, steps, navigation, current, snapshot, visited,
        engineStatus, hydratingNow, error, operations.pendingCount());
  }

  ///// Checklists /////

  @Override
  public CompletableFuture<Void> updateChecklistItem(final String itemId,
      final boolean completed) {
    return updateChecklistItem(itemId, completed, null);
  }

  @Override
  public CompletableFuture<Void> updateChecklistItem(final String itemId, final boolean completed,
      final String stepId) {
    return submit(new GenerationalOperation<Void>() {
      @Override
      public Void execute(final long operationGeneration) throws FlowEngineException {
        final Step step;
        synchronized (stateLock) {
          if (isStale(operationGeneration)) {
            return null;
          }
          refuseWhenErrored();
          step = stepId != null ? catalog.find(stepId) : currentStep;
        }
        checklists.updateChecklistItem(step, stepId, itemId, completed,
            contextAccess(operationGeneration));
        return null;
      }
    });
  }

  @Override
  public ChecklistProgress getChecklistProgress() {
    return getChecklistProgress(null);
  }

  @Override
  public ChecklistProgress getChecklistProgress(final String stepId) {
    final Step step;
    final FlowContext snapshot;
    synchronized (stateLock) {
      step = stepId != null ? catalog.find(stepId) : currentStep;
      snapshot = context;
    }
    if (!ChecklistManager.isChecklist(step)) {
      return null;
    }
    return checklists.getProgress(step, snapshot);
  }

  ///// Events, hooks and plugins /////

  @Override
  public <E> ListenerRegistration addEventListener(final EventType<E> type,
      final FlowEventListener<E> listener) {
    return eventBus.subscribe(type, listener);
  }

  @Override
  public void setDataLoadHandler(final DataLoadHandler loadHandler) {
    persistence.setLoadHandler(loadHandler);
  }

  @Override
  public void setDataPersistHandler(final DataPersistHandler persistHandler) {
    persistence.setPersistHandler(persistHandler);
  }

  @Override
  public void setClearPersistedDataHandler(final DataClearHandler clearHandler) {
    persistence.setClearHandler(clearHandler);
  }

  @Override
  public CompletableFuture<Void> use(final FlowPlugin plugin) {
    return submit(new GenerationalOperation<Void>() {
      @Override
      public Void execute(final long operationGeneration) throws FlowEngineException {
        plugins.install(plugin, FlowEngineImpl.this);
        return null;
      }
    });
  }

  @Override
  public CompletableFuture<Void> uninstall(final String pluginName) {
    return submit(new GenerationalOperation<Void>() {
      @Override
      public Void execute(final long operationGeneration) throws FlowEngineException {
        plugins.uninstall(pluginName);
        return null;
      }
    });
  }

  @Override
  public boolean isPluginInstalled(final String pluginName) {
    return plugins.isInstalled(pluginName);
  }

  @Override
  public List<FlowPlugin> getInstalledPlugins() {
    return plugins.getInstalledPlugins();
  }

  ///// Diagnostics and lifecycle /////

  @Override
  public String getId() {
    return engineId;
  }

  @Override
  public FlowEngineConfiguration getConfiguration() {
    synchronized (stateLock) {
      return configuration;
    }
  }

  @Override
  public List<ErrorRecord> getErrorHistory() {
    return errorHandler.getErrorHistory();
  }

  @Override
  public FlowStatistics getFlowStatistics() {
    return flowStats;
  }

  @Override
  public QueueStatistics getQueueStatistics() {
    synchronized (stateLock) {
      return queue.getStatistics();
    }
  }

  @Override
  public CompletableFuture<Void> awaitIdle() {
    if (!engineAlive.get()) {
      return shutDownFuture();
    }
    synchronized (stateLock) {
      return queue.awaitIdle();
    }
  }

  @Override
  public boolean alive() {
    return engineAlive.get();
  }

  @Override
  public void shutdown() {
    if (!engineAlive.compareAndSet(true, false)) {
      logger.info("Flow engine is already shut down");
      return;
    }
    logger.info("Shutting down flow engine");
    final OperationQueue operations;
    synchronized (stateLock) {
      generation++;
      operations = queue;
    }
    // 1. stop the operation thread
    operations.shutdown();
    // 2. release plugins
    plugins.cleanupAll();
    // 3. print flow stats
    logger.info(flowStats.toString());
    // 4. drop listeners
    eventBus.clear();
    logger.info("Successfully shut down flow engine");
  }

  ///// Operations /////

  private Void initialize(final long initGeneration) throws FlowEngineException {
    final FlowEngineConfiguration config;
    synchronized (stateLock) {
      if (isStale(initGeneration)) {
        return null;
      }
      config = configuration;
      hydrating = true;
    }
    logger.info("Initializing " + config);

    // 1. plugins, which may install their own persistence handlers
    for (final FlowPlugin plugin : config.getPlugins()) {
      try {
        plugins.install(plugin, this);
      } catch (FlowEngineException installFailure) {
        synchronized (stateLock) {
          hydrating = false;
        }
        final FlowEngineException failure = installFailure.getCode() == Code.PLUGIN_FAILURE
            ? installFailure
            : new FlowEngineException(Code.PLUGIN_FAILURE,
                "Plugin " + plugin.getName() + " could not be installed", installFailure);
        errorHandler.report(failure, Code.PLUGIN_FAILURE, "installPlugin", context(), null);
        throw failure;
      }
    }

    // 2. configured handlers fill whatever plugins left unset
    persistence.setRetryPolicy(config.getPersistenceRetry());
    if (persistence.getLoadHandler() == null) {
      persistence.setLoadHandler(config.getLoadHandler());
    }
    if (persistence.getPersistHandler() == null) {
      persistence.setPersistHandler(config.getPersistHandler());
    }
    if (persistence.getClearHandler() == null) {
      persistence.setClearHandler(config.getClearHandler());
    }

    // 3. hydrate
    final OperationResult<LoadedData> loaded = persistence.load(context());
    String startStepId = config.getEffectiveInitialStepId();
    synchronized (stateLock) {
      if (isStale(initGeneration)) {
        return null;
      }
      hydrating = false;
      if (!loaded.isSuccessful()) {
        logger.warn("Flow engine could not hydrate and is errored until reset");
      } else if (loaded.getValue() != null) {
        final LoadedData data = loaded.getValue();
        context = restore(context, data);
        if (data.getCurrentStepId() != null) {
          if (catalog.contains(data.getCurrentStepId())) {
            startStepId = data.getCurrentStepId();
          } else {
            logger.warn("Stored step " + data.getCurrentStepId()
                + " no longer exists, starting at " + startStepId);
          }
        }
      }
    }
    if (!loaded.isSuccessful()) {
      publishStateChange();
      return null;
    }

    // 4. activate the first step
    final OperationResult<String> start = resolver().settle(startStepId, context());
    if (!start.isSuccessful()) {
      errorHandler.report(start.getError(), start.getError().getCode(), "initialize", context(),
          startStepId);
      publishStateChange();
      return null;
    }
    commit(initGeneration, null, start.getValue(), NavigationDirection.INITIAL);
    logger.info("Flow engine ready at step " + start.getValue());
    return null;
  }

  private CompletableFuture<EngineState> navigation(final NavigationDirection direction,
      final String requestedStepId, final Map<String, Object> stepData) {
    return submit(new GenerationalOperation<EngineState>() {
      @Override
      public EngineState execute(final long operationGeneration) throws FlowEngineException {
        return navigate(operationGeneration, direction, requestedStepId, stepData);
      }
    });
  }

  private EngineState navigate(final long navigationGeneration,
      final NavigationDirection direction, final String requestedStepId,
      final Map<String, Object> stepData) throws FlowEngineException {
    final Step from;
    final boolean proceed;
    synchronized (stateLock) {
      refuseWhenErrored();
      final boolean reopening =
          direction == NavigationDirection.GOTO && status == EngineStatus.COMPLETED;
      proceed = !isStale(navigationGeneration)
          && (reopening || (currentStep != null && status == EngineStatus.READY));
      from = currentStep;
      if (proceed) {
        status = EngineStatus.NAVIGATING;
        lastError = null;
      }
    }
    if (!proceed) {
      logger.debug("Ignoring " + direction + " outside of a navigable state");
      return getState();
    }
    final NavigationOutcome outcome = new NavigationOutcome();
    try {
      transition(navigationGeneration, direction, requestedStepId, stepData, from, outcome);
    } finally {
      synchronized (stateLock) {
        if (!isStale(navigationGeneration) && status == EngineStatus.NAVIGATING) {
          status = currentStep == null ? EngineStatus.COMPLETED : EngineStatus.READY;
        }
      }
      if (!outcome.committed && outcome.contextChanged) {
        publishStateChange();
        schedulePersist(navigationGeneration);
      }
    }
    return getState();
  }

  private static final class NavigationOutcome {
    private boolean committed;
    private boolean contextChanged;
  }

  private void transition(final long navigationGeneration, final NavigationDirection direction,
      final String requestedStepId, final Map<String, Object> stepData, final Step from,
      final NavigationOutcome outcome) {
    if (from != null && !catalog().contains(from.getId())) {
      errorHandler.report(new FlowEngineException(Code.INVARIANT_VIOLATION,
          "Current step " + from.getId() + " vanished from the step set"),
          Code.INVARIANT_VIOLATION, direction.name(), context(), from.getId());
      return;
    }
    final String fromId = from == null ? null : from.getId();
    final String operation = "navigate:" + direction;

    // 1. preconditions
    if (direction == NavigationDirection.NEXT && ChecklistManager.isChecklist(from)
        && !checklists.isComplete(from, context())) {
      errorHandler.fail(new FlowEngineException(Code.CHECKLIST_INCOMPLETE,
          "Checklist of step " + fromId + " is incomplete"), operation, context(), fromId);
      flowStats.recordFailure();
      return;
    }

    // 2. step data flows into flowData through the regular update path
    final Map<String, Object> completionData = new LinkedHashMap<>();
    if (stepData != null) {
      completionData.putAll(stepData);
    }
    if (direction == NavigationDirection.NEXT && ChecklistManager.isChecklist(from)) {
      completionData.putAll(checklists.completionData(from, context()));
    }
    if (!completionData.isEmpty()) {
      outcome.contextChanged = applyContextPatch(navigationGeneration,
          ContextPatch.ofFlowData(completionData), false);
    }

    // 3. resolve
    final OperationResult<String> resolved = direction == NavigationDirection.GOTO
        ? resolver().settle(requestedStepId, context())
        : resolver().resolveTarget(from, direction, context(), historySnapshot());
    if (!resolved.isSuccessful()) {
      errorHandler.fail(resolved.getError(), operation, context(), fromId);
      flowStats.recordFailure();
      return;
    }
    String targetId = resolved.getValue();
    if (direction == NavigationDirection.PREVIOUS && targetId == null) {
      logger.debug("No step before " + fromId);
      return;
    }

    // 4. before-navigation interception, fired once per attempt
    final BeforeStepChangeEvent beforeChange =
        new BeforeStepChangeEvent(from, targetId, direction, context());
    final OperationResult<BeforeStepChangeEvent> intercepted =
        eventBus.publishInterceptable(beforeChange);
    if (!intercepted.isSuccessful()) {
      errorHandler.fail(intercepted.getError(), operation, context(), fromId);
      flowStats.recordFailure();
      return;
    }
    if (beforeChange.isCancelled()) {
      logger.debug("Transition " + fromId + " -> " + targetId + " cancelled by listener");
      flowStats.recordCancellation();
      return;
    }
    if (beforeChange.isRedirected()) {
      final OperationResult<String> redirected =
          resolver().settle(beforeChange.getRedirectStepId(), context());
      if (!redirected.isSuccessful()) {
        errorHandler.fail(redirected.getError(), operation, context(), fromId);
        flowStats.recordFailure();
        return;
      }
      logger.debug("Transition " + fromId + " -> " + targetId + " redirected to "
          + redirected.getValue());
      targetId = redirected.getValue();
    }

    // 5. leave the current step
    if (direction == NavigationDirection.NEXT) {
      final StepCompleteHook onComplete = from.getOnStepComplete();
      if (onComplete != null) {
        final FlowContext hookContext = context();
        final boolean hookSucceeded = runHook(new Callable<Object>() {
          @Override
          public Object call() throws Exception {
            return AsyncSupport.await(
                onComplete.onStepComplete(Collections.unmodifiableMap(completionData),
                    hookContext));
          }
        }, "onStepComplete", fromId);
        if (!hookSucceeded) {
          flowStats.recordFailure();
          return;
        }
      }
      if (!markCompleted(navigationGeneration, from)) {
        return;
      }
      eventBus.publish(EventType.STEP_COMPLETED, new StepEvent(from, context(), completionData));
    } else if (direction == NavigationDirection.SKIP) {
      eventBus.publish(EventType.STEP_SKIPPED, new StepEvent(from, context(), null));
    }

    // 6. commit
    outcome.committed = commit(navigationGeneration, from, targetId, direction);
  }

  /**
   * Make the target current, or complete the flow when it is null, then run activation side
   * effects and notify. Returns false if the operation went stale.
   */
  private boolean commit(final long commitGeneration, final Step from, final String targetId,
      final NavigationDirection direction) {
    final long now = System.currentTimeMillis();
    final Step target;
    final FlowContext committedContext;
    final boolean freshStart;
    final FlowCompleteHook onFlowComplete;
    final StepChangeCallback onStepChange;
    synchronized (stateLock) {
      if (isStale(commitGeneration)) {
        return false;
      }
      target = catalog.find(targetId);
      if (from != null) {
        if (direction == NavigationDirection.PREVIOUS) {
          if (!history.isEmpty() && history.get(history.size() - 1).equals(targetId)) {
            history.remove(history.size() - 1);
          }
        } else {
          history.add(from.getId());
        }
      }
      freshStart = context.getInternals().getCompletedSteps().isEmpty();
      currentStep = target;
      if (target != null) {
        context = context.withInternals(context.getInternals().withStepStarted(target.getId(), now));
        if (status != EngineStatus.ERRORED) {
          status = EngineStatus.READY;
        }
      } else if (status != EngineStatus.ERRORED) {
        status = EngineStatus.COMPLETED;
      }
      committedContext = context;
      onFlowComplete = configuration.getOnFlowComplete();
      onStepChange = configuration.getOnStepChange();
    }
    flowStats.recordActivation(targetId);
    logger.debug("Committed " + direction + " " + (from == null ? null : from.getId()) + " -> "
        + targetId);

    if (from != null && target != null) {
      eventBus.publish(navigationEventType(direction),
          new NavigationEvent(from, target, direction, committedContext));
    }
    if (target != null) {
      final StepActiveHook onActive = target.getOnStepActive();
      if (onActive != null) {
        runHook(new Callable<Object>() {
          @Override
          public Object call() throws Exception {
            return AsyncSupport.await(onActive.onStepActive(committedContext));
          }
        }, "onStepActive", target.getId());
      }
      eventBus.publish(EventType.STEP_ACTIVE, new StepEvent(target, committedContext, null));
      if (direction == NavigationDirection.INITIAL && freshStart) {
        eventBus.publish(EventType.FLOW_STARTED,
            new FlowLifecycleEvent(committedContext, target.getId(), 0L));
      }
    } else {
      if (onFlowComplete != null) {
        runHook(new Callable<Object>() {
          @Override
          public Object call() throws Exception {
            return AsyncSupport.await(onFlowComplete.onFlowComplete(committedContext));
          }
        }, "onFlowComplete", null);
      }
      final long duration = elapsedSince(committedContext);
      logger.info("Flow completed in " + duration + "ms");
      eventBus.publish(EventType.FLOW_COMPLETED,
          new FlowLifecycleEvent(committedContext, null, duration));
    }
    if (onStepChange != null) {
      try {
        onStepChange.onStepChange(target, from, committedContext);
      } catch (RuntimeException callbackFailure) {
        errorHandler.report(callbackFailure, Code.HOOK_FAILURE, "onStepChange", committedContext,
            targetId);
      }
    }
    publishStateChange();
    if (direction != NavigationDirection.INITIAL) {
      schedulePersist(commitGeneration);
    }
    return true;
  }

  private boolean markCompleted(final long operationGeneration, final Step step) {
    synchronized (stateLock) {
      if (isStale(operationGeneration)) {
        return false;
      }
      context = context.withInternals(
          context.getInternals().withStepCompleted(step.getId(), System.currentTimeMillis()));
      return true;
    }
  }

  /**
   * The single path through which flowData and attributes change. Returns false when the merge is
   * structurally a no-op, in which case nobody is notified.
   */
  private boolean applyContextPatch(final long operationGeneration, final ContextPatch patch,
      final boolean notify) {
    final FlowContext before;
    final FlowContext after;
    synchronized (stateLock) {
      if (isStale(operationGeneration)) {
        return false;
      }
      before = context;
      after = before.merge(patch);
      if (before.equals(after)) {
        logger.debug("Context update is a no-op");
        return false;
      }
      context = after;
    }
    eventBus.publish(EventType.CONTEXT_UPDATE, new ContextUpdateEvent(before, after));
    if (notify) {
      publishStateChange();
      schedulePersist(operationGeneration);
    }
    return true;
  }

  /**
   * Queue a persist of whatever the state is once the operation runs. Skipped while hydrating or
   * without a persist handler.
   */
  private void schedulePersist(final long operationGeneration) {
    final OperationQueue operations;
    synchronized (stateLock) {
      if (isStale(operationGeneration) || hydrating || persistence.getPersistHandler() == null) {
        return;
      }
      operations = queue;
    }
    operations.enqueue(tracked(operationGeneration, new QueuedOperation<Void>() {
      @Override
      public Void execute() {
        final FlowContext snapshot;
        final String stepId;
        synchronized (stateLock) {
          if (isStale(operationGeneration)) {
            return null;
          }
          snapshot = context;
          stepId = currentStep == null ? null : currentStep.getId();
        }
        persistence.persist(snapshot, stepId);
        return null;
      }
    }), OperationQueue.PRIORITY_NORMAL);
  }

  private boolean runHook(final Callable<Object> hook, final String operation,
      final String stepId) {
    return errorHandler.safeExecute(hook, Code.HOOK_FAILURE, operation, context(), stepId)
        .isSuccessful();
  }

  private void publishStateChange() {
    eventBus.publish(EventType.STATE_CHANGE, getState());
  }

  /**
   * Accept an error into the engine, unless it comes from an operation of an abandoned generation.
   * Such an operation may still be unwinding on the retired worker after a reset.
   */
  private boolean recordError(final ErrorRecord record) {
    final boolean becameErrored;
    synchronized (stateLock) {
      final Long operationGeneration = runningGeneration.get();
      if (operationGeneration != null && isStale(operationGeneration)) {
        return false;
      }
      lastError = record.getError();
      becameErrored = record.getKind() == ErrorKind.FATAL && status != EngineStatus.ERRORED;
      if (becameErrored) {
        status = EngineStatus.ERRORED;
      }
    }
    if (becameErrored) {
      logger.error("Flow engine errored, navigation is refused until reset");
      publishStateChange();
    }
    return true;
  }

  ///// Helpers /////

  private interface GenerationalOperation<T> {
    T execute(final long operationGeneration) throws Exception;
  }

  private <T> CompletableFuture<T> submit(final GenerationalOperation<T> operation) {
    if (!engineAlive.get()) {
      return shutDownFuture();
    }
    final long operationGeneration;
    final OperationQueue operations;
    synchronized (stateLock) {
      operationGeneration = generation;
      operations = queue;
    }
    return operations.enqueue(tracked(operationGeneration, new QueuedOperation<T>() {
      @Override
      public T execute() throws Exception {
        return operation.execute(operationGeneration);
      }
    }));
  }

  /**
   * Mark the worker thread with the generation the operation belongs to while it runs.
   */
  private <T> QueuedOperation<T> tracked(final long operationGeneration,
      final QueuedOperation<T> operation) {
    return new QueuedOperation<T>() {
      @Override
      public T execute() throws Exception {
        runningGeneration.set(operationGeneration);
        try {
          return operation.execute();
        } finally {
          runningGeneration.remove();
        }
      }
    };
  }

  private ContextAccess contextAccess(final long operationGeneration) {
    return new ContextAccess() {
      @Override
      public FlowContext currentContext() {
        return context();
      }

      @Override
      public boolean applyContextPatch(final ContextPatch patch) {
        return FlowEngineImpl.this.applyContextPatch(operationGeneration, patch, true);
      }
    };
  }

  // caller holds stateLock
  private void refuseWhenErrored() throws FlowEngineException {
    if (status == EngineStatus.ERRORED) {
      throw new FlowEngineException(Code.ENGINE_ERRORED);
    }
  }

  // caller holds stateLock
  private boolean isStale(final long operationGeneration) {
    return operationGeneration != generation;
  }

  // caller holds stateLock
  private void applyConfiguration(final FlowEngineConfiguration newConfiguration) {
    configuration = newConfiguration;
    catalog = new StepCatalog(newConfiguration.getSteps());
    resolver = new NavigationResolver(logger.forComponent(NavigationResolver.class), catalog);
    logger.setFlowId(newConfiguration.getFlowId());
  }

  private static FlowContext buildInitialContext(final FlowEngineConfiguration config) {
    return FlowContext.initial(System.currentTimeMillis()).merge(config.getInitialContext());
  }

  private static FlowContext restore(final FlowContext base, final LoadedData data) {
    final FlowContext merged = base.merge(ContextPatch.newBuilder().flowData(data.getFlowData())
        .attributes(data.getAttributes()).build());
    final long startedAt = data.getStartedAt() != null ? data.getStartedAt()
        : base.getInternals().getStartedAt();
    return merged.withInternals(base.getInternals().absorb(FlowInternals.restore(startedAt,
        data.getCompletedSteps(), data.getStepStartTimes())));
  }

  private static EventType<NavigationEvent> navigationEventType(
      final NavigationDirection direction) {
    switch (direction) {
      case PREVIOUS:
        return EventType.NAVIGATION_BACK;
      case GOTO:
        return EventType.NAVIGATION_JUMP;
      default:
        return EventType.NAVIGATION_FORWARD;
    }
  }

  private static long elapsedSince(final FlowContext flowContext) {
    return System.currentTimeMillis() - flowContext.getInternals().getStartedAt();
  }

  private OperationQueue newQueue() {
    return new OperationQueue(logger.forComponent(OperationQueue.class),
        "flow-engine-" + engineId.substring(0, 8));
  }

  private FlowContext context() {
    synchronized (stateLock) {
      return context;
    }
  }

  private StepCatalog catalog() {
    synchronized (stateLock) {
      return catalog;
    }
  }

  private NavigationResolver resolver() {
    synchronized (stateLock) {
      return resolver;
    }
  }

  private List<String> historySnapshot() {
    synchronized (stateLock) {
      return new ArrayList<>(history);
    }
  }

  private static <T> CompletableFuture<T> shutDownFuture() {
    final CompletableFuture<T> future = new CompletableFuture<>();
    future.completeExceptionally(new FlowEngineException(Code.ENGINE_SHUT_DOWN));
    return future;
  }
}
