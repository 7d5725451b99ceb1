package com.github.flowengine;

/**
 * Typed key of an engine event. The constants below are the complete catalogue; the type parameter
 * is the payload handed to listeners.
 */
public final class EventType<E> {
  public static final EventType<EngineState> STATE_CHANGE =
      new EventType<>("stateChange", EngineState.class);
  public static final EventType<BeforeStepChangeEvent> BEFORE_STEP_CHANGE =
      new EventType<>("beforeStepChange", BeforeStepChangeEvent.class);
  public static final EventType<StepEvent> STEP_ACTIVE =
      new EventType<>("stepActive", StepEvent.class);
  public static final EventType<StepEvent> STEP_COMPLETED =
      new EventType<>("stepCompleted", StepEvent.class);
  public static final EventType<StepEvent> STEP_SKIPPED =
      new EventType<>("stepSkipped", StepEvent.class);
  public static final EventType<FlowLifecycleEvent> FLOW_STARTED =
      new EventType<>("flowStarted", FlowLifecycleEvent.class);
  public static final EventType<FlowLifecycleEvent> FLOW_COMPLETED =
      new EventType<>("flowCompleted", FlowLifecycleEvent.class);
  public static final EventType<FlowLifecycleEvent> FLOW_ABANDONED =
      new EventType<>("flowAbandoned", FlowLifecycleEvent.class);
  public static final EventType<NavigationEvent> NAVIGATION_BACK =
      new EventType<>("navigationBack", NavigationEvent.class);
  public static final EventType<NavigationEvent> NAVIGATION_FORWARD =
      new EventType<>("navigationForward", NavigationEvent.class);
  public static final EventType<NavigationEvent> NAVIGATION_JUMP =
      new EventType<>("navigationJump", NavigationEvent.class);
  public static final EventType<ContextUpdateEvent> CONTEXT_UPDATE =
      new EventType<>("contextUpdate", ContextUpdateEvent.class);
  public static final EventType<ChecklistEvent> CHECKLIST_ITEM_TOGGLED =
      new EventType<>("checklistItemToggled", ChecklistEvent.class);
  public static final EventType<ChecklistEvent> CHECKLIST_PROGRESS_CHANGED =
      new EventType<>("checklistProgressChanged", ChecklistEvent.class);
  public static final EventType<PersistenceEvent> PERSISTENCE_SUCCESS =
      new EventType<>("persistenceSuccess", PersistenceEvent.class);
  public static final EventType<PersistenceEvent> PERSISTENCE_FAILURE =
      new EventType<>("persistenceFailure", PersistenceEvent.class);
  public static final EventType<PluginEvent> PLUGIN_INSTALLED =
      new EventType<>("pluginInstalled", PluginEvent.class);
  public static final EventType<PluginEvent> PLUGIN_ERROR =
      new EventType<>("pluginError", PluginEvent.class);
  public static final EventType<ErrorRecord> ERROR = new EventType<>("error", ErrorRecord.class);

  private final String name;
  private final Class<E> payloadType;

  private EventType(final String name, final Class<E> payloadType) {
    this.name = name;
    this.payloadType = payloadType;
  }

  public String getName() {
    return name;
  }

  E cast(final Object payload) {
    return payloadType.cast(payload);
  }

  @Override
  public String toString() {
    return name;
  }
}
