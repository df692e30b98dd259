package com.github.fsmdsl.sim;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmdsl.FsmException.Code;
import com.github.fsmdsl.model.Action;
import com.github.fsmdsl.model.Choice;
import com.github.fsmdsl.model.ChoiceBranch;
import com.github.fsmdsl.model.FsmDefinition;
import com.github.fsmdsl.model.State;
import com.github.fsmdsl.model.Timer;
import com.github.fsmdsl.model.Transition;
import com.github.fsmdsl.runtime.ActionHandler;
import com.github.fsmdsl.runtime.DispatchOutcome;
import com.github.fsmdsl.runtime.GuardEvaluator;

/**
 * Run-to-completion interpreter for a validated {@link FsmDefinition}.
 *
 * Notes for users:<br>
 * 1. one owner is expected to drive {@link #load}, {@link #step} and {@link #tick} serially. These
 * take the engine write lock; {@link #snapshot} takes the read lock and may be called from any
 * thread, eg. a renderer.<br>
 *
 * 2. {@link #postEvent} never takes the lock, so events can be queued from any thread while a step
 * is in progress. They are processed in posting order, one per step.<br>
 *
 * 3. a step resolves its whole route (transition plus any chained choices) before executing
 * anything. It then runs exit actions of the old state, disarms the timers the old state owns, and
 * runs transition actions, branch actions and entry actions of the new state. Completion
 * transitions of the new state follow within the same step.<br>
 *
 * 4. time is logical. {@link #tick} advances the clock and expired timers post their events; it
 * does not step.<br>
 *
 * 5. guard and action exceptions never escape: a throwing guard counts as false, a throwing action
 * is logged and skipped.<br>
 */
public final class Simulator {
  private static final Logger logger = LogManager.getLogger(Simulator.class.getSimpleName());

  private final SimulatorConfiguration config;
  private final GuardEvaluator guardEvaluator;
  private final ActionHandler actionHandler;

  private final ReentrantReadWriteLock engineSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock engineWriteLock = engineSuperLock.writeLock();
  private final ReadLock engineReadLock = engineSuperLock.readLock();

  private final Deque<PendingEvent> pendingEvents = new ConcurrentLinkedDeque<>();
  private volatile EngineStatus status = EngineStatus.IDLE;

  // everything below is guarded by the engine lock
  private FsmDefinition definition;
  private String currentState;
  private long clock;
  private long traceSequence;
  private final Map<String, ArmedTimer> armedTimers = new HashMap<>();
  private final Deque<TraceEntry> trace = new ArrayDeque<>();
  private SimulatorStatistics statistics;

  public Simulator() {
    this(SimulatorConfiguration.defaults(), GuardTable.empty(), ActionHandler.NO_OP);
  }

  public Simulator(final GuardEvaluator guardEvaluator, final ActionHandler actionHandler) {
    this(SimulatorConfiguration.defaults(), guardEvaluator, actionHandler);
  }

  public Simulator(final SimulatorConfiguration config, final GuardEvaluator guardEvaluator,
      final ActionHandler actionHandler) {
    if (config == null || guardEvaluator == null || actionHandler == null) {
      throw new IllegalArgumentException(
          "Configuration, guard evaluator and action handler cannot be null");
    }
    this.config = config;
    this.guardEvaluator = guardEvaluator;
    this.actionHandler = actionHandler;
  }

  /**
   * Loads a definition, discarding whatever was loaded before, and enters its initial state.
   * Entry actions of the initial state and any completion transitions run here; no trace entry is
   * recorded.
   */
  public void load(final FsmDefinition definition) throws SimulationFault {
    if (definition == null) {
      throw new IllegalArgumentException("Definition cannot be null");
    }
    acquire(engineWriteLock, "load");
    try {
      final boolean reload = this.definition != null;
      status = EngineStatus.RUNNING;
      this.definition = definition;
      pendingEvents.clear();
      armedTimers.clear();
      trace.clear();
      clock = 0L;
      traceSequence = 0L;
      statistics = new SimulatorStatistics(definition.getName());
      currentState = definition.getInitialState();
      logInfo(reload ? "Reloaded, entering " + currentState : "Loaded, entering " + currentState);

      final List<String> executed = new ArrayList<>();
      final State initial = definition.getState(currentState);
      for (final Action action : initial.getEntryActions()) {
        execute(action, null, currentState, executed);
      }
      runCompletions(null, executed, new ArrayList<String>());
      logDebug("Load executed " + executed + ", now in " + currentState);
    } finally {
      status = EngineStatus.READY;
      engineWriteLock.unlock();
    }
  }

  public void postEvent(final String event) throws SimulationFault {
    postEvent(event, null);
  }

  /**
   * Appends an event to the tail of the pending queue.
   */
  public void postEvent(final String event, final Object payload) throws SimulationFault {
    if (event == null || event.isEmpty()) {
      throw new IllegalArgumentException("Event name cannot be null or empty");
    }
    machineLoaded();
    pendingEvents.add(new PendingEvent(event, payload));
  }

  /**
   * Processes the event at the head of the queue to completion.
   */
  public StepResult step() throws SimulationFault {
    machineLoaded();
    acquire(engineWriteLock, "step");
    try {
      final PendingEvent event = pendingEvents.poll();
      if (event == null) {
        return StepResult.noPendingEvent();
      }
      status = EngineStatus.RUNNING;
      statistics.totalSteps++;
      final String from = currentState;
      final List<String> path = new ArrayList<>();
      path.add(from);

      final Route route = select(event.name, event.payload);
      if (route == null) {
        statistics.totalUnmatched++;
        final TraceEntry entry = record(from, from, event.name,
            Collections.<String>emptyList(), DispatchOutcome.UNMATCHED, path);
        logDebug("Discarded unmatched event " + event.name + " in " + from);
        return new StepResult(DispatchOutcome.UNMATCHED, entry);
      }

      final List<String> executed = new ArrayList<>();
      perform(route, event.payload, executed, path);
      try {
        runCompletions(event.payload, executed, path);
      } catch (SimulationFault fault) {
        // the event is consumed and its actions ran, keep that in the trace
        statistics.totalTransitions++;
        record(from, currentState, event.name, executed, DispatchOutcome.TRANSITIONED, path);
        throw fault;
      }
      statistics.totalTransitions++;
      final TraceEntry entry =
          record(from, currentState, event.name, executed, DispatchOutcome.TRANSITIONED, path);
      logDebug("Processed " + entry);
      return new StepResult(DispatchOutcome.TRANSITIONED, entry);
    } finally {
      status = EngineStatus.READY;
      engineWriteLock.unlock();
    }
  }

  /**
   * Advances the logical clock by the given units. Every armed timer falling due within the window
   * posts its event, earliest first, ties in timer declaration order. Periodic timers re-arm and may
   * fire several times in one tick, up to the configured firing bound. The clock saturates at
   * {@code Long.MAX_VALUE}, the end of logical time; a timer falling due there never fires.
   */
  public void tick(final long units) throws SimulationFault {
    if (units < 0L) {
      throw new IllegalArgumentException("Tick units cannot be negative: " + units);
    }
    machineLoaded();
    acquire(engineWriteLock, "tick");
    try {
      final long until = saturatedAdd(clock, units);
      int firings = 0;
      ArmedTimer next;
      while ((next = nextDue(until)) != null) {
        if (firings >= config.getMaxTimerFiringsPerTick() && next.timer.isPeriodic()) {
          skipPeriods(next, until);
          continue;
        }
        clock = next.dueAt;
        pendingEvents.add(new PendingEvent(next.timer.getEvent(), null));
        statistics.totalTimerFirings++;
        firings++;
        if (next.timer.isPeriodic()) {
          next.dueAt = saturatedAdd(next.dueAt, next.timer.getDuration());
        } else {
          armedTimers.remove(next.timer.getId());
        }
        logDebug("Timer " + next.timer.getId() + " fired at " + clock + ", posted "
            + next.timer.getEvent());
      }
      clock = until;
    } finally {
      engineWriteLock.unlock();
    }
  }

  public SimulatorSnapshot snapshot() throws SimulationFault {
    acquire(engineReadLock, "snapshot");
    try {
      final List<String> pending = new ArrayList<>();
      for (final PendingEvent event : pendingEvents) {
        pending.add(event.name);
      }
      final List<String> armed = new ArrayList<>();
      if (definition != null) {
        for (final Timer timer : definition.getTimers()) {
          if (armedTimers.containsKey(timer.getId())) {
            armed.add(timer.getId());
          }
        }
      }
      return new SimulatorSnapshot(status, definition == null ? null : definition.getName(),
          currentState, pending, armed, clock, new ArrayList<>(trace));
    } finally {
      engineReadLock.unlock();
    }
  }

  /**
   * Current state id, null while idle.
   */
  public String getCurrentState() throws SimulationFault {
    acquire(engineReadLock, "getCurrentState");
    try {
      return currentState;
    } finally {
      engineReadLock.unlock();
    }
  }

  public EngineStatus getStatus() {
    return status;
  }

  /**
   * Copy of the counters gathered since the last load, null while idle.
   */
  public SimulatorStatistics getStatistics() throws SimulationFault {
    acquire(engineReadLock, "getStatistics");
    try {
      return statistics == null ? null : statistics.copy();
    } finally {
      engineReadLock.unlock();
    }
  }

  public SimulatorConfiguration getConfiguration() {
    return config;
  }

  private Route select(final String event, final Object payload) throws SimulationFault {
    for (final Transition transition : definition.transitionsFrom(currentState)) {
      if (!Objects.equals(transition.getEvent(), event)) {
        continue;
      }
      if (transition.isGuarded() && !evaluate(transition.getGuard(), payload)) {
        continue;
      }
      return resolve(transition, payload);
    }
    return null;
  }

  private Route resolve(final Transition transition, final Object payload) throws SimulationFault {
    final Route route = new Route(transition);
    String target = transition.getTarget();
    while (definition.isChoice(target)) {
      if (route.choices.size() >= config.getMaxChainLength()) {
        throw fault(Code.CHAIN_LIMIT_EXCEEDED, "Choice chain from " + currentState + " exceeded "
            + config.getMaxChainLength() + " choices at " + target);
      }
      final Choice choice = definition.getChoice(target);
      ChoiceBranch taken = null;
      for (final ChoiceBranch branch : choice.getConditionedBranches()) {
        if (evaluate(branch.getCondition(), payload)) {
          taken = branch;
          break;
        }
      }
      if (taken == null) {
        taken = choice.getDefaultBranch();
      }
      route.choices.add(target);
      route.branches.add(taken);
      target = taken.getTarget();
    }
    route.destination = target;
    return route;
  }

  private void perform(final Route route, final Object payload, final List<String> executed,
      final List<String> path) {
    final String from = currentState;
    final String to = route.destination;
    for (final Action action : definition.getState(from).getExitActions()) {
      execute(action, payload, to, executed);
    }
    disarmOwnedBy(from);
    for (final Action action : route.transition.getActions()) {
      execute(action, payload, to, executed);
    }
    for (final ChoiceBranch branch : route.branches) {
      for (final Action action : branch.getActions()) {
        execute(action, payload, to, executed);
      }
    }
    currentState = to;
    for (final Action action : definition.getState(to).getEntryActions()) {
      execute(action, payload, to, executed);
    }
    path.addAll(route.choices);
    path.add(to);
  }

  private void runCompletions(final Object payload, final List<String> executed,
      final List<String> path) throws SimulationFault {
    int completions = 0;
    Route route;
    while ((route = select(null, payload)) != null) {
      if (++completions > config.getMaxChainLength()) {
        throw fault(Code.CHAIN_LIMIT_EXCEEDED, "Completion transitions from " + currentState
            + " exceeded " + config.getMaxChainLength());
      }
      perform(route, payload, executed, path);
    }
  }

  private void execute(final Action action, final Object payload, final String owner,
      final List<String> executed) {
    if (action.isStartTimer()) {
      arm(action.getTimerId(), owner);
    } else if (action.isStopTimer()) {
      armedTimers.remove(action.getTimerId());
    }
    executed.add(action.getText());
    try {
      actionHandler.execute(action.getText(), payload);
    } catch (Exception problem) {
      statistics.totalActionFaults++;
      logWarning("Action " + action.getText() + " failed, continuing", problem);
    }
  }

  private boolean evaluate(final String guard, final Object payload) {
    try {
      return guardEvaluator.evaluate(guard, payload);
    } catch (Exception problem) {
      statistics.totalGuardFaults++;
      logWarning("Guard [" + guard + "] failed, treating as false", problem);
      return false;
    }
  }

  private void arm(final String timerId, final String owner) {
    final Timer timer = definition.getTimer(timerId);
    if (timer == null) {
      logWarning("Ignoring start of undeclared timer " + timerId, null);
      return;
    }
    armedTimers.put(timerId,
        new ArmedTimer(timer, saturatedAdd(clock, timer.getDuration()), owner));
  }

  private void disarmOwnedBy(final String state) {
    armedTimers.values().removeIf(armed -> armed.owner.equals(state));
  }

  private ArmedTimer nextDue(final long until) {
    ArmedTimer next = null;
    for (final Timer timer : definition.getTimers()) {
      final ArmedTimer armed = armedTimers.get(timer.getId());
      if (armed != null && armed.dueAt <= until && armed.dueAt != Long.MAX_VALUE
          && (next == null || armed.dueAt < next.dueAt)) {
        next = armed;
      }
    }
    return next;
  }

  /**
   * Moves a periodic timer to its first due time after until, dropping the periods in between.
   */
  private void skipPeriods(final ArmedTimer armed, final long until) {
    final long period = armed.timer.getDuration();
    final long skipped = (until - armed.dueAt) / period + 1L;
    armed.dueAt = saturatedAdd(armed.dueAt + (skipped - 1L) * period, period);
    statistics.totalSkippedFirings += skipped;
    logWarning("Timer " + armed.timer.getId() + " skipped " + skipped
        + " periods, tick reached " + config.getMaxTimerFiringsPerTick() + " firings", null);
  }

  // both operands are non-negative
  static long saturatedAdd(final long augend, final long addend) {
    final long sum = augend + addend;
    return sum < 0L ? Long.MAX_VALUE : sum;
  }

  private TraceEntry record(final String from, final String to, final String event,
      final List<String> actions, final DispatchOutcome outcome, final List<String> path) {
    final TraceEntry entry = new TraceEntry(++traceSequence, from, to, event, actions, outcome, path);
    trace.addLast(entry);
    while (trace.size() > config.getTraceRetention()) {
      trace.removeFirst();
    }
    return entry;
  }

  private void machineLoaded() throws SimulationFault {
    if (status == EngineStatus.IDLE) {
      throw new SimulationFault(Code.MACHINE_NOT_LOADED, "No machine loaded, call load() first");
    }
  }

  private void acquire(final Lock lock, final String operation)
      throws SimulationFault {
    try {
      if (!lock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        throw new SimulationFault(Code.LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to " + operation);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new SimulationFault(Code.INTERRUPTED, exception);
    }
  }

  private SimulationFault fault(final Code code, final String message) {
    logError(message);
    return new SimulationFault(code, message);
  }

  private String machineName() {
    return definition == null ? null : definition.getName();
  }

  private void logError(final String message) {
    logger.error(new StringBuilder().append("[m:").append(machineName()).append("] ")
        .append(message).toString());
  }

  private void logWarning(final String message, final Throwable error) {
    logger.warn(new StringBuilder().append("[m:").append(machineName()).append("] ")
        .append(message).toString(), error);
  }

  private void logInfo(final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineName()).append("] ")
        .append(message).toString());
  }

  private void logDebug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineName()).append("] ")
          .append(message).toString());
    }
  }

  private static final class PendingEvent {
    private final String name;
    private final Object payload;

    private PendingEvent(final String name, final Object payload) {
      this.name = name;
      this.payload = payload;
    }
  }

  private static final class ArmedTimer {
    private final Timer timer;
    private final String owner;
    private long dueAt;

    private ArmedTimer(final Timer timer, final long dueAt, final String owner) {
      this.timer = timer;
      this.dueAt = dueAt;
      this.owner = owner;
    }
  }

  // a resolved transition, choices chained through to the destination state
  private static final class Route {
    private final Transition transition;
    private final List<String> choices = new ArrayList<>();
    private final List<ChoiceBranch> branches = new ArrayList<>();
    private String destination;

    private Route(final Transition transition) {
      this.transition = transition;
    }
  }

}
