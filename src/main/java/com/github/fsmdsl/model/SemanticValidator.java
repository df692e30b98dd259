package com.github.fsmdsl.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks the referential and structural integrity of a draft. Every check runs independently and
 * all findings are collected, so a draft with N independent defects yields at least N errors in a
 * single pass. Warnings never prevent a definition from being produced.
 *
 * The validator is stateless and may be shared across threads.
 */
public final class SemanticValidator {
  private static final Logger logger =
      LogManager.getLogger(SemanticValidator.class.getSimpleName());

  static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public ValidationResult validate(final FsmDraft draft) {
    if (draft == null) {
      throw new IllegalArgumentException("Draft cannot be null");
    }
    final List<Diagnostic> diagnostics = new ArrayList<>();
    final Map<String, State> states = firstById(draft.getStates());
    final Map<String, Choice> choices = new LinkedHashMap<>();
    for (final Choice choice : draft.getChoices()) {
      if (!choices.containsKey(choice.getId())) {
        choices.put(choice.getId(), choice);
      }
    }

    checkInitial(draft, states, choices, diagnostics);
    checkIdentifiers(draft, diagnostics);
    checkDuplicates(draft, diagnostics);
    checkTransitions(draft, states, choices, diagnostics);
    checkChoices(draft, states, choices, diagnostics);
    checkChoiceCycles(choices, diagnostics);
    checkCompletionCycles(draft, states, choices, diagnostics);
    checkTimers(draft, diagnostics);
    checkReachability(draft, diagnostics);
    checkShadowing(draft, states, diagnostics);

    boolean hasErrors = false;
    for (final Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        hasErrors = true;
        break;
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Validated fsm %s with %d diagnostics", draft.getName(),
          diagnostics.size()));
    }
    return new ValidationResult(hasErrors ? null : new FsmDefinition(draft), diagnostics);
  }

  private static Map<String, State> firstById(final List<State> declared) {
    final Map<String, State> byId = new LinkedHashMap<>();
    for (final State state : declared) {
      if (!byId.containsKey(state.getId())) {
        byId.put(state.getId(), state);
      }
    }
    return byId;
  }

  private void checkInitial(final FsmDraft draft, final Map<String, State> states,
      final Map<String, Choice> choices, final List<Diagnostic> diagnostics) {
    final List<Transition> initials = draft.getInitialTransitions();
    if (initials.isEmpty()) {
      diagnostics.add(new Diagnostic(DiagnosticCode.MISSING_INITIAL, draft.getName(),
          "fsm " + draft.getName() + " has no initial transition [*] --> <state>",
          draft.getPosition()));
      return;
    }
    for (int iter = 1; iter < initials.size(); iter++) {
      final Transition extra = initials.get(iter);
      diagnostics.add(new Diagnostic(DiagnosticCode.MULTIPLE_INITIAL, extra.getTarget(),
          "initial transition already declared to " + initials.get(0).getTarget(),
          extra.getPosition()));
    }
    final Transition initial = initials.get(0);
    if (!states.containsKey(initial.getTarget())) {
      final String reason = choices.containsKey(initial.getTarget()) ? " is a choice, not a state"
          : " is not a declared state";
      diagnostics.add(new Diagnostic(DiagnosticCode.INITIAL_NOT_STATE, initial.getTarget(),
          "initial target " + initial.getTarget() + reason, initial.getPosition()));
    }
  }

  private void checkIdentifiers(final FsmDraft draft, final List<Diagnostic> diagnostics) {
    for (final State state : draft.getStates()) {
      checkIdentifier(state.getId(), "state", state.getPosition(), diagnostics);
    }
    for (final Choice choice : draft.getChoices()) {
      checkIdentifier(choice.getId(), "choice", choice.getPosition(), diagnostics);
    }
    for (final Timer timer : draft.getTimers()) {
      checkIdentifier(timer.getId(), "timer", timer.getPosition(), diagnostics);
      checkIdentifier(timer.getEvent(), "event", timer.getPosition(), diagnostics);
    }
    for (final Transition transition : draft.getTransitions()) {
      if (transition.getEvent() != null) {
        checkIdentifier(transition.getEvent(), "event", transition.getPosition(), diagnostics);
      }
    }
  }

  private static void checkIdentifier(final String id, final String kind,
      final SourcePosition position, final List<Diagnostic> diagnostics) {
    if (id == null || !IDENTIFIER.matcher(id).matches()) {
      diagnostics.add(new Diagnostic(DiagnosticCode.INVALID_IDENTIFIER, id,
          kind + " identifier '" + id + "' must match " + IDENTIFIER.pattern(), position));
    }
  }

  private void checkDuplicates(final FsmDraft draft, final List<Diagnostic> diagnostics) {
    // states and choices share one namespace
    final Map<String, String> declared = new HashMap<>();
    for (final State state : draft.getStates()) {
      final String previous = declared.putIfAbsent(state.getId(), "state");
      if (previous != null) {
        diagnostics.add(new Diagnostic(DiagnosticCode.DUPLICATE_IDENTIFIER, state.getId(),
            "state " + state.getId() + " is already declared as a " + previous,
            state.getPosition()));
      }
    }
    for (final Choice choice : draft.getChoices()) {
      final String previous = declared.putIfAbsent(choice.getId(), "choice");
      if (previous != null) {
        diagnostics.add(new Diagnostic(DiagnosticCode.DUPLICATE_IDENTIFIER, choice.getId(),
            "choice " + choice.getId() + " is already declared as a " + previous,
            choice.getPosition()));
      }
    }
    final Set<String> timers = new HashSet<>();
    for (final Timer timer : draft.getTimers()) {
      if (!timers.add(timer.getId())) {
        diagnostics.add(new Diagnostic(DiagnosticCode.DUPLICATE_TIMER, timer.getId(),
            "timer " + timer.getId() + " is already declared", timer.getPosition()));
      }
    }
  }

  private void checkTransitions(final FsmDraft draft, final Map<String, State> states,
      final Map<String, Choice> choices, final List<Diagnostic> diagnostics) {
    for (final Transition transition : draft.getTransitions()) {
      final String source = transition.getSource();
      if (choices.containsKey(source) && !states.containsKey(source)) {
        diagnostics.add(new Diagnostic(DiagnosticCode.CHOICE_AS_SOURCE, source,
            "transition source " + source + " is a choice; declare its exits as choice branches",
            transition.getPosition()));
      } else if (!states.containsKey(source)) {
        diagnostics.add(new Diagnostic(DiagnosticCode.UNRESOLVED_SOURCE, source,
            "transition source " + source + " is not a declared state",
            transition.getPosition()));
      }
      final String target = transition.getTarget();
      if (!states.containsKey(target) && !choices.containsKey(target)) {
        diagnostics.add(new Diagnostic(DiagnosticCode.UNRESOLVED_TARGET, target,
            "transition target " + target + " is not a declared state or choice",
            transition.getPosition()));
      }
    }
  }

  private void checkChoices(final FsmDraft draft, final Map<String, State> states,
      final Map<String, Choice> choices, final List<Diagnostic> diagnostics) {
    for (final Choice choice : draft.getChoices()) {
      int defaults = 0;
      int conditioned = 0;
      for (final ChoiceBranch branch : choice.getBranches()) {
        if (branch.isDefault()) {
          defaults++;
          if (defaults > 1) {
            diagnostics.add(new Diagnostic(DiagnosticCode.CHOICE_MULTIPLE_ELSE, choice.getId(),
                "choice " + choice.getId() + " declares more than one [else] branch",
                branch.getPosition()));
          }
        } else {
          conditioned++;
        }
        final String target = branch.getTarget();
        if (!states.containsKey(target) && !choices.containsKey(target)) {
          diagnostics.add(new Diagnostic(DiagnosticCode.UNRESOLVED_TARGET, target,
              "choice " + choice.getId() + " branch target " + target
                  + " is not a declared state or choice",
              branch.getPosition()));
        }
      }
      if (defaults == 0) {
        diagnostics.add(new Diagnostic(DiagnosticCode.CHOICE_MISSING_ELSE, choice.getId(),
            "choice " + choice.getId() + " has no [else] branch", choice.getPosition()));
      }
      if (conditioned == 0) {
        diagnostics.add(new Diagnostic(DiagnosticCode.CHOICE_NO_CONDITION, choice.getId(),
            "choice " + choice.getId() + " has no conditioned branch", choice.getPosition()));
      }
    }
  }

  private void checkChoiceCycles(final Map<String, Choice> choices,
      final List<Diagnostic> diagnostics) {
    final Map<String, List<String>> edges = new LinkedHashMap<>();
    for (final Choice choice : choices.values()) {
      final List<String> next = new ArrayList<>();
      for (final ChoiceBranch branch : choice.getBranches()) {
        if (choices.containsKey(branch.getTarget())) {
          next.add(branch.getTarget());
        }
      }
      edges.put(choice.getId(), next);
    }
    for (final List<String> cycle : findCycles(edges)) {
      final String head = cycle.get(0);
      diagnostics.add(new Diagnostic(DiagnosticCode.CHOICE_CYCLE, head,
          "choice cycle " + String.join(" -> ", cycle), choices.get(head).getPosition()));
    }
  }

  /**
   * A state with an unguarded completion always leaves on its own. When every state such a chain
   * can land in, through choices included, is forced the same way, the chain never settles.
   */
  private void checkCompletionCycles(final FsmDraft draft, final Map<String, State> states,
      final Map<String, Choice> choices, final List<Diagnostic> diagnostics) {
    final Map<String, Set<String>> landings = new LinkedHashMap<>();
    for (final String stateId : states.keySet()) {
      landings.put(stateId, new LinkedHashSet<String>());
    }
    final Set<String> forced = new LinkedHashSet<>();
    for (final Transition transition : draft.getTransitions()) {
      final String source = transition.getSource();
      if (!transition.isCompletion() || !landings.containsKey(source) || forced.contains(source)) {
        continue;
      }
      landInto(transition.getTarget(), choices, landings.get(source), new HashSet<String>());
      if (!transition.isGuarded()) {
        forced.add(source);
      }
    }

    // shrink to the states whose every landing stays inside
    final Set<String> trapped = new LinkedHashSet<>(forced);
    boolean shrunk = true;
    while (shrunk) {
      shrunk = false;
      for (final Iterator<String> iter = trapped.iterator(); iter.hasNext();) {
        if (!trapped.containsAll(landings.get(iter.next()))) {
          iter.remove();
          shrunk = true;
        }
      }
    }

    final Map<String, List<String>> edges = new LinkedHashMap<>();
    for (final String stateId : trapped) {
      edges.put(stateId, new ArrayList<String>(landings.get(stateId)));
    }
    for (final List<String> cycle : findCycles(edges)) {
      final String head = cycle.get(0);
      diagnostics.add(new Diagnostic(DiagnosticCode.COMPLETION_CYCLE, head,
          "unguarded completion transitions loop forever: " + String.join(" -> ", cycle),
          states.get(head).getPosition()));
    }
  }

  // choices expand to every branch target; a choice without a default may stop, so it stays put
  private static void landInto(final String target, final Map<String, Choice> choices,
      final Set<String> into, final Set<String> seen) {
    final Choice choice = choices.get(target);
    if (choice == null) {
      into.add(target);
      return;
    }
    if (!seen.add(target)) {
      return;
    }
    if (choice.getDefaultBranch() == null) {
      into.add(target);
    }
    for (final ChoiceBranch branch : choice.getBranches()) {
      landInto(branch.getTarget(), choices, into, seen);
    }
  }

  /**
   * Depth-first search reporting each back edge once as a closed path, eg. [C1, C2, C1].
   */
  static List<List<String>> findCycles(final Map<String, List<String>> edges) {
    final List<List<String>> cycles = new ArrayList<>();
    final Set<String> done = new HashSet<>();
    for (final String start : edges.keySet()) {
      if (!done.contains(start)) {
        visit(start, edges, new ArrayList<String>(), done, cycles);
      }
    }
    return cycles;
  }

  private static void visit(final String node, final Map<String, List<String>> edges,
      final List<String> path, final Set<String> done, final List<List<String>> cycles) {
    path.add(node);
    for (final String next : edges.get(node)) {
      final int onPath = path.indexOf(next);
      if (onPath >= 0) {
        final List<String> cycle = new ArrayList<>(path.subList(onPath, path.size()));
        cycle.add(next);
        cycles.add(cycle);
      } else if (!done.contains(next)) {
        visit(next, edges, path, done, cycles);
      }
    }
    path.remove(path.size() - 1);
    done.add(node);
  }

  private void checkTimers(final FsmDraft draft, final List<Diagnostic> diagnostics) {
    final Set<String> timerIds = new HashSet<>();
    for (final Timer timer : draft.getTimers()) {
      timerIds.add(timer.getId());
      if (timer.getDuration() <= 0L) {
        diagnostics.add(new Diagnostic(DiagnosticCode.INVALID_TIMER_DURATION, timer.getId(),
            "timer " + timer.getId() + " duration must be positive, was " + timer.getDuration(),
            timer.getPosition()));
      }
    }

    final List<Action> actions = new ArrayList<>();
    for (final State state : draft.getStates()) {
      actions.addAll(state.getEntryActions());
      actions.addAll(state.getExitActions());
    }
    for (final Transition transition : draft.getTransitions()) {
      actions.addAll(transition.getActions());
    }
    for (final Choice choice : draft.getChoices()) {
      for (final ChoiceBranch branch : choice.getBranches()) {
        actions.addAll(branch.getActions());
      }
    }
    for (final Action action : actions) {
      final String timerId = action.getTimerId();
      if (timerId != null && !timerIds.contains(timerId)) {
        diagnostics.add(new Diagnostic(DiagnosticCode.UNKNOWN_TIMER, timerId,
            action.getText() + " refers to undeclared timer '" + timerId + "'",
            action.getPosition()));
      }
    }

    final Set<String> triggers = new HashSet<>();
    for (final Transition transition : draft.getTransitions()) {
      if (transition.getEvent() != null) {
        triggers.add(transition.getEvent());
      }
    }
    for (final Timer timer : draft.getTimers()) {
      if (!triggers.contains(timer.getEvent())) {
        diagnostics.add(new Diagnostic(DiagnosticCode.UNUSED_TIMER_EVENT, timer.getId(),
            "timer " + timer.getId() + " raises " + timer.getEvent()
                + " but no transition is triggered by it",
            timer.getPosition()));
      }
    }
  }

  private void checkReachability(final FsmDraft draft, final List<Diagnostic> diagnostics) {
    final Set<String> incoming = new HashSet<>();
    for (final Transition initial : draft.getInitialTransitions()) {
      incoming.add(initial.getTarget());
    }
    for (final Transition transition : draft.getTransitions()) {
      incoming.add(transition.getTarget());
    }
    for (final Choice choice : draft.getChoices()) {
      for (final ChoiceBranch branch : choice.getBranches()) {
        incoming.add(branch.getTarget());
      }
    }
    for (final State state : draft.getStates()) {
      if (!incoming.contains(state.getId())) {
        diagnostics.add(new Diagnostic(DiagnosticCode.UNREACHABLE_STATE, state.getId(),
            "state " + state.getId() + " has no incoming transition", state.getPosition()));
      }
    }
  }

  private void checkShadowing(final FsmDraft draft, final Map<String, State> states,
      final List<Diagnostic> diagnostics) {
    // K=source + event, V=guards seen so far; a null guard means an unguarded transition was seen
    final Map<String, Set<String>> seen = new HashMap<>();
    for (final Transition transition : draft.getTransitions()) {
      if (!states.containsKey(transition.getSource())) {
        continue;
      }
      final String key = transition.getSource() + "\u0000" + transition.getEvent();
      Set<String> guards = seen.get(key);
      if (guards == null) {
        guards = new HashSet<>();
        seen.put(key, guards);
      }
      final String trigger =
          transition.getEvent() == null ? "completion" : "event " + transition.getEvent();
      if (guards.contains(null)) {
        diagnostics.add(new Diagnostic(DiagnosticCode.SHADOWED_TRANSITION,
            transition.getSource(),
            transition.getSource() + " --> " + transition.getTarget() + " on " + trigger
                + " is never taken, an earlier unguarded transition always wins",
            transition.getPosition()));
      } else if (transition.isGuarded() && guards.contains(transition.getGuard())) {
        diagnostics.add(new Diagnostic(DiagnosticCode.SHADOWED_TRANSITION,
            transition.getSource(),
            transition.getSource() + " --> " + transition.getTarget() + " on " + trigger
                + " repeats guard [" + transition.getGuard() + "] of an earlier transition",
            transition.getPosition()));
      }
      guards.add(transition.getGuard());
    }
  }
}
