package com.github.fsmdsl.codegen;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.fsmdsl.FsmException.Code;
import com.github.fsmdsl.model.Action;
import com.github.fsmdsl.model.Choice;
import com.github.fsmdsl.model.ChoiceBranch;
import com.github.fsmdsl.model.State;
import com.github.fsmdsl.model.Timer;
import com.github.fsmdsl.model.Transition;

/**
 * Renders a {@link DispatchTable} as one Java class implementing
 * {@link com.github.fsmdsl.runtime.GeneratedMachine}. The class body lives in a template; this
 * emitter only produces the constants and the static tables.
 */
final class StandardJavaEmitter {
  static final String TEMPLATE = "/templates/standard/Machine.java.tmpl";
  private static final String INDENT = "    ";
  private static final String CONTINUATION = "        ";

  private final SourceTemplate template;

  StandardJavaEmitter(final SourceTemplate template) {
    this.template = template;
  }

  String emit(final DispatchTable table, final GeneratorOptions options) throws CodegenException {
    final Map<String, String> values = new HashMap<>();
    values.put("packageDeclaration", options.getPackageName().isEmpty() ? ""
        : "package " + options.getPackageName() + ";\n\n");
    values.put("machineName", table.getMachineName());
    values.put("className", className(table, options));
    values.put("maxChain", String.valueOf(options.getMaxChainLength()));
    values.put("maxFiringsPerTick", String.valueOf(options.getMaxTimerFiringsPerTick()));
    values.put("initialState", table.getInitialState());

    final List<String> states = new ArrayList<>();
    for (final State state : table.getStates()) {
      states.add(state.getId());
    }
    values.put("stateConstants", join(states));
    final List<String> choices = new ArrayList<>();
    for (final Choice choice : table.getChoices()) {
      choices.add(choice.getId());
    }
    values.put("choiceConstants", join(choices));
    values.put("eventConstants", join(table.getEvents()));

    final List<String> timers = new ArrayList<>();
    final List<String> durations = new ArrayList<>();
    final List<String> periodic = new ArrayList<>();
    final List<String> events = new ArrayList<>();
    for (final Timer timer : table.getTimers()) {
      timers.add(timer.getId());
      durations.add(timer.getDuration() + "L");
      periodic.add(String.valueOf(timer.isPeriodic()));
      events.add(JavaNames.literal(timer.getEvent()));
    }
    values.put("timerConstants", join(timers));
    values.put("timerDurations", join(durations));
    values.put("timerPeriodic", join(periodic));
    values.put("timerEvents", join(events));
    values.put("tables", tables(table));
    return template.render(values);
  }

  static String className(final DispatchTable table, final GeneratorOptions options)
      throws CodegenException {
    if (options.getClassName() != null) {
      return options.getClassName();
    }
    final String name = table.getMachineName();
    final String className = Character.toUpperCase(name.charAt(0)) + name.substring(1) + "Machine";
    if (JavaNames.isReservedTypeName(className)) {
      throw new CodegenException(Code.UNRENDERABLE_CONSTRUCT, name, "Machine name " + name
          + " yields class name " + className + ", which the generated code already declares");
    }
    return className;
  }

  private static String tables(final DispatchTable table) {
    final StringBuilder out = new StringBuilder();
    for (final State state : table.getStates()) {
      final String index = "[State." + state.getId() + ".ordinal()]";
      out.append(INDENT).append("ENTRY").append(index).append(" = ")
          .append(actions(state.getEntryActions())).append(";\n");
      out.append(INDENT).append("EXIT").append(index).append(" = ")
          .append(actions(state.getExitActions())).append(";\n");
      final List<String> rows = new ArrayList<>();
      for (final Transition row : table.getRows(state.getId())) {
        rows.add("new Row(" + (row.isCompletion() ? "null" : "Event." + row.getEvent()) + ", "
            + JavaNames.literal(row.getGuard()) + ", " + target(table, row.getTarget()) + ", "
            + actions(row.getActions()) + ")");
      }
      out.append(INDENT).append("ROWS").append(index).append(" = ").append(array("Row", rows))
          .append(";\n");
    }
    for (final Choice choice : table.getChoices()) {
      final List<String> branches = new ArrayList<>();
      for (final ChoiceBranch branch : choice.getBranches()) {
        branches.add("new Branch(" + JavaNames.literal(branch.getCondition()) + ", "
            + target(table, branch.getTarget()) + ", " + actions(branch.getActions()) + ")");
      }
      out.append(INDENT).append("BRANCHES[Choice.").append(choice.getId()).append(".ordinal()] = ")
          .append(array("Branch", branches)).append(";\n");
    }
    // the template supplies the final newline
    if (out.length() > 0) {
      out.setLength(out.length() - 1);
    }
    return out.toString();
  }

  private static String target(final DispatchTable table, final String target) {
    return (table.isChoice(target) ? "Choice." : "State.") + target;
  }

  private static String actions(final List<Action> actions) {
    final List<String> rendered = new ArrayList<>();
    for (final Action action : actions) {
      final String text = JavaNames.literal(action.getText());
      if (action.isStartTimer()) {
        rendered.add("startTimer(" + text + ", Timer." + action.getTimerId() + ")");
      } else if (action.isStopTimer()) {
        rendered.add("stopTimer(" + text + ", Timer." + action.getTimerId() + ")");
      } else {
        rendered.add("call(" + text + ")");
      }
    }
    return "actions(" + join(rendered) + ")";
  }

  private static String array(final String type, final List<String> elements) {
    if (elements.isEmpty()) {
      return "new " + type + "[] {}";
    }
    final StringBuilder out = new StringBuilder("new ").append(type).append("[] {\n");
    for (final String element : elements) {
      out.append(CONTINUATION).append(element).append(",\n");
    }
    return out.append(INDENT).append('}').toString();
  }

  private static String join(final List<String> parts) {
    return String.join(", ", parts);
  }
}
