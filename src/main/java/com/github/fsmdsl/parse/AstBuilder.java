package com.github.fsmdsl.parse;

import java.util.ArrayList;
import java.util.List;

import com.github.fsmdsl.model.Action;
import com.github.fsmdsl.model.Choice;
import com.github.fsmdsl.model.ChoiceBranch;
import com.github.fsmdsl.model.FsmDraft;
import com.github.fsmdsl.model.State;
import com.github.fsmdsl.model.Timer;
import com.github.fsmdsl.model.Transition;

/**
 * Walks a parse tree once and produces the typed draft model. Declarations keep their source order
 * and nothing is validated here; dangling names and duplicates flow through untouched so the
 * validator can report them.
 */
public final class AstBuilder {

  public FsmDraft build(final ParseNode machine) {
    if (machine == null || machine.getKind() != NodeKind.MACHINE) {
      throw new IllegalArgumentException("Expected a MACHINE node, got " + machine);
    }
    final FsmDraft.Builder builder =
        FsmDraft.Builder.newBuilder(machine.getText()).position(machine.getPosition());
    for (final ParseNode statement : machine.getChildren()) {
      switch (statement.getKind()) {
        case INITIAL:
          builder.initial(statement.getText(), statement.getPosition());
          break;
        case STATE:
          builder.state(state(statement));
          break;
        case TRANSITION:
          builder.transition(transition(statement));
          break;
        case TIMER:
          builder.timer(timer(statement));
          break;
        case CHOICE:
          builder.choice(choice(statement));
          break;
        default:
          throw new IllegalArgumentException("Unexpected statement node " + statement);
      }
    }
    return builder.build();
  }

  private State state(final ParseNode node) {
    final ParseNode description = node.child(NodeKind.DESCRIPTION);
    final List<Action> entry = new ArrayList<>();
    for (final ParseNode block : node.children(NodeKind.ENTRY)) {
      entry.addAll(actions(block));
    }
    final List<Action> exit = new ArrayList<>();
    for (final ParseNode block : node.children(NodeKind.EXIT)) {
      exit.addAll(actions(block));
    }
    return new State(node.getText(), description == null ? null : description.getText(), entry,
        exit, node.getPosition());
  }

  private Transition transition(final ParseNode node) {
    final ParseNode event = node.child(NodeKind.EVENT);
    return new Transition(node.child(NodeKind.SOURCE).getText(),
        node.child(NodeKind.TARGET).getText(), event == null ? null : event.getText(),
        guardText(node), actions(node), node.getPosition());
  }

  private Timer timer(final ParseNode node) {
    // the parser only accepts digits that fit in a long
    final long duration = Long.parseLong(node.child(NodeKind.DURATION).getText());
    return new Timer(node.getText(), duration, node.child(NodeKind.EVENT).getText(),
        node.child(NodeKind.PERIODIC) != null, node.getPosition());
  }

  private Choice choice(final ParseNode node) {
    final List<ChoiceBranch> branches = new ArrayList<>();
    for (final ParseNode branch : node.children(NodeKind.BRANCH)) {
      final String condition = branch.child(NodeKind.ELSE) != null ? null
          : branch.child(NodeKind.GUARD).getText();
      branches.add(new ChoiceBranch(condition, branch.child(NodeKind.TARGET).getText(),
          actions(branch), branch.getPosition()));
    }
    return new Choice(node.getText(), branches, node.getPosition());
  }

  private static String guardText(final ParseNode node) {
    final ParseNode guard = node.child(NodeKind.GUARD);
    if (guard != null) {
      return guard.getText();
    }
    // [else] on a plain transition is just an opaque guard
    final ParseNode otherwise = node.child(NodeKind.ELSE);
    return otherwise == null ? null : otherwise.getText();
  }

  private static List<Action> actions(final ParseNode node) {
    final List<Action> actions = new ArrayList<>();
    for (final ParseNode action : node.children(NodeKind.ACTION)) {
      actions.add(new Action(action.getText(), action.child(NodeKind.ARGUMENTS).getText(),
          action.getPosition()));
    }
    return actions;
  }
}
