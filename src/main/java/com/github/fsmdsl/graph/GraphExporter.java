package com.github.fsmdsl.graph;

import java.util.ArrayList;
import java.util.List;

import com.github.fsmdsl.model.Action;
import com.github.fsmdsl.model.Choice;
import com.github.fsmdsl.model.ChoiceBranch;
import com.github.fsmdsl.model.FsmDefinition;
import com.github.fsmdsl.model.FsmDraft;
import com.github.fsmdsl.model.State;
import com.github.fsmdsl.model.Transition;

/**
 * Derives the {@link GraphDescription} a layout collaborator positions: the initial marker, one
 * node per state and choice, one edge per transition and choice branch.
 */
public final class GraphExporter {

  public GraphDescription export(final FsmDefinition definition) {
    if (definition == null) {
      throw new IllegalArgumentException("Definition cannot be null");
    }
    final List<NodeRecord> nodes = new ArrayList<>();
    final List<EdgeRecord> edges = new ArrayList<>();
    nodes.add(new NodeRecord(FsmDraft.INITIAL_MARKER, FsmDraft.INITIAL_MARKER));
    edges.add(new EdgeRecord(FsmDraft.INITIAL_MARKER, definition.getInitialState(), ""));
    for (final State state : definition.getStates().values()) {
      nodes.add(new NodeRecord(state.getId(), state.getDescription() == null ? state.getId()
          : state.getId() + ": " + state.getDescription()));
    }
    for (final Choice choice : definition.getChoices().values()) {
      nodes.add(new NodeRecord(choice.getId(), "<<choice>> " + choice.getId()));
    }
    for (final Transition transition : definition.getTransitions()) {
      edges.add(new EdgeRecord(transition.getSource(), transition.getTarget(),
          transition.getLabel()));
    }
    for (final Choice choice : definition.getChoices().values()) {
      for (final ChoiceBranch branch : choice.getBranches()) {
        edges.add(new EdgeRecord(choice.getId(), branch.getTarget(), branchLabel(branch)));
      }
    }
    return new GraphDescription(definition.getName(), nodes, edges);
  }

  private static String branchLabel(final ChoiceBranch branch) {
    final StringBuilder label = new StringBuilder().append('[')
        .append(branch.isDefault() ? "else" : branch.getCondition()).append(']');
    if (!branch.getActions().isEmpty()) {
      label.append(" / ");
      for (int iter = 0; iter < branch.getActions().size(); iter++) {
        final Action action = branch.getActions().get(iter);
        label.append(iter == 0 ? "" : "; ").append(action.getText());
      }
    }
    return label.toString();
  }
}
