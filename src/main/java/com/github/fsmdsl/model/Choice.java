package com.github.fsmdsl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A decision node. Branches are evaluated in order and the first one whose condition holds wins;
 * the default branch is taken when none does.
 */
public final class Choice {
  private final String id;
  private final List<ChoiceBranch> branches;
  private final SourcePosition position;

  public Choice(final String id, final List<ChoiceBranch> branches,
      final SourcePosition position) {
    this.id = id;
    this.branches = branches == null ? Collections.<ChoiceBranch>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(branches));
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public Choice(final String id, final List<ChoiceBranch> branches) {
    this(id, branches, SourcePosition.UNKNOWN);
  }

  public String getId() {
    return id;
  }

  /**
   * All branches in declaration order, the default one included.
   */
  public List<ChoiceBranch> getBranches() {
    return branches;
  }

  public List<ChoiceBranch> getConditionedBranches() {
    final List<ChoiceBranch> conditioned = new ArrayList<>();
    for (final ChoiceBranch branch : branches) {
      if (!branch.isDefault()) {
        conditioned.add(branch);
      }
    }
    return conditioned;
  }

  /**
   * The first default branch, null when there is none.
   */
  public ChoiceBranch getDefaultBranch() {
    for (final ChoiceBranch branch : branches) {
      if (branch.isDefault()) {
        return branch;
      }
    }
    return null;
  }

  public SourcePosition getPosition() {
    return position;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, branches);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Choice other = (Choice) obj;
    return Objects.equals(id, other.id) && branches.equals(other.branches);
  }

  @Override
  public String toString() {
    return "Choice [id=" + id + ", branches=" + branches + "]";
  }
}
