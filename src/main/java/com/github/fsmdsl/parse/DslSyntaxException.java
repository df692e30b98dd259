package com.github.fsmdsl.parse;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import com.github.fsmdsl.FsmException;
import com.github.fsmdsl.model.SourcePosition;

/**
 * Thrown on the first token the grammar cannot match. Parsing stops there; no partial tree is ever
 * handed to later stages.
 */
public final class DslSyntaxException extends FsmException {
  private static final long serialVersionUID = 1L;
  private final SourcePosition position;
  private final SortedSet<String> expected;
  private final String found;

  public DslSyntaxException(final SourcePosition position, final SortedSet<String> expected,
      final String found) {
    super(Code.SYNTAX_ERROR, position + ": " + detail(expected, found));
    this.position = position;
    this.expected = Collections.unmodifiableSortedSet(new TreeSet<>(expected));
    this.found = found;
  }

  private static String detail(final SortedSet<String> expected, final String found) {
    if (expected.size() == 1) {
      return "expected " + expected.first() + " but found " + found;
    }
    return "expected one of " + expected + " but found " + found;
  }

  /**
   * The message without its position prefix, for callers that print the position themselves.
   */
  public String getDetail() {
    return detail(expected, found);
  }

  public SourcePosition getPosition() {
    return position;
  }

  /**
   * Grammar alternatives that would have been accepted at {@link #getPosition()}.
   */
  public SortedSet<String> getExpected() {
    return expected;
  }

  public String getFound() {
    return found;
  }
}
