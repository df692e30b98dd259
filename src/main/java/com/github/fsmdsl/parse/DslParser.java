package com.github.fsmdsl.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import com.github.fsmdsl.model.SourcePosition;

/**
 * Recursive-descent parser for the FSM DSL. One method per grammar rule:
 *
 * <pre>
 * machine     := "fsm" IDENT "{" statement* "}" EOF
 * statement   := initial | stateDecl | timerDecl | choiceDecl | transition
 * initial     := "[*]" "-->" IDENT
 * stateDecl   := "state" IDENT [":" STRING] ["{" stateAction* "}"]
 * stateAction := ("entry" | "exit") "/" actionList
 * transition  := IDENT "-->" IDENT [":" [IDENT] [GUARD] ["/" actionList]]
 * timerDecl   := "timer" IDENT "=" INT "->" IDENT ["periodic"]
 * choiceDecl  := "choice" IDENT "{" branch* "}"
 * branch      := GUARD "->" IDENT ["/" actionList]
 * actionList  := action ((";" | ",") action)*
 * action      := IDENT "(" balanced-text ")"
 * GUARD       := "[" balanced-text "]"
 * </pre>
 *
 * Whitespace, line comments and block comments may appear between any two terminals. Parsing stops
 * at the first error. The parser holds no state between calls and is safe to share.
 */
public final class DslParser {

  /**
   * Parses DSL source into a tree rooted at a {@link NodeKind#MACHINE} node.
   *
   * @throws DslSyntaxException on the first token the grammar cannot match
   */
  public ParseNode parse(final String source) throws DslSyntaxException {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null");
    }
    final DslScanner scanner = new DslScanner(source);
    final SourcePosition at = scanner.mark();
    scanner.expectLiteral("fsm");
    final String name = scanner.expectIdentifier();
    scanner.expectLiteral("{");
    final List<ParseNode> statements = new ArrayList<>();
    while (!scanner.tryLiteral("}")) {
      statements.add(statement(scanner));
    }
    if (!scanner.atEnd()) {
      scanner.noteExpected("end of input");
      throw scanner.fail();
    }
    return new ParseNode(NodeKind.MACHINE, name, at, statements);
  }

  private ParseNode statement(final DslScanner scanner) throws DslSyntaxException {
    final SourcePosition at = scanner.mark();
    if (scanner.tryLiteral("[*]")) {
      scanner.expectLiteral("-->");
      return ParseNode.leaf(NodeKind.INITIAL, scanner.expectIdentifier(), at);
    }
    final String word = scanner.peekWord();
    if ("state".equals(word)) {
      return stateDecl(scanner, at);
    } else if ("timer".equals(word)) {
      return timerDecl(scanner, at);
    } else if ("choice".equals(word)) {
      return choiceDecl(scanner, at);
    }
    final String source = scanner.tryIdentifier();
    if (source == null) {
      scanner.noteExpected("'state'");
      scanner.noteExpected("'timer'");
      scanner.noteExpected("'choice'");
      throw scanner.fail();
    }
    return transition(scanner, source, at);
  }

  private ParseNode stateDecl(final DslScanner scanner, final SourcePosition at)
      throws DslSyntaxException {
    scanner.expectLiteral("state");
    final String id = scanner.expectIdentifier();
    final List<ParseNode> children = new ArrayList<>();
    if (scanner.tryLiteral(":")) {
      final SourcePosition descriptionAt = scanner.mark();
      children.add(ParseNode.leaf(NodeKind.DESCRIPTION, scanner.expectString(), descriptionAt));
    }
    if (scanner.tryLiteral("{")) {
      while (!scanner.tryLiteral("}")) {
        final SourcePosition actionAt = scanner.mark();
        final NodeKind kind;
        if (scanner.tryLiteral("entry")) {
          kind = NodeKind.ENTRY;
        } else if (scanner.tryLiteral("exit")) {
          kind = NodeKind.EXIT;
        } else {
          throw scanner.fail();
        }
        scanner.expectLiteral("/");
        children.add(new ParseNode(kind, null, actionAt, actionList(scanner)));
      }
    }
    return new ParseNode(NodeKind.STATE, id, at, children);
  }

  private ParseNode transition(final DslScanner scanner, final String source,
      final SourcePosition at) throws DslSyntaxException {
    scanner.expectLiteral("-->");
    final SourcePosition targetAt = scanner.mark();
    final String target = scanner.expectIdentifier();
    final List<ParseNode> children = new ArrayList<>();
    children.add(ParseNode.leaf(NodeKind.SOURCE, source, at));
    children.add(ParseNode.leaf(NodeKind.TARGET, target, targetAt));
    if (scanner.tryLiteral(":")) {
      final SourcePosition labelAt = scanner.mark();
      final String event = scanner.tryIdentifier();
      if (event != null) {
        children.add(ParseNode.leaf(NodeKind.EVENT, event, labelAt));
      }
      final ParseNode guard = guard(scanner);
      if (guard != null) {
        children.add(guard);
      }
      final boolean hasActions = scanner.tryLiteral("/");
      if (hasActions) {
        children.addAll(actionList(scanner));
      }
      if (event == null && guard == null && !hasActions) {
        throw scanner.fail();
      }
    }
    return new ParseNode(NodeKind.TRANSITION, null, at, children);
  }

  private ParseNode timerDecl(final DslScanner scanner, final SourcePosition at)
      throws DslSyntaxException {
    scanner.expectLiteral("timer");
    final String id = scanner.expectIdentifier();
    scanner.expectLiteral("=");
    final List<ParseNode> children = new ArrayList<>();
    final SourcePosition durationAt = scanner.mark();
    children.add(ParseNode.leaf(NodeKind.DURATION, scanner.expectInteger(), durationAt));
    scanner.expectLiteral("->");
    final SourcePosition eventAt = scanner.mark();
    children.add(ParseNode.leaf(NodeKind.EVENT, scanner.expectIdentifier(), eventAt));
    final SourcePosition periodicAt = scanner.mark();
    if (scanner.tryLiteral("periodic")) {
      children.add(ParseNode.leaf(NodeKind.PERIODIC, "periodic", periodicAt));
    }
    return new ParseNode(NodeKind.TIMER, id, at, children);
  }

  private ParseNode choiceDecl(final DslScanner scanner, final SourcePosition at)
      throws DslSyntaxException {
    scanner.expectLiteral("choice");
    final String id = scanner.expectIdentifier();
    scanner.expectLiteral("{");
    final List<ParseNode> branches = new ArrayList<>();
    while (!scanner.tryLiteral("}")) {
      final SourcePosition branchAt = scanner.mark();
      final ParseNode condition = guard(scanner);
      if (condition == null) {
        throw scanner.fail();
      }
      scanner.expectLiteral("->");
      final SourcePosition targetAt = scanner.mark();
      final List<ParseNode> children = new ArrayList<>();
      children.add(condition);
      children.add(ParseNode.leaf(NodeKind.TARGET, scanner.expectIdentifier(), targetAt));
      if (scanner.tryLiteral("/")) {
        children.addAll(actionList(scanner));
      }
      branches.add(new ParseNode(NodeKind.BRANCH, null, branchAt, children));
    }
    return new ParseNode(NodeKind.CHOICE, id, at, branches);
  }

  /**
   * A bracketed guard or condition; {@code [else]} yields an {@link NodeKind#ELSE} node.
   */
  private ParseNode guard(final DslScanner scanner) throws DslSyntaxException {
    final SourcePosition at = scanner.mark();
    final String raw = scanner.tryBracketText();
    if (raw == null) {
      return null;
    }
    final String text = raw.trim();
    if (text.isEmpty()) {
      final TreeSet<String> expected = new TreeSet<>();
      expected.add("guard expression");
      throw new DslSyntaxException(at, expected, "'[]'");
    }
    if ("else".equals(text)) {
      return ParseNode.leaf(NodeKind.ELSE, text, at);
    }
    return ParseNode.leaf(NodeKind.GUARD, text, at);
  }

  private List<ParseNode> actionList(final DslScanner scanner) throws DslSyntaxException {
    final List<ParseNode> actions = new ArrayList<>();
    do {
      final SourcePosition at = scanner.mark();
      final String name = scanner.expectIdentifier();
      final SourcePosition argumentsAt = scanner.mark();
      final String arguments = scanner.expectParenText();
      final List<ParseNode> children = new ArrayList<>();
      children.add(ParseNode.leaf(NodeKind.ARGUMENTS, arguments.trim(), argumentsAt));
      actions.add(new ParseNode(NodeKind.ACTION, name, at, children));
    } while (scanner.tryLiteral(";") || scanner.tryLiteral(","));
    return actions;
  }
}
