package com.github.fsmdsl.parse;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.github.fsmdsl.model.SourcePosition;

/**
 * Character-level cursor over DSL source. Every match method skips whitespace and comments first,
 * so grammar rules never deal with trivia.
 *
 * Failed attempts are remembered at the furthest position reached; {@link #fail()} turns them into
 * a {@link DslSyntaxException} listing every alternative that would have been accepted there.
 */
final class DslScanner {
  static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<>(
      Arrays.asList("fsm", "state", "timer", "choice", "entry", "exit", "periodic", "else")));

  private final String input;
  private int pos;
  private int line = 1;
  private int column = 1;
  private int byteOffset;

  // furthest failure seen so far
  private int failOffset = -1;
  private SourcePosition failPosition;
  private String failFound;
  private final SortedSet<String> failExpected = new TreeSet<>();

  DslScanner(final String input) {
    this.input = input;
  }

  /**
   * Skips trivia and reports where the next token starts.
   */
  SourcePosition mark() throws DslSyntaxException {
    skipTrivia();
    return position();
  }

  boolean atEnd() throws DslSyntaxException {
    skipTrivia();
    return pos >= input.length();
  }

  boolean tryLiteral(final String literal) throws DslSyntaxException {
    skipTrivia();
    if (matches(literal)) {
      advance(literal.length());
      return true;
    }
    noteExpected("'" + literal + "'");
    return false;
  }

  void expectLiteral(final String literal) throws DslSyntaxException {
    if (!tryLiteral(literal)) {
      throw fail();
    }
  }

  /**
   * The identifier-like word at the cursor, keywords included, without consuming it.
   */
  String peekWord() throws DslSyntaxException {
    skipTrivia();
    final int end = scanWord();
    return end > pos ? input.substring(pos, end) : null;
  }

  /**
   * Consumes an identifier that is not a keyword, returns null when there is none.
   */
  String tryIdentifier() throws DslSyntaxException {
    skipTrivia();
    final int end = scanWord();
    if (end > pos) {
      final String word = input.substring(pos, end);
      if (!KEYWORDS.contains(word)) {
        advance(end - pos);
        return word;
      }
    }
    noteExpected("identifier");
    return null;
  }

  String expectIdentifier() throws DslSyntaxException {
    final String identifier = tryIdentifier();
    if (identifier == null) {
      throw fail();
    }
    return identifier;
  }

  String expectInteger() throws DslSyntaxException {
    skipTrivia();
    int end = pos;
    while (end < input.length() && isDigit(input.charAt(end))) {
      end++;
    }
    if (end == pos || (end < input.length() && isIdentifierPart(input.charAt(end)))) {
      noteExpected("integer");
      throw fail();
    }
    final String digits = input.substring(pos, end);
    try {
      Long.parseLong(digits);
    } catch (NumberFormatException overflow) {
      noteExpected("integer no larger than " + Long.MAX_VALUE);
      throw fail();
    }
    advance(end - pos);
    return digits;
  }

  /**
   * Double-quoted string with {@code \" \\ \n \t} escapes, returned unescaped.
   */
  String expectString() throws DslSyntaxException {
    skipTrivia();
    if (peek() != '"') {
      noteExpected("string");
      throw fail();
    }
    advance(1);
    final StringBuilder value = new StringBuilder();
    while (pos < input.length() && peek() != '"') {
      char c = peek();
      advance(1);
      if (c == '\\' && pos < input.length()) {
        final char escaped = peek();
        advance(1);
        switch (escaped) {
          case 'n':
            c = '\n';
            break;
          case 't':
            c = '\t';
            break;
          default:
            c = escaped;
        }
      }
      value.append(c);
    }
    if (pos >= input.length()) {
      noteExpected("'\"'");
      throw fail();
    }
    advance(1);
    return value.toString();
  }

  /**
   * Raw text between balanced square brackets, null when the cursor is not on '['.
   */
  String tryBracketText() throws DslSyntaxException {
    skipTrivia();
    if (peek() != '[') {
      noteExpected("'['");
      return null;
    }
    return balanced('[', ']');
  }

  /**
   * Raw text between balanced parentheses.
   */
  String expectParenText() throws DslSyntaxException {
    skipTrivia();
    if (peek() != '(') {
      noteExpected("'('");
      throw fail();
    }
    return balanced('(', ')');
  }

  private String balanced(final char open, final char close) throws DslSyntaxException {
    advance(1);
    final int start = pos;
    int depth = 1;
    boolean quoted = false;
    while (pos < input.length()) {
      final char c = peek();
      if (quoted) {
        if (c == '\\') {
          advance(1);
        } else if (c == '"') {
          quoted = false;
        }
      } else if (c == '"') {
        quoted = true;
      } else if (c == open) {
        depth++;
      } else if (c == close) {
        depth--;
        if (depth == 0) {
          final String text = input.substring(start, pos);
          advance(1);
          return text;
        }
      }
      if (pos < input.length()) {
        advance(1);
      }
    }
    noteExpected("'" + close + "'");
    throw fail();
  }

  void noteExpected(final String alternative) {
    if (pos > failOffset) {
      failOffset = pos;
      failPosition = position();
      failFound = describeFound();
      failExpected.clear();
    }
    if (pos == failOffset) {
      failExpected.add(alternative);
    }
  }

  DslSyntaxException fail() {
    if (failPosition == null) {
      return new DslSyntaxException(position(), new TreeSet<String>(), describeFound());
    }
    return new DslSyntaxException(failPosition, failExpected, failFound);
  }

  SourcePosition position() {
    return new SourcePosition(byteOffset, line, column);
  }

  private void skipTrivia() throws DslSyntaxException {
    while (pos < input.length()) {
      final char c = peek();
      if (Character.isWhitespace(c)) {
        advance(1);
      } else if (c == '/' && peekAhead(1) == '/') {
        while (pos < input.length() && peek() != '\n') {
          advance(1);
        }
      } else if (c == '/' && peekAhead(1) == '*') {
        final SourcePosition start = position();
        advance(2);
        boolean closed = false;
        while (pos < input.length()) {
          if (peek() == '*' && peekAhead(1) == '/') {
            advance(2);
            closed = true;
            break;
          }
          advance(1);
        }
        if (!closed) {
          final SortedSet<String> expected = new TreeSet<>();
          expected.add("'*/' closing the comment opened at " + start);
          throw new DslSyntaxException(position(), expected, "end of input");
        }
      } else {
        break;
      }
    }
  }

  private boolean matches(final String literal) {
    if (!input.startsWith(literal, pos)) {
      return false;
    }
    if (isIdentifierStart(literal.charAt(0))) {
      final int end = pos + literal.length();
      return end >= input.length() || !isIdentifierPart(input.charAt(end));
    }
    return true;
  }

  private int scanWord() {
    int end = pos;
    if (end < input.length() && isIdentifierStart(input.charAt(end))) {
      end++;
      while (end < input.length() && isIdentifierPart(input.charAt(end))) {
        end++;
      }
    }
    return end;
  }

  private String describeFound() {
    if (pos >= input.length()) {
      return "end of input";
    }
    final int end = scanWord();
    if (end > pos) {
      return "'" + input.substring(pos, end) + "'";
    }
    return "'" + input.charAt(pos) + "'";
  }

  private char peek() {
    return pos < input.length() ? input.charAt(pos) : '\0';
  }

  private char peekAhead(final int distance) {
    return pos + distance < input.length() ? input.charAt(pos + distance) : '\0';
  }

  private void advance(final int count) {
    for (int iter = 0; iter < count && pos < input.length(); iter++) {
      final char c = input.charAt(pos++);
      if (c == '\n') {
        line++;
        column = 1;
      } else if (!Character.isLowSurrogate(c)) {
        column++;
      }
      byteOffset += utf8Length(c);
    }
  }

  private static int utf8Length(final char c) {
    if (c < 0x80) {
      return 1;
    } else if (c < 0x800) {
      return 2;
    } else if (Character.isHighSurrogate(c)) {
      return 4;
    } else if (Character.isLowSurrogate(c)) {
      return 0;
    }
    return 3;
  }

  private static boolean isDigit(final char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(final char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}
