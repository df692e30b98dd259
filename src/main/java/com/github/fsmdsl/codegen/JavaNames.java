package com.github.fsmdsl.codegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Java lexical rules the standard target has to respect.
 */
final class JavaNames {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

  static final Set<String> RESERVED_WORDS = Collections.unmodifiableSet(new HashSet<>(
      Arrays.asList("abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
          "class", "const", "continue", "default", "do", "double", "else", "enum", "extends",
          "final", "finally", "float", "for", "goto", "if", "implements", "import", "instanceof",
          "int", "interface", "long", "native", "new", "package", "private", "protected", "public",
          "return", "short", "static", "strictfp", "super", "switch", "synchronized", "this",
          "throw", "throws", "transient", "try", "void", "volatile", "while", "true", "false",
          "null", "_")));

  // simple names the generated class declares or imports
  static final Set<String> GENERATED_TYPE_NAMES = Collections.unmodifiableSet(new HashSet<>(
      Arrays.asList("State", "Choice", "Event", "Timer", "Op", "Action", "Row", "Branch", "Route",
          "Pending", "ArrayDeque", "ArrayList", "Arrays", "Deque", "List", "DispatchOutcome",
          "GeneratedMachine", "MachineHost")));

  static boolean isReserved(final String name) {
    return RESERVED_WORDS.contains(name);
  }

  static boolean isUsableIdentifier(final String name) {
    return name != null && IDENTIFIER.matcher(name).matches() && !isReserved(name);
  }

  static boolean isReservedTypeName(final String name) {
    return GENERATED_TYPE_NAMES.contains(name);
  }

  /**
   * Java string literal for arbitrary text, quotes included.
   */
  static String literal(final String text) {
    if (text == null) {
      return "null";
    }
    final StringBuilder builder = new StringBuilder(text.length() + 2).append('"');
    for (int iter = 0; iter < text.length(); iter++) {
      final char c = text.charAt(iter);
      switch (c) {
        case '"':
          builder.append("\\\"");
          break;
        case '\\':
          builder.append("\\\\");
          break;
        case '\n':
          builder.append("\\n");
          break;
        case '\r':
          builder.append("\\r");
          break;
        case '\t':
          builder.append("\\t");
          break;
        default:
          if (c < 0x20 || c == 0x7f) {
            builder.append(String.format("\\%03o", (int) c));
          } else {
            builder.append(c);
          }
      }
    }
    return builder.append('"').toString();
  }

  private JavaNames() {}
}
