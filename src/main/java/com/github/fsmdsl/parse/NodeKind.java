package com.github.fsmdsl.parse;

/**
 * Grammar rule that produced a {@link ParseNode}.
 */
public enum NodeKind {
  // fsm <Name> { ... }, text=name
  MACHINE,
  // [*] --> <id>, text=target
  INITIAL,
  // state <id>, text=id
  STATE,
  // : "description", text=unescaped description
  DESCRIPTION,
  // entry / actions
  ENTRY,
  // exit / actions
  EXIT,
  // <id> --> <id> : ...
  TRANSITION,
  SOURCE,
  TARGET,
  EVENT,
  // [text], text=guard or condition without brackets
  GUARD,
  // [else]
  ELSE,
  // timer <id> = <int> -> <event> [periodic], text=id
  TIMER,
  DURATION,
  PERIODIC,
  // choice <id> { ... }, text=id
  CHOICE,
  BRANCH,
  // name(arguments), text=name
  ACTION,
  ARGUMENTS;
}
