package com.github.fsmdsl;

import com.github.fsmdsl.model.FsmDefinition;

/**
 * DSL sources shared by the tests.
 */
public final class Fixtures {

  public static final String RED_GREEN =
      "fsm T { [*] --> Red  state Red  state Green  Red --> Green : go }";

  public static final String TRAFFIC = "fsm Traffic {\n"
      + "  [*] --> Red\n"
      + "  state Red : \"stop\" {\n"
      + "    entry / lamp(red); start_timer(cycle)\n"
      + "    exit / stop_timer(cycle)\n"
      + "  }\n"
      + "  state Green {\n"
      + "    entry / lamp(green)\n"
      + "  }\n"
      + "  timer cycle = 5 -> tick periodic\n"
      + "  Red --> Green : go [clear] / log(go)\n"
      + "  Green --> Red : tick\n"
      + "}\n";

  public static final String BLINK = "fsm Blink {\n"
      + "  [*] --> Idle\n"
      + "  state Idle\n"
      + "  state Blinking {\n"
      + "    entry / start_timer(t)\n"
      + "    exit / stop_timer(t)\n"
      + "  }\n"
      + "  timer t = 100 -> Tick periodic\n"
      + "  Idle --> Blinking : start\n"
      + "  Blinking --> Idle : stop\n"
      + "  Idle --> Idle : Tick / late()\n"
      + "}\n";

  // choices, completion transitions, both timer kinds, guards and quoted action arguments
  public static final String ORDER = "fsm Order {\n"
      + "  [*] --> Idle\n"
      + "  state Idle {\n"
      + "    entry / idle()\n"
      + "    exit / leaveIdle()\n"
      + "  }\n"
      + "  state Checking {\n"
      + "    entry / start_timer(timeout); check()\n"
      + "    exit / stop_timer(timeout)\n"
      + "  }\n"
      + "  state Approved : \"order accepted\" {\n"
      + "    entry / approve()\n"
      + "  }\n"
      + "  state Rejected {\n"
      + "    entry / reject(\"no \\\"luck\\\"\")\n"
      + "  }\n"
      + "  state Archived\n"
      + "  timer timeout = 30 -> expired\n"
      + "  timer heartbeat = 10 -> beat periodic\n"
      + "  /* routing */\n"
      + "  choice decide {\n"
      + "    [amount > 100] -> review / flag(big)\n"
      + "    [else] -> Approved\n"
      + "  }\n"
      + "  choice review {\n"
      + "    [vip] -> Approved / vipPath()\n"
      + "    [else] -> Rejected\n"
      + "  }\n"
      + "  Idle --> Checking : submit / start_timer(heartbeat)\n"
      + "  Checking --> decide : verified\n"
      + "  Checking --> Rejected : expired\n"
      + "  Checking --> Checking : beat [noisy] / ping()\n"
      + "  Approved --> Archived\n"
      + "  Rejected --> Idle : retry\n"
      + "  Archived --> Idle : reset / stop_timer(heartbeat)\n"
      + "  Idle --> Idle : beat / idleBeat()\n"
      + "}\n";

  public static FsmDefinition compile(final String source) throws FsmException {
    return new FsmPipeline().compileOrThrow(source);
  }

  private Fixtures() {}
}
