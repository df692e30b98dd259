package com.github.fsmdsl.sim;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.fsmdsl.Fixtures;
import com.github.fsmdsl.FsmException;
import com.github.fsmdsl.FsmException.Code;
import com.github.fsmdsl.runtime.ActionHandler;
import com.github.fsmdsl.runtime.DispatchOutcome;
import com.github.fsmdsl.sim.GuardTable.GuardTableBuilder;
import com.github.fsmdsl.sim.SimulatorConfiguration.SimulatorConfigurationBuilder;

/**
 * Tests to maintain the sanity and correctness of the run-to-completion engine.
 */
public class SimulatorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(SimulatorTest.class.getSimpleName());

  private final List<String> executed = Collections.synchronizedList(new ArrayList<String>());
  private final ActionHandler recorder = (action, payload) -> executed.add(action);

  @Test
  public void testRedGreen() throws FsmException {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile(Fixtures.RED_GREEN));
    assertEquals(EngineStatus.READY, simulator.getStatus());
    assertEquals("Red", simulator.getCurrentState());

    simulator.postEvent("go");
    final StepResult result = simulator.step();
    assertEquals(DispatchOutcome.TRANSITIONED, result.getOutcome());
    assertEquals("Green", simulator.getCurrentState());
    final List<TraceEntry> trace = simulator.snapshot().getTrace();
    assertEquals(1, trace.size());
    assertEquals("{Red,Green,go,[]}", trace.get(0).toString());
    assertEquals(Arrays.asList("Red", "Green"), trace.get(0).getPath());

    // nothing queued: no-op, no trace entry
    final StepResult idle = simulator.step();
    assertEquals(DispatchOutcome.NO_PENDING_EVENT, idle.getOutcome());
    assertNull(idle.getTraceEntry());
    assertEquals("Green", simulator.getCurrentState());
    assertEquals(1, simulator.snapshot().getTrace().size());
  }

  @Test
  public void testUnmatchedEvent() throws FsmException {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile(Fixtures.RED_GREEN));
    simulator.postEvent("unknown");
    final StepResult result = simulator.step();
    assertEquals(DispatchOutcome.UNMATCHED, result.getOutcome());
    assertEquals("Red", simulator.getCurrentState());
    final TraceEntry entry = result.getTraceEntry();
    assertTrue(entry.isUnmatched());
    assertEquals("Red", entry.getFrom());
    assertEquals("Red", entry.getTo());
    assertEquals("unknown", entry.getEvent());
    assertEquals(entry, simulator.snapshot().getTrace().get(0));
    assertEquals(1L, simulator.getStatistics().getTotalUnmatched());
  }

  @Test
  public void testFirstSatisfiedTransitionWins() throws FsmException {
    final String guardedFirst = "fsm Pick { [*] --> A state A state B state C "
        + "A --> B : go [x] A --> C : go }";
    final String plainFirst = "fsm Pick { [*] --> A state A state B state C "
        + "A --> C : go A --> B : go [x] }";
    assertEquals("B", destination(guardedFirst, true));
    assertEquals("C", destination(guardedFirst, false));
    assertEquals("C", destination(plainFirst, true));
  }

  private static String destination(final String source, final boolean x) throws FsmException {
    final GuardTable guards = GuardTableBuilder.newBuilder().constant("x", x).build();
    final Simulator simulator = new Simulator(guards, ActionHandler.NO_OP);
    simulator.load(Fixtures.compile(source));
    simulator.postEvent("go");
    simulator.step();
    return simulator.getCurrentState();
  }

  @Test
  public void testPeriodicTimerStoppedByExitAction() throws FsmException {
    final Simulator simulator = new Simulator(GuardTable.empty(), recorder);
    simulator.load(Fixtures.compile(Fixtures.BLINK));
    simulator.postEvent("start");
    assertEquals(Arrays.asList("start_timer(t)"), simulator.step().getTraceEntry().getActions());

    simulator.tick(350L);
    SimulatorSnapshot snapshot = simulator.snapshot();
    assertEquals(Arrays.asList("Tick", "Tick", "Tick"), snapshot.getPendingEvents());
    assertEquals(Arrays.asList("t"), snapshot.getArmedTimers());
    assertEquals(350L, snapshot.getClock());

    simulator.postEvent("stop");
    for (int iter = 0; iter < 3; iter++) {
      assertEquals(DispatchOutcome.UNMATCHED, simulator.step().getOutcome());
    }
    final StepResult stop = simulator.step();
    assertEquals("Idle", stop.getTraceEntry().getTo());
    assertEquals(Arrays.asList("stop_timer(t)"), stop.getTraceEntry().getActions());

    simulator.tick(1000L);
    snapshot = simulator.snapshot();
    assertTrue(snapshot.getArmedTimers().isEmpty());
    assertTrue(snapshot.getPendingEvents().isEmpty());
    assertEquals(DispatchOutcome.NO_PENDING_EVENT, simulator.step().getOutcome());
    assertFalse(executed.contains("late()"));
    assertEquals(3L, simulator.getStatistics().getTotalTimerFirings());
  }

  @Test
  public void testTimerOwnedByExitedStateIsDisarmed() throws FsmException {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile("fsm Own { [*] --> A state A { entry / start_timer(t) } "
        + "state B timer t = 10 -> ring A --> B : leave B --> A : ring }"));
    assertEquals(Arrays.asList("t"), simulator.snapshot().getArmedTimers());
    simulator.postEvent("leave");
    simulator.step();
    simulator.tick(50L);
    assertTrue(simulator.snapshot().getArmedTimers().isEmpty());
    assertTrue(simulator.snapshot().getPendingEvents().isEmpty());
  }

  @Test
  public void testTimersExpireInDueThenDeclarationOrder() throws FsmException {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile("fsm Tie {\n  [*] --> A\n"
        + "  state A { entry / start_timer(b); start_timer(c); start_timer(a) }\n"
        + "  timer a = 10 -> first\n  timer b = 10 -> second\n  timer c = 5 -> third\n"
        + "  A --> A : first\n  A --> A : second\n  A --> A : third\n}"));
    simulator.tick(10L);
    assertEquals(Arrays.asList("third", "first", "second"),
        simulator.snapshot().getPendingEvents());
  }

  @Test
  public void testChoiceChainAndActionOrder() throws FsmException {
    final Simulator simulator = new Simulator(orderGuards(), recorder);
    simulator.load(Fixtures.compile(Fixtures.ORDER));
    assertEquals(Arrays.asList("idle()"), executed);

    simulator.postEvent("submit");
    assertEquals(Arrays.asList("leaveIdle()", "start_timer(heartbeat)", "start_timer(timeout)",
        "check()"), simulator.step().getTraceEntry().getActions());
    assertEquals(Arrays.asList("timeout", "heartbeat"), simulator.snapshot().getArmedTimers());

    simulator.postEvent("verified", 500);
    final TraceEntry rejected = simulator.step().getTraceEntry();
    assertEquals(Arrays.asList("stop_timer(timeout)", "flag(big)", "reject(\"no \\\"luck\\\"\")"),
        rejected.getActions());
    assertEquals(Arrays.asList("Checking", "decide", "review", "Rejected"), rejected.getPath());
    assertEquals("Rejected", simulator.getCurrentState());
    // heartbeat was owned by Checking
    assertTrue(simulator.snapshot().getArmedTimers().isEmpty());

    simulator.postEvent("retry");
    simulator.postEvent("submit");
    simulator.postEvent("verified", 5000);
    simulator.step();
    simulator.step();
    final TraceEntry approved = simulator.step().getTraceEntry();
    assertEquals(Arrays.asList("stop_timer(timeout)", "flag(big)", "vipPath()", "approve()"),
        approved.getActions());
    assertEquals(Arrays.asList("Checking", "decide", "review", "Approved", "Archived"),
        approved.getPath());
    assertEquals("Archived", simulator.getCurrentState());
  }

  @Test
  public void testThrowingGuardCountsAsFalse() throws FsmException {
    final Simulator simulator = new Simulator(orderGuards(), recorder);
    simulator.load(Fixtures.compile(Fixtures.ORDER));
    simulator.postEvent("submit");
    simulator.step();
    simulator.tick(10L);
    assertEquals(DispatchOutcome.UNMATCHED, simulator.step().getOutcome());
    assertEquals("Checking", simulator.getCurrentState());
    assertEquals(1L, simulator.getStatistics().getTotalGuardFaults());
    assertFalse(executed.contains("ping()"));
  }

  @Test
  public void testThrowingActionIsSkipped() throws FsmException {
    final ActionHandler exploding = (action, payload) -> {
      executed.add(action);
      if ("check()".equals(action)) {
        throw new IllegalStateException("boom");
      }
    };
    final Simulator simulator = new Simulator(orderGuards(), exploding);
    simulator.load(Fixtures.compile(Fixtures.ORDER));
    simulator.postEvent("submit");
    assertTrue(simulator.step().isTransitioned());
    assertEquals("Checking", simulator.getCurrentState());
    assertEquals(1L, simulator.getStatistics().getTotalActionFaults());
    assertTrue(executed.contains("check()"));
  }

  @Test
  public void testCompletionTransitionsRunOnLoad() throws FsmException {
    final Simulator simulator = new Simulator(GuardTable.empty(), recorder);
    simulator.load(Fixtures.compile("fsm Boot { [*] --> Start state Start { entry / hello() } "
        + "state Ready Start --> Ready : / ready() }"));
    assertEquals("Ready", simulator.getCurrentState());
    assertEquals(Arrays.asList("hello()", "ready()"), executed);
    assertTrue(simulator.snapshot().getTrace().isEmpty());
  }

  @Test
  public void testCompletionTransitionsFollowAStep() throws FsmException {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile(
        "fsm Hop { [*] --> A state A state B state C A --> B : go B --> C C --> A : back }"));
    simulator.postEvent("go");
    final TraceEntry entry = simulator.step().getTraceEntry();
    assertEquals("C", entry.getTo());
    assertEquals(Arrays.asList("A", "B", "C"), entry.getPath());
  }

  @Test
  public void testResidualCycleHitsChainLimit() throws FsmException {
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().maxChainLength(8).build();
    final GuardTable guards = GuardTableBuilder.newBuilder().constant("loop", true).build();
    final Simulator simulator = new Simulator(config, guards, ActionHandler.NO_OP);
    simulator.load(Fixtures.compile("fsm Loop { [*] --> S state S state A state B "
        + "S --> A : go A --> B : [loop] B --> A : [loop] }"));
    simulator.postEvent("go");
    try {
      simulator.step();
      fail("expected the chain limit to trip");
    } catch (SimulationFault expected) {
      assertEquals(Code.CHAIN_LIMIT_EXCEEDED, expected.getCode());
    }
    assertEquals(EngineStatus.READY, simulator.getStatus());
    // the consumed event still shows up, stopped where the limit tripped
    final List<TraceEntry> trace = simulator.snapshot().getTrace();
    assertEquals(1, trace.size());
    assertEquals("S", trace.get(0).getFrom());
    assertEquals("A", trace.get(0).getTo());
    assertEquals(Arrays.asList("S", "A", "B", "A", "B", "A", "B", "A", "B", "A"),
        trace.get(0).getPath());
    assertEquals("A", simulator.getCurrentState());
    assertEquals(1L, simulator.getStatistics().getTotalTransitions());
  }

  @Test
  public void testClockSaturatesInsteadOfWrapping() throws FsmException {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile("fsm Far { [*] --> A "
        + "state A { entry / start_timer(t) } timer t = 9223372036854775807 -> Fire "
        + "A --> A : go A --> A : Fire }"));
    simulator.tick(10L);
    simulator.postEvent("go");
    simulator.step();
    simulator.tick(0L);
    SimulatorSnapshot snapshot = simulator.snapshot();
    assertTrue(snapshot.getPendingEvents().isEmpty());
    assertEquals(Arrays.asList("t"), snapshot.getArmedTimers());
    assertEquals(10L, snapshot.getClock());

    simulator.tick(1L);
    simulator.tick(Long.MAX_VALUE);
    snapshot = simulator.snapshot();
    assertEquals(Long.MAX_VALUE, snapshot.getClock());
    assertTrue(snapshot.getPendingEvents().isEmpty());
    assertEquals("A", snapshot.getCurrentState());

    // the end of logical time stays put
    simulator.tick(Long.MAX_VALUE);
    assertEquals(Long.MAX_VALUE, simulator.snapshot().getClock());
    assertEquals(0L, simulator.getStatistics().getTotalTimerFirings());
  }

  @Test
  public void testPeriodicBacklogIsBoundedPerTick() throws FsmException {
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().maxTimerFiringsPerTick(5).build();
    final Simulator simulator = new Simulator(config, GuardTable.empty(), ActionHandler.NO_OP);
    simulator.load(Fixtures.compile(Fixtures.BLINK));
    simulator.postEvent("start");
    simulator.step();

    simulator.tick(1000000000L);
    assertEquals(5, simulator.snapshot().getPendingEvents().size());
    assertEquals(1000000000L, simulator.snapshot().getClock());
    SimulatorStatistics statistics = simulator.getStatistics();
    assertEquals(5L, statistics.getTotalTimerFirings());
    assertEquals(10000000L - 5L, statistics.getTotalSkippedFirings());

    // skipped periods leave the timer on its original phase
    simulator.tick(99L);
    assertEquals(5, simulator.snapshot().getPendingEvents().size());
    simulator.tick(1L);
    assertEquals(6, simulator.snapshot().getPendingEvents().size());
    statistics = simulator.getStatistics();
    assertEquals(6L, statistics.getTotalTimerFirings());
    assertEquals(10000000L - 5L, statistics.getTotalSkippedFirings());
  }

  @Test
  public void testOneShotTimersFireBeyondTheBound() throws FsmException {
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().maxTimerFiringsPerTick(1).build();
    final Simulator simulator = new Simulator(config, GuardTable.empty(), ActionHandler.NO_OP);
    simulator.load(Fixtures.compile("fsm Two {\n  [*] --> A\n"
        + "  state A { entry / start_timer(p); start_timer(once) }\n"
        + "  timer p = 1 -> pulse periodic\n  timer once = 10 -> done\n"
        + "  A --> A : pulse\n  A --> A : done\n}"));
    simulator.tick(10L);
    assertEquals(Arrays.asList("pulse", "done"), simulator.snapshot().getPendingEvents());
    assertEquals(Arrays.asList("p"), simulator.snapshot().getArmedTimers());
    assertEquals(9L, simulator.getStatistics().getTotalSkippedFirings());
  }

  @Test
  public void testTraceRetention() throws FsmException {
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().traceRetention(3).build();
    final Simulator simulator = new Simulator(config, GuardTable.empty(), ActionHandler.NO_OP);
    simulator.load(Fixtures.compile(Fixtures.RED_GREEN));
    for (int iter = 0; iter < 5; iter++) {
      simulator.postEvent("nope");
      simulator.step();
    }
    final List<TraceEntry> trace = simulator.snapshot().getTrace();
    assertEquals(3, trace.size());
    assertEquals(3L, trace.get(0).getSequence());
    assertEquals(5L, trace.get(2).getSequence());
  }

  @Test
  public void testNothingLoaded() throws FsmException {
    final Simulator simulator = new Simulator();
    assertEquals(EngineStatus.IDLE, simulator.snapshot().getStatus());
    assertNull(simulator.snapshot().getCurrentState());
    try {
      simulator.postEvent("go");
      fail("expected a fault");
    } catch (SimulationFault expected) {
      assertEquals(Code.MACHINE_NOT_LOADED, expected.getCode());
    }
    try {
      simulator.step();
      fail("expected a fault");
    } catch (SimulationFault expected) {
      assertEquals(Code.MACHINE_NOT_LOADED, expected.getCode());
    }
  }

  @Test
  public void testReloadResets() throws FsmException {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile(Fixtures.BLINK));
    simulator.postEvent("start");
    simulator.step();
    simulator.tick(120L);
    simulator.postEvent("stop");

    simulator.load(Fixtures.compile(Fixtures.RED_GREEN));
    final SimulatorSnapshot snapshot = simulator.snapshot();
    assertEquals("T", snapshot.getMachineName());
    assertEquals("Red", snapshot.getCurrentState());
    assertTrue(snapshot.getPendingEvents().isEmpty());
    assertTrue(snapshot.getArmedTimers().isEmpty());
    assertTrue(snapshot.getTrace().isEmpty());
    assertEquals(0L, snapshot.getClock());
    assertEquals(0L, simulator.getStatistics().getTotalSteps());
  }

  @Test
  public void testConcurrentPosting() throws Exception {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile(Fixtures.RED_GREEN));
    final int posters = 4;
    final int eventsEach = 250;
    final ExecutorService executor = Executors.newFixedThreadPool(posters);
    final CountDownLatch start = new CountDownLatch(1);
    final CountDownLatch done = new CountDownLatch(posters);
    for (int poster = 0; poster < posters; poster++) {
      executor.submit(() -> {
        try {
          start.await();
          for (int iter = 0; iter < eventsEach; iter++) {
            simulator.postEvent("nope");
          }
        } catch (Exception problem) {
          logger.error("Poster failed", problem);
        } finally {
          done.countDown();
        }
      });
    }
    start.countDown();
    assertTrue(done.await(10L, TimeUnit.SECONDS));
    executor.shutdown();

    int steps = 0;
    while (simulator.step().getOutcome() != DispatchOutcome.NO_PENDING_EVENT) {
      steps++;
    }
    assertEquals(posters * eventsEach, steps);
    assertEquals(posters * eventsEach, simulator.getStatistics().getTotalUnmatched());
  }

  @Test
  public void testInvalidConfiguration() {
    try {
      SimulatorConfigurationBuilder.newBuilder().traceRetention(0).maxChainLength(-1)
          .maxTimerFiringsPerTick(0).build();
      fail("expected an invalid config");
    } catch (FsmException expected) {
      assertEquals(Code.INVALID_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("traceRetention"));
      assertTrue(expected.getMessage().contains("maxChainLength"));
      assertTrue(expected.getMessage().contains("maxTimerFiringsPerTick"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeTick() throws FsmException {
    final Simulator simulator = new Simulator();
    simulator.load(Fixtures.compile(Fixtures.RED_GREEN));
    simulator.tick(-1L);
  }

  static GuardTable orderGuards() {
    return GuardTableBuilder.newBuilder()
        .guard("amount > 100", payload -> payload instanceof Integer && (Integer) payload > 100)
        .guard("vip", payload -> payload instanceof Integer && (Integer) payload > 1000)
        .guard("noisy", payload -> {
          throw new IllegalStateException("sensor offline");
        }).build();
  }
}
