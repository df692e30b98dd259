package com.github.fsmdsl.codegen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;

import com.github.fsmdsl.Fixtures;
import com.github.fsmdsl.codegen.GeneratorOptions.GeneratorOptionsBuilder;
import com.github.fsmdsl.model.FsmDefinition;
import com.github.fsmdsl.runtime.ActionHandler;
import com.github.fsmdsl.runtime.DispatchOutcome;
import com.github.fsmdsl.runtime.GeneratedMachine;
import com.github.fsmdsl.runtime.MachineHost;
import com.github.fsmdsl.sim.GuardTable;
import com.github.fsmdsl.sim.GuardTable.GuardTableBuilder;
import com.github.fsmdsl.sim.Simulator;
import com.github.fsmdsl.sim.SimulatorConfiguration.SimulatorConfigurationBuilder;
import com.github.fsmdsl.sim.StepResult;

/**
 * Compiles generated machines and replays the same inputs against them and the simulator; both
 * must take the same transitions and run the same actions in the same order.
 */
public class GeneratorEquivalenceTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final InMemoryCompiler compiler = new InMemoryCompiler();

  @Before
  public void compilerPresent() {
    Assume.assumeTrue("no system java compiler", compiler.isAvailable());
  }

  @Test
  public void testEveryFixtureCompiles() throws Exception {
    final String[] sources = {Fixtures.RED_GREEN, Fixtures.TRAFFIC, Fixtures.BLINK,
        Fixtures.ORDER};
    for (final String source : sources) {
      final FsmDefinition definition = Fixtures.compile(source);
      final GeneratedMachine machine = instantiate(definition, "", new RecordingHost(guards()));
      machine.start();
      assertEquals(definition.getInitialState(), machine.currentState());
    }
  }

  @Test
  public void testOrderMachineMatchesSimulator() throws Exception {
    final FsmDefinition definition = Fixtures.compile(Fixtures.ORDER);
    final List<String> simulated = new ArrayList<>();
    final Simulator simulator =
        new Simulator(guards(), (action, payload) -> simulated.add(action));
    simulator.load(definition);
    final RecordingHost host = new RecordingHost(guards());
    final GeneratedMachine machine = instantiate(definition, "com.example.generated", host);
    machine.start();
    assertEquals(simulated, host.executed);

    final String[] script = {"submit", "+25", "+10", "retry", "submit", "verified=50",
        "reset", "beat", "submit", "verified=500", "retry", "submit", "verified=5000", "+100",
        "bogus", "reset", "submit", "+7", "+7"};
    for (final String input : script) {
      apply(input, simulator, machine);
      assertEquals(simulator.snapshot().getPendingEvents().size(), machine.pendingEvents());
      StepResult expected;
      do {
        expected = simulator.step();
        final DispatchOutcome actual = machine.step();
        assertEquals("after " + input, expected.getOutcome(), actual);
        assertEquals("after " + input, simulator.getCurrentState(), machine.currentState());
        assertEquals("after " + input, simulated, host.executed);
      } while (expected.getOutcome() != DispatchOutcome.NO_PENDING_EVENT);
    }
    assertEquals("Checking", machine.currentState());
  }

  @Test
  public void testPeriodicTimersMatchSimulator() throws Exception {
    final FsmDefinition definition = Fixtures.compile(Fixtures.BLINK);
    final List<String> simulated = new ArrayList<>();
    final Simulator simulator =
        new Simulator(guards(), (action, payload) -> simulated.add(action));
    simulator.load(definition);
    final RecordingHost host = new RecordingHost(guards());
    final GeneratedMachine machine = instantiate(definition, "", host);
    machine.start();

    final String[] script = {"start", "+350", "stop", "+1000", "Tick", "start", "+99", "+1"};
    for (final String input : script) {
      apply(input, simulator, machine);
      assertEquals(simulator.snapshot().getPendingEvents().size(), machine.pendingEvents());
      StepResult expected;
      do {
        expected = simulator.step();
        assertEquals(expected.getOutcome(), machine.step());
        assertEquals(simulator.getCurrentState(), machine.currentState());
      } while (expected.getOutcome() != DispatchOutcome.NO_PENDING_EVENT);
    }
    assertEquals(simulated, host.executed);
    assertTrue(host.executed.contains("late()"));
  }

  @Test
  public void testClockSaturationMatchesSimulator() throws Exception {
    final FsmDefinition definition = Fixtures.compile("fsm Far { [*] --> A "
        + "state A { entry / start_timer(t) } timer t = 9223372036854775807 -> Fire "
        + "A --> A : go A --> A : Fire }");
    final Simulator simulator = new Simulator();
    simulator.load(definition);
    final GeneratedMachine machine = instantiate(definition, "", new RecordingHost(guards()));
    machine.start();

    final String[] script = {"+10", "go", "+0", "+1", "+" + Long.MAX_VALUE, "+5"};
    replay(script, simulator, machine);
    assertEquals(0, machine.pendingEvents());
    assertEquals("A", machine.currentState());
  }

  @Test
  public void testFiringBoundMatchesSimulator() throws Exception {
    final FsmDefinition definition = Fixtures.compile(Fixtures.BLINK);
    final Simulator simulator = new Simulator(SimulatorConfigurationBuilder.newBuilder()
        .maxTimerFiringsPerTick(5).build(), GuardTable.empty(), ActionHandler.NO_OP);
    simulator.load(definition);
    final GeneratorOptions options =
        GeneratorOptionsBuilder.newBuilder().maxTimerFiringsPerTick(5).build();
    final GeneratedMachine machine =
        instantiate(definition, options, new RecordingHost(guards()));
    machine.start();

    final String[] script = {"start", "+1000000", "stop", "start", "+250", "+100"};
    replay(script, simulator, machine);
    assertEquals("Blinking", machine.currentState());
  }

  private static void replay(final String[] script, final Simulator simulator,
      final GeneratedMachine machine) throws Exception {
    for (final String input : script) {
      apply(input, simulator, machine);
      assertEquals("after " + input, simulator.snapshot().getPendingEvents().size(),
          machine.pendingEvents());
      StepResult expected;
      do {
        expected = simulator.step();
        assertEquals("after " + input, expected.getOutcome(), machine.step());
        assertEquals("after " + input, simulator.getCurrentState(), machine.currentState());
      } while (expected.getOutcome() != DispatchOutcome.NO_PENDING_EVENT);
    }
  }

  private static void apply(final String input, final Simulator simulator,
      final GeneratedMachine machine) throws Exception {
    if (input.startsWith("+")) {
      final long units = Long.parseLong(input.substring(1));
      simulator.tick(units);
      machine.tick(units);
      return;
    }
    final int split = input.indexOf('=');
    final String event = split < 0 ? input : input.substring(0, split);
    final Object payload = split < 0 ? null : Integer.valueOf(input.substring(split + 1));
    simulator.postEvent(event, payload);
    machine.post(event, payload);
  }

  private GeneratedMachine instantiate(final FsmDefinition definition, final String packageName,
      final MachineHost host) throws Exception {
    return instantiate(definition,
        GeneratorOptionsBuilder.newBuilder().packageName(packageName).build(), host);
  }

  private GeneratedMachine instantiate(final FsmDefinition definition,
      final GeneratorOptions options, final MachineHost host) throws Exception {
    final String packageName = options.getPackageName();
    final String source = new CodeGenerator().generate(definition, "standard", options);
    final String simpleName = CodeGenerator.className(definition, options);
    final String className = packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    final Class<?> type = compiler.compile(className, source);
    return (GeneratedMachine) type.getConstructor(MachineHost.class).newInstance(host);
  }

  private static GuardTable guards() {
    return GuardTableBuilder.newBuilder()
        .guard("amount > 100", payload -> payload instanceof Integer && (Integer) payload > 100)
        .guard("vip", payload -> payload instanceof Integer && (Integer) payload > 1000)
        .guard("noisy", payload -> {
          throw new IllegalStateException("sensor offline");
        }).build();
  }

  private static final class RecordingHost implements MachineHost {
    private final GuardTable guards;
    private final List<String> executed = new ArrayList<>();

    private RecordingHost(final GuardTable guards) {
      this.guards = guards;
    }

    @Override
    public boolean evaluate(final String guard, final Object payload) throws Exception {
      return guards.evaluate(guard, payload);
    }

    @Override
    public void execute(final String action, final Object payload) {
      executed.add(action);
    }
  }
}
