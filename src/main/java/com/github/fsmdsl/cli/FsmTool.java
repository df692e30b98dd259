package com.github.fsmdsl.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmdsl.FsmException;
import com.github.fsmdsl.FsmException.Code;
import com.github.fsmdsl.FsmPipeline;
import com.github.fsmdsl.codegen.CodeGenerator;
import com.github.fsmdsl.codegen.GeneratorOptions;
import com.github.fsmdsl.codegen.GeneratorOptions.GeneratorOptionsBuilder;
import com.github.fsmdsl.graph.GraphCodec;
import com.github.fsmdsl.graph.GraphExporter;
import com.github.fsmdsl.model.Diagnostic;
import com.github.fsmdsl.model.FsmDefinition;
import com.github.fsmdsl.model.ValidationResult;
import com.github.fsmdsl.parse.DslSyntaxException;
import com.github.fsmdsl.runtime.ActionHandler;
import com.github.fsmdsl.sim.GuardTable;
import com.github.fsmdsl.sim.GuardTable.GuardTableBuilder;
import com.github.fsmdsl.sim.Simulator;
import com.github.fsmdsl.sim.StepResult;
import com.github.fsmdsl.sim.TraceEntry;

/**
 * Command line front end.
 *
 * <pre>
 * validate &lt;file&gt;
 * generate --target &lt;name&gt; [--package &lt;pkg&gt;] [--class &lt;name&gt;] &lt;file&gt;
 * graph &lt;file&gt;
 * simulate [--guard &lt;text&gt;]... &lt;file&gt; [&lt;event&gt; | +&lt;units&gt;]...
 * </pre>
 *
 * Exit codes: 0 success, 1 the model or a command failed, 2 bad usage. In simulate, guards listed
 * with --guard hold and every other guard is false; a {@code +N} argument advances the clock by N
 * units and steps the events posted by expiring timers.
 */
public final class FsmTool {
  private static final Logger logger = LogManager.getLogger(FsmTool.class.getSimpleName());

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE = "usage: fsm validate <file>\n"
      + "       fsm generate --target <name> [--package <pkg>] [--class <name>] <file>\n"
      + "       fsm graph <file>\n"
      + "       fsm simulate [--guard <text>]... <file> [<event> | +<units>]...";

  private final FsmPipeline pipeline = new FsmPipeline();

  public static void main(String[] args) {
    System.exit(new FsmTool().run(args, System.out, System.err));
  }

  public int run(final String[] args, final PrintStream out, final PrintStream err) {
    if (args == null || args.length == 0) {
      return usage(err, "missing command");
    }
    final List<String> rest = new ArrayList<>();
    for (int iter = 1; iter < args.length; iter++) {
      rest.add(args[iter]);
    }
    try {
      switch (args[0]) {
        case "validate":
          return validate(rest, out, err);
        case "generate":
          return generate(rest, out, err);
        case "graph":
          return graph(rest, out, err);
        case "simulate":
          return simulate(rest, out, err);
        default:
          return usage(err, "unknown command " + args[0]);
      }
    } catch (UsageException problem) {
      return usage(err, problem.getMessage());
    } catch (FsmException problem) {
      logger.debug("Command " + args[0] + " failed", problem);
      err.println("error: " + problem.getCode() + ": " + problem.getMessage());
      return EXIT_FAILURE;
    }
  }

  private int validate(final List<String> args, final PrintStream out, final PrintStream err)
      throws FsmException, UsageException {
    final String file = single(args);
    final ValidationResult result = compile(file, err);
    if (result == null || !result.isValid()) {
      return EXIT_FAILURE;
    }
    final FsmDefinition definition = result.getDefinition();
    out.println(file + ": fsm " + definition.getName() + " is valid ("
        + definition.getStates().size() + " states, " + definition.getTransitions().size()
        + " transitions, " + result.getWarnings().size() + " warnings)");
    return EXIT_OK;
  }

  private int generate(final List<String> args, final PrintStream out, final PrintStream err)
      throws FsmException, UsageException {
    String target = null;
    final GeneratorOptionsBuilder options = GeneratorOptionsBuilder.newBuilder();
    String file = null;
    for (int iter = 0; iter < args.size(); iter++) {
      final String arg = args.get(iter);
      if ("--target".equals(arg)) {
        target = value(args, ++iter, arg);
      } else if ("--package".equals(arg)) {
        options.packageName(value(args, ++iter, arg));
      } else if ("--class".equals(arg)) {
        options.className(value(args, ++iter, arg));
      } else if (arg.startsWith("--") || file != null) {
        throw new UsageException("unexpected argument " + arg);
      } else {
        file = arg;
      }
    }
    if (target == null || file == null) {
      throw new UsageException("generate needs --target and a file");
    }
    final GeneratorOptions generatorOptions = options.build();
    final FsmDefinition definition = definition(file, err);
    if (definition == null) {
      return EXIT_FAILURE;
    }
    out.print(new CodeGenerator().generate(definition, target, generatorOptions));
    return EXIT_OK;
  }

  private int graph(final List<String> args, final PrintStream out, final PrintStream err)
      throws FsmException, UsageException {
    final FsmDefinition definition = definition(single(args), err);
    if (definition == null) {
      return EXIT_FAILURE;
    }
    out.println(new GraphCodec().write(new GraphExporter().export(definition)));
    return EXIT_OK;
  }

  private int simulate(final List<String> args, final PrintStream out, final PrintStream err)
      throws FsmException, UsageException {
    final GuardTableBuilder guards = GuardTableBuilder.newBuilder();
    String file = null;
    final List<String> inputs = new ArrayList<>();
    for (int iter = 0; iter < args.size(); iter++) {
      final String arg = args.get(iter);
      if (file == null && "--guard".equals(arg)) {
        guards.constant(value(args, ++iter, arg), true);
      } else if (file == null && arg.startsWith("--")) {
        throw new UsageException("unexpected argument " + arg);
      } else if (file == null) {
        file = arg;
      } else {
        inputs.add(arg);
      }
    }
    if (file == null) {
      throw new UsageException("simulate needs a file");
    }
    final FsmDefinition definition = definition(file, err);
    if (definition == null) {
      return EXIT_FAILURE;
    }
    final GuardTable guardTable = guards.build();
    final Simulator simulator = new Simulator(guardTable, ActionHandler.NO_OP);
    simulator.load(definition);
    out.println("start: " + simulator.getCurrentState());
    for (final String input : inputs) {
      if (input.startsWith("+")) {
        simulator.tick(units(input));
      } else {
        simulator.postEvent(input);
      }
      StepResult result;
      while ((result = simulator.step()).getTraceEntry() != null) {
        out.println(describe(result.getTraceEntry()));
      }
    }
    out.println("final: " + simulator.getCurrentState());
    return EXIT_OK;
  }

  private static String describe(final TraceEntry entry) {
    final StringBuilder line = new StringBuilder().append(entry.getSequence()).append(": ")
        .append(entry.getFrom()).append(" --").append(entry.getEvent()).append("--> ");
    if (entry.isUnmatched()) {
      return line.append("(unmatched)").toString();
    }
    line.append(String.join(" -> ", entry.getPath().subList(1, entry.getPath().size())));
    if (!entry.getActions().isEmpty()) {
      line.append(' ').append(entry.getActions());
    }
    return line.toString();
  }

  /**
   * Reads, parses and validates a file, reporting problems as compiler-style lines on err. Returns
   * null when the source does not parse.
   */
  private ValidationResult compile(final String file, final PrintStream err)
      throws FsmException {
    final String source = read(file);
    final ValidationResult result;
    try {
      result = pipeline.compile(source);
    } catch (DslSyntaxException problem) {
      err.println(file + ":" + problem.getPosition() + ": error: " + problem.getCode() + ": "
          + problem.getDetail());
      return null;
    }
    for (final Diagnostic diagnostic : result.getDiagnostics()) {
      err.println(file + ":" + diagnostic.format());
    }
    return result;
  }

  private FsmDefinition definition(final String file, final PrintStream err) throws FsmException {
    final ValidationResult result = compile(file, err);
    return result == null ? null : result.getDefinition();
  }

  private static String read(final String file) throws FsmException {
    final Path path = Paths.get(file);
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException problem) {
      throw new FsmException(Code.IO_FAILURE, "Cannot read " + file + ": " + problem);
    }
  }

  private static long units(final String input) throws UsageException {
    try {
      final long units = Long.parseLong(input.substring(1));
      if (units < 0L) {
        throw new UsageException("tick units cannot be negative: " + input);
      }
      return units;
    } catch (NumberFormatException problem) {
      throw new UsageException("not a tick: " + input);
    }
  }

  private static String single(final List<String> args) throws UsageException {
    if (args.size() != 1 || args.get(0).startsWith("--")) {
      throw new UsageException("expected exactly one file");
    }
    return args.get(0);
  }

  private static String value(final List<String> args, final int index, final String option)
      throws UsageException {
    if (index >= args.size()) {
      throw new UsageException(option + " needs a value");
    }
    return args.get(index);
  }

  private static int usage(final PrintStream err, final String problem) {
    err.println("error: " + problem);
    err.println(USAGE);
    return EXIT_USAGE;
  }

  private static final class UsageException extends Exception {
    private static final long serialVersionUID = 1L;

    private UsageException(final String message) {
      super(message);
    }
  }
}
