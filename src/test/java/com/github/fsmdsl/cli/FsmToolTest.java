package com.github.fsmdsl.cli;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.fsmdsl.Fixtures;

/**
 * Drives the command line entry point against files in a temporary folder.
 */
public class FsmToolTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private ByteArrayOutputStream outBytes;
  private ByteArrayOutputStream errBytes;

  @Before
  public void resetStreams() {
    outBytes = new ByteArrayOutputStream();
    errBytes = new ByteArrayOutputStream();
  }

  @Test
  public void testValidate() throws IOException {
    final String order = write("order.fsm", Fixtures.ORDER);
    assertEquals(FsmTool.EXIT_OK, run("validate", order));
    assertEquals(Arrays.asList(order + ": fsm Order is valid (5 states, 8 transitions, 0 warnings)"),
        out());
    assertEquals("", err());
  }

  @Test
  public void testValidateReportsWarnings() throws IOException {
    final String file = write("w.fsm", "fsm W { [*] --> A state A state B A --> A : go }");
    assertEquals(FsmTool.EXIT_OK, run("validate", file));
    assertTrue(err().contains(file + ":1:"));
    assertTrue(err().contains(": warning: UNREACHABLE_STATE: "));
    assertEquals(Arrays.asList(file + ": fsm W is valid (2 states, 1 transitions, 1 warnings)"),
        out());
  }

  @Test
  public void testValidateFailures() throws IOException {
    final String broken = write("broken.fsm", "fsm T { [*] --> }");
    assertEquals(FsmTool.EXIT_FAILURE, run("validate", broken));
    assertTrue(err(), err().startsWith(broken + ":1:17: error: SYNTAX_ERROR: expected "));

    resetStreams();
    final String invalid = write("invalid.fsm", "fsm T { state A }");
    assertEquals(FsmTool.EXIT_FAILURE, run("validate", invalid));
    assertTrue(err().contains(": error: MISSING_INITIAL: "));
    assertTrue(out().isEmpty());

    resetStreams();
    assertEquals(FsmTool.EXIT_FAILURE,
        run("validate", new File(folder.getRoot(), "absent.fsm").getPath()));
    assertTrue(err().startsWith("error: IO_FAILURE: "));
  }

  @Test
  public void testGenerate() throws IOException {
    final String traffic = write("traffic.fsm", Fixtures.TRAFFIC);
    assertEquals(FsmTool.EXIT_OK,
        run("generate", "--target", "standard", "--package", "com.example", traffic));
    final String source = new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    assertTrue(source.startsWith("package com.example;"));
    assertTrue(source.contains("public final class TrafficMachine implements GeneratedMachine"));

    resetStreams();
    assertEquals(FsmTool.EXIT_FAILURE, run("generate", "--target", "fancy", traffic));
    assertTrue(err().startsWith("error: UNKNOWN_TARGET: "));

    resetStreams();
    assertEquals(FsmTool.EXIT_FAILURE,
        run("generate", "--target", "standard", "--class", "State", traffic));
    assertTrue(err().startsWith("error: INVALID_CONFIG: "));

    resetStreams();
    assertEquals(FsmTool.EXIT_USAGE, run("generate", traffic));
    assertTrue(err().contains("usage: fsm validate <file>"));
  }

  @Test
  public void testGraph() throws IOException {
    final String file = write("rg.fsm", Fixtures.RED_GREEN);
    assertEquals(FsmTool.EXIT_OK, run("graph", file));
    final String json = new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"name\" : \"T\""));
    assertTrue(json.contains("\"label\" : \"go\""));
  }

  @Test
  public void testSimulate() throws IOException {
    final String file = write("rg.fsm", Fixtures.RED_GREEN);
    assertEquals(FsmTool.EXIT_OK, run("simulate", file, "go", "nope"));
    assertEquals(Arrays.asList("start: Red", "1: Red --go--> Green",
        "2: Green --nope--> (unmatched)", "final: Green"), out());
  }

  @Test
  public void testSimulateWithGuardsAndTicks() throws IOException {
    final String file = write("traffic.fsm", Fixtures.TRAFFIC);
    assertEquals(FsmTool.EXIT_OK, run("simulate", file, "go", "+5"));
    assertEquals(Arrays.asList("start: Red", "1: Red --go--> (unmatched)",
        "2: Red --tick--> (unmatched)", "final: Red"), out());

    resetStreams();
    assertEquals(FsmTool.EXIT_OK, run("simulate", "--guard", "clear", file, "go", "+5"));
    assertEquals(Arrays.asList("start: Red",
        "1: Red --go--> Green [stop_timer(cycle), log(go), lamp(green)]", "final: Green"), out());

    resetStreams();
    assertEquals(FsmTool.EXIT_USAGE, run("simulate", file, "+soon"));
  }

  @Test
  public void testUsage() {
    assertEquals(FsmTool.EXIT_USAGE, run());
    assertTrue(err().startsWith("error: missing command"));
    resetStreams();
    assertEquals(FsmTool.EXIT_USAGE, run("explode"));
    assertTrue(err().startsWith("error: unknown command explode"));
    resetStreams();
    assertEquals(FsmTool.EXIT_USAGE, run("validate"));
  }

  private int run(final String... args) {
    final PrintStream out = new PrintStream(outBytes, true);
    final PrintStream err = new PrintStream(errBytes, true);
    return new FsmTool().run(args, out, err);
  }

  private List<String> out() {
    final String text = new String(outBytes.toByteArray(), StandardCharsets.UTF_8).trim();
    return text.isEmpty() ? Arrays.<String>asList() : Arrays.asList(text.split("\\R"));
  }

  private String err() {
    return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
  }

  private String write(final String name, final String source) throws IOException {
    final File file = folder.newFile(name);
    Files.write(file.toPath(), source.getBytes(StandardCharsets.UTF_8));
    return file.getPath();
  }
}
