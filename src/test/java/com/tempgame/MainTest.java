package com.tempgame;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

public class MainTest {
  private static final String GRAPH = """
      vertex s controller
      vertex t controller
      vertex u controller
      edge s t 0
      edge s u 0
      """;

  @TempDir
  Path directory;

  private Path graph;
  private Path output;
  private StringWriter err;

  @BeforeEach
  void writeGraph() throws IOException {
    graph = Files.writeString(directory.resolve("choice.tg"), GRAPH);
    output = directory.resolve("out.txt");
    err = new StringWriter();
  }

  private int run(String... args) {
    CommandLine commandLine = Main.commandLine();
    commandLine.setErr(new PrintWriter(err, true));
    return commandLine.execute(args);
  }

  @Test
  void reportsInitialWinningSet() throws IOException {
    int exitCode = run("-O", output.toString(), graph.toString(), "t", "1");

    assertEquals(0, exitCode, err.toString());
    assertEquals(List.of("{s,t}"), Files.readAllLines(output));
  }

  @Test
  void zeroDeadline() throws IOException {
    assertEquals(0, run("-O", output.toString(), graph.toString(), "t", "0"));
    assertEquals(List.of("{t}"), Files.readAllLines(output));
  }

  @Test
  void writesTableAndStrategy() throws IOException {
    int exitCode = run("--table", "--strategy", "--no-periodicity", "-O", output.toString(),
        graph.toString(), "t", "1");

    assertEquals(0, exitCode, err.toString());
    assertEquals(List.of("0: {s,t}", "1: {t}", "0: [s->t]"), Files.readAllLines(output));
  }

  @Test
  void solvesGuardedGraph() throws IOException {
    Path guarded = Files.writeString(directory.resolve("guarded.tg"), """
        vertex s0 controller
        vertex s1 controller
        edge s0 s0 true
        edge s1 s1 true
        edge s0 s1 (>= x 5)
        """);

    assertEquals(0, run("-O", output.toString(), guarded.toString(), "s1", "5"), err.toString());
    assertEquals(List.of("{s1}"), Files.readAllLines(output));
    assertEquals(0, run("-O", output.toString(), guarded.toString(), "s1", "1000000"), err.toString());
    assertEquals(List.of("{s0,s1}"), Files.readAllLines(output));
  }

  @Test
  void readsJson() throws IOException {
    Path json = Files.writeString(directory.resolve("choice.json"), """
        {"vertices": {"a": "opponent", "b": "controller", "c": "controller"},
         "edges": [{"from": "a", "to": "b", "at": 0}, {"from": "a", "to": "c", "at": 0}]}
        """);

    assertEquals(0, run("-O", output.toString(), "--policy", "at_deadline", json.toString(), "b", "1"));
    assertEquals(List.of("{}"), Files.readAllLines(output));
    assertEquals(0, run("-O", output.toString(), "--reacher", "opponent", json.toString(), "b", "1"));
    assertEquals(List.of("{a,b,c}"), Files.readAllLines(output));
  }

  @Test
  void unknownTargetVertex() {
    int exitCode = run("-O", output.toString(), graph.toString(), "t,nowhere", "3");

    assertEquals(Main.EXIT_UNKNOWN_VERTEX, exitCode);
    assertTrue(err.toString().startsWith("UnknownVertex:"), err.toString());
    assertTrue(err.toString().contains("nowhere"), err.toString());
    assertTrue(Files.notExists(output));
  }

  @Test
  void malformedGraph() throws IOException {
    Path broken = Files.writeString(directory.resolve("broken.tg"), "vertex s controller\nedge s s soon\n");

    assertEquals(Main.EXIT_MALFORMED_INPUT, run(broken.toString(), "s", "1"));
    assertTrue(err.toString().startsWith("MalformedInput: Line 2"), err.toString());
  }

  @Test
  void invalidArguments() {
    assertEquals(CommandLine.ExitCode.SOFTWARE, run("--", graph.toString(), "t", "-1"));
    assertTrue(err.toString().contains("Deadline"), err.toString());
    assertEquals(CommandLine.ExitCode.USAGE, run(graph.toString(), "t"));
    assertEquals(CommandLine.ExitCode.SOFTWARE,
        run("--strategy", "--retention", "last", graph.toString(), "t", "1"));
  }

  @Test
  void missingGraphFile() {
    assertEquals(CommandLine.ExitCode.SOFTWARE, run(directory.resolve("missing.tg").toString(), "t", "1"));
    assertTrue(err.toString().startsWith("IOError:"), err.toString());
  }
}
