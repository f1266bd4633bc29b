package com.tempgame.output;

import com.tempgame.model.TemporalGraph;
import com.tempgame.model.Vertex;
import com.tempgame.solver.StrategyExtractor;
import com.tempgame.solver.WinningSet;
import com.tempgame.solver.WinningSetTable;
import java.io.PrintStream;
import java.util.Map;
import java.util.stream.Collectors;

public final class Formatter {
  private Formatter() {}

  public static String format(WinningSet winningSet, TemporalGraph graph) {
    return winningSet.vertices(graph).stream()
        .map(Vertex::name)
        .collect(Collectors.joining(",", "{", "}"));
  }

  public static String format(Map<Vertex, Vertex> moves) {
    return moves.entrySet().stream()
        .map(e -> "%s->%s".formatted(e.getKey().name(), e.getValue().name()))
        .collect(Collectors.joining(",", "[", "]"));
  }

  public static void writeTable(WinningSetTable table, TemporalGraph graph, PrintStream writer) {
    for (WinningSetTable.Row row : table.rows()) {
      writer.append("%d: %s".formatted(row.time(), format(row.winningSet(), graph))).println();
    }
  }

  public static void writeStrategy(StrategyExtractor strategy, WinningSetTable table, PrintStream writer) {
    for (int time = 0; time < table.deadline(); time++) {
      writer.append("%d: %s".formatted(time, format(strategy.moves(time)))).println();
    }
  }
}
