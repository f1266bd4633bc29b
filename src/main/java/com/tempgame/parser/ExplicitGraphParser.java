package com.tempgame.parser;

import com.tempgame.model.TemporalGraph;
import com.tempgame.model.TimeConstraint;
import java.util.Iterator;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Parses the line based graph format.
 *
 * <pre>
 * # comment
 * period 4
 * vertex s controller
 * vertex t opponent
 * edge s t 0,2
 * edge t s (>= x 5)
 * </pre>
 *
 * <p>An edge is either usable at the listed instants or whenever the guard formula holds for the current time.
 */
public final class ExplicitGraphParser {
  private static final Pattern COMMA_PATTERN = Pattern.compile(" *, *");
  private static final Pattern SPACE_PATTERN = Pattern.compile("\\s+");

  private ExplicitGraphParser() {}

  public static TemporalGraph parse(Stream<String> lines) {
    TemporalGraph.Builder builder = TemporalGraph.builder();
    boolean seenEdge = false;
    boolean seenPeriod = false;
    int lineNumber = 0;
    Iterator<String> iterator = lines.iterator();
    while (iterator.hasNext()) {
      lineNumber += 1;
      String line = stripComment(iterator.next());
      if (line.isEmpty()) {
        continue;
      }
      String[] tokens = SPACE_PATTERN.split(line, 4);
      try {
        switch (tokens[0]) {
          case "period" -> {
            expectArity(lineNumber, tokens, 2, "period <length>");
            if (seenPeriod) {
              throw new MalformedInputException(lineNumber, "Duplicate period declaration");
            }
            if (seenEdge) {
              throw new MalformedInputException(lineNumber, "Period must be declared before any edge");
            }
            builder.period(ParseUtil.parseInteger(lineNumber, tokens[1]));
            seenPeriod = true;
          }
          case "vertex" -> {
            expectArity(lineNumber, tokens, 3, "vertex <name> <owner>");
            builder.addVertex(tokens[1], ParseUtil.parseOwner(lineNumber, tokens[2]));
          }
          case "edge" -> {
            if (tokens.length != 4) {
              throw new MalformedInputException(lineNumber,
                  "Expected 'edge <source> <destination> <instants or guard>', got '%s'".formatted(line));
            }
            String schedule = tokens[3].strip();
            if (isFormula(schedule)) {
              builder.addEdge(tokens[1], tokens[2], TimeConstraint.of(TimeFormulaParser.parse(schedule)));
            } else {
              for (String instant : COMMA_PATTERN.split(schedule)) {
                builder.addEdge(tokens[1], tokens[2], ParseUtil.parseInteger(lineNumber, instant));
              }
            }
            seenEdge = true;
          }
          default -> throw new MalformedInputException(lineNumber, "Unknown declaration '%s'".formatted(tokens[0]));
        }
      } catch (IllegalArgumentException | IllegalStateException e) {
        throw new MalformedInputException(lineNumber, e.getMessage(), e);
      }
    }
    try {
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new MalformedInputException(e.getMessage(), e);
    }
  }

  static boolean isFormula(String schedule) {
    return schedule.startsWith("(") || "true".equals(schedule) || "false".equals(schedule);
  }

  private static String stripComment(String line) {
    int comment = line.indexOf('#');
    return (comment == -1 ? line : line.substring(0, comment)).strip();
  }

  private static void expectArity(int line, String[] tokens, int arity, String usage) {
    if (tokens.length != arity) {
      throw new MalformedInputException(line, "Expected '%s', got '%s'".formatted(usage, String.join(" ", tokens)));
    }
  }
}
