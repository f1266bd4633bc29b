package com.tempgame.parser;

import com.tempgame.model.TargetSet;
import com.tempgame.model.TemporalGraph;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Parses target set literals such as {@code s1, s3}. */
public final class TargetParser {
  private static final Pattern COMMA_PATTERN = Pattern.compile("\\s*,\\s*");

  private TargetParser() {}

  public static List<String> parseNames(String literal) {
    String stripped = literal.strip();
    if (stripped.isEmpty()) {
      return List.of();
    }
    List<String> names = Arrays.asList(COMMA_PATTERN.split(stripped, -1));
    for (String name : names) {
      if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
        throw new MalformedInputException("Invalid vertex name '%s' in target literal '%s'".formatted(name, literal));
      }
    }
    return List.copyOf(names);
  }

  public static TargetSet parse(String literal, TemporalGraph graph) {
    return TargetSet.of(graph, parseNames(literal));
  }
}
