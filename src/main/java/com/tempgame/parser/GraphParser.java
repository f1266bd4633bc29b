package com.tempgame.parser;

import com.tempgame.model.TemporalGraph;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public final class GraphParser {
  public enum Format {
    AUTO, EXPLICIT, JSON
  }

  private GraphParser() {}

  public static TemporalGraph parse(Path path, Format format) throws IOException {
    Format resolved = format == Format.AUTO ? detect(path) : format;
    try (BufferedReader reader = Files.newBufferedReader(path)) {
      return switch (resolved) {
        case JSON -> JsonGraphParser.parse(reader);
        case EXPLICIT -> ExplicitGraphParser.parse(reader.lines());
        case AUTO -> throw new AssertionError();
      };
    }
  }

  static Format detect(Path path) {
    return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json") ? Format.JSON : Format.EXPLICIT;
  }
}
