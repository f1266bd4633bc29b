package com.tempgame.parser;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tempgame.model.TemporalGraph;
import com.tempgame.model.TimeConstraint;
import java.io.Reader;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Parses graphs given as JSON.
 *
 * <pre>
 * {
 *   "period": 4,
 *   "vertices": {"s": "controller", "t": "opponent"},
 *   "edges": [
 *     {"from": "s", "to": "t", "at": [0, 2]},
 *     {"from": "t", "to": "s", "when": "(>= x 5)"}
 *   ]
 * }
 * </pre>
 */
public final class JsonGraphParser {
  private JsonGraphParser() {}

  public static TemporalGraph parse(Reader reader) {
    JsonElement element;
    try {
      element = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new MalformedInputException("Invalid JSON: " + e.getMessage(), e);
    }
    if (!element.isJsonObject()) {
      throw new MalformedInputException("Expected a JSON object, got %s".formatted(element));
    }
    return parse(element.getAsJsonObject());
  }

  public static TemporalGraph parse(JsonObject json) {
    try {
      TemporalGraph.Builder builder = TemporalGraph.builder();
      @Nullable
      JsonElement period = json.get("period");
      if (period != null && !period.isJsonNull()) {
        builder.period(ParseUtil.parseInteger(period));
      }

      JsonObject vertices = require(json, "vertices").getAsJsonObject();
      for (Map.Entry<String, JsonElement> entry : vertices.entrySet()) {
        builder.addVertex(entry.getKey(), ParseUtil.parseOwner(entry.getValue().getAsJsonPrimitive()));
      }

      @Nullable
      JsonElement edges = json.get("edges");
      if (edges != null) {
        for (JsonElement edgeElement : edges.getAsJsonArray()) {
          JsonObject edge = edgeElement.getAsJsonObject();
          String source = require(edge, "from").getAsString();
          String destination = require(edge, "to").getAsString();
          @Nullable
          JsonElement guard = edge.get("when");
          if (guard != null && !guard.isJsonNull()) {
            if (edge.has("at")) {
              throw new MalformedInputException("Edge %s has both 'at' and 'when'".formatted(edge));
            }
            builder.addEdge(source, destination, TimeConstraint.of(TimeFormulaParser.parse(guard.getAsString())));
            continue;
          }
          JsonElement at = require(edge, "at");
          List<JsonElement> instants = at.isJsonArray() ? ParseUtil.stream(at.getAsJsonArray()).toList() : List.of(at);
          for (JsonElement instant : instants) {
            builder.addEdge(source, destination, ParseUtil.parseInteger(instant));
          }
        }
      }
      return builder.build();
    } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
      throw new MalformedInputException(e.getMessage(), e);
    }
  }

  private static JsonElement require(JsonObject object, String member) {
    JsonElement element = object.get(member);
    if (element == null || element.isJsonNull()) {
      throw new MalformedInputException("Missing '%s' in %s".formatted(member, object));
    }
    return element;
  }
}
