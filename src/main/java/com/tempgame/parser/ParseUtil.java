package com.tempgame.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.tempgame.grammar.TimeConstraintLexer;
import com.tempgame.grammar.TimeConstraintParser;
import com.tempgame.grammar.TimeConstraintVisitor;
import com.tempgame.model.Player;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ConsoleErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

final class ParseUtil {
  private ParseUtil() {}

  static <T> T parse(String formula, TimeConstraintVisitor<T> visitor) {
    try {
      TimeConstraintLexer lexer = new TimeConstraintLexer(CharStreams.fromString(formula));
      lexer.removeErrorListener(ConsoleErrorListener.INSTANCE);
      lexer.addErrorListener(TokenErrorListener.INSTANCE);
      CommonTokenStream tokens = new CommonTokenStream(lexer);
      TimeConstraintParser parser = new TimeConstraintParser(tokens);
      parser.removeErrorListener(ConsoleErrorListener.INSTANCE);
      parser.setErrorHandler(new BailErrorStrategy());
      return visitor.visit(parser.constraint());
    } catch (ParseCancellationException e) {
      String reason = e.getMessage() == null ? "" : ": " + e.getMessage();
      throw new IllegalArgumentException("Failed to parse formula '%s'%s".formatted(formula, reason), e);
    }
  }

  static int parseInteger(int line, String token) {
    try {
      int value = Integer.parseInt(token);
      if (value < 0) {
        throw new MalformedInputException(line, "Expected a non-negative integer, got '%s'".formatted(token));
      }
      return value;
    } catch (NumberFormatException e) {
      throw new MalformedInputException(line, "Expected a non-negative integer, got '%s'".formatted(token), e);
    }
  }

  static Player parseOwner(int line, String token) {
    try {
      return Player.parse(token);
    } catch (IllegalArgumentException e) {
      throw new MalformedInputException(line, "Expected owner controller/opponent or 0/1, got '%s'".formatted(token), e);
    }
  }

  static Player parseOwner(JsonPrimitive primitive) {
    return parseOwner(0, primitive.getAsString());
  }

  static int parseInteger(JsonElement element) {
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
      throw new MalformedInputException("Expected a non-negative integer, got %s".formatted(element));
    }
    return parseInteger(0, element.getAsString());
  }

  static Stream<JsonElement> stream(JsonArray array) {
    return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
        Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
  }

  private static final class TokenErrorListener extends BaseErrorListener {
    static final TokenErrorListener INSTANCE = new TokenErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
        String msg, RecognitionException e) {
      throw new ParseCancellationException("column %d: %s".formatted(charPositionInLine, msg), e);
    }
  }
}
