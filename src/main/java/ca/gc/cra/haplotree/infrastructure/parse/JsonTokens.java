package ca.gc.cra.haplotree.infrastructure.parse;

import ca.gc.cra.haplotree.application.port.TreeParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;

/**
 * Small streaming helpers shared by the tree format parsers.
 */
final class JsonTokens {

  private JsonTokens() {}

  static void expect(JsonParser parser, JsonToken actual, JsonToken expected, String context)
      throws TreeParseException {
    if (actual != expected) {
      throw new TreeParseException(
          "Expected " + expected + " for " + context + " but found " + actual + " at " + location(parser));
    }
  }

  /**
   * Reads the current scalar as text; {@code null} for JSON null.
   */
  static String text(JsonParser parser) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
      parser.skipChildren();
      return null;
    }
    return parser.getText();
  }

  /**
   * Reads the current scalar as a long; {@code null} for JSON null or non-numeric text.
   */
  static Long number(JsonParser parser) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NUMBER_INT) {
      return parser.getLongValue();
    }
    if (token == JsonToken.VALUE_STRING) {
      String raw = parser.getText().trim();
      try {
        return raw.isEmpty() ? null : Long.parseLong(raw);
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
      parser.skipChildren();
    }
    return null;
  }

  static String location(JsonParser parser) {
    return "line " + parser.currentLocation().getLineNr() + ", column " + parser.currentLocation().getColumnNr();
  }
}
