package ca.gc.cra.sentinel.application.replay;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one mutation-log line. Commands are flat: each field holds a scalar or an array of scalars, so nested
 * objects are rejected along with anything after the closing brace.
 *
 * @since 0.1.0
 */
final class ReplayJson {
  private final JsonFactory factory = new JsonFactory();

  /**
   * @param line one log line
   * @return fields in document order; JSON {@code null} is kept as a {@code null} value
   * @throws IllegalArgumentException when the line is not exactly one flat JSON object
   */
  Map<String, Object> parseObject(String line) {
    try (JsonParser parser = factory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Command must be a JSON object");
      }
      Map<String, Object> fields = new LinkedHashMap<>();
      for (String name = parser.nextFieldName(); name != null; name = parser.nextFieldName()) {
        JsonToken token = parser.nextToken();
        fields.put(name, token == JsonToken.START_ARRAY ? scalars(parser, name) : scalar(parser, token, name));
      }
      if (parser.currentToken() != JsonToken.END_OBJECT) {
        throw new IllegalArgumentException("Malformed command object");
      }
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("Command line contains trailing content");
      }
      return fields;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON command: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unreadable command line", ex);
    }
  }

  private static List<Object> scalars(JsonParser parser, String field) throws IOException {
    List<Object> values = new ArrayList<>();
    for (JsonToken token = parser.nextToken(); token != JsonToken.END_ARRAY; token = parser.nextToken()) {
      if (token == JsonToken.START_ARRAY) {
        throw new IllegalArgumentException("Nested arrays are not supported (field " + field + ")");
      }
      values.add(scalar(parser, token, field));
    }
    return values;
  }

  private static Object scalar(JsonParser parser, JsonToken token, String field) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Command ends inside field " + field);
    }
    switch (token) {
      case VALUE_STRING:
        return parser.getText();
      case VALUE_NUMBER_INT:
      case VALUE_NUMBER_FLOAT:
        return parser.getNumberValue();
      case VALUE_TRUE:
      case VALUE_FALSE:
        return parser.getBooleanValue();
      case VALUE_NULL:
        return null;
      default:
        throw new IllegalArgumentException("Field " + field + " must be a scalar or an array of scalars");
    }
  }
}
