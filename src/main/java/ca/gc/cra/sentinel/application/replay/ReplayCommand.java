package ca.gc.cra.sentinel.application.replay;

import ca.gc.cra.sentinel.application.registry.RegistryError;
import ca.gc.cra.sentinel.application.registry.RegistryException;
import ca.gc.cra.sentinel.domain.access.Principal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed mutation-log entry: an operation name, the calling principal, and its arguments.
 *
 * <p>Typed accessors raise {@link RegistryError#INVALID_INPUT} when a field is missing or has the wrong JSON
 * type, so a bad line is reported like any other rejected command.</p>
 *
 * @param lineNumber 1-based line in the log
 * @param op operation name, for example {@code createAlert}
 * @param fields every field of the JSON object, including {@code op} and {@code caller}
 * @since 0.1.0
 */
record ReplayCommand(int lineNumber, String op, Map<String, Object> fields) {

  ReplayCommand {
    Objects.requireNonNull(op, "op");
    Map<String, Object> present = new LinkedHashMap<>();
    fields.forEach((key, value) -> {
      if (value != null) {
        present.put(key, value);
      }
    });
    fields = Collections.unmodifiableMap(present);
  }

  static ReplayCommand from(int lineNumber, Map<String, Object> json) {
    Object op = json.get("op");
    if (!(op instanceof String name) || name.isBlank()) {
      throw invalid("missing op");
    }
    return new ReplayCommand(lineNumber, name.trim(), json);
  }

  Principal caller() {
    return principal("caller");
  }

  Principal principal(String key) {
    try {
      return Principal.of(text(key));
    } catch (IllegalArgumentException ex) {
      throw invalid(key + " must be a principal id");
    }
  }

  String text(String key) {
    Object value = require(key);
    if (!(value instanceof String text)) {
      throw invalid(key + " must be a string");
    }
    return text;
  }

  String optionalText(String key) {
    Object value = fields.get(key);
    return value instanceof String text ? text : null;
  }

  long longValue(String key) {
    Object value = require(key);
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big && big.bitLength() < 64) {
      return big.longValue();
    }
    throw invalid(key + " must be an integer");
  }

  int intValue(String key) {
    long value = longValue(key);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw invalid(key + " is out of range");
    }
    return (int) value;
  }

  double doubleValue(String key) {
    Object value = require(key);
    if (!(value instanceof Number number)) {
      throw invalid(key + " must be a number");
    }
    return number.doubleValue();
  }

  boolean booleanValue(String key) {
    Object value = require(key);
    if (!(value instanceof Boolean flag)) {
      throw invalid(key + " must be true or false");
    }
    return flag;
  }

  List<String> textList(String key) {
    Object value = require(key);
    if (!(value instanceof List<?> raw)) {
      throw invalid(key + " must be an array");
    }
    List<String> out = new ArrayList<>(raw.size());
    for (Object element : raw) {
      if (!(element instanceof String text)) {
        throw invalid(key + " must contain only strings");
      }
      out.add(text);
    }
    return out;
  }

  <E extends Enum<E>> E enumValue(String key, Class<E> type) {
    String raw = text(key);
    try {
      return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalid(key + " has unknown value " + raw);
    }
  }

  private Object require(String key) {
    Object value = fields.get(key);
    if (value == null) {
      throw invalid("missing " + key);
    }
    return value;
  }

  static RegistryException invalid(String message) {
    return new RegistryException(RegistryError.INVALID_INPUT, message);
  }
}
