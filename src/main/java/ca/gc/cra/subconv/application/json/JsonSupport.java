package ca.gc.cra.subconv.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that parses payloads into {@link Map}/{@link List} structures and writes flat objects back out.
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses the supplied JSON string into a mutable object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails or the document is empty
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("JSON document is empty");
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a document whose root must be a JSON object.
   *
   * @param json JSON document; never {@code null}
   * @return root object fields in document order
   * @throws IllegalArgumentException when parsing fails or the root is not an object
   */
  public Map<String, Object> parseObject(String json) {
    Object root = parse(json);
    if (!(root instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("JSON root must be an object");
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      fields.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return fields;
  }

  /**
   * Writes a flat object. Numbers and booleans keep their JSON type; everything else is written as a string and
   * {@code null} values are skipped.
   *
   * @param fields field values in output order
   * @return compact JSON text
   */
  public String writeObject(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      for (Map.Entry<String, ?> entry : fields.entrySet()) {
        Object value = entry.getValue();
        if (value == null) {
          continue;
        }
        if (value instanceof Integer || value instanceof Long) {
          generator.writeNumberField(entry.getKey(), ((Number) value).longValue());
        } else if (value instanceof Boolean flag) {
          generator.writeBooleanField(entry.getKey(), flag);
        } else {
          generator.writeStringField(entry.getKey(), value.toString());
        }
      }
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write JSON", ex);
    }
    return out.toString();
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
