package ca.gc.cra.subconv.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedStructures() {
    Map<String, Object> root = json.parseObject("{\"a\":1,\"b\":[\"x\",true,null],\"c\":{\"d\":\"e\"}}");

    assertEquals(1, ((Number) root.get("a")).intValue());
    assertEquals(Arrays.asList("x", Boolean.TRUE, null), root.get("b"));
    assertEquals(Map.of("d", "e"), root.get("c"));
  }

  @Test
  void rejectsNonObjectRoot() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1,2]"));
  }

  @Test
  void rejectsEmptyAndMalformedDocuments() {
    assertThrows(IllegalArgumentException.class, () -> json.parse(""));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":}"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
  }

  @Test
  void writeObjectKeepsOrderAndTypes() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("v", "2");
    fields.put("port", 443);
    fields.put("skip", null);
    fields.put("tls", Boolean.TRUE);
    fields.put("alpn", List.of("h2"));

    assertEquals("{\"v\":\"2\",\"port\":443,\"tls\":true,\"alpn\":\"[h2]\"}", json.writeObject(fields));
  }
}
