package ca.gc.cra.subconv.infrastructure.uri;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryStringTest {

  @Test
  void firstOccurrenceWinsAndOrderIsKept() {
    Map<String, String> values = QueryString.parse("b=2&a=1&b=3&flag");

    assertEquals(List.of("b", "a", "flag"), List.copyOf(values.keySet()));
    assertEquals("2", values.get("b"));
    assertEquals("", values.get("flag"));
  }

  @Test
  void semicolonIsData() {
    Map<String, String> values = QueryString.parse("plugin=obfs-local%3Bobfs%3Dhttp;x=1");

    assertEquals("obfs-local;obfs=http;x=1", values.get("plugin"));
  }

  @Test
  void valueMayContainEquals() {
    assertEquals("a=b", QueryString.parse("k=a=b").get("k"));
  }

  @Test
  void malformedPairsAreDropped() {
    Map<String, String> values = QueryString.parse("bad=%zz&good=1");

    assertEquals(Map.of("good", "1"), values);
  }

  @Test
  void emptyInputYieldsEmptyMap() {
    assertTrue(QueryString.parse(null).isEmpty());
    assertTrue(QueryString.parse("").isEmpty());
  }

  @Test
  void formatEncodesReservedCharacters() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("path", "/ws?ed=2048");
    values.put("name", "a b");

    assertEquals("path=%2Fws%3Fed%3D2048&name=a+b", QueryString.format(values));
  }
}
