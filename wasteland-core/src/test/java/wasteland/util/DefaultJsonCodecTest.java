package wasteland.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void emptyTagListEncodesAsNull() {
    assertNull(codec.toJsonArray(List.of()));
    assertNull(codec.toJsonArray(null));
  }

  @Test
  void tagListEncodesAsCompactArray() {
    assertEquals("[\"go\",\"federation\"]", codec.toJsonArray(List.of("go", "federation")));
  }

  @Test
  void arrayEscapesSpecialCharacters() {
    String json = codec.toJsonArray(List.of("say \"hi\"\nback\\slash"));

    assertTrue(json.contains("\\\"hi\\\""));
    assertTrue(json.contains("\\n"));
    assertTrue(json.contains("\\\\"));
    assertEquals(List.of("say \"hi\"\nback\\slash"), codec.parseArray(json));
  }

  @Test
  void arrayWithNullElementThrows() {
    List<String> values = new java.util.ArrayList<>();
    values.add(null);

    assertThrows(IllegalArgumentException.class, () -> codec.toJsonArray(values));
  }

  @Test
  void parseArrayToleratesWhitespaceAndNull() {
    assertEquals(List.of("a", "b"), codec.parseArray(" [ \"a\" , \"b\" ] "));
    assertTrue(codec.parseArray(null).isEmpty());
    assertTrue(codec.parseArray("").isEmpty());
    assertTrue(codec.parseArray("null").isEmpty());
    assertTrue(codec.parseArray("[]").isEmpty());
  }

  @Test
  void parseArrayRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseArray("{\"a\":1}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseArray("[\"a\""));
    assertThrows(IllegalArgumentException.class, () -> codec.parseArray("[1,2]"));
  }

  @Test
  void toJsonLeavesNumbersUnquoted() {
    Map<String, Object> valence = new LinkedHashMap<>();
    valence.put("quality", 5);
    valence.put("reliability", 4);

    assertEquals("{\"quality\": 5, \"reliability\": 4}", codec.toJson(valence));
  }

  @Test
  void toJsonQuotesStringsAndHandlesNull() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("note", "ok");
    values.put("missing", null);

    assertEquals("{\"note\": \"ok\", \"missing\": null}", codec.toJson(values));
    assertEquals("{}", codec.toJson(Map.of()));
  }

  @Test
  void toJsonWithNullKeyThrows() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(null, 1);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.toJson(values));
    assertTrue(ex.getMessage().contains("null keys"));
  }

  @Test
  void parseObjectReturnsLiteralText() {
    Map<String, String> parsed = codec.parseObject("{\"quality\": 5, \"reliability\":3, \"note\": \"x\"}");

    assertEquals("5", parsed.get("quality"));
    assertEquals("3", parsed.get("reliability"));
    assertEquals("x", parsed.get("note"));
  }

  @Test
  void parseObjectRejectsNestedValues() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\": {\"b\": 1}}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1]"));
    assertTrue(codec.parseObject(null).isEmpty());
  }
}
