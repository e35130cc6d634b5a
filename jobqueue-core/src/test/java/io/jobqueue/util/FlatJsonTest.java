package io.jobqueue.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlatJsonTest {

  @Test
  void writesInInsertionOrderAndSkipsNulls() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("b", "2");
    fields.put("skip", null);
    fields.put("a", "one");

    assertEquals("{\"b\":\"2\",\"a\":\"one\"}", FlatJson.write(fields));
    assertEquals("{}", FlatJson.write(Map.of()));
  }

  @Test
  void escapesControlAndQuoteCharacters() {
    String value = "say \"hi\"\\\n\t\u0001";
    String json = FlatJson.write(Map.of("k", value));

    assertEquals("{\"k\":\"say \\\"hi\\\"\\\\\\n\\t\\u0001\"}", json);
    assertEquals(value, FlatJson.read(json).get("k"));
  }

  @Test
  void readsLiteralsAsText() {
    Map<String, String> fields = FlatJson.read(" { \"n\" : 42 , \"f\": -1.5e3, \"b\":true, \"z\":null, \"s\":\"x\" } ");

    assertEquals("42", fields.get("n"));
    assertEquals("-1.5e3", fields.get("f"));
    assertEquals("true", fields.get("b"));
    assertFalse(fields.containsKey("z"));
    assertEquals("x", fields.get("s"));
  }

  @Test
  void readsUnicodeEscapes() {
    assertEquals("\u00e9/", FlatJson.read("{\"k\":\"\\u00e9\\/\"}").get("k"));
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read(""));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("[]"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":{\"b\":\"c\"}}"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":[1]}"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":\"b\""));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":\"b\"} x"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":nope}"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":\"\\q\"}"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":\"\\u12\"}"));
    assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\" \"b\"}"));
  }

  @Test
  void errorNamesOffset() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> FlatJson.read("{\"a\":nope}"));

    assertTrue(ex.getMessage().startsWith("Malformed JSON at offset"), ex.getMessage());
  }
}
