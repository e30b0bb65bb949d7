package com.aino.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the JsonUtil class.
 */
@DisplayName("JsonUtil Tests")
public class JsonUtilTest {

    @Test
    @DisplayName("Should write compact JSON in insertion order")
    void testToJson() throws JsonProcessingException {
        // Given: an ordered map
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "John");
        data.put("age", 30);

        // When: converting to JSON
        String json = JsonUtil.toJson(data);

        // Then: compact output
        assertEquals("{\"name\":\"John\",\"age\":30}", json);
    }

    @Test
    @DisplayName("Should escape semicolons in cookie JSON and still parse back")
    void testToCookieJson() throws JsonProcessingException {
        String json = JsonUtil.toCookieJson(Map.of("notice", "Saved; thanks"));

        assertFalse(json.contains(";"));
        assertEquals("Saved; thanks", JsonUtil.fromJsonMap(json).get("notice"));
        assertEquals(JsonUtil.toJson(Map.of("n", "plain")), JsonUtil.toCookieJson(Map.of("n", "plain")));
    }

    @Test
    @DisplayName("Should parse any JSON value into a generic tree")
    void testParseValue() throws JsonProcessingException {
        assertEquals(Map.of("a", List.of(1, true)), JsonUtil.parseValue("{\"a\":[1,true]}"));
        assertEquals("text", JsonUtil.parseValue("\"text\""));
        assertNull(JsonUtil.parseValue("null"));
    }

    @Test
    @DisplayName("Should parse a JSON object into a map")
    void testFromJsonMap() throws JsonProcessingException {
        Map<String, Object> map = JsonUtil.fromJsonMap("{\"user\":\"jane\",\"n\":2}");

        assertEquals("jane", map.get("user"));
        assertEquals(2, map.get("n"));
    }

    @Test
    @DisplayName("Should throw on malformed JSON or non-object input")
    void testMalformed() {
        assertThrows(JsonProcessingException.class, () -> JsonUtil.parseValue("{oops"));
        assertThrows(JsonProcessingException.class, () -> JsonUtil.fromJsonMap("[1,2]"));
    }
}
