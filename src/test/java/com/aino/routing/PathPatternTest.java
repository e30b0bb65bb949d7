package com.aino.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathPattern Tests")
public class PathPatternTest {

    @Test
    @DisplayName("Should compile literal and named segments")
    void testCompile() {
        PathPattern pattern = PathPattern.compile("/orders/:id/items/:item_id/");

        assertEquals(4, pattern.getSegments().size());
        assertFalse(pattern.getSegments().get(0).isParam());
        assertTrue(pattern.getSegments().get(1).isParam());
        assertEquals(List.of("id", "item_id"), pattern.getParamNames());
    }

    @Test
    @DisplayName("Should bind named segments")
    void testMatchBindsParams() {
        Map<String, String> params = PathPattern.compile("/orders/:id").match(List.of("orders", "42"));

        assertEquals(Map.of("id", "42"), params);
    }

    @Test
    @DisplayName("Should require equal segment counts")
    void testSegmentCount() {
        PathPattern pattern = PathPattern.compile("/orders/:id");

        assertNull(pattern.match(List.of("orders")));
        assertNull(pattern.match(List.of("orders", "1", "edit")));
    }

    @Test
    @DisplayName("Should compare literals case-sensitively")
    void testCaseSensitive() {
        assertNull(PathPattern.compile("/orders").match(List.of("Orders")));
    }

    @Test
    @DisplayName("Should match the root path with no segments")
    void testRoot() {
        assertEquals(Map.of(), PathPattern.compile("/").match(List.of()));
    }

    @Test
    @DisplayName("Should reject a parameter without a name")
    void testUnnamedParam() {
        assertThrows(IllegalArgumentException.class, () -> PathPattern.compile("/orders/:"));
    }
}
