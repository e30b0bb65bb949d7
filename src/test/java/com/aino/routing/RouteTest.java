package com.aino.routing;

import com.aino.http.Method;
import com.aino.middleware.MiddlewareChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the Route class.
 */
@DisplayName("Route Tests")
public class RouteTest {

    @Test
    @DisplayName("Should expose method, path and name")
    void testAccessors() {
        // Given: a named route
        Route route = new Route(Method.GET, "/orders/:id", MiddlewareChain.empty(), "order");

        // Then: accessors reflect the constructor arguments
        assertEquals(Method.GET, route.getMethod());
        assertEquals("/orders/:id", route.getPath());
        assertEquals("order", route.getName());
        assertTrue(route.getMiddleware().isEmpty());
        assertEquals("GET /orders/:id as order", route.toString());
    }

    @Test
    @DisplayName("Should match only its own method")
    void testMethodMismatch() {
        Route route = new Route(Method.POST, "/orders", null, null);

        assertNull(route.match(Method.GET, List.of("orders")));
        assertNull(route.match(null, List.of("orders")));
        assertEquals(Map.of(), route.match(Method.POST, List.of("orders")));
    }

    @Test
    @DisplayName("Should reject a route without a method")
    void testNullMethod() {
        assertThrows(IllegalArgumentException.class, () -> new Route(null, "/", null, null));
    }
}
