package com.aino.middleware;

import com.aino.http.Context;
import com.aino.http.Request;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the Pipeline reducer.
 *
 * <p>Tests ordering, halt short-circuiting, ignoreHalt steps and error propagation.</p>
 */
@DisplayName("Pipeline Tests")
public class PipelineTest {

    private static Context newContext() {
        return new Context(Request.builder("GET", "/").build());
    }

    private static Middleware record(List<String> calls, String name) {
        return ctx -> {
            calls.add(name);
            return ctx;
        };
    }

    @Test
    @DisplayName("Should run middleware in declaration order")
    void testRunsInOrder() throws Exception {
        // Given: three recording middleware
        List<String> calls = new ArrayList<>();
        MiddlewareChain chain = MiddlewareChain.of(record(calls, "a"), record(calls, "b"), record(calls, "c"));

        // When: reducing
        Pipeline.reduce(newContext(), chain);

        // Then: all ran in order
        assertEquals(List.of("a", "b", "c"), calls);
    }

    @Test
    @DisplayName("Should skip remaining middleware once halted")
    void testHaltShortCircuits() throws Exception {
        // Given: a halting middleware followed by a mock
        Middleware skipped = mock(Middleware.class);
        MiddlewareChain chain = MiddlewareChain.of(ctx -> ctx.halt().responseStatus(401), skipped);

        // When: reducing
        Context result = Pipeline.reduce(newContext(), chain);

        // Then: the mock was never invoked
        verify(skipped, never()).handle(any());
        assertTrue(result.isHalted());
        assertEquals(401, result.responseStatus());
    }

    @Test
    @DisplayName("Should still run ignoreHalt middleware after a halt")
    void testIgnoreHaltRuns() throws Exception {
        // Given: a halt, a normal step and an always step
        List<String> calls = new ArrayList<>();
        MiddlewareChain chain = MiddlewareChain.of(ctx -> ctx.halt())
                .then(record(calls, "normal"))
                .always(record(calls, "always"));

        // When: reducing
        Pipeline.reduce(newContext(), chain);

        // Then: only the always step ran
        assertEquals(List.of("always"), calls);
    }

    @Test
    @DisplayName("Should give the same result for nested and flat chains")
    void testNestedFlattening() throws Exception {
        // Given: the same middleware nested and flat
        List<String> nestedCalls = new ArrayList<>();
        List<String> flatCalls = new ArrayList<>();
        MiddlewareChain nested = MiddlewareChain.of(record(nestedCalls, "a"))
                .then(MiddlewareChain.of(record(nestedCalls, "b"), record(nestedCalls, "c")));
        MiddlewareChain flat = MiddlewareChain.of(record(flatCalls, "a"), record(flatCalls, "b"), record(flatCalls, "c"));

        // When: reducing both
        Pipeline.reduce(newContext(), nested);
        Pipeline.reduce(newContext(), flat);

        // Then: same order
        assertEquals(flatCalls, nestedCalls);
    }

    @Test
    @DisplayName("Should honor a halt set inside a nested chain")
    void testHaltInsideNestedChain() throws Exception {
        List<String> calls = new ArrayList<>();
        MiddlewareChain chain = MiddlewareChain.of(
                MiddlewareChain.of(record(calls, "a"), ctx -> ctx.halt()),
                MiddlewareChain.of(record(calls, "b")));

        Pipeline.reduce(newContext(), chain);

        assertEquals(List.of("a"), calls);
    }

    @Test
    @DisplayName("Should return the context unchanged for an empty chain")
    void testEmptyChain() throws Exception {
        Context ctx = newContext();
        assertSame(ctx, Pipeline.reduce(ctx, MiddlewareChain.empty()));
    }

    @Test
    @DisplayName("Should propagate exceptions thrown by middleware")
    void testExceptionsPropagate() {
        // Given: a failing middleware
        MiddlewareChain chain = MiddlewareChain.of(ctx -> {
            throw new IllegalArgumentException("boom");
        });

        // When/Then: the exception reaches the caller
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Pipeline.reduce(newContext(), chain));
        assertEquals("boom", e.getMessage());
    }

    @Test
    @DisplayName("Should reject middleware that returns null")
    void testNullContextRejected() {
        MiddlewareChain chain = MiddlewareChain.of(ctx -> null);
        assertThrows(IllegalStateException.class, () -> Pipeline.reduce(newContext(), chain));
    }
}
