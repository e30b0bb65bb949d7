package com.aino.session;

import com.aino.http.Context;
import com.aino.middleware.MiddlewareChain;
import com.aino.middleware.Pipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.aino.session.SessionTestSupport.setCookies;
import static com.aino.session.SessionTestSupport.withCookies;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the session lifecycle middleware and accessors.
 */
@DisplayName("Session Tests")
public class SessionTest {

    private final SessionStorage storage = new CookieSessionStorage("secret-key", "salt");

    @Test
    @DisplayName("Should carry session data to the next request")
    void testLifecycle() throws Exception {
        // Given: a request that writes to the session
        MiddlewareChain write = MiddlewareChain.of(
                Session.config(storage),
                Session.decode(),
                ctx -> Session.put(ctx, "user", "jane"),
                Session.encode());
        Context first = Pipeline.reduce(withCookies(Map.of()), write);

        // When: the next request sends the cookies back
        MiddlewareChain read = MiddlewareChain.of(Session.config(storage), Session.decode());
        Context second = Pipeline.reduce(withCookies(setCookies(first)), read);

        // Then: the data is there
        assertEquals("jane", Session.get(second, "user"));
        assertFalse(second.sessionUpdated());
    }

    @Test
    @DisplayName("Should not write cookies when the session was not updated")
    void testEncodeSkippedWithoutUpdate() throws Exception {
        MiddlewareChain chain = MiddlewareChain.of(Session.config(storage), Session.decode(), Session.encode());

        Context ctx = Pipeline.reduce(withCookies(Map.of()), chain);

        assertNull(ctx.responseHeaders());
    }

    @Test
    @DisplayName("Should mark the session updated on put, delete and clear")
    void testAccessorsMarkUpdated() {
        Context ctx = withCookies(Map.of()).session(new HashMap<>(Map.of("a", 1, "b", 2)));

        Session.delete(ctx, "a");
        assertTrue(ctx.sessionUpdated());
        assertEquals(Map.of("b", 2), ctx.session());

        Session.put(ctx, "c", 3);
        assertEquals(3, Session.get(ctx, "c"));

        Session.clear(ctx);
        assertEquals(Map.of(), ctx.session());
    }

    @Test
    @DisplayName("Should not mutate the map it was given")
    void testCopyOnWrite() {
        Map<String, Object> original = Map.of("a", 1);
        Context ctx = withCookies(Map.of()).session(original);

        Session.put(ctx, "b", 2);

        assertEquals(Map.of("a", 1), original);
    }

    @Test
    @DisplayName("Should refuse accessors before the session is decoded")
    void testAccessBeforeDecode() {
        Context ctx = withCookies(Map.of());

        assertThrows(IllegalStateException.class, () -> Session.get(ctx, "a"));
        assertThrows(IllegalStateException.class, () -> Session.put(ctx, "a", 1));
        assertThrows(IllegalStateException.class, () -> Session.delete(ctx, "a"));
        assertThrows(IllegalStateException.class, () -> Session.clear(ctx));
    }

    @Test
    @DisplayName("Should refuse to decode without a configured storage")
    void testDecodeWithoutConfig() {
        assertThrows(IllegalStateException.class, () -> Session.decode().handle(withCookies(Map.of())));
        assertThrows(IllegalArgumentException.class, () -> Session.config(null));
    }
}
