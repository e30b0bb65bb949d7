package com.aino.plugin;

import com.aino.core.Aino;
import com.aino.http.Context;
import com.aino.http.Method;
import com.aino.http.Request;
import com.aino.middleware.MiddlewareChain;
import com.aino.middleware.Pipeline;
import com.aino.plugin.csrf.CsrfPlugin;
import com.aino.plugin.session.SessionPlugin;
import com.aino.session.EncryptedCookieSessionStorage;
import com.aino.session.Session;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Plugin Tests")
public class PluginTest {

    @Test
    @DisplayName("Should publish plugins as application locals")
    void testRegister() {
        SessionPlugin sessions = SessionPlugin.signed("key", "salt");
        CsrfPlugin csrf = new CsrfPlugin();

        Aino app = new Aino().register(sessions).register(csrf);

        assertSame(sessions, app.get("session"));
        assertSame(csrf, app.get("csrf"));
        assertSame(csrf, app.getPlugin("csrf"));
        assertNull(app.getPlugin("missing"));
        assertEquals("1.0.0", sessions.getVersion());
    }

    @Test
    @DisplayName("Should choose the storage from the factory")
    void testFactories() {
        assertInstanceOf(EncryptedCookieSessionStorage.class, SessionPlugin.encrypted(new byte[32]).getStorage());
        assertThrows(IllegalArgumentException.class, () -> SessionPlugin.encrypted(new byte[8]));
        assertThrows(IllegalArgumentException.class, () -> new SessionPlugin(null));
    }

    @Test
    @DisplayName("Should save the session even when the request was halted")
    void testSaveRunsAfterHalt() throws Exception {
        // Given: a handler that writes to the session and halts
        SessionPlugin sessions = SessionPlugin.signed("key", "salt");
        MiddlewareChain chain = MiddlewareChain.of(ctx -> ctx.cookies(new HashMap<>()))
                .then(sessions.load())
                .then(ctx -> Session.put(ctx, "seen", true).halt().redirect("/"))
                .then(sessions.save());

        // When: reducing
        Context ctx = Pipeline.reduce(new Context(Request.builder("GET", "/").build()), chain);

        // Then: the session cookies were still written
        assertTrue(ctx.responseHeaders().stream().anyMatch(h -> h.getValue().startsWith("_aino_session=")));
    }

    @Test
    @DisplayName("Should issue a token and reject unsafe requests without one")
    void testCsrfProtect() throws Exception {
        MiddlewareChain chain = MiddlewareChain.of(ctx -> ctx.session(new HashMap<>()))
                .then(new CsrfPlugin().protect());

        Context ctx = Pipeline.reduce(
                new Context(Request.builder("POST", "/").build()).method(Method.POST), chain);

        assertNotNull(Session.get(ctx, "csrf_token"));
        assertEquals(403, ctx.responseStatus());
    }
}
