package com.aino.session;

import com.aino.http.Context;
import com.aino.middleware.Middleware;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session lifecycle middleware and accessors.
 *
 * <p>The lifecycle runs in a fixed order: {@link #config} installs the storage, {@link #decode}
 * reads the session after cookies are parsed, handlers read and write it through the accessors,
 * and {@link #encode} writes it back only if it was changed. Every accessor requires the session
 * to have been decoded.</p>
 */
public final class Session {

    private Session() {
    }

    public static Middleware config(SessionStorage storage) {
        if (storage == null) {
            throw new IllegalArgumentException("Session storage must not be null");
        }
        return ctx -> ctx.sessionConfig(storage);
    }

    /**
     * Creates a middleware that reads the session from the request.
     *
     * @return the middleware
     */
    public static Middleware decode() {
        return ctx -> requireStorage(ctx).decode(ctx);
    }

    /**
     * Creates a middleware that writes the session into the response if it was updated.
     *
     * @return the middleware
     */
    public static Middleware encode() {
        return ctx -> ctx.sessionUpdated() ? requireStorage(ctx).encode(ctx) : ctx;
    }

    public static Object get(Context ctx, String key) {
        return requireSession(ctx).get(key);
    }

    public static Context put(Context ctx, String key, Object value) {
        Map<String, Object> session = new LinkedHashMap<>(requireSession(ctx));
        session.put(key, value);
        return ctx.session(session).sessionUpdated(true);
    }

    public static Context delete(Context ctx, String key) {
        Map<String, Object> session = new LinkedHashMap<>(requireSession(ctx));
        session.remove(key);
        return ctx.session(session).sessionUpdated(true);
    }

    public static Context clear(Context ctx) {
        requireSession(ctx);
        return ctx.session(new LinkedHashMap<>()).sessionUpdated(true);
    }

    static Map<String, Object> requireSession(Context ctx) {
        if (ctx.session() == null) {
            throw new IllegalStateException("Session has not been decoded yet");
        }
        return ctx.session();
    }

    private static SessionStorage requireStorage(Context ctx) {
        SessionStorage storage = ctx.sessionConfig();
        if (storage == null) {
            throw new IllegalStateException("No session storage configured, add Session.config first");
        }
        return storage;
    }
}
