package com.aino.session;

import com.aino.http.Context;
import com.aino.middleware.Middleware;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One-shot messages carried in the session to the next request. Messages are written with
 * {@link #put}, moved out of the session by {@link #load} on the following request and read
 * with {@link #get}.
 */
public final class Flash {
    static final String SESSION_KEY = "aino_flash";

    private Flash() {
    }

    /**
     * Stores a message for the next request.
     *
     * @throws IllegalArgumentException if the value is null
     */
    public static Context put(Context ctx, String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Flash values must be strings");
        }
        Map<String, String> pending = pending(Session.get(ctx, SESSION_KEY));
        pending.put(key, value);
        return Session.put(ctx, SESSION_KEY, pending);
    }

    /**
     * Creates a middleware that moves the pending messages from the session onto the context.
     * The session is only marked updated when there were messages to remove.
     *
     * @return the middleware
     */
    public static Middleware load() {
        return ctx -> {
            Object stored = Session.get(ctx, SESSION_KEY);
            if (stored == null) {
                return ctx.flash(new LinkedHashMap<>());
            }
            return Session.delete(ctx, SESSION_KEY).flash(pending(stored));
        };
    }

    public static String get(Context ctx, String key) {
        if (ctx.flash() == null) {
            throw new IllegalStateException("Flash has not been loaded yet");
        }
        return ctx.flash().get(key);
    }

    private static Map<String, String> pending(Object stored) {
        Map<String, String> messages = new LinkedHashMap<>();
        if (stored instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) stored).entrySet()) {
                messages.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
            }
        }
        return messages;
    }
}
