package com.aino.csrf;

import com.aino.http.Context;
import com.aino.http.Method;
import com.aino.middleware.Middleware;
import com.aino.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.Set;

/**
 * Synchronizer token protection against cross-site request forgery.
 *
 * <p>{@link #set()} keeps a random token in the session and forms embed it through
 * {@link #getToken}. {@link #check()} then requires every unsafe request to send the same token
 * back in its body as {@code csrf_token}. Both middleware need the session decoded, and
 * {@code check} also needs the body parsed.</p>
 */
public final class Csrf {
    private static final Logger logger = LoggerFactory.getLogger(Csrf.class);

    public static final String TOKEN_KEY = "csrf_token";
    static final String FAILURE_MESSAGE = "CSRF token doesn't match";

    private static final int TOKEN_BYTES = 32;
    private static final Set<Method> SAFE_METHODS = Set.of(Method.GET, Method.HEAD);
    private static final SecureRandom RANDOM = new SecureRandom();

    private Csrf() {
    }

    /**
     * Creates a middleware that stores a new token in the session unless one is already there.
     *
     * @return the middleware
     */
    public static Middleware set() {
        return ctx -> {
            if (Session.get(ctx, TOKEN_KEY) != null) {
                return ctx;
            }
            return Session.put(ctx, TOKEN_KEY, generateToken());
        };
    }

    /**
     * Creates a middleware that rejects unsafe requests whose body token does not equal the
     * session token. A rejected request is halted with a 403.
     *
     * @return the middleware
     */
    public static Middleware check() {
        return ctx -> {
            if (SAFE_METHODS.contains(ctx.method())) {
                return ctx;
            }

            String expected = sessionToken(ctx);
            String supplied = suppliedToken(ctx);
            if (expected == null || supplied == null
                    || !MessageDigest.isEqual(
                            expected.getBytes(StandardCharsets.UTF_8),
                            supplied.getBytes(StandardCharsets.UTF_8))) {
                logger.debug("Rejecting {} /{}: CSRF token mismatch", ctx.method(),
                        ctx.path() == null ? "" : String.join("/", ctx.path()));
                return ctx.halt()
                        .responseStatus(403)
                        .responseHeader("Content-Type", "text/plain")
                        .responseBody(FAILURE_MESSAGE);
            }
            return ctx;
        };
    }

    /**
     * Gets the current token, for embedding in a form.
     *
     * @param ctx the context
     * @return the token
     * @throws IllegalStateException if there is no session or no token in it
     */
    public static String getToken(Context ctx) {
        if (ctx.session() == null) {
            throw new IllegalStateException("Session has not been decoded yet");
        }
        Object token = ctx.session().get(TOKEN_KEY);
        if (!(token instanceof String)) {
            throw new IllegalStateException("No CSRF token in the session, add Csrf.set() before rendering forms");
        }
        return (String) token;
    }

    static String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String sessionToken(Context ctx) {
        Map<String, Object> session = ctx.session();
        if (session == null) {
            return null;
        }
        Object token = session.get(TOKEN_KEY);
        return token instanceof String ? (String) token : null;
    }

    private static String suppliedToken(Context ctx) {
        if (!(ctx.parsedBody() instanceof Map)) {
            return null;
        }
        Object token = ((Map<?, ?>) ctx.parsedBody()).get(TOKEN_KEY);
        return token instanceof String ? (String) token : null;
    }
}
