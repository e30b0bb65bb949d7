package com.aino.plugin.session;

import com.aino.middleware.MiddlewareChain;
import com.aino.plugin.AbstractPlugin;
import com.aino.session.CookieSessionStorage;
import com.aino.session.EncryptedCookieSessionStorage;
import com.aino.session.Flash;
import com.aino.session.Session;
import com.aino.session.SessionStorage;

/**
 * Plugin that wires the session lifecycle into an application.
 *
 * <p>{@link #load()} goes after cookie parsing and before the routes; {@link #save()} goes last.
 * {@code save} runs even for halted contexts, so redirects and error responses still persist
 * session changes.</p>
 *
 * <pre>{@code
 * SessionPlugin sessions = SessionPlugin.signed(secret, salt);
 * app.register(sessions)
 *     .use(CommonMiddleware.common())
 *     .use(sessions.load())
 *     ...
 *     .use(sessions.save());
 * }</pre>
 */
public class SessionPlugin extends AbstractPlugin {
    private final SessionStorage storage;

    public SessionPlugin(SessionStorage storage) {
        super("session", "1.0.0");
        if (storage == null) {
            throw new IllegalArgumentException("Session storage must not be null");
        }
        this.storage = storage;
    }

    /**
     * Creates a plugin that stores sessions in signed, readable cookies.
     *
     * @param key  the signing key
     * @param salt the signing salt
     * @return the plugin
     */
    public static SessionPlugin signed(String key, String salt) {
        return new SessionPlugin(new CookieSessionStorage(key, salt));
    }

    /**
     * Creates a plugin that stores sessions in encrypted cookies.
     *
     * @param key the 32 byte AES key
     * @return the plugin
     */
    public static SessionPlugin encrypted(byte[] key) {
        return new SessionPlugin(new EncryptedCookieSessionStorage(key));
    }

    public SessionStorage getStorage() {
        return storage;
    }

    /**
     * Gets the middleware that installs the storage, decodes the session and loads flash
     * messages.
     *
     * @return the chain
     */
    public MiddlewareChain load() {
        return MiddlewareChain.of(Session.config(storage), Session.decode(), Flash.load());
    }

    /**
     * Gets the middleware that writes an updated session into the response. Runs even when
     * the context is halted.
     *
     * @return the chain
     */
    public MiddlewareChain save() {
        return MiddlewareChain.empty().always(Session.encode());
    }
}
