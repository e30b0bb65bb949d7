package com.aino.session;

import com.aino.http.Context;

/**
 * A pluggable backend that moves session data between the context and the transport.
 *
 * <p>The storage object doubles as its own configuration (keys, salts). It is chosen once when
 * the application is wired up and installed on each context with {@link Session#config}.</p>
 */
public interface SessionStorage {

    /**
     * Reads the session from the request. Must set the session on the context; data that is
     * missing, tampered with or unreadable yields an empty session, never an exception.
     *
     * @param ctx the context, with cookies already parsed
     * @return the context with its session set
     */
    Context decode(Context ctx);

    /**
     * Writes the session into the response, appending one or more {@code Set-Cookie} headers.
     * Called only for contexts whose session was updated.
     *
     * @param ctx the context
     * @return the context with the session headers appended
     */
    Context encode(Context ctx);
}
