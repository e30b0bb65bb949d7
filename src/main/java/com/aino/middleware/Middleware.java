package com.aino.middleware;

import com.aino.http.Context;

/**
 * Interface for middleware components.
 * A middleware takes the request context and returns it, possibly enriched,
 * with a response set, or halted so the rest of the pipeline is skipped.
 */
@FunctionalInterface
public interface Middleware {
    /**
     * Processes the request context.
     *
     * @param ctx the context for the current request
     * @return the context to hand to the next middleware, usually {@code ctx} itself
     * @throws Exception if an error occurs during processing; it propagates to the host
     */
    Context handle(Context ctx) throws Exception;
}
