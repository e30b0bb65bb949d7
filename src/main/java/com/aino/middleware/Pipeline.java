package com.aino.middleware;

import com.aino.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a context through a middleware chain.
 *
 * <p>The reduction is a plain sequential fold: each step receives the context returned by the
 * previous one. Once the context is halted, only steps marked {@code ignoreHalt} still run.
 * Exceptions thrown by middleware are not caught here.</p>
 */
public final class Pipeline {
    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

    private Pipeline() {
    }

    /**
     * Reduces the context over the chain.
     *
     * @param ctx   the context
     * @param chain the middleware to run
     * @return the resulting context
     * @throws Exception whatever a middleware throws
     */
    public static Context reduce(Context ctx, MiddlewareChain chain) throws Exception {
        Context current = ctx;
        for (MiddlewareChain.Step step : chain.steps()) {
            if (current.isHalted() && !step.getOptions().isIgnoreHalt()) {
                logger.trace("Skipping middleware {}, context is halted", step.getMiddleware());
                continue;
            }
            Context next = step.getMiddleware().handle(current);
            if (next == null) {
                throw new IllegalStateException(
                        "Middleware " + step.getMiddleware() + " returned null instead of a context");
            }
            current = next;
        }
        return current;
    }
}
