package com.aino.middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, possibly nested list of middleware.
 *
 * <p>Chains are immutable: every {@code then} call returns a new chain. Nesting keeps
 * declaration order; {@link #steps()} flattens the tree depth-first.</p>
 */
public final class MiddlewareChain {
    private static final MiddlewareChain EMPTY = new MiddlewareChain(Collections.emptyList());

    private final List<Object> entries;

    private MiddlewareChain(List<Object> entries) {
        this.entries = entries;
    }

    /**
     * Gets an empty chain.
     *
     * @return the empty chain
     */
    public static MiddlewareChain empty() {
        return EMPTY;
    }

    /**
     * Creates a chain from middleware, in order, with default options.
     *
     * @param middleware the middleware
     * @return the chain
     */
    public static MiddlewareChain of(Middleware... middleware) {
        MiddlewareChain chain = EMPTY;
        for (Middleware m : middleware) {
            chain = chain.then(m);
        }
        return chain;
    }

    /**
     * Creates a chain from nested chains, in order.
     *
     * @param chains the chains to nest
     * @return the chain
     */
    public static MiddlewareChain of(MiddlewareChain... chains) {
        MiddlewareChain chain = EMPTY;
        for (MiddlewareChain nested : chains) {
            chain = chain.then(nested);
        }
        return chain;
    }

    /**
     * Appends a middleware with default options.
     *
     * @param middleware the middleware
     * @return a new chain
     */
    public MiddlewareChain then(Middleware middleware) {
        return then(middleware, new MiddlewareOptions());
    }

    /**
     * Appends a middleware with the given options.
     *
     * @param middleware the middleware
     * @param options    the options for this entry
     * @return a new chain
     */
    public MiddlewareChain then(Middleware middleware, MiddlewareOptions options) {
        if (middleware == null) {
            throw new IllegalArgumentException("middleware must not be null");
        }
        return append(new Step(middleware, options));
    }

    /**
     * Appends a middleware that runs even when the context is halted.
     *
     * @param middleware the middleware
     * @return a new chain
     */
    public MiddlewareChain always(Middleware middleware) {
        return then(middleware, new MiddlewareOptions().setIgnoreHalt(true));
    }

    /**
     * Appends a nested chain. Its entries keep their own options.
     *
     * @param nested the nested chain
     * @return a new chain
     */
    public MiddlewareChain then(MiddlewareChain nested) {
        if (nested == null) {
            throw new IllegalArgumentException("nested chain must not be null");
        }
        return append(nested);
    }

    private MiddlewareChain append(Object entry) {
        List<Object> copy = new ArrayList<>(entries.size() + 1);
        copy.addAll(entries);
        copy.add(entry);
        return new MiddlewareChain(Collections.unmodifiableList(copy));
    }

    /**
     * Flattens the chain depth-first in declaration order.
     *
     * @return the steps to run
     */
    public List<Step> steps() {
        List<Step> steps = new ArrayList<>();
        collect(this, steps);
        return steps;
    }

    private static void collect(MiddlewareChain chain, List<Step> into) {
        for (Object entry : chain.entries) {
            if (entry instanceof MiddlewareChain) {
                collect((MiddlewareChain) entry, into);
            } else {
                into.add((Step) entry);
            }
        }
    }

    public boolean isEmpty() {
        return steps().isEmpty();
    }

    /** A single middleware paired with its options. */
    public static final class Step {
        private final Middleware middleware;
        private final MiddlewareOptions options;

        private Step(Middleware middleware, MiddlewareOptions options) {
            this.middleware = middleware;
            this.options = options;
        }

        public Middleware getMiddleware() {
            return middleware;
        }

        public MiddlewareOptions getOptions() {
            return options;
        }
    }
}
