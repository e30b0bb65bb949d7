package com.aino.middleware;

/** Per-middleware options inside a {@link MiddlewareChain}. */
public class MiddlewareOptions {
    private boolean ignoreHalt = false;

    /**
     * Whether the middleware runs even after the context has been halted.
     *
     * @return true if halt is ignored
     */
    public boolean isIgnoreHalt() {
        return ignoreHalt;
    }

    public MiddlewareOptions setIgnoreHalt(boolean ignoreHalt) {
        this.ignoreHalt = ignoreHalt;
        return this;
    }
}
