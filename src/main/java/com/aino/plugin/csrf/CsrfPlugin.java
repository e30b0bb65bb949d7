package com.aino.plugin.csrf;

import com.aino.csrf.Csrf;
import com.aino.middleware.MiddlewareChain;
import com.aino.plugin.AbstractPlugin;

/**
 * Plugin that adds CSRF protection. {@link #protect()} must come after the session is loaded and
 * the body is parsed.
 */
public class CsrfPlugin extends AbstractPlugin {

    public CsrfPlugin() {
        super("csrf", "1.0.0");
    }

    /**
     * Gets the middleware that issues a token and rejects unsafe requests without a matching one.
     *
     * @return the chain
     */
    public MiddlewareChain protect() {
        return MiddlewareChain.of(Csrf.set(), Csrf.check());
    }
}
