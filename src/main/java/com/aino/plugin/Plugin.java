package com.aino.plugin;

import com.aino.core.Aino;

/**
 * A bundle of middleware that can be registered with an {@link Aino} application. Plugins
 * publish themselves as application locals and hand out middleware for the pipeline.
 */
public interface Plugin {

    /**
     * Called once when the plugin is registered.
     *
     * @param app the application
     */
    void register(Aino app);

    String getName();

    String getVersion();

    /**
     * Called when the server starts listening.
     *
     * @param app the application
     */
    default void onStart(Aino app) {
    }

    /**
     * Called when the server stops.
     *
     * @param app the application
     */
    default void onStop(Aino app) {
    }
}
