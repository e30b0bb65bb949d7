package com.aino.plugin;

import com.aino.core.Aino;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for plugins, holding the name and version and logging lifecycle events.
 */
public abstract class AbstractPlugin implements Plugin {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final String name;
    private final String version;

    protected AbstractPlugin(String name, String version) {
        this.name = name;
        this.version = version;
    }

    @Override
    public void register(Aino app) {
        logger.debug("Registering plugin {} v{}", name, version);
        app.set(name, this);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public void onStart(Aino app) {
        logger.debug("Plugin {} v{} starting", name, version);
    }

    @Override
    public void onStop(Aino app) {
        logger.debug("Plugin {} v{} stopping", name, version);
    }
}
