package org.pxboard.node.processes.http;

import com.typesafe.config.Config;
import org.pxboard.node.spi.IController;
import org.pxboard.node.spi.ServiceRegistry;

/**
 * Base class of controllers mounted by {@link HttpServerProcess}, which creates them through
 * the {@code (ServiceRegistry, Config)} constructor.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    /**
     * @param registry Services shared by all controllers.
     * @param options  The controller's {@code options} block.
     */
    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Joins a base path and a route, avoiding double slashes.
     */
    protected static String path(final String basePath, final String route) {
        return (basePath + route).replaceAll("//+", "/");
    }
}
