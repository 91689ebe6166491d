package org.pxboard.node.spi;

import io.javalin.Javalin;

/**
 * A group of HTTP routes mounted by the HTTP server process.
 */
public interface IController {

    /**
     * @param app      The server to add routes to.
     * @param basePath Prefix of every route of this controller, without trailing slash.
     */
    void registerRoutes(Javalin app, String basePath);
}
