package org.pxboard.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.pxboard.board.BoardRuntime;
import org.pxboard.node.processes.AbstractProcess;
import org.pxboard.node.spi.IController;
import org.pxboard.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a Javalin server whose routes come from the {@code routes} block of the options.
 * <p>
 * Nested objects in {@code routes} form path segments; a {@code "$controller"} entry mounts
 * the named {@link IController} at the path built so far:
 * <pre>
 * routes {
 *   api {
 *     "$controller" { className = "org.pxboard.node.processes.http.api.boards.BoardController" }
 *   }
 * }
 * </pre>
 * Requires the {@code boardRuntime} dependency, which controllers obtain from the
 * {@link ServiceRegistry}.
 */
public class HttpServerProcess extends AbstractProcess {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String CONTROLLER_KEY = "$controller";

    private final ServiceRegistry services = new ServiceRegistry();
    private final List<ControllerRoute> routes = new ArrayList<>();
    private Javalin app;

    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        services.register(BoardRuntime.class, getDependency("boardRuntime", BoardRuntime.class));
        if (options.hasPath("routes")) {
            collectRoutes(options.getObject("routes"), "");
        } else {
            LOGGER.warn("Process '{}' has no 'routes' block, nothing will be served", processName);
        }
    }

    @Override
    public synchronized void start() {
        if (app != null) {
            return;
        }
        app = createApp();
        app.start(options.getString("network.host"), options.getInt("network.port"));
        LOGGER.info("HTTP server listening on {}:{}", options.getString("network.host"), app.port());
    }

    /**
     * Builds the configured server without starting it.
     */
    Javalin createApp() {
        final Javalin created = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) ->
                LOGGER.debug("{} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms));

            final QueuedThreadPool threadPool = new QueuedThreadPool(
                intOption("network.threadPool.maxThreads", 200),
                intOption("network.threadPool.minThreads", 8),
                intOption("network.threadPool.idleTimeoutMs", 60000));
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;
        });
        for (final ControllerRoute route : routes) {
            instantiate(route).registerRoutes(created, route.basePath);
            LOGGER.debug("Mounted {} at '{}'", route.className, route.basePath.isEmpty() ? "/" : route.basePath);
        }
        return created;
    }

    @Override
    public synchronized void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped");
        }
    }

    /**
     * Port the server listens on, or -1 if it is not running.
     */
    public synchronized int port() {
        return app != null ? app.port() : -1;
    }

    private void collectRoutes(final ConfigObject level, final String path) {
        for (final Map.Entry<String, ConfigValue> entry : level.entrySet()) {
            final ConfigValue value = entry.getValue();
            if (value.valueType() != ConfigValueType.OBJECT) {
                throw new IllegalArgumentException("Route entry '" + entry.getKey() + "' at '" + path + "' must be an object");
            }
            final Config config = ((ConfigObject) value).toConfig();
            if (CONTROLLER_KEY.equals(entry.getKey())) {
                routes.add(new ControllerRoute(path, config.getString("className"),
                    config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty()));
            } else {
                collectRoutes((ConfigObject) value, path + "/" + entry.getKey());
            }
        }
    }

    private IController instantiate(final ControllerRoute route) {
        try {
            final Class<?> type = Class.forName(route.className);
            if (!IController.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(route.className + " is not a controller");
            }
            final Constructor<?> constructor = type.getConstructor(ServiceRegistry.class, Config.class);
            return (IController) constructor.newInstance(services, route.options);
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Controller " + route.className + " could not be created", e);
        }
    }

    private int intOption(final String path, final int fallback) {
        return options.hasPath(path) ? options.getInt(path) : fallback;
    }

    private static final class ControllerRoute {
        final String basePath;
        final String className;
        final Config options;

        ControllerRoute(final String basePath, final String className, final Config options) {
            this.basePath = basePath;
            this.className = className;
            this.options = options;
        }
    }
}
