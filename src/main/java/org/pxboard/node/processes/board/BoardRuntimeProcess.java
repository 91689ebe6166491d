package org.pxboard.node.processes.board;

import com.typesafe.config.Config;
import org.pxboard.access.ConfigPermissionEvaluator;
import org.pxboard.access.StaticTokenAuthenticator;
import org.pxboard.board.BoardRuntime;
import org.pxboard.board.BoardRuntimeConfig;
import org.pxboard.board.exceptions.StorageFailureException;
import org.pxboard.node.processes.AbstractProcess;
import org.pxboard.node.spi.IServiceProvider;
import org.pxboard.store.H2BoardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Runs the {@link BoardRuntime} and exposes it to dependent processes.
 * <p>
 * Options: {@code database} (see {@link H2BoardStore}), {@code cache}, {@code cooldown},
 * {@code activity}, {@code sockets}, {@code auth.tokens} and {@code auth.permissions}.
 */
public class BoardRuntimeProcess extends AbstractProcess implements IServiceProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(BoardRuntimeProcess.class);

    private final BoardRuntime runtime;

    public BoardRuntimeProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        final BoardRuntimeConfig config = BoardRuntimeConfig.fromConfig(options);
        this.runtime = new BoardRuntime(
            new H2BoardStore(processName + "-db", options.getConfig("database")),
            new StaticTokenAuthenticator(options.getConfig("auth")),
            new ConfigPermissionEvaluator(options.getConfig("auth.permissions")),
            config,
            Clock.systemUTC());
    }

    @Override
    public void start() {
        try {
            runtime.start();
        } catch (final StorageFailureException e) {
            throw new IllegalStateException("Boards could not be loaded: " + e.getMessage(), e);
        }
        LOGGER.info("Process '{}' serving {} boards", processName, runtime.boards().size());
    }

    @Override
    public void stop() {
        runtime.close();
    }

    @Override
    public Object getExposedService() {
        return runtime;
    }
}
