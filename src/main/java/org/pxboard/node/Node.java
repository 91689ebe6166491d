package org.pxboard.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.pxboard.node.spi.IProcess;
import org.pxboard.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A pxboard server node: instantiates the processes listed under {@code node.processes},
 * starts them and stops them again in reverse order.
 *
 * <p>A process names the processes it needs under {@code require}. Processes are created
 * after everything they require, and each required process's exposed service is handed to
 * the constructor under the local name chosen in the configuration.</p>
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_PATH = "node.processes";

    private final Map<String, IProcess> processes = new LinkedHashMap<>();
    private final List<String> started = new ArrayList<>();
    private Thread shutdownHook;

    /**
     * Creates all configured processes.
     *
     * @param config The resolved application configuration.
     * @throws IllegalStateException if a process cannot be created or the dependencies are inconsistent.
     */
    public Node(final Config config) {
        if (!config.hasPath(PROCESSES_PATH)) {
            LOGGER.warn("No '{}' section found, the node has nothing to run", PROCESSES_PATH);
            return;
        }
        final Map<String, ProcessDefinition> definitions = parse(config.getObject(PROCESSES_PATH));
        final Map<String, Object> services = new HashMap<>();
        for (final String name : dependencyOrder(definitions)) {
            final ProcessDefinition definition = definitions.get(name);
            final IProcess process = instantiate(definition, resolve(definition, services));
            processes.put(name, process);
            if (process instanceof IServiceProvider) {
                final Object service = ((IServiceProvider) process).getExposedService();
                if (service != null) {
                    services.put(name, service);
                }
            }
        }
        LOGGER.info("Created {} process(es): {}", processes.size(), processes.keySet());
    }

    /**
     * Starts processes in dependency order. If one fails, the ones already started are stopped
     * and the failure is rethrown.
     */
    public void start() {
        for (final Map.Entry<String, IProcess> entry : processes.entrySet()) {
            try {
                entry.getValue().start();
                started.add(entry.getKey());
                LOGGER.debug("Process '{}' started", entry.getKey());
            } catch (final RuntimeException e) {
                LOGGER.error("Process '{}' failed to start, shutting down", entry.getKey(), e);
                stop();
                throw e;
            }
        }
        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started");
    }

    /**
     * Stops started processes, last started first. Safe to call more than once.
     */
    public synchronized void stop() {
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Shutdown already in progress: {}", e.getMessage());
            }
        }
        if (started.isEmpty()) {
            return;
        }
        final List<String> order = new ArrayList<>(started);
        Collections.reverse(order);
        started.clear();
        for (final String name : order) {
            try {
                processes.get(name).stop();
                LOGGER.debug("Process '{}' stopped", name);
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}'", name, e);
            }
        }
        LOGGER.info("Node stopped");
    }

    /**
     * Looks up a created process by its configured name.
     */
    public Optional<IProcess> process(final String name) {
        return Optional.ofNullable(processes.get(name));
    }

    private static Map<String, ProcessDefinition> parse(final ConfigObject section) {
        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        final Config all = section.toConfig();
        for (final String name : new TreeSet<>(section.keySet())) {
            final Config process = all.getConfig(name);
            final Map<String, String> requires = new LinkedHashMap<>();
            if (process.hasPath("require")) {
                final ConfigObject require = process.getObject("require");
                for (final String localName : require.keySet()) {
                    requires.put(localName, require.toConfig().getString(localName));
                }
            }
            definitions.put(name, new ProcessDefinition(
                name,
                process.getString("className"),
                process.hasPath("options") ? process.getConfig("options") : ConfigFactory.empty(),
                requires));
        }
        return definitions;
    }

    /**
     * Kahn's algorithm over the {@code require} edges.
     *
     * @throws IllegalStateException on unknown or circular requirements.
     */
    private static List<String> dependencyOrder(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Integer> pending = new HashMap<>();
        final Map<String, List<String>> dependents = new HashMap<>();
        for (final ProcessDefinition definition : definitions.values()) {
            pending.put(definition.name, new TreeSet<>(definition.requires.values()).size());
            for (final String required : new TreeSet<>(definition.requires.values())) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException(
                        "Process '" + definition.name + "' requires unknown process '" + required + "'");
                }
                dependents.computeIfAbsent(required, k -> new ArrayList<>()).add(definition.name);
            }
        }

        final Deque<String> ready = new ArrayDeque<>();
        definitions.keySet().stream().filter(name -> pending.get(name) == 0).forEach(ready::add);
        final List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String name = ready.poll();
            order.add(name);
            for (final String dependent : dependents.getOrDefault(name, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != definitions.size()) {
            final Set<String> cycle = new TreeSet<>(definitions.keySet());
            order.forEach(cycle::remove);
            throw new IllegalStateException("Circular requirements among processes " + cycle);
        }
        return order;
    }

    private static Map<String, Object> resolve(final ProcessDefinition definition, final Map<String, Object> services) {
        final Map<String, Object> dependencies = new HashMap<>();
        definition.requires.forEach((localName, source) -> {
            final Object service = services.get(source);
            if (service == null) {
                throw new IllegalStateException(
                    "Process '" + definition.name + "' requires '" + source + "', which exposes no service");
            }
            dependencies.put(localName, service);
        });
        return dependencies;
    }

    private static IProcess instantiate(final ProcessDefinition definition, final Map<String, Object> dependencies) {
        try {
            final Class<?> type = Class.forName(definition.className);
            if (!IProcess.class.isAssignableFrom(type)) {
                throw new IllegalStateException(definition.className + " is not a process");
            }
            final Constructor<?> constructor = type.getConstructor(String.class, Map.class, Config.class);
            LOGGER.debug("Creating process '{}' ({})", definition.name, type.getSimpleName());
            return (IProcess) constructor.newInstance(definition.name, dependencies, definition.options);
        } catch (final InvocationTargetException e) {
            throw new IllegalStateException("Process '" + definition.name + "' could not be created: "
                + e.getCause().getMessage(), e.getCause());
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Process '" + definition.name + "' could not be created", e);
        }
    }

    private static final class ProcessDefinition {
        final String name;
        final String className;
        final Config options;
        final Map<String, String> requires;

        ProcessDefinition(final String name, final String className, final Config options,
                          final Map<String, String> requires) {
            this.name = name;
            this.className = className;
            this.options = options;
            this.requires = requires;
        }
    }
}
