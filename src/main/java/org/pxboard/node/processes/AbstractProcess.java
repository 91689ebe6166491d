package org.pxboard.node.processes;

import com.typesafe.config.Config;
import org.pxboard.node.spi.IProcess;

import java.util.Map;

/**
 * Base class of configured processes. The {@link org.pxboard.node.Node} creates subclasses
 * reflectively through the {@code (String, Map, Config)} constructor.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  Name of this process in the configuration.
     * @param dependencies Services of required processes, keyed by the local names from {@code require}.
     * @param options      The process's {@code options} block.
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? Map.copyOf(dependencies) : Map.of();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * Returns a required dependency.
     *
     * @throws IllegalArgumentException if it is missing or of another type.
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final T dependency = getOptionalDependency(name, expectedType);
        if (dependency == null) {
            throw new IllegalArgumentException("Process '" + processName + "' requires dependency '" + name + "'");
        }
        return dependency;
    }

    /**
     * Returns a dependency, or null if none was configured under this name.
     *
     * @throws IllegalArgumentException if it is of another type.
     */
    protected <T> T getOptionalDependency(final String name, final Class<T> expectedType) {
        final Object dependency = dependencies.get(name);
        if (dependency == null) {
            return null;
        }
        if (!expectedType.isInstance(dependency)) {
            throw new IllegalArgumentException("Dependency '" + name + "' of process '" + processName + "' is a "
                + dependency.getClass().getName() + ", expected " + expectedType.getName());
        }
        return expectedType.cast(dependency);
    }
}
