package org.pxboard.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Services available to controllers, keyed by type.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if a service of this type is already registered.
     */
    public <T> void register(final Class<T> type, final T instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered");
        }
    }

    /**
     * @throws IllegalArgumentException if no service of this type is registered.
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }

    public boolean hasService(final Class<?> type) {
        return services.containsKey(type);
    }
}
