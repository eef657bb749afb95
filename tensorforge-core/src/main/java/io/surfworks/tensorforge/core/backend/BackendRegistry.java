package io.surfworks.tensorforge.core.backend;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Name to factory lookup for {@link Backend} implementations.
 *
 * <p>Backends are found by name only: there is no default and no fallback, so a
 * caller always states which backend it wants. Names are case-insensitive.
 */
public final class BackendRegistry {

    private static final Logger LOG = Logger.getLogger(BackendRegistry.class.getName());

    private static final Map<String, Supplier<Backend>> FACTORIES = new ConcurrentHashMap<>();

    private BackendRegistry() {} // Utility class

    /**
     * Registers a factory under a name, replacing any factory already registered under it.
     *
     * @throws IllegalArgumentException for a blank name
     */
    public static void register(String name, Supplier<Backend> factory) {
        Objects.requireNonNull(factory, "factory cannot be null");
        String key = key(name);
        Supplier<Backend> previous = FACTORIES.put(key, factory);
        LOG.info((previous == null ? "Registered" : "Replaced") + " backend '" + key + "'");
    }

    public static boolean isRegistered(String name) {
        return FACTORIES.containsKey(key(name));
    }

    /**
     * Creates a new instance of the named backend.
     *
     * @throws IllegalArgumentException if no backend is registered under the name
     */
    public static Backend get(String name) {
        Supplier<Backend> factory = FACTORIES.get(key(name));
        if (factory == null) {
            throw new IllegalArgumentException(
                "Backend '" + name + "' not registered. Available: " + available());
        }
        return factory.get();
    }

    /**
     * Registered names in lowercase, sorted.
     */
    public static List<String> available() {
        return FACTORIES.keySet().stream().sorted().toList();
    }

    /**
     * Forgets every registration.
     */
    public static void clear() {
        FACTORIES.clear();
    }

    private static String key(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Backend name must not be blank");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
