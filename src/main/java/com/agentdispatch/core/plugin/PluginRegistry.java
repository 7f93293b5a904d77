package com.agentdispatch.core.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Name-to-factory registry for pluggable components (agent providers, dependency rules).
 * <p>
 * Built-ins register a {@link Supplier}; external plugins are loaded by class name once at
 * startup. A plugin that fails to load or instantiate is logged and excluded, and never
 * prevents the others from loading.
 *
 * @param <T> plugin contract
 */
public class PluginRegistry<T> {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final String kind;
    private final Class<T> contract;
    private final ClassLoader classLoader;
    private final Map<String, Supplier<? extends T>> factories = new LinkedHashMap<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    public PluginRegistry(String kind, Class<T> contract) {
        this(kind, contract, PluginRegistry.class.getClassLoader());
    }

    public PluginRegistry(String kind, Class<T> contract, ClassLoader classLoader) {
        this.kind = kind;
        this.contract = contract;
        this.classLoader = classLoader;
    }

    public synchronized void register(String name, Supplier<? extends T> factory) {
        if (factories.put(name, factory) != null) {
            log.info("Replaced {} plugin '{}'", kind, name);
        }
        failures.remove(name);
    }

    /**
     * Registers a plugin by fully-qualified class name. The class must implement the
     * registry's contract and expose a public no-arg constructor.
     *
     * @return false if the class could not be loaded; the failure is recorded, not thrown
     */
    public synchronized boolean registerClass(String name, String className) {
        try {
            Class<?> raw = Class.forName(className, true, classLoader);
            if (!contract.isAssignableFrom(raw)) {
                throw new PluginLoadException(className + " does not implement " + contract.getName());
            }
            Constructor<? extends T> ctor = raw.asSubclass(contract).getConstructor();
            register(name, () -> instantiate(name, ctor));
            log.info("Loaded {} plugin '{}' from {}", kind, name, className);
            return true;
        } catch (ReflectiveOperationException | LinkageError | RuntimeException e) {
            log.warn("Failed to load {} plugin '{}' from {}: {}", kind, name, className, e.toString());
            failures.put(name, e.toString());
            return false;
        }
    }

    /**
     * Loads every entry of a name-to-class-name map, isolating failures.
     *
     * @return number of plugins loaded
     */
    public int loadAll(Map<String, String> classNames) {
        int loaded = 0;
        for (var entry : classNames.entrySet()) {
            if (registerClass(entry.getKey(), entry.getValue())) {
                loaded++;
            }
        }
        return loaded;
    }

    public synchronized T create(String name) {
        Supplier<? extends T> factory = factories.get(name);
        if (factory == null) {
            throw new PluginLoadException("No " + kind + " plugin named '" + name + "'");
        }
        return factory.get();
    }

    /**
     * Instantiates every registered plugin in registration order. A plugin whose factory
     * throws is dropped from the registry and reported under {@link #failures()}.
     */
    public synchronized List<T> createAll() {
        var created = new ArrayList<T>();
        var broken = new ArrayList<String>();
        for (var entry : factories.entrySet()) {
            try {
                created.add(entry.getValue().get());
            } catch (RuntimeException e) {
                log.warn("Excluding {} plugin '{}': {}", kind, entry.getKey(), e.getMessage());
                failures.put(entry.getKey(), e.toString());
                broken.add(entry.getKey());
            }
        }
        broken.forEach(factories::remove);
        return created;
    }

    public synchronized boolean contains(String name) {
        return factories.containsKey(name);
    }

    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(factories.keySet()));
    }

    /** Plugins excluded at load or instantiation time, with the cause. */
    public synchronized Map<String, String> failures() {
        return Map.copyOf(failures);
    }

    private T instantiate(String name, Constructor<? extends T> ctor) {
        try {
            return ctor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new PluginLoadException("Cannot instantiate " + kind + " plugin '" + name + "'", e);
        }
    }
}
