package net.vortexdevelopment.injekt.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Mapping from a type to its single live instance.
 *
 * <p>Entries keep insertion order, which is the order used when looking for a registered subtype.
 * Every operation runs under one reentrant lock: a thread constructing a type may resolve nested
 * dependencies through the same registry, while other threads wait until the construction is
 * stored. {@link #clear()} takes the same lock, so it never runs in the middle of a resolution.
 */
public class InstanceRegistry {

    private final Map<Class<?>, Object> instances = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Get the instance registered exactly under the given type.
     *
     * @param type The type key
     * @return The instance, or null if the type has not been constructed yet
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public <T> T get(@NotNull Class<T> type) {
        lock.lock();
        try {
            return (T) instances.get(type);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store or overwrite the instance for a type.
     */
    public void put(@NotNull Class<?> type, @NotNull Object instance) {
        lock.lock();
        try {
            instances.put(type, instance);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(@NotNull Class<?> type) {
        lock.lock();
        try {
            return instances.containsKey(type);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Find the first registered instance, in insertion order, whose type is a strict subtype
     * of the given type.
     *
     * @param type The required type
     * @return The instance, or null if no registered type extends or implements the given type
     */
    @Nullable
    public Object findSubtypeInstance(@NotNull Class<?> type) {
        lock.lock();
        try {
            for (Map.Entry<Class<?>, Object> entry : instances.entrySet()) {
                Class<?> registeredType = entry.getKey();
                if (registeredType != type && type.isAssignableFrom(registeredType)) {
                    return entry.getValue();
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the instance registered under the type, or create, store and return a new one.
     * The factory is invoked at most once per call and never when an instance already exists.
     * If the factory throws, nothing is stored.
     *
     * @throws IllegalStateException if the factory returns null
     */
    public <T> T computeIfAbsent(@NotNull Class<T> type, @NotNull Function<Class<T>, ? extends T> factory) {
        lock.lock();
        try {
            T existing = type.cast(instances.get(type));
            if (existing != null) {
                return existing;
            }
            T created = factory.apply(type);
            if (created == null) {
                throw new IllegalStateException("Unable to register null instance for class: " + type.getName());
            }
            instances.put(type, created);
            return created;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a multi-step lookup as a single critical section.
     */
    public <T> T atomically(@NotNull Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Types currently registered, in insertion order.
     */
    @NotNull
    public List<Class<?>> getRegisteredTypes() {
        lock.lock();
        try {
            return new ArrayList<>(instances.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return instances.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every entry. Safe to call on an empty registry.
     */
    public void clear() {
        lock.lock();
        try {
            instances.clear();
        } finally {
            lock.unlock();
        }
    }
}
