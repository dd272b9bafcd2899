package net.vortexdevelopment.injekt.di.scan;

import net.vortexdevelopment.injekt.di.utils.DependencyUtils;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Known implementers of each supertype, in registration order.
 *
 * <p>A class registers itself once, under every superclass and interface it has. Lookups return
 * the implementers of a type in the order they were registered.
 */
public class ImplementerIndex {

    private final Map<Class<?>, Set<Class<?>>> implementers = new LinkedHashMap<>();

    /**
     * Register a class as an implementer of all its supertypes.
     *
     * @return true if the class was not registered before
     */
    public synchronized boolean register(@NotNull Class<?> implementer) {
        boolean added = false;
        for (Class<?> supertype : DependencyUtils.getSupertypes(implementer)) {
            added |= implementers.computeIfAbsent(supertype, key -> new LinkedHashSet<>()).add(implementer);
        }
        return added;
    }

    /**
     * Registered subtypes of the given type, concrete or not, in registration order.
     */
    @NotNull
    public synchronized List<Class<?>> getSubtypes(@NotNull Class<?> type) {
        Set<Class<?>> subtypes = implementers.get(type);
        return subtypes == null ? new ArrayList<>() : new ArrayList<>(subtypes);
    }
}
