package net.vortexdevelopment.injekt.di.engine;

import net.vortexdevelopment.injekt.debug.DebugLogger;
import net.vortexdevelopment.injekt.di.DependencyContainer;
import net.vortexdevelopment.injekt.di.InstanceRegistry;
import net.vortexdevelopment.injekt.di.UnresolvableAbstractTypeException;
import net.vortexdevelopment.injekt.di.scan.ClasspathScanner;
import net.vortexdevelopment.injekt.di.utils.DependencyUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves a required type to a single instance. Rules are tried in order and the first one
 * that produces an instance wins:
 * <ol>
 *   <li>an instance registered exactly under the type</li>
 *   <li>the first registered instance, in registration order, whose type is a strict subtype</li>
 *   <li>the first concrete implementer known to the container, which is then constructed</li>
 *   <li>failure, when the type is abstract or only has abstract subtypes</li>
 *   <li>a new instance of the type itself</li>
 * </ol>
 * Implementers are ordered by marking order first, then by class name for subtypes found by
 * package scanning. Before failing on an abstract type, the packages of the type and of the class
 * requiring it are searched for {@link net.vortexdevelopment.injekt.annotation.Injectable} classes.
 */
public class TypeResolver {

    private final DependencyContainer container;

    public TypeResolver(DependencyContainer container) {
        this.container = container;
    }

    /**
     * Resolve the required type to an instance, constructing and registering one if needed.
     *
     * @param type The required type
     * @return An instance assignable to the type
     * @throws UnresolvableAbstractTypeException if the type is abstract and has no concrete implementer
     */
    @NotNull
    public Object resolve(@NotNull Class<?> type) {
        return resolve(type, null);
    }

    /**
     * Resolve the required type on behalf of the class whose constructor needs it.
     *
     * @param type The required type
     * @param requester The class being constructed, or null
     * @return An instance assignable to the type
     * @throws UnresolvableAbstractTypeException if the type is abstract and has no concrete implementer
     */
    @NotNull
    public Object resolve(@NotNull Class<?> type, @Nullable Class<?> requester) {
        InstanceRegistry registry = container.getRegistry();
        return registry.atomically(() -> {
            Object instance = registry.get(type);
            if (instance != null) {
                DebugLogger.log("Resolved %s from the registry", type.getName());
                return instance;
            }

            instance = registry.findSubtypeInstance(type);
            if (instance != null) {
                DebugLogger.log("Resolved %s with registered subtype %s", type.getName(), instance.getClass().getName());
                return instance;
            }

            List<Class<?>> subtypes = getKnownSubtypes(type);
            List<Class<?>> implementers = getImplementers(subtypes);
            if (implementers.isEmpty() && !DependencyUtils.isConcrete(type) && container.discoverInjectables(type, requester)) {
                subtypes = getKnownSubtypes(type);
                implementers = getImplementers(subtypes);
            }
            if (!implementers.isEmpty()) {
                Class<?> implementer = implementers.get(0);
                DebugLogger.log("Resolved %s with implementer %s out of %s", type.getName(), implementer.getName(), implementers);
                return container.construct(implementer);
            }

            if (!subtypes.isEmpty() || !DependencyUtils.isConcrete(type)) {
                throw new UnresolvableAbstractTypeException(type);
            }

            DebugLogger.log("Constructing %s directly", type.getName());
            return container.construct(type);
        });
    }

    /**
     * Subtypes known for a type: marked implementers in marking order, followed by those found
     * through package scanning that were not marked.
     */
    @NotNull
    public List<Class<?>> getKnownSubtypes(@NotNull Class<?> type) {
        Set<Class<?>> subtypes = new LinkedHashSet<>(container.getImplementerIndex().getSubtypes(type));
        for (ClasspathScanner scanner : container.getScanners()) {
            subtypes.addAll(scanner.getSubTypesOf(type));
        }
        return new ArrayList<>(subtypes);
    }

    private static List<Class<?>> getImplementers(List<Class<?>> subtypes) {
        return subtypes.stream()
                .filter(DependencyUtils::isConcrete)
                .toList();
    }
}
