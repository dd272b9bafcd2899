package net.vortexdevelopment.injekt.di;

import net.vortexdevelopment.injekt.di.descriptor.ConstructorDescriptor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public interface DependencyRepository {

    /**
     * Mark a type as injectable and register it as an implementer of its supertypes.
     * Marking the same type again has no effect.
     * @param type The type to mark
     */
    void markInjectable(@NotNull Class<?> type);

    /**
     * Check whether a type has been marked or carries {@link net.vortexdevelopment.injekt.annotation.Injectable}.
     * @param type The type to check
     * @return true if the type is injectable
     */
    boolean isInjectable(@NotNull Class<?> type);

    /**
     * Get the canonical instance of a type, constructing it with injected dependencies on first use
     * @param type The type to construct
     * @return The single instance of the type
     * @param <T> The type
     */
    @NotNull <T> T construct(@NotNull Class<T> type);

    /**
     * Get the canonical instance of a type. On first construction the supplied arguments fill their
     * parameters verbatim and every other parameter is injected. Once the instance exists the
     * supplied arguments are ignored.
     * @param type The type to construct
     * @param arguments Arguments given by the caller
     * @return The single instance of the type
     * @param <T> The type
     */
    @NotNull <T> T construct(@NotNull Class<T> type, @NotNull SuppliedArguments arguments);

    /**
     * Get a dependency from the repository
     * @param dependency The class of the dependency
     * @return The dependency instance
     * @param <T> The type of the dependency
     * @throws RuntimeException if the dependency has not been constructed
     */
    @NotNull <T> T getDependency(@NotNull Class<T> dependency);

    /**
     * Get a dependency from the repository
     * @param dependency The class of the dependency
     * @return The dependency instance or null if it doesn't exist
     * @param <T> The type of the dependency
     */
    @Nullable <T> T getDependencyOrNull(@NotNull Class<T> dependency);

    /**
     * Install a hand-written constructor descriptor used instead of reflection for its type
     * @param descriptor The descriptor
     */
    void registerDescriptor(@NotNull ConstructorDescriptor<?> descriptor);

    /**
     * Scan packages for {@link net.vortexdevelopment.injekt.annotation.Injectable} classes and
     * use them, and any other class found there, as implementer candidates
     * @param packages The packages to scan
     */
    void scanPackages(@NotNull String... packages);

    /**
     * Remove every registered instance. References obtained before stay valid but are no longer
     * returned by the repository.
     */
    void reset();

    static @NotNull DependencyRepository getInstance() {
        return DependencyContainer.getInstance();
    }
}
