package net.vortexdevelopment.injekt;

import net.vortexdevelopment.injekt.di.DependencyContainer;
import net.vortexdevelopment.injekt.di.SuppliedArguments;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Static entry point to the process-wide {@link DependencyContainer}.
 *
 * <p>Usage example:
 * <pre>
 * {@code
 * @Injectable
 * public class GroupService {
 *     private final PersonService personService;
 *
 *     public GroupService(PersonService personService) {
 *         this.personService = personService;
 *     }
 * }
 *
 * GroupService groupService = Injekt.construct(GroupService.class);
 * assert groupService == Injekt.construct(GroupService.class);
 * }
 * </pre>
 *
 * <p>The registry lives as long as the process. Call {@link #reset()} between independent test
 * cases, never while another thread is constructing.
 */
public final class Injekt {

    private Injekt() {
    }

    /**
     * Mark a type as injectable. Idempotent.
     */
    public static void markInjectable(@NotNull Class<?> type) {
        DependencyContainer.getInstance().markInjectable(type);
    }

    /**
     * Get the canonical instance of a type, injecting its constructor dependencies on first use.
     */
    public static <T> @NotNull T construct(@NotNull Class<T> type) {
        return DependencyContainer.getInstance().construct(type);
    }

    /**
     * Get the canonical instance of a type, building it with the supplied arguments on first use.
     */
    public static <T> @NotNull T construct(@NotNull Class<T> type, @NotNull SuppliedArguments arguments) {
        return DependencyContainer.getInstance().construct(type, arguments);
    }

    public static <T> @Nullable T getDependencyOrNull(@NotNull Class<T> type) {
        return DependencyContainer.getInstance().getDependencyOrNull(type);
    }

    /**
     * Clear every registered instance.
     */
    public static void reset() {
        DependencyContainer.getInstance().reset();
    }
}
