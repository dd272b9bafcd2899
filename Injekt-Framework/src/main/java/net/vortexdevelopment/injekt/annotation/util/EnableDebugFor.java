package net.vortexdevelopment.injekt.annotation.util;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables debug logging for the specified classes once the annotated class is marked injectable.
 *
 * Example:
 * <pre>
 * {@code @EnableDebugFor({TypeResolver.class, DependencyContainer.class})}
 * {@code @Injectable}
 * public class UserService {
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EnableDebugFor {
    /**
     * Classes to enable debug logging for.
     */
    Class<?>[] value();
}
