package net.vortexdevelopment.injekt.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Selects the constructor used for injection when a class declares more than one.
 *
 * <p>Example:
 * <pre>
 * public class UserService {
 *
 *     public UserService() {
 *         this(new InMemoryDatabase());
 *     }
 *
 *     {@literal @}Inject
 *     public UserService(Database database) {
 *         this.database = database;
 *     }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.CONSTRUCTOR)
public @interface Inject {
}
