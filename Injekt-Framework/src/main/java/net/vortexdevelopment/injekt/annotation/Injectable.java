package net.vortexdevelopment.injekt.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as injectable: the container keeps a single instance of it and may supply it
 * as a constructor dependency, including for any abstract class or interface it extends.
 *
 * <p>Annotated classes are marked the first time the container sees them: when they are
 * constructed, when their package is scanned, or when an abstract type declared in the same
 * package, or required by a class of the same package, has no known implementer. Marking
 * registers the class as an implementer of all of its supertypes. Implementers living in other
 * packages need {@code injekt.scan.packages} or an explicit mark.
 *
 * <pre>
 * {@code
 * @Injectable
 * public class BQDatabase extends Database {
 * }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Injectable {
}
