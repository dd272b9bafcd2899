package net.vortexdevelopment.injekt.di;

import lombok.Getter;

/**
 * Thrown when a required type is abstract, or an interface, and no concrete implementation
 * of it is known to the container.
 */
@Getter
public class UnresolvableAbstractTypeException extends RuntimeException {

    private final Class<?> type;

    public UnresolvableAbstractTypeException(Class<?> type) {
        super("Unable to resolve abstract type: " + type.getName()
                + ". No concrete implementation is known, mark one with markInjectable(), or annotate one with @Injectable"
                + " in the package of the type, of the class requiring it, or in a scanned package.");
        this.type = type;
    }
}
