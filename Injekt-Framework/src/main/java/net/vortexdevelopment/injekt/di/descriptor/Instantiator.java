package net.vortexdevelopment.injekt.di.descriptor;

/**
 * Invokes a constructor with a fully resolved argument array.
 * Whatever the constructor throws is thrown unchanged.
 *
 * @param <T> The constructed type
 */
@FunctionalInterface
public interface Instantiator<T> {

    T newInstance(Object[] arguments) throws Throwable;
}
