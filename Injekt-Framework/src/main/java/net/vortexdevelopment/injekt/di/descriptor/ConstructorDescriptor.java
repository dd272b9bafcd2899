package net.vortexdevelopment.injekt.di.descriptor;

import lombok.Getter;
import lombok.SneakyThrows;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Describes how to build a type: the parameters of the constructor used for injection and the
 * {@link Instantiator} that calls it.
 *
 * <p>Descriptors are produced once per type, either by reflection in
 * {@link ConstructorDescriptorFactory} or by hand:
 * <pre>
 * {@code
 * ConstructorDescriptor<UserService> descriptor = ConstructorDescriptor.builder(UserService.class)
 *         .parameter("database", Database.class)
 *         .instantiator(arguments -> new UserService((Database) arguments[0]))
 *         .build();
 * }
 * </pre>
 *
 * @param <T> The described type
 */
@Getter
public class ConstructorDescriptor<T> {

    private final Class<T> type;
    private final List<ParameterDescriptor> parameters;
    private final Instantiator<T> instantiator;

    public ConstructorDescriptor(@NotNull Class<T> type, @NotNull List<ParameterDescriptor> parameters, @NotNull Instantiator<T> instantiator) {
        this.type = type;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.instantiator = instantiator;
    }

    public static <T> Builder<T> builder(@NotNull Class<T> type) {
        return new Builder<>(type);
    }

    public int getParameterCount() {
        return parameters.size();
    }

    /**
     * Invoke the constructor exactly once. Exceptions raised by the constructor propagate as they are.
     */
    @SneakyThrows
    public T instantiate(Object[] arguments) {
        return instantiator.newInstance(arguments);
    }

    @Override
    public String toString() {
        return type.getSimpleName() + parameters;
    }

    public static class Builder<T> {
        private final Class<T> type;
        private final List<ParameterDescriptor> parameters = new ArrayList<>();
        private Instantiator<T> instantiator;

        private Builder(Class<T> type) {
            this.type = type;
        }

        /**
         * Add the next parameter. A null type marks a parameter the container cannot inject.
         */
        public Builder<T> parameter(@NotNull String name, Class<?> parameterType) {
            parameters.add(new ParameterDescriptor(parameters.size(), name, parameterType));
            return this;
        }

        public Builder<T> instantiator(@NotNull Instantiator<T> instantiator) {
            this.instantiator = instantiator;
            return this;
        }

        public ConstructorDescriptor<T> build() {
            if (instantiator == null) {
                throw new IllegalStateException("No instantiator set for descriptor of class: " + type.getName());
            }
            return new ConstructorDescriptor<>(type, parameters, instantiator);
        }
    }
}
