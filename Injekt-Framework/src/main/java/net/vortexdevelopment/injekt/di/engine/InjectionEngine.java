package net.vortexdevelopment.injekt.di.engine;

import net.vortexdevelopment.injekt.debug.DebugLogger;
import net.vortexdevelopment.injekt.di.SuppliedArguments;
import net.vortexdevelopment.injekt.di.descriptor.ConstructorDescriptor;
import net.vortexdevelopment.injekt.di.descriptor.ParameterDescriptor;
import net.vortexdevelopment.injekt.di.utils.DependencyUtils;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Fills the constructor arguments of a type.
 * Supplied arguments are taken as they are; every other parameter is resolved by type.
 */
public class InjectionEngine {

    private final TypeResolver typeResolver;

    public InjectionEngine(TypeResolver typeResolver) {
        this.typeResolver = typeResolver;
    }

    /**
     * Build the complete argument array for a constructor.
     *
     * @param descriptor The constructor to fill
     * @param supplied Arguments given by the caller, used verbatim and never registered
     * @return One value per parameter, in declaration order
     * @throws IllegalArgumentException if the supplied arguments do not match the parameters,
     *                                  or a parameter that cannot be injected was not supplied
     */
    @NotNull
    public Object[] resolveArguments(@NotNull ConstructorDescriptor<?> descriptor, @NotNull SuppliedArguments supplied) {
        validate(descriptor, supplied);

        List<ParameterDescriptor> parameters = descriptor.getParameters();
        Object[] arguments = new Object[parameters.size()];
        for (ParameterDescriptor parameter : parameters) {
            int index = parameter.getIndex();
            if (supplied.hasPositional(index)) {
                arguments[index] = supplied.getPositional(index);
                continue;
            }
            if (supplied.hasNamed(parameter.getName())) {
                arguments[index] = supplied.getNamed(parameter.getName());
                continue;
            }
            if (!parameter.isInjectable()) {
                throw new IllegalArgumentException("Missing argument for constructor parameter '" + parameter.getName()
                        + "' of class: " + descriptor.getType().getName() + ". Parameters of type "
                        + (parameter.getType() != null ? parameter.getType().getName() : "unknown")
                        + " cannot be injected and must be supplied.");
            }
            arguments[index] = typeResolver.resolve(parameter.getType(), descriptor.getType());
            DebugLogger.log("Injected %s into %s", parameter, descriptor.getType().getName());
        }
        return arguments;
    }

    private void validate(ConstructorDescriptor<?> descriptor, SuppliedArguments supplied) {
        String className = descriptor.getType().getName();
        List<ParameterDescriptor> parameters = descriptor.getParameters();
        if (supplied.getPositionalCount() > parameters.size()) {
            throw new IllegalArgumentException("Too many positional arguments for class: " + className
                    + ". Expected at most " + parameters.size() + " but got " + supplied.getPositionalCount());
        }

        for (String name : supplied.getNames()) {
            ParameterDescriptor parameter = parameters.stream()
                    .filter(candidate -> candidate.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown constructor parameter '" + name
                            + "' for class: " + className));
            if (supplied.hasPositional(parameter.getIndex())) {
                throw new IllegalArgumentException("Constructor parameter '" + name + "' of class: " + className
                        + " was supplied both by position and by name");
            }
        }

        for (ParameterDescriptor parameter : parameters) {
            int index = parameter.getIndex();
            if (supplied.hasPositional(index)) {
                checkType(className, parameter, supplied.getPositional(index));
            } else if (supplied.hasNamed(parameter.getName())) {
                checkType(className, parameter, supplied.getNamed(parameter.getName()));
            }
        }
    }

    private void checkType(String className, ParameterDescriptor parameter, Object value) {
        Class<?> type = parameter.getType();
        if (type == null) {
            return;
        }
        if (value == null) {
            if (type.isPrimitive()) {
                throw new IllegalArgumentException("Null supplied for primitive constructor parameter '"
                        + parameter.getName() + "' of class: " + className);
            }
            return;
        }
        if (!DependencyUtils.boxed(type).isInstance(value)) {
            throw new IllegalArgumentException("Supplied argument of type " + value.getClass().getName()
                    + " does not match constructor parameter '" + parameter.getName() + "' of type "
                    + type.getName() + " in class: " + className);
        }
    }
}
