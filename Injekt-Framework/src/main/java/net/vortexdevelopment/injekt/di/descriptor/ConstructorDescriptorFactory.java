package net.vortexdevelopment.injekt.di.descriptor;

import net.vortexdevelopment.injekt.annotation.Inject;
import net.vortexdevelopment.injekt.debug.DebugLogger;
import net.vortexdevelopment.injekt.di.utils.DependencyUtils;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Produces and caches one {@link ConstructorDescriptor} per type.
 *
 * <p>The constructor used for injection is, in order: the one annotated with {@link Inject},
 * the only declared constructor, or the no-arg constructor. Parameter names are read from the
 * class file, which requires compiling with {@code -parameters}; without it names fall back to
 * {@code arg0, arg1, ...} and named arguments cannot be matched.
 */
public class ConstructorDescriptorFactory {

    private final Map<Class<?>, ConstructorDescriptor<?>> descriptors = new ConcurrentHashMap<>();

    /**
     * Get the descriptor of a type, creating it by reflection on first use.
     */
    @NotNull
    @SuppressWarnings("unchecked")
    public <T> ConstructorDescriptor<T> describe(@NotNull Class<T> type) {
        return (ConstructorDescriptor<T>) descriptors.computeIfAbsent(type, this::reflect);
    }

    /**
     * Install a hand-written descriptor, replacing any existing one for the same type.
     */
    public void register(@NotNull ConstructorDescriptor<?> descriptor) {
        descriptors.put(descriptor.getType(), descriptor);
    }

    private <T> ConstructorDescriptor<T> reflect(Class<T> type) {
        Constructor<T> constructor = selectConstructor(type);
        List<ParameterDescriptor> parameters = new ArrayList<>();
        Parameter[] reflected = constructor.getParameters();
        for (int i = 0; i < reflected.length; i++) {
            Parameter parameter = reflected[i];
            if (!parameter.isNamePresent()) {
                DebugLogger.log("Parameter names of %s are not available, compile with -parameters to match named arguments", type.getName());
            }
            parameters.add(new ParameterDescriptor(i, parameter.getName(), parameter.getType()));
        }
        DebugLogger.log("Described %s with constructor parameters %s", type.getName(), parameters);
        return new ConstructorDescriptor<>(type, parameters, reflective(constructor));
    }

    @SuppressWarnings("unchecked")
    private <T> Constructor<T> selectConstructor(Class<T> type) {
        Constructor<T>[] constructors = (Constructor<T>[]) type.getDeclaredConstructors();
        Constructor<T> selected = null;
        for (Constructor<T> constructor : constructors) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                if (selected != null) {
                    throw new RuntimeException("Multiple @Inject constructors found in class: " + type.getName());
                }
                selected = constructor;
            }
        }
        if (selected != null) {
            return selected;
        }
        if (constructors.length == 1) {
            return constructors[0];
        }
        if (DependencyUtils.hasDefaultConstructor(type)) {
            try {
                return type.getDeclaredConstructor();
            } catch (NoSuchMethodException e) {
                throw new RuntimeException("Unable to access default constructor of class: " + type.getName(), e);
            }
        }
        throw new RuntimeException("Unable to choose a constructor for class: " + type.getName()
                + ". Annotate one of its " + constructors.length + " constructors with @Inject.");
    }

    private static <T> Instantiator<T> reflective(Constructor<T> constructor) {
        constructor.setAccessible(true);
        return arguments -> {
            try {
                return constructor.newInstance(arguments);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            } catch (InstantiationException | IllegalAccessException e) {
                throw new RuntimeException("Unable to create new instance of class: " + constructor.getDeclaringClass().getName(), e);
            }
        };
    }
}
