package net.vortexdevelopment.injekt.di.utils;

import org.reflections.ReflectionUtils;

import java.lang.reflect.Modifier;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Utility class for common reflection operations in Injekt.
 */
public class DependencyUtils {

    /**
     * Check whether a type can be instantiated: not an interface, not abstract, not a primitive,
     * an array or an annotation.
     */
    public static boolean isConcrete(Class<?> clazz) {
        return !clazz.isInterface()
                && !clazz.isPrimitive()
                && !clazz.isArray()
                && !Modifier.isAbstract(clazz.getModifiers());
    }

    /**
     * All superclasses and interfaces of a class, excluding the class itself and {@link Object}.
     */
    public static Set<Class<?>> getSupertypes(Class<?> clazz) {
        return ReflectionUtils.getAllSuperTypes(clazz).stream()
                .filter(type -> type != clazz && type != Object.class)
                .collect(Collectors.toSet());
    }

    /**
     * The wrapper class of a primitive type, or the type itself.
     */
    public static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        return switch (type.getName()) {
            case "int" -> Integer.class;
            case "long" -> Long.class;
            case "boolean" -> Boolean.class;
            case "double" -> Double.class;
            case "float" -> Float.class;
            case "short" -> Short.class;
            case "byte" -> Byte.class;
            case "char" -> Character.class;
            default -> Void.class;
        };
    }

    public static boolean hasDefaultConstructor(Class<?> clazz) {
        try {
            clazz.getDeclaredConstructor();
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
