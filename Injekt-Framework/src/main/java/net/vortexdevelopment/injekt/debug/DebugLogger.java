package net.vortexdevelopment.injekt.debug;

import net.vortexdevelopment.injekt.annotation.util.EnableDebug;
import net.vortexdevelopment.injekt.annotation.util.EnableDebugFor;
import net.vortexdevelopment.injekt.config.Environment;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debug logger utility that auto-detects the calling class.
 * Classes can be enabled for debug logging via @EnableDebug or @EnableDebugFor annotations,
 * or all at once with the {@value Environment#DEBUG_ALL} property.
 */
public class DebugLogger {

    private static final Set<String> enabledClasses = ConcurrentHashMap.newKeySet();

    /**
     * Enable debug logging for multiple classes.
     */
    public static void enableDebugFor(Class<?>... classes) {
        for (Class<?> clazz : classes) {
            enabledClasses.add(clazz.getName());
        }
    }

    /**
     * Apply the @EnableDebug and @EnableDebugFor annotations present on a class.
     * Called by the container when the class is marked injectable.
     */
    public static void enableFromAnnotations(Class<?> clazz) {
        if (clazz.isAnnotationPresent(EnableDebug.class)) {
            enableDebugFor(clazz);
        }
        EnableDebugFor debugFor = clazz.getAnnotation(EnableDebugFor.class);
        if (debugFor != null) {
            enableDebugFor(debugFor.value());
        }
    }

    /**
     * Check if debug logging is enabled for a class.
     */
    public static boolean isEnabled(Class<?> clazz) {
        return enabledClasses.contains(clazz.getName())
                || Environment.getInstance().getPropertyAsBoolean(Environment.DEBUG_ALL, false);
    }

    /**
     * Log a debug message. Automatically detects the calling class.
     *
     * @param message the debug message
     */
    public static void log(String message) {
        Class<?> callerClass = getCallerClass();
        if (callerClass != null && isEnabled(callerClass)) {
            print(callerClass, message);
        }
    }

    /**
     * Log a debug message with formatted arguments. Automatically detects the calling class.
     * The message is only formatted when logging is enabled for the caller.
     *
     * @param format the format string
     * @param args the arguments
     */
    public static void log(String format, Object... args) {
        Class<?> callerClass = getCallerClass();
        if (callerClass != null && isEnabled(callerClass)) {
            print(callerClass, String.format(format, args));
        }
    }

    /**
     * Log a formatted debug message for a specific class.
     *
     * @param clazz the class to log for
     * @param format the format string
     * @param args the arguments
     */
    public static void log(Class<?> clazz, String format, Object... args) {
        if (isEnabled(clazz)) {
            print(clazz, String.format(format, args));
        }
    }

    private static void print(Class<?> clazz, String message) {
        System.out.println("[DEBUG:" + clazz.getSimpleName() + "] " + message);
    }

    /**
     * Auto-detect the calling class using StackWalker.
     */
    private static Class<?> getCallerClass() {
        return StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE)
                .walk(frames -> frames
                        .skip(2) // Skip DebugLogger.log() and DebugLogger.getCallerClass()
                        .findFirst()
                        .map(StackWalker.StackFrame::getDeclaringClass)
                        .orElse(null));
    }

    /**
     * Clear all enabled debug classes (for testing).
     */
    public static void clearAll() {
        enabledClasses.clear();
    }
}
