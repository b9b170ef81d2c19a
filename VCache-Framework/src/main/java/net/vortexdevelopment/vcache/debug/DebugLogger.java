package net.vortexdevelopment.vcache.debug;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debug logger utility that auto-detects the calling class.
 * Verbose cache tracing (hits, misses, evictions) goes through here so it can be
 * switched on per class without touching the logging backend configuration.
 * <p>
 * Enable globally with {@code -Dvcache.debug.all=true} or per class with
 * {@link #enableDebugFor(Class...)}. Enabled messages are written to the SLF4J
 * logger of the calling class at DEBUG level.
 */
public class DebugLogger {

    private static final Set<String> enabledClasses = ConcurrentHashMap.newKeySet();
    private static final boolean GLOBAL_DEBUG = Boolean.getBoolean("vcache.debug.all");

    /**
     * Enable debug logging for one or more classes.
     */
    public static void enableDebugFor(Class<?>... classes) {
        for (Class<?> clazz : classes) {
            enabledClasses.add(clazz.getName());
        }
    }

    /**
     * Check if debug logging is enabled for a class.
     */
    public static boolean isEnabled(Class<?> clazz) {
        return GLOBAL_DEBUG || enabledClasses.contains(clazz.getName());
    }

    /**
     * Log a debug message with formatted arguments. Automatically detects the calling class.
     *
     * @param format the format string
     * @param args the arguments
     */
    public static void log(String format, Object... args) {
        Class<?> callerClass = getCallerClass();
        if (callerClass != null && isEnabled(callerClass)) {
            write(callerClass, args.length == 0 ? format : String.format(format, args));
        }
    }

    /**
     * Log a formatted debug message for a specific class (fallback when auto-detection fails).
     *
     * @param clazz the class to log for
     * @param format the format string
     * @param args the arguments
     */
    public static void log(Class<?> clazz, String format, Object... args) {
        if (isEnabled(clazz)) {
            write(clazz, args.length == 0 ? format : String.format(format, args));
        }
    }

    private static void write(Class<?> clazz, String message) {
        Logger logger = LoggerFactory.getLogger(clazz);
        logger.debug("[DEBUG:{}] {}", clazz.getSimpleName(), message);
    }

    /**
     * Auto-detect the calling class using StackWalker.
     */
    private static Class<?> getCallerClass() {
        try {
            return StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE)
                    .walk(frames -> frames
                            .skip(2) // DebugLogger.log() and DebugLogger.getCallerClass()
                            .findFirst()
                            .map(StackWalker.StackFrame::getDeclaringClass)
                            .orElse(null));
        } catch (RuntimeException e) {
            return null;
        }
    }

    /**
     * Clear all enabled debug classes (for testing).
     */
    public static void clearAll() {
        enabledClasses.clear();
    }
}
