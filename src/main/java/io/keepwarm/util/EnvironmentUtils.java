package io.keepwarm.util;

import java.util.Map;
import java.util.function.Function;

/**
 * Utility class for reading secrets and settings from environment variables
 */
public final class EnvironmentUtils {
    
    private static volatile Function<String, String> lookup = System::getenv;
    
    private EnvironmentUtils() {
    }
    
    /**
     * Get required environment variable - throws exception if not set
     * 
     * @param name the environment variable name
     * @return the trimmed environment variable value
     * @throws IllegalStateException if the environment variable is not set or is empty
     */
    public static String getRequiredEnv(String name) {
        String value = lookup.apply(name);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalStateException("Required environment variable '" + name + "' is not set or is empty");
        }
        return value.trim();
    }
    
    /**
     * Get environment variable with default value. Blank values count as unset.
     */
    public static String getEnv(String name, String defaultValue) {
        String value = lookup.apply(name);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }
    
    /**
     * Replaces the variable source, for tests. Pass {@code null} to restore {@link System#getenv(String)}.
     */
    static void overrideForTesting(Map<String, String> variables) {
        lookup = variables == null ? System::getenv : variables::get;
    }
}
