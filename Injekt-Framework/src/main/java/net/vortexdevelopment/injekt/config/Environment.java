package net.vortexdevelopment.injekt.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Environment class for reading engine properties with support for:
 * - Environment variables (highest priority)
 * - System properties
 * - application.properties file (lowest priority)
 *
 * <p>Recognized keys:
 * <ul>
 *   <li>{@value #DEBUG_ALL} - print debug output for every class</li>
 *   <li>{@value #SCAN_PACKAGES} - comma separated packages scanned when a container is created</li>
 * </ul>
 */
public class Environment {

    public static final String DEBUG_ALL = "injekt.debug.all";
    public static final String SCAN_PACKAGES = "injekt.scan.packages";

    private static volatile Environment instance;
    private final Properties applicationProperties;

    private Environment() {
        applicationProperties = new Properties();
        loadApplicationProperties();
    }

    /**
     * Get the singleton Environment instance.
     *
     * @return The Environment instance
     */
    public static Environment getInstance() {
        if (instance == null) {
            synchronized (Environment.class) {
                if (instance == null) {
                    instance = new Environment();
                }
            }
        }
        return instance;
    }

    /**
     * Looks for application.properties in the current working directory first,
     * then on the classpath.
     */
    private void loadApplicationProperties() {
        String workingDir = System.getProperty("user.dir");
        File propertiesFile = new File(workingDir, "application.properties");
        if (propertiesFile.isFile()) {
            try (FileInputStream fileInputStream = new FileInputStream(propertiesFile)) {
                applicationProperties.load(fileInputStream);
                return;
            } catch (IOException e) {
                // Unreadable working directory file, fall back to the classpath
                applicationProperties.clear();
            }
        }

        try (InputStream inputStream = Environment.class.getClassLoader()
                .getResourceAsStream("application.properties")) {
            if (inputStream != null) {
                applicationProperties.load(inputStream);
            }
        } catch (IOException e) {
            throw new RuntimeException("Unable to read application.properties from the classpath", e);
        }
    }

    /**
     * Get a property value with resolution priority:
     * 1. Environment variables (converted from dot notation to UPPER_SNAKE_CASE)
     * 2. System properties
     * 3. application.properties file
     *
     * @param key The property key (supports dot notation, e.g., "injekt.debug.all")
     * @return The property value, or null if not found
     */
    @Nullable
    public String getProperty(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }

        String value = System.getenv(convertToEnvKey(key));
        if (value != null) {
            return value;
        }

        value = System.getProperty(key);
        if (value != null) {
            return value;
        }

        return applicationProperties.getProperty(key);
    }

    /**
     * Get a property value with a default value if not found.
     *
     * @param key The property key
     * @param defaultValue The default value to return if property is not found
     * @return The property value or default value
     */
    public String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get a property value as a boolean.
     *
     * @param key The property key
     * @param defaultValue The default value if property is not found
     * @return The boolean value
     */
    public boolean getPropertyAsBoolean(String key, boolean defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Get a comma separated property value as a list. Blank entries are dropped.
     *
     * @param key The property key
     * @return The trimmed values, empty if the property is not set
     */
    @NotNull
    public List<String> getPropertyAsList(String key) {
        List<String> values = new ArrayList<>();
        String value = getProperty(key);
        if (value == null) {
            return values;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    /**
     * Convert a property key from dot notation to environment variable format.
     * Example: "injekt.debug.all" -> "INJEKT_DEBUG_ALL"
     */
    static String convertToEnvKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }
}
