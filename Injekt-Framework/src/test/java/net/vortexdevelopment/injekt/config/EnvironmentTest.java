package net.vortexdevelopment.injekt.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for property lookup.
 */
class EnvironmentTest {

    private final Environment environment = Environment.getInstance();

    @AfterEach
    void clearProperties() {
        System.clearProperty("injekt.test.overridden");
        System.clearProperty("injekt.test.flag");
        System.clearProperty("injekt.test.list");
    }

    @Test
    void readsApplicationPropertiesFromClasspath() {
        assertThat(environment.getProperty("injekt.test.greeting")).isEqualTo("hello from properties");
    }

    @Test
    void systemPropertyOverridesPropertiesFile() {
        assertThat(environment.getProperty("injekt.test.overridden")).isEqualTo("from file");

        System.setProperty("injekt.test.overridden", "from system");

        assertThat(environment.getProperty("injekt.test.overridden")).isEqualTo("from system");
    }

    @Test
    void missingPropertyFallsBackToDefault() {
        assertThat(environment.getProperty("injekt.test.missing")).isNull();
        assertThat(environment.getProperty("injekt.test.missing", "fallback")).isEqualTo("fallback");
        assertThat(environment.getProperty("")).isNull();
        assertThat(environment.getPropertyAsBoolean("injekt.test.missing", true)).isTrue();
    }

    @Test
    void booleanPropertyIsParsed() {
        System.setProperty("injekt.test.flag", " true ");

        assertThat(environment.getPropertyAsBoolean("injekt.test.flag", false)).isTrue();
    }

    @Test
    void listPropertyIsSplitAndTrimmed() {
        System.setProperty("injekt.test.list", " com.example.a, com.example.b ,, ");

        assertThat(environment.getPropertyAsList("injekt.test.list")).containsExactly("com.example.a", "com.example.b");
        assertThat(environment.getPropertyAsList("injekt.test.missing")).isEmpty();
    }

    @Test
    void environmentKeyUsesUpperSnakeCase() {
        assertThat(Environment.convertToEnvKey(Environment.SCAN_PACKAGES)).isEqualTo("INJEKT_SCAN_PACKAGES");
        assertThat(Environment.convertToEnvKey("injekt.debug-all")).isEqualTo("INJEKT_DEBUG_ALL");
    }
}
