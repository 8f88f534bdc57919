package org.optiscope.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: file selection and the precedence of system properties over
 * the file and of the file over {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    private final List<String> messages = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("optiscope.menu-columns");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should layer the file over the bundled defaults")
    void loadFromFile_shouldLayerFileOverDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(2, config.getInt("optiscope.menu-columns"));
        assertEquals(List.of("owner"), config.getStringList("optiscope.reserved-identifiers"));
        assertEquals("----------------------", config.getString("optiscope.separator"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("optiscope.menu-columns", "3");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(3, config.getInt("optiscope.menu-columns"));
    }

    @Test
    @DisplayName("Substitutions should resolve after all layers are stacked")
    void loadFromFile_shouldResolveReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
        assertEquals(5, config.getInt("optiscope.sequence.max-rounds"));
    }

    @Test
    @DisplayName("loadDefaults should return the reference configuration")
    void loadDefaults_shouldReturnReferenceConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(4, config.getInt("optiscope.menu-columns"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("An explicit file takes precedence and is reported")
    void resolve_shouldUseExplicitFile() {
        Config config = ConfigLoader.resolve(testResource("test-config.conf"), (level, message) -> messages.add(level + " " + message));

        assertEquals(2, config.getInt("optiscope.menu-columns"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file"));
    }

    @Test
    @DisplayName("A missing explicit file is rejected")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.resolve(missing, (level, message) -> messages.add(message)));
        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    @DisplayName("-Dconfig.file is used when no explicit file is given")
    void resolve_shouldUseConfigFileProperty() {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());

        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(level + " " + message));

        assertEquals(2, config.getInt("optiscope.menu-columns"));
        assertTrue(messages.get(0).contains("-Dconfig.file"));
    }

    @Test
    @DisplayName("A -Dconfig.file naming a missing file is rejected")
    void resolve_shouldRejectMissingConfigFileProperty() {
        System.setProperty("config.file", "missing/optiscope.conf");

        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(null, (level, message) -> { }));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
