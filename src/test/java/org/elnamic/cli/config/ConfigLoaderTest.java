package org.elnamic.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.elnamic.runtime.RuntimeOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the precedence chain of {@link ConfigLoader}.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    /**
     * Verifies that the bundled defaults are present without any file or override.
     */
    @Test
    @Tag("unit")
    void testDefaults() {
        // Act
        Config config = ConfigLoader.load(null, null);

        // Assert
        assertThat(config.getLong("elnamic.runtime.max-loop-iterations")).isEqualTo(10_000_000L);
        assertThat(config.getBoolean("elnamic.proof.report-status")).isFalse();
        assertThat(config.getString("elnamic.repl.prompt")).isEqualTo("el> ");
        assertThat(RuntimeOptions.fromConfig(config)).isEqualTo(RuntimeOptions.defaults());
    }

    /**
     * Verifies that a file overrides the defaults and command-line overrides win over the file.
     */
    @Test
    @Tag("unit")
    void testFileAndOverridePrecedence() throws IOException {
        // Arrange
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "elnamic.runtime { max-call-depth = 42, max-loop-iterations = 7 }");

        // Act
        Config config = ConfigLoader.load(file.toFile(), Map.of("elnamic.runtime.max-loop-iterations", "99"));
        RuntimeOptions options = RuntimeOptions.fromConfig(config);

        // Assert
        assertThat(options.maxCallDepth()).isEqualTo(42);
        assertThat(options.maxLoopIterations()).isEqualTo(99L);
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    /**
     * Verifies that an explicitly named file must exist.
     */
    @Test
    @Tag("unit")
    void testMissingExplicitFile() {
        // Arrange
        File missing = tempDir.resolve("absent.conf").toFile();

        // Act & Assert
        assertThatThrownBy(() -> ConfigLoader.load(missing, null)).isInstanceOf(ConfigException.class);
    }
}
