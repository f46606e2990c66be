package org.nanoir.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.nanoir.junit.extensions.logging.LogWatchExtension;
import org.nanoir.runtime.RuntimeOptions;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String TRACE_PROPERTY = "nanoir.runtime.trace-nodes";

    @AfterEach
    void tearDown() {
        System.clearProperty(TRACE_PROPERTY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void load_shouldFallBackToReferenceDefaults(@TempDir Path dir) {
        Config config = ConfigLoader.load(dir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile());

        assertThat(config.getInt("nanoir.runtime.viewport.width")).isEqualTo(800);
        assertThat(config.getInt("nanoir.runtime.viewport.height")).isEqualTo(600);
        assertThat(config.getBoolean("nanoir.runtime.trace-nodes")).isFalse();
        assertThat(config.getStringList("nanoir.validation.implicit-targets")).containsExactly("screen");
    }

    @Test
    void load_shouldLetTheFileOverrideDefaults(@TempDir Path dir) throws IOException {
        File file = writeConfig(dir, "nanoir.runtime.viewport { width = 320 }\nnanoir.validation.implicit-targets = [screen, canvas]\n");

        Config config = ConfigLoader.load(file);

        assertThat(config.getInt("nanoir.runtime.viewport.width")).isEqualTo(320);
        assertThat(config.getInt("nanoir.runtime.viewport.height")).isEqualTo(600);
        assertThat(config.getStringList("nanoir.validation.implicit-targets")).containsExactly("screen", "canvas");
    }

    @Test
    void load_shouldLetSystemPropertiesOverrideTheFile(@TempDir Path dir) throws IOException {
        File file = writeConfig(dir, "nanoir.runtime.trace-nodes = false\n");
        System.setProperty(TRACE_PROPERTY, "true");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertThat(config.getBoolean(TRACE_PROPERTY)).isTrue();
    }

    @Test
    void load_shouldIgnoreADirectoryInPlaceOfTheFile(@TempDir Path dir) {
        Config config = ConfigLoader.load(dir.toFile());

        assertThat(config.getInt("nanoir.runtime.viewport.width")).isEqualTo(800);
    }

    @Test
    void runtimeOptions_shouldBeReadFromTheLoadedConfig(@TempDir Path dir) throws IOException {
        File file = writeConfig(dir, "nanoir.runtime { viewport { width = 64, height = 32 }, log-actions = false }\n");

        RuntimeOptions options = RuntimeOptions.fromConfig(ConfigLoader.load(file));

        assertThat(options).isEqualTo(new RuntimeOptions(64, 32, false, false));
        assertThat(RuntimeOptions.fromConfig(ConfigFactory.empty())).isEqualTo(RuntimeOptions.defaults());
    }

    @Test
    void runtimeOptions_loadShouldApplyEveryLayer(@TempDir Path dir) throws IOException {
        File file = writeConfig(dir, "nanoir.runtime.viewport.height = 90\n");
        System.setProperty(TRACE_PROPERTY, "true");
        ConfigFactory.invalidateCaches();

        RuntimeOptions options = RuntimeOptions.load(file);

        assertThat(options).isEqualTo(new RuntimeOptions(800, 90, true, true));
    }

    @Test
    void runtimeOptions_loadFromTheWorkingDirectoryShouldMatchTheLoader() {
        assertThat(RuntimeOptions.load()).isEqualTo(RuntimeOptions.fromConfig(ConfigLoader.load()));
    }

    @Test
    void runtimeOptions_shouldRejectAnEmptyViewport() {
        Config config = ConfigFactory.parseString("nanoir.runtime.viewport.width = 0");

        assertThatThrownBy(() -> RuntimeOptions.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0x600");
    }

    private static File writeConfig(Path dir, String content) throws IOException {
        Path file = dir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }
}
