package org.nanoir.runtime;

import com.typesafe.config.Config;
import org.nanoir.config.ConfigLoader;

import java.io.File;

/**
 * Interpreter settings from the {@code nanoir.runtime} configuration block.
 *
 * @param viewportWidth  Width used for {@code viewport}-sized resources.
 * @param viewportHeight Height used for {@code viewport}-sized resources.
 * @param logActions     Emit side-effect actions at DEBUG level.
 * @param traceNodes     Log every executed node at DEBUG level.
 */
public record RuntimeOptions(int viewportWidth, int viewportHeight, boolean logActions, boolean traceNodes) {

    public RuntimeOptions {
        if (viewportWidth <= 0 || viewportHeight <= 0) {
            throw new IllegalArgumentException("Viewport dimensions must be positive: " + viewportWidth + "x" + viewportHeight);
        }
    }

    public static RuntimeOptions defaults() {
        return new RuntimeOptions(800, 600, true, false);
    }

    /**
     * Loads the layered configuration from the working directory and reads the options.
     *
     * @return The options.
     * @see ConfigLoader#load()
     */
    public static RuntimeOptions load() {
        return fromConfig(ConfigLoader.load());
    }

    public static RuntimeOptions load(File configFile) {
        return fromConfig(ConfigLoader.load(configFile));
    }

    /**
     * Reads the options from a loaded configuration.
     *
     * @param config The root configuration.
     * @return The options; missing keys keep their defaults.
     */
    public static RuntimeOptions fromConfig(Config config) {
        RuntimeOptions d = defaults();
        Config runtime = config.hasPath("nanoir.runtime") ? config.getConfig("nanoir.runtime") : null;
        if (runtime == null) {
            return d;
        }
        return new RuntimeOptions(
                runtime.hasPath("viewport.width") ? runtime.getInt("viewport.width") : d.viewportWidth(),
                runtime.hasPath("viewport.height") ? runtime.getInt("viewport.height") : d.viewportHeight(),
                runtime.hasPath("log-actions") ? runtime.getBoolean("log-actions") : d.logActions(),
                runtime.hasPath("trace-nodes") ? runtime.getBoolean("trace-nodes") : d.traceNodes());
    }

    public RuntimeOptions withViewport(int width, int height) {
        return new RuntimeOptions(width, height, logActions, traceNodes);
    }
}
