package org.maze.core.io;

import org.maze.core.model.config.MazeSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Overlays maze dimensions and algorithm from a local properties file.
 * Only the application layer calls this; the seed is never read from here.
 */
public final class LocalMazeConfigLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "maze.local.properties");

    private LocalMazeConfigLoader() {
    }

    public static void apply(MazeSettings settings) {
        apply(settings, resolvePath());
    }

    public static void apply(MazeSettings settings, Path path) {
        if (!Files.exists(path)) {
            return;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read local maze config: " + path.toAbsolutePath(), e);
        }

        settings.rows = pickInt(props, "maze.rows", settings.rows);
        settings.columns = pickInt(props, "maze.columns", settings.columns);
        String algorithm = pick(props.getProperty("maze.algorithm"));
        if (algorithm != null) {
            settings.algorithm = algorithm;
        }
    }

    static Path resolvePath() {
        String override = pick(
                System.getProperty("maze.config.path"),
                System.getenv("MAZE_CONFIG_PATH")
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }

    private static int pickInt(Properties props, String key, int fallback) {
        String value = pick(props.getProperty(key));
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Bad integer for " + key + ": " + value, e);
        }
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}
