package org.shapes.core.model.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

public final class LocalSettingsLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "shapes.local.properties");

    private LocalSettingsLoader() {
    }

    public static void apply(ShapesSettings settings) {
        apply(settings, resolvePath());
    }

    /** Файла может не быть - тогда настройки не меняются. */
    public static void apply(ShapesSettings settings, Path path) {
        if (!Files.exists(path)) {
            return;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read local shapes config: " + path.toAbsolutePath(), e);
        }

        settings.repairEnabled = ShapesSettings.parseFlag(props.getProperty("shapes.repair"), settings.repairEnabled);
        settings.fallbackEnabled = ShapesSettings.parseFlag(props.getProperty("shapes.fallback"), settings.fallbackEnabled);
        settings.annotatePorts = ShapesSettings.parseFlag(props.getProperty("shapes.annotatePorts"), settings.annotatePorts);
        settings.annotateScales = ShapesSettings.parseFlag(props.getProperty("shapes.annotateScales"), settings.annotateScales);
        settings.verbose = ShapesSettings.parseFlag(props.getProperty("shapes.verbose"), settings.verbose);
    }

    static Path resolvePath() {
        String override = ShapesSettings.pick(
                System.getProperty("shapes.config.path"),
                System.getenv("SHAPES_CONFIG_PATH")
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }
}
