package org.shapes.core.model.config;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class ShapesSettingsTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @After
    public void clearProperties() {
        System.clearProperty("shapes.fallback");
        System.clearProperty("shapes.annotatePorts");
        System.clearProperty("shapes.config.path");
    }

    @Test
    public void defaults() {
        ShapesSettings settings = new ShapesSettings();
        assertTrue(settings.repairEnabled);
        assertTrue(settings.fallbackEnabled);
        assertFalse(settings.annotatePorts);
        assertTrue(settings.annotateScales);
        assertFalse(settings.verbose);
    }

    @Test
    public void systemPropertiesOverrideFields() {
        System.setProperty("shapes.fallback", "false");
        System.setProperty("shapes.annotatePorts", " YES ");

        ShapesSettings settings = new ShapesSettings();
        settings.applyOverridesFromSystem();

        assertFalse(settings.fallbackEnabled);
        assertTrue(settings.annotatePorts);
    }

    @Test
    public void unrecognisedFlagKeepsCurrentValue() {
        assertTrue(ShapesSettings.parseFlag("maybe", true));
        assertFalse(ShapesSettings.parseFlag(null, false));
        assertTrue(ShapesSettings.parseFlag("On", false));
        assertFalse(ShapesSettings.parseFlag("0", true));
    }

    @Test
    public void localPropertiesFileIsApplied() throws Exception {
        Path file = tmp.newFile("shapes.local.properties").toPath();
        Files.write(file, "shapes.repair=false\nshapes.annotateScales=off\n".getBytes(StandardCharsets.UTF_8));

        ShapesSettings settings = new ShapesSettings();
        LocalSettingsLoader.apply(settings, file);

        assertFalse(settings.repairEnabled);
        assertFalse(settings.annotateScales);
        assertTrue(settings.fallbackEnabled);
    }

    @Test
    public void configPathCanBeRedirected() throws Exception {
        Path file = tmp.newFile("custom.properties").toPath();
        Files.write(file, "shapes.verbose=true\n".getBytes(StandardCharsets.UTF_8));
        System.setProperty("shapes.config.path", file.toString());

        assertEquals(file, LocalSettingsLoader.resolvePath());
        ShapesSettings settings = new ShapesSettings();
        LocalSettingsLoader.apply(settings);
        assertTrue(settings.verbose);
    }

    @Test
    public void missingLocalFileChangesNothing() {
        ShapesSettings settings = new ShapesSettings();
        LocalSettingsLoader.apply(settings, tmp.getRoot().toPath().resolve("absent.properties"));
        assertTrue(settings.repairEnabled);
        assertTrue(settings.annotateScales);
    }
}
