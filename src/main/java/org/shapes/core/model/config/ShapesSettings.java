package org.shapes.core.model.config;

import java.util.Locale;

public class ShapesSettings {

    // --- Разбор ---
    public boolean repairEnabled = true;
    public boolean fallbackEnabled = true;   // LEGACY после отказа STRICT

    // --- Вывод ---
    public boolean annotatePorts = false;    // "-- Edge e, position p, type T" у типизированных портов
    public boolean annotateScales = true;    // "--scale N" после каждого масштаба

    public boolean verbose = false;

    public void applyOverridesFromSystem() {
        repairEnabled = parseFlag(pick(
                System.getProperty("shapes.repair"),
                System.getenv("SHAPES_REPAIR")
        ), repairEnabled);
        fallbackEnabled = parseFlag(pick(
                System.getProperty("shapes.fallback"),
                System.getenv("SHAPES_FALLBACK")
        ), fallbackEnabled);
        annotatePorts = parseFlag(pick(
                System.getProperty("shapes.annotatePorts"),
                System.getenv("SHAPES_ANNOTATE_PORTS")
        ), annotatePorts);
        annotateScales = parseFlag(pick(
                System.getProperty("shapes.annotateScales"),
                System.getenv("SHAPES_ANNOTATE_SCALES")
        ), annotateScales);
        verbose = parseFlag(pick(
                System.getProperty("shapes.verbose"),
                System.getenv("SHAPES_VERBOSE")
        ), verbose);
    }

    /**
     * true/yes/on/1 и false/no/off/0 без учёта регистра; всё остальное (и null) оставляет fallback.
     */
    static boolean parseFlag(String value, boolean fallback) {
        if (value == null) return fallback;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> {
                return true;
            }
            case "false", "no", "off", "0" -> {
                return false;
            }
            default -> {
                return fallback;
            }
        }
    }

    static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value != null) {
                String trimmed = value.trim();
                if (!trimmed.isEmpty()) {
                    return trimmed;
                }
            }
        }
        return null;
    }
}
