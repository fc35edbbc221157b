package org.shapes.core.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Чтение и запись текста shapes.lua целиком (UTF-8). BOM в начале файла отбрасывается.
 */
public final class ShapesFileLoader {

    private static final char BOM = '\uFEFF';

    private ShapesFileLoader() {
    }

    public static String read(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            return text.substring(1);
        }
        return text;
    }

    public static void write(Path path, String text) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, text, StandardCharsets.UTF_8);
    }
}
