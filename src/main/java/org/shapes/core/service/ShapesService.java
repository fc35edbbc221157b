package org.shapes.core.service;

import org.shapes.core.io.ShapesFileLoader;
import org.shapes.core.io.ShapesJsonEncoder;
import org.shapes.core.io.ShapesSerializer;
import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.config.ShapesSettings;
import org.shapes.core.parse.GrammarException;
import org.shapes.core.parse.ParseListener;
import org.shapes.core.parse.ParseOutcome;
import org.shapes.core.parse.ParsePipeline;
import org.shapes.core.parse.ShapesParseException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Граница ядра: то, чем пользуются редактор и CLI.
 * Модель не удерживается между вызовами: каждый разбор строит новый ShapesFile.
 */
public class ShapesService {

    private final ShapesSettings settings;
    private final ParsePipeline pipeline;

    public ShapesService(ShapesSettings settings, ParseListener listener) {
        this.settings = (settings != null) ? settings : new ShapesSettings();
        this.pipeline = new ParsePipeline(this.settings, listener);
    }

    public ShapesService() {
        this(new ShapesSettings(), ParseListener.NONE);
    }

    /**
     * repair -> строгий разбор -> (при отказе) эвристика.
     * При включённом запасном разборе не бросает исключений: результат эвристики, даже пустой,
     * возвращается со статусом.
     *
     * @throws ShapesParseException вида PARSE, только если запасной разбор выключен
     */
    public ParseOutcome parseShapesContent(String text) throws ShapesParseException {
        try {
            return pipeline.run(text);
        } catch (GrammarException e) {
            throw new ShapesParseException(ShapesParseException.Kind.PARSE, e.getMessage(), e);
        }
    }

    /**
     * @throws ShapesParseException вида IO, если файл не читается; вида PARSE - как у {@link #parseShapesContent}
     */
    public ParseOutcome parseShapesFile(Path path) throws ShapesParseException {
        String text;
        try {
            text = ShapesFileLoader.read(path);
        } catch (IOException e) {
            throw new ShapesParseException(ShapesParseException.Kind.IO, "Failed to read shapes file: " + path, e);
        }
        return parseShapesContent(text);
    }

    public String serializeShapesFile(ShapesFile file) {
        return ShapesSerializer.serialize(file, settings);
    }

    public void writeShapesFile(Path path, ShapesFile file) throws IOException {
        ShapesFileLoader.write(path, serializeShapesFile(file));
    }

    public String toJson(ShapesFile file) {
        return ShapesJsonEncoder.toJson(file);
    }

    public ShapesSettings getSettings() {
        return settings;
    }
}
