package org.shapes.core.parse;

import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.config.ShapesSettings;

import java.util.ArrayList;
import java.util.List;

public class ParsePipeline {

    private final List<ParseStrategy> strategies = new ArrayList<>();
    private final ShapesSettings settings;
    private final ParseListener listener;

    /**
     * Полный конструктор.
     */
    public ParsePipeline(ShapesSettings settings, ParseListener listener) {
        this.settings = (settings != null) ? settings : new ShapesSettings();
        this.listener = (listener != null) ? listener : ParseListener.NONE;

        // Фиксируем порядок стратегий: грамматика, затем построчный сканер
        strategies.add(new StrictShapesParser());
        strategies.add(new LegacyShapesParser());
    }

    /**
     * Настройки по умолчанию, без вывода.
     */
    public ParsePipeline() {
        this(new ShapesSettings(), ParseListener.NONE);
    }

    /**
     * repair -> STRICT -> (отказ или ноль форм) LEGACY.
     *
     * @throws GrammarException только если запасной разбор выключен и строгий не удался
     */
    public ParseOutcome run(String text) throws GrammarException {
        String source = (text != null) ? text : "";
        String prepared = settings.repairEnabled ? InputRepair.repair(source) : source;

        GrammarException strictFailure = null;

        for (ParseStrategy strategy : strategies) {
            if (!isEnabled(strategy.id())) {
                listener.onStrategySkip(strategy.id(), strategy.name());
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStrategyStart(strategy.id(), strategy.name());

            ShapesFile file;
            try {
                file = strategy.parse(prepared);
            } catch (GrammarException e) {
                listener.onStrategyFailed(strategy.id(), strategy.name(), e.getMessage());
                strictFailure = e;
                continue;
            }

            long elapsed = System.currentTimeMillis() - start;
            listener.onStrategyEnd(strategy.id(), strategy.name(), file.shapes.size(), elapsed);

            return switch (strategy.id()) {
                case STRICT -> ParseOutcome.parsed(file);
                case LEGACY -> ParseOutcome.recovered(file, source,
                        (strictFailure != null) ? strictFailure.getMessage() : null);
            };
        }

        if (strictFailure != null) {
            throw strictFailure;
        }
        throw new GrammarException("No parse strategy is enabled");
    }

    private boolean isEnabled(StrategyId id) {
        return switch (id) {
            case STRICT -> true;
            case LEGACY -> settings.fallbackEnabled;
        };
    }
}
