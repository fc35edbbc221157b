package org.shapes.core.parse;

import org.shapes.core.model.ShapesFile;

public interface ParseStrategy {
    StrategyId id();
    String name();
    ShapesFile parse(String text) throws GrammarException;
}
