package org.shapes.core.parse;

public interface ParseListener {

    ParseListener NONE = new ParseListener() {
        @Override
        public void onStrategyStart(StrategyId id, String name) {
        }

        @Override
        public void onStrategyEnd(StrategyId id, String name, int shapeCount, long elapsedMs) {
        }

        @Override
        public void onStrategyFailed(StrategyId id, String name, String message) {
        }

        @Override
        public void onStrategySkip(StrategyId id, String name) {
        }
    };

    void onStrategyStart(StrategyId id, String name);
    void onStrategyEnd(StrategyId id, String name, int shapeCount, long elapsedMs);
    void onStrategyFailed(StrategyId id, String name, String message);
    void onStrategySkip(StrategyId id, String name);
}
