package org.shapes.core.parse;

import java.io.PrintStream;

public class ConsoleParseListener implements ParseListener {

    private final PrintStream out;
    private final PrintStream err;

    public ConsoleParseListener() {
        this(System.out, System.err);
    }

    public ConsoleParseListener(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void onStrategyStart(StrategyId id, String name) {
        out.println("[PARSE START] " + id + " - " + name);
    }

    @Override
    public void onStrategyEnd(StrategyId id, String name, int shapeCount, long elapsedMs) {
        out.println("[PARSE END]   " + id + " - " + name + " shapes=" + shapeCount + " (" + elapsedMs + " ms)");
    }

    @Override
    public void onStrategyFailed(StrategyId id, String name, String message) {
        err.println("[PARSE FAIL]  " + id + " - " + name + ": " + message);
    }

    @Override
    public void onStrategySkip(StrategyId id, String name) {
        out.println("[PARSE SKIP]  " + id + " - " + name);
    }
}
