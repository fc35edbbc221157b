package org.shapes.core.lua;

/**
 * Синтаксическая ошибка в тексте таблицы. Сообщение уже содержит строку и позицию.
 */
public class LuaSyntaxException extends Exception {

    private final int line;
    private final int column;

    public LuaSyntaxException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
