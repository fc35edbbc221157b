package org.shapes.core.parse;

/**
 * Отказ грамматического разбора: синтаксическая ошибка, не найдена таблица форм
 * или в таблице не оказалось ни одной формы. Наружу из {@link ParsePipeline}
 * выходит только при выключенном запасном разборе.
 */
public class GrammarException extends Exception {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
