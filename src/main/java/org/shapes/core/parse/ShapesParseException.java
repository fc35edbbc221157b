package org.shapes.core.parse;

/**
 * Ошибка, которую видит потребитель: чтение файла (IO) или неудавшийся разбор (PARSE).
 */
public class ShapesParseException extends Exception {

    public enum Kind {
        IO,
        PARSE
    }

    private final Kind kind;

    public ShapesParseException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
