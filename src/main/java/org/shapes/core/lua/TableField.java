package org.shapes.core.lua;

/**
 * Поле конструктора таблицы.
 *
 * comment - текст комментария "--", стоящего на той же строке после значения
 * или после разделителя поля (без "--", обрезанный); null, если его нет.
 */
public record TableField(Kind kind, String name, LuaExpr key, LuaExpr value, String comment) {

    public enum Kind {
        /** value */
        POSITIONAL,
        /** name = value */
        NAMED,
        /** [key] = value */
        KEYED
    }

    public static TableField positional(LuaExpr value, String comment) {
        return new TableField(Kind.POSITIONAL, null, null, value, comment);
    }

    public static TableField named(String name, LuaExpr value, String comment) {
        return new TableField(Kind.NAMED, name, null, value, comment);
    }

    public static TableField keyed(LuaExpr key, LuaExpr value, String comment) {
        return new TableField(Kind.KEYED, null, key, value, comment);
    }
}
