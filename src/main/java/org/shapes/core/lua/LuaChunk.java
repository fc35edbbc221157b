package org.shapes.core.lua;

import java.util.List;

/**
 * Результат разбора всего текста: присваивания верхнего уровня и выражение из return.
 * Для каждого присваивания хранится только первое выражение правой части.
 */
public record LuaChunk(List<Statement> statements, LuaExpr returned) {

    public record Statement(Kind kind, String target, LuaExpr value) {
        public enum Kind {
            ASSIGNMENT,
            LOCAL
        }
    }
}
