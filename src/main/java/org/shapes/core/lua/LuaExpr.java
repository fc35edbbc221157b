package org.shapes.core.lua;

import java.util.ArrayList;
import java.util.List;

/**
 * Узел дерева выражений для подмножества Lua, которое встречается в файлах shapes.lua:
 * числа, унарный минус, конструкторы таблиц, идентификаторы (true/false/nil, PortType-токены)
 * и строки. Набор закрыт; обход делается через {@link Visitor}, поэтому добавление
 * нового вида узла ломает компиляцию всех обходчиков, а не молча пропускается.
 */
public sealed interface LuaExpr
        permits LuaExpr.NumberLit, LuaExpr.UnaryMinus, LuaExpr.TableCtor, LuaExpr.Identifier, LuaExpr.StringLit {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitNumber(NumberLit number);

        R visitUnaryMinus(UnaryMinus unary);

        R visitTable(TableCtor table);

        R visitIdentifier(Identifier identifier);

        R visitString(StringLit string);
    }

    /** text - как в исходнике ("0x00113077", "1.5e3"), value - разобранное значение. */
    record NumberLit(String text, double value) implements LuaExpr {
        public boolean isIntegral() {
            return value == Math.rint(value) && !Double.isInfinite(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record UnaryMinus(LuaExpr operand) implements LuaExpr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryMinus(this);
        }
    }

    record TableCtor(List<TableField> fields, int line) implements LuaExpr {

        /** Значения безымянных полей в порядке появления. */
        public List<LuaExpr> positional() {
            List<LuaExpr> out = new ArrayList<>();
            for (TableField f : fields) {
                if (f.kind() == TableField.Kind.POSITIONAL) out.add(f.value());
            }
            return out;
        }

        /** Первое поле вида name = value, либо null. */
        public TableField named(String name) {
            for (TableField f : fields) {
                if (f.kind() == TableField.Kind.NAMED && f.name().equals(name)) return f;
            }
            return null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTable(this);
        }
    }

    /** Голый идентификатор: true, false, nil, THRUSTER_OUT, a.b */
    record Identifier(String name) implements LuaExpr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    record StringLit(String value) implements LuaExpr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }
}
