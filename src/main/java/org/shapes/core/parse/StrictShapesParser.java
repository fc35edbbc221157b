package org.shapes.core.parse;

import org.shapes.core.lua.LuaChunk;
import org.shapes.core.lua.LuaExpr;
import org.shapes.core.lua.LuaSyntaxException;
import org.shapes.core.lua.LuaTableParser;
import org.shapes.core.lua.TableField;
import org.shapes.core.model.CannonProperties;
import org.shapes.core.model.FragmentProperties;
import org.shapes.core.model.Port;
import org.shapes.core.model.PortType;
import org.shapes.core.model.Scale;
import org.shapes.core.model.Shape;
import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.ShroudComponent;
import org.shapes.core.model.ThrusterProperties;
import org.shapes.core.model.Vertex;

import java.util.ArrayList;
import java.util.List;

/**
 * Строгий разбор: текст читается как выражение-таблица, затем дерево обходится
 * по позициям и по именам полей.
 *
 * Форма: {id, {scale, scale, ..., name = value, ...}, name = value, ...}
 * - первое безымянное поле - числовой id (без него форма молча отбрасывается);
 * - второе безымянное поле - блок свойств: безымянные таблицы в нём - масштабы
 *   (verts/ports), именованные - расширенные свойства;
 * - именованные поля на уровне формы - тоже расширенные свойства.
 * Неизвестные имена и значения неподходящего вида игнорируются без ошибки.
 */
public class StrictShapesParser implements ParseStrategy {

    @Override
    public StrategyId id() {
        return StrategyId.STRICT;
    }

    @Override
    public String name() {
        return "Table grammar";
    }

    @Override
    public ShapesFile parse(String text) throws GrammarException {
        LuaChunk chunk = parseChunk(text);
        LuaExpr.TableCtor table = locateShapesTable(chunk);
        if (table == null) {
            throw new GrammarException("No shapes table found");
        }

        ShapesFile file = new ShapesFile();
        for (TableField field : table.fields()) {
            if (field.kind() != TableField.Kind.POSITIONAL) continue;
            LuaExpr.TableCtor shapeTable = asTable(field.value());
            if (shapeTable != null) {
                Shape shape = extractShape(shapeTable);
                if (shape != null) {
                    file.shapes.add(shape);
                }
            }
        }

        if (file.shapes.isEmpty()) {
            throw new GrammarException("Shapes table contains no shapes");
        }
        return file;
    }

    /**
     * Сначала текст оборачивается в "return ...", как голая таблица. Если так не разбирается,
     * пробуем текст как есть (присваивание shapes = {...} или собственный return).
     */
    private static LuaChunk parseChunk(String text) throws GrammarException {
        try {
            return LuaTableParser.parseChunk("return " + text);
        } catch (LuaSyntaxException wrapped) {
            try {
                return LuaTableParser.parseChunk(text);
            } catch (LuaSyntaxException plain) {
                throw new GrammarException("Failed to parse: " + wrapped.getMessage(), wrapped);
            }
        }
    }

    static LuaExpr.TableCtor locateShapesTable(LuaChunk chunk) {
        LuaExpr.TableCtor returned = asTable(chunk.returned());
        if (returned != null) {
            return returned;
        }
        for (LuaChunk.Statement st : chunk.statements()) {
            if (st.kind() == LuaChunk.Statement.Kind.ASSIGNMENT && asTable(st.value()) != null) {
                return asTable(st.value());
            }
        }
        for (LuaChunk.Statement st : chunk.statements()) {
            if (st.kind() == LuaChunk.Statement.Kind.LOCAL && asTable(st.value()) != null) {
                return asTable(st.value());
            }
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Форма
    // ------------------------------------------------------------------

    private static Shape extractShape(LuaExpr.TableCtor table) {
        Shape shape = null;
        int positional = 0;
        List<TableField> named = new ArrayList<>();

        for (TableField field : table.fields()) {
            switch (field.kind()) {
                case POSITIONAL -> {
                    if (positional == 0) {
                        Integer id = unsignedInt(field.value());
                        if (id == null) {
                            return null;
                        }
                        shape = new Shape(id, nameFrom(field.comment()));
                    } else if (positional == 1) {
                        LuaExpr.TableCtor block = asTable(field.value());
                        if (block != null) {
                            readPropertiesBlock(shape, block);
                        }
                    } else if (isIdentifier(field.value(), "launcher_radial")) {
                        shape.launcherRadial = Boolean.TRUE;
                    }
                    positional++;
                }
                case NAMED -> named.add(field);
                default -> {
                    // [key] = value на уровне формы не используется
                }
            }
        }

        if (shape == null) {
            return null;
        }
        // поля уровня формы перекрывают одноимённые из блока свойств
        for (TableField field : named) {
            applyProperty(shape, field.name(), field.value());
        }
        return shape;
    }

    private static String nameFrom(String comment) {
        if (comment == null) return null;
        String trimmed = comment.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static void readPropertiesBlock(Shape shape, LuaExpr.TableCtor block) {
        for (TableField field : block.fields()) {
            if (field.kind() == TableField.Kind.POSITIONAL) {
                LuaExpr.TableCtor scaleTable = asTable(field.value());
                if (scaleTable != null) {
                    shape.scales.add(readScale(scaleTable));
                } else if (isIdentifier(field.value(), "launcher_radial")) {
                    shape.launcherRadial = Boolean.TRUE;
                }
            } else if (field.kind() == TableField.Kind.NAMED) {
                applyProperty(shape, field.name(), field.value());
            }
        }
    }

    private static Scale readScale(LuaExpr.TableCtor table) {
        Scale scale = new Scale();

        LuaExpr.TableCtor vertsTable = asTable(namedValue(table, "verts"));
        if (vertsTable != null) {
            for (LuaExpr item : vertsTable.positional()) {
                Vertex v = readVertex(item);
                if (v != null) scale.verts.add(v);
            }
        }

        LuaExpr.TableCtor portsTable = asTable(namedValue(table, "ports"));
        if (portsTable != null) {
            for (LuaExpr item : portsTable.positional()) {
                Port p = readPort(item);
                if (p != null) scale.ports.add(p);
            }
        }
        return scale;
    }

    private static Vertex readVertex(LuaExpr item) {
        LuaExpr.TableCtor t = asTable(item);
        if (t == null) return null;
        List<LuaExpr> coords = t.positional();
        if (coords.size() != 2) return null;
        Double x = number(coords.get(0));
        Double y = number(coords.get(1));
        if (x == null || y == null) return null;
        return new Vertex(x, y);
    }

    private static Port readPort(LuaExpr item) {
        LuaExpr.TableCtor t = asTable(item);
        if (t == null) return null;
        List<LuaExpr> parts = t.positional();
        if (parts.size() < 2 || parts.size() > 3) return null;
        Integer edge = unsignedInt(parts.get(0));
        Double position = number(parts.get(1));
        if (edge == null || position == null) return null;

        PortType type = PortType.DEFAULT;
        if (parts.size() == 3) {
            type = PortType.fromToken(text(parts.get(2)));
        }
        return new Port(edge, position, type);
    }

    // ------------------------------------------------------------------
    // Расширенные свойства
    // ------------------------------------------------------------------

    private static void applyProperty(Shape shape, String name, LuaExpr value) {
        switch (name) {
            case "launcher_radial" -> shape.launcherRadial =
                    !isIdentifier(value, "false");
            case "mirror_of" -> shape.mirrorOf = pick(integer(value), shape.mirrorOf);
            case "group" -> shape.group = pick(integer(value), shape.group);
            case "features" -> shape.features = pick(features(value), shape.features);
            case "fillColor" -> shape.fillColor = pick(color(value), shape.fillColor);
            case "fillColor1" -> shape.fillColor1 = pick(color(value), shape.fillColor1);
            case "lineColor" -> shape.lineColor = pick(color(value), shape.lineColor);
            case "durability" -> shape.durability = orNaN(number(value), shape.durability);
            case "density" -> shape.density = orNaN(number(value), shape.density);
            case "growRate" -> shape.growRate = orNaN(number(value), shape.growRate);
            case "shroud" -> shape.shroud = pick(shroud(value), shape.shroud);
            case "cannon" -> shape.cannon = pick(cannon(value), shape.cannon);
            case "thruster" -> shape.thruster = pick(thruster(value), shape.thruster);
            default -> {
                // неизвестное свойство - пропускаем
            }
        }
    }

    private static List<String> features(LuaExpr value) {
        List<String> out = new ArrayList<>();
        LuaExpr.TableCtor t = asTable(value);
        if (t != null) {
            for (LuaExpr item : t.positional()) {
                String s = text(item);
                if (s != null) splitFlags(s, out);
            }
            return out;
        }
        String s = text(value);
        if (s == null) return null;
        splitFlags(s, out);
        return out;
    }

    private static void splitFlags(String s, List<String> out) {
        for (String part : s.split("\\|")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) out.add(trimmed);
        }
    }

    private static List<ShroudComponent> shroud(LuaExpr value) {
        LuaExpr.TableCtor t = asTable(value);
        if (t == null) return null;
        List<ShroudComponent> out = new ArrayList<>();
        for (LuaExpr item : t.positional()) {
            LuaExpr.TableCtor c = asTable(item);
            if (c == null) continue;
            ShroudComponent sc = new ShroudComponent();
            double[] size = tuple(c, "size", 2);
            sc.sizeX = size[0];
            sc.sizeY = size[1];
            double[] offset = tuple(c, "offset", 3);
            sc.offsetX = offset[0];
            sc.offsetY = offset[1];
            sc.offsetZ = offset[2];
            sc.taper = namedNumber(c, "taper", 0.0);
            sc.count = (int) namedNumber(c, "count", 0.0);
            sc.angle = namedNumber(c, "angle", 0.0);
            sc.triColorId = (int) namedNumber(c, "tri_color_id", 0.0);
            sc.triColor1Id = (int) namedNumber(c, "tri_color1_id", 0.0);
            sc.lineColorId = (int) namedNumber(c, "line_color_id", 0.0);
            sc.shape = (int) namedNumber(c, "shape", 0.0);
            out.add(sc);
        }
        return out;
    }

    private static CannonProperties cannon(LuaExpr value) {
        LuaExpr.TableCtor t = asTable(value);
        if (t == null) return null;
        CannonProperties c = new CannonProperties();
        c.damage = namedNumber(t, "damage", 0.0);
        c.power = namedNumber(t, "power", 0.0);
        c.roundsPerSec = namedNumber(t, "roundsPerSec", 0.0);
        c.muzzleVel = namedNumber(t, "muzzleVel", 0.0);
        c.range = namedNumber(t, "range", 0.0);
        c.spread = namedNumber(t, "spread", 0.0);
        c.roundsPerBurst = integer(namedValue(t, "roundsPerBurst"));
        c.burstyness = namedNumber(t, "burstyness", Double.NaN);
        c.color = color(namedValue(t, "color"));
        c.explosive = text(namedValue(t, "explosive"));
        c.fragment = fragment(namedValue(t, "fragment"));
        return c;
    }

    private static FragmentProperties fragment(LuaExpr value) {
        LuaExpr.TableCtor t = asTable(value);
        if (t == null) return null;
        FragmentProperties f = new FragmentProperties();
        f.roundsPerBurst = (int) namedNumber(t, "roundsPerBurst", 0.0);
        f.muzzleVel = namedNumber(t, "muzzleVel", 0.0);
        f.spread = namedNumber(t, "spread", 0.0);
        f.pattern = text(namedValue(t, "pattern"));
        f.damage = namedNumber(t, "damage", 0.0);
        f.range = namedNumber(t, "range", 0.0);
        f.color = color(namedValue(t, "color"));
        return f;
    }

    private static ThrusterProperties thruster(LuaExpr value) {
        LuaExpr.TableCtor t = asTable(value);
        if (t == null) return null;
        ThrusterProperties th = new ThrusterProperties();
        th.force = namedNumber(t, "force", 0.0);
        th.power = namedNumber(t, "power", 0.0);
        th.color = color(namedValue(t, "color"));
        return th;
    }

    // ------------------------------------------------------------------
    // Значения
    // ------------------------------------------------------------------

    /** Число или число с унарным минусом (в т.ч. вложенным); иначе null. */
    private static final LuaExpr.Visitor<Double> NUMBER = new LuaExpr.Visitor<>() {
        @Override
        public Double visitNumber(LuaExpr.NumberLit number) {
            return number.value();
        }

        @Override
        public Double visitUnaryMinus(LuaExpr.UnaryMinus unary) {
            Double inner = unary.operand().accept(this);
            return (inner != null) ? -inner : null;
        }

        @Override
        public Double visitTable(LuaExpr.TableCtor table) {
            return null;
        }

        @Override
        public Double visitIdentifier(LuaExpr.Identifier identifier) {
            return null;
        }

        @Override
        public Double visitString(LuaExpr.StringLit string) {
            return null;
        }
    };

    /** Текст идентификатора или строки; иначе null. */
    private static final LuaExpr.Visitor<String> TEXT = new LuaExpr.Visitor<>() {
        @Override
        public String visitNumber(LuaExpr.NumberLit number) {
            return null;
        }

        @Override
        public String visitUnaryMinus(LuaExpr.UnaryMinus unary) {
            return null;
        }

        @Override
        public String visitTable(LuaExpr.TableCtor table) {
            return null;
        }

        @Override
        public String visitIdentifier(LuaExpr.Identifier identifier) {
            return identifier.name();
        }

        @Override
        public String visitString(LuaExpr.StringLit string) {
            return string.value();
        }
    };

    private static Double number(LuaExpr e) {
        return (e != null) ? e.accept(NUMBER) : null;
    }

    private static String text(LuaExpr e) {
        return (e != null) ? e.accept(TEXT) : null;
    }

    private static Integer integer(LuaExpr e) {
        Double v = number(e);
        if (v == null || v != Math.rint(v) || v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) return null;
        return v.intValue();
    }

    /** Только литерал без минуса: id формы и индекс ребра. */
    private static Integer unsignedInt(LuaExpr e) {
        if (!(e instanceof LuaExpr.NumberLit)) return null;
        LuaExpr.NumberLit n = (LuaExpr.NumberLit) e;
        double v = n.value();
        if (!n.isIntegral() || v < 0 || v > Integer.MAX_VALUE) return null;
        return (int) v;
    }

    /** Цвет 0xAARRGGBB: значения выше 0x7fffffff переносятся в отрицательные int. */
    private static Integer color(LuaExpr e) {
        Double v = number(e);
        if (v == null || v != Math.rint(v) || v < Integer.MIN_VALUE || v > 0xFFFFFFFFL) return null;
        return (int) v.longValue();
    }

    private static LuaExpr.TableCtor asTable(LuaExpr e) {
        return (e instanceof LuaExpr.TableCtor) ? (LuaExpr.TableCtor) e : null;
    }

    private static boolean isIdentifier(LuaExpr e, String name) {
        return (e instanceof LuaExpr.Identifier) && name.equals(((LuaExpr.Identifier) e).name());
    }

    private static LuaExpr namedValue(LuaExpr.TableCtor t, String name) {
        TableField f = t.named(name);
        return (f != null) ? f.value() : null;
    }

    private static double namedNumber(LuaExpr.TableCtor t, String name, double fallback) {
        Double v = number(namedValue(t, name));
        return (v != null) ? v : fallback;
    }

    private static double[] tuple(LuaExpr.TableCtor t, String name, int arity) {
        double[] out = new double[arity];
        LuaExpr.TableCtor tupleTable = asTable(namedValue(t, name));
        if (tupleTable != null) {
            List<LuaExpr> items = tupleTable.positional();
            for (int i = 0; i < arity && i < items.size(); i++) {
                Double v = number(items.get(i));
                if (v != null) out[i] = v;
            }
        }
        return out;
    }

    private static <T> T pick(T candidate, T fallback) {
        return (candidate != null) ? candidate : fallback;
    }

    private static double orNaN(Double candidate, double fallback) {
        return (candidate != null) ? candidate : fallback;
    }
}
