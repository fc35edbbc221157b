package org.shapes.core.io;

import org.shapes.core.model.CannonProperties;
import org.shapes.core.model.FragmentProperties;
import org.shapes.core.model.Port;
import org.shapes.core.model.Scale;
import org.shapes.core.model.Shape;
import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.ShroudComponent;
import org.shapes.core.model.ThrusterProperties;
import org.shapes.core.model.Vertex;
import org.shapes.core.model.config.ShapesSettings;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Каноническая запись shapes.lua.
 *
 * Формат одной формы:
 *     {id, --name
 *         {
 *             {
 *                 verts = { {x, y}, ... },
 *                 ports = { {edge, position[, TYPE]}, ... }
 *             }, --scale 1
 *             group = ..., features = "...", fillColor = 0x........, ...
 *         }
 *     },
 *
 * Порядок необязательных свойств фиксирован и не зависит от исходного текста:
 * group, features, fillColor, fillColor1, lineColor, durability, density, growRate,
 * launcher_radial, mirror_of, shroud, cannon (+fragment), thruster.
 * Ничего не проверяет: пишет то, что лежит в модели.
 */
public class ShapesSerializer {

    private static final String I1 = "    ";
    private static final String I2 = I1 + I1;
    private static final String I3 = I2 + I1;
    private static final String I4 = I3 + I1;
    private static final String I5 = I4 + I1;

    // explosive = FINAL|PROXIMITY пишется без кавычек, как в файлах игры
    private static final Pattern FLAG_SET = Pattern.compile("[A-Z_][A-Z0-9_]*(?:\\|[A-Z_][A-Z0-9_]*)*");

    public static String serialize(ShapesFile file) {
        return serialize(file, new ShapesSettings());
    }

    public static String serialize(ShapesFile file, ShapesSettings settings) {
        ShapesSettings cfg = (settings != null) ? settings : new ShapesSettings();
        StringBuilder sb = new StringBuilder("{\n");

        List<Shape> shapes = (file != null) ? file.shapes : List.of();
        for (int i = 0; i < shapes.size(); i++) {
            writeShape(sb, shapes.get(i), cfg);
            sb.append(i < shapes.size() - 1 ? "\n" + I1 + "},\n" : "\n" + I1 + "}\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    private static void writeShape(StringBuilder sb, Shape shape, ShapesSettings cfg) {
        sb.append(I1).append('{').append(shape.id).append(',');
        if (shape.name != null) {
            String name = shape.name.replaceAll("[\\r\\n]+", " ");
            // "--[" открыл бы блочный комментарий
            sb.append(name.startsWith("[") ? " -- " : " --").append(name);
        }
        sb.append('\n');

        sb.append(I2).append("{\n");

        for (int j = 0; j < shape.scales.size(); j++) {
            writeScale(sb, shape.scales.get(j), cfg);
            // запятая и после последнего масштаба: следом могут идти свойства
            sb.append('\n').append(I3).append("},");
            if (cfg.annotateScales) {
                sb.append(" --scale ").append(j + 1);
            }
            sb.append('\n');
        }

        writeProperties(sb, shape);

        sb.append(I2).append('}');
    }

    private static void writeScale(StringBuilder sb, Scale scale, ShapesSettings cfg) {
        sb.append(I3).append("{\n");

        sb.append(I4).append("verts = {");
        if (scale.verts.isEmpty()) {
            sb.append('}');
        } else {
            sb.append('\n');
            for (Vertex v : scale.verts) {
                sb.append(I5).append('{').append(fmt(v.x)).append(", ").append(fmt(v.y)).append("},\n");
            }
            sb.append(I4).append('}');
        }
        sb.append(",\n");

        sb.append(I4).append("ports = {");
        if (scale.ports.isEmpty()) {
            sb.append('}');
        } else {
            sb.append('\n');
            for (Port p : scale.ports) {
                sb.append(I5).append('{').append(p.edge).append(", ").append(fmt(p.position));
                if (p.isTyped()) {
                    sb.append(", ").append(p.portType.toToken()).append("},");
                    if (cfg.annotatePorts) {
                        sb.append("  -- Edge ").append(p.edge)
                                .append(", position ").append(fmt(p.position))
                                .append(", type ").append(p.portType.toToken());
                    }
                } else {
                    sb.append("},");
                }
                sb.append('\n');
            }
            sb.append(I4).append('}');
        }
    }

    private static void writeProperties(StringBuilder sb, Shape shape) {
        if (shape.group != null) {
            line(sb, I3, "group", String.valueOf(shape.group));
        }
        if (shape.features != null) {
            line(sb, I3, "features", quote(joinFeatures(shape.features)));
        }

        if (shape.fillColor != null) line(sb, I3, "fillColor", hex(shape.fillColor));
        if (shape.fillColor1 != null) line(sb, I3, "fillColor1", hex(shape.fillColor1));
        if (shape.lineColor != null) line(sb, I3, "lineColor", hex(shape.lineColor));

        if (!Double.isNaN(shape.durability)) line(sb, I3, "durability", fmt(shape.durability));
        if (!Double.isNaN(shape.density)) line(sb, I3, "density", fmt(shape.density));
        if (!Double.isNaN(shape.growRate)) line(sb, I3, "growRate", fmt(shape.growRate));

        if (shape.launcherRadial != null) {
            line(sb, I3, "launcher_radial", shape.launcherRadial ? "true" : "false");
        }
        if (shape.mirrorOf != null) {
            line(sb, I3, "mirror_of", String.valueOf(shape.mirrorOf));
        }

        if (shape.shroud != null) {
            sb.append(I3).append("shroud = {\n");
            for (ShroudComponent c : shape.shroud) {
                sb.append(I4)
                        .append("{size = {").append(fmt(c.sizeX)).append(", ").append(fmt(c.sizeY)).append('}')
                        .append(", offset = {").append(fmt(c.offsetX)).append(", ").append(fmt(c.offsetY))
                        .append(", ").append(fmt(c.offsetZ)).append('}')
                        .append(", taper = ").append(fmt(c.taper))
                        .append(", count = ").append(c.count)
                        .append(", angle = ").append(fmt(c.angle))
                        .append(", tri_color_id = ").append(c.triColorId)
                        .append(", tri_color1_id = ").append(c.triColor1Id)
                        .append(", line_color_id = ").append(c.lineColorId)
                        .append(", shape = ").append(c.shape)
                        .append("},\n");
            }
            sb.append(I3).append("},\n");
        }

        if (shape.cannon != null) {
            writeCannon(sb, shape.cannon);
        }
        if (shape.thruster != null) {
            writeThruster(sb, shape.thruster);
        }
    }

    private static void writeCannon(StringBuilder sb, CannonProperties c) {
        sb.append(I3).append("cannon = {\n");
        line(sb, I4, "damage", fmt(c.damage));
        line(sb, I4, "power", fmt(c.power));
        line(sb, I4, "roundsPerSec", fmt(c.roundsPerSec));
        line(sb, I4, "muzzleVel", fmt(c.muzzleVel));
        line(sb, I4, "range", fmt(c.range));
        line(sb, I4, "spread", fmt(c.spread));
        if (c.roundsPerBurst != null) line(sb, I4, "roundsPerBurst", String.valueOf(c.roundsPerBurst));
        if (!Double.isNaN(c.burstyness)) line(sb, I4, "burstyness", fmt(c.burstyness));
        if (c.color != null) line(sb, I4, "color", hex(c.color));
        if (c.explosive != null) {
            line(sb, I4, "explosive", FLAG_SET.matcher(c.explosive).matches() ? c.explosive : quote(c.explosive));
        }
        if (c.fragment != null) {
            writeFragment(sb, c.fragment);
        }
        sb.append(I3).append("},\n");
    }

    private static void writeFragment(StringBuilder sb, FragmentProperties f) {
        sb.append(I4).append("fragment = {\n");
        line(sb, I5, "roundsPerBurst", String.valueOf(f.roundsPerBurst));
        line(sb, I5, "muzzleVel", fmt(f.muzzleVel));
        line(sb, I5, "spread", fmt(f.spread));
        if (f.pattern != null) line(sb, I5, "pattern", quote(f.pattern));
        line(sb, I5, "damage", fmt(f.damage));
        line(sb, I5, "range", fmt(f.range));
        if (f.color != null) line(sb, I5, "color", hex(f.color));
        sb.append(I4).append("},\n");
    }

    private static void writeThruster(StringBuilder sb, ThrusterProperties t) {
        sb.append(I3).append("thruster = {\n");
        line(sb, I4, "force", fmt(t.force));
        line(sb, I4, "power", fmt(t.power));
        if (t.color != null) line(sb, I4, "color", hex(t.color));
        sb.append(I3).append("},\n");
    }

    private static void line(StringBuilder sb, String indent, String name, String value) {
        sb.append(indent).append(name).append(" = ").append(value).append(",\n");
    }

    // ------------------------------------------------------------------
    // Форматирование значений
    // ------------------------------------------------------------------

    /**
     * Кратчайшая десятичная запись без экспоненты: 5.0 -> "5", 0.25 -> "0.25", -0.0 -> "-0".
     * NaN и бесконечности пишутся как есть (грамматика их не прочитает).
     */
    static String fmt(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return Double.toString(v);
        }
        if (v == 0.0) {
            return (Double.doubleToRawLongBits(v) < 0) ? "-0" : "0";
        }
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    /** Всегда 8 hex-цифр: 0x113077 -> "0x00113077", -1 -> "0xffffffff". */
    static String hex(int color) {
        return String.format(Locale.ROOT, "0x%08x", color);
    }

    /** Через '|', без пустых элементов и краевых пробелов: так же их читает парсер. */
    static String joinFeatures(List<String> features) {
        StringBuilder out = new StringBuilder();
        for (String f : features) {
            String trimmed = (f != null) ? f.trim() : "";
            if (trimmed.isEmpty()) continue;
            if (out.length() > 0) out.append('|');
            out.append(trimmed);
        }
        return out.toString();
    }

    static String quote(String s) {
        return '"' + s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r") + '"';
    }
}
