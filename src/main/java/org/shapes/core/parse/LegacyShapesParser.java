package org.shapes.core.parse;

import org.shapes.core.model.Port;
import org.shapes.core.model.PortType;
import org.shapes.core.model.Scale;
import org.shapes.core.model.Shape;
import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.Vertex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Запасной построчный сканер для текста, который не разобрался грамматикой.
 *
 * Восстанавливает только id, масштабы (verts + ports) и флаг launcher_radial.
 * Имя формы, цвета, cannon, thruster, shroud и прочие свойства НЕ восстанавливаются.
 * Строки с нечитаемым id, вершины и порты неверного вида молча отбрасываются.
 * Никогда не падает: текст без форм даёт пустой ShapesFile.
 */
public class LegacyShapesParser implements ParseStrategy {

    private static final Pattern TUPLE = Pattern.compile("\\{([^{}]*)\\}");
    // не больше 9 цифр, чтобы значение гарантированно влезало в int
    private static final Pattern UNSIGNED = Pattern.compile("\\d{1,9}");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");

    private enum Mode {
        NONE,
        VERTS,
        PORTS
    }

    @Override
    public StrategyId id() {
        return StrategyId.LEGACY;
    }

    @Override
    public String name() {
        return "Line scanner";
    }

    @Override
    public ShapesFile parse(String text) {
        ShapesFile file = new ShapesFile();
        if (text == null) return file;

        String[] lines = text.split("\\r?\\n", -1);
        int i = 0;
        while (i < lines.length) {
            String line = lines[i].trim();

            if (line.isEmpty() || line.startsWith("--")) {
                i++;
                continue;
            }

            if (line.startsWith("{")) {
                String code = stripComment(line);
                Integer id = shapeId(code);
                if (id != null) {
                    Shape shape = new Shape(id);
                    i = readShape(shape, code, lines, i + 1);
                    file.shapes.add(shape);
                    continue;
                }
            }
            i++;
        }
        return file;
    }

    /**
     * Читает тело формы до возврата глубины скобок к нулю.
     * Возвращает индекс первой строки после формы.
     */
    private static int readShape(Shape shape, String idLine, String[] lines, int from) {
        // своя открывающая скобка формы + баланс остатка строки после id
        String idText = String.valueOf(shape.id);
        int depth = 1 + braceDelta(idLine.substring(idLine.indexOf(idText) + idText.length()));
        if (idLine.contains("launcher_radial")) {
            shape.launcherRadial = Boolean.TRUE;
        }

        Mode mode = Mode.NONE;
        Scale current = null;
        List<Scale> scales = new ArrayList<>();
        int i = from;

        while (i < lines.length && depth > 0) {
            String raw = lines[i].trim();
            String code = stripComment(raw);
            i++;

            if (raw.contains("launcher_radial")) {
                shape.launcherRadial = Boolean.TRUE;
            }

            int vertsIdx = code.indexOf("verts");
            int portsIdx = code.indexOf("ports");
            if (vertsIdx >= 0 && code.contains("{")) {
                current = new Scale();
                scales.add(current);
                if (portsIdx > vertsIdx) {
                    // verts и ports на одной строке: каждый список читается своим режимом
                    readVerts(code.substring(vertsIdx, portsIdx), current);
                    readPorts(code.substring(portsIdx), current);
                    mode = Mode.PORTS;
                } else {
                    readVerts(code.substring(vertsIdx), current);
                    mode = Mode.VERTS;
                }
            } else if (portsIdx >= 0) {
                if (current == null) {
                    current = new Scale();
                    scales.add(current);
                }
                mode = Mode.PORTS;
                readPorts(code.substring(portsIdx), current);
            } else if (code.equals("}") || code.equals("},")) {
                mode = Mode.NONE;
            } else if (mode == Mode.VERTS) {
                readVerts(code, current);
            } else if (mode == Mode.PORTS) {
                readPorts(code, current);
            }

            depth += braceDelta(code);
        }

        for (Scale s : scales) {
            if (!s.verts.isEmpty()) {
                shape.scales.add(s);
            }
        }
        return i;
    }

    private static void readVerts(String code, Scale scale) {
        Matcher m = TUPLE.matcher(code);
        while (m.find()) {
            String[] parts = m.group(1).split(",");
            if (parts.length < 2) continue;
            String x = parts[0].trim();
            String y = parts[1].trim();
            if (!DECIMAL.matcher(x).matches() || !DECIMAL.matcher(y).matches()) continue;
            scale.verts.add(new Vertex(Double.parseDouble(x), Double.parseDouble(y)));
        }
    }

    private static void readPorts(String code, Scale scale) {
        Matcher m = TUPLE.matcher(code);
        while (m.find()) {
            String[] parts = m.group(1).split(",");
            if (parts.length < 2) continue;
            String edge = parts[0].trim();
            String position = parts[1].trim();
            if (!UNSIGNED.matcher(edge).matches() || !DECIMAL.matcher(position).matches()) continue;

            PortType type = PortType.DEFAULT;
            if (parts.length >= 3) {
                type = PortType.fromToken(parts[2].trim());
            }
            scale.ports.add(new Port(Integer.parseInt(edge), Double.parseDouble(position), type));
        }
    }

    /** Первый токен строки вида "{5001, ..." как беззнаковое целое, иначе null. */
    static Integer shapeId(String code) {
        String trimmed = trimBraces(code);
        if (trimmed.isEmpty()) return null;
        String first = trimmed.split(",", -1)[0].trim();
        if (!UNSIGNED.matcher(first).matches()) return null;
        return Integer.parseInt(first);
    }

    private static String trimBraces(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && isBraceOrComma(s.charAt(start))) start++;
        while (end > start && isBraceOrComma(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    private static boolean isBraceOrComma(char c) {
        return c == '{' || c == '}' || c == ',';
    }

    static String stripComment(String line) {
        int idx = line.indexOf("--");
        return (idx >= 0) ? line.substring(0, idx).trim() : line.trim();
    }

    static int braceDelta(String code) {
        int delta = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') delta++;
            else if (c == '}') delta--;
        }
        return delta;
    }
}
