package org.shapes.core.lua;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Разбор подмножества Lua, достаточного для файлов описаний (shapes.lua, blocks.lua).
 * Ручной рекурсивный спуск по символам, без отдельного лексера.
 *
 * Поддерживается:
 *   Комментарии {@code -- ...} до конца строки и блочные {@code --[[ ... ]]}, {@code --[==[ ... ]==]}.
 *   Числа: десятичные с дробной частью и экспонентой ({@code 5}, {@code .5}, {@code 1e-3})
 *       и шестнадцатеричные ({@code 0x00113077}).
 *   Строки в двойных/одинарных кавычках с обычными escape-последовательностями и длинные {@code [[...]]}.
 *   Унарный минус, скобки, идентификаторы (в т.ч. через точку) и наборы флагов {@code A|B}.
 *   Таблицы: поля {@code value}, {@code name = value}, {@code [key] = value},
 *       разделители {@code ,} и {@code ;}, допускается хвостовой разделитель.
 *   Операторы верхнего уровня: {@code return expr}, {@code name = expr}, {@code local name = expr}.
 *
 * Бинарные операторы и вызовы функций не поддерживаются: это ошибка разбора.
 * Ошибки выбрасываются как {@link LuaSyntaxException} со строкой и позицией.
 */
public class LuaTableParser {

    private static final Set<String> RESERVED = Set.of(
            "and", "break", "do", "else", "elseif", "end", "for", "function", "goto", "if",
            "in", "local", "not", "or", "repeat", "return", "then", "until", "while"
    );

    private final String input;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    // Строка последнего съеденного токена: комментарий на ней считается "хвостовым"
    private int lastTokenLine = 0;
    private String trailingComment;

    public LuaTableParser(String input) {
        this.input = (input != null) ? input : "";
    }

    public static LuaChunk parseChunk(String text) throws LuaSyntaxException {
        return new LuaTableParser(text).chunk();
    }

    /** Ровно одно выражение на весь текст (пробелы и комментарии вокруг допускаются). */
    public static LuaExpr parseExpression(String text) throws LuaSyntaxException {
        LuaTableParser p = new LuaTableParser(text);
        LuaExpr expr = p.expression();
        p.skipWhitespaceAndComments();
        if (!p.eof()) {
            throw p.error("Unexpected '" + p.current() + "' after expression");
        }
        return expr;
    }

    // ------------------------------------------------------------------
    // Операторы
    // ------------------------------------------------------------------

    public LuaChunk chunk() throws LuaSyntaxException {
        List<LuaChunk.Statement> statements = new ArrayList<>();
        LuaExpr returned = null;

        while (true) {
            skipWhitespaceAndComments();
            if (eof()) break;

            if (peek(';')) {
                advance();
                continue;
            }

            String word = peekWord();
            if ("return".equals(word)) {
                consumeWord(word);
                skipWhitespaceAndComments();
                if (!eof() && !peek(';')) {
                    List<LuaExpr> values = expressionList();
                    returned = values.get(0);
                }
                skipWhitespaceAndComments();
                if (peek(';')) advance();
                skipWhitespaceAndComments();
                if (!eof()) {
                    throw error("Expected end of input after return statement");
                }
                break;
            }

            if ("local".equals(word)) {
                consumeWord(word);
                skipWhitespaceAndComments();
                String target = parseName();
                skipWhitespaceAndComments();
                while (peek(',')) {
                    advance();
                    skipWhitespaceAndComments();
                    parseName();
                    skipWhitespaceAndComments();
                }
                LuaExpr value = null;
                if (peek('=') && !peekNext('=')) {
                    advance();
                    markToken();
                    value = expressionList().get(0);
                }
                statements.add(new LuaChunk.Statement(LuaChunk.Statement.Kind.LOCAL, target, value));
                continue;
            }

            if (word != null && !RESERVED.contains(word)) {
                String target = parseDottedName();
                skipWhitespaceAndComments();
                if (!peek('=') || peekNext('=')) {
                    throw error("Expected '=' after '" + target + "'");
                }
                advance();
                markToken();
                LuaExpr value = expressionList().get(0);
                statements.add(new LuaChunk.Statement(LuaChunk.Statement.Kind.ASSIGNMENT, target, value));
                continue;
            }

            throw error("Unexpected '" + current() + "' at statement start");
        }

        return new LuaChunk(statements, returned);
    }

    private List<LuaExpr> expressionList() throws LuaSyntaxException {
        List<LuaExpr> out = new ArrayList<>();
        out.add(expression());
        skipWhitespaceAndComments();
        while (peek(',')) {
            advance();
            markToken();
            out.add(expression());
            skipWhitespaceAndComments();
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Выражения
    // ------------------------------------------------------------------

    public LuaExpr expression() throws LuaSyntaxException {
        skipWhitespaceAndComments();
        if (eof()) {
            throw error("Unexpected end of input while reading a value");
        }

        char ch = current();

        if (ch == '{') {
            return parseTable();
        }

        if (ch == '-') {
            advance();
            markToken();
            return new LuaExpr.UnaryMinus(expression());
        }

        if (Character.isDigit(ch) || (ch == '.' && isDigitAt(pos + 1))) {
            return parseNumber();
        }

        if (ch == '"' || ch == '\'') {
            return new LuaExpr.StringLit(parseQuotedString(ch));
        }

        if (ch == '[' && longBracketLevel(pos) >= 0) {
            return new LuaExpr.StringLit(parseLongString());
        }

        if (ch == '(') {
            advance();
            LuaExpr inner = expression();
            skipWhitespaceAndComments();
            expect(')');
            markToken();
            return inner;
        }

        if (isNameStart(ch)) {
            String word = peekWord();
            if (RESERVED.contains(word)) {
                throw error("Unexpected keyword '" + word + "' in expression");
            }
            StringBuilder flags = new StringBuilder(parseDottedName());
            // набор флагов через '|' (THRUSTER|TORQUER) - один идентификатор
            while (peek('|') && pos + 1 < input.length() && isNameStart(input.charAt(pos + 1))) {
                advance();
                flags.append('|').append(parseName());
            }
            return new LuaExpr.Identifier(flags.toString());
        }

        throw error("Unexpected character '" + ch + "' while reading a value");
    }

    private LuaExpr.TableCtor parseTable() throws LuaSyntaxException {
        int startLine = line;
        expect('{');
        markToken();
        List<TableField> fields = new ArrayList<>();

        while (true) {
            skipWhitespaceAndComments();
            if (eof()) {
                throw error("Table opened at line " + startLine + " is not closed");
            }
            if (peek('}')) {
                advance();
                markToken();
                break;
            }

            TableField.Kind kind;
            String name = null;
            LuaExpr key = null;
            LuaExpr value;

            if (peek('[') && longBracketLevel(pos) < 0) {
                // [key] = value
                advance();
                key = expression();
                skipWhitespaceAndComments();
                expect(']');
                skipWhitespaceAndComments();
                expect('=');
                markToken();
                value = expression();
                kind = TableField.Kind.KEYED;
            } else if (isNameStart(current()) && isNamedField()) {
                name = parseName();
                skipWhitespaceAndComments();
                expect('=');
                markToken();
                value = expression();
                kind = TableField.Kind.NAMED;
            } else {
                value = expression();
                kind = TableField.Kind.POSITIONAL;
            }

            // комментарий после значения или после разделителя - на той же строке
            trailingComment = null;
            skipWhitespaceAndComments();
            boolean separated = false;
            if (peek(',') || peek(';')) {
                advance();
                markToken();
                skipWhitespaceAndComments();
                separated = true;
            }
            String comment = trailingComment;
            trailingComment = null;

            switch (kind) {
                case NAMED -> fields.add(TableField.named(name, value, comment));
                case KEYED -> fields.add(TableField.keyed(key, value, comment));
                default -> fields.add(TableField.positional(value, comment));
            }

            if (!separated && !peek('}')) {
                if (eof()) {
                    throw error("Table opened at line " + startLine + " is not closed");
                }
                throw error("Expected ',' or '}' in table, got '" + current() + "'");
            }
        }

        return new LuaExpr.TableCtor(fields, startLine);
    }

    /** Заглядывание вперёд: после имени идёт '=' (но не '=='). Позиция не меняется. */
    private boolean isNamedField() {
        int p = pos;
        while (p < input.length() && isNamePart(input.charAt(p))) p++;
        String word = input.substring(pos, p);
        if (RESERVED.contains(word) || "true".equals(word) || "false".equals(word) || "nil".equals(word)) {
            return false;
        }
        while (p < input.length() && Character.isWhitespace(input.charAt(p))) p++;
        return p < input.length()
                && input.charAt(p) == '='
                && (p + 1 >= input.length() || input.charAt(p + 1) != '=');
    }

    private LuaExpr.NumberLit parseNumber() throws LuaSyntaxException {
        int start = pos;

        if (peek('0') && (peekNext('x') || peekNext('X'))) {
            advance();
            advance();
            int digitsStart = pos;
            while (!eof() && Character.digit(current(), 16) >= 0) advance();
            String digits = input.substring(digitsStart, pos);
            if (digits.isEmpty()) {
                throw error("Malformed hexadecimal number");
            }
            failIfGlued();
            markToken();
            String text = input.substring(start, pos);
            try {
                return new LuaExpr.NumberLit(text, (double) Long.parseLong(digits, 16));
            } catch (NumberFormatException e) {
                throw error("Hexadecimal number out of range: " + text);
            }
        }

        while (!eof() && Character.isDigit(current())) advance();
        if (peek('.')) {
            advance();
            while (!eof() && Character.isDigit(current())) advance();
        }
        if (peek('e') || peek('E')) {
            advance();
            if (peek('+') || peek('-')) advance();
            int expStart = pos;
            while (!eof() && Character.isDigit(current())) advance();
            if (pos == expStart) {
                throw error("Malformed number exponent");
            }
        }
        failIfGlued();
        markToken();

        String text = input.substring(start, pos);
        try {
            return new LuaExpr.NumberLit(text, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw error("Malformed number: " + text);
        }
    }

    // "12abc" - не число и не имя
    private void failIfGlued() throws LuaSyntaxException {
        if (!eof() && (isNamePart(current()) || current() == '.')) {
            throw error("Malformed number near '" + current() + "'");
        }
    }

    private String parseQuotedString(char quote) throws LuaSyntaxException {
        int startLine = line;
        expect(quote);
        StringBuilder sb = new StringBuilder();
        while (!eof()) {
            char c = current();
            if (c == quote) {
                advance();
                markToken();
                return sb.toString();
            }
            if (c == '\n') {
                throw error("Unfinished string started at line " + startLine);
            }
            if (c == '\\') {
                advance();
                if (eof()) break;
                char e = current();
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\' -> sb.append('\\');
                    case '"' -> sb.append('"');
                    case '\'' -> sb.append('\'');
                    default -> sb.append('\\').append(e);
                }
                advance();
                continue;
            }
            sb.append(c);
            advance();
        }
        throw error("Unfinished string started at line " + startLine);
    }

    private String parseLongString() throws LuaSyntaxException {
        int level = longBracketLevel(pos);
        int startLine = line;
        for (int i = 0; i < level + 2; i++) advance();
        String close = "]" + "=".repeat(level) + "]";
        int end = input.indexOf(close, pos);
        if (end < 0) {
            throw error("Unfinished long string started at line " + startLine);
        }
        String body = input.substring(pos, end);
        while (pos < end + close.length()) advance();
        markToken();
        // первый перевод строки сразу после [[ не входит в строку
        if (body.startsWith("\r\n")) return body.substring(2);
        if (body.startsWith("\n")) return body.substring(1);
        return body;
    }

    private String parseName() throws LuaSyntaxException {
        if (eof() || !isNameStart(current())) {
            throw error("Expected a name");
        }
        int start = pos;
        while (!eof() && isNamePart(current())) advance();
        markToken();
        return input.substring(start, pos);
    }

    private String parseDottedName() throws LuaSyntaxException {
        StringBuilder sb = new StringBuilder(parseName());
        while (peek('.') && pos + 1 < input.length() && isNameStart(input.charAt(pos + 1))) {
            advance();
            sb.append('.').append(parseName());
        }
        return sb.toString();
    }

    private String peekWord() {
        if (eof() || !isNameStart(current())) return null;
        int p = pos;
        while (p < input.length() && isNamePart(input.charAt(p))) p++;
        return input.substring(pos, p);
    }

    private void consumeWord(String word) {
        for (int i = 0; i < word.length(); i++) advance();
        markToken();
    }

    // ------------------------------------------------------------------
    // Пробелы и комментарии
    // ------------------------------------------------------------------

    /**
     * Пропускает пробелы и комментарии. Строчный комментарий, начатый на строке последнего
     * токена, запоминается как хвостовой (если хвостовой ещё не найден).
     */
    private void skipWhitespaceAndComments() throws LuaSyntaxException {
        while (!eof()) {
            char c = current();
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }
            if (c == '-' && peekNext('-')) {
                int commentLine = line;
                advance();
                advance();
                int level = longBracketLevel(pos);
                if (level >= 0) {
                    skipBlockComment(level, commentLine);
                    continue;
                }
                int start = pos;
                while (!eof() && current() != '\n') advance();
                if (commentLine == lastTokenLine && trailingComment == null) {
                    trailingComment = input.substring(start, pos).trim();
                }
                continue;
            }
            break;
        }
    }

    private void skipBlockComment(int level, int startLine) throws LuaSyntaxException {
        for (int i = 0; i < level + 2; i++) advance();
        String close = "]" + "=".repeat(level) + "]";
        int end = input.indexOf(close, pos);
        if (end < 0) {
            throw error("Unfinished block comment started at line " + startLine);
        }
        while (pos < end + close.length()) advance();
    }

    /** Уровень длинной скобки "[==[" в позиции p, либо -1. */
    private int longBracketLevel(int p) {
        if (p >= input.length() || input.charAt(p) != '[') return -1;
        int q = p + 1;
        int level = 0;
        while (q < input.length() && input.charAt(q) == '=') {
            level++;
            q++;
        }
        return (q < input.length() && input.charAt(q) == '[') ? level : -1;
    }

    // ------------------------------------------------------------------
    // Низкоуровневые операции
    // ------------------------------------------------------------------

    private void markToken() {
        lastTokenLine = line;
    }

    private boolean eof() {
        return pos >= input.length();
    }

    private char current() {
        return input.charAt(pos);
    }

    private boolean peek(char c) {
        return !eof() && input.charAt(pos) == c;
    }

    private boolean peekNext(char c) {
        return pos + 1 < input.length() && input.charAt(pos + 1) == c;
    }

    private boolean isDigitAt(int p) {
        return p < input.length() && Character.isDigit(input.charAt(p));
    }

    private void advance() {
        if (input.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private void expect(char expected) throws LuaSyntaxException {
        if (eof()) {
            throw error("Expected '" + expected + "' but reached end of input");
        }
        if (current() != expected) {
            throw error("Expected '" + expected + "' but found '" + current() + "'");
        }
        advance();
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private LuaSyntaxException error(String message) {
        return new LuaSyntaxException(message, line, column);
    }
}
