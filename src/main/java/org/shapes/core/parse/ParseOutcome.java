package org.shapes.core.parse;

import org.shapes.core.model.ShapesFile;

import java.util.regex.Pattern;

/**
 * Результат разбора вместе с тем, какой стратегией он получен.
 *
 * RECOVERED_NOTHING отличает "эвристика ничего не нашла в непустом тексте"
 * от честно пустого файла (EMPTY), чтобы вызывающий мог показать предупреждение.
 *
 * @param strictFailure сообщение отказа строгого разбора, если отработал запасной; иначе null
 */
public record ParseOutcome(ShapesFile shapesFile, StrategyId strategy, Status status, String strictFailure) {

    public enum Status {
        /** строгий разбор */
        PARSED,
        /** эвристика нашла хотя бы одну форму */
        RECOVERED,
        /** в тексте нет ничего, кроме скобок, разделителей и комментариев */
        EMPTY,
        /** текст непустой, но эвристика не нашла ни одной формы */
        RECOVERED_NOTHING
    }

    private static final Pattern COMMENT = Pattern.compile("--[^\\n]*");
    private static final Pattern SKELETON = Pattern.compile("(?:\\breturn\\b|[\\s{},;])+");

    public static ParseOutcome parsed(ShapesFile file) {
        return new ParseOutcome(file, StrategyId.STRICT, Status.PARSED, null);
    }

    public static ParseOutcome recovered(ShapesFile file, String sourceText, String strictFailure) {
        Status status;
        if (!file.isEmpty()) {
            status = Status.RECOVERED;
        } else if (hasContent(sourceText)) {
            status = Status.RECOVERED_NOTHING;
        } else {
            status = Status.EMPTY;
        }
        return new ParseOutcome(file, StrategyId.LEGACY, status, strictFailure);
    }

    public boolean usedFallback() {
        return strategy == StrategyId.LEGACY;
    }

    public boolean isSuspicious() {
        return status == Status.RECOVERED_NOTHING;
    }

    static boolean hasContent(String text) {
        if (text == null) return false;
        String stripped = COMMENT.matcher(text).replaceAll("");
        return !SKELETON.matcher(stripped).replaceAll("").isEmpty();
    }
}
