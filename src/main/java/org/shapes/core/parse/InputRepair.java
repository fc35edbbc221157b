package org.shapes.core.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Дешёвая построчная правка известных огрехов ручного редактирования перед грамматическим разбором.
 *
 * Порядок фиксирован:
 * 1) "}" + перевод строки + "{" без запятой между ними -> "},\n{" (отступ из пробелов/табов сохраняется);
 * 2) "launcher_radial=" с любыми пробелами -> "launcher_radial = ";
 *    голый флаг launcher_radial без "=" -> "launcher_radial = true".
 *
 * Ничего больше не переписывается. Повторное применение ничего не меняет.
 * Результат не обязан быть корректной таблицей.
 */
public final class InputRepair {

    private static final Pattern MISSING_COMMA = Pattern.compile("\\}(\\r?\\n)([ \\t]*)\\{");
    private static final Pattern RADIAL_ASSIGN = Pattern.compile("\\blauncher_radial[ \\t]*=[ \\t]*(?!=)");
    private static final Pattern RADIAL_BARE = Pattern.compile("\\blauncher_radial\\b(?!\\s*=)");

    private InputRepair() {
    }

    public static String repair(String text) {
        if (text == null || text.isEmpty()) return "";

        String fixed = MISSING_COMMA.matcher(text).replaceAll("},$1$2{");
        fixed = RADIAL_ASSIGN.matcher(fixed).replaceAll("launcher_radial = ");
        fixed = RADIAL_BARE.matcher(fixed).replaceAll(Matcher.quoteReplacement("launcher_radial = true"));
        return fixed;
    }
}
