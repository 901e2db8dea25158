package com.fedquery.query;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 标识符工具：保留字判断与反引号转义
 */
final class Identifiers {
    private static final Pattern PLAIN = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");

    static final Set<String> KEYWORDS = Set.of(
        "SELECT", "FROM", "JOIN", "LEFT", "OUTER", "ON", "WHERE", "AND", "ORDER", "BY", "ASC", "DESC",
        "LIMIT", "TRUE", "FALSE", "NULL"
    );

    /**
     * 能识别但不支持的关键字，出现时给出明确的语法错误
     */
    static final Set<String> UNSUPPORTED = Set.of(
        "OR", "NOT", "IN", "LIKE", "BETWEEN", "IS", "GROUP", "HAVING", "UNION", "INTERSECT", "EXCEPT",
        "DISTINCT", "OFFSET", "INNER", "RIGHT", "FULL", "CROSS", "AS", "EXISTS"
    );

    private Identifiers() {
    }

    static boolean isKeyword(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        return KEYWORDS.contains(upper) || UNSUPPORTED.contains(upper);
    }

    static String quoteIfNeeded(String identifier) {
        if (PLAIN.matcher(identifier).matches() && !isKeyword(identifier)) {
            return identifier;
        }
        return "`" + identifier.replace("`", "``") + "`";
    }
}
