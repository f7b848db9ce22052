package io.backup4j.core;

import java.util.Objects;

/**
 * One include/exclude rule. An expression wrapped in square brackets is a regular expression.
 */
public record FilterRule(int order, boolean include, String expression) {

    public FilterRule {
        Objects.requireNonNull(expression, "expression must not be null");
    }

    public boolean isRegex() {
        return expression.length() >= 2 && expression.startsWith("[") && expression.endsWith("]");
    }

    public FilterRule withExpression(String value) {
        return new FilterRule(order, include, value);
    }

    /**
     * Command line form, e.g. {@code +*.txt} or {@code -[.*\.tmp]}.
     */
    public String asFilterString() {
        return (include ? "+" : "-") + expression;
    }
}
