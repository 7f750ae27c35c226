package com.strata.domain;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Selects datasets by exact name ({@code events}) or by prefix with a single
 * trailing wildcard ({@code sensor.*}). A lone {@code *} selects every dataset.
 */
public final class DatasetSelector {

    private static final Pattern SYNTAX = Pattern.compile("^[A-Za-z0-9_.\\-]*\\*?$");

    private final String expression;

    private DatasetSelector(String expression) {
        this.expression = expression;
    }

    /**
     * Parse a selector expression.
     *
     * @throws IllegalArgumentException if the expression is empty or malformed
     */
    public static DatasetSelector of(String expression) {
        if (!isValid(expression)) {
            throw new IllegalArgumentException("Malformed dataset selector: " + expression);
        }
        return new DatasetSelector(expression);
    }

    public static boolean isValid(String expression) {
        return expression != null && !expression.isBlank() && SYNTAX.matcher(expression).matches();
    }

    public String getExpression() {
        return expression;
    }

    public boolean isWildcard() {
        return expression.endsWith("*");
    }

    /**
     * Exact name, or the prefix when this is a wildcard selector
     */
    public String getPrefix() {
        return isWildcard() ? expression.substring(0, expression.length() - 1) : expression;
    }

    public boolean matches(String dataset) {
        if (dataset == null) {
            return false;
        }
        return isWildcard() ? dataset.startsWith(getPrefix()) : dataset.equals(expression);
    }

    /**
     * Whether some dataset could be selected by both selectors.
     */
    public boolean overlaps(DatasetSelector other) {
        if (!isWildcard() && !other.isWildcard()) {
            return expression.equals(other.expression);
        }
        if (isWildcard() && other.isWildcard()) {
            return getPrefix().startsWith(other.getPrefix()) || other.getPrefix().startsWith(getPrefix());
        }
        return isWildcard() ? matches(other.expression) : other.matches(expression);
    }

    /**
     * File- and key-safe rendering used in object storage keys.
     */
    public String toKeySegment() {
        String prefix = getPrefix();
        if (!isWildcard()) {
            return prefix;
        }
        return (prefix.isEmpty() ? "all" : prefix) + "_all";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DatasetSelector && ((DatasetSelector) o).expression.equals(expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }

    @Override
    public String toString() {
        return expression;
    }
}
