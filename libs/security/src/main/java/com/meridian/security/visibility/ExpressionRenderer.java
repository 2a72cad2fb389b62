package com.meridian.security.visibility;

import java.util.stream.Collectors;

/**
 * Renders a {@link RowFilter} as a readable boolean expression, for debug logging.
 * <p>
 * Example: {@code (access_level IN ('public', 'visible') OR username = 'alice')}.
 */
public final class ExpressionRenderer implements RowFilter.Visitor<String> {

    public static String render(RowFilter filter) {
        return filter.accept(new ExpressionRenderer());
    }

    @Override
    public String visitAll() {
        return "TRUE";
    }

    @Override
    public String visitNone() {
        return "FALSE";
    }

    @Override
    public String visitEqualTo(RowFilter.EqualTo filter) {
        if (filter.value() == null) {
            return filter.field() + " IS NULL";
        }
        return filter.field() + " = " + literal(filter.value());
    }

    @Override
    public String visitIn(RowFilter.In filter) {
        return filter.values().stream()
                .map(ExpressionRenderer::literal)
                .sorted()
                .collect(Collectors.joining(", ", filter.field() + " IN (", ")"));
    }

    @Override
    public String visitAnyOf(RowFilter.AnyOf filter) {
        return filter.filters().stream()
                .map(f -> f.accept(this))
                .collect(Collectors.joining(" OR ", "(", ")"));
    }

    @Override
    public String visitAllOf(RowFilter.AllOf filter) {
        return filter.filters().stream()
                .map(f -> f.accept(this))
                .collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public String visitNot(RowFilter.Not filter) {
        return "NOT " + filter.filter().accept(this);
    }

    private static String literal(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + String.valueOf(value).replace("'", "''") + "'";
    }
}
