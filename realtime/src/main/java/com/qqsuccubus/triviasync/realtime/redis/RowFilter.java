package com.qqsuccubus.triviasync.realtime.redis;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Row filter in the {@code column=eq.value} form accepted by table subscriptions.
 * <p>
 * Only equality is supported. A missing or blank filter matches every row.
 * </p>
 */
final class RowFilter {
    private static final RowFilter ALL = new RowFilter(null, null);

    private final String column;
    private final String value;

    private RowFilter(String column, String value) {
        this.column = column;
        this.value = value;
    }

    static RowFilter parse(String filter) {
        if (filter == null || filter.isBlank()) {
            return ALL;
        }
        int eq = filter.indexOf('=');
        if (eq <= 0 || !filter.startsWith("eq.", eq + 1)) {
            throw new IllegalArgumentException("Unsupported row filter: " + filter);
        }
        return new RowFilter(filter.substring(0, eq).trim(), filter.substring(eq + 4));
    }

    boolean matches(JsonNode row) {
        if (column == null) {
            return true;
        }
        if (row == null) {
            return false;
        }
        JsonNode field = row.get(column);
        return field != null && !field.isNull() && value.equals(field.asText());
    }
}
