package com.schemaops.core.db;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rows returned by a statement, or the update count for statements without rows.
 */
public record QueryResult(List<Map<String, Object>> rows, int rowCount) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of(), 0);
    }

    public static QueryResult ofRows(List<Map<String, Object>> rows) {
        return new QueryResult(rows, rows.size());
    }

    public static QueryResult ofUpdateCount(int count) {
        return new QueryResult(List.of(), count);
    }

    public static QueryResult singleValue(String column, Object value) {
        return ofRows(List.of(Map.of(column, value)));
    }

    /**
     * Value of a column in the first row, if any.
     */
    public Optional<Object> firstValue(String column) {
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(0).get(column));
    }
}
