package com.schemaops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A SQL statement to run through the executor.
 *
 * @param id operation id used in logs and history; may be null
 * @param sql statement text
 * @param params positional bind parameters
 * @param transaction wrap the statement in BEGIN/COMMIT
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SqlOperation(String id, String sql, List<Object> params, boolean transaction) {

    public SqlOperation {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be empty");
        }
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static SqlOperation of(String sql) {
        return new SqlOperation(null, sql, List.of(), false);
    }

    public static SqlOperation of(String id, String sql) {
        return new SqlOperation(id, sql, List.of(), false);
    }

    public SqlOperation inTransaction() {
        return new SqlOperation(id, sql, params, true);
    }

    /**
     * Label for logs: the id if present, otherwise the first 50 characters of SQL.
     */
    public String label() {
        if (id != null) {
            return id;
        }
        return sql.length() > 50 ? sql.substring(0, 50) : sql;
    }
}
