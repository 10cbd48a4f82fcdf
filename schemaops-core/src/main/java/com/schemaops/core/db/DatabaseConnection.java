package com.schemaops.core.db;

import java.util.List;

/**
 * A single database session.
 * Session-scoped state (advisory locks, SET parameters, open transactions)
 * lives as long as the underlying connection.
 */
public interface DatabaseConnection {

    /**
     * Run a statement with positional parameters.
     *
     * @throws org.springframework.dao.DataAccessException on database errors
     */
    QueryResult query(String sql, List<?> params);

    default QueryResult query(String sql) {
        return query(sql, List.of());
    }

    default QueryResult query(String sql, Object... params) {
        return query(sql, List.of(params));
    }
}
