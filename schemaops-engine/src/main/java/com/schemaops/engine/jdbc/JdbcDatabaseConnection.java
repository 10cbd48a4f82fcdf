package com.schemaops.engine.jdbc;

import com.schemaops.core.db.DatabaseConnection;
import com.schemaops.core.db.QueryResult;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.JdbcUtils;

import java.sql.Connection;
import java.sql.ResultSet;
import java.util.List;
import java.util.Map;

/**
 * {@link DatabaseConnection} over one JDBC connection.
 *
 * Every statement runs on the same physical session, so session state
 * (advisory locks, SET parameters, BEGIN/COMMIT) carries over between calls.
 * Errors are translated by {@link JdbcTemplate} into Spring's
 * DataAccessException hierarchy (40P01 becomes a DeadlockLoserDataAccessException).
 */
public class JdbcDatabaseConnection implements DatabaseConnection, AutoCloseable {

    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;

    public JdbcDatabaseConnection(Connection connection) {
        this.connection = connection;
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    @Override
    public QueryResult query(String sql, List<?> params) {
        Object[] args = params.toArray();
        return jdbcTemplate.execute(sql, (PreparedStatementCallback<QueryResult>) ps -> {
            new ArgumentPreparedStatementSetter(args).setValues(ps);
            if (ps.execute()) {
                try (ResultSet rs = ps.getResultSet()) {
                    List<Map<String, Object>> rows =
                        new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(rs);
                    return QueryResult.ofRows(rows);
                }
            }
            return QueryResult.ofUpdateCount(Math.max(ps.getUpdateCount(), 0));
        });
    }

    /**
     * Close the underlying connection, returning it to its pool.
     */
    @Override
    public void close() {
        JdbcUtils.closeConnection(connection);
    }
}
