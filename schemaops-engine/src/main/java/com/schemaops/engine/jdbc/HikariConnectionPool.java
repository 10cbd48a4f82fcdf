package com.schemaops.engine.jdbc;

import com.schemaops.core.db.ConnectionPool;
import com.schemaops.core.db.DatabaseConnection;
import com.schemaops.core.db.PoolStats;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;

/**
 * {@link ConnectionPool} backed by a HikariCP data source.
 * Utilisation is read from Hikari's pool MXBean against the configured
 * maximum pool size.
 */
public class HikariConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(HikariConnectionPool.class);

    private final HikariDataSource dataSource;

    public HikariConnectionPool(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public DatabaseConnection acquire() {
        try {
            return new JdbcDatabaseConnection(dataSource.getConnection());
        } catch (SQLException e) {
            throw new CannotGetJdbcConnectionException("Failed to obtain JDBC connection from pool", e);
        }
    }

    @Override
    public void release(DatabaseConnection connection) {
        if (connection instanceof JdbcDatabaseConnection jdbc) {
            jdbc.close();
            return;
        }
        log.warn("Ignoring release of a connection this pool did not hand out: {}", connection);
    }

    @Override
    public PoolStats getStats() {
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        int active = pool != null ? pool.getActiveConnections() : 0;
        return new PoolStats(active, dataSource.getMaximumPoolSize());
    }
}
