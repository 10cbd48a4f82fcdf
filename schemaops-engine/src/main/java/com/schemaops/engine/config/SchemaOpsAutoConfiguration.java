package com.schemaops.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemaops.advisory.AdvisoryLockManager;
import com.schemaops.core.db.ConnectionPool;
import com.schemaops.core.util.Sleeper;
import com.schemaops.engine.coordinator.TaskGraphCoordinator;
import com.schemaops.engine.io.TaskGraphReader;
import com.schemaops.engine.jdbc.HikariConnectionPool;
import com.schemaops.engine.lifecycle.GracefulShutdownHandler;
import com.schemaops.engine.metrics.OrchestrationMetrics;
import com.schemaops.executor.LockAwareExecutor;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Wires the lock manager, executor and coordinator over the application's
 * Hikari data source. Each bean backs off when the application defines its own.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(HikariDataSource.class)
@ConditionalOnBean(HikariDataSource.class)
@EnableConfigurationProperties(SchemaOpsProperties.class)
public class SchemaOpsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationMetrics orchestrationMetrics() {
        return new OrchestrationMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionPool schemaOpsConnectionPool(HikariDataSource dataSource) {
        return new HikariConnectionPool(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public AdvisoryLockManager advisoryLockManager(SchemaOpsProperties properties, OrchestrationMetrics metrics) {
        return new AdvisoryLockManager(properties.locks().toSettings(), metrics, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public LockAwareExecutor lockAwareExecutor(ConnectionPool pool, SchemaOpsProperties properties,
                                               OrchestrationMetrics metrics) {
        LockAwareExecutor executor = new LockAwareExecutor(pool, properties.executor().toSettings(),
            metrics, Sleeper.SYSTEM, Clock.systemUTC());
        metrics.monitorExecutor(executor::getStats);
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskGraphCoordinator taskGraphCoordinator(LockAwareExecutor executor, SchemaOpsProperties properties,
                                                     ObjectProvider<ObjectMapper> objectMapper,
                                                     OrchestrationMetrics metrics) {
        return new TaskGraphCoordinator(executor, properties.coordinator().toSettings(),
            objectMapper.getIfAvailable(ObjectMapper::new), metrics, Sleeper.SYSTEM, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskGraphReader taskGraphReader(ObjectProvider<ObjectMapper> objectMapper) {
        return new TaskGraphReader(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public GracefulShutdownHandler schemaOpsShutdownHandler(TaskGraphCoordinator coordinator,
                                                            LockAwareExecutor executor,
                                                            AdvisoryLockManager lockManager) {
        return new GracefulShutdownHandler(coordinator, executor, lockManager);
    }
}
