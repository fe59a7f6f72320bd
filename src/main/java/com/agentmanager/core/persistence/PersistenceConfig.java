package com.agentmanager.core.persistence;

import com.agentmanager.core.events.EventLog;
import com.agentmanager.core.events.InMemoryEventLog;
import com.agentmanager.core.events.JdbcEventLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Wires the repo store, session store and event log.
 * <p>
 * When {@code spring.datasource.url} is set (PostgreSQL), the JDBC implementations are used
 * and their tables created on startup, repos first, then sessions, then events. Otherwise
 * everything lives in memory: fine for development and tests, lost on restart.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnExpression("!'${spring.datasource.url:}'.isEmpty()")
    @EnableConfigurationProperties(DataSourceProperties.class)
    static class JdbcPersistence {

        @Bean
        public DataSource dataSource(DataSourceProperties properties) {
            log.info("Configuring JDBC persistence (PostgreSQL)");
            return properties.initializeDataSourceBuilder().build();
        }

        @Bean
        public RepoStore repoStore(DataSource dataSource, Clock clock) throws SQLException {
            var store = new JdbcRepoStore(dataSource, clock);
            store.createTables();
            return store;
        }

        // RepoStore parameter orders table creation: sessions references repos.
        @Bean
        public SessionStore sessionStore(DataSource dataSource, Clock clock, RepoStore repoStore) throws SQLException {
            var store = new JdbcSessionStore(dataSource, clock);
            store.createTables();
            return store;
        }

        @Bean
        public EventLog eventLog(DataSource dataSource, ObjectMapper objectMapper, Clock clock,
                                 SessionStore sessionStore) throws SQLException {
            var eventLog = new JdbcEventLog(dataSource, objectMapper, clock);
            eventLog.createTables();
            return eventLog;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnExpression("'${spring.datasource.url:}'.isEmpty()")
    static class InMemoryPersistence {

        @Bean
        public RepoStore repoStore(Clock clock) {
            log.info("No datasource configured; using in-memory stores (state will not persist across restarts)");
            return new InMemoryRepoStore(clock);
        }

        @Bean
        public SessionStore sessionStore(Clock clock) {
            return new InMemorySessionStore(clock);
        }

        @Bean
        public EventLog eventLog(Clock clock) {
            return new InMemoryEventLog(clock);
        }
    }
}
