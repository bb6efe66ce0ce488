package com.auraflux.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Provides the {@link SessionRepository} bean.
 * <p>
 * When a datasource URL is configured (the {@code postgres} profile), a
 * {@link JdbcSessionRepository} is created. Otherwise an in-memory repository is used as a
 * fallback, suitable for development and testing but not durable across restarts.
 */
@Configuration
public class SessionRepositoryConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionRepositoryConfig.class);

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "spring.datasource", name = "url")
    public SessionRepository jdbcSessionRepository(DataSource dataSource, ObjectMapper objectMapper) throws Exception {
        log.info("Configuring JDBC session repository");
        var repository = new JdbcSessionRepository(dataSource, objectMapper);
        repository.createTables();
        return repository;
    }

    @Bean
    @ConditionalOnMissingBean(SessionRepository.class)
    public SessionRepository inMemorySessionRepository() {
        log.info("No datasource configured; using in-memory session repository (sessions will not persist across restarts)");
        return new InMemorySessionRepository();
    }
}
