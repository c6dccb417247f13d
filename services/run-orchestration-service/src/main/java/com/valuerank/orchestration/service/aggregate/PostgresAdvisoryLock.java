package com.valuerank.orchestration.service.aggregate;

import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.error.ConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@code pg_advisory_xact_lock(hashtext(key))}. Different keys with the same hash share a lock,
 * which only serializes unrelated work.
 */
@Component
@ConditionalOnProperty(prefix = "orchestrator", name = "aggregate-lock-mode", havingValue = "postgres", matchIfMissing = true)
public class PostgresAdvisoryLock implements AdvisoryLock {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresAdvisoryLock.class);

    private final JdbcTemplate jdbcTemplate;
    private final OrchestratorProperties properties;

    public PostgresAdvisoryLock(JdbcTemplate jdbcTemplate, OrchestratorProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(String key) {
        long timeoutMillis = properties.getAggregateLockTimeout().toMillis();
        try {
            jdbcTemplate.execute("SET LOCAL lock_timeout = '" + timeoutMillis + "ms'");
            jdbcTemplate.queryForList("SELECT pg_advisory_xact_lock(hashtext(?))", key);
        } catch (DataAccessException ex) {
            LOGGER.error("Failed to acquire advisory lock for {}", key, ex);
            throw new ConflictException("Could not acquire aggregation lock for " + key, ex);
        }
    }
}
