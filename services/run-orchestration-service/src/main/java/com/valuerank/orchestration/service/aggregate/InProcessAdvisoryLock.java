package com.valuerank.orchestration.service.aggregate;

import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.error.ConflictException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Striped JVM-local locks released when the transaction completes. Only serializes callers
 * inside one process; used for single-node deployments and databases without advisory locks.
 */
@Component
@ConditionalOnProperty(prefix = "orchestrator", name = "aggregate-lock-mode", havingValue = "in-process")
public class InProcessAdvisoryLock implements AdvisoryLock {

    private static final Logger LOGGER = LoggerFactory.getLogger(InProcessAdvisoryLock.class);
    private static final int STRIPES = 64;

    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];
    private final OrchestratorProperties properties;

    public InProcessAdvisoryLock(OrchestratorProperties properties) {
        this.properties = properties;
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public void acquire(String key) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("Advisory lock requires an active transaction");
        }
        ReentrantLock lock = stripes[Math.floorMod(key.hashCode(), STRIPES)];
        boolean acquired;
        try {
            acquired = lock.tryLock(properties.getAggregateLockTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ConflictException("Interrupted while waiting for aggregation lock for " + key, ex);
        }
        if (!acquired) {
            LOGGER.error("Timed out waiting for advisory lock for {}", key);
            throw new ConflictException("Could not acquire aggregation lock for " + key);
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                lock.unlock();
            }
        });
    }
}
