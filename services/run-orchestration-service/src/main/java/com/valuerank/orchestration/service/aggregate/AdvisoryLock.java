package com.valuerank.orchestration.service.aggregate;

public interface AdvisoryLock {

    /**
     * Blocks until the lock is held, or throws {@link com.valuerank.orchestration.error.ConflictException}
     * when it cannot be acquired within the configured timeout.
     */
    void acquire(String key);
}
