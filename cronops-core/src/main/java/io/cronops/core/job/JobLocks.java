package io.cronops.core.job;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per job id, shared by the API mutations and the scheduler's fire path so that a pause
 * and a fire of the same job never interleave.
 */
public final class JobLocks {
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String jobId, LockedAction<T> action) throws IOException {
        ReentrantLock lock = locks.computeIfAbsent(jobId, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    public void forget(String jobId) {
        locks.remove(jobId);
    }

    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }
}
