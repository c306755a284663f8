package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.exception.WorkspaceBusyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes writers of the taxonomy and the product documents.
 * <p>
 * Batches wait for the lock; admin mutations wait at most {@code tracker.admin.lock-wait} and then fail
 * with {@link WorkspaceBusyException}. Reentrant, so an admin operation may run tagging inline.
 */
@Component
public class WorkspaceLock {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceLock.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Duration adminWait;

    public WorkspaceLock(@Value("${tracker.admin.lock-wait:5s}") Duration adminWait) {
        this.adminWait = adminWait;
    }

    /**
     * Runs a batch step holding the lock, waiting as long as needed.
     */
    public <T> T runExclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs an admin mutation holding the lock.
     *
     * @throws WorkspaceBusyException if the lock is not free within the configured wait
     */
    public <T> T runAdmin(String operation, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(adminWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceBusyException("Interrupted while waiting to run " + operation);
        }
        if (!acquired) {
            log.warn("[LOCK] {} rejected, a batch holds the workspace", operation);
            throw new WorkspaceBusyException("A crawl or tagging run is in progress, retry " + operation + " later");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked() {
        return lock.isLocked();
    }
}
