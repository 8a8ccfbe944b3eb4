package com.example.syncedscheduler.lock;

import java.util.function.Supplier;

/**
 * Named mutual exclusion shared by every instance of the application.
 * <p>
 * Acquisition is scoped: the lock is held for the duration of the critical section
 * and released on every exit path, including exceptions thrown by the section.
 */
public interface DistributedLock {

    /**
     * Run a critical section while holding the named lock, blocking until the lock is available.
     *
     * @param lockName        Name of the lock
     * @param criticalSection Code to run exclusively
     * @return Value returned by the critical section
     * @throws com.example.syncedscheduler.exception.LockAcquisitionException if waiting for the lock was interrupted
     */
    <T> T withLock(String lockName, Supplier<T> criticalSection);
}
