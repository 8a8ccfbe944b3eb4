package com.example.syncedscheduler.lock;

import com.example.syncedscheduler.config.SyncedSchedulerProperties;
import com.example.syncedscheduler.exception.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Blocking distributed lock on top of a ShedLock {@link LockProvider}.
 * <p>
 * ShedLock only offers try-lock semantics, so acquisition polls the provider until the
 * lock record is free. A record left behind by a crashed holder becomes free once its
 * {@code lockAtMostFor} has elapsed.
 */
@Slf4j
@Component
public class ShedLockDistributedLock implements DistributedLock {

    private final LockProvider lockProvider;
    private final Clock clock;
    private final Duration lockAtMostFor;
    private final Duration pollInterval;

    public ShedLockDistributedLock(LockProvider lockProvider, Clock clock, SyncedSchedulerProperties properties) {
        this.lockProvider = lockProvider;
        this.clock = clock;
        this.lockAtMostFor = properties.getLockAtMostFor();
        this.pollInterval = properties.getLockPollInterval();
    }

    @Override
    public <T> T withLock(String lockName, Supplier<T> criticalSection) {
        var lock = acquire(lockName);
        try {
            return criticalSection.get();
        } finally {
            lock.unlock();
            log.debug("Released lock {}", lockName);
        }
    }

    private SimpleLock acquire(String lockName) {
        var attempts = 0;
        while (true) {
            attempts++;
            var configuration = new LockConfiguration(clock.instant(), lockName, lockAtMostFor, Duration.ZERO);
            var lock = lockProvider.lock(configuration);
            if (lock.isPresent()) {
                log.debug("Acquired lock {} after {} attempt(s)", lockName, attempts);
                return lock.get();
            }

            if (attempts == 1) {
                log.debug("Lock {} is held elsewhere, waiting", lockName);
            }

            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException(lockName, "interrupted while waiting", e);
            }
        }
    }
}
