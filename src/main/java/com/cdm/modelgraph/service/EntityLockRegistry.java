package com.cdm.modelgraph.service;

import com.cdm.modelgraph.config.ReconciliationProperties;
import com.cdm.modelgraph.exception.EntityLockTimeoutException;
import com.cdm.modelgraph.exception.ModelGraphException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per entity, so two reconciliations of the same entity
 * cannot interleave their read and write phases. Locks are reentrant; a nested call
 * for the same key on the same thread proceeds.
 *
 * <p>An entry lives only while some thread holds or waits for it.
 */
@Component
@RequiredArgsConstructor
public class EntityLockRegistry {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();
    private final ReconciliationProperties properties;

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry claimed = existing != null ? existing : new Entry();
            claimed.users++;
            return claimed;
        });
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(properties.getLockTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ModelGraphException("Interrupted while waiting for lock on " + key, e);
            }
            if (!acquired) {
                throw new EntityLockTimeoutException(key, properties.getLockTimeoutMs());
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    /** Number of keys currently held or awaited. */
    int activeKeys() {
        return locks.size();
    }

    public static String key(String label, String id) {
        return label + ":" + id;
    }

    // users is only read and written inside the map's atomic compute calls
    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }
}
