package com.cdm.modelgraph.service;

import com.cdm.modelgraph.config.ReconciliationProperties;
import com.cdm.modelgraph.exception.EntityLockTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EntityLockRegistryTest {

    private EntityLockRegistry registry;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.setLockTimeoutMs(100);
        registry = new EntityLockRegistry(properties);
    }

    @Test
    void testKeysAreReleasedAfterUse() {
        for (int i = 0; i < 100; i++) {
            registry.withLock(EntityLockRegistry.key("Object", "o" + i), () -> null);
        }

        assertEquals(0, registry.activeKeys());
    }

    @Test
    void testNestedCallOnSameKeyIsReentrant() {
        String key = EntityLockRegistry.key("List", "l1");

        String value = registry.withLock(key, () -> {
            assertEquals(1, registry.activeKeys());
            String inner = registry.withLock(key, () -> "inner");
            assertEquals(1, registry.activeKeys());
            return inner;
        });

        assertEquals("inner", value);
        assertEquals(0, registry.activeKeys());
    }

    @Test
    void testTimeoutWhileAnotherThreadHoldsTheKey() throws InterruptedException {
        String key = EntityLockRegistry.key("Object", "o1");
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> registry.withLock(key, () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));

        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        try {
            registry.withLock(key, () -> null);
        } catch (EntityLockTimeoutException e) {
            failure.set(e);
        }
        release.countDown();
        holder.join(5000);

        assertNotNull(failure.get());
        assertEquals(0, registry.activeKeys());
        assertEquals("done", registry.withLock(key, () -> "done"));
    }
}
