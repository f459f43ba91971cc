package com.questrail.timedcallback.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class RegistrationGuardTest {

    @Test
    void acquireHoldsUntilClosed() {
        ReentrantLock lock = new ReentrantLock();

        try (RegistrationGuard guard = RegistrationGuard.acquire(lock)) {
            assertTrue(guard.isHeld());
            assertTrue(lock.isHeldByCurrentThread());
        }

        assertFalse(lock.isLocked());
    }

    @Test
    void closeIsIdempotent() {
        ReentrantLock lock = new ReentrantLock();
        RegistrationGuard guard = RegistrationGuard.acquire(lock);

        guard.close();
        guard.close();

        assertFalse(guard.isHeld());
        assertEquals(0, lock.getHoldCount());
    }

    @Test
    void unguardedScopeHoldsNothing() {
        RegistrationGuard guard = RegistrationGuard.unguarded();

        assertFalse(guard.isHeld());
        guard.close();
    }
}
