package com.questrail.timedcallback.core;

import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * RegistrationGuard
 * -----------------------------------------------------------------------------
 * Scoped hold on the registry's membership lock.
 *
 * <p>The lock is taken on construction and released by {@link #close()}, so
 * callers use it with try-with-resources:</p>
 *
 * <pre>
 *   try (RegistrationGuard guard = RegistrationGuard.acquire(membershipLock)) {
 *       processors.add(processor);
 *   }
 * </pre>
 *
 * <p>This guard protects only the set of registered processors. It never
 * protects a processor's timeline or lookup; those are covered by the engine
 * lock. When both are needed, the guard is the outer lock. A thread that
 * already holds the engine lock takes an {@link #unguarded()} scope instead,
 * so the engine lock is never held while waiting for the guard.</p>
 */
public final class RegistrationGuard implements AutoCloseable
{
    private static final RegistrationGuard UNGUARDED = new RegistrationGuard(null);

    private final Lock lock;
    private boolean released;

    private RegistrationGuard(Lock lock)
    {
        this.lock = lock;
    }

    /**
     * Blocks until {@code lock} is held by the calling thread.
     */
    public static RegistrationGuard acquire(Lock lock)
    {
        Objects.requireNonNull(lock, "lock");
        lock.lock();
        return new RegistrationGuard(lock);
    }

    /**
     * A scope that holds nothing. Used by the thread that owns the engine lock.
     */
    public static RegistrationGuard unguarded()
    {
        return UNGUARDED;
    }

    /**
     * Returns {@code true} if this scope actually holds the membership lock.
     */
    public boolean isHeld()
    {
        return lock != null && !released;
    }

    /**
     * Releases the lock. Calling this more than once has no further effect.
     */
    @Override
    public void close()
    {
        if (lock != null && !released) {
            released = true;
            lock.unlock();
        }
    }
}
