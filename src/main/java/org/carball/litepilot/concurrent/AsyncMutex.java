package org.carball.litepilot.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Non-reentrant mutual exclusion for asynchronous call sites.
 * <p>
 * {@link #lock()} never blocks the calling thread: it returns a future that completes once the
 * caller owns the mutex. Waiters are served strictly in request order, and {@link #unlock()} hands
 * ownership straight to the oldest waiter so the mutex is never observed free in between.
 * <p>
 * There is no owner tracking, so any party may unlock. Unlocking a free mutex is a no-op.
 */
@Slf4j
public class AsyncMutex {

    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private boolean locked;

    /**
     * Requests the mutex.
     *
     * @return a future completed when the caller holds the mutex; already complete if it was free
     */
    public CompletableFuture<Void> lock() {
        synchronized (this) {
            if (!locked) {
                locked = true;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    /**
     * Takes the mutex only if nobody holds it.
     */
    public synchronized boolean tryLock() {
        if (locked) {
            return false;
        }
        locked = true;
        return true;
    }

    /**
     * Releases the mutex, resuming exactly one waiter if any is queued.
     */
    public void unlock() {
        while (true) {
            CompletableFuture<Void> next;
            synchronized (this) {
                if (!locked) {
                    log.debug("unlock() called on a mutex that is not held");
                    return;
                }
                next = waiters.pollFirst();
                if (next == null) {
                    locked = false;
                    return;
                }
            }
            // Completed outside the monitor: the waiter's continuation may run on this thread.
            if (next.complete(null)) {
                return;
            }
            // Waiter was cancelled; ownership moves on to the next one.
        }
    }

    public synchronized boolean isLocked() {
        return locked;
    }

    public synchronized int getQueueLength() {
        return waiters.size();
    }
}
