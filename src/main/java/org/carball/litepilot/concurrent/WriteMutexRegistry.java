package org.carball.litepilot.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out one write mutex per database file path and keeps it alive while any pool uses it.
 * <p>
 * Every pool opened against the same path shares the same {@link AsyncMutex}; the entry is
 * dropped when the last pool detaches. Create one registry per process (or per test) and pass it
 * to every pool that must coordinate writes.
 */
@Slf4j
public class WriteMutexRegistry {

    private final Map<String, Registration> registrations = new HashMap<>();

    /**
     * Returns the mutex for {@code databasePath}, creating it on first use, and counts one more user.
     */
    public synchronized AsyncMutex attach(String databasePath) {
        Registration registration = registrations.computeIfAbsent(databasePath, path -> {
            log.debug("Creating write mutex for {}", path);
            return new Registration();
        });
        registration.references++;
        return registration.mutex;
    }

    /**
     * Counts one user less for {@code databasePath}, removing the mutex when nobody uses it anymore.
     */
    public synchronized void detach(String databasePath) {
        Registration registration = registrations.get(databasePath);
        if (registration == null) {
            log.warn("Detach requested for unknown write mutex {}", databasePath);
            return;
        }
        registration.references--;
        if (registration.references <= 0) {
            registrations.remove(databasePath);
            log.debug("Removed write mutex for {}", databasePath);
        }
    }

    public synchronized int getReferenceCount(String databasePath) {
        Registration registration = registrations.get(databasePath);
        return registration == null ? 0 : registration.references;
    }

    public synchronized boolean isRegistered(String databasePath) {
        return registrations.containsKey(databasePath);
    }

    public synchronized int size() {
        return registrations.size();
    }

    private static final class Registration {
        private final AsyncMutex mutex = new AsyncMutex();
        private int references;
    }
}
