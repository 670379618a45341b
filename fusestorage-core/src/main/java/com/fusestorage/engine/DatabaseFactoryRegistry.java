package com.fusestorage.engine;

import com.fusestorage.exception.NoFactoryRegisteredException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide slot holding the default {@link DatabaseFactory}.
 *
 * <p>Optional: managers constructed with an explicit queue never consult it. Set once at startup with
 * {@link #register(DatabaseFactory)} and cleared with {@link #shutdown()}.
 */
@Slf4j
public final class DatabaseFactoryRegistry {
    private static final ReentrantLock LOCK = new ReentrantLock();
    private static DatabaseFactory registered;

    private DatabaseFactoryRegistry() {
    }

    /**
     * Register the default factory, replacing any previous one.
     *
     * @param factory factory
     */
    public static void register(DatabaseFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory is required");
        }
        LOCK.lock();
        try {
            if (registered != null && registered != factory) {
                log.info("Replacing registered database factory {} with {}",
                        registered.getClass().getName(), factory.getClass().getName());
            }
            registered = factory;
        } finally {
            LOCK.unlock();
        }
    }

    public static Optional<DatabaseFactory> current() {
        LOCK.lock();
        try {
            return Optional.ofNullable(registered);
        } finally {
            LOCK.unlock();
        }
    }

    /**
     * Registered factory.
     *
     * @return factory
     * @throws NoFactoryRegisteredException when nothing has been registered
     */
    public static DatabaseFactory require() {
        return current().orElseThrow(() -> new NoFactoryRegisteredException(
                "No database factory registered; call DatabaseFactoryRegistry.register(...) first"));
    }

    /**
     * Clear the slot. Queues already created are unaffected.
     */
    public static void shutdown() {
        LOCK.lock();
        try {
            registered = null;
        } finally {
            LOCK.unlock();
        }
    }
}
