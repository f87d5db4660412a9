package com.example.healthcoach.service;

import com.example.healthcoach.model.UserProfile;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;

/**
 * Read-through cache for the singleton profile. Each load gets the next version number;
 * {@link #invalidate()} forces the next {@link #get()} to reload.
 * <p>
 * Reads never wait on a load that refreshes an expired snapshot: while one thread reloads,
 * others keep getting the previous profile. Only callers with nothing cached wait.
 */
@Slf4j
public class UserProfileCache {

    private static final class Snapshot {
        final UserProfile profile;
        final Instant loadedAt;
        final long version;

        Snapshot(UserProfile profile, Instant loadedAt, long version) {
            this.profile = profile;
            this.loadedAt = loadedAt;
            this.version = version;
        }
    }

    private final LongFunction<UserProfile> loader;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock loadLock = new ReentrantLock();
    private final AtomicLong versions = new AtomicLong();

    private volatile Snapshot snapshot = new Snapshot(null, null, 0);

    /**
     * @param loader receives the version the loaded profile should carry
     */
    public UserProfileCache(LongFunction<UserProfile> loader, Duration ttl, Clock clock) {
        this.loader = loader;
        this.ttl = ttl;
        this.clock = clock;
    }

    public UserProfile get() {
        Snapshot current = snapshot;
        if (isFresh(current)) {
            return current.profile;
        }
        if (current.profile != null) {
            if (!loadLock.tryLock()) {
                return current.profile;
            }
        } else {
            loadLock.lock();
        }
        try {
            current = snapshot;
            if (isFresh(current)) {
                return current.profile;
            }
            long next = versions.incrementAndGet();
            UserProfile loaded = loader.apply(next);
            // an invalidate() during the load means the profile may predate the change
            if (snapshot == current) {
                snapshot = new Snapshot(loaded, clock.instant(), next);
                log.debug("Loaded user profile version {}", next);
            }
            return loaded;
        } finally {
            loadLock.unlock();
        }
    }

    /** Drops the cached snapshot; call after the profile or its baselines change. */
    public void invalidate() {
        long version = snapshot.version;
        snapshot = new Snapshot(null, null, version);
        log.info("User profile cache invalidated at version {}", version);
    }

    public long version() {
        return snapshot.version;
    }

    public boolean isLoaded() {
        return snapshot.profile != null;
    }

    private boolean isFresh(Snapshot s) {
        if (s.profile == null) {
            return false;
        }
        return ttl == null || ttl.isZero() || !s.loadedAt.plus(ttl).isBefore(clock.instant());
    }
}
