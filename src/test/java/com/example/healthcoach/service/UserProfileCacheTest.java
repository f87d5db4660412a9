package com.example.healthcoach.service;

import com.example.healthcoach.model.UserProfile;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UserProfileCacheTest {

    /** Clock the test can move forward. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-10T09:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final MutableClock clock = new MutableClock();
    private final AtomicInteger loads = new AtomicInteger();

    private UserProfileCache cache(Duration ttl) {
        return new UserProfileCache(v -> {
            loads.incrementAndGet();
            return UserProfile.builder().name("Alex").version(v).build();
        }, ttl, clock);
    }

    @Test
    void loadsOnceWithinTtl() {
        UserProfileCache cache = cache(Duration.ofHours(1));
        assertFalse(cache.isLoaded());

        UserProfile first = cache.get();
        clock.advance(Duration.ofMinutes(30));

        assertSame(first, cache.get());
        assertEquals(1, loads.get());
        assertEquals(1, first.getVersion());
        assertTrue(cache.isLoaded());
    }

    @Test
    void reloadsAfterTtlWithNextVersion() {
        UserProfileCache cache = cache(Duration.ofHours(1));
        cache.get();
        clock.advance(Duration.ofMinutes(61));

        assertEquals(2, cache.get().getVersion());
        assertEquals(2, cache.version());
    }

    @Test
    void invalidateForcesReload() {
        UserProfileCache cache = cache(Duration.ofHours(1));
        cache.get();
        cache.invalidate();

        assertFalse(cache.isLoaded());
        assertEquals(2, cache.get().getVersion());
        assertEquals(2, loads.get());
    }

    @Test
    void staleProfileIsServedWhileReloadRuns() throws Exception {
        CountDownLatch reloading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        UserProfileCache cache = new UserProfileCache(v -> {
            loads.incrementAndGet();
            if (v > 1) {
                reloading.countDown();
                await(release);
            }
            return UserProfile.builder().name("Alex").version(v).build();
        }, Duration.ofHours(1), clock);
        UserProfile first = cache.get();
        clock.advance(Duration.ofMinutes(61));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<UserProfile> refreshed = pool.submit(cache::get);
            assertTrue(reloading.await(2, TimeUnit.SECONDS));

            assertSame(first, cache.get());

            release.countDown();
            assertEquals(2, refreshed.get(2, TimeUnit.SECONDS).getVersion());
            assertEquals(2, cache.get().getVersion());
            assertEquals(2, loads.get());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentFirstReadsLoadOnce() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        UserProfileCache cache = new UserProfileCache(v -> {
            loads.incrementAndGet();
            await(release);
            return UserProfile.builder().name("Alex").version(v).build();
        }, Duration.ofHours(1), clock);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<UserProfile> a = pool.submit(cache::get);
            Future<UserProfile> b = pool.submit(cache::get);
            Future<UserProfile> c = pool.submit(cache::get);
            release.countDown();

            UserProfile loaded = a.get(2, TimeUnit.SECONDS);
            assertSame(loaded, b.get(2, TimeUnit.SECONDS));
            assertSame(loaded, c.get(2, TimeUnit.SECONDS));
            assertEquals(1, loads.get());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void invalidateDuringLoadDoesNotCacheTheLoadedProfile() throws Exception {
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        UserProfileCache cache = new UserProfileCache(v -> {
            loads.incrementAndGet();
            if (v == 1) {
                loading.countDown();
                await(release);
            }
            return UserProfile.builder().name("Alex").version(v).build();
        }, Duration.ofHours(1), clock);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<UserProfile> pending = pool.submit(cache::get);
            assertTrue(loading.await(2, TimeUnit.SECONDS));
            cache.invalidate();
            release.countDown();

            assertEquals(1, pending.get(2, TimeUnit.SECONDS).getVersion());
            assertFalse(cache.isLoaded());
            assertEquals(2, cache.get().getVersion());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
