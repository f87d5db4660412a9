package com.example.healthcoach.service;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Serializes work per session: turns of one session run one at a time in arrival order,
 * different sessions never wait on each other. A session is tracked only while it has a
 * running or waiting turn.
 */
public class SessionGate {

    /** Permit plus the number of turns holding or waiting for it; mutated only inside {@code compute}. */
    private static final class Lane {
        final Semaphore permit = new Semaphore(1, true);
        int users;
    }

    private final ConcurrentHashMap<String, Lane> lanes = new ConcurrentHashMap<>();

    public <T> Mono<T> run(String sessionId, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Lane lane = join(sessionId);
            return Mono.usingWhen(
                            Mono.fromCallable(() -> {
                                lane.permit.acquire();
                                return lane.permit;
                            }).subscribeOn(Schedulers.boundedElastic()),
                            p -> Mono.defer(work),
                            p -> Mono.fromRunnable(p::release))
                    .doFinally(signal -> leave(sessionId, lane));
        });
    }

    private Lane join(String sessionId) {
        return lanes.compute(sessionId, (id, lane) -> {
            Lane l = lane == null ? new Lane() : lane;
            l.users++;
            return l;
        });
    }

    private void leave(String sessionId, Lane lane) {
        lanes.computeIfPresent(sessionId, (id, l) -> {
            if (l != lane) {
                return l;
            }
            return --l.users == 0 ? null : l;
        });
    }

    int trackedSessions() {
        return lanes.size();
    }
}
