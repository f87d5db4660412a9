package com.example.healthcoach.service;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SessionGateTest {

    private final SessionGate gate = new SessionGate();

    @Test
    void turnsOfOneSessionNeverOverlap() throws InterruptedException {
        AtomicInteger active = new AtomicInteger();
        List<Integer> maxSeen = new CopyOnWriteArrayList<>();

        Flux.range(0, 5)
                .flatMap(i -> gate.run("s-1", () -> Mono.fromRunnable(() -> maxSeen.add(active.incrementAndGet()))
                        .then(Mono.delay(Duration.ofMillis(20)))
                        .doOnTerminate(active::decrementAndGet)))
                .blockLast(Duration.ofSeconds(5));

        assertThat(maxSeen).hasSize(5).containsOnly(1);
        awaitTracked(0);
    }

    @Test
    void permitIsReleasedAfterFailure() {
        Mono<Object> failing = gate.run("s-2", () -> Mono.error(new IllegalStateException("boom")));

        assertThat(failing.onErrorReturn("recovered").block()).isEqualTo("recovered");
        assertThat(gate.run("s-2", () -> Mono.just("next")).block(Duration.ofSeconds(2))).isEqualTo("next");
    }

    @Test
    void otherSessionRunsWhileOneIsBusy() throws Exception {
        Sinks.Empty<Void> release = Sinks.empty();
        CompletableFuture<String> busy = gate.run("s-a", () -> release.asMono().thenReturn("a")).toFuture();

        assertThat(gate.run("s-b", () -> Mono.just("b")).block(Duration.ofSeconds(2))).isEqualTo("b");
        assertThat(busy).isNotDone();

        release.tryEmitEmpty();
        assertThat(busy.get(2, TimeUnit.SECONDS)).isEqualTo("a");
        awaitTracked(0);
    }

    @Test
    void finishedSessionsAreForgotten() throws InterruptedException {
        for (int i = 0; i < 2000; i++) {
            assertThat(gate.run("session-" + i, () -> Mono.just(1)).block(Duration.ofSeconds(2))).isEqualTo(1);
        }

        awaitTracked(0);
    }

    @Test
    void waitingTurnKeepsSessionTracked() throws Exception {
        Sinks.Empty<Void> release = Sinks.empty();
        CompletableFuture<String> first = gate.run("s-c", () -> release.asMono().thenReturn("first")).toFuture();
        CompletableFuture<String> second = gate.run("s-c", () -> Mono.just("second")).toFuture();

        assertThat(gate.trackedSessions()).isEqualTo(1);
        release.tryEmitEmpty();

        assertThat(first.get(2, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(second.get(2, TimeUnit.SECONDS)).isEqualTo("second");
        awaitTracked(0);
    }

    /** The lane is dropped in doFinally, which may run just after the caller saw the value. */
    private void awaitTracked(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (gate.trackedSessions() != expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(gate.trackedSessions()).isEqualTo(expected);
    }
}
