// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import sh.meshnet.core.crypto.PskDeriver;
import sh.meshnet.core.membership.ThresholdMembershipEngine;
import sh.meshnet.core.model.KeyMaterial;
import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.score.InMemoryScoreStore;
import sh.meshnet.core.types.ParticipantId;

class EpochManagerConcurrencyTest {

    private static final Instant T0 = Instant.parse("2026-01-05T12:00:00Z");

    @Test
    void readersNeverSeeAMixedEpoch() throws Exception {
        final MutableClock clock = new MutableClock(T0);
        final InMemoryScoreStore store = new InMemoryScoreStore();
        final List<ParticipantId> ids = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            final ParticipantId id = ParticipantId.of("node-" + i);
            ids.add(id);
            store.submit(ScoreRecord.builder(id).submittedAt(T0).suiteVersion("poc-0.1").overall(0.5 + i * 0.05).build());
        }

        final ExecutorService executor = Executors.newFixedThreadPool(5);
        final AtomicBoolean running = new AtomicBoolean(true);
        final CountDownLatch start = new CountDownLatch(1);
        try (EpochManager manager = EpochManager.builder()
                .store(store)
                .engine(new ThresholdMembershipEngine())
                .deriver(new PskDeriver(32, 32))
                .epochDuration(Duration.ofSeconds(60))
                .knownParticipants(Set.copyOf(ids))
                .clock(clock)
                .build()) {
            final List<Future<?>> readers = new ArrayList<>();
            for (int r = 0; r < 4; r++) {
                readers.add(executor.submit(() -> {
                    start.await();
                    long lastSeen = 0;
                    while (running.get()) {
                        final EpochView view = manager.current();
                        final long epochId = view.epochId();
                        assertTrue(epochId >= lastSeen, "epoch went backwards");
                        lastSeen = epochId;
                        for (MembershipVerdict verdict : view.snapshot().verdicts().values()) {
                            assertEquals(epochId, verdict.epochId());
                        }
                        for (KeyMaterial key : view.keyMaterial().values()) {
                            assertEquals(epochId, key.epochId());
                            assertTrue(view.verdict(key.participantId()).orElseThrow().isAllowed());
                        }
                    }
                    return null;
                }));
            }

            start.countDown();
            for (int i = 0; i < 200; i++) {
                manager.forceRotate();
            }
            running.set(false);
            for (Future<?> reader : readers) {
                reader.get(30, TimeUnit.SECONDS);
            }
            assertEquals(201, manager.current().epochId());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentRotationsAreSerialized() throws Exception {
        final MutableClock clock = new MutableClock(T0);
        final ExecutorService executor = Executors.newFixedThreadPool(4);
        try (EpochManager manager = EpochManager.builder()
                .store(new InMemoryScoreStore())
                .engine(new ThresholdMembershipEngine())
                .deriver(new PskDeriver(32, 32))
                .clock(clock)
                .build()) {
            final List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        manager.forceRotate();
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            assertEquals(101, manager.current().epochId());
        } finally {
            executor.shutdownNow();
        }
    }
}
