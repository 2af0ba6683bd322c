// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.meshnet.controller.publish.SnapshotPublisher;
import sh.meshnet.core.crypto.PskDeriver;
import sh.meshnet.core.error.PublishException;
import sh.meshnet.core.error.RotationException;
import sh.meshnet.core.membership.MembershipEngine;
import sh.meshnet.core.membership.MembershipPolicy;
import sh.meshnet.core.membership.ThresholdMembershipEngine;
import sh.meshnet.core.model.KeyMaterial;
import sh.meshnet.core.model.MembershipStatus;
import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.model.Snapshot;
import sh.meshnet.core.score.InMemoryScoreStore;
import sh.meshnet.core.types.ParticipantId;

@ExtendWith(MockitoExtension.class)
class EpochManagerTest {

    private static final Instant T0 = Instant.parse("2026-01-05T12:00:00Z");
    private static final ParticipantId A = ParticipantId.of("node-a");
    private static final ParticipantId B = ParticipantId.of("node-b");
    private static final ParticipantId C = ParticipantId.of("node-c");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryScoreStore store = new InMemoryScoreStore();
    private final PskDeriver deriver = new PskDeriver(32, 32);
    private final List<Snapshot> published = new CopyOnWriteArrayList<>();

    @Mock
    private ControllerMetrics metrics;

    private EpochManager manager;

    @BeforeEach
    void setUp() {
        manager = newManager(new ThresholdMembershipEngine(), published::add);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private EpochManager newManager(final MembershipEngine engine, final SnapshotPublisher publisher) {
        return EpochManager.builder()
                .store(store)
                .engine(engine)
                .deriver(deriver)
                .policy(new MembershipPolicy(0.70, Duration.ofSeconds(120)))
                .epochDuration(Duration.ofSeconds(60))
                .knownParticipants(Set.of(A, B, C))
                .publisher(publisher)
                .metrics(metrics)
                .clock(clock)
                .random(new FixedSecureRandom())
                .build();
    }

    private void submit(final ParticipantId id, final double overall) {
        store.submit(ScoreRecord.builder(id).submittedAt(clock.instant()).suiteVersion("poc-0.1").overall(overall).build());
    }

    @Test
    void initialEpochIsOneWithEveryoneDenied() {
        final EpochView view = manager.current();

        assertEquals(1, view.epochId());
        assertEquals(T0.plusSeconds(60), view.expiresAt());
        assertEquals(3, view.snapshot().deniedCount());
        assertTrue(view.keyMaterial().isEmpty());
        view.snapshot().verdicts().values()
                .forEach(v -> assertEquals(ThresholdMembershipEngine.REASON_NO_BENCHMARK, v.reason()));
        assertEquals(List.of(view.snapshot()), published);
    }

    @Test
    void scenarioAllowedAndBelowThreshold() {
        submit(A, 0.91);
        submit(C, 0.40);
        clock.advanceSeconds(60);

        assertTrue(manager.tick());

        final EpochView view = manager.current();
        assertEquals(2, view.epochId());
        assertEquals(MembershipStatus.ALLOWED, view.verdict(A).orElseThrow().status());
        final MembershipVerdict c = view.verdict(C).orElseThrow();
        assertEquals(MembershipStatus.DENIED, c.status());
        assertEquals(ThresholdMembershipEngine.REASON_BELOW_THRESHOLD, c.reason());
        assertEquals(Set.of(A), view.keyMaterial().keySet());
        assertTrue(manager.keyMaterial(C).isEmpty());
        assertEquals(32, manager.keyMaterial(A).orElseThrow().keyLength());
        verify(metrics).onRotation(eq(2L), any(Duration.class));
    }

    @Test
    void scenarioRecordGoesStale() {
        submit(B, 0.95);
        clock.advanceSeconds(60);
        manager.tick();
        assertTrue(manager.verdict(B).orElseThrow().isAllowed());

        clock.advanceSeconds(125);
        assertTrue(manager.tick());

        final MembershipVerdict b = manager.verdict(B).orElseThrow();
        assertEquals(MembershipStatus.DENIED, b.status());
        assertEquals(ThresholdMembershipEngine.REASON_STALE, b.reason());
        assertEquals(Duration.ofSeconds(185), b.benchmarkAge());
        assertTrue(manager.keyMaterial(B).isEmpty());
    }

    @Test
    void backToBackManualRotationsAdvanceEpochTwice() {
        final Snapshot before = manager.currentSnapshot();

        final EpochView first = manager.forceRotate();
        final EpochView second = manager.forceRotate();

        assertEquals(before.epochId() + 1, first.epochId());
        assertEquals(before.epochId() + 2, second.epochId());
        assertNotEquals(before.secretFingerprint(), first.snapshot().secretFingerprint());
        assertNotEquals(first.snapshot().secretFingerprint(), second.snapshot().secretFingerprint());
    }

    @Test
    void tickDoesNothingBeforeExpiry() {
        clock.advanceSeconds(59);
        assertFalse(manager.tick());
        assertEquals(1, manager.current().epochId());

        clock.advanceSeconds(1);
        assertTrue(manager.tick());
        assertEquals(2, manager.current().epochId());
    }

    @Test
    void manualRotationPushesNextScheduledRotation() {
        clock.advanceSeconds(30);
        manager.forceRotate();
        assertEquals(T0.plusSeconds(90), manager.current().expiresAt());

        clock.advanceSeconds(45);
        assertFalse(manager.tick());
        clock.advanceSeconds(15);
        assertTrue(manager.tick());
    }

    @Test
    void epochIdsIncreaseByOneAcrossMixedRotations() {
        long expected = manager.current().epochId();
        for (int i = 0; i < 20; i++) {
            if (i % 3 == 0) {
                manager.forceRotate();
            } else {
                clock.advanceSeconds(60);
                assertTrue(manager.tick());
            }
            expected++;
            assertEquals(expected, manager.current().epochId());
        }
        final List<Long> ids = new ArrayList<>();
        published.forEach(s -> ids.add(s.epochId()));
        for (int i = 1; i < ids.size(); i++) {
            assertEquals(ids.get(i - 1) + 1, ids.get(i));
        }
    }

    @Test
    void participantsWhoSubmittedJoinTheKnownSet() {
        final ParticipantId d = ParticipantId.of("node-d");
        submit(d, 0.8);

        manager.forceRotate();

        assertTrue(manager.verdict(d).orElseThrow().isAllowed());
        assertEquals(4, manager.currentSnapshot().verdicts().size());
    }

    @Test
    void keysAreDerivedFromTheEpochSecret() {
        final FixedSecureRandom random = new FixedSecureRandom();
        submit(A, 0.9);
        try (EpochManager own = EpochManager.builder()
                .store(store).engine(new ThresholdMembershipEngine()).deriver(deriver)
                .clock(clock).random(random).build()) {
            final byte[] secret = random.generated().get(0);
            final KeyMaterial key = own.keyMaterial(A).orElseThrow();
            assertArrayEquals(deriver.derive(secret, A), key.keyBytes());
        }
    }

    @Test
    void failedRotationKeepsPreviousEpoch() {
        final MembershipEngine engine = mock(MembershipEngine.class);
        final ThresholdMembershipEngine real = new ThresholdMembershipEngine();
        when(engine.evaluate(any(), any()))
                .thenAnswer(inv -> real.evaluate(inv.getArgument(0), inv.getArgument(1)))
                .thenThrow(new IllegalStateException("engine down"));
        submit(A, 0.9);
        manager.close();
        manager = newManager(engine, published::add);

        final EpochView before = manager.current();
        final KeyMaterial keyBefore = manager.keyMaterial(A).orElseThrow();
        final int publishedBefore = published.size();

        final RotationException ex = assertThrows(RotationException.class, () -> manager.forceRotate());

        assertEquals(before.epochId() + 1, ex.attemptedEpochId());
        assertSame(before, manager.current());
        assertEquals(keyBefore, manager.keyMaterial(A).orElseThrow());
        assertEquals(publishedBefore, published.size());
        verify(metrics).onRotationFailed(eq(before.epochId() + 1), any(IllegalStateException.class));

        clock.advanceSeconds(60);
        assertThrows(RotationException.class, () -> manager.tick());
        assertSame(before, manager.current());
    }

    @Test
    void engineMissingAVerdictAbortsRotation() {
        final MembershipEngine engine = mock(MembershipEngine.class);
        when(engine.evaluate(any(), any()))
                .thenAnswer(inv -> new ThresholdMembershipEngine().evaluate(inv.getArgument(0), inv.getArgument(1)))
                .thenReturn(java.util.Map.of());
        manager.close();
        manager = newManager(engine, published::add);

        assertThrows(RotationException.class, () -> manager.forceRotate());
        assertEquals(1, manager.current().epochId());
    }

    @Test
    void publisherFailureDoesNotRollBack() {
        manager.close();
        manager = newManager(new ThresholdMembershipEngine(), snapshot -> {
            if (snapshot.epochId() > 1) {
                throw new PublishException(snapshot.epochId(), "disk full");
            }
        });

        final EpochView view = manager.forceRotate();

        assertEquals(2, view.epochId());
        assertSame(view, manager.current());
        verify(metrics).onPublishFailed(eq(2L), any(PublishException.class));
    }

    @Test
    void closeStopsRotations() {
        manager.close();

        assertTrue(manager.isClosed());
        assertThrows(IllegalStateException.class, () -> manager.forceRotate());
        clock.advanceSeconds(600);
        assertFalse(manager.tick());
        assertEquals(1, manager.current().epochId());
    }
}
