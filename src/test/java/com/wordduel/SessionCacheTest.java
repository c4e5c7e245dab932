package com.wordduel;

import com.wordduel.cache.SessionCache;
import com.wordduel.config.GameProperties;
import com.wordduel.domain.DomainModels.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class SessionCacheTest {
    private static final Instant T0 = MutableClock.BASE;

    private MutableClock clock;
    private SessionCache cache;
    private AtomicInteger loads;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new SessionCache(GameProperties.defaults(), clock);
        loads = new AtomicInteger();
    }

    @Test
    void storeLookupPopulatesPointersForEveryParticipant() {
        SessionSnapshot active = snapshot(SessionStatus.ACTIVE);

        assertEquals(Optional.of(active), cache.activeSession("alice", loader(Optional.of(active))));
        assertEquals(Optional.of(active), cache.activeSession("alice", loader(Optional.of(active))));
        assertEquals(Optional.of(active), cache.activeSession("bob", loader(Optional.of(active))));
        assertEquals(1, loads.get());
    }

    @Test
    void missIsRememberedForSixtySeconds() {
        assertTrue(cache.activeSession("carol", loader(Optional.empty())).isEmpty());
        clock.advance(Duration.ofSeconds(59));
        assertTrue(cache.activeSession("carol", loader(Optional.empty())).isEmpty());
        assertEquals(1, loads.get());

        clock.advance(Duration.ofSeconds(2));
        cache.activeSession("carol", loader(Optional.empty()));
        assertEquals(2, loads.get());
    }

    @Test
    void activationOverridesRememberedMiss() {
        cache.activeSession("alice", loader(Optional.empty()));
        SessionSnapshot active = snapshot(SessionStatus.ACTIVE);
        cache.refresh(active);

        assertEquals(Optional.of(active), cache.activeSession("alice", loader(Optional.empty())));
        assertEquals(1, loads.get());
    }

    @Test
    void completedSessionIsEvictedForAllParticipants() {
        SessionSnapshot active = snapshot(SessionStatus.ACTIVE);
        cache.refresh(active);
        cache.refresh(snapshot(SessionStatus.COMPLETED));

        assertTrue(cache.snapshot(active.id()).isEmpty());
        cache.activeSession("alice", loader(Optional.empty()));
        cache.activeSession("bob", loader(Optional.empty()));
        assertEquals(2, loads.get());
    }

    @Test
    void staleSnapshotFallsThroughToStore() {
        cache.refresh(snapshot(SessionStatus.ACTIVE));
        cache.refresh(snapshot(SessionStatus.WAITING));

        assertTrue(cache.activeSession("alice", loader(Optional.empty())).isEmpty());
        assertEquals(1, loads.get());
        assertTrue(cache.snapshot(42L).isEmpty());
    }

    @Test
    void snapshotsExpireAfterFifteenMinutes() {
        cache.refresh(snapshot(SessionStatus.ACTIVE));
        clock.advance(Duration.ofMinutes(14));
        assertTrue(cache.snapshot(42L).isPresent());
        clock.advance(Duration.ofMinutes(2));
        assertTrue(cache.snapshot(42L).isEmpty());
    }

    private Function<String, Optional<SessionSnapshot>> loader(Optional<SessionSnapshot> result) {
        return playerId -> {
            loads.incrementAndGet();
            return result;
        };
    }

    private static SessionSnapshot snapshot(SessionStatus status) {
        Session s = new Session(42L, "alice", Difficulty.EASY, "GAME", "_A__", status, "alice", T0,
                T0.plus(Duration.ofMinutes(10)), status == SessionStatus.COMPLETED ? CompletionReason.TIMED_OUT : null,
                "a", 1L, T0, T0);
        return new SessionSnapshot(s, List.of(
                new Participant(42L, "alice", 20, 0, T0),
                new Participant(42L, "bob", 0, 1, T0)));
    }
}
