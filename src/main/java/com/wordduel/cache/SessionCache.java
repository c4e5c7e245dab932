package com.wordduel.cache;

import com.wordduel.config.GameProperties;
import com.wordduel.domain.DomainModels.Participant;
import com.wordduel.domain.DomainModels.SessionSnapshot;
import com.wordduel.domain.DomainModels.SessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Player -> active session pointers and session -> last materialized snapshot. Best effort only: a hit is
 * checked against the snapshot's status and membership, and writes re-read the durable store anyway.
 */
@Slf4j
@Component
public class SessionCache {
    private final TtlCache<String, OptionalLong> pointers;
    private final TtlCache<Long, SessionSnapshot> snapshots;
    private final GameProperties.Cache settings;

    public SessionCache(GameProperties properties, Clock clock) {
        this.settings = properties.cache();
        this.pointers = new TtlCache<>(clock, settings.pointerTtl());
        this.snapshots = new TtlCache<>(clock, settings.snapshotTtl());
    }

    /**
     * Read path for a player's active session. A cached miss answers empty without consulting {@code loader}.
     */
    public Optional<SessionSnapshot> activeSession(String playerId, Function<String, Optional<SessionSnapshot>> loader) {
        Optional<OptionalLong> pointer = guarded(() -> pointers.get(playerId), Optional.empty());
        if (pointer.isPresent()) {
            if (pointer.get().isEmpty()) {
                return Optional.empty();
            }
            long sessionId = pointer.get().getAsLong();
            Optional<SessionSnapshot> cached = guarded(() -> snapshots.get(sessionId), Optional.empty());
            if (cached.isPresent() && isActiveFor(cached.get(), playerId)) {
                return cached;
            }
            log.debug("Stale cache entry for player {} -> session {}", playerId, sessionId);
            guarded(() -> {
                pointers.invalidate(playerId);
                snapshots.invalidate(sessionId);
                return null;
            }, null);
        }

        Optional<SessionSnapshot> loaded = loader.apply(playerId);
        if (loaded.isPresent()) {
            refresh(loaded.get());
        } else {
            guarded(() -> {
                pointers.put(playerId, OptionalLong.empty(), settings.negativeTtl());
                return null;
            }, null);
        }
        return loaded;
    }

    public Optional<SessionSnapshot> snapshot(long sessionId) {
        return guarded(() -> snapshots.get(sessionId), Optional.empty());
    }

    /**
     * Stores the new snapshot of an active session, or evicts everything about a completed one.
     */
    public void refresh(SessionSnapshot snapshot) {
        if (snapshot.session().status() == SessionStatus.COMPLETED) {
            evict(snapshot);
            return;
        }
        guarded(() -> {
            snapshots.put(snapshot.id(), snapshot);
            if (snapshot.session().status() == SessionStatus.ACTIVE) {
                for (Participant p : snapshot.participants()) {
                    pointers.put(p.playerId(), OptionalLong.of(snapshot.id()));
                }
            }
            return null;
        }, null);
    }

    public void evict(SessionSnapshot snapshot) {
        guarded(() -> {
            snapshots.invalidate(snapshot.id());
            for (Participant p : snapshot.participants()) {
                pointers.invalidate(p.playerId());
            }
            pointers.purgeExpired();
            snapshots.purgeExpired();
            return null;
        }, null);
    }

    private boolean isActiveFor(SessionSnapshot snapshot, String playerId) {
        return snapshot.session().status() == SessionStatus.ACTIVE && snapshot.isParticipant(playerId);
    }

    private <T> T guarded(Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.warn("Session cache unavailable, falling back to the store", e);
            return fallback;
        }
    }
}
