package com.wordduel.session;

import com.wordduel.domain.DomainModels.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class SessionModels {
    public record ParticipantView(String playerId, int score, int joinOrder) {}

    /**
     * What a client may see of a session. The secret word is left out.
     */
    public record SessionView(long id,
                              String creatorId,
                              Difficulty difficulty,
                              String mask,
                              SessionStatus status,
                              String currentTurn,
                              List<ParticipantView> participants,
                              Instant startTime,
                              Instant endTime,
                              Long secondsRemaining,
                              boolean timedOut,
                              CompletionReason completionReason,
                              Instant createdAt,
                              Instant updatedAt) {

        public static SessionView of(SessionSnapshot snapshot, Instant now) {
            Session s = snapshot.session();
            Long remaining = null;
            if (s.status() == SessionStatus.ACTIVE && s.endTime() != null) {
                remaining = now.isAfter(s.endTime()) ? 0L : Duration.between(now, s.endTime()).getSeconds();
            }
            return new SessionView(s.id(), s.creatorId(), s.difficulty(), s.mask(), s.status(), s.currentTurn(),
                    snapshot.participants().stream()
                            .map(p -> new ParticipantView(p.playerId(), p.score(), p.joinOrder()))
                            .toList(),
                    s.startTime(), s.endTime(), remaining, s.timedOut(), s.completionReason(), s.createdAt(), s.updatedAt());
        }
    }

    public record JoinResult(ParticipantView participant, SessionView session) {}
}
