package org.jstats.matchcrawler_api.modules.crawl.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted match detail. Matches are historical facts: a stored record is only ever
 * replaced wholesale by an explicit repair.
 *
 * @param ref          match identifier
 * @param gameStart    start of the game
 * @param duration     game length
 * @param queueId      remote queue id (420 = ranked solo), null if unknown
 * @param gameVersion  patch string reported by the API
 * @param participants participants in payload order
 * @param rawPayload   the remote JSON body as received
 * @param fetchedAt    when the detail was fetched
 */
public record MatchRecord(
        MatchRef ref,
        Instant gameStart,
        Duration duration,
        Integer queueId,
        String gameVersion,
        List<ParticipantRecord> participants,
        String rawPayload,
        Instant fetchedAt
) {

    public MatchRecord {
        Objects.requireNonNull(ref, "ref is required");
        Objects.requireNonNull(gameStart, "gameStart is required");
        Objects.requireNonNull(duration, "duration is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        participants = participants == null ? List.of() : List.copyOf(participants);
        rawPayload = rawPayload == null ? "" : rawPayload;
    }

    public List<PlayerRef> participantRefs() {
        return participants.stream().map(ParticipantRecord::player).toList();
    }

    public long countTeam(int teamId) {
        return participants.stream().filter(p -> p.teamId() == teamId).count();
    }
}
