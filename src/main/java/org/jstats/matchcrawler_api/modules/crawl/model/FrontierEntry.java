package org.jstats.matchcrawler_api.modules.crawl.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of discovery work, keyed by (kind, region, refId).
 *
 * @param id           storage id, null until persisted
 * @param kind         what the ref points at
 * @param region       region of the ref
 * @param refId        remote id of the player or match
 * @param discoveredAt when the ref was first seen; FIFO key within a kind
 * @param attempts     transient failures so far
 * @param state        lifecycle state
 * @param notBefore    earliest instant the entry may be claimed again
 * @param claimedAt    when the current claim was taken, null unless in flight
 * @param lastError    reason of the last failure or requeue
 */
public record FrontierEntry(
        Long id,
        EntityKind kind,
        String region,
        String refId,
        Instant discoveredAt,
        int attempts,
        FrontierState state,
        Instant notBefore,
        Instant claimedAt,
        String lastError
) {

    public FrontierEntry {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(refId, "refId is required");
        Objects.requireNonNull(discoveredAt, "discoveredAt is required");
        Objects.requireNonNull(state, "state is required");
        notBefore = notBefore == null ? discoveredAt : notBefore;
    }

    public static FrontierEntry discovered(PlayerRef player, Instant now) {
        return new FrontierEntry(null, EntityKind.PLAYER, player.region(), player.id(),
                now, 0, FrontierState.PENDING, now, null, null);
    }

    public static FrontierEntry discovered(MatchRef match, Instant now) {
        return new FrontierEntry(null, EntityKind.MATCH, match.region(), match.id(),
                now, 0, FrontierState.PENDING, now, null, null);
    }

    public PlayerRef playerRef() {
        if (kind != EntityKind.PLAYER) {
            throw new IllegalStateException("Not a player entry: " + this);
        }
        return new PlayerRef(region, refId);
    }

    public MatchRef matchRef() {
        if (kind != EntityKind.MATCH) {
            throw new IllegalStateException("Not a match entry: " + this);
        }
        return new MatchRef(region, refId);
    }

    public FrontierEntry withAttempts(int newAttempts) {
        return new FrontierEntry(id, kind, region, refId, discoveredAt, newAttempts, state, notBefore, claimedAt, lastError);
    }

    public String key() {
        return kind + ":" + region + "/" + refId;
    }
}
