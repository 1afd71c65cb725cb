package org.jstats.matchcrawler_api.modules.crawl.remote;

import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;

import java.time.Duration;
import java.util.List;

/**
 * Gateway to the remote match API. A single instance is the rate-limit gate for every
 * caller: implementations throttle themselves, and a rate-limit signal pauses all callers.
 */
public interface RemoteMatchClient {

    /**
     * Match ids of a player inside the window. An empty list is a valid answer.
     *
     * @throws NotFoundException       the player is unknown to the remote API
     * @throws RateLimitedException    quota exhausted; retry after {@link RateLimitedException#retryAfter}
     * @throws TransientException      network failure or 5xx
     * @throws UpstreamRejectedException credentials rejected (401/403)
     */
    List<MatchRef> listMatchIds(PlayerRef player, MatchWindow window);

    /**
     * Full detail of a match.
     *
     * @throws NotFoundException       the match expired from the remote retention window; never retry
     * @throws RateLimitedException    quota exhausted; retry after {@link RateLimitedException#retryAfter}
     * @throws TransientException      network failure or 5xx
     * @throws UpstreamPayloadException body could not be parsed
     * @throws UpstreamRejectedException credentials rejected (401/403)
     */
    MatchRecord fetchMatch(MatchRef match);

    /**
     * Players of a ranked ladder tier (challenger, grandmaster, master), used for seeding.
     * Never fails: an unreachable ladder yields an empty list.
     */
    List<PlayerRef> listLadderPlayers(String tier);

    // ---------- error taxonomy ----------

    class RemoteClientException extends RuntimeException {
        public RemoteClientException(String message) { super(message); }
        public RemoteClientException(String message, Throwable cause) { super(message, cause); }
    }

    final class NotFoundException extends RemoteClientException {
        public NotFoundException(String message) { super(message); }
    }

    final class RateLimitedException extends RemoteClientException {
        public final Duration retryAfter;
        public RateLimitedException(Duration retryAfter) {
            super("Rate limited, retry after " + retryAfter.toMillis() + "ms");
            this.retryAfter = retryAfter;
        }
    }

    final class TransientException extends RemoteClientException {
        public TransientException(String message) { super(message); }
        public TransientException(String message, Throwable cause) { super(message, cause); }
    }

    final class UpstreamRejectedException extends RemoteClientException {
        public final int status;
        public UpstreamRejectedException(int status, String message) {
            super(message);
            this.status = status;
        }
    }

    final class UpstreamPayloadException extends RemoteClientException {
        public UpstreamPayloadException(String message) { super(message); }
    }
}
