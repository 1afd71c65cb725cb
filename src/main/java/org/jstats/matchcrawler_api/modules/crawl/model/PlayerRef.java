package org.jstats.matchcrawler_api.modules.crawl.model;

import java.util.Objects;

/**
 * Opaque identifier of a player in the remote system.
 *
 * @param region platform region / shard the player belongs to (e.g. euw1)
 * @param id     remote player id (Riot PUUID)
 */
public record PlayerRef(String region, String id) {

    public PlayerRef {
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(id, "id is required");
    }

    @Override
    public String toString() {
        return region + "/" + id;
    }
}
