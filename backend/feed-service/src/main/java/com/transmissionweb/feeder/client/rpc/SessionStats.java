package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate counters returned by session-stats.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionStats(
        int activeTorrentCount,
        int pausedTorrentCount,
        int torrentCount,
        long downloadSpeed,
        long uploadSpeed,
        @JsonProperty("cumulative-stats") TransferStats cumulativeStats,
        @JsonProperty("current-stats") TransferStats currentStats
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransferStats(
            long uploadedBytes,
            long downloadedBytes,
            long filesAdded,
            long secondsActive,
            long sessionCount
    ) {
    }
}
