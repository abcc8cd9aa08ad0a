package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * torrent-add reply. The daemon fills exactly one of the two fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TorrentAddResult(
        @JsonProperty("torrent-added") AddedTorrent added,
        @JsonProperty("torrent-duplicate") AddedTorrent duplicate
) {

    @JsonIgnore
    public boolean isDuplicate() {
        return added == null && duplicate != null;
    }

    @JsonIgnore
    public AddedTorrent torrent() {
        return added != null ? added : duplicate;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AddedTorrent(int id, String name, String hashString) {
    }
}
