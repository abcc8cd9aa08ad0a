package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * torrent-get reply projected to the id and peers fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TorrentPeers(List<Entry> torrents) {

    public TorrentPeers {
        torrents = torrents == null ? List.of() : List.copyOf(torrents);
    }

    public List<Peer> firstPeers() {
        if (torrents.isEmpty() || torrents.get(0).peers() == null) {
            return List.of();
        }
        return torrents.get(0).peers();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(int id, List<Peer> peers) {
    }
}
