package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TorrentList(List<Torrent> torrents) {

    public TorrentList {
        torrents = torrents == null ? List.of() : List.copyOf(torrents);
    }
}
