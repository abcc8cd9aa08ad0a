package com.transmissionweb.feeder.dto;

import com.transmissionweb.feeder.client.rpc.SessionStats;
import com.transmissionweb.feeder.client.rpc.Torrent;

import java.util.List;

public record TorrentOverviewDTO(List<Torrent> torrents, SessionStats stats) {
    public TorrentOverviewDTO {
        torrents = torrents == null ? List.of() : List.copyOf(torrents);
    }
}
