package com.transmissionweb.feeder.client.rpc;

import java.util.List;

/**
 * Arguments shared by torrent-start, torrent-stop and torrent-reannounce.
 */
public record TorrentIdsArguments(List<Integer> ids) {

    public TorrentIdsArguments {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("At least one torrent id is required");
        }
        ids = List.copyOf(ids);
    }

    public static TorrentIdsArguments of(int id) {
        return new TorrentIdsArguments(List.of(id));
    }
}
