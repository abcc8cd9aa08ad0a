package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Arguments of torrent-get. A null id list selects every torrent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TorrentGetArguments(List<Integer> ids, List<String> fields) {

    public TorrentGetArguments {
        Objects.requireNonNull(fields, "fields are required");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("torrent-get needs at least one field");
        }
        ids = ids == null ? null : List.copyOf(ids);
        fields = List.copyOf(fields);
    }

    public static TorrentGetArguments allTorrents(List<String> fields) {
        return new TorrentGetArguments(null, fields);
    }

    public static TorrentGetArguments forTorrent(int id, List<String> fields) {
        return new TorrentGetArguments(List.of(id), fields);
    }
}
