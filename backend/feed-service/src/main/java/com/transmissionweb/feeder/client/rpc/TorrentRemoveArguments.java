package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TorrentRemoveArguments(
        List<Integer> ids,
        @JsonProperty("delete-local-data") boolean deleteLocalData
) {

    public TorrentRemoveArguments {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("At least one torrent id is required");
        }
        ids = List.copyOf(ids);
    }

    public static TorrentRemoveArguments of(int id, boolean deleteLocalData) {
        return new TorrentRemoveArguments(List.of(id), deleteLocalData);
    }
}
