package com.transmissionweb.feeder.client.rpc;

public record FreeSpaceArguments(String path) {

    public FreeSpaceArguments {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
    }
}
