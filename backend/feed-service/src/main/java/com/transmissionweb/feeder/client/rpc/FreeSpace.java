package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FreeSpace(
        String path,
        @JsonProperty("size-bytes") long sizeBytes,
        @JsonProperty("total_size") long totalSize
) {
}
