package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Peer(
        String address,
        String clientName,
        boolean clientIsChoked,
        boolean clientIsInterested,
        String flagStr,
        @JsonProperty("isDownloadingFrom") boolean isDownloadingFrom,
        @JsonProperty("isEncrypted") boolean isEncrypted,
        @JsonProperty("isIncoming") boolean isIncoming,
        @JsonProperty("isUploadingTo") boolean isUploadingTo,
        @JsonProperty("isUTP") boolean isUTP,
        boolean peerIsChoked,
        boolean peerIsInterested,
        int port,
        double progress,
        long rateToClient,
        long rateToPeer
) {
}
