package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Torrent(
        int id,
        String name,
        int status,
        double percentDone,
        long rateDownload,
        long rateUpload,
        double uploadRatio,
        long totalSize,
        long downloadedEver,
        long uploadedEver,
        int peersConnected,
        long eta,
        int error,
        String errorString,
        long addedDate
) {
}
