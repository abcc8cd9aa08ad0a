package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Base64;

/**
 * Arguments of torrent-add. Exactly one of {@code filename} (magnet URI or URL) and
 * {@code metainfo} (base64 .torrent content) must be present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TorrentAddArguments(String filename, String metainfo) {

    public TorrentAddArguments {
        boolean hasFilename = filename != null && !filename.isBlank();
        boolean hasMetainfo = metainfo != null && !metainfo.isBlank();
        if (!hasFilename && !hasMetainfo) {
            throw new IllegalArgumentException("No torrent data provided");
        }
        if (hasFilename && hasMetainfo) {
            throw new IllegalArgumentException("Provide either a magnet/URL or torrent metadata, not both");
        }
        filename = hasFilename ? filename.trim() : null;
        metainfo = hasMetainfo ? metainfo : null;
    }

    public static TorrentAddArguments ofUrl(String magnetOrUrl) {
        return new TorrentAddArguments(magnetOrUrl, null);
    }

    public static TorrentAddArguments ofMetainfo(byte[] torrentData) {
        if (torrentData == null || torrentData.length == 0) {
            throw new IllegalArgumentException("No torrent data provided");
        }
        return new TorrentAddArguments(null, Base64.getEncoder().encodeToString(torrentData));
    }
}
