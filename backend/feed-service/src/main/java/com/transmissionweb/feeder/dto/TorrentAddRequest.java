package com.transmissionweb.feeder.dto;

/**
 * Body of POST /api/v1/torrents: a magnet/URL in {@code filename} or base64 .torrent content in
 * {@code metainfo}.
 */
public record TorrentAddRequest(String filename, String metainfo) {
}
