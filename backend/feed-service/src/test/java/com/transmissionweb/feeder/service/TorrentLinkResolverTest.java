package com.transmissionweb.feeder.service;

import com.transmissionweb.feeder.dto.CandidateItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TorrentLinkResolverTest {

    private final TorrentLinkResolver resolver = new TorrentLinkResolver();

    private static CandidateItem item(String link, List<String> enclosures, Map<String, String> custom) {
        return new CandidateItem("Ubuntu 24.04", "guid-1", link, enclosures, custom);
    }

    @Test
    @DisplayName("the item link wins when it is a magnet URI")
    void primaryLinkFirst() {
        CandidateItem candidate = item("magnet:?xt=urn:btih:abc",
                List.of("https://example.com/a.torrent"), Map.of());

        assertThat(resolver.resolve(candidate)).contains("magnet:?xt=urn:btih:abc");
    }

    @Test
    @DisplayName("the first torrent enclosure is used when the link is a web page")
    void enclosureSecond() {
        CandidateItem candidate = item("https://example.com/ubuntu",
                List.of("https://example.com/cover.jpg", "https://example.com/ubuntu.torrent"), Map.of());

        assertThat(resolver.resolve(candidate)).contains("https://example.com/ubuntu.torrent");
    }

    @Test
    @DisplayName("custom fields are consulted last, in document order")
    void customFieldsLast() {
        Map<String, String> custom = new LinkedHashMap<>();
        custom.put("torrent.contentLength", "1000");
        custom.put("torrent.magnetURI", "magnet:?xt=urn:btih:def");
        custom.put("torrent.fileName", "ubuntu.torrent");
        CandidateItem candidate = item("https://example.com/ubuntu", List.of(), custom);

        assertThat(resolver.resolve(candidate)).contains("magnet:?xt=urn:btih:def");
    }

    @Test
    @DisplayName("no usable link yields empty")
    void nothingUsable() {
        CandidateItem candidate = item("https://example.com/ubuntu", List.of("https://example.com/a.iso"), Map.of());

        assertThat(resolver.resolve(candidate)).isEmpty();
    }

    @Test
    @DisplayName("bare prefix or suffix is not a link")
    void barePrefixAndSuffix() {
        assertThat(TorrentLinkResolver.isTorrentLink("magnet:?")).isFalse();
        assertThat(TorrentLinkResolver.isTorrentLink(".torrent")).isFalse();
        assertThat(TorrentLinkResolver.isTorrentLink("a.torrent")).isTrue();
        assertThat(TorrentLinkResolver.isTorrentLink(null)).isFalse();
    }
}
