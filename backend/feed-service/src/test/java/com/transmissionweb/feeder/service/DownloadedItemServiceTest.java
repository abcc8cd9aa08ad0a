package com.transmissionweb.feeder.service;

import com.transmissionweb.feeder.config.FeederProperties;
import com.transmissionweb.feeder.dto.CandidateItem;
import com.transmissionweb.feeder.dto.DownloadedItemDTO;
import com.transmissionweb.feeder.entity.DownloadedItem;
import com.transmissionweb.feeder.entity.Feed;
import com.transmissionweb.feeder.exception.FeedNotFoundException;
import com.transmissionweb.feeder.mapper.EntityMapper;
import com.transmissionweb.feeder.repository.DownloadedItemRepository;
import com.transmissionweb.feeder.repository.FeedRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Pageable;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs without a test transaction so every service call commits on its own, the way the
 * feed check uses it.
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({DownloadedItemService.class, FeedService.class, FeedPatternMatcher.class, EntityMapper.class,
        DownloadedItemServiceTest.Config.class})
class DownloadedItemServiceTest {

    @TestConfiguration
    static class Config {
        @Bean
        FeederProperties feederProperties() {
            return new FeederProperties();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-04-25T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private DownloadedItemService downloadedItemService;

    @Autowired
    private FeedService feedService;

    @Autowired
    private FeedRepository feedRepository;

    @Autowired
    private DownloadedItemRepository downloadedItemRepository;

    private Feed feed;

    @BeforeEach
    void setUp() {
        feed = feedRepository.save(Feed.builder()
                .name("Linux ISOs")
                .url("https://example.com/linux.xml")
                .pattern("^Ubuntu")
                .build());
    }

    @AfterEach
    void tearDown() {
        downloadedItemRepository.deleteAll();
        feedRepository.deleteAll();
    }

    private static CandidateItem candidate(String guid) {
        return new CandidateItem("Ubuntu 24.04 Desktop", guid, "https://example.com/ubuntu", List.of(), Map.of());
    }

    @Nested
    @DisplayName("recordDownload")
    class RecordDownload {

        @Test
        @DisplayName("first insert succeeds and the item is then known")
        void firstInsert() {
            boolean inserted = downloadedItemService.recordDownload(feed.getId(), candidate("g1"), "magnet:?xt=urn:btih:1");

            assertThat(inserted).isTrue();
            assertThat(downloadedItemService.isDownloaded(feed.getId(), "g1")).isTrue();
            assertThat(downloadedItemService.isDownloaded(feed.getId(), "g2")).isFalse();
        }

        @Test
        @DisplayName("the stored title is trimmed")
        void storesTrimmedTitle() {
            CandidateItem padded = new CandidateItem("  Ubuntu 24.04 Server ", "g9", null, List.of(), Map.of());

            downloadedItemService.recordDownload(feed.getId(), padded, "magnet:?xt=urn:btih:9");

            assertThat(downloadedItemService.getRecentDownloads(feed.getId(), 0))
                    .extracting(DownloadedItemDTO::itemTitle)
                    .containsExactly("Ubuntu 24.04 Server");
        }

        @Test
        @DisplayName("second insert of the same pair returns false and leaves one row")
        void duplicateInsert() {
            downloadedItemService.recordDownload(feed.getId(), candidate("g1"), "magnet:?xt=urn:btih:1");

            boolean again = downloadedItemService.recordDownload(feed.getId(), candidate("g1"), "magnet:?xt=urn:btih:1");

            assertThat(again).isFalse();
            assertThat(downloadedItemRepository.findByFeed_IdOrderByDownloadedAtDesc(feed.getId(), Pageable.unpaged())).hasSize(1);
        }

        @Test
        @DisplayName("the same guid under another feed is a separate record")
        void sameGuidOtherFeed() {
            Feed other = feedRepository.save(Feed.builder()
                    .name("Other").url("https://example.com/other.xml").pattern(".*").build());

            downloadedItemService.recordDownload(feed.getId(), candidate("g1"), "magnet:?xt=urn:btih:1");
            boolean inserted = downloadedItemService.recordDownload(other.getId(), candidate("g1"), "magnet:?xt=urn:btih:1");

            assertThat(inserted).isTrue();
        }

        @Test
        @DisplayName("the resolved link is stored when the item has no link")
        void storesResolvedLink() {
            CandidateItem withoutLink = new CandidateItem("Ubuntu", "g9", null, List.of(), Map.of());

            downloadedItemService.recordDownload(feed.getId(), withoutLink, "magnet:?xt=urn:btih:9");

            assertThat(downloadedItemService.getRecentDownloads(feed.getId(), 10))
                    .singleElement()
                    .satisfies(item -> {
                        assertThat(item.itemLink()).isEqualTo("magnet:?xt=urn:btih:9");
                        assertThat(item.downloadedAt()).isEqualTo(LocalDateTime.of(2024, 4, 25, 12, 0));
                    });
        }

        @Test
        @DisplayName("unknown feed is reported")
        void unknownFeed() {
            assertThatThrownBy(() -> downloadedItemService.recordDownload(999_999L, candidate("g1"), "magnet:?x=1"))
                    .isInstanceOf(FeedNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("getRecentDownloads")
    class RecentDownloads {

        private void insert(String guid, LocalDateTime at) {
            downloadedItemRepository.save(DownloadedItem.builder()
                    .feed(feed)
                    .itemGuid(guid)
                    .itemTitle("Item " + guid)
                    .itemLink("https://example.com/" + guid + ".torrent")
                    .downloadedAt(at)
                    .build());
        }

        @Test
        @DisplayName("newest first, limited")
        void newestFirst() {
            LocalDateTime base = LocalDateTime.of(2024, 4, 1, 0, 0);
            insert("old", base);
            insert("newest", base.plusDays(2));
            insert("middle", base.plusDays(1));

            List<DownloadedItemDTO> recent = downloadedItemService.getRecentDownloads(feed.getId(), 2);

            assertThat(recent).extracting(DownloadedItemDTO::itemGuid).containsExactly("newest", "middle");
            assertThat(recent).allSatisfy(item -> assertThat(item.feedId()).isEqualTo(feed.getId()));
        }

        @Test
        @DisplayName("non-positive limit falls back to the default")
        void defaultLimit() {
            LocalDateTime base = LocalDateTime.of(2024, 4, 1, 0, 0);
            for (int i = 0; i < 55; i++) {
                insert("g" + i, base.plusMinutes(i));
            }

            assertThat(downloadedItemService.getRecentDownloads(feed.getId(), 0)).hasSize(50);
            assertThat(downloadedItemService.getRecentDownloads(feed.getId(), -3)).hasSize(50);
        }
    }

    @Test
    @DisplayName("deleting a feed removes its download history")
    void cascadeOnFeedDelete() {
        downloadedItemService.recordDownload(feed.getId(), candidate("g1"), "magnet:?xt=urn:btih:1");
        downloadedItemService.recordDownload(feed.getId(), candidate("g2"), "magnet:?xt=urn:btih:2");

        feedService.deleteFeed(feed.getId());

        assertThat(feedRepository.existsById(feed.getId())).isFalse();
        assertThat(downloadedItemRepository.count()).isZero();
    }
}
