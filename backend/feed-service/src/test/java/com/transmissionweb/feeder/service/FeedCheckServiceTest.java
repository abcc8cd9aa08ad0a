package com.transmissionweb.feeder.service;

import com.transmissionweb.feeder.client.TransmissionRpcClient;
import com.transmissionweb.feeder.dto.CandidateItem;
import com.transmissionweb.feeder.dto.FeedCheckResult;
import com.transmissionweb.feeder.entity.Feed;
import com.transmissionweb.feeder.exception.FeedFetchException;
import com.transmissionweb.feeder.exception.FeedNotFoundException;
import com.transmissionweb.feeder.exception.RpcTransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedCheckServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 4, 25, 12, 0);

    @Mock
    private FeedService feedService;

    @Mock
    private RssFeedService rssFeedService;

    @Mock
    private DownloadedItemService downloadedItemService;

    @Mock
    private TransmissionRpcClient rpcClient;

    private FeedCheckService feedCheckService;

    private Feed feed;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-04-25T12:00:00Z"), ZoneOffset.UTC);
        feedCheckService = new FeedCheckService(feedService, rssFeedService, new FeedPatternMatcher(),
                new TorrentLinkResolver(), downloadedItemService, rpcClient, clock);

        feed = Feed.builder()
                .id(1L)
                .name("Linux ISOs")
                .url("https://example.com/linux.xml")
                .pattern("^Ubuntu")
                .matchCount(3)
                .build();
    }

    private static CandidateItem item(String title, String guid, String link) {
        return new CandidateItem(title, guid, link, List.of(), Map.of());
    }

    @Test
    @DisplayName("matching new item is submitted, recorded and counted")
    void submitsMatchingItem() {
        // given
        when(feedService.getFeed(1L)).thenReturn(feed);
        when(rssFeedService.fetch(feed.getUrl())).thenReturn(List.of(
                item("Ubuntu 24.04 Desktop", "u1", "magnet:?xt=urn:btih:u1"),
                item("Debian 12 Netinst", "d1", "magnet:?xt=urn:btih:d1")));
        when(downloadedItemService.isDownloaded(1L, "u1")).thenReturn(false);
        when(downloadedItemService.recordDownload(eq(1L), any(), eq("magnet:?xt=urn:btih:u1"))).thenReturn(true);

        // when
        FeedCheckResult result = feedCheckService.checkFeed(1L);

        // then
        verify(rpcClient).addTorrentByUrl("magnet:?xt=urn:btih:u1");
        verify(rpcClient, never()).addTorrentByUrl("magnet:?xt=urn:btih:d1");
        verify(feedService).recordCheckResult(1L, NOW, 1, null);
        assertThat(result.itemsFound()).isEqualTo(2);
        assertThat(result.matched()).isEqualTo(1);
        assertThat(result.submitted()).isEqualTo(1);
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("already downloaded item is skipped without contacting the daemon")
    void skipsDuplicate() {
        when(feedService.getFeed(1L)).thenReturn(feed);
        when(rssFeedService.fetch(feed.getUrl())).thenReturn(List.of(
                item("Ubuntu 24.04 Desktop", "u1", "magnet:?xt=urn:btih:u1")));
        when(downloadedItemService.isDownloaded(1L, "u1")).thenReturn(true);

        FeedCheckResult result = feedCheckService.checkFeed(1L);

        verifyNoInteractions(rpcClient);
        verify(downloadedItemService, never()).recordDownload(any(), any(), any());
        verify(feedService).recordCheckResult(1L, NOW, 0, null);
        assertThat(result.skipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("fetch failure records the error and leaves the count alone")
    void fetchFailure() {
        // given
        when(feedService.getFeed(1L)).thenReturn(feed);
        when(rssFeedService.fetch(feed.getUrl()))
                .thenThrow(FeedFetchException.network(feed.getUrl(), new IOException("connection reset")));

        // when
        FeedCheckResult result = feedCheckService.checkFeed(1L);

        // then
        ArgumentCaptor<String> error = ArgumentCaptor.forClass(String.class);
        verify(feedService).recordCheckError(eq(1L), eq(NOW), error.capture());
        assertThat(error.getValue()).contains("connection reset");
        verify(feedService, never()).recordCheckResult(any(), any(), anyInt(), any());
        verifyNoInteractions(rpcClient);
        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    @DisplayName("stored invalid pattern is reported as a feed error")
    void invalidStoredPattern() {
        feed.setPattern("(unterminated");
        when(feedService.getFeed(1L)).thenReturn(feed);

        FeedCheckResult result = feedCheckService.checkFeed(1L);

        verify(feedService).recordCheckError(eq(1L), eq(NOW), anyString());
        verifyNoInteractions(rssFeedService);
        assertThat(result.error()).contains("Invalid regex pattern");
    }

    @Test
    @DisplayName("submission failure is counted and the remaining items are still processed")
    void submissionFailureContinues() {
        // given
        when(feedService.getFeed(1L)).thenReturn(feed);
        when(rssFeedService.fetch(feed.getUrl())).thenReturn(List.of(
                item("Ubuntu 22.04", "u0", "magnet:?xt=urn:btih:u0"),
                item("Ubuntu 24.04", "u1", "magnet:?xt=urn:btih:u1")));
        when(downloadedItemService.isDownloaded(eq(1L), anyString())).thenReturn(false);
        when(rpcClient.addTorrentByUrl("magnet:?xt=urn:btih:u0"))
                .thenThrow(RpcTransportException.httpError("torrent-add", 502));
        when(downloadedItemService.recordDownload(eq(1L), any(), eq("magnet:?xt=urn:btih:u1"))).thenReturn(true);

        // when
        FeedCheckResult result = feedCheckService.checkFeed(1L);

        // then
        verify(rpcClient).addTorrentByUrl("magnet:?xt=urn:btih:u1");
        verify(downloadedItemService, never()).recordDownload(eq(1L), any(), eq("magnet:?xt=urn:btih:u0"));
        ArgumentCaptor<String> error = ArgumentCaptor.forClass(String.class);
        verify(feedService).recordCheckResult(eq(1L), eq(NOW), eq(1), error.capture());
        assertThat(error.getValue()).startsWith("1 torrent could not be added").contains("Ubuntu 22.04");
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.submitted()).isEqualTo(1);
    }

    @Test
    @DisplayName("item without a torrent link is skipped")
    void noLink() {
        when(feedService.getFeed(1L)).thenReturn(feed);
        when(rssFeedService.fetch(feed.getUrl())).thenReturn(List.of(
                item("Ubuntu 24.04", "u1", "https://example.com/ubuntu")));
        when(downloadedItemService.isDownloaded(1L, "u1")).thenReturn(false);

        FeedCheckResult result = feedCheckService.checkFeed(1L);

        verifyNoInteractions(rpcClient);
        verify(feedService).recordCheckResult(1L, NOW, 0, null);
        assertThat(result.skipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("record failure after submission is logged and not counted")
    void recordFailure() {
        when(feedService.getFeed(1L)).thenReturn(feed);
        when(rssFeedService.fetch(feed.getUrl())).thenReturn(List.of(
                item("Ubuntu 24.04", "u1", "magnet:?xt=urn:btih:u1")));
        when(downloadedItemService.isDownloaded(1L, "u1")).thenReturn(false);
        when(downloadedItemService.recordDownload(eq(1L), any(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("database locked"));

        FeedCheckResult result = feedCheckService.checkFeed(1L);

        verify(rpcClient).addTorrentByUrl("magnet:?xt=urn:btih:u1");
        verify(feedService).recordCheckResult(1L, NOW, 0, null);
        assertThat(result.submitted()).isZero();
    }

    @Test
    @DisplayName("insert conflict is treated as already downloaded")
    void insertConflict() {
        when(feedService.getFeed(1L)).thenReturn(feed);
        when(rssFeedService.fetch(feed.getUrl())).thenReturn(List.of(
                item("Ubuntu 24.04", "u1", "magnet:?xt=urn:btih:u1")));
        when(downloadedItemService.isDownloaded(1L, "u1")).thenReturn(false);
        when(downloadedItemService.recordDownload(eq(1L), any(), anyString())).thenReturn(false);

        FeedCheckResult result = feedCheckService.checkFeed(1L);

        verify(feedService).recordCheckResult(1L, NOW, 0, null);
        assertThat(result.skipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("stop request ends the item loop and stores the count without advancing the check time")
    void stopBetweenItems() {
        when(feedService.getFeed(1L)).thenReturn(feed);
        when(rssFeedService.fetch(feed.getUrl())).thenReturn(List.of(
                item("Ubuntu 22.04", "u0", "magnet:?xt=urn:btih:u0"),
                item("Ubuntu 24.04", "u1", "magnet:?xt=urn:btih:u1")));
        when(downloadedItemService.isDownloaded(1L, "u0")).thenReturn(false);
        when(downloadedItemService.recordDownload(eq(1L), any(), anyString())).thenReturn(true);
        AtomicInteger polls = new AtomicInteger();

        FeedCheckResult result = feedCheckService.checkFeed(1L, () -> polls.incrementAndGet() > 1);

        verify(rpcClient, times(1)).addTorrentByUrl(anyString());
        verify(feedService, times(1)).recordPartialCheckResult(1L, 1, null);
        verify(feedService, never()).recordCheckResult(anyLong(), any(), anyInt(), any());
        assertThat(result.submitted()).isEqualTo(1);
    }

    @Test
    @DisplayName("locks come from a fixed set of stripes and are released after each check")
    void boundedLocks() {
        Set<ReentrantLock> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (long id = 1; id <= 10_000; id++) {
            locks.add(feedCheckService.lockFor(id));
        }
        assertThat(locks).hasSize(FeedCheckService.LOCK_STRIPES);
        assertThat(feedCheckService.lockFor(42L)).isSameAs(feedCheckService.lockFor(42L));

        when(feedService.getFeed(9L)).thenThrow(new FeedNotFoundException(9L));
        assertThatThrownBy(() -> feedCheckService.checkFeed(9L)).isInstanceOf(FeedNotFoundException.class);
        assertThat(feedCheckService.lockFor(9L).isLocked()).isFalse();
    }

    @Test
    @DisplayName("unknown feed is not found")
    void unknownFeed() {
        when(feedService.getFeed(9L)).thenThrow(new FeedNotFoundException(9L));

        assertThatThrownBy(() -> feedCheckService.checkFeed(9L))
                .isInstanceOf(FeedNotFoundException.class);
        verifyNoInteractions(rssFeedService);
    }
}
