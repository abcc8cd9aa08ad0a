package com.transmissionweb.feeder.service;

import com.transmissionweb.feeder.client.TransmissionRpcClient;
import com.transmissionweb.feeder.dto.CandidateItem;
import com.transmissionweb.feeder.dto.FeedCheckResult;
import com.transmissionweb.feeder.entity.Feed;
import com.transmissionweb.feeder.exception.FeedFetchException;
import com.transmissionweb.feeder.exception.FeedNotFoundException;
import com.transmissionweb.feeder.exception.FeederException;
import com.transmissionweb.feeder.exception.InvalidPatternException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;

/**
 * 피드 1건 점검 서비스.
 * 피드 조회 → 제목 매칭 → 중복 제외 → 데몬에 토렌트 추가 → 기록 → 피드 상태 저장 순으로 진행합니다.
 *
 * <p>같은 피드의 점검은 겹치지 않습니다. 락은 고정 개수의 스트라이프라 삭제된 피드가 남기는 것이 없습니다.
 * 스케줄러가 점검 중인 피드를 수동 점검하면 끝날 때까지 기다린 뒤 그 기록을 보고 진행합니다.
 * 네트워크 호출 동안에는 트랜잭션을 잡지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedCheckService {

    private static final int MAX_ERROR_DETAILS = 3;
    static final int LOCK_STRIPES = 64;

    private final FeedService feedService;
    private final RssFeedService rssFeedService;
    private final FeedPatternMatcher patternMatcher;
    private final TorrentLinkResolver linkResolver;
    private final DownloadedItemService downloadedItemService;
    private final TransmissionRpcClient rpcClient;
    private final Clock clock;

    // 같은 스트라이프의 다른 피드도 순차 실행됨
    private final ReentrantLock[] checkLocks = createLocks();

    public FeedCheckResult checkFeed(Long feedId) {
        return checkFeed(feedId, () -> false);
    }

    /**
     * @param stopRequested 아이템 사이마다 확인. true가 되면 남은 아이템은 다음 점검으로 넘기고,
     *                      처리한 건수만 반영하며 점검 시각은 갱신하지 않음
     * @throws FeedNotFoundException 해당 ID의 피드가 없을 때
     */
    public FeedCheckResult checkFeed(Long feedId, BooleanSupplier stopRequested) {
        ReentrantLock lock = lockFor(feedId);
        if (lock.isLocked()) {
            log.debug("Feed {} is being checked, waiting", feedId);
        }
        lock.lock();
        try {
            return runCheck(feedService.getFeed(feedId), stopRequested);
        } finally {
            lock.unlock();
        }
    }

    private FeedCheckResult runCheck(Feed feed, BooleanSupplier stopRequested) {
        Long feedId = feed.getId();

        Pattern pattern;
        try {
            pattern = patternMatcher.compile(feed.getPattern());
        } catch (InvalidPatternException e) {
            return recordFailure(feed, e.getMessage());
        }

        List<CandidateItem> items;
        try {
            items = rssFeedService.fetch(feed.getUrl());
        } catch (FeedFetchException e) {
            return recordFailure(feed, e.getMessage());
        }

        log.info("Checking feed '{}' with pattern {}: {} items", feed.getName(), feed.getPattern(), items.size());

        int matched = 0;
        int submitted = 0;
        int skipped = 0;
        List<String> failures = new ArrayList<>();
        boolean completed = true;

        for (CandidateItem item : items) {
            if (stopRequested.getAsBoolean()) {
                log.info("Stop requested, leaving feed '{}' before all items were processed", feed.getName());
                completed = false;
                break;
            }
            if (!patternMatcher.matches(pattern, item.title())) {
                log.debug("No match: {}", item.title());
                continue;
            }
            matched++;

            if (item.guid() == null) {
                log.warn("Skipping matched item without id or title in feed '{}'", feed.getName());
                skipped++;
                continue;
            }
            if (downloadedItemService.isDownloaded(feedId, item.guid())) {
                log.debug("Already downloaded: {}", item.title());
                skipped++;
                continue;
            }

            Optional<String> link = linkResolver.resolve(item);
            if (link.isEmpty()) {
                log.info("No torrent link found for: {}", item.title());
                skipped++;
                continue;
            }

            try {
                rpcClient.addTorrentByUrl(link.get());
            } catch (FeederException e) {
                log.warn("Failed to add torrent {}: {}", item.title(), e.getMessage());
                failures.add(item.title() + ": " + e.getMessage());
                continue;
            }

            try {
                if (downloadedItemService.recordDownload(feedId, item, link.get())) {
                    submitted++;
                    log.info("Added torrent from feed '{}': {}", feed.getName(), item.title());
                } else {
                    skipped++;
                }
            } catch (DataAccessException | FeedNotFoundException e) {
                // 제출은 됐지만 기록 실패: 다음 점검에서 다시 제출될 수 있음
                log.warn("Failed to record downloaded item {}: {}", item.title(), e.getMessage());
            }
        }

        LocalDateTime checkedAt = LocalDateTime.now(clock);
        String error = summarize(failures);
        if (completed) {
            feedService.recordCheckResult(feedId, checkedAt, submitted, error);
        } else {
            feedService.recordPartialCheckResult(feedId, submitted, error);
        }

        return new FeedCheckResult(feedId, checkedAt, items.size(), matched, submitted, skipped, failures.size(), error);
    }

    ReentrantLock lockFor(Long feedId) {
        return checkLocks[Math.floorMod(feedId.hashCode(), LOCK_STRIPES)];
    }

    private static ReentrantLock[] createLocks() {
        ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }

    private FeedCheckResult recordFailure(Feed feed, String error) {
        LocalDateTime checkedAt = LocalDateTime.now(clock);
        log.warn("Check of feed '{}' failed: {}", feed.getName(), error);
        feedService.recordCheckError(feed.getId(), checkedAt, error);
        return FeedCheckResult.failed(feed.getId(), checkedAt, error);
    }

    private static String summarize(List<String> failures) {
        if (failures.isEmpty()) {
            return null;
        }
        StringBuilder summary = new StringBuilder()
                .append(failures.size())
                .append(failures.size() == 1 ? " torrent could not be added: " : " torrents could not be added: ");
        summary.append(String.join("; ", failures.subList(0, Math.min(MAX_ERROR_DETAILS, failures.size()))));
        if (failures.size() > MAX_ERROR_DETAILS) {
            summary.append("; ...");
        }
        return summary.toString();
    }
}
