package com.transmissionweb.feeder.service;

import com.transmissionweb.feeder.config.FeederProperties;
import com.transmissionweb.feeder.dto.FeedCreateRequest;
import com.transmissionweb.feeder.dto.FeedUpdateRequest;
import com.transmissionweb.feeder.entity.Feed;
import com.transmissionweb.feeder.exception.FeedNotFoundException;
import com.transmissionweb.feeder.exception.FeedPersistenceException;
import com.transmissionweb.feeder.repository.DownloadedItemRepository;
import com.transmissionweb.feeder.repository.FeedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeedService {

    private final FeedRepository feedRepository;
    private final DownloadedItemRepository downloadedItemRepository;
    private final FeedPatternMatcher patternMatcher;
    private final FeederProperties feederProperties;

    /**
     * 모든 피드 목록 조회 (ID순)
     */
    @Transactional(readOnly = true)
    public List<Feed> getAllFeeds() {
        return feedRepository.findAllByOrderByIdAsc();
    }

    /**
     * 활성화된 피드 목록 조회 (ID순)
     */
    @Transactional(readOnly = true)
    public List<Feed> getEnabledFeeds() {
        return feedRepository.findByEnabledTrueOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Feed getFeed(Long id) {
        return feedRepository.findById(id)
                .orElseThrow(() -> new FeedNotFoundException(id));
    }

    /**
     * 피드 등록 (패턴이 컴파일되지 않으면 저장하지 않음)
     */
    @Transactional
    public Feed createFeed(FeedCreateRequest request) {
        patternMatcher.validate(request.pattern());
        String url = request.url().trim();
        if (feedRepository.existsByUrl(url)) {
            throw FeedPersistenceException.duplicateUrl(url, null);
        }

        Feed feed = Feed.builder()
                .name(request.name().trim())
                .url(url)
                .pattern(request.pattern())
                .enabled(request.enabled() == null || request.enabled())
                .checkInterval(intervalOrDefault(request.checkInterval()))
                .matchCount(0)
                .build();

        Feed saved = save(feed);
        log.info("Created feed: id={}, name={}, url={}", saved.getId(), saved.getName(), saved.getUrl());
        return saved;
    }

    /**
     * 피드 수정 (요청의 null이 아닌 필드만 반영)
     * 새 패턴은 저장 전에 검증합니다.
     */
    @Transactional
    public Feed updateFeed(Long id, FeedUpdateRequest request) {
        Feed feed = getFeed(id);

        if (request.pattern() != null) {
            patternMatcher.validate(request.pattern());
            feed.setPattern(request.pattern());
        }
        if (request.name() != null && !request.name().isBlank()) {
            feed.setName(request.name().trim());
        }
        if (request.url() != null && !request.url().isBlank()) {
            String url = request.url().trim();
            if (!url.equals(feed.getUrl()) && feedRepository.existsByUrl(url)) {
                throw FeedPersistenceException.duplicateUrl(url, null);
            }
            feed.setUrl(url);
        }
        if (request.enabled() != null) {
            feed.setEnabled(request.enabled());
        }
        if (request.checkInterval() != null) {
            feed.setCheckInterval(intervalOrDefault(request.checkInterval()));
        }

        Feed saved = save(feed);
        log.info("Updated feed: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * 피드 삭제 (다운로드 기록 포함)
     */
    @Transactional
    public void deleteFeed(Long id) {
        Feed feed = getFeed(id);
        int removed = downloadedItemRepository.deleteByFeedId(id);
        feedRepository.delete(feed);
        log.info("Deleted feed: id={}, name={}, history={}", id, feed.getName(), removed);
    }

    public void recordCheckResult(Long id, LocalDateTime checkedAt, int newMatches, String error) {
        int updated = feedRepository.updateCheckResult(id, checkedAt, newMatches, error);
        if (updated == 0) {
            log.warn("Feed {} disappeared before its status could be stored", id);
        }
    }

    public void recordPartialCheckResult(Long id, int newMatches, String error) {
        int updated = feedRepository.updatePartialResult(id, newMatches, error);
        if (updated == 0) {
            log.warn("Feed {} disappeared before its status could be stored", id);
        }
    }

    public void recordCheckError(Long id, LocalDateTime checkedAt, String error) {
        int updated = feedRepository.updateCheckError(id, checkedAt, error);
        if (updated == 0) {
            log.warn("Feed {} disappeared before its error could be stored", id);
        }
    }

    private Feed save(Feed feed) {
        try {
            return feedRepository.saveAndFlush(feed);
        } catch (DataIntegrityViolationException e) {
            throw FeedPersistenceException.duplicateUrl(feed.getUrl(), e);
        }
    }

    private int intervalOrDefault(Integer minutes) {
        if (minutes == null || minutes <= 0) {
            return (int) feederProperties.getDefaultCheckInterval().toMinutes();
        }
        return minutes;
    }
}
