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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 피드별로 데몬에 이미 넘긴 아이템 기록 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadedItemService {

    private final DownloadedItemRepository downloadedItemRepository;
    private final FeedRepository feedRepository;
    private final EntityMapper entityMapper;
    private final FeederProperties feederProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean isDownloaded(Long feedId, String itemGuid) {
        return downloadedItemRepository.existsByFeed_IdAndItemGuid(feedId, itemGuid);
    }

    /**
     * (피드, guid) 기록 저장.
     * 짧은 개별 트랜잭션에서 실행되며, 유니크 제약 위반 시(이미 기록됨) false를 반환합니다.
     *
     * @param resolvedLink 실제로 제출한 링크 (아이템 자체 링크가 없을 때 저장)
     */
    public boolean recordDownload(Long feedId, CandidateItem item, String resolvedLink) {
        Feed feed = feedRepository.findById(feedId)
                .orElseThrow(() -> new FeedNotFoundException(feedId));

        DownloadedItem downloaded = DownloadedItem.builder()
                .feed(feed)
                .itemGuid(item.guid())
                .itemTitle(item.title() != null ? item.title().trim() : "")
                .itemLink(item.link() != null ? item.link() : resolvedLink)
                .downloadedAt(LocalDateTime.now(clock))
                .build();

        try {
            downloadedItemRepository.saveAndFlush(downloaded);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Item already recorded for feed {}: {}", feedId, item.guid());
            return false;
        }
    }

    /**
     * 피드의 최근 다운로드 목록 조회 (최신순)
     * limit이 0 이하이면 기본값, 최대값을 넘으면 최대값으로 제한
     */
    @Transactional(readOnly = true)
    public List<DownloadedItemDTO> getRecentDownloads(Long feedId, int limit) {
        if (!feedRepository.existsById(feedId)) {
            throw new FeedNotFoundException(feedId);
        }
        FeederProperties.Downloads downloads = feederProperties.getDownloads();
        int effective = limit <= 0 ? downloads.getDefaultLimit() : Math.min(limit, downloads.getMaxLimit());

        PageRequest page = PageRequest.of(0, effective);
        return downloadedItemRepository.findByFeed_IdOrderByDownloadedAtDesc(feedId, page).stream()
                .map(entityMapper::toDTO)
                .collect(Collectors.toList());
    }
}
