package com.transmissionweb.feeder.controller;

import com.transmissionweb.feeder.dto.DownloadedItemDTO;
import com.transmissionweb.feeder.dto.FeedCheckResult;
import com.transmissionweb.feeder.dto.FeedCreateRequest;
import com.transmissionweb.feeder.dto.FeedDTO;
import com.transmissionweb.feeder.dto.FeedUpdateRequest;
import com.transmissionweb.feeder.mapper.EntityMapper;
import com.transmissionweb.feeder.service.DownloadedItemService;
import com.transmissionweb.feeder.service.FeedCheckService;
import com.transmissionweb.feeder.service.FeedService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/feeds")
@RequiredArgsConstructor
public class FeedController {

    private final FeedService feedService;
    private final FeedCheckService feedCheckService;
    private final DownloadedItemService downloadedItemService;
    private final EntityMapper entityMapper;

    /**
     * GET /api/v1/feeds - 모든 피드 목록 조회
     */
    @GetMapping
    public ResponseEntity<List<FeedDTO>> listFeeds() {
        List<FeedDTO> feeds = feedService.getAllFeeds().stream()
                .map(entityMapper::toDTO)
                .collect(Collectors.toList());
        return ResponseEntity.ok(feeds);
    }

    /**
     * GET /api/v1/feeds/{id} - ID로 피드 조회
     */
    @GetMapping("/{id}")
    public ResponseEntity<FeedDTO> getFeed(@PathVariable Long id) {
        return ResponseEntity.ok(entityMapper.toDTO(feedService.getFeed(id)));
    }

    /**
     * POST /api/v1/feeds - 새로운 피드 등록
     */
    @PostMapping
    public ResponseEntity<FeedDTO> createFeed(@Valid @RequestBody FeedCreateRequest request) {
        FeedDTO created = entityMapper.toDTO(feedService.createFeed(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /**
     * PUT /api/v1/feeds/{id} - 피드 수정
     */
    @PutMapping("/{id}")
    public ResponseEntity<FeedDTO> updateFeed(@PathVariable Long id, @RequestBody FeedUpdateRequest request) {
        return ResponseEntity.ok(entityMapper.toDTO(feedService.updateFeed(id, request)));
    }

    /**
     * DELETE /api/v1/feeds/{id} - 피드 및 다운로드 기록 삭제
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteFeed(@PathVariable Long id) {
        feedService.deleteFeed(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/feeds/{id}/check - 즉시 점검 실행 (완료까지 대기)
     */
    @PostMapping("/{id}/check")
    public ResponseEntity<FeedCheckResult> checkFeed(@PathVariable Long id) {
        return ResponseEntity.ok(feedCheckService.checkFeed(id));
    }

    /**
     * GET /api/v1/feeds/{id}/items - 최근 다운로드 기록 조회
     */
    @GetMapping("/{id}/items")
    public ResponseEntity<List<DownloadedItemDTO>> recentItems(
            @PathVariable Long id,
            @RequestParam(defaultValue = "0") int limit) {
        return ResponseEntity.ok(downloadedItemService.getRecentDownloads(id, limit));
    }
}
