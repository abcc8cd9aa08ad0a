package com.transmissionweb.feeder.controller;

import com.transmissionweb.feeder.client.TransmissionRpcClient;
import com.transmissionweb.feeder.client.rpc.FreeSpace;
import com.transmissionweb.feeder.client.rpc.Peer;
import com.transmissionweb.feeder.client.rpc.PortTestResult;
import com.transmissionweb.feeder.client.rpc.SessionStats;
import com.transmissionweb.feeder.client.rpc.Torrent;
import com.transmissionweb.feeder.client.rpc.TorrentAddArguments;
import com.transmissionweb.feeder.client.rpc.TorrentAddResult;
import com.transmissionweb.feeder.config.TransmissionProperties;
import com.transmissionweb.feeder.dto.TorrentAddRequest;
import com.transmissionweb.feeder.dto.TorrentOverviewDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * 웹 UI용 Transmission 데몬 작업 전달 컨트롤러
 */
@RestController
@RequestMapping("/api/v1/torrents")
@RequiredArgsConstructor
@Slf4j
public class TorrentController {

    private final TransmissionRpcClient rpcClient;
    private final TransmissionProperties transmissionProperties;

    /**
     * GET /api/v1/torrents - 토렌트 목록 및 세션 통계 조회
     */
    @GetMapping
    public ResponseEntity<TorrentOverviewDTO> listTorrents() {
        List<Torrent> torrents = rpcClient.getTorrents();
        SessionStats stats = rpcClient.getSessionStats();
        return ResponseEntity.ok(new TorrentOverviewDTO(torrents, stats));
    }

    @GetMapping("/stats")
    public ResponseEntity<SessionStats> sessionStats() {
        return ResponseEntity.ok(rpcClient.getSessionStats());
    }

    @GetMapping("/port-test")
    public ResponseEntity<PortTestResult> portTest() {
        return ResponseEntity.ok(rpcClient.testPort());
    }

    /**
     * GET /api/v1/torrents/free-space - 여유 공간 조회 (기본값: 설정된 다운로드 디렉터리)
     */
    @GetMapping("/free-space")
    public ResponseEntity<FreeSpace> freeSpace(@RequestParam(required = false) String path) {
        String target = path == null || path.isBlank() ? transmissionProperties.getDownloadDir() : path;
        return ResponseEntity.ok(rpcClient.getFreeSpace(target));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TorrentAddResult> addTorrent(@RequestBody TorrentAddRequest request) {
        TorrentAddResult result = rpcClient.addTorrent(new TorrentAddArguments(request.filename(), request.metainfo()));
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    /**
     * POST /api/v1/torrents/upload - .torrent 파일 업로드로 토렌트 추가
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TorrentAddResult> uploadTorrent(@RequestParam("torrent-file") MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded torrent file", e);
        }
        log.info("Uploading torrent file {} ({} bytes)", file.getOriginalFilename(), content.length);
        return ResponseEntity.status(HttpStatus.CREATED).body(rpcClient.addTorrentByMetainfo(content));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<Void> start(@PathVariable int id) {
        rpcClient.startTorrent(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<Void> stop(@PathVariable int id) {
        rpcClient.stopTorrent(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/reannounce")
    public ResponseEntity<Void> reannounce(@PathVariable int id) {
        rpcClient.reannounceTorrent(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/reannounce")
    public ResponseEntity<Void> reannounceAll() {
        rpcClient.reannounceAll();
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable int id,
                                       @RequestParam(defaultValue = "false") boolean deleteData) {
        rpcClient.removeTorrent(id, deleteData);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/peers")
    public ResponseEntity<List<Peer>> peers(@PathVariable int id) {
        return ResponseEntity.ok(rpcClient.getPeers(id));
    }
}
