package com.transmissionweb.feeder.service;

import com.transmissionweb.feeder.dto.CandidateItem;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 데몬에 넘길 링크 선택.
 * 아이템 링크 → 첫 enclosure → 확장 필드 순으로, magnet URI 또는 .torrent URL인 첫 값을 사용합니다.
 */
@Component
public class TorrentLinkResolver {

    private static final String MAGNET_PREFIX = "magnet:?";
    private static final String TORRENT_SUFFIX = ".torrent";

    public Optional<String> resolve(CandidateItem item) {
        if (isTorrentLink(item.link())) {
            return Optional.of(item.link());
        }
        for (String enclosure : item.enclosures()) {
            if (isTorrentLink(enclosure)) {
                return Optional.of(enclosure);
            }
        }
        for (String value : item.customFields().values()) {
            if (isTorrentLink(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static boolean isTorrentLink(String link) {
        return isMagnetLink(link) || isTorrentFile(link);
    }

    // 접두사/접미사만 있는 값은 링크로 보지 않음
    static boolean isMagnetLink(String link) {
        return link != null && link.length() > MAGNET_PREFIX.length() && link.startsWith(MAGNET_PREFIX);
    }

    static boolean isTorrentFile(String link) {
        return link != null && link.length() > TORRENT_SUFFIX.length() && link.endsWith(TORRENT_SUFFIX);
    }
}
