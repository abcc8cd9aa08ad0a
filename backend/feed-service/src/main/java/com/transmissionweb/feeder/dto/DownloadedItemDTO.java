package com.transmissionweb.feeder.dto;

import java.time.LocalDateTime;

public record DownloadedItemDTO(
        Long id,
        Long feedId,
        String itemGuid,
        String itemTitle,
        String itemLink,
        LocalDateTime downloadedAt
) {
}
