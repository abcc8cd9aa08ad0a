package com.transmissionweb.feeder.dto;

import java.time.LocalDateTime;

public record FeedDTO(
        Long id,
        String name,
        String url,
        String pattern,
        Boolean enabled,
        Integer checkInterval,
        LocalDateTime lastChecked,
        String lastError,
        Integer matchCount,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
