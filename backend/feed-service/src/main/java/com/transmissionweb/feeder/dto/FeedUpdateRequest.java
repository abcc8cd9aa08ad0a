package com.transmissionweb.feeder.dto;

/**
 * Partial update: null fields are left unchanged.
 */
public record FeedUpdateRequest(
        String name,
        String url,
        String pattern,
        Boolean enabled,
        Integer checkInterval
) {
}
