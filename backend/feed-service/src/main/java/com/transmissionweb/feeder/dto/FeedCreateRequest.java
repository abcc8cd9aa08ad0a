package com.transmissionweb.feeder.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * A missing or non-positive check interval falls back to the configured default.
 */
public record FeedCreateRequest(
        @NotBlank(message = "Name is required") String name,
        @NotBlank(message = "URL is required") String url,
        @NotBlank(message = "Pattern is required") String pattern,
        Boolean enabled,
        Integer checkInterval
) {
    public FeedCreateRequest {
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }
}
