package com.transmissionweb.feeder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Feeds registered at startup, configured in application.yml under {@code feeder.seed}.
 */
@Configuration
@ConfigurationProperties(prefix = "feeder.seed")
@Data
public class FeedSeedConfig {

    /**
     * Enable/disable seeding
     */
    private boolean enabled = true;

    private List<FeedEntry> feeds = new ArrayList<>();

    @Data
    public static class FeedEntry {
        private String name;

        /**
         * RSS or Atom document URL. Entries whose URL is already registered are skipped.
         */
        private String url;

        /**
         * Regular expression matched against item titles
         */
        private String pattern;

        private boolean enabled = true;

        private Integer checkIntervalMinutes;
    }
}
