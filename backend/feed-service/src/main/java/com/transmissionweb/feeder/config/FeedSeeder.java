package com.transmissionweb.feeder.config;

import com.transmissionweb.feeder.dto.FeedCreateRequest;
import com.transmissionweb.feeder.exception.FeederException;
import com.transmissionweb.feeder.repository.FeedRepository;
import com.transmissionweb.feeder.service.FeedService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Registers the configured seed feeds on startup. Feeds already present (by URL) are left
 * untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedSeeder implements CommandLineRunner {

    private final FeedSeedConfig seedConfig;
    private final FeedRepository feedRepository;
    private final FeedService feedService;

    @Override
    public void run(String... args) {
        if (!seedConfig.isEnabled()) {
            log.debug("Feed seeding is disabled");
            return;
        }
        if (seedConfig.getFeeds().isEmpty()) {
            return;
        }

        int created = 0;
        for (FeedSeedConfig.FeedEntry entry : seedConfig.getFeeds()) {
            if (entry.getUrl() == null || entry.getUrl().isBlank()) {
                log.warn("Skipping seed feed '{}' without URL", entry.getName());
                continue;
            }
            if (feedRepository.existsByUrl(entry.getUrl().trim())) {
                log.debug("Seed feed already exists: {}", entry.getUrl());
                continue;
            }
            try {
                String name = entry.getName() != null ? entry.getName() : entry.getUrl();
                feedService.createFeed(new FeedCreateRequest(
                        name, entry.getUrl(), entry.getPattern(), entry.isEnabled(), entry.getCheckIntervalMinutes()));
                created++;
            } catch (FeederException e) {
                log.warn("Could not seed feed '{}': {}", entry.getName(), e.getMessage());
            }
        }

        if (created > 0) {
            log.info("Seeded {} new feeds", created);
        } else {
            log.info("All configured seed feeds already exist");
        }
    }
}
