package com.transmissionweb.feeder.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;

@Entity
@Table(name = "feeds", indexes = {
    @Index(name = "idx_feeds_enabled", columnList = "enabled")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Feed {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "url", nullable = false, unique = true, length = 2048)
    private String url;

    /**
     * Regular expression tested against item titles.
     */
    @Column(name = "pattern", nullable = false, columnDefinition = "TEXT")
    private String pattern;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    @Column(name = "check_interval", nullable = false)
    @Builder.Default
    private Integer checkInterval = 15; // minutes

    // Status columns are written only by FeedRepository's status updates.
    @Column(name = "last_checked", updatable = false)
    private LocalDateTime lastChecked;

    @Column(name = "last_error", columnDefinition = "TEXT", updatable = false)
    private String lastError;

    @Column(name = "match_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer matchCount = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Duration getCheckIntervalDuration() {
        return Duration.ofMinutes(checkInterval == null ? 0 : checkInterval);
    }

    /**
     * A feed is due when it was never checked or its interval has fully elapsed.
     */
    public boolean isDue(LocalDateTime now) {
        if (lastChecked == null) {
            return true;
        }
        return Duration.between(lastChecked, now).compareTo(getCheckIntervalDuration()) >= 0;
    }
}
