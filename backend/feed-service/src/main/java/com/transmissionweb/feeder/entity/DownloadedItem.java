package com.transmissionweb.feeder.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

/**
 * One feed item that was handed to the daemon. The (feed, guid) pair is unique.
 */
@Entity
@Table(name = "downloaded_items",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_downloaded_feed_guid", columnNames = {"feed_id", "item_guid"})
    },
    indexes = {
        @Index(name = "idx_downloaded_guid", columnList = "item_guid")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadedItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "feed_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Feed feed;

    @Column(name = "item_guid", nullable = false, length = 1024, updatable = false)
    private String itemGuid;

    @Column(name = "item_title", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String itemTitle;

    @Column(name = "item_link", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String itemLink;

    @Column(name = "downloaded_at", nullable = false, updatable = false)
    private LocalDateTime downloadedAt;

    public Long getFeedId() {
        return feed != null ? feed.getId() : null;
    }
}
