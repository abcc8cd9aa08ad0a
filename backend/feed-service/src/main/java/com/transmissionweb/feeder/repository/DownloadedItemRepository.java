package com.transmissionweb.feeder.repository;

import com.transmissionweb.feeder.entity.DownloadedItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DownloadedItemRepository extends JpaRepository<DownloadedItem, Long> {

    boolean existsByFeed_IdAndItemGuid(Long feedId, String itemGuid);

    List<DownloadedItem> findByFeed_IdOrderByDownloadedAtDesc(Long feedId, Pageable pageable);

    @Modifying
    @Query("DELETE FROM DownloadedItem d WHERE d.feed.id = :feedId")
    int deleteByFeedId(@Param("feedId") Long feedId);
}
