package com.transmissionweb.feeder.repository;

import com.transmissionweb.feeder.entity.Feed;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface FeedRepository extends JpaRepository<Feed, Long> {

    List<Feed> findAllByOrderByIdAsc();

    List<Feed> findByEnabledTrueOrderByIdAsc();

    boolean existsByUrl(String url);

    /**
     * Status write after a completed check. The match count is incremented in SQL.
     */
    @Modifying
    @Transactional
    @Query("UPDATE Feed f SET f.lastChecked = :checkedAt, f.lastError = :error, " +
           "f.matchCount = f.matchCount + :delta WHERE f.id = :id")
    int updateCheckResult(@Param("id") Long id,
                          @Param("checkedAt") LocalDateTime checkedAt,
                          @Param("delta") int delta,
                          @Param("error") String error);

    /**
     * Status write for a check stopped before its last item. The check time is left as it
     * was so the feed stays due.
     */
    @Modifying
    @Transactional
    @Query("UPDATE Feed f SET f.lastError = :error, f.matchCount = f.matchCount + :delta WHERE f.id = :id")
    int updatePartialResult(@Param("id") Long id,
                            @Param("delta") int delta,
                            @Param("error") String error);

    /**
     * Status write for a check that failed before any item was processed.
     */
    @Modifying
    @Transactional
    @Query("UPDATE Feed f SET f.lastChecked = :checkedAt, f.lastError = :error WHERE f.id = :id")
    int updateCheckError(@Param("id") Long id,
                         @Param("checkedAt") LocalDateTime checkedAt,
                         @Param("error") String error);
}
