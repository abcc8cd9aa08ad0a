package com.transmissionweb.feeder.dto;

import java.time.LocalDateTime;

/**
 * Outcome of one feed check.
 *
 * @param itemsFound   entries in the fetched document
 * @param matched      entries whose title matched the pattern
 * @param submitted    entries handed to the daemon and recorded
 * @param skipped      matched entries skipped as already downloaded or without a torrent link
 * @param failed       matched entries the daemon did not accept
 * @param error        feed-level error (fetch or pattern), null on success
 */
public record FeedCheckResult(
        Long feedId,
        LocalDateTime checkedAt,
        int itemsFound,
        int matched,
        int submitted,
        int skipped,
        int failed,
        String error
) {

    public static FeedCheckResult failed(Long feedId, LocalDateTime checkedAt, String error) {
        return new FeedCheckResult(feedId, checkedAt, 0, 0, 0, 0, 0, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
