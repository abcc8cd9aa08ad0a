package com.transmissionweb.feeder.exception;

public class FeedNotFoundException extends FeederException {

    private final Long feedId;

    public FeedNotFoundException(Long feedId) {
        super("FEED_NOT_FOUND", "Feed not found: " + feedId);
        this.feedId = feedId;
    }

    public Long getFeedId() {
        return feedId;
    }
}
