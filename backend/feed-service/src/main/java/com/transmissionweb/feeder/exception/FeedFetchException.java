package com.transmissionweb.feeder.exception;

/**
 * A feed document could not be retrieved or parsed.
 */
public class FeedFetchException extends FeederException {

    public enum Kind {
        NETWORK,
        MALFORMED
    }

    private final Kind kind;
    private final String url;

    public FeedFetchException(Kind kind, String url, String message, Throwable cause) {
        super("FEED_FETCH_ERROR", message, cause);
        this.kind = kind;
        this.url = url;
    }

    public static FeedFetchException network(String url, Throwable cause) {
        return new FeedFetchException(Kind.NETWORK, url, "Failed to fetch feed " + url + ": " + cause.getMessage(), cause);
    }

    public static FeedFetchException malformed(String url, Throwable cause) {
        return new FeedFetchException(Kind.MALFORMED, url, "Failed to parse feed " + url + ": " + cause.getMessage(), cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getUrl() {
        return url;
    }
}
