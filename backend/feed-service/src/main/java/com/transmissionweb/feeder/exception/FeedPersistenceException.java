package com.transmissionweb.feeder.exception;

/**
 * A registry write was refused by the database, e.g. a second feed with the same URL.
 */
public class FeedPersistenceException extends FeederException {

    public FeedPersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_ERROR", message, cause);
    }

    public static FeedPersistenceException duplicateUrl(String url, Throwable cause) {
        return new FeedPersistenceException("A feed with this URL already exists: " + url, cause);
    }
}
