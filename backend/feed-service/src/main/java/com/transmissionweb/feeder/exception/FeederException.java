package com.transmissionweb.feeder.exception;

/**
 * Base class of feed-service errors. Carries a stable error code for API responses.
 */
public class FeederException extends RuntimeException {

    private final String errorCode;

    public FeederException(String message) {
        super(message);
        this.errorCode = "FEEDER_ERROR";
    }

    public FeederException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "FEEDER_ERROR";
    }

    public FeederException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FeederException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
