package com.transmissionweb.feeder.exception;

public class InvalidPatternException extends FeederException {

    private final String pattern;

    public InvalidPatternException(String pattern, String message, Throwable cause) {
        super("INVALID_PATTERN", message, cause);
        this.pattern = pattern;
    }

    public static InvalidPatternException blank() {
        return new InvalidPatternException(null, "Match pattern is required", null);
    }

    public static InvalidPatternException of(String pattern, Throwable cause) {
        return new InvalidPatternException(pattern, "Invalid regex pattern: " + cause.getMessage(), cause);
    }

    public String getPattern() {
        return pattern;
    }
}
