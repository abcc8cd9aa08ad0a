package com.transmissionweb.feeder.exception;

/**
 * The daemon could not be reached or answered with a non-success HTTP status.
 */
public class RpcTransportException extends FeederException {

    private final Integer httpStatus;

    public RpcTransportException(String message, Throwable cause) {
        super("TRANSPORT_ERROR", message, cause);
        this.httpStatus = null;
    }

    public RpcTransportException(String message, int httpStatus) {
        super("TRANSPORT_ERROR", message);
        this.httpStatus = httpStatus;
    }

    public static RpcTransportException unreachable(String method, Throwable cause) {
        return new RpcTransportException("Transmission RPC '" + method + "' failed: " + cause.getMessage(), cause);
    }

    public static RpcTransportException httpError(String method, int status) {
        return new RpcTransportException("Transmission RPC '" + method + "' returned HTTP " + status, status);
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
