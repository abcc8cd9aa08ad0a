package com.transmissionweb.feeder.exception;

/**
 * The daemon answered at the transport level but reported a failure, or the reply
 * could not be decoded.
 */
public class RpcProtocolException extends FeederException {

    public RpcProtocolException(String message) {
        super("PROTOCOL_ERROR", message);
    }

    public RpcProtocolException(String message, Throwable cause) {
        super("PROTOCOL_ERROR", message, cause);
    }

    protected RpcProtocolException(String errorCode, String message) {
        super(errorCode, message);
    }

    /**
     * The reply's result field was not "success".
     */
    public static RpcProtocolException rejected(String method, String result) {
        return new RpcProtocolException("Transmission RPC '" + method + "' failed: " + result);
    }

    public static RpcProtocolException undecodable(String method, Throwable cause) {
        return new RpcProtocolException("Transmission RPC '" + method + "' returned an unreadable reply", cause);
    }
}
