package com.transmissionweb.feeder.exception;

/**
 * Session negotiation with the daemon failed.
 */
public class RpcSessionException extends RpcProtocolException {

    public RpcSessionException(String message) {
        super("SESSION_ERROR", message);
    }

    /**
     * The daemon rejected the session again right after handing out a fresh token.
     */
    public static RpcSessionException rejectedAfterRefresh(String method) {
        return new RpcSessionException("Transmission rejected the refreshed session for '" + method + "'");
    }

    /**
     * A 409 reply came without the header carrying the new token.
     */
    public static RpcSessionException missingToken(String method) {
        return new RpcSessionException("Transmission sent 409 without a session id for '" + method + "'");
    }
}
