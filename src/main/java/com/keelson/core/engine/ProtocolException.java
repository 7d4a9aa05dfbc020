package com.keelson.core.engine;

/**
 * A client message could not be decoded or is not allowed in the connection's current state.
 */
public class ProtocolException extends RuntimeException {

    private final String requestId;

    public ProtocolException(String message) {
        this(message, null, null);
    }

    public ProtocolException(String message, String requestId, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    /**
     * Request id of the offending message when it could still be read, otherwise {@code null}.
     */
    public String requestId() {
        return requestId;
    }
}
