package com.keelson.dispatch.ws;

/**
 * Lifecycle of an events socket connection.
 */
public enum ConnectionState {
    CONNECTING,
    HANDSHAKING,
    SYNCED,
    LAGGING,
    CLOSED
}
