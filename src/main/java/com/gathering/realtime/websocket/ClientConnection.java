package com.gathering.realtime.websocket;

import java.io.IOException;

/**
 * Handle of one external real-time client as seen by {@link ConnectionManager}.
 */
public interface ClientConnection {

    /**
     * Completes the protocol handshake. Called once by
     * {@link ConnectionManager#connect(ClientConnection, String)}.
     */
    void accept() throws IOException;

    /**
     * Sends one already serialized JSON message.
     */
    void send(String text) throws IOException;

    /**
     * Identifier used when the client did not supply one.
     */
    default String defaultClientId() {
        return "client_" + Integer.toHexString(System.identityHashCode(this));
    }
}
