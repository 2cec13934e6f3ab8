package com.flyknight.transport;

import java.io.IOException;

/**
 * A connection to a peer failed or was closed while in use.
 *
 * On the host this ends the affected session and nothing else.
 */
public class ConnectionException extends IOException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
