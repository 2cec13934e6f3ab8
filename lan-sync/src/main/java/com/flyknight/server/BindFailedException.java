package com.flyknight.server;

import java.io.IOException;

/**
 * The host could not open its listening socket. Fatal; never retried.
 */
public class BindFailedException extends IOException {

    public BindFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
