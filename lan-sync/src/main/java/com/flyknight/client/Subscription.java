package com.flyknight.client;

/**
 * Handle to a registered event handler. Closing it unregisters the handler;
 * closing twice does nothing.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
