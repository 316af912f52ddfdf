package com.welie.gattlink.internal;

/**
 * Handle to a registered listener. Closing it detaches the listener; closing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
