package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;

/**
 * Receives the value updates of an observed characteristic.
 *
 * <p>Methods are called on the peripheral's callback thread. Updates that arrive while nobody listens are dropped.
 */
@FunctionalInterface
public interface ObservationListener {

    /**
     * A notification, indication or read result for the characteristic arrived.
     *
     * @param value the new value
     */
    void onCharacteristicUpdate(@NotNull byte[] value);

    /**
     * The stack reported an error for the characteristic, or notifications could not be enabled after a (re)connect.
     *
     * @param exception the error
     */
    default void onError(@NotNull GattException exception) {}

    /**
     * The link dropped. The observation stays registered and is re-armed on the next connection.
     */
    default void onDisconnected() {}
}
