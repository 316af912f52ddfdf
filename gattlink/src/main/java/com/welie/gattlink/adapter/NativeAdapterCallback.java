package com.welie.gattlink.adapter;

import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Events coming out of the native Bluetooth stack.
 *
 * <p>The stack calls these methods in the order the events happened, from a single thread per adapter.
 * Implementations must return quickly.
 */
public abstract class NativeAdapterCallback {

    /**
     * The power state of the local adapter changed.
     *
     * @param state the new state
     */
    public void onAdapterStateChanged(@NotNull AdapterState state) {}

    /**
     * A peripheral connected, failed to connect or disconnected.
     *
     * @param event the connection event
     */
    public void onConnectionEvent(@NotNull ConnectionEvent event) {}

    /**
     * A command completed.
     *
     * @param response the completion, tagged with its kind and status
     */
    public void onResponse(@NotNull GattResponse response) {}

    /**
     * A characteristic value arrived, either as the result of a read or as a notification or indication.
     *
     * @param change the value update
     */
    public void onCharacteristicChanged(@NotNull CharacteristicChange change) {}

    /**
     * The transport can accept another write without response for this peripheral.
     *
     * @param deviceId the peripheral
     */
    public void onReadyToSendWriteWithoutResponse(@NotNull UUID deviceId) {}
}
