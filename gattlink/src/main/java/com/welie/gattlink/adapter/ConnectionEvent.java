package com.welie.gattlink.adapter;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.UUID;

/**
 * Link level event for one peripheral.
 */
public final class ConnectionEvent {

    public enum Type {
        CONNECTED,
        CONNECT_FAILED,
        DISCONNECTED
    }

    @NotNull
    private final UUID deviceId;

    @NotNull
    private final Type type;

    @Nullable
    private final Integer errorCode;

    private ConnectionEvent(@NotNull final UUID deviceId, @NotNull final Type type, @Nullable final Integer errorCode) {
        this.deviceId = Objects.requireNonNull(deviceId, "no valid device id provided");
        this.type = Objects.requireNonNull(type, "no valid type provided");
        this.errorCode = errorCode;
    }

    @NotNull
    public static ConnectionEvent connected(@NotNull final UUID deviceId) {
        return new ConnectionEvent(deviceId, Type.CONNECTED, null);
    }

    @NotNull
    public static ConnectionEvent connectFailed(@NotNull final UUID deviceId, @Nullable final Integer errorCode) {
        return new ConnectionEvent(deviceId, Type.CONNECT_FAILED, errorCode);
    }

    /**
     * @param errorCode native error code, or null for a disconnect that the stack reports without an error
     */
    @NotNull
    public static ConnectionEvent disconnected(@NotNull final UUID deviceId, @Nullable final Integer errorCode) {
        return new ConnectionEvent(deviceId, Type.DISCONNECTED, errorCode);
    }

    @NotNull
    public UUID getDeviceId() {
        return deviceId;
    }

    @NotNull
    public Type getType() {
        return type;
    }

    @Nullable
    public Integer getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return errorCode == null ? type.toString() : String.format("%s(%d)", type, errorCode);
    }
}
