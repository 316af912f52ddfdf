package com.welie.gattlink.adapter;

import com.welie.gattlink.BluetoothCommandStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.UUID;

import static com.welie.gattlink.BluetoothCommandStatus.COMMAND_SUCCESS;

/**
 * Completion of a native command, tagged with its {@link ResponseKind}.
 */
public final class GattResponse {

    @NotNull
    private final UUID deviceId;

    @NotNull
    private final ResponseKind kind;

    @NotNull
    private final BluetoothCommandStatus status;

    private final int intValue;

    @Nullable
    private final Object value;

    private GattResponse(@NotNull final UUID deviceId, @NotNull final ResponseKind kind, @NotNull final BluetoothCommandStatus status, final int intValue, @Nullable final Object value) {
        this.deviceId = Objects.requireNonNull(deviceId, "no valid device id provided");
        this.kind = Objects.requireNonNull(kind, "no valid response kind provided");
        this.status = Objects.requireNonNull(status, "no valid status provided");
        this.intValue = intValue;
        this.value = value;
    }

    @NotNull
    public static GattResponse of(@NotNull final UUID deviceId, @NotNull final ResponseKind kind, @NotNull final BluetoothCommandStatus status) {
        return new GattResponse(deviceId, kind, status, 0, null);
    }

    @NotNull
    public static GattResponse success(@NotNull final UUID deviceId, @NotNull final ResponseKind kind) {
        return of(deviceId, kind, COMMAND_SUCCESS);
    }

    /**
     * @param mtu the negotiated maximum transmission unit of the link
     */
    @NotNull
    public static GattResponse servicesDiscovered(@NotNull final UUID deviceId, final int mtu) {
        return new GattResponse(deviceId, ResponseKind.SERVICES_DISCOVERED, COMMAND_SUCCESS, mtu, null);
    }

    @NotNull
    public static GattResponse rssiRead(@NotNull final UUID deviceId, final int rssi) {
        return new GattResponse(deviceId, ResponseKind.RSSI_READ, COMMAND_SUCCESS, rssi, null);
    }

    /**
     * @param value the descriptor value in whatever representation the stack produced (byte[], String, Number, ...)
     */
    @NotNull
    public static GattResponse descriptorRead(@NotNull final UUID deviceId, @Nullable final Object value) {
        return new GattResponse(deviceId, ResponseKind.DESCRIPTOR_READ, COMMAND_SUCCESS, 0, value);
    }

    @NotNull
    public UUID getDeviceId() {
        return deviceId;
    }

    @NotNull
    public ResponseKind getKind() {
        return kind;
    }

    @NotNull
    public BluetoothCommandStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == COMMAND_SUCCESS;
    }

    public int getMtu() {
        return intValue;
    }

    public int getRssi() {
        return intValue;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("%s(%s)", kind, status);
    }
}
