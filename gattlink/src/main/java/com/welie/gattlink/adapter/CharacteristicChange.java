package com.welie.gattlink.adapter;

import com.welie.gattlink.BluetoothCommandStatus;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

import static com.welie.gattlink.BluetoothCommandStatus.COMMAND_SUCCESS;

/**
 * A characteristic value update. The stack reports read results and notifications through the same channel.
 */
public final class CharacteristicChange {

    @NotNull
    private final UUID deviceId;

    @NotNull
    private final NativeGattCharacteristic characteristic;

    @NotNull
    private final byte[] value;

    @NotNull
    private final BluetoothCommandStatus status;

    public CharacteristicChange(@NotNull final UUID deviceId, @NotNull final NativeGattCharacteristic characteristic, @NotNull final byte[] value, @NotNull final BluetoothCommandStatus status) {
        this.deviceId = Objects.requireNonNull(deviceId, "no valid device id provided");
        this.characteristic = Objects.requireNonNull(characteristic, "no valid characteristic provided");
        this.value = Arrays.copyOf(Objects.requireNonNull(value, "no valid value provided"), value.length);
        this.status = Objects.requireNonNull(status, "no valid status provided");
    }

    @NotNull
    public static CharacteristicChange value(@NotNull final UUID deviceId, @NotNull final NativeGattCharacteristic characteristic, @NotNull final byte[] value) {
        return new CharacteristicChange(deviceId, characteristic, value, COMMAND_SUCCESS);
    }

    @NotNull
    public static CharacteristicChange error(@NotNull final UUID deviceId, @NotNull final NativeGattCharacteristic characteristic, @NotNull final BluetoothCommandStatus status) {
        return new CharacteristicChange(deviceId, characteristic, new byte[0], status);
    }

    @NotNull
    public UUID getDeviceId() {
        return deviceId;
    }

    @NotNull
    public NativeGattCharacteristic getCharacteristic() {
        return characteristic;
    }

    @NotNull
    public byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    @NotNull
    public BluetoothCommandStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == COMMAND_SUCCESS;
    }

    /**
     * @return true if this change is for the characteristic with these UUIDs
     */
    public boolean isFor(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID) {
        return characteristic.getUuid().equals(characteristicUUID) && characteristic.getService().getUuid().equals(serviceUUID);
    }

    @Override
    public String toString() {
        return String.format("CharacteristicChange(%s, %s)", characteristic.getUuid(), status);
    }
}
