package com.welie.gattlink;

import com.welie.gattlink.adapter.NativeGattDescriptor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.UUID;

/**
 * Represents a discovered Bluetooth Gatt descriptor
 */
public class BluetoothGattDescriptor {

    /**
     * The UUID of this descriptor.
     */
    @NotNull
    protected final UUID uuid;

    /**
     * Native handle this descriptor was discovered from, null for descriptors created by hand.
     */
    @Nullable
    private final NativeGattDescriptor nativeDescriptor;

    /**
     * Back-reference to the characteristic this descriptor belongs to.
     */
    @Nullable
    protected BluetoothGattCharacteristic characteristic;

    /**
     * Create a new BluetoothGattDescriptor.
     *
     * @param uuid The UUID for this descriptor
     */
    public BluetoothGattDescriptor(@NotNull UUID uuid) {
        this(uuid, null);
    }

    BluetoothGattDescriptor(@NotNull UUID uuid, @Nullable NativeGattDescriptor nativeDescriptor) {
        this.uuid = Objects.requireNonNull(uuid, "no valid UUID supplied");
        this.nativeDescriptor = nativeDescriptor;
    }

    /**
     * Returns the characteristic this descriptor belongs to.
     *
     * @return The characteristic.
     */
    public @Nullable BluetoothGattCharacteristic getCharacteristic() {
        return characteristic;
    }

    void setCharacteristic(@NotNull BluetoothGattCharacteristic characteristic) {
        this.characteristic = Objects.requireNonNull(characteristic, "no valid characteristic supplied");
    }

    /**
     * Returns the UUID of this descriptor.
     *
     * @return UUID of this descriptor
     */
    public @NotNull UUID getUuid() {
        return uuid;
    }

    @Nullable
    NativeGattDescriptor getNativeDescriptor() {
        return nativeDescriptor;
    }

    @Override
    public String toString() {
        return String.format("BluetoothGattDescriptor(%s)", uuid);
    }
}
