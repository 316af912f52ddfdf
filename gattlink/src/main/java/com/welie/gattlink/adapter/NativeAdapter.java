package com.welie.gattlink.adapter;

import com.welie.gattlink.BluetoothGattCharacteristic.WriteType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.UUID;

/**
 * Command side of the native Bluetooth stack.
 *
 * <p>Commands return immediately. Their outcome arrives later through {@link NativeAdapterCallback}: link changes as
 * {@link ConnectionEvent}s, command completions as {@link GattResponse}s and characteristic reads as
 * {@link CharacteristicChange}s. Writes without response have no completion.
 */
public interface NativeAdapter {

    @NotNull
    AdapterState getAdapterState();

    void addCallback(@NotNull NativeAdapterCallback callback);

    void removeCallback(@NotNull NativeAdapterCallback callback);

    void connect(@NotNull UUID deviceId);

    void cancelConnection(@NotNull UUID deviceId);

    /**
     * @param serviceUUIDs services to discover, or null for all
     */
    void discoverServices(@NotNull UUID deviceId, @Nullable List<@NotNull UUID> serviceUUIDs);

    void discoverCharacteristics(@NotNull UUID deviceId, @NotNull NativeGattService service);

    void discoverDescriptors(@NotNull UUID deviceId, @NotNull NativeGattCharacteristic characteristic);

    /**
     * @return the service tree of the peripheral as currently known to the stack
     */
    @NotNull
    List<@NotNull NativeGattService> getServices(@NotNull UUID deviceId);

    void read(@NotNull UUID deviceId, @NotNull NativeGattCharacteristic characteristic);

    void read(@NotNull UUID deviceId, @NotNull NativeGattDescriptor descriptor);

    void write(@NotNull UUID deviceId, @NotNull NativeGattCharacteristic characteristic, @NotNull byte[] value, @NotNull WriteType writeType);

    void write(@NotNull UUID deviceId, @NotNull NativeGattDescriptor descriptor, @NotNull byte[] value);

    void setNotifyEnabled(@NotNull UUID deviceId, @NotNull NativeGattCharacteristic characteristic, boolean enable);

    void readRssi(@NotNull UUID deviceId);

    boolean canSendWriteWithoutResponse(@NotNull UUID deviceId);
}
