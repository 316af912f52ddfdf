package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Represents a discovered Bluetooth Gatt service
 */
public class BluetoothGattService {

    /**
     * The UUID of this service.
     */
    @NotNull
    protected final UUID uuid;

    /**
     * List of characteristics included in this service.
     */
    protected final List<BluetoothGattCharacteristic> characteristics = new ArrayList<>();

    /**
     * Create a new BluetoothGattService.
     *
     * @param uuid The UUID for this service
     */
    public BluetoothGattService(@NotNull UUID uuid) {
        this.uuid = Objects.requireNonNull(uuid, "no valid UUID supplied");
    }

    /**
     * Add a characteristic to this service.
     *
     * @param characteristic The characteristics to be added
     * @return true, if the characteristic was added to the service
     */
    boolean addCharacteristic(@NotNull BluetoothGattCharacteristic characteristic) {
        Objects.requireNonNull(characteristic, "no valid characteristic supplied");
        characteristic.setService(this);
        return characteristics.add(characteristic);
    }

    /**
     * Returns the UUID of this service
     *
     * @return UUID of this service
     */
    public @NotNull UUID getUuid() {
        return uuid;
    }

    /**
     * Returns a list of characteristics included in this service.
     *
     * @return Characteristics included in this service
     */
    public @NotNull List<BluetoothGattCharacteristic> getCharacteristics() {
        return Collections.unmodifiableList(characteristics);
    }

    /**
     * Returns a characteristic with a given UUID out of the list of
     * characteristics offered by this service.
     *
     * <p>If a remote service offers multiple characteristics with the same
     * UUID, the first instance of a characteristic with the given UUID
     * is returned.
     *
     * @param uuid the UUID of the characteristic
     * @return GATT characteristic object or null if no characteristic with the given UUID was
     * found.
     */
    public @Nullable BluetoothGattCharacteristic getCharacteristic(@NotNull UUID uuid) {
        Objects.requireNonNull(uuid, "no valid uuid supplied");

        for (BluetoothGattCharacteristic characteristic : characteristics) {
            if (uuid.equals(characteristic.getUuid())) {
                return characteristic;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("BluetoothGattService(%s, %d characteristics)", uuid, characteristics.size());
    }
}
