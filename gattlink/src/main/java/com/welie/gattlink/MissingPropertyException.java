package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * The characteristic exists but lacks the property the operation needs, for example reading a characteristic
 * without {@link BluetoothGattCharacteristic#PROPERTY_READ}.
 */
public class MissingPropertyException extends GattException {

    private static final long serialVersionUID = 1L;

    private final int requiredProperties;

    private final int actualProperties;

    public MissingPropertyException(@NotNull UUID characteristicUUID, int requiredProperties, int actualProperties) {
        super(String.format("characteristic %s has properties 0x%02X, but one of 0x%02X is required", characteristicUUID, actualProperties, requiredProperties));
        this.requiredProperties = requiredProperties;
        this.actualProperties = actualProperties;
    }

    public int getRequiredProperties() {
        return requiredProperties;
    }

    public int getActualProperties() {
        return actualProperties;
    }
}
