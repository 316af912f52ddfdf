package com.welie.gattlink.adapter;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.UUID;

/**
 * Native handle of a service in the peripheral's attribute tree.
 */
public interface NativeGattService {

    @NotNull
    UUID getUuid();

    /**
     * @return the characteristics discovered so far, empty until characteristic discovery ran for this service
     */
    @NotNull
    List<@NotNull NativeGattCharacteristic> getGattCharacteristics();
}
