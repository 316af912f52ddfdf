package com.welie.gattlink.adapter;

import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Native handle of a descriptor.
 */
public interface NativeGattDescriptor {

    @NotNull
    UUID getUuid();

    @NotNull
    NativeGattCharacteristic getCharacteristic();
}
