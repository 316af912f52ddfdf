package com.welie.gattlink.adapter;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.UUID;

/**
 * Native handle of a characteristic.
 */
public interface NativeGattCharacteristic {

    @NotNull
    UUID getUuid();

    @NotNull
    NativeGattService getService();

    /**
     * Characteristic flags as reported by the stack, for example "read", "write", "write-without-response",
     * "notify", "indicate" or "authenticated-signed-writes".
     *
     * @return list of flags
     */
    @NotNull
    List<@NotNull String> getFlags();

    /**
     * @return the descriptors discovered so far, empty until descriptor discovery ran for this characteristic
     */
    @NotNull
    List<@NotNull NativeGattDescriptor> getGattDescriptors();
}
