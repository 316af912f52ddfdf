package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Base class of all failures reported by a {@link BluetoothPeripheral}.
 */
public class GattException extends IOException {

    private static final long serialVersionUID = 1L;

    public GattException(@NotNull String message) {
        super(message);
    }

    public GattException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
