package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The native stack reported an error for a GATT operation.
 */
public class GattOperationException extends GattException {

    private static final long serialVersionUID = 1L;

    /** The status the stack reported. */
    @NotNull
    private final BluetoothCommandStatus status;

    /**
     * Creates an exception for an error status.
     *
     * @param message what was being done
     * @param status  status reported by the stack
     */
    public GattOperationException(@NotNull String message, @NotNull BluetoothCommandStatus status) {
        this(message, status, null);
    }

    /**
     * Creates an exception for an error status raised by the stack as an exception.
     *
     * @param message what was being done
     * @param status  status the failure maps to
     * @param cause   the native exception
     */
    public GattOperationException(@NotNull String message, @NotNull BluetoothCommandStatus status, @Nullable Throwable cause) {
        super(String.format("%s failed with status '%s'", message, status), cause);
        this.status = Objects.requireNonNull(status, "no valid status provided");
    }

    /**
     * Returns the status reported by the stack.
     *
     * @return status
     */
    @NotNull
    public BluetoothCommandStatus getStatus() {
        return status;
    }
}
