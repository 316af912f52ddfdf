package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The link to the peripheral dropped while connecting or while an operation was waiting for its result.
 */
public class ConnectionLostException extends GattException {

    private static final long serialVersionUID = 1L;

    @Nullable
    private final DisconnectReason reason;

    public ConnectionLostException(@NotNull String message, @Nullable DisconnectReason reason) {
        super(reason == null ? message : String.format("%s: %s", message, reason));
        this.reason = reason;
    }

    /**
     * @return the decoded native reason, or null if the stack gave none
     */
    @Nullable
    public DisconnectReason getReason() {
        return reason;
    }
}
