package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;

/**
 * An operation needs a live connection, or discovered services, and there is none.
 */
public class NotReadyException extends GattException {

    private static final long serialVersionUID = 1L;

    public NotReadyException(@NotNull String message) {
        super(message);
    }
}
