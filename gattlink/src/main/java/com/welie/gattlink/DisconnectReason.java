package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Why a peripheral ended up disconnected, decoded from the native error code of a connect-failed or disconnected
 * event.
 */
public final class DisconnectReason {

    public enum Type {
        /**
         * The peripheral or the local stack ended the link normally
         */
        PERIPHERAL_DISCONNECTED(7),

        /**
         * The link could not be established
         */
        FAILED(10),

        /**
         * The link timed out
         */
        TIMEOUT(6),

        /**
         * The stack does not know the peripheral
         */
        UNKNOWN_DEVICE(12),

        /**
         * The connection attempt was cancelled
         */
        CANCELLED(5),

        /**
         * The stack cannot hold any more connections
         */
        CONNECTION_LIMIT_REACHED(11),

        /**
         * Encryption of the link timed out
         */
        ENCRYPTION_TIMED_OUT(15),

        /**
         * The local adapter stopped being available while connecting
         */
        ADAPTER_FAILURE(-1),

        /**
         * A native code without a known meaning, see {@link DisconnectReason#getCode()}
         */
        UNKNOWN(-1);

        private final int code;

        Type(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    public static final DisconnectReason PERIPHERAL_DISCONNECTED = new DisconnectReason(Type.PERIPHERAL_DISCONNECTED);
    public static final DisconnectReason FAILED = new DisconnectReason(Type.FAILED);
    public static final DisconnectReason TIMEOUT = new DisconnectReason(Type.TIMEOUT);
    public static final DisconnectReason UNKNOWN_DEVICE = new DisconnectReason(Type.UNKNOWN_DEVICE);
    public static final DisconnectReason CANCELLED = new DisconnectReason(Type.CANCELLED);
    public static final DisconnectReason CONNECTION_LIMIT_REACHED = new DisconnectReason(Type.CONNECTION_LIMIT_REACHED);
    public static final DisconnectReason ENCRYPTION_TIMED_OUT = new DisconnectReason(Type.ENCRYPTION_TIMED_OUT);
    public static final DisconnectReason ADAPTER_FAILURE = new DisconnectReason(Type.ADAPTER_FAILURE);

    private static final DisconnectReason[] KNOWN = {
            PERIPHERAL_DISCONNECTED, FAILED, TIMEOUT, UNKNOWN_DEVICE, CANCELLED, CONNECTION_LIMIT_REACHED, ENCRYPTION_TIMED_OUT
    };

    @NotNull
    private final Type type;

    private final int code;

    private DisconnectReason(@NotNull final Type type) {
        this(type, type.getCode());
    }

    private DisconnectReason(@NotNull final Type type, final int code) {
        this.type = Objects.requireNonNull(type, "no valid type provided");
        this.code = code;
    }

    /**
     * Decode a native error code.
     *
     * @param code the native error code
     * @return the matching reason, or an {@link Type#UNKNOWN} reason carrying the code
     */
    @NotNull
    public static DisconnectReason fromCode(final int code) {
        for (DisconnectReason reason : KNOWN) {
            if (reason.code == code) return reason;
        }
        return unknown(code);
    }

    /**
     * Decode an optional native error code.
     *
     * @param code the native error code, may be null
     * @return the decoded reason or null if no code was given
     */
    @Nullable
    public static DisconnectReason fromNullableCode(@Nullable final Integer code) {
        return code == null ? null : fromCode(code);
    }

    @NotNull
    public static DisconnectReason unknown(final int code) {
        return new DisconnectReason(Type.UNKNOWN, code);
    }

    @NotNull
    public Type getType() {
        return type;
    }

    /**
     * @return the native error code this reason was decoded from, -1 for {@link Type#ADAPTER_FAILURE}
     */
    public int getCode() {
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DisconnectReason that = (DisconnectReason) o;
        return code == that.code && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, code);
    }

    @Override
    public String toString() {
        return type == Type.UNKNOWN ? String.format("UNKNOWN(%d)", code) : type.toString();
    }
}
