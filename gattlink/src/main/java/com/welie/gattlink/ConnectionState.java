package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Connection state of a {@link BluetoothPeripheral}.
 *
 * <p>A connection attempt moves through {@link #LINK_ESTABLISHING}, {@link #DISCOVERING_SERVICES} and
 * {@link #CONFIGURING_OBSERVATIONS} before becoming {@link #CONNECTED}. Any of these steps may instead end in
 * {@link Disconnected}.
 */
public abstract class ConnectionState {

    public static final Connecting LINK_ESTABLISHING = new Connecting(Connecting.Phase.LINK_ESTABLISHING);
    public static final Connecting DISCOVERING_SERVICES = new Connecting(Connecting.Phase.DISCOVERING_SERVICES);
    public static final Connecting CONFIGURING_OBSERVATIONS = new Connecting(Connecting.Phase.CONFIGURING_OBSERVATIONS);
    public static final Connected CONNECTED = new Connected();
    public static final Disconnecting DISCONNECTING = new Disconnecting();
    public static final Disconnected DISCONNECTED = new Disconnected(null);

    private ConnectionState() {
    }

    @NotNull
    public static Disconnected disconnected(@Nullable final DisconnectReason reason) {
        return reason == null ? DISCONNECTED : new Disconnected(reason);
    }

    public boolean isConnected() {
        return this == CONNECTED;
    }

    public boolean isDisconnected() {
        return this instanceof Disconnected;
    }

    public static final class Disconnected extends ConnectionState {

        @Nullable
        private final DisconnectReason reason;

        private Disconnected(@Nullable final DisconnectReason reason) {
            this.reason = reason;
        }

        /**
         * @return why the link ended, or null if the native stack did not say
         */
        @Nullable
        public DisconnectReason getReason() {
            return reason;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Objects.equals(reason, ((Disconnected) o).reason);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(reason);
        }

        @Override
        public String toString() {
            return reason == null ? "Disconnected" : String.format("Disconnected(%s)", reason);
        }
    }

    public static final class Connecting extends ConnectionState {

        public enum Phase {
            LINK_ESTABLISHING,
            DISCOVERING_SERVICES,
            CONFIGURING_OBSERVATIONS
        }

        @NotNull
        private final Phase phase;

        private Connecting(@NotNull final Phase phase) {
            this.phase = phase;
        }

        @NotNull
        public Phase getPhase() {
            return phase;
        }

        @Override
        public String toString() {
            return String.format("Connecting(%s)", phase);
        }
    }

    public static final class Connected extends ConnectionState {
        private Connected() {
        }

        @Override
        public String toString() {
            return "Connected";
        }
    }

    public static final class Disconnecting extends ConnectionState {
        private Disconnecting() {
        }

        @Override
        public String toString() {
            return "Disconnecting";
        }
    }
}
