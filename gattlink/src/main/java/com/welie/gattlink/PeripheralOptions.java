package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Immutable settings of a {@link BluetoothPeripheral}.
 */
public final class PeripheralOptions {

    public static final long DEFAULT_DISCONNECT_TIMEOUT_MS = 5000L;

    public static final PeripheralOptions DEFAULT = builder().build();

    @Nullable
    private final List<UUID> serviceFilter;

    private final long disconnectTimeoutMillis;

    @NotNull
    private final BluetoothPeripheralCallback callback;

    private PeripheralOptions(@NotNull final Builder builder) {
        this.serviceFilter = builder.serviceFilter == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.serviceFilter));
        this.disconnectTimeoutMillis = builder.disconnectTimeoutMillis;
        this.callback = builder.callback;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the services to discover, or null to discover all services
     */
    @Nullable
    public List<UUID> getServiceFilter() {
        return serviceFilter;
    }

    /**
     * @return how long {@link BluetoothPeripheral#disconnect()} waits for the stack to report the disconnect
     */
    public long getDisconnectTimeoutMillis() {
        return disconnectTimeoutMillis;
    }

    @NotNull
    public BluetoothPeripheralCallback getCallback() {
        return callback;
    }

    public static final class Builder {

        @Nullable
        private List<UUID> serviceFilter;

        private long disconnectTimeoutMillis = DEFAULT_DISCONNECT_TIMEOUT_MS;

        @NotNull
        private BluetoothPeripheralCallback callback = new BluetoothPeripheralCallback.NULL();

        private Builder() {
        }

        /**
         * Only discover these services. Passing null discovers all services.
         */
        @NotNull
        public Builder serviceFilter(@Nullable final List<@NotNull UUID> serviceUUIDs) {
            if (serviceUUIDs != null) {
                serviceUUIDs.forEach(uuid -> Objects.requireNonNull(uuid, "no valid service UUID provided"));
            }
            this.serviceFilter = serviceUUIDs;
            return this;
        }

        @NotNull
        public Builder disconnectTimeout(final long timeout, @NotNull final TimeUnit unit) {
            Objects.requireNonNull(unit, "no valid time unit provided");
            if (timeout <= 0) {
                throw new IllegalArgumentException("disconnect timeout must be positive");
            }
            this.disconnectTimeoutMillis = unit.toMillis(timeout);
            return this;
        }

        @NotNull
        public Builder callback(@NotNull final BluetoothPeripheralCallback callback) {
            this.callback = Objects.requireNonNull(callback, "no valid callback provided");
            return this;
        }

        @NotNull
        public PeripheralOptions build() {
            return new PeripheralOptions(this);
        }
    }
}
