package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A registered {@link ObservationListener}. Closing it detaches the listener; when it was the last listener of the
 * characteristic, notifications are switched off on the peripheral.
 */
public final class Observation implements Closeable {

    @NotNull
    private final Observers observers;

    @NotNull
    private final Observers.Registration registration;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    Observation(@NotNull final Observers observers, @NotNull final Observers.Registration registration) {
        this.observers = Objects.requireNonNull(observers, "no valid observers provided");
        this.registration = Objects.requireNonNull(registration, "no valid registration provided");
    }

    @NotNull
    public UUID getServiceUUID() {
        return registration.getKey().getServiceUUID();
    }

    @NotNull
    public UUID getCharacteristicUUID() {
        return registration.getKey().getCharacteristicUUID();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            observers.release(registration);
        }
    }
}
