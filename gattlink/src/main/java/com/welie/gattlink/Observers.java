package com.welie.gattlink;

import com.welie.gattlink.adapter.CharacteristicChange;
import com.welie.gattlink.adapter.NativeAdapter;
import com.welie.gattlink.adapter.NativeGattCharacteristic;
import com.welie.gattlink.internal.EventStream;
import com.welie.gattlink.internal.Handler;
import com.welie.gattlink.internal.Subscription;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import static com.welie.gattlink.BluetoothCommandStatus.OPERATION_FAILED;
import static com.welie.gattlink.BluetoothGattCharacteristic.PROPERTY_INDICATE;
import static com.welie.gattlink.BluetoothGattCharacteristic.PROPERTY_NOTIFY;
import static com.welie.gattlink.adapter.ResponseKind.NOTIFICATION_STATE_UPDATED;

/**
 * Registry of observed characteristics.
 *
 * <p>Notifications for a characteristic are enabled when its first listener registers while connected, and again on
 * every new connection, followed by the subscription actions of its listeners. They are disabled when its last
 * listener goes away. Registrations outlive connections.
 */
final class Observers {
    private static final String TAG = Observers.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    /**
     * Receives arming and subscription action failures that do not bring the connection down.
     */
    @FunctionalInterface
    interface ErrorReporter {
        void report(@NotNull UUID serviceUUID, @NotNull UUID characteristicUUID, @NotNull GattException exception);
    }

    @NotNull
    private final UUID deviceId;

    @NotNull
    private final NativeAdapter adapter;

    @NotNull
    private final Handler callbackHandler;

    @NotNull
    private final ErrorReporter errorReporter;

    @NotNull
    private final Subscription changeSubscription;

    private final Object lock = new Object();

    // Held across a registry change and the notification change it causes
    private final ReentrantLock armingLock = new ReentrantLock();

    // Guarded by lock
    private final Map<Key, List<Registration>> registrations = new HashMap<>();

    // Guarded by lock
    @Nullable
    private Connection connection;

    // Guarded by lock
    @Nullable
    private GattCatalog catalog;

    Observers(@NotNull final UUID deviceId,
              @NotNull final NativeAdapter adapter,
              @NotNull final EventStream<CharacteristicChange> characteristicChanges,
              @NotNull final Handler callbackHandler,
              @NotNull final ErrorReporter errorReporter) {
        this.deviceId = Objects.requireNonNull(deviceId, "no valid device id provided");
        this.adapter = Objects.requireNonNull(adapter, "no valid adapter provided");
        this.callbackHandler = Objects.requireNonNull(callbackHandler, "no valid handler provided");
        this.errorReporter = Objects.requireNonNull(errorReporter, "no valid error reporter provided");
        this.changeSubscription = Objects.requireNonNull(characteristicChanges, "no valid characteristic stream provided").subscribe(this::route);
    }

    /**
     * Register a listener. If this is the first listener of the characteristic and the peripheral is connected,
     * notifications are enabled before returning. The subscription action then runs when connected. When either fails
     * nothing is registered.
     */
    @NotNull
    Observation observe(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final ObservationListener listener, @Nullable final SubscriptionAction action) throws GattException, InterruptedException {
        Objects.requireNonNull(listener, "no valid listener provided");
        final Registration registration = new Registration(new Key(serviceUUID, characteristicUUID), listener, action);
        final Key key = registration.key;

        armingLock.lockInterruptibly();
        try {
            final boolean first;
            final Connection currentConnection;
            final GattCatalog currentCatalog;
            synchronized (lock) {
                final List<Registration> registered = registrations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>());
                first = registered.isEmpty();
                registered.add(registration);
                currentConnection = connection;
                currentCatalog = catalog;
            }

            if (currentConnection != null && currentCatalog != null) {
                boolean armed = false;
                try {
                    if (first) {
                        setNotify(currentConnection, currentCatalog, key, true);
                    }
                    armed = true;
                    runAction(registration);
                } catch (GattException | InterruptedException | RuntimeException e) {
                    if (remove(registration) && armed) {
                        disable(currentConnection, currentCatalog, key);
                    }
                    throw e;
                }
            }
        } finally {
            armingLock.unlock();
        }
        return new Observation(this, registration);
    }

    void release(@NotNull final Registration registration) {
        armingLock.lock();
        try {
            if (!remove(registration)) return;

            final Connection currentConnection;
            final GattCatalog currentCatalog;
            synchronized (lock) {
                currentConnection = connection;
                currentCatalog = catalog;
            }
            if (currentConnection == null || currentCatalog == null) return;

            disable(currentConnection, currentCatalog, registration.key);
        } finally {
            armingLock.unlock();
        }
    }

    /**
     * @return true if the registration was the last one of its characteristic
     */
    private boolean remove(@NotNull final Registration registration) {
        synchronized (lock) {
            final List<Registration> registered = registrations.get(registration.key);
            if (registered == null || !registered.remove(registration)) return false;
            if (registered.isEmpty()) {
                registrations.remove(registration.key);
                return true;
            }
            return false;
        }
    }

    /**
     * Enable notifications for every registered characteristic on a new connection and run the subscription actions.
     *
     * <p>Failures that leave the connection intact are reported to the listeners concerned; link failures are rethrown
     * so the connect attempt fails.
     */
    void onConnected(@NotNull final Connection newConnection, @NotNull final GattCatalog newCatalog) throws GattException, InterruptedException {
        armingLock.lockInterruptibly();
        try {
            final Map<Key, List<Registration>> toArm = new HashMap<>();
            synchronized (lock) {
                connection = Objects.requireNonNull(newConnection, "no valid connection provided");
                catalog = Objects.requireNonNull(newCatalog, "no valid catalog provided");
                registrations.forEach((key, registered) -> toArm.put(key, new ArrayList<>(registered)));
            }

            for (Map.Entry<Key, List<Registration>> entry : toArm.entrySet()) {
                final Key key = entry.getKey();
                try {
                    setNotify(newConnection, newCatalog, key, true);
                } catch (GattException e) {
                    if (!newConnection.isAlive()) throw e;

                    logger.error(String.format("could not enable notifications for <%s>: %s", key.characteristicUUID, e.getMessage()));
                    deliverError(key, e);
                    errorReporter.report(key.serviceUUID, key.characteristicUUID, e);
                    continue;
                }

                for (Registration registration : entry.getValue()) {
                    try {
                        runAction(registration);
                    } catch (GattException e) {
                        if (!newConnection.isAlive()) throw e;

                        logger.error(String.format("subscription action for <%s> failed: %s", key.characteristicUUID, e.getMessage()));
                        post(() -> registration.listener.onError(e));
                        errorReporter.report(key.serviceUUID, key.characteristicUUID, e);
                    }
                }
            }
        } finally {
            armingLock.unlock();
        }
    }

    void onDisconnected() {
        final List<Registration> toNotify = new ArrayList<>();
        synchronized (lock) {
            if (connection == null) return;
            connection = null;
            catalog = null;
            registrations.values().forEach(toNotify::addAll);
        }
        toNotify.forEach(registration -> post(registration.listener::onDisconnected));
    }

    void close() {
        changeSubscription.close();
        synchronized (lock) {
            registrations.clear();
            connection = null;
            catalog = null;
        }
    }

    private void runAction(@NotNull final Registration registration) throws GattException, InterruptedException {
        if (registration.action == null) return;

        try {
            registration.action.onSubscribed();
        } catch (RuntimeException e) {
            throw new GattOperationException("subscription action for " + registration.key.characteristicUUID, OPERATION_FAILED, e);
        }
    }

    private void disable(@NotNull final Connection target, @NotNull final GattCatalog source, @NotNull final Key key) {
        try {
            setNotify(target, source, key, false);
        } catch (GattException e) {
            logger.warn(String.format("could not disable notifications for <%s>: %s", key.characteristicUUID, e.getMessage()));
        } catch (InterruptedException e) {
            logger.warn(String.format("interrupted while disabling notifications for <%s>", key.characteristicUUID));
            Thread.currentThread().interrupt();
        }
    }

    private void setNotify(@NotNull final Connection target, @NotNull final GattCatalog source, @NotNull final Key key, final boolean enable) throws GattException, InterruptedException {
        final BluetoothGattCharacteristic characteristic = source.obtain(key.serviceUUID, key.characteristicUUID, PROPERTY_NOTIFY | PROPERTY_INDICATE);
        final NativeGattCharacteristic nativeCharacteristic = Objects.requireNonNull(characteristic.getNativeCharacteristic(), "characteristic was not discovered");

        logger.info(String.format("%s notifications for <%s>", enable ? "enabling" : "disabling", key.characteristicUUID));
        target.execute(NOTIFICATION_STATE_UPDATED, () -> adapter.setNotifyEnabled(deviceId, nativeCharacteristic, enable));
    }

    private void route(@NotNull final CharacteristicChange change) {
        final NativeGattCharacteristic characteristic = change.getCharacteristic();
        final Key key = new Key(characteristic.getService().getUuid(), characteristic.getUuid());
        final List<Registration> registered;
        synchronized (lock) {
            if (connection == null) return;
            registered = registrations.get(key);
        }
        if (registered == null) return;

        if (change.isSuccess()) {
            final byte[] value = change.getValue();
            // Every listener gets its own copy
            registered.forEach(registration -> {
                final byte[] copy = value.clone();
                post(() -> registration.listener.onCharacteristicUpdate(copy));
            });
        } else {
            deliverError(key, new GattOperationException("notification of " + key.characteristicUUID, change.getStatus()));
        }
    }

    private void deliverError(@NotNull final Key key, @NotNull final GattException exception) {
        final List<Registration> registered;
        synchronized (lock) {
            registered = registrations.get(key);
        }
        if (registered == null) return;
        registered.forEach(registration -> post(() -> registration.listener.onError(exception)));
    }

    private void post(@NotNull final Runnable runnable) {
        try {
            callbackHandler.post(runnable);
        } catch (RejectedExecutionException e) {
            logger.debug("callback handler is shut down, dropping listener call");
        }
    }

    /**
     * One listener of a characteristic with its optional subscription action.
     */
    static final class Registration {
        @NotNull
        private final Key key;

        @NotNull
        private final ObservationListener listener;

        @Nullable
        private final SubscriptionAction action;

        Registration(@NotNull final Key key, @NotNull final ObservationListener listener, @Nullable final SubscriptionAction action) {
            this.key = key;
            this.listener = listener;
            this.action = action;
        }

        @NotNull
        Key getKey() {
            return key;
        }
    }

    /**
     * Identifies an observed characteristic by its service and characteristic UUID.
     */
    static final class Key {
        @NotNull
        private final UUID serviceUUID;

        @NotNull
        private final UUID characteristicUUID;

        Key(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID) {
            this.serviceUUID = Objects.requireNonNull(serviceUUID, "no valid service UUID provided");
            this.characteristicUUID = Objects.requireNonNull(characteristicUUID, "no valid characteristic UUID provided");
        }

        @NotNull
        UUID getServiceUUID() {
            return serviceUUID;
        }

        @NotNull
        UUID getCharacteristicUUID() {
            return characteristicUUID;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Key key = (Key) o;
            return serviceUUID.equals(key.serviceUUID) && characteristicUUID.equals(key.characteristicUUID);
        }

        @Override
        public int hashCode() {
            return Objects.hash(serviceUUID, characteristicUUID);
        }
    }
}
