package com.welie.gattlink;

import com.welie.gattlink.adapter.AdapterState;
import com.welie.gattlink.adapter.CharacteristicChange;
import com.welie.gattlink.adapter.ConnectionEvent;
import com.welie.gattlink.adapter.GattResponse;
import com.welie.gattlink.adapter.NativeAdapter;
import com.welie.gattlink.adapter.NativeAdapterCallback;
import com.welie.gattlink.adapter.NativeGattCharacteristic;
import com.welie.gattlink.adapter.NativeGattService;
import com.welie.gattlink.internal.EventStream;
import com.welie.gattlink.internal.Handler;
import com.welie.gattlink.internal.StateSignal;
import com.welie.gattlink.internal.Subscription;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.welie.gattlink.BluetoothCommandStatus.OPERATION_FAILED;
import static com.welie.gattlink.ConnectionState.*;
import static com.welie.gattlink.adapter.AdapterState.POWERED_ON;
import static com.welie.gattlink.adapter.ResponseKind.*;

/**
 * Drives the connection to one peripheral and is the only writer of its {@link ConnectionState}.
 *
 * <p>A connect attempt runs on its own thread and is shared by every caller of {@link #connect()} while it runs. The
 * native stack's events arrive on the adapter's thread; link loss is handled there so that waiting operations fail
 * straight away.
 */
final class ConnectionStateMachine {
    private static final String TAG = ConnectionStateMachine.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    /**
     * Outbound events of a connect attempt.
     */
    interface Events {
        void onServicesDiscovered(@NotNull List<BluetoothGattService> services);

        void onMtuChanged(int mtu);

        void onObservationError(@NotNull UUID serviceUUID, @NotNull UUID characteristicUUID, @NotNull GattException exception);
    }

    @NotNull
    private final UUID deviceId;

    @NotNull
    private final NativeAdapter adapter;

    @NotNull
    private final PeripheralOptions options;

    @NotNull
    private final Events events;

    @NotNull
    private final Handler connectHandler;

    private final EventStream<ConnectionEvent> connectionEvents = new EventStream<>("connection events");
    private final EventStream<GattResponse> responses = new EventStream<>("responses");
    private final EventStream<CharacteristicChange> characteristicChanges = new EventStream<>("characteristic changes");
    private final EventStream<AdapterState> adapterStates = new EventStream<>("adapter states");
    private final StateSignal<Boolean> writeReadiness = new StateSignal<>(false);
    private final StateSignal<ConnectionState> state = new StateSignal<>(DISCONNECTED);

    @NotNull
    private final Observers observers;

    @NotNull
    private final NativeAdapterCallback adapterCallback;

    private final Object stateLock = new Object();

    // Written under stateLock
    @Nullable
    private volatile Connection connection;

    // Written under stateLock
    @Nullable
    private volatile GattCatalog catalog;

    // Written under stateLock
    @Nullable
    private volatile Integer mtu;

    // Guarded by stateLock
    @Nullable
    private CompletableFuture<Void> attempt;

    // Guarded by stateLock
    private boolean disposed = false;

    ConnectionStateMachine(@NotNull final UUID deviceId,
                           @NotNull final NativeAdapter adapter,
                           @NotNull final PeripheralOptions options,
                           @NotNull final Handler callbackHandler,
                           @NotNull final Events events) {
        this.deviceId = Objects.requireNonNull(deviceId, "no valid device id provided");
        this.adapter = Objects.requireNonNull(adapter, "no valid adapter provided");
        this.options = Objects.requireNonNull(options, "no valid options provided");
        this.events = Objects.requireNonNull(events, "no valid events provided");
        this.connectHandler = new Handler(deviceId + "-connect");
        this.observers = new Observers(deviceId, adapter, characteristicChanges, callbackHandler, events::onObservationError);
        this.adapterCallback = new NativeAdapterCallback() {
            @Override
            public void onAdapterStateChanged(@NotNull AdapterState adapterState) {
                adapterStates.emit(adapterState);
            }

            @Override
            public void onConnectionEvent(@NotNull ConnectionEvent event) {
                if (!deviceId.equals(event.getDeviceId())) return;
                handleConnectionEvent(event);
                connectionEvents.emit(event);
            }

            @Override
            public void onResponse(@NotNull GattResponse response) {
                if (!deviceId.equals(response.getDeviceId())) return;
                responses.emit(response);
            }

            @Override
            public void onCharacteristicChanged(@NotNull CharacteristicChange change) {
                if (!deviceId.equals(change.getDeviceId())) return;
                characteristicChanges.emit(change);
            }

            @Override
            public void onReadyToSendWriteWithoutResponse(@NotNull UUID id) {
                if (!deviceId.equals(id)) return;
                writeReadiness.setValue(true);
            }
        };
        adapter.addCallback(adapterCallback);
    }

    @NotNull
    StateSignal<ConnectionState> getState() {
        return state;
    }

    @NotNull
    Observers getObservers() {
        return observers;
    }

    /**
     * @return the connection, once the link is up
     * @throws NotReadyException if there is no established connection
     */
    @NotNull
    Connection getConnection() throws NotReadyException {
        final Connection current = connection;
        if (current == null || !current.isEstablished() || !current.isAlive()) {
            throw new NotReadyException(String.format("peripheral %s is not connected", deviceId));
        }
        return current;
    }

    /**
     * @return the discovered services of the current connection
     * @throws NotReadyException if services have not been discovered on the current connection
     */
    @NotNull
    GattCatalog getCatalog() throws NotReadyException {
        final GattCatalog current = catalog;
        if (current == null) {
            throw new NotReadyException(String.format("services of peripheral %s have not been discovered", deviceId));
        }
        return current;
    }

    @Nullable
    GattCatalog findCatalog() {
        return catalog;
    }

    @Nullable
    Integer getMtu() {
        return mtu;
    }

    /**
     * Connect, or join the connect attempt already in progress. Returns immediately when connected.
     */
    void connect() throws GattException, InterruptedException {
        final CompletableFuture<Void> current;
        synchronized (stateLock) {
            if (disposed) {
                throw new NotReadyException(String.format("peripheral %s has been closed", deviceId));
            }
            if (state.getValue().isConnected()) return;

            if (attempt == null || attempt.isDone()) {
                final CompletableFuture<Void> created = new CompletableFuture<>();
                attempt = created;
                connectHandler.post(() -> runAttempt(created));
            }
            current = attempt;
        }

        try {
            current.get();
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof GattException) throw (GattException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("connect attempt failed", cause);
        }
    }

    private void runAttempt(@NotNull final CompletableFuture<Void> result) {
        try {
            establishConnection();
            result.complete(null);
        } catch (GattException | RuntimeException e) {
            result.completeExceptionally(e);
        } catch (InterruptedException e) {
            logger.info(String.format("connect attempt for %s interrupted", deviceId));
            result.cancel(false);
            Thread.currentThread().interrupt();
        }
    }

    private void establishConnection() throws GattException, InterruptedException {
        if (state.getValue() instanceof Disconnecting) {
            logger.info("waiting for pending disconnect to finish");
            awaitDisconnected();
        }

        final Connection newConnection = new Connection(deviceId, adapter, responses, characteristicChanges, writeReadiness);
        final Subscription adapterWatcher = adapterStates.subscribe(adapterState -> {
            if (adapterState != POWERED_ON) {
                logger.info(String.format("Bluetooth adapter became %s while connecting", adapterState));
                closeConnection();
                newConnection.fail(new AdapterUnavailableException(adapterState));
            }
        });

        try {
            final AdapterState adapterState = adapter.getAdapterState();
            if (adapterState != POWERED_ON) {
                throw new AdapterUnavailableException(adapterState);
            }

            synchronized (stateLock) {
                connection = newConnection;
                catalog = null;
                mtu = null;
                publish(LINK_ESTABLISHING);
            }

            logger.info(String.format("connecting to %s", deviceId));
            final CompletableFuture<ConnectionEvent> connected = connectionEvents.first(event -> event.getType() == ConnectionEvent.Type.CONNECTED);
            try {
                adapter.connect(deviceId);
            } catch (RuntimeException e) {
                connected.cancel(false);
                throw new GattOperationException("connect", OPERATION_FAILED, e);
            }
            newConnection.await(connected);
            expect(newConnection, DISCOVERING_SERVICES);

            final GattCatalog discovered = discoverServices(newConnection);
            events.onServicesDiscovered(discovered.getServices());

            advance(newConnection, DISCOVERING_SERVICES, CONFIGURING_OBSERVATIONS);
            logger.info("configuring characteristic observations");
            observers.onConnected(newConnection, discovered);

            advance(newConnection, CONFIGURING_OBSERVATIONS, CONNECTED);
            logger.info(String.format("connected to %s", deviceId));
        } catch (GattException | InterruptedException | RuntimeException e) {
            logger.error(String.format("failed to connect to %s: %s", deviceId, e.getMessage()));
            closeConnection();
            abandon(newConnection, e);
            throw e;
        } finally {
            adapterWatcher.close();
        }
    }

    @NotNull
    private GattCatalog discoverServices(@NotNull final Connection target) throws GattException, InterruptedException {
        logger.info("discovering services");
        final GattResponse servicesDiscovered = target.execute(SERVICES_DISCOVERED, () -> adapter.discoverServices(deviceId, options.getServiceFilter()));
        final int negotiatedMtu = servicesDiscovered.getMtu();
        events.onMtuChanged(negotiatedMtu);

        for (NativeGattService service : adapter.getServices(deviceId)) {
            target.execute(CHARACTERISTICS_DISCOVERED, () -> adapter.discoverCharacteristics(deviceId, service));
            for (NativeGattCharacteristic characteristic : service.getGattCharacteristics()) {
                target.execute(DESCRIPTORS_DISCOVERED, () -> adapter.discoverDescriptors(deviceId, characteristic));
            }
        }

        final GattCatalog discovered = GattCatalog.from(adapter.getServices(deviceId));
        synchronized (stateLock) {
            expect(target, DISCOVERING_SERVICES);
            catalog = discovered;
            mtu = negotiatedMtu;
        }
        logger.info(String.format("discovered %d services", discovered.getServices().size()));
        return discovered;
    }

    private void expect(@NotNull final Connection target, @NotNull final ConnectionState expected) throws GattException {
        synchronized (stateLock) {
            target.checkAlive();
            if (connection != target || !state.getValue().equals(expected)) {
                throw new ConnectionLostException(String.format("connect attempt for %s was aborted", deviceId), null);
            }
        }
    }

    private void advance(@NotNull final Connection target, @NotNull final ConnectionState from, @NotNull final ConnectionState to) throws GattException {
        synchronized (stateLock) {
            expect(target, from);
            publish(to);
        }
    }

    /**
     * Forget a failed attempt's connection and make sure the state ends up Disconnected.
     */
    private void abandon(@NotNull final Connection failed, @NotNull final Exception cause) {
        final DisconnectReason reason;
        if (cause instanceof ConnectionLostException) {
            reason = ((ConnectionLostException) cause).getReason();
        } else if (cause instanceof AdapterUnavailableException) {
            reason = DisconnectReason.ADAPTER_FAILURE;
        } else {
            reason = null;
        }

        final boolean current;
        synchronized (stateLock) {
            current = connection == failed;
            if (current) {
                connection = null;
                catalog = null;
                mtu = null;
            }
        }
        failed.fail(cause instanceof GattException ? (GattException) cause : new ConnectionLostException("connect attempt aborted", reason));
        if (current) {
            observers.onDisconnected();
        }
        setDisconnected(reason);
    }

    private void handleConnectionEvent(@NotNull final ConnectionEvent event) {
        logger.info(String.format("connection event %s for %s", event, deviceId));
        switch (event.getType()) {
            case CONNECTED:
                synchronized (stateLock) {
                    final Connection current = connection;
                    if (current != null && state.getValue() == LINK_ESTABLISHING) {
                        current.markEstablished();
                        publish(DISCOVERING_SERVICES);
                    }
                }
                break;
            case CONNECT_FAILED:
            case DISCONNECTED:
                onLinkLost(DisconnectReason.fromNullableCode(event.getErrorCode()));
                break;
        }
    }

    /**
     * Dispose the connection, fail everything waiting on it and publish Disconnected, in that order.
     */
    private void onLinkLost(@Nullable final DisconnectReason reason) {
        final Connection lost;
        synchronized (stateLock) {
            lost = connection;
            if (lost == null && state.getValue().isDisconnected()) return;
            connection = null;
            catalog = null;
            mtu = null;
        }

        if (lost != null) {
            lost.fail(new ConnectionLostException(String.format("peripheral %s disconnected", deviceId), reason));
        }
        observers.onDisconnected();
        synchronized (stateLock) {
            publish(ConnectionState.disconnected(reason));
        }
    }

    /**
     * Disconnect and wait until the state is Disconnected. The native teardown is issued even when already
     * disconnected.
     */
    void disconnect() throws InterruptedException {
        synchronized (stateLock) {
            if (!state.getValue().isDisconnected()) {
                publish(DISCONNECTING);
            }
        }
        closeConnection();
        awaitDisconnected();
    }

    private void awaitDisconnected() throws InterruptedException {
        final CompletableFuture<ConnectionState> disconnected = state.first(ConnectionState::isDisconnected);
        try {
            disconnected.get(options.getDisconnectTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn(String.format("no disconnect reported for %s within %d ms, forcing disconnected state", deviceId, options.getDisconnectTimeoutMillis()));
            onLinkLost(null);
        } catch (ExecutionException e) {
            throw new IllegalStateException("waiting for disconnect failed", e.getCause());
        } finally {
            disconnected.cancel(false);
        }
    }

    private void closeConnection() {
        try {
            adapter.cancelConnection(deviceId);
        } catch (RuntimeException e) {
            logger.error(String.format("cancelling connection to %s failed", deviceId), e);
        }
    }

    /**
     * Stop everything. Callers waiting in {@link #connect()} get a {@link java.util.concurrent.CancellationException}.
     */
    void close() {
        final CompletableFuture<Void> pendingAttempt;
        synchronized (stateLock) {
            if (disposed) return;
            disposed = true;
            pendingAttempt = attempt;
        }

        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
        }
        connectHandler.shutdownNow();
        closeConnection();

        final Connection lost;
        synchronized (stateLock) {
            lost = connection;
            connection = null;
            catalog = null;
            mtu = null;
        }
        if (lost != null) {
            lost.fail(new ConnectionLostException(String.format("peripheral %s closed", deviceId), null));
        }
        observers.onDisconnected();
        setDisconnected(null);

        adapter.removeCallback(adapterCallback);
        observers.close();
        logger.info(String.format("peripheral %s closed", deviceId));
    }

    boolean isClosed() {
        synchronized (stateLock) {
            return disposed;
        }
    }

    // Keeps an existing Disconnected state and its reason
    private void setDisconnected(@Nullable final DisconnectReason reason) {
        synchronized (stateLock) {
            if (!state.getValue().isDisconnected()) {
                publish(ConnectionState.disconnected(reason));
            }
        }
    }

    // Must hold stateLock
    private void publish(@NotNull final ConnectionState newState) {
        final ConnectionState previous = state.getValue();
        if (previous.equals(newState)) return;
        logger.info(String.format("state %s -> %s", previous, newState));
        state.setValue(newState);
    }
}
