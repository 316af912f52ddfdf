package com.welie.gattlink;

import com.welie.gattlink.BluetoothGattCharacteristic.WriteType;
import com.welie.gattlink.adapter.GattResponse;
import com.welie.gattlink.adapter.NativeAdapter;
import com.welie.gattlink.adapter.NativeGattCharacteristic;
import com.welie.gattlink.adapter.NativeGattDescriptor;
import com.welie.gattlink.internal.Handler;
import com.welie.gattlink.internal.Subscription;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static com.welie.gattlink.BluetoothBytesParser.bytes2String;
import static com.welie.gattlink.BluetoothGattCharacteristic.*;
import static com.welie.gattlink.adapter.ResponseKind.*;

/**
 * Represents a Bluetooth BLE peripheral
 *
 * <p>All operations block until they are done and throw a {@link GattException} when they fail. GATT operations need
 * a connected peripheral and run one at a time; concurrent callers are served in arrival order. Interrupting a caller
 * abandons its wait, the native operation itself is not cancelled.
 */
public final class BluetoothPeripheral implements Closeable {
    private static final String TAG = BluetoothPeripheral.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    private static final String NO_VALID_SERVICE_UUID_PROVIDED = "no valid service UUID provided";
    private static final String NO_VALID_CHARACTERISTIC_UUID_PROVIDED = "no valid characteristic UUID provided";
    private static final String NO_VALID_DESCRIPTOR_UUID_PROVIDED = "no valid descriptor UUID provided";
    private static final String NO_VALID_WRITE_TYPE_PROVIDED = "no valid writeType provided";
    private static final String NO_VALID_VALUE_PROVIDED = "no valid value provided";

    @NotNull
    private final UUID identifier;

    @NotNull
    private final NativeAdapter adapter;

    @NotNull
    private final BluetoothPeripheralCallback peripheralCallback;

    @NotNull
    private final Handler callBackHandler;

    @NotNull
    private final ConnectionStateMachine stateMachine;

    public BluetoothPeripheral(@NotNull final NativeAdapter adapter, @NotNull final UUID identifier) {
        this(adapter, identifier, PeripheralOptions.DEFAULT);
    }

    public BluetoothPeripheral(@NotNull final NativeAdapter adapter, @NotNull final UUID identifier, @NotNull final PeripheralOptions options) {
        this.adapter = Objects.requireNonNull(adapter, "no valid adapter provided");
        this.identifier = Objects.requireNonNull(identifier, "no valid identifier provided");
        Objects.requireNonNull(options, "no valid options provided");
        this.peripheralCallback = options.getCallback();
        this.callBackHandler = new Handler(identifier + "-callback");
        this.stateMachine = new ConnectionStateMachine(identifier, adapter, options, callBackHandler, new ConnectionStateMachine.Events() {
            @Override
            public void onServicesDiscovered(@NotNull List<BluetoothGattService> services) {
                post(() -> peripheralCallback.onServicesDiscovered(BluetoothPeripheral.this, services));
            }

            @Override
            public void onMtuChanged(int mtu) {
                post(() -> peripheralCallback.onMtuChanged(BluetoothPeripheral.this, mtu));
            }

            @Override
            public void onObservationError(@NotNull UUID serviceUUID, @NotNull UUID characteristicUUID, @NotNull GattException exception) {
                post(() -> peripheralCallback.onObservationError(BluetoothPeripheral.this, serviceUUID, characteristicUUID, exception));
            }
        });
    }

    /**
     * Connect to the peripheral and discover its services.
     *
     * <p>Returns immediately when already connected. Concurrent callers share one connection attempt and all get its
     * outcome. Observations that were registered earlier are re-armed before this method returns.
     *
     * @throws AdapterUnavailableException if the Bluetooth adapter is not powered on
     * @throws ConnectionLostException     if the link dropped while connecting
     * @throws GattOperationException      if service discovery failed
     * @throws NotReadyException           if this peripheral has been closed
     * @throws InterruptedException        if the calling thread was interrupted while waiting
     */
    public void connect() throws GattException, InterruptedException {
        stateMachine.connect();
    }

    /**
     * Disconnect from the peripheral and wait until the state is {@link ConnectionState.Disconnected}.
     *
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    public void disconnect() throws InterruptedException {
        logger.info(String.format("disconnecting %s", identifier));
        stateMachine.disconnect();
    }

    /**
     * Disconnect, stop all threads of this peripheral and unregister from the adapter. A closed peripheral cannot be
     * connected again.
     */
    @Override
    public void close() {
        stateMachine.close();
        callBackHandler.shutdown();
    }

    /**
     * Read a characteristic.
     *
     * @param serviceUUID        the service the characteristic belongs to
     * @param characteristicUUID the characteristic to read
     * @return the value that was read
     * @throws NotReadyException           if not connected
     * @throws AttributeNotFoundException  if the characteristic was not discovered
     * @throws MissingPropertyException    if the characteristic cannot be read
     * @throws GattOperationException      if the peripheral reported an error
     * @throws ConnectionLostException     if the link dropped before the value arrived
     */
    @NotNull
    public byte[] read(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID) throws GattException, InterruptedException {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);

        final Connection connection = stateMachine.getConnection();
        final NativeGattCharacteristic nativeCharacteristic = obtainNative(serviceUUID, characteristicUUID, PROPERTY_READ);

        logger.info(String.format("reading characteristic <%s>", characteristicUUID));
        final byte[] value = connection.readCharacteristic(nativeCharacteristic);
        logger.debug(String.format("read <%s> from characteristic <%s>", bytes2String(value), characteristicUUID));
        return value;
    }

    /**
     * Write a characteristic.
     *
     * <p>A write with response returns when the peripheral acknowledged it. A write without response waits until the
     * transport can take it and returns as soon as it was handed over.
     *
     * @throws MissingPropertyException if the characteristic does not support the write type
     */
    public void write(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final byte[] value, @NotNull final WriteType writeType) throws GattException, InterruptedException {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);
        Objects.requireNonNull(value, NO_VALID_VALUE_PROVIDED);
        Objects.requireNonNull(writeType, NO_VALID_WRITE_TYPE_PROVIDED);

        // Copy the value to avoid race conditions
        final byte[] bytesToWrite = value.clone();

        final Connection connection = stateMachine.getConnection();
        final NativeGattCharacteristic nativeCharacteristic = obtainNative(serviceUUID, characteristicUUID, writeType.getProperty());

        if (writeType == WriteType.WITHOUT_RESPONSE) {
            connection.writeWithoutResponse(nativeCharacteristic, bytesToWrite);
            return;
        }

        logger.info(String.format("writing %s <%s> to characteristic <%s>", writeType, bytes2String(bytesToWrite), characteristicUUID));
        connection.execute(CHARACTERISTIC_WRITTEN, () -> adapter.write(identifier, nativeCharacteristic, bytesToWrite, writeType));
    }

    /**
     * Read a descriptor. Values the stack reports as text or numbers are converted with
     * {@link DescriptorValues#normalize(UUID, Object)}.
     */
    @NotNull
    public byte[] readDescriptor(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final UUID descriptorUUID) throws GattException, InterruptedException {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);
        Objects.requireNonNull(descriptorUUID, NO_VALID_DESCRIPTOR_UUID_PROVIDED);

        final Connection connection = stateMachine.getConnection();
        final NativeGattDescriptor nativeDescriptor = obtainNativeDescriptor(serviceUUID, characteristicUUID, descriptorUUID);

        logger.info(String.format("reading descriptor <%s>", descriptorUUID));
        final GattResponse response = connection.execute(DESCRIPTOR_READ, () -> adapter.read(identifier, nativeDescriptor));
        return DescriptorValues.normalize(descriptorUUID, response.getValue());
    }

    public void writeDescriptor(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final UUID descriptorUUID, @NotNull final byte[] value) throws GattException, InterruptedException {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);
        Objects.requireNonNull(descriptorUUID, NO_VALID_DESCRIPTOR_UUID_PROVIDED);
        Objects.requireNonNull(value, NO_VALID_VALUE_PROVIDED);

        final byte[] bytesToWrite = value.clone();
        final Connection connection = stateMachine.getConnection();
        final NativeGattDescriptor nativeDescriptor = obtainNativeDescriptor(serviceUUID, characteristicUUID, descriptorUUID);

        logger.info(String.format("writing <%s> to descriptor <%s>", bytes2String(bytesToWrite), descriptorUUID));
        connection.execute(DESCRIPTOR_WRITTEN, () -> adapter.write(identifier, nativeDescriptor, bytesToWrite));
    }

    /**
     * Observe a characteristic's notifications or indications.
     *
     * <p>May be called while disconnected; notifications are then enabled on the next connection. When connected and
     * this is the first listener of the characteristic, notifications are enabled before this method returns.
     *
     * @return the registration, close it to stop observing
     */
    @NotNull
    public Observation observe(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final ObservationListener listener) throws GattException, InterruptedException {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);
        Objects.requireNonNull(listener, "no valid listener provided");

        return observe(serviceUUID, characteristicUUID, listener, null);
    }

    /**
     * Observe a characteristic and run an action each time its notifications have been enabled: right away when
     * connected, and after every reconnect.
     *
     * <p>When the action fails while observing, the listener is not registered and the failure is thrown. When it fails
     * on a reconnect, the failure goes to the listener and to {@link BluetoothPeripheralCallback#onObservationError}.
     *
     * @param action the action to run, or null for none
     * @return the registration, close it to stop observing
     */
    @NotNull
    public Observation observe(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final ObservationListener listener, @Nullable final SubscriptionAction action) throws GattException, InterruptedException {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);
        Objects.requireNonNull(listener, "no valid listener provided");

        return stateMachine.getObservers().observe(serviceUUID, characteristicUUID, listener, action);
    }

    /**
     * Read the signal strength of the link.
     *
     * @return RSSI in dBm
     */
    public int readRssi() throws GattException, InterruptedException {
        final Connection connection = stateMachine.getConnection();
        final int rssi = connection.execute(RSSI_READ, () -> adapter.readRssi(identifier)).getRssi();
        logger.debug(String.format("rssi of %s is %d", identifier, rssi));
        return rssi;
    }

    @NotNull
    private NativeGattCharacteristic obtainNative(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, final int requiredProperties) throws GattException {
        final BluetoothGattCharacteristic characteristic = stateMachine.getCatalog().obtain(serviceUUID, characteristicUUID, requiredProperties);
        return Objects.requireNonNull(characteristic.getNativeCharacteristic(), "characteristic was not discovered");
    }

    @NotNull
    private NativeGattDescriptor obtainNativeDescriptor(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final UUID descriptorUUID) throws GattException {
        final BluetoothGattDescriptor descriptor = stateMachine.getCatalog().obtainDescriptor(serviceUUID, characteristicUUID, descriptorUUID);
        return Objects.requireNonNull(descriptor.getNativeDescriptor(), "descriptor was not discovered");
    }

    private void post(@NotNull final Runnable runnable) {
        try {
            callBackHandler.post(runnable);
        } catch (RejectedExecutionException e) {
            logger.debug("callback handler is shut down, dropping callback");
        }
    }

    /**
     * Listen to state changes. The listener is first called with the current state, then with every change, on the
     * callback thread.
     *
     * @return the registration, close it to stop listening
     */
    @NotNull
    public Subscription addStateListener(@NotNull final Consumer<ConnectionState> listener) {
        Objects.requireNonNull(listener, "no valid listener provided");
        return stateMachine.getState().subscribe(state -> post(() -> listener.accept(state)));
    }

    /**
     * Get the list of services discovered on the current connection.
     *
     * @return the services, or null when services have not been discovered
     */
    @Nullable
    public List<BluetoothGattService> getServices() {
        final GattCatalog catalog = stateMachine.findCatalog();
        return catalog == null ? null : catalog.getServices();
    }

    /**
     * Get the BluetoothGattService object for a service UUID.
     *
     * @param serviceUUID the UUID of the service
     * @return the service, or null if it was not discovered
     */
    @Nullable
    public BluetoothGattService getService(@NotNull final UUID serviceUUID) {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);

        final List<BluetoothGattService> services = getServices();
        if (services == null) return null;
        for (BluetoothGattService service : services) {
            if (service.getUuid().equals(serviceUUID)) {
                return service;
            }
        }
        return null;
    }

    @Nullable
    public BluetoothGattCharacteristic getCharacteristic(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID) {
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);

        final BluetoothGattService service = getService(serviceUUID);
        return service == null ? null : service.getCharacteristic(characteristicUUID);
    }

    /**
     * @return the MTU reported by service discovery on the current connection, or null when not known
     */
    @Nullable
    public Integer getMtu() {
        return stateMachine.getMtu();
    }

    @NotNull
    public UUID getIdentifier() {
        return identifier;
    }

    @NotNull
    public ConnectionState getState() {
        return stateMachine.getState().getValue();
    }

    public boolean isClosed() {
        return stateMachine.isClosed();
    }

    @Override
    public String toString() {
        return String.format("BluetoothPeripheral(%s, %s)", identifier, getState());
    }
}
