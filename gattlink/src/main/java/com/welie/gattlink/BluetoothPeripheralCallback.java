package com.welie.gattlink;


import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.UUID;

/**
 * Callbacks for BluetoothPeripheral events that are not the result of a blocking call.
 *
 * <p>All callbacks are delivered on the peripheral's callback thread, in the order the events happened.
 */
public abstract class BluetoothPeripheralCallback {

    /**
     * Callback invoked once per successful connection, after all services, characteristics and descriptors
     * have been discovered and before observations are re-armed.
     *
     * @param peripheral the peripheral
     * @param services the discovered services
     */
    public void onServicesDiscovered(@NotNull BluetoothPeripheral peripheral, @NotNull List<BluetoothGattService> services) {}

    /**
     * Callback invoked when service discovery reports the negotiated MTU.
     *
     * @param peripheral the peripheral
     * @param mtu the new MTU
     */
    public void onMtuChanged(@NotNull BluetoothPeripheral peripheral, int mtu) {}

    /**
     * Callback invoked when notifications for an observed characteristic could not be enabled on (re)connection.
     * The connection itself stays up. The observation's listeners get the same exception.
     *
     * @param peripheral the peripheral
     * @param serviceUUID the service of the observed characteristic
     * @param characteristicUUID the observed characteristic
     * @param exception what went wrong
     */
    public void onObservationError(@NotNull BluetoothPeripheral peripheral, @NotNull UUID serviceUUID, @NotNull UUID characteristicUUID, @NotNull GattException exception) {}

    /**
     * NULL class to deal with nullability
     */
    static class NULL extends BluetoothPeripheralCallback { }
}
