package com.welie.gattlink;

import com.welie.gattlink.adapter.NativeGattCharacteristic;
import com.welie.gattlink.adapter.NativeGattDescriptor;
import com.welie.gattlink.adapter.NativeGattService;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import static com.welie.gattlink.BluetoothGattCharacteristic.*;

/**
 * Read-only snapshot of the services of a connected peripheral.
 *
 * <p>A catalog is built in one go from the native service tree once discovery has finished and is never modified
 * afterwards. Lookups resolve UUIDs to the discovered objects and check the properties an operation needs.
 */
final class GattCatalog {

    @NotNull
    private final List<BluetoothGattService> services;

    private GattCatalog(@NotNull final List<BluetoothGattService> services) {
        this.services = Collections.unmodifiableList(services);
    }

    @NotNull
    static GattCatalog from(@NotNull final List<@NotNull NativeGattService> nativeServices) {
        Objects.requireNonNull(nativeServices, "no valid services provided");

        final List<BluetoothGattService> services = new ArrayList<>();
        for (NativeGattService nativeService : nativeServices) {
            final BluetoothGattService service = new BluetoothGattService(nativeService.getUuid());
            for (NativeGattCharacteristic nativeCharacteristic : nativeService.getGattCharacteristics()) {
                final int properties = mapFlagsToProperty(nativeCharacteristic.getFlags());
                final BluetoothGattCharacteristic characteristic = new BluetoothGattCharacteristic(nativeCharacteristic.getUuid(), properties, nativeCharacteristic);
                for (NativeGattDescriptor nativeDescriptor : nativeCharacteristic.getGattDescriptors()) {
                    characteristic.addDescriptor(new BluetoothGattDescriptor(nativeDescriptor.getUuid(), nativeDescriptor));
                }
                service.addCharacteristic(characteristic);
            }
            services.add(service);
        }
        return new GattCatalog(services);
    }

    static int mapFlagsToProperty(@NotNull final List<String> flags) {
        Objects.requireNonNull(flags, "flags list not valid");

        int result = 0;
        if (flags.contains("broadcast")) {
            result = result | PROPERTY_BROADCAST;
        }
        if (flags.contains("read")) {
            result = result | PROPERTY_READ;
        }
        if (flags.contains("write-without-response")) {
            result = result | PROPERTY_WRITE_NO_RESPONSE;
        }
        if (flags.contains("write")) {
            result = result | PROPERTY_WRITE;
        }
        if (flags.contains("notify")) {
            result = result | PROPERTY_NOTIFY;
        }
        if (flags.contains("indicate")) {
            result = result | PROPERTY_INDICATE;
        }
        if (flags.contains("authenticated-signed-writes")) {
            result = result | PROPERTY_SIGNED_WRITE;
        }
        if (flags.contains("extended-properties")) {
            result = result | PROPERTY_EXTENDED_PROPS;
        }
        return result;
    }

    @NotNull
    List<BluetoothGattService> getServices() {
        return services;
    }

    /**
     * Find a characteristic that has at least one of the required properties.
     *
     * <p>Services and characteristics are searched in discovery order. Of several characteristics with the same UUIDs,
     * the first one that has a required property wins.
     *
     * @param requiredProperties bit mask of acceptable properties, 0 to accept any characteristic
     */
    @NotNull
    BluetoothGattCharacteristic obtain(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, final int requiredProperties) throws AttributeNotFoundException, MissingPropertyException {
        Objects.requireNonNull(serviceUUID, "no valid service UUID provided");
        Objects.requireNonNull(characteristicUUID, "no valid characteristic UUID provided");

        BluetoothGattCharacteristic lacking = null;
        for (BluetoothGattService service : services) {
            if (!service.getUuid().equals(serviceUUID)) continue;

            for (BluetoothGattCharacteristic characteristic : service.getCharacteristics()) {
                if (!characteristic.getUuid().equals(characteristicUUID)) continue;

                if (requiredProperties == 0 || characteristic.supportsAny(requiredProperties)) {
                    return characteristic;
                }
                if (lacking == null) {
                    lacking = characteristic;
                }
            }
        }

        if (lacking != null) {
            throw new MissingPropertyException(characteristicUUID, requiredProperties, lacking.getProperties());
        }
        throw new AttributeNotFoundException(String.format("characteristic %s of service %s not found", characteristicUUID, serviceUUID));
    }

    @NotNull
    BluetoothGattDescriptor obtainDescriptor(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final UUID descriptorUUID) throws AttributeNotFoundException {
        Objects.requireNonNull(descriptorUUID, "no valid descriptor UUID provided");

        final BluetoothGattCharacteristic characteristic;
        try {
            characteristic = obtain(serviceUUID, characteristicUUID, 0);
        } catch (MissingPropertyException e) {
            throw new IllegalStateException("no properties were required", e);
        }

        final BluetoothGattDescriptor descriptor = characteristic.getDescriptor(descriptorUUID);
        if (descriptor == null) {
            throw new AttributeNotFoundException(String.format("descriptor %s of characteristic %s not found", descriptorUUID, characteristicUUID));
        }
        return descriptor;
    }
}
