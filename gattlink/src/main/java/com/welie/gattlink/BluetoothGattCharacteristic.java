package com.welie.gattlink;

import com.welie.gattlink.adapter.NativeGattCharacteristic;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Represents a discovered Bluetooth GATT Characteristic
 *
 * <p>A GATT characteristic is a basic data element used to construct a GATT service,
 * {@link BluetoothGattService}. The characteristic contains a value as well as
 * additional information and optional GATT descriptors, {@link BluetoothGattDescriptor}.
 */
public class BluetoothGattCharacteristic {

    /**
     * Characteristic proprty: Characteristic is broadcastable.
     */
    public static final int PROPERTY_BROADCAST = 0x01;

    /**
     * Characteristic property: Characteristic is readable.
     */
    public static final int PROPERTY_READ = 0x02;

    /**
     * Characteristic property: Characteristic can be written without response.
     */
    public static final int PROPERTY_WRITE_NO_RESPONSE = 0x04;

    /**
     * Characteristic property: Characteristic can be written.
     */
    public static final int PROPERTY_WRITE = 0x08;

    /**
     * Characteristic property: Characteristic supports notification
     */
    public static final int PROPERTY_NOTIFY = 0x10;

    /**
     * Characteristic property: Characteristic supports indication
     */
    public static final int PROPERTY_INDICATE = 0x20;

    /**
     * Characteristic property: Characteristic supports write with signature
     */
    public static final int PROPERTY_SIGNED_WRITE = 0x40;

    /**
     * Characteristic property: Characteristic has extended properties
     */
    public static final int PROPERTY_EXTENDED_PROPS = 0x80;

    public enum WriteType {
        /**
         * Write with response (aka write request)
         */
        WITH_RESPONSE(PROPERTY_WRITE),

        /**
         * Write without response (aka write command)
         */
        WITHOUT_RESPONSE(PROPERTY_WRITE_NO_RESPONSE);

        private final int property;

        WriteType(int property) {
            this.property = property;
        }

        /**
         * @return the characteristic property a characteristic needs to support this write type
         */
        public int getProperty() {
            return property;
        }
    }

    /**
     * The UUID of this characteristic.
     */
    @NotNull
    protected final UUID uuid;

    /**
     * Characteristic properties.
     */
    protected final int properties;

    /**
     * Native handle this characteristic was discovered from, null for characteristics created by hand.
     */
    @Nullable
    private final NativeGattCharacteristic nativeCharacteristic;

    /**
     * Back-reference to the service this characteristic belongs to.
     */
    @Nullable
    protected BluetoothGattService service;

    /**
     * List of descriptors included in this characteristic.
     */
    protected final List<BluetoothGattDescriptor> descriptors = new ArrayList<>();

    /**
     * Create a new BluetoothGattCharacteristic.
     *
     * @param uuid The UUID for this characteristic
     * @param properties Properties of this characteristic
     */
    public BluetoothGattCharacteristic(@NotNull UUID uuid, int properties) {
        this(uuid, properties, null);
    }

    BluetoothGattCharacteristic(@NotNull UUID uuid, int properties, @Nullable NativeGattCharacteristic nativeCharacteristic) {
        this.uuid = Objects.requireNonNull(uuid, "no valid UUID supplied");
        this.properties = properties;
        this.nativeCharacteristic = nativeCharacteristic;
    }

    /**
     * Adds a descriptor to this characteristic.
     *
     * @param descriptor Descriptor to be added to this characteristic.
     * @return true, if the descriptor was added to the characteristic
     */
    boolean addDescriptor(@NotNull BluetoothGattDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "no valid descriptor supplied");
        descriptor.setCharacteristic(this);
        return descriptors.add(descriptor);
    }

    /**
     * Returns the service this characteristic belongs to.
     *
     * @return The asscociated service
     */
    public @Nullable BluetoothGattService getService() {
        return service;
    }

    void setService(@NotNull BluetoothGattService service) {
        this.service = Objects.requireNonNull(service, "no valid service supplied");
    }

    /**
     * Returns the UUID of this characteristic
     *
     * @return UUID of this characteristic
     */
    public @NotNull UUID getUuid() {
        return uuid;
    }

    /**
     * Returns the properties of this characteristic.
     *
     * <p>The properties contain a bit mask of property flags indicating
     * the features of this characteristic.
     *
     * @return Properties of this characteristic
     */
    public int getProperties() {
        return properties;
    }

    @Nullable
    NativeGattCharacteristic getNativeCharacteristic() {
        return nativeCharacteristic;
    }

    /**
     * Returns a list of descriptors for this characteristic.
     *
     * @return Descriptors for this characteristic
     */
    public @NotNull List<BluetoothGattDescriptor> getDescriptors() {
        return Collections.unmodifiableList(descriptors);
    }

    /**
     * Returns a descriptor with a given UUID out of the list of
     * descriptors for this characteristic.
     *
     * @param uuid the UUID of the descriptor
     * @return GATT descriptor object or null if no descriptor with the given UUID was found.
     */
    public @Nullable BluetoothGattDescriptor getDescriptor(@NotNull UUID uuid) {
        Objects.requireNonNull(uuid, "no valid uuid supplied");

        for (BluetoothGattDescriptor descriptor : descriptors) {
            if (descriptor.getUuid().equals(uuid)) {
                return descriptor;
            }
        }
        return null;
    }

    /**
     * @param requiredProperties bit mask of properties
     * @return true if this characteristic has at least one of the given properties
     */
    public boolean supportsAny(int requiredProperties) {
        return (properties & requiredProperties) != 0;
    }

    public boolean supportsReading() {
        return (properties & PROPERTY_READ) > 0;
    }

    public boolean supportsWritingWithResponse() {
        return (properties & PROPERTY_WRITE) > 0;
    }

    public boolean supportsWritingWithoutResponse() {
        return (properties & PROPERTY_WRITE_NO_RESPONSE) > 0;
    }

    public boolean supportsNotifying() {
        return (((properties & PROPERTY_NOTIFY) > 0) || ((properties & PROPERTY_INDICATE) > 0));
    }

    public boolean supportsWriteType(@NotNull WriteType writeType) {
        Objects.requireNonNull(writeType, "no valid writeType supplied");
        return supportsAny(writeType.getProperty());
    }

    @Override
    public String toString() {
        return String.format("BluetoothGattCharacteristic(%s, properties 0x%02X)", uuid, properties);
    }
}
