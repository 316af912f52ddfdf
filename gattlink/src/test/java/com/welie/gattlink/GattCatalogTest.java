package com.welie.gattlink;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;
import java.util.UUID;

import static com.welie.gattlink.BluetoothGattCharacteristic.*;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GattCatalogTest {

    private static final UUID SERVICE_UUID = UUID.fromString("0000180D-0000-1000-8000-00805f9b34fb");
    private static final UUID OTHER_SERVICE_UUID = UUID.fromString("0000180A-0000-1000-8000-00805f9b34fb");
    private static final UUID CHARACTERISTIC_UUID = UUID.fromString("00002A37-0000-1000-8000-00805f9b34fb");
    private static final UUID DESCRIPTOR_UUID = DescriptorValues.CCC_DESCRIPTOR_UUID;

    @Test
    void When_mapping_flags_then_every_known_flag_sets_its_property() {
        assertEquals(PROPERTY_BROADCAST, GattCatalog.mapFlagsToProperty(Collections.singletonList("broadcast")));
        assertEquals(PROPERTY_READ, GattCatalog.mapFlagsToProperty(Collections.singletonList("read")));
        assertEquals(PROPERTY_WRITE_NO_RESPONSE, GattCatalog.mapFlagsToProperty(Collections.singletonList("write-without-response")));
        assertEquals(PROPERTY_WRITE, GattCatalog.mapFlagsToProperty(Collections.singletonList("write")));
        assertEquals(PROPERTY_NOTIFY, GattCatalog.mapFlagsToProperty(Collections.singletonList("notify")));
        assertEquals(PROPERTY_INDICATE, GattCatalog.mapFlagsToProperty(Collections.singletonList("indicate")));
        assertEquals(PROPERTY_SIGNED_WRITE, GattCatalog.mapFlagsToProperty(Collections.singletonList("authenticated-signed-writes")));
        assertEquals(PROPERTY_EXTENDED_PROPS, GattCatalog.mapFlagsToProperty(Collections.singletonList("extended-properties")));
    }

    @Test
    void When_mapping_several_flags_then_the_properties_are_combined_and_unknown_flags_ignored() {
        final int properties = GattCatalog.mapFlagsToProperty(Arrays.asList("read", "notify", "reliable-write"));

        assertEquals(PROPERTY_READ | PROPERTY_NOTIFY, properties);
    }

    @Test
    void Given_native_services_when_building_the_catalog_then_the_tree_is_linked() throws Exception {
        // Given
        final FakeNativeAdapter.FakeService service = new FakeNativeAdapter.FakeService(SERVICE_UUID);
        service.addCharacteristic(CHARACTERISTIC_UUID, "read", "notify").addDescriptor(DESCRIPTOR_UUID);

        // When
        final GattCatalog catalog = GattCatalog.from(Collections.singletonList(service));

        // Then
        assertEquals(1, catalog.getServices().size());
        final BluetoothGattCharacteristic characteristic = catalog.obtain(SERVICE_UUID, CHARACTERISTIC_UUID, PROPERTY_READ);
        assertSame(catalog.getServices().get(0), characteristic.getService());
        assertTrue(characteristic.supportsReading());
        assertTrue(characteristic.supportsNotifying());
        final BluetoothGattDescriptor descriptor = catalog.obtainDescriptor(SERVICE_UUID, CHARACTERISTIC_UUID, DESCRIPTOR_UUID);
        assertSame(characteristic, descriptor.getCharacteristic());
        assertThrows(UnsupportedOperationException.class, () -> catalog.getServices().clear());
    }

    @Test
    void Given_duplicate_characteristics_when_obtaining_then_the_first_one_with_the_property_wins() throws Exception {
        // Given
        final FakeNativeAdapter.FakeService service = new FakeNativeAdapter.FakeService(SERVICE_UUID);
        service.addCharacteristic(CHARACTERISTIC_UUID, "read");
        service.addCharacteristic(CHARACTERISTIC_UUID, "write");
        final GattCatalog catalog = GattCatalog.from(Collections.singletonList(service));

        // When
        final BluetoothGattCharacteristic writable = catalog.obtain(SERVICE_UUID, CHARACTERISTIC_UUID, PROPERTY_WRITE);
        final BluetoothGattCharacteristic any = catalog.obtain(SERVICE_UUID, CHARACTERISTIC_UUID, 0);

        // Then
        assertEquals(PROPERTY_WRITE, writable.getProperties());
        assertEquals(PROPERTY_READ, any.getProperties());
    }

    @Test
    void Given_a_characteristic_without_the_property_when_obtaining_then_MissingProperty_is_thrown() {
        // Given
        final FakeNativeAdapter.FakeService service = new FakeNativeAdapter.FakeService(SERVICE_UUID);
        service.addCharacteristic(CHARACTERISTIC_UUID, "read");
        final GattCatalog catalog = GattCatalog.from(Collections.singletonList(service));

        // When
        final MissingPropertyException exception = assertThrows(MissingPropertyException.class,
                () -> catalog.obtain(SERVICE_UUID, CHARACTERISTIC_UUID, PROPERTY_NOTIFY | PROPERTY_INDICATE));

        // Then
        assertEquals(PROPERTY_NOTIFY | PROPERTY_INDICATE, exception.getRequiredProperties());
        assertEquals(PROPERTY_READ, exception.getActualProperties());
    }

    @Test
    void Given_a_characteristic_in_another_service_when_obtaining_then_NotFound_is_thrown() {
        // Given
        final FakeNativeAdapter.FakeService service = new FakeNativeAdapter.FakeService(OTHER_SERVICE_UUID);
        service.addCharacteristic(CHARACTERISTIC_UUID, "read");
        final GattCatalog catalog = GattCatalog.from(Collections.singletonList(service));

        // When / Then
        assertThrows(AttributeNotFoundException.class, () -> catalog.obtain(SERVICE_UUID, CHARACTERISTIC_UUID, PROPERTY_READ));
        assertThrows(AttributeNotFoundException.class, () -> catalog.obtainDescriptor(OTHER_SERVICE_UUID, CHARACTERISTIC_UUID, DESCRIPTOR_UUID));
    }
}
