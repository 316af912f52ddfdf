package com.welie.gattlink;

import com.welie.gattlink.adapter.*;
import com.welie.gattlink.internal.EventStream;
import com.welie.gattlink.internal.StateSignal;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;
import java.util.concurrent.*;

import static com.welie.gattlink.BluetoothCommandStatus.*;
import static com.welie.gattlink.BluetoothGattCharacteristic.WriteType.WITHOUT_RESPONSE;
import static com.welie.gattlink.adapter.ResponseKind.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ConnectionTest {

    public static final int TIMEOUT_THRESHOLD = 500;

    private static final UUID DEVICE_ID = UUID.fromString("8b0c3c3e-5a36-4bc2-9a2e-2f6a3a1c0d11");
    private static final UUID SERVICE_UUID = UUID.fromString("6e400001-b5a3-f393-e0a9-e50e24dcca9e");
    private static final UUID CHARACTERISTIC_UUID = UUID.fromString("6e400002-b5a3-f393-e0a9-e50e24dcca9e");

    @Mock
    NativeAdapter adapter;

    private final EventStream<GattResponse> responses = new EventStream<>("responses");
    private final EventStream<CharacteristicChange> characteristicChanges = new EventStream<>("changes");
    private final StateSignal<Boolean> writeReadiness = new StateSignal<>(false);
    private final ExecutorService executor = Executors.newCachedThreadPool();

    private Connection connection;
    private FakeNativeAdapter.FakeCharacteristic characteristic;

    @BeforeEach
    void setUp() {
        connection = new Connection(DEVICE_ID, adapter, responses, characteristicChanges, writeReadiness);
        characteristic = new FakeNativeAdapter.FakeService(SERVICE_UUID).addCharacteristic(CHARACTERISTIC_UUID, "read", "write-without-response");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void Given_a_command_when_its_response_arrives_then_execute_returns_it() throws Exception {
        // Given
        doAnswer(invocation -> {
            responses.emit(GattResponse.rssiRead(DEVICE_ID, -42));
            return null;
        }).when(adapter).readRssi(DEVICE_ID);

        // When
        final GattResponse response = connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID));

        // Then
        assertEquals(-42, response.getRssi());
        assertEquals(0, connection.getPendingCount());
    }

    @Test
    void Given_a_command_when_a_response_of_another_kind_arrives_then_it_keeps_waiting() throws Exception {
        // Given
        final Future<GattResponse> result = executor.submit(() -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));
        verify(adapter, timeout(TIMEOUT_THRESHOLD)).readRssi(DEVICE_ID);

        // When
        responses.emit(GattResponse.success(DEVICE_ID, DESCRIPTOR_WRITTEN));
        Thread.sleep(50);
        assertFalse(result.isDone());
        responses.emit(GattResponse.rssiRead(DEVICE_ID, -70));

        // Then
        assertEquals(-70, result.get(1, TimeUnit.SECONDS).getRssi());
    }

    @Test
    void Given_a_command_when_the_response_has_an_error_status_then_GattOperationException_is_thrown() {
        // Given
        doAnswer(invocation -> {
            responses.emit(GattResponse.of(DEVICE_ID, RSSI_READ, UNLIKELY_ERROR));
            return null;
        }).when(adapter).readRssi(DEVICE_ID);

        // When
        final GattOperationException exception = assertThrows(GattOperationException.class, () -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));

        // Then
        assertEquals(UNLIKELY_ERROR, exception.getStatus());
        assertTrue(connection.isAlive());
    }

    @Test
    void Given_a_native_command_that_throws_when_executed_then_it_fails_with_operation_failed() {
        // Given
        doThrow(new IllegalStateException("stack gone")).when(adapter).readRssi(DEVICE_ID);

        // When
        final GattOperationException exception = assertThrows(GattOperationException.class, () -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));

        // Then
        assertEquals(OPERATION_FAILED, exception.getStatus());
        assertTrue(exception.getCause() instanceof IllegalStateException);
        assertEquals(0, responses.getSubscriberCount());
    }

    @Test
    void Given_waiting_commands_when_the_connection_fails_then_they_all_fail_with_the_first_failure() throws Exception {
        // Given
        final Future<GattResponse> result = executor.submit(() -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));
        verify(adapter, timeout(TIMEOUT_THRESHOLD)).readRssi(DEVICE_ID);
        final ConnectionLostException lost = new ConnectionLostException("lost", DisconnectReason.TIMEOUT);

        // When
        connection.fail(lost);
        connection.fail(new ConnectionLostException("later", DisconnectReason.FAILED));

        // Then
        final ExecutionException exception = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertSame(lost, exception.getCause());
        assertSame(lost, connection.getFailure());
        assertFalse(connection.isAlive());
    }

    @Test
    void Given_a_failed_connection_when_a_command_is_executed_then_nothing_is_issued() {
        // Given
        final ConnectionLostException lost = new ConnectionLostException("lost", null);
        connection.fail(lost);

        // When
        final GattException exception = assertThrows(GattException.class, () -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));

        // Then
        assertSame(lost, exception);
        verify(adapter, never()).readRssi(any());
    }

    @Test
    void Given_a_read_when_the_value_arrives_then_it_is_returned() throws Exception {
        // Given
        doAnswer(invocation -> {
            characteristicChanges.emit(CharacteristicChange.value(DEVICE_ID, characteristic, new byte[]{0x01, 0x02}));
            return null;
        }).when(adapter).read(DEVICE_ID, characteristic);

        // When
        final byte[] value = connection.readCharacteristic(characteristic);

        // Then
        assertArrayEquals(new byte[]{0x01, 0x02}, value);
    }

    @Test
    void Given_a_read_when_an_error_arrives_then_GattOperationException_is_thrown() {
        // Given
        doAnswer(invocation -> {
            characteristicChanges.emit(CharacteristicChange.error(DEVICE_ID, characteristic, READ_NOT_PERMITTED));
            return null;
        }).when(adapter).read(DEVICE_ID, characteristic);

        // When
        final GattOperationException exception = assertThrows(GattOperationException.class, () -> connection.readCharacteristic(characteristic));

        // Then
        assertEquals(READ_NOT_PERMITTED, exception.getStatus());
    }

    @Test
    void Given_a_transport_without_room_when_writing_without_response_then_the_write_waits_for_readiness() throws Exception {
        // Given
        when(adapter.canSendWriteWithoutResponse(DEVICE_ID)).thenReturn(false);
        final byte[] value = new byte[]{0x10};

        // When
        final Future<?> write = executor.submit(() -> {
            connection.writeWithoutResponse(characteristic, value);
            return null;
        });
        Thread.sleep(100);
        verify(adapter, never()).write(any(), any(NativeGattCharacteristic.class), any(), any());
        writeReadiness.setValue(true);

        // Then
        write.get(1, TimeUnit.SECONDS);
        verify(adapter).write(eq(DEVICE_ID), eq(characteristic), eq(value), eq(WITHOUT_RESPONSE));
    }

    @Test
    void Given_a_transport_with_room_when_writing_without_response_then_the_write_is_issued_at_once() throws Exception {
        // Given
        when(adapter.canSendWriteWithoutResponse(DEVICE_ID)).thenReturn(true);

        // When
        connection.writeWithoutResponse(characteristic, new byte[]{0x10});

        // Then
        verify(adapter).write(eq(DEVICE_ID), eq(characteristic), any(), eq(WITHOUT_RESPONSE));
        assertTrue(writeReadiness.getValue());
    }

    @Test
    void Given_a_waiting_write_when_the_connection_fails_then_the_write_fails() throws Exception {
        // Given
        when(adapter.canSendWriteWithoutResponse(DEVICE_ID)).thenReturn(false);
        final Future<?> write = executor.submit(() -> {
            connection.writeWithoutResponse(characteristic, new byte[]{0x10});
            return null;
        });
        Thread.sleep(100);

        // When
        connection.fail(new ConnectionLostException("lost", DisconnectReason.PERIPHERAL_DISCONNECTED));

        // Then
        final ExecutionException exception = assertThrows(ExecutionException.class, () -> write.get(1, TimeUnit.SECONDS));
        assertTrue(exception.getCause() instanceof ConnectionLostException);
        verify(adapter, never()).write(any(), any(NativeGattCharacteristic.class), any(), any());
    }

    @Test
    void Given_a_waiting_caller_when_it_is_interrupted_then_the_connection_stays_alive() throws Exception {
        // Given
        final Future<GattResponse> result = executor.submit(() -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));
        verify(adapter, timeout(TIMEOUT_THRESHOLD)).readRssi(DEVICE_ID);

        // When
        result.cancel(true);
        Thread.sleep(50);

        // Then
        assertTrue(connection.isAlive());
        assertEquals(0, connection.getPendingCount());
        assertEquals(1, responses.getSubscriberCount());
        responses.emit(GattResponse.rssiRead(DEVICE_ID, -10));
        assertEquals(0, responses.getSubscriberCount());
    }

    @Test
    void Given_an_abandoned_command_when_the_next_command_of_that_kind_runs_then_it_receives_its_own_response() throws Exception {
        // Given
        final Future<GattResponse> abandoned = executor.submit(() -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));
        verify(adapter, timeout(TIMEOUT_THRESHOLD)).readRssi(DEVICE_ID);
        abandoned.cancel(true);
        Thread.sleep(50);

        // When
        final Future<GattResponse> next = executor.submit(() -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));
        Thread.sleep(50);
        verify(adapter, times(1)).readRssi(DEVICE_ID);
        responses.emit(GattResponse.rssiRead(DEVICE_ID, -10));
        verify(adapter, timeout(TIMEOUT_THRESHOLD).times(2)).readRssi(DEVICE_ID);
        responses.emit(GattResponse.rssiRead(DEVICE_ID, -99));

        // Then
        assertEquals(-99, next.get(1, TimeUnit.SECONDS).getRssi());
        assertEquals(0, responses.getSubscriberCount());
    }

    @Test
    void Given_an_abandoned_command_when_the_connection_fails_then_the_next_command_fails_without_being_issued() throws Exception {
        // Given
        final Future<GattResponse> abandoned = executor.submit(() -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));
        verify(adapter, timeout(TIMEOUT_THRESHOLD)).readRssi(DEVICE_ID);
        abandoned.cancel(true);
        Thread.sleep(50);
        final Future<GattResponse> next = executor.submit(() -> connection.execute(RSSI_READ, () -> adapter.readRssi(DEVICE_ID)));
        Thread.sleep(50);

        // When
        final ConnectionLostException lost = new ConnectionLostException("lost", DisconnectReason.TIMEOUT);
        connection.fail(lost);

        // Then
        final ExecutionException exception = assertThrows(ExecutionException.class, () -> next.get(1, TimeUnit.SECONDS));
        assertSame(lost, exception.getCause());
        verify(adapter, times(1)).readRssi(DEVICE_ID);
        assertEquals(0, responses.getSubscriberCount());
    }
}
