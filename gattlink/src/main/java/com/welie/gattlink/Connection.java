package com.welie.gattlink;

import com.welie.gattlink.adapter.CharacteristicChange;
import com.welie.gattlink.adapter.GattResponse;
import com.welie.gattlink.adapter.NativeAdapter;
import com.welie.gattlink.adapter.NativeGattCharacteristic;
import com.welie.gattlink.adapter.ResponseKind;
import com.welie.gattlink.internal.EventStream;
import com.welie.gattlink.internal.StateSignal;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import static com.welie.gattlink.BluetoothBytesParser.bytes2String;
import static com.welie.gattlink.BluetoothCommandStatus.OPERATION_FAILED;
import static com.welie.gattlink.BluetoothGattCharacteristic.WriteType.WITHOUT_RESPONSE;

/**
 * One connect attempt's native session.
 *
 * <p>Commands are issued one at a time: a caller holds the guard from issuing a command until its response arrived, so
 * a response of a given kind always belongs to the only command of that kind in flight. A caller that stops waiting
 * leaves its response outstanding, and the next command is only issued once that response arrived and was discarded.
 * Once the link fails, every pending and future wait fails with the same exception.
 */
final class Connection {
    private static final String TAG = Connection.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    @NotNull
    private final UUID deviceId;

    @NotNull
    private final NativeAdapter adapter;

    @NotNull
    private final EventStream<GattResponse> responses;

    @NotNull
    private final EventStream<CharacteristicChange> characteristicChanges;

    @NotNull
    private final StateSignal<Boolean> writeReadiness;

    private final ReentrantLock guard = new ReentrantLock(true);

    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();

    // Written under guard
    @Nullable
    private volatile CompletableFuture<?> outstanding;

    @Nullable
    private volatile GattException failure;

    private volatile boolean established = false;

    Connection(@NotNull final UUID deviceId,
               @NotNull final NativeAdapter adapter,
               @NotNull final EventStream<GattResponse> responses,
               @NotNull final EventStream<CharacteristicChange> characteristicChanges,
               @NotNull final StateSignal<Boolean> writeReadiness) {
        this.deviceId = Objects.requireNonNull(deviceId, "no valid device id provided");
        this.adapter = Objects.requireNonNull(adapter, "no valid adapter provided");
        this.responses = Objects.requireNonNull(responses, "no valid response stream provided");
        this.characteristicChanges = Objects.requireNonNull(characteristicChanges, "no valid characteristic stream provided");
        this.writeReadiness = Objects.requireNonNull(writeReadiness, "no valid readiness signal provided");
    }

    @NotNull
    UUID getDeviceId() {
        return deviceId;
    }

    /**
     * Issue a command and wait for the next response of the given kind.
     *
     * @param kind    the kind of response the command produces
     * @param command issues the native command
     * @return the successful response
     * @throws GattOperationException if the response carries an error status or the command threw
     * @throws ConnectionLostException if the link dropped while waiting
     */
    @NotNull
    GattResponse execute(@NotNull final ResponseKind kind, @NotNull final Runnable command) throws GattException, InterruptedException {
        Objects.requireNonNull(kind, "no valid response kind provided");
        Objects.requireNonNull(command, "no valid command provided");

        guard.lockInterruptibly();
        try {
            checkAlive();
            discardOutstanding();
            final CompletableFuture<GattResponse> response = responses.first(r -> r.getKind() == kind);
            outstanding = response;
            issue(kind.toString(), command, response);
            final GattResponse result = await(response, false);
            if (!result.isSuccess()) {
                throw new GattOperationException(kind.toString(), result.getStatus());
            }
            return result;
        } finally {
            guard.unlock();
        }
    }

    @NotNull
    byte[] readCharacteristic(@NotNull final NativeGattCharacteristic characteristic) throws GattException, InterruptedException {
        Objects.requireNonNull(characteristic, "no valid characteristic provided");
        final UUID serviceUUID = characteristic.getService().getUuid();
        final UUID characteristicUUID = characteristic.getUuid();

        guard.lockInterruptibly();
        try {
            checkAlive();
            discardOutstanding();
            final CompletableFuture<CharacteristicChange> change = characteristicChanges.first(c -> c.isFor(serviceUUID, characteristicUUID));
            outstanding = change;
            issue("read " + characteristicUUID, () -> adapter.read(deviceId, characteristic), change);
            final CharacteristicChange result = await(change, false);
            if (!result.isSuccess()) {
                throw new GattOperationException("read " + characteristicUUID, result.getStatus());
            }
            // Observers of the characteristic get the same change
            return result.getValue().clone();
        } finally {
            guard.unlock();
        }
    }

    /**
     * Write without response once the transport has room for it. There is no completion for this kind of write.
     */
    void writeWithoutResponse(@NotNull final NativeGattCharacteristic characteristic, @NotNull final byte[] value) throws GattException, InterruptedException {
        Objects.requireNonNull(characteristic, "no valid characteristic provided");
        Objects.requireNonNull(value, "no valid value provided");

        guard.lockInterruptibly();
        try {
            checkAlive();
            final boolean ready = writeReadiness.updateAndGet(current -> adapter.canSendWriteWithoutResponse(deviceId));
            if (!ready) {
                logger.debug(String.format("waiting for room to write without response to <%s>", characteristic.getUuid()));
                await(writeReadiness.first(Boolean::booleanValue));
            }
            logger.info(String.format("writing %s <%s> to characteristic <%s>", WITHOUT_RESPONSE, bytes2String(value), characteristic.getUuid()));
            issue("write " + characteristic.getUuid(), () -> adapter.write(deviceId, characteristic, value, WITHOUT_RESPONSE), null);
        } finally {
            guard.unlock();
        }
    }

    /**
     * Wait for the response of a command whose caller stopped waiting. Its result is dropped.
     */
    private void discardOutstanding() throws GattException, InterruptedException {
        final CompletableFuture<?> previous = outstanding;
        if (previous == null || previous.isDone()) return;

        logger.debug("waiting for the response of an abandoned command");
        await(previous, false);
        outstanding = null;
    }

    private void issue(@NotNull final String description, @NotNull final Runnable command, @Nullable final CompletableFuture<?> result) throws GattOperationException {
        try {
            command.run();
        } catch (RuntimeException e) {
            logger.error(String.format("native command '%s' failed", description), e);
            if (result != null) {
                result.cancel(false);
            }
            throw new GattOperationException(description, OPERATION_FAILED, e);
        }
    }

    /**
     * Wait for a future, failing early when the link fails. Interrupting the caller abandons the wait but leaves the
     * native command running.
     */
    <T> T await(@NotNull final CompletableFuture<T> future) throws GattException, InterruptedException {
        return await(future, true);
    }

    private <T> T await(@NotNull final CompletableFuture<T> future, final boolean cancelOnInterrupt) throws GattException, InterruptedException {
        pending.add(future);
        try {
            final GattException cause = failure;
            if (cause != null) {
                future.cancel(false);
                throw cause;
            }
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GattException) {
                throw (GattException) e.getCause();
            }
            throw new GattOperationException("waiting for response", OPERATION_FAILED, e.getCause());
        } catch (InterruptedException e) {
            if (cancelOnInterrupt) {
                future.cancel(false);
            }
            throw e;
        } catch (CancellationException e) {
            final GattException cause = failure;
            if (cause != null) throw cause;
            throw e;
        } finally {
            pending.remove(future);
        }
    }

    /**
     * Mark the connection as failed and wake up every waiter. Only the first failure is kept.
     */
    void fail(@NotNull final GattException cause) {
        Objects.requireNonNull(cause, "no valid cause provided");

        synchronized (this) {
            if (failure == null) {
                failure = cause;
            }
        }
        final GattException kept = failure;
        pending.forEach(future -> future.completeExceptionally(kept));
        final CompletableFuture<?> previous = outstanding;
        if (previous != null) {
            previous.completeExceptionally(kept);
        }
    }

    void checkAlive() throws GattException {
        final GattException cause = failure;
        if (cause != null) {
            throw cause;
        }
    }

    boolean isAlive() {
        return failure == null;
    }

    @Nullable
    GattException getFailure() {
        return failure;
    }

    void markEstablished() {
        established = true;
    }

    boolean isEstablished() {
        return established;
    }

    int getPendingCount() {
        return pending.size();
    }
}
