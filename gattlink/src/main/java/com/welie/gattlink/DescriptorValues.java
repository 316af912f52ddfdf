package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import static com.welie.gattlink.BluetoothBytesParser.FORMAT_UINT16;
import static com.welie.gattlink.BluetoothBytesParser.FORMAT_UINT64;

/**
 * Turns the typed value a native stack reports for a descriptor read into raw bytes.
 */
public final class DescriptorValues {
    private static final String TAG = DescriptorValues.class.getSimpleName();
    private static final Logger logger = LoggerFactory.getLogger(TAG);

    public static final UUID CHARACTERISTIC_EXTENDED_PROPERTIES_UUID = UUID.fromString("00002900-0000-1000-8000-00805f9b34fb");
    public static final UUID CCC_DESCRIPTOR_UUID = UUID.fromString("00002902-0000-1000-8000-00805f9b34fb");
    public static final UUID SCC_DESCRIPTOR_UUID = UUID.fromString("00002903-0000-1000-8000-00805f9b34fb");
    public static final UUID L2CAP_PSM_CHARACTERISTIC_UUID = UUID.fromString("ABDD3056-28FA-441D-A470-55A75A52553A");

    // Numbers reported for these descriptors are 16-bit values
    private static final Set<UUID> UINT16_DESCRIPTORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            CHARACTERISTIC_EXTENDED_PROPERTIES_UUID,
            CCC_DESCRIPTOR_UUID,
            SCC_DESCRIPTOR_UUID,
            L2CAP_PSM_CHARACTERISTIC_UUID)));

    private DescriptorValues() {
    }

    /**
     * Normalize a descriptor value.
     *
     * <ul>
     *     <li>{@code byte[]} is returned as a copy</li>
     *     <li>{@link String} is encoded as UTF-8</li>
     *     <li>{@link Number} becomes 2 little-endian bytes for the 16-bit descriptors, 8 otherwise</li>
     *     <li>{@link Character}, the stack's unsigned 16-bit value, becomes 2 little-endian bytes</li>
     * </ul>
     * Anything else is logged and yields an empty array.
     *
     * @param descriptorUUID UUID of the descriptor that was read
     * @param value          value as reported by the native stack
     * @return the value as bytes, never null
     */
    @NotNull
    public static byte[] normalize(@NotNull final UUID descriptorUUID, @Nullable final Object value) {
        Objects.requireNonNull(descriptorUUID, "no valid descriptor UUID provided");

        if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        }
        if (value instanceof String) {
            return ((String) value).getBytes(StandardCharsets.UTF_8);
        }
        if (value instanceof Number) {
            final long number = ((Number) value).longValue();
            final int format = UINT16_DESCRIPTORS.contains(descriptorUUID) ? FORMAT_UINT16 : FORMAT_UINT64;
            return new BluetoothBytesParser().setIntValue(number, format).getValue();
        }
        if (value instanceof Character) {
            return new BluetoothBytesParser().setIntValue((Character) value, FORMAT_UINT16).getValue();
        }

        logger.warn(String.format("unknown value type '%s' for descriptor <%s>", value == null ? "null" : value.getClass().getSimpleName(), descriptorUUID));
        return new byte[0];
    }
}
