package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

/**
 * Builds byte arrays from unsigned integer values and formats byte arrays for logging.
 */
public class BluetoothBytesParser {

    public static final int FORMAT_UINT8 = 0x11;
    public static final int FORMAT_UINT16 = 0x12;
    public static final int FORMAT_UINT32 = 0x14;
    public static final int FORMAT_UINT64 = 0x18;

    @NotNull
    private final ByteOrder byteOrder;

    @NotNull
    private byte[] value = new byte[0];

    public BluetoothBytesParser() {
        this(LITTLE_ENDIAN);
    }

    public BluetoothBytesParser(@NotNull final ByteOrder byteOrder) {
        this.byteOrder = Objects.requireNonNull(byteOrder, "no valid byte order provided");
    }

    /**
     * Append an unsigned integer. Bits that do not fit the format are dropped.
     *
     * @param value      the value
     * @param formatType one of the FORMAT_UINT* constants
     * @return this parser
     */
    @NotNull
    public BluetoothBytesParser setIntValue(final long value, final int formatType) {
        final int length = getTypeLen(formatType);
        final byte[] result = Arrays.copyOf(this.value, this.value.length + length);
        for (int i = 0; i < length; i++) {
            final int shift = 8 * (byteOrder == LITTLE_ENDIAN ? i : length - 1 - i);
            result[this.value.length + i] = (byte) (value >>> shift);
        }
        this.value = result;
        return this;
    }

    @NotNull
    public byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    private static int getTypeLen(final int formatType) {
        switch (formatType) {
            case FORMAT_UINT8:
            case FORMAT_UINT16:
            case FORMAT_UINT32:
            case FORMAT_UINT64:
                return formatType & 0xF;
            default:
                throw new IllegalArgumentException(String.format("unsupported format type 0x%02X", formatType));
        }
    }

    /**
     * Convert a byte array to a hex string
     *
     * @param bytes the bytes to convert
     * @return String representing the byte array in hexadecimal
     */
    @NotNull
    public static String bytes2String(final byte[] bytes) {
        if (bytes == null) return "";
        final StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }
}
