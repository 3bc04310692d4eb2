// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.primitives.scale;

import java.util.Objects;

/**
 * SCALE compact ("general integer") codec for unsigned values up to {@link Long#MAX_VALUE}.
 *
 * <p>The two low bits of the first byte select the mode:
 * <ul>
 *   <li>{@code 0b00} single byte, values {@code 0..63}</li>
 *   <li>{@code 0b01} two bytes little-endian, values {@code 64..2^14-1}</li>
 *   <li>{@code 0b10} four bytes little-endian, values {@code 2^14..2^30-1}</li>
 *   <li>{@code 0b11} big-integer mode: the upper six bits hold {@code length - 4},
 *       followed by {@code length} little-endian bytes</li>
 * </ul>
 *
 * <p>Decoding is strict: non-canonical encodings (a value that would fit a smaller mode,
 * or trailing zero bytes in big-integer mode) are rejected, the same way the RLP decoder
 * rejects non-minimal lengths.
 *
 * @since 0.1.0
 */
public final class ScaleCompact {

    private static final long SINGLE_BYTE_MAX = (1L << 6) - 1;
    private static final long TWO_BYTE_MAX = (1L << 14) - 1;
    private static final long FOUR_BYTE_MAX = (1L << 30) - 1;

    private ScaleCompact() {
        // Utility class
    }

    /**
     * A decoded compact value and the number of bytes it occupied.
     *
     * @param value    the decoded unsigned value
     * @param consumed the encoded length in bytes
     */
    public record Decoded(long value, int consumed) {}

    /**
     * Decodes a compact integer that must span the whole input.
     *
     * @param encoded the encoded bytes
     * @return the decoded value
     * @throws IllegalArgumentException if the encoding is malformed, non-canonical, larger
     *                                  than {@link Long#MAX_VALUE}, or followed by trailing bytes
     */
    public static long decodeLong(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        final Decoded decoded = decode(encoded, 0);
        if (decoded.consumed() != encoded.length) {
            throw new IllegalArgumentException(
                    "compact integer has " + (encoded.length - decoded.consumed()) + " trailing bytes");
        }
        return decoded.value();
    }

    /**
     * Decodes one compact integer starting at {@code offset}.
     *
     * @param data   the buffer to read from
     * @param offset the index of the first byte
     * @return the decoded value and its encoded length
     * @throws IllegalArgumentException if the encoding is malformed or truncated
     */
    public static Decoded decode(final byte[] data, final int offset) {
        Objects.requireNonNull(data, "data cannot be null");
        if (offset < 0 || offset >= data.length) {
            throw new IllegalArgumentException("Invalid compact data: offset beyond end");
        }

        final int first = data[offset] & 0xFF;
        switch (first & 0b11) {
            case 0b00:
                return new Decoded(first >>> 2, 1);
            case 0b01: {
                final long value = readLittleEndian(data, offset, 2) >>> 2;
                if (value <= SINGLE_BYTE_MAX) {
                    throw new IllegalArgumentException("Non-canonical compact encoding: " + value);
                }
                return new Decoded(value, 2);
            }
            case 0b10: {
                final long value = readLittleEndian(data, offset, 4) >>> 2;
                if (value <= TWO_BYTE_MAX) {
                    throw new IllegalArgumentException("Non-canonical compact encoding: " + value);
                }
                return new Decoded(value, 4);
            }
            default:
                return decodeBigInteger(data, offset, (first >>> 2) + 4);
        }
    }

    /**
     * Encodes a non-negative value in its canonical compact form.
     *
     * @param value the value to encode
     * @return the encoded bytes
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static byte[] encodeLong(final long value) {
        if (value < 0L) {
            throw new IllegalArgumentException("compact encoding only supports non-negative values");
        }
        if (value <= SINGLE_BYTE_MAX) {
            return new byte[] {(byte) (value << 2)};
        }
        if (value <= TWO_BYTE_MAX) {
            return writeLittleEndian((value << 2) | 0b01, 2);
        }
        if (value <= FOUR_BYTE_MAX) {
            return writeLittleEndian((value << 2) | 0b10, 4);
        }

        final int length = minimalByteSize(value);
        final byte[] out = new byte[1 + length];
        out[0] = (byte) (((length - 4) << 2) | 0b11);
        long tmp = value;
        for (int i = 0; i < length; i++) {
            out[1 + i] = (byte) tmp;
            tmp >>>= 8;
        }
        return out;
    }

    private static Decoded decodeBigInteger(final byte[] data, final int offset, final int length) {
        if (length > Long.BYTES) {
            throw new IllegalArgumentException("compact integer of " + length + " bytes exceeds 64 bits");
        }
        if (offset + 1 + length > data.length) {
            throw new IllegalArgumentException("Invalid compact data: truncated big-integer payload");
        }
        if (data[offset + length] == 0) {
            throw new IllegalArgumentException("Non-canonical compact encoding: trailing zero byte");
        }

        long value = 0;
        for (int i = length - 1; i >= 0; i--) {
            value = (value << 8) | (data[offset + 1 + i] & 0xFFL);
        }
        if (value < 0) {
            throw new IllegalArgumentException("compact integer exceeds signed 64-bit range");
        }
        if (value <= FOUR_BYTE_MAX) {
            throw new IllegalArgumentException("Non-canonical compact encoding: " + value);
        }
        return new Decoded(value, 1 + length);
    }

    private static long readLittleEndian(final byte[] data, final int offset, final int size) {
        if (offset + size > data.length) {
            throw new IllegalArgumentException("Invalid compact data: expected " + size + " bytes");
        }
        long value = 0;
        for (int i = size - 1; i >= 0; i--) {
            value = (value << 8) | (data[offset + i] & 0xFFL);
        }
        return value;
    }

    private static byte[] writeLittleEndian(final long value, final int size) {
        final byte[] out = new byte[size];
        long tmp = value;
        for (int i = 0; i < size; i++) {
            out[i] = (byte) tmp;
            tmp >>>= 8;
        }
        return out;
    }

    private static int minimalByteSize(final long value) {
        return Long.BYTES - Long.numberOfLeadingZeros(value) / 8;
    }
}
