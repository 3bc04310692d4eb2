// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.strata.primitives.Hex;

/**
 * Hex-encoded 32-byte identifier: block hashes, parent hashes, state and extrinsics
 * roots, extrinsic content hashes.
 * <p>
 * The canonical value is lowercase with a {@code 0x} prefix. The constructor only
 * accepts that form (after lowercasing); {@link #parse(String)} additionally accepts
 * input without the prefix. Surrounding whitespace is never accepted.
 * <p>
 * Serializes to and from a bare JSON string.
 *
 * @since 0.1.0
 */
public record Hash(@JsonValue String value) {
    public static final int BYTE_LENGTH = 32;

    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a 64-digit hex string, with or without {@code 0x} prefix.
     *
     * @param input the user-supplied hash
     * @return the canonical hash
     * @throws IllegalArgumentException if the input is null, contains anything but hex digits
     *                                  after the optional prefix, or is not 32 bytes
     */
    public static Hash parse(final String input) {
        final byte[] bytes;
        try {
            bytes = Hex.decodeFixed(input, BYTE_LENGTH);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Block hash must be " + BYTE_LENGTH + " bytes of hex: " + input, e);
        }
        return fromBytes(bytes);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    private static Hash fromJson(final String value) {
        return new Hash(value);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash(Hex.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
