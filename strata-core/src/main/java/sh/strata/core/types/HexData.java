// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.types;

import java.util.Objects;
import java.util.regex.Pattern;

import sh.strata.primitives.Hex;

/**
 * Immutable variable-length byte data rendered as {@code 0x}-prefixed hex.
 * <p>
 * Used for signer account identifiers and raw extrinsic payloads, whose length
 * depends on the chain's address format.
 * <p>
 * Instances created from bytes defer hex generation until {@link #value()} is
 * first called.
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");
    public static final HexData EMPTY = new HexData(new byte[0]);

    private volatile String value;
    private final byte[] raw;

    /**
     * Creates a HexData from a hex string.
     *
     * @param value the hex-encoded string with "0x" prefix
     */
    public HexData(String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
        this.value = Hex.encode(raw);
    }

    private HexData(byte[] raw) {
        this.raw = raw;
        this.value = null;
    }

    /**
     * Returns the lowercase hex string with "0x" prefix.
     *
     * @return the hex string
     */
    public String value() {
        String v = value;
        if (v == null) {
            v = Hex.encode(raw);
            value = v;
        }
        return v;
    }

    public int byteLength() {
        return raw.length;
    }

    /**
     * Returns a copy of the raw bytes.
     *
     * @return the decoded byte array
     */
    public byte[] toBytes() {
        return raw.clone();
    }

    /**
     * Creates HexData from raw bytes, copying the input.
     *
     * @param bytes the byte array to wrap, or null/empty for {@link #EMPTY}
     * @return the wrapped data
     */
    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return java.util.Arrays.equals(raw, ((HexData) o).raw);
    }

    @Override
    public int hashCode() {
        return java.util.Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[" + "value=" + value() + ']';
    }
}
