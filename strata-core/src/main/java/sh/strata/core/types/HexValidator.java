// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for fixed-length hex identifiers.
 *
 * <p>Used by {@link Hash} to validate its canonical, prefixed form.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Creates a pattern matching {@code 0x} followed by exactly {@code byteLength * 2} hex digits.
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a compiled pattern for the prefixed form
     */
    public static Pattern fixedLength(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + byteLength * 2 + "}$");
    }
}
