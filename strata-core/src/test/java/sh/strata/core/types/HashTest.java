// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HashTest {

    private static final String DIGITS = "1234567890abcdef1234567890abcdef1234567890abcdef1234567890abcdef";

    @Test
    void accepts32ByteHex() {
        Hash hash = new Hash("0x" + DIGITS);
        assertEquals(32, hash.toBytes().length);
    }

    @Test
    void normalizesToLowercase() {
        Hash hash = new Hash("0x" + DIGITS.toUpperCase());
        assertEquals("0x" + DIGITS, hash.value());
    }

    @Test
    void constructorRequiresPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new Hash(DIGITS));
    }

    @Test
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new Hash("0x1234"));
    }

    @Test
    void parseAcceptsPrefixedAndBareForms() {
        Hash prefixed = Hash.parse("0x" + DIGITS);
        Hash bare = Hash.parse(DIGITS);
        Hash upperPrefix = Hash.parse("0X" + DIGITS);

        assertEquals(prefixed, bare);
        assertEquals(prefixed, upperPrefix);
        assertEquals("0x" + DIGITS, bare.value());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "0x",
        "not_a_valid_hash",
        "0x1234",
        "1234567890abcdef1234567890abcdef1234567890abcdef1234567890abcde",
        "1234567890abcdef1234567890abcdef1234567890abcdef1234567890abcdef00",
        "0xzz34567890abcdef1234567890abcdef1234567890abcdef1234567890abcdef",
        "0x0x34567890abcdef1234567890abcdef1234567890abcdef1234567890abcdef"
    })
    void parseRejectsMalformedInput(String input) {
        assertThrows(IllegalArgumentException.class, () -> Hash.parse(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {" ", "\n", "\t", "\r\n"})
    void parseRejectsSurroundingWhitespace(String padding) {
        assertThrows(IllegalArgumentException.class, () -> Hash.parse(padding + "0x" + DIGITS));
        assertThrows(IllegalArgumentException.class, () -> Hash.parse("0x" + DIGITS + padding));
        assertThrows(IllegalArgumentException.class, () -> Hash.parse(padding + DIGITS + padding));
    }

    @Test
    void parseRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> Hash.parse(null));
    }

    @Test
    void fromBytesRequires32() {
        assertThrows(IllegalArgumentException.class, () -> Hash.fromBytes(new byte[10]));
    }

    @Test
    void roundTripBytes() {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte) 0xAB);
        Hash hash = Hash.fromBytes(bytes);
        assertArrayEquals(bytes, hash.toBytes());
    }
}
