// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.OptionalLong;

import org.junit.jupiter.api.Test;

import sh.strata.primitives.scale.ScaleCompact;

class InherentTimestampExtractorTest {

    private final InherentTimestampExtractor extractor = new InherentTimestampExtractor();

    private static ExtrinsicHandle call(int index, String pallet, String call, byte[] args) {
        return new TestChain.Extrinsic(index, new byte[] {(byte) index}, false, null, pallet, call, args);
    }

    @Test
    void decodesMillisecondsAndTruncatesToSeconds() {
        List<ExtrinsicHandle> extrinsics = List.of(
                call(0, "Timestamp", "set", ScaleCompact.encodeLong(1_704_067_200_999L)));

        assertEquals(OptionalLong.of(1_704_067_200L), extractor.extractSeconds(extrinsics));
    }

    @Test
    void findsInherentAfterOtherExtrinsics() {
        List<ExtrinsicHandle> extrinsics = List.of(
                call(0, "ParachainSystem", "set_validation_data", new byte[] {0x01}),
                call(1, "Timestamp", "set", ScaleCompact.encodeLong(6_000L)));

        assertEquals(OptionalLong.of(6L), extractor.extractSeconds(extrinsics));
    }

    @Test
    void otherCallsOfTimestampPalletAreIgnored() {
        List<ExtrinsicHandle> extrinsics = List.of(
                call(0, "Timestamp", "other", ScaleCompact.encodeLong(6_000L)));

        assertTrue(extractor.extractSeconds(extrinsics).isEmpty());
    }

    @Test
    void undecodableArgumentIsSkipped() {
        List<ExtrinsicHandle> extrinsics = List.of(
                call(0, "Timestamp", "set", new byte[] {0x01}),
                call(1, "Timestamp", "set", ScaleCompact.encodeLong(12_000L)));

        assertEquals(OptionalLong.of(12L), extractor.extractSeconds(extrinsics));
    }

    @Test
    void emptyBlockHasNoTimestamp() {
        assertTrue(extractor.extractSeconds(List.of()).isEmpty());
        assertTrue(extractor.extractSeconds(List.of(call(0, "Timestamp", "set", new byte[0]))).isEmpty());
    }
}
