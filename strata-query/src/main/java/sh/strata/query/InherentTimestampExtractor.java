// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import java.util.List;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.strata.primitives.scale.ScaleCompact;

/**
 * Reads the {@code Timestamp.set} inherent, whose single argument is the block time in
 * milliseconds as a SCALE compact {@code u64}.
 *
 * <p>
 * An inherent whose argument does not decode is skipped, so a later well-formed one still
 * wins; if none decodes the result is empty.
 */
public final class InherentTimestampExtractor implements TimestampExtractor {

    private static final Logger log = LoggerFactory.getLogger(InherentTimestampExtractor.class);

    static final String TIMESTAMP_PALLET = "Timestamp";
    static final String SET_CALL = "set";

    @Override
    public OptionalLong extractSeconds(List<ExtrinsicHandle> extrinsics) {
        for (ExtrinsicHandle extrinsic : extrinsics) {
            if (!TIMESTAMP_PALLET.equals(extrinsic.palletName()) || !SET_CALL.equals(extrinsic.callName())) {
                continue;
            }
            try {
                long millis = ScaleCompact.decodeLong(extrinsic.callArguments());
                return OptionalLong.of(millis / 1000);
            } catch (IllegalArgumentException e) {
                log.debug("Undecodable Timestamp.set argument in extrinsic {}: {}", extrinsic.index(), e.getMessage());
            }
        }
        return OptionalLong.empty();
    }
}
