// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import java.util.List;
import java.util.OptionalLong;

/**
 * Reads the block time out of a block's extrinsics.
 */
@FunctionalInterface
public interface TimestampExtractor {

    /**
     * Extracts the block time.
     *
     * @param extrinsics the block's extrinsics in on-chain order
     * @return seconds since the epoch, or empty when no timestamp could be decoded
     */
    OptionalLong extractSeconds(List<ExtrinsicHandle> extrinsics);
}
