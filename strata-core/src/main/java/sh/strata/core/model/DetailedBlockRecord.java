// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A block summary together with its full extrinsic and event lists, both in on-chain order.
 *
 * <p>Built fresh for every detailed query; only {@link #basic()} is ever cached.
 *
 * @param basic      the block summary
 * @param extrinsics all extrinsics
 * @param events     all events, indexed block-wide
 */
public record DetailedBlockRecord(BlockRecord basic, List<ExtrinsicRecord> extrinsics, List<EventRecord> events) {

    public DetailedBlockRecord {
        Objects.requireNonNull(basic, "basic");
        extrinsics = List.copyOf(extrinsics);
        events = List.copyOf(events);
    }
}
