// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * One event of a detailed block.
 *
 * @param index          position among all events of the block
 * @param extrinsicIndex the emitting extrinsic, or {@code null} for block-level events
 * @param pallet         the pallet that emitted the event
 * @param event          the event variant name
 */
public record EventRecord(int index, @Nullable Integer extrinsicIndex, String pallet, String event) {

    public EventRecord {
        Objects.requireNonNull(pallet, "pallet");
        Objects.requireNonNull(event, "event");
    }
}
