// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.codec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import sh.strata.core.types.Hash;

/**
 * Wire shape of a {@link sh.strata.core.model.BlockRecord}.
 *
 * <p>All components are boxed so a field missing from older payloads arrives as
 * {@code null} and can be defaulted by the codec. Hashes bind through {@link Hash}'s own
 * JSON string form, so a malformed hash fails inside the mapper.
 */
record BlockRecordJson(
        @JsonProperty("number") @Nullable Long number,
        @JsonProperty("hash") @Nullable Hash hash,
        @JsonProperty("parent_hash") @Nullable Hash parentHash,
        @JsonProperty("timestamp") @Nullable Long timestamp,
        @JsonProperty("transactions") @Nullable List<Hash> transactions,
        @JsonProperty("state_root") @Nullable Hash stateRoot,
        @JsonProperty("extrinsics_root") @Nullable Hash extrinsicsRoot,
        @JsonProperty("extrinsic_count") @Nullable Integer extrinsicCount,
        @JsonProperty("event_count") @Nullable Integer eventCount,
        @JsonProperty("is_finalized") @Nullable Boolean finalized) {}
